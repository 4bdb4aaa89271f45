package io.chainrun.serialization.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.chainrun.core.execution.ChainEvent;
import io.chainrun.core.execution.ChainObserver;
import io.chainrun.serialization.ChainSerializer;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/// Observer that appends one JSON object per completed step attempt to a writer.
///
/// Each line carries `chain_id`, `step_id`, `attempt`, `status`, `duration_ms`, `summary`
/// and `timestamp`. Other events are ignored.
///
/// ### Contracts
/// - **Thread-safe**: parallel steps report from worker threads; lines never interleave
/// - **Flushes per line**, so the file is readable while a chain is still running
/// - Write failures surface as `UncheckedIOException`, which the executor logs and
///   ignores like any other observer failure
///
/// @see ChainObserver
public final class JsonLinesAuditSink implements ChainObserver, Closeable {

    private final Writer writer;
    private final ObjectMapper mapper;

    public JsonLinesAuditSink(Writer writer) {
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
        this.mapper = ChainSerializer.createMapper().disable(SerializationFeature.INDENT_OUTPUT);
    }

    /// Opens `file` for appending, creating it when absent.
    ///
    /// @param file audit file, not null
    /// @return sink writing to the file, never null
    /// @throws IOException if the file cannot be opened
    public static JsonLinesAuditSink appendingTo(Path file) throws IOException {
        Objects.requireNonNull(file, "file must not be null");
        return new JsonLinesAuditSink(
                Files.newBufferedWriter(
                        file,
                        StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.APPEND));
    }

    @Override
    public void onEvent(ChainEvent event) {
        if (!(event instanceof ChainEvent.StepCompleted)) {
            return;
        }
        String line = toLine((ChainEvent.StepCompleted) event);
        synchronized (writer) {
            try {
                writer.write(line);
                writer.write('\n');
                writer.flush();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write audit record", e);
            }
        }
    }

    private String toLine(ChainEvent.StepCompleted event) {
        ObjectNode node = mapper.createObjectNode();
        node.put("chain_id", event.chainId());
        node.put("step_id", event.stepId());
        node.put("attempt", event.attempt());
        node.put("status", event.status().name());
        node.put("duration_ms", event.duration().toMillis());
        node.put("summary", event.summary());
        node.put("timestamp", event.timestamp().toString());
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode audit record", e);
        }
    }

    @Override
    public void close() throws IOException {
        synchronized (writer) {
            writer.close();
        }
    }
}
