package io.chainrun.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.chainrun.core.chain.ChainDefinition;
import io.chainrun.core.execution.ChainResult;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// Utility class for reading and writing chain definitions and results as JSON.
///
/// ### Usage
/// {@snippet :
/// ChainDefinition chain = ChainSerializer.loadFromFile(Path.of("chains/triage.json"));
/// ChainResult result = engine.execute(chain, Map.of("search_query", "invoices"));
/// System.out.println(ChainSerializer.resultToJson(result));
/// }
///
/// A chain file without a `name` takes the file name without its `.json` extension.
///
/// @implNote Thread-safe. The internal ObjectMapper is created per call via
/// `createMapper()`. For high-throughput scenarios, cache the mapper.
///
/// @see ChainJacksonModule for the registered type handlers
public final class ChainSerializer {

    private static final String JSON_EXTENSION = ".json";

    private ChainSerializer() {}

    /// Serializes a chain definition to pretty-printed JSON in the authoring format.
    ///
    /// @param chain the chain to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(ChainDefinition chain) {
        Objects.requireNonNull(chain, "chain must not be null");
        try {
            return createMapper().writeValueAsString(chain);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize chain: " + e.getMessage(), e);
        }
    }

    /// Deserializes a chain definition from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized chain, never null
    /// @throws IllegalArgumentException if the JSON is malformed or not a chain
    public static ChainDefinition fromJson(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return createMapper().readValue(json, ChainDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize chain: " + e.getOriginalMessage(), e);
        }
    }

    /// Serializes a chain result, including its full history, to pretty-printed JSON.
    ///
    /// @param result the result to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String resultToJson(ChainResult result) {
        Objects.requireNonNull(result, "result must not be null");
        try {
            return createMapper().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize chain result: " + e.getMessage(), e);
        }
    }

    /// Reads one chain definition file.
    ///
    /// @param file JSON file, not null
    /// @return the chain, named after the file when it declares no name
    /// @throws UncheckedIOException if the file cannot be read
    /// @throws IllegalArgumentException if the content is not a chain
    public static ChainDefinition loadFromFile(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read chain file: " + file, e);
        }
        ChainDefinition chain;
        try {
            chain = fromJson(json);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(file + ": " + e.getMessage(), e);
        }
        if (chain.name() == null || chain.name().isBlank()) {
            return chain.withName(baseName(file));
        }
        return chain;
    }

    /// Reads every `*.json` file directly under a directory, sorted by file name.
    ///
    /// @param directory directory to scan, not null
    /// @return chains in file name order, never null
    /// @throws UncheckedIOException if the directory cannot be listed or a file read
    /// @throws IllegalArgumentException if a file is not a chain
    public static List<ChainDefinition> loadFromDirectory(Path directory) {
        Objects.requireNonNull(directory, "directory must not be null");
        List<Path> files;
        try (Stream<Path> entries = Files.list(directory)) {
            files =
                    entries.filter(Files::isRegularFile)
                            .filter(p -> p.getFileName().toString().endsWith(JSON_EXTENSION))
                            .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                            .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list chain directory: " + directory, e);
        }
        List<ChainDefinition> chains = new ArrayList<>(files.size());
        for (Path file : files) {
            chains.add(loadFromFile(file));
        }
        return chains;
    }

    /// Creates an ObjectMapper configured for chain serialization.
    ///
    /// Registers:
    /// - `ChainJacksonModule` for the chain model and result records
    /// - `JavaTimeModule` for `Duration` and `Instant` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new ChainJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private static String baseName(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(JSON_EXTENSION)
                ? name.substring(0, name.length() - JSON_EXTENSION.length())
                : name;
    }
}
