package io.chainrun.core.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Mutable key-value store threaded through one chain run.
///
/// Holds two maps:
/// - **data**: seeded from the initial parameters; output mappings write here and step
///   inputs read from here
/// - **metadata**: engine bookkeeping such as `<stepId>_retry_count`, never visible to
///   input resolution
///
/// Every data write made by an output mapping is appended to a write log. Later writes to
/// the same key overwrite earlier ones; collisions are not validated.
///
/// ### Thread Safety
/// @implNote Not thread-safe. Owned by the executing thread; parallel tasks read from a
/// {@link #snapshot()} instead.
public final class ChainState {

    /// Suffix of the retry counter key kept per step in metadata.
    public static final String RETRY_COUNT_SUFFIX = "_retry_count";

    private final Map<String, Object> data;
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private final List<StateWrite> writes = new ArrayList<>();

    /// Creates a state seeded with the given parameters.
    ///
    /// @param initial initial parameters, not null; null values are kept
    public ChainState(Map<String, Object> initial) {
        Objects.requireNonNull(initial, "initial must not be null");
        this.data = new LinkedHashMap<>(initial);
    }

    public static ChainState empty() {
        return new ChainState(Map.of());
    }

    public boolean contains(String key) {
        return data.containsKey(key);
    }

    /// Returns the value for `key`, or {@link Undefined#VALUE} when the key is absent.
    public Object lookup(String key) {
        if (!data.containsKey(key)) {
            return Undefined.VALUE;
        }
        return data.get(key);
    }

    /// Returns a read-only live view of the data map.
    public Map<String, Object> view() {
        return Collections.unmodifiableMap(data);
    }

    /// Returns an immutable copy of the data map that keeps null values.
    public Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /// Applies output-mapping writes in iteration order and logs them.
    ///
    /// @param stepId  writing step, not null
    /// @param attempt attempt that produced the values
    /// @param values  state key to value, not null
    public void apply(String stepId, int attempt, Map<String, Object> values) {
        Objects.requireNonNull(stepId, "stepId must not be null");
        Objects.requireNonNull(values, "values must not be null");
        values.forEach(
                (key, value) -> {
                    data.put(key, value);
                    writes.add(new StateWrite(stepId, attempt, key));
                });
    }

    /// Returns the number of retries recorded for the step.
    public int retryCount(String stepId) {
        Object count = metadata.get(stepId + RETRY_COUNT_SUFFIX);
        return count instanceof Integer value ? value : 0;
    }

    /// Records the retry count the step reached in its latest execution.
    public void recordRetries(String stepId, int retries) {
        metadata.put(stepId + RETRY_COUNT_SUFFIX, retries);
    }

    /// Returns an immutable copy of the engine metadata.
    public Map<String, Object> metadataSnapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public List<StateWrite> writes() {
        return List.copyOf(writes);
    }
}
