package io.chainrun.core.state;

import java.util.Objects;

/// Record of one output-mapping write into chain state.
///
/// @param stepId  identity of the writing step, not null
/// @param attempt 1-based attempt of the step that produced the value
/// @param key     state key written, not null
public record StateWrite(String stepId, int attempt, String key) {

    public StateWrite {
        Objects.requireNonNull(stepId, "stepId must not be null");
        Objects.requireNonNull(key, "key must not be null");
    }
}
