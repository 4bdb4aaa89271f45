package io.chainrun.core.operation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Result of invoking one operation once.
///
/// @see OperationInvoker for how exceptions map to {@link Failure}
public sealed interface InvocationOutcome {

    boolean isSuccess();

    /// The operation returned normally.
    ///
    /// @param output result fields, not null (may be empty); null values are kept
    record Success(Map<String, Object> output) implements InvocationOutcome {

        public Success {
            output =
                    output != null
                            ? Collections.unmodifiableMap(new LinkedHashMap<>(output))
                            : Map.of();
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /// The operation failed, or could not be invoked.
    ///
    /// @param error              human-readable message, not null
    /// @param errorType          exception class simple name or a configuration error tag
    /// @param errorCode          structured code from {@link OperationException}, may be null
    /// @param configurationError true when the operation was unknown or disabled; such failures
    ///                           always stop the chain
    record Failure(String error, String errorType, String errorCode, boolean configurationError)
            implements InvocationOutcome {

        public Failure {
            Objects.requireNonNull(error, "error must not be null");
            Objects.requireNonNull(errorType, "errorType must not be null");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }

    static InvocationOutcome success(Map<String, Object> output) {
        return new Success(output);
    }

    static InvocationOutcome failure(String error, String errorType) {
        return new Failure(error, errorType, null, false);
    }
}
