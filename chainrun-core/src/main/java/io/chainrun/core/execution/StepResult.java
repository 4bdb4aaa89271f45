package io.chainrun.core.execution;

import io.chainrun.core.operation.InvocationOutcome;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Record of one attempt of one step. Never mutated after creation; a retried step
/// produces one result per attempt.
///
/// ### Contracts
/// - **Precondition**: `stepId`, `operationName`, `status` must not be null
/// - `output` is set for successes, `error` for failures
///
/// @param stepId        step name or `step_<index>`, not null
/// @param stepIndex     zero-based position of the step
/// @param operationName operation that was invoked, not null
/// @param attempt       1-based attempt number within the step execution
/// @param status        attempt outcome, not null
/// @param output        result fields on success, empty on failure
/// @param error         failure message, null on success
/// @param errorType     failure type, null on success
/// @param errorCode     structured failure code, may be null
/// @param startedAt     when the attempt started, not null
/// @param duration      attempt wall time, not null
public record StepResult(
        String stepId,
        int stepIndex,
        String operationName,
        int attempt,
        StepStatus status,
        Map<String, Object> output,
        String error,
        String errorType,
        String errorCode,
        Instant startedAt,
        Duration duration) {

    public StepResult {
        Objects.requireNonNull(stepId, "stepId must not be null");
        Objects.requireNonNull(operationName, "operationName must not be null");
        Objects.requireNonNull(status, "status must not be null");
        output =
                output != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(output))
                        : Map.of();
        startedAt = startedAt != null ? startedAt : Instant.now();
        duration = duration != null ? duration : Duration.ZERO;
    }

    /// Creates the record of an attempt from its invocation outcome.
    ///
    /// @param stepId        step identity, not null
    /// @param stepIndex     step position
    /// @param operationName invoked operation, not null
    /// @param attempt       1-based attempt
    /// @param outcome       invocation outcome, not null
    /// @param startedAt     attempt start, not null
    /// @param duration      attempt wall time, not null
    /// @return new result, never null
    public static StepResult of(
            String stepId,
            int stepIndex,
            String operationName,
            int attempt,
            InvocationOutcome outcome,
            Instant startedAt,
            Duration duration) {
        if (outcome instanceof InvocationOutcome.Success success) {
            return new StepResult(
                    stepId, stepIndex, operationName, attempt, StepStatus.SUCCESS,
                    success.output(), null, null, null, startedAt, duration);
        }
        InvocationOutcome.Failure failure = (InvocationOutcome.Failure) outcome;
        return new StepResult(
                stepId, stepIndex, operationName, attempt, StepStatus.FAILURE,
                Map.of(), failure.error(), failure.errorType(), failure.errorCode(),
                startedAt, duration);
    }

    public boolean isSuccess() {
        return status == StepStatus.SUCCESS;
    }

    public boolean isFailure() {
        return status == StepStatus.FAILURE;
    }

    /// Returns a one-line description used in audit events.
    public String summary() {
        if (isSuccess()) {
            return output.isEmpty() ? "ok" : "ok " + output.keySet();
        }
        return errorCode != null ? "[" + errorCode + "] " + error : error;
    }
}
