package io.chainrun.core.execution;

import io.chainrun.core.chain.ExecutionMode;
import io.chainrun.core.state.StateWrite;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Complete outcome of one chain run, returned even when the chain fails.
///
/// ### Counting
/// - `stepsExecuted` counts step executions; all attempts of one execution count once,
///   a revisit through a jump counts again
/// - `stepsSucceeded` and `stepsFailed` count executions by their final outcome
/// - `history` holds one {@link StepResult} per attempt, in execution order (step order in
///   parallel mode)
///
/// @param chainId        unique id of this run, not null
/// @param chainName      chain name, may be null
/// @param mode           mode the chain ran in, not null
/// @param status         aggregate status, not null
/// @param stepsExecuted  number of step executions
/// @param stepsSucceeded executions whose final attempt succeeded
/// @param stepsFailed    executions whose final attempt failed
/// @param history        every attempt, not null
/// @param finalState     snapshot of chain state data, not null
/// @param engineMetadata snapshot of engine bookkeeping such as retry counters, not null
/// @param stateWrites    log of output-mapping writes, not null
/// @param error          reason the chain stopped or first bypassed failure, may be null
/// @param cancelled      whether the run was interrupted
/// @param startedAt      run start, not null
/// @param completedAt    run end, not null
public record ChainResult(
        String chainId,
        String chainName,
        ExecutionMode mode,
        ChainStatus status,
        int stepsExecuted,
        int stepsSucceeded,
        int stepsFailed,
        List<StepResult> history,
        Map<String, Object> finalState,
        Map<String, Object> engineMetadata,
        List<StateWrite> stateWrites,
        String error,
        boolean cancelled,
        Instant startedAt,
        Instant completedAt) {

    public ChainResult {
        Objects.requireNonNull(chainId, "chainId must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(status, "status must not be null");
        history = history != null ? List.copyOf(history) : List.of();
        finalState = finalState != null ? finalState : Map.of();
        engineMetadata = engineMetadata != null ? engineMetadata : Map.of();
        stateWrites = stateWrites != null ? List.copyOf(stateWrites) : List.of();
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        completedAt = completedAt != null ? completedAt : startedAt;
    }

    public boolean isCompleted() {
        return status == ChainStatus.COMPLETED;
    }

    public boolean isFailed() {
        return status == ChainStatus.FAILED;
    }

    public Duration duration() {
        return Duration.between(startedAt, completedAt);
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }

    /// Returns all attempts of the given step, in order.
    public List<StepResult> attemptsOf(String stepId) {
        return history.stream().filter(r -> r.stepId().equals(stepId)).toList();
    }
}
