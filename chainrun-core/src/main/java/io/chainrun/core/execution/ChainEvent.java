package io.chainrun.core.execution;

import io.chainrun.core.chain.ExecutionMode;
import java.time.Duration;
import java.time.Instant;

/// Events emitted during chain execution for audit and progress reporting.
///
/// ### Event Flow
/// ```
/// ChainStarted → StepStarted → StepCompleted → (retry: StepStarted → ...) → ChainCompleted
/// ```
///
/// One `StepStarted`/`StepCompleted` pair is emitted per attempt.
///
/// @see ChainObserver for event consumers
public sealed interface ChainEvent {

    /// Returns the id of the run.
    String chainId();

    /// Returns when the event occurred.
    Instant timestamp();

    /// @param chainId   run id
    /// @param chainName chain name, may be null
    /// @param mode      execution mode
    /// @param stepCount number of declared steps
    /// @param timestamp when the run started
    record ChainStarted(
            String chainId, String chainName, ExecutionMode mode, int stepCount, Instant timestamp)
            implements ChainEvent {

        public static ChainStarted now(
                String chainId, String chainName, ExecutionMode mode, int stepCount) {
            return new ChainStarted(chainId, chainName, mode, stepCount, Instant.now());
        }
    }

    /// @param chainId       run id
    /// @param stepId        step identity
    /// @param operationName operation about to be invoked
    /// @param attempt       1-based attempt
    /// @param timestamp     when the attempt started
    record StepStarted(
            String chainId, String stepId, String operationName, int attempt, Instant timestamp)
            implements ChainEvent {

        public static StepStarted now(
                String chainId, String stepId, String operationName, int attempt) {
            return new StepStarted(chainId, stepId, operationName, attempt, Instant.now());
        }
    }

    /// Audit record of one attempt.
    ///
    /// @param chainId   run id
    /// @param stepId    step identity
    /// @param attempt   1-based attempt
    /// @param status    attempt outcome
    /// @param duration  attempt wall time
    /// @param summary   one-line outcome description
    /// @param timestamp when the attempt completed
    record StepCompleted(
            String chainId,
            String stepId,
            int attempt,
            StepStatus status,
            Duration duration,
            String summary,
            Instant timestamp)
            implements ChainEvent {

        public static StepCompleted now(String chainId, StepResult result) {
            return new StepCompleted(
                    chainId,
                    result.stepId(),
                    result.attempt(),
                    result.status(),
                    result.duration(),
                    result.summary(),
                    Instant.now());
        }
    }

    /// @param chainId   run id
    /// @param status    aggregate status
    /// @param error     terminal reason, may be null
    /// @param timestamp when the run ended
    record ChainCompleted(String chainId, ChainStatus status, String error, Instant timestamp)
            implements ChainEvent {

        public static ChainCompleted now(ChainResult result) {
            return new ChainCompleted(
                    result.chainId(), result.status(), result.error(), Instant.now());
        }
    }
}
