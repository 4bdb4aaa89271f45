package io.chainrun.core.chain;

import java.util.Objects;
import java.util.Optional;

/// What happens after a step's operation fails.
///
/// A policy is a plain value; whether `maxRetries` is present and positive for
/// {@link Action#RETRY} is checked by {@link ChainValidator} so that every problem of a
/// chain can be reported at once.
///
/// ### Semantics
/// - `STOP` ends the chain immediately.
/// - `RETRY` re-invokes the same step until `maxRetries` attempts have been made, then
///   behaves as `CONTINUE` when `continueOnMaxRetries` is set, otherwise as `STOP`.
/// - `CONTINUE` records the failure and moves to `next`, or to the sequential successor.
///
/// @param action               failure action, not null
/// @param maxRetries           total attempts allowed for `RETRY`, may be null otherwise
/// @param continueOnMaxRetries whether an exhausted retry continues instead of stopping
/// @param next                 step to continue with, may be null for fallthrough
public record FailurePolicy(
        Action action, Integer maxRetries, boolean continueOnMaxRetries, String next) {

    /// Declared failure action.
    public enum Action {
        STOP,
        RETRY,
        CONTINUE
    }

    public FailurePolicy {
        Objects.requireNonNull(action, "action must not be null");
    }

    /// The default policy: stop the chain.
    public static FailurePolicy stop() {
        return new FailurePolicy(Action.STOP, null, false, null);
    }

    /// Retries up to `maxRetries` attempts, then stops.
    public static FailurePolicy retry(int maxRetries) {
        return new FailurePolicy(Action.RETRY, maxRetries, false, null);
    }

    /// Retries up to `maxRetries` attempts, then continues with `next` (or falls through).
    ///
    /// @param maxRetries total attempts allowed
    /// @param next       step to continue with once retries are exhausted, may be null
    /// @return new policy, never null
    public static FailurePolicy retryThenContinue(int maxRetries, String next) {
        return new FailurePolicy(Action.RETRY, maxRetries, true, next);
    }

    /// Continues with the sequential successor.
    public static FailurePolicy continueOnFailure() {
        return new FailurePolicy(Action.CONTINUE, null, false, null);
    }

    /// Continues with the named step.
    ///
    /// @param stepName recovery step, not null
    /// @return new policy, never null
    public static FailurePolicy continueTo(String stepName) {
        Objects.requireNonNull(stepName, "stepName must not be null");
        return new FailurePolicy(Action.CONTINUE, null, false, stepName);
    }

    public Optional<String> nextStep() {
        return Optional.ofNullable(next);
    }
}
