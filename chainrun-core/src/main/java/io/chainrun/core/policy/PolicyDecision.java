package io.chainrun.core.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// What the executor does after one attempt of a step.
///
/// Exactly one of `retry`, `terminate` or a cursor move applies:
/// - `retry`: invoke the same step again, `nextIndex` is unused
/// - `terminate`: stop the chain, `reason` explains why
/// - otherwise move to `nextIndex`, or end the chain when it is {@link #END}
///
/// @param stateWrites     state key to value, applied before moving on, not null
/// @param nextIndex       next step position, or {@link #END}
/// @param retry           whether to invoke the same step again
/// @param terminate       whether the chain stops on an unrecovered failure
/// @param failureBypassed whether a failure was recorded and execution continues past it
/// @param reason          explanation for terminal or bypassed failures, may be null
public record PolicyDecision(
        Map<String, Object> stateWrites,
        int nextIndex,
        boolean retry,
        boolean terminate,
        boolean failureBypassed,
        String reason) {

    /// Cursor value meaning "no further step".
    public static final int END = -1;

    public PolicyDecision {
        stateWrites =
                stateWrites != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(stateWrites))
                        : Map.of();
    }

    public static PolicyDecision advance(Map<String, Object> stateWrites, int nextIndex) {
        return new PolicyDecision(stateWrites, nextIndex, false, false, false, null);
    }

    public static PolicyDecision retryStep() {
        return new PolicyDecision(Map.of(), END, true, false, false, null);
    }

    public static PolicyDecision stop(String reason) {
        return new PolicyDecision(Map.of(), END, false, true, false, reason);
    }

    public static PolicyDecision bypass(int nextIndex, String reason) {
        return new PolicyDecision(Map.of(), nextIndex, false, false, true, reason);
    }

    /// Returns whether the cursor ends after this decision.
    public boolean ends() {
        return terminate || (!retry && nextIndex == END);
    }
}
