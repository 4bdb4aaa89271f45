package io.chainrun.core.policy;

import io.chainrun.core.chain.ChainDefinition;
import io.chainrun.core.chain.FailurePolicy;
import io.chainrun.core.chain.StepDefinition;
import io.chainrun.core.chain.SuccessPolicy;
import io.chainrun.core.operation.InvocationOutcome;
import io.chainrun.core.operation.InvocationOutcome.Failure;
import io.chainrun.core.operation.InvocationOutcome.Success;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Turns the outcome of one attempt into a {@link PolicyDecision}.
///
/// Created per chain run; step names are indexed once so that jumps resolve in constant
/// time.
///
/// ### Decision Table
/// | Outcome | Policy | Decision |
/// |---------|--------|----------|
/// | success | any | map outputs, go to `onSuccess.next` or successor |
/// | failure | STOP | terminate |
/// | failure | RETRY, `attempt < maxRetries` | retry same step |
/// | failure | RETRY exhausted, `continueOnMaxRetries` | bypass to `next` or successor |
/// | failure | RETRY exhausted | terminate |
/// | failure | CONTINUE | bypass to `onFailure.next` or successor |
/// | configuration error | any | terminate |
///
/// Output mappings skip result fields that are absent. A bypassed failure applies no
/// mapping.
public class PolicyEvaluator {

    private final ChainDefinition chain;
    private final Map<String, Integer> indexByName = new HashMap<>();

    public PolicyEvaluator(ChainDefinition chain) {
        this.chain = Objects.requireNonNull(chain, "chain must not be null");
        for (int i = 0; i < chain.steps().size(); i++) {
            String name = chain.steps().get(i).stepName();
            if (name != null) {
                indexByName.putIfAbsent(name, i);
            }
        }
    }

    /// Evaluates one attempt.
    ///
    /// @param stepIndex position of the step that ran
    /// @param outcome   invocation outcome, not null
    /// @param attempt   1-based attempt number within the current execution of the step
    /// @return the decision, never null
    public PolicyDecision evaluate(int stepIndex, InvocationOutcome outcome, int attempt) {
        Objects.requireNonNull(outcome, "outcome must not be null");
        StepDefinition step = chain.steps().get(stepIndex);

        if (outcome instanceof Success success) {
            return onSuccess(stepIndex, step.onSuccess(), success);
        }
        return onFailure(stepIndex, step, (Failure) outcome, attempt);
    }

    private PolicyDecision onSuccess(int stepIndex, SuccessPolicy policy, Success success) {
        Map<String, Object> writes = new LinkedHashMap<>();
        policy.outputMappings()
                .forEach(
                        (field, stateKey) -> {
                            if (success.output().containsKey(field)) {
                                writes.put(stateKey, success.output().get(field));
                            }
                        });

        if (policy.next() == null) {
            return PolicyDecision.advance(writes, successor(stepIndex));
        }
        Integer target = indexByName.get(policy.next());
        if (target == null) {
            return PolicyDecision.stop("Unknown next step: " + policy.next());
        }
        return PolicyDecision.advance(writes, target);
    }

    private PolicyDecision onFailure(
            int stepIndex, StepDefinition step, Failure failure, int attempt) {
        if (failure.configurationError()) {
            return PolicyDecision.stop(failure.error());
        }

        FailurePolicy policy = step.onFailure();
        return switch (policy.action()) {
            case STOP -> PolicyDecision.stop(failure.error());
            case CONTINUE -> bypass(stepIndex, policy.next(), failure.error());
            case RETRY -> {
                int maxRetries = policy.maxRetries() != null ? policy.maxRetries() : 1;
                if (attempt < maxRetries) {
                    yield PolicyDecision.retryStep();
                }
                String reason = failure.error() + " (after " + attempt + " attempts)";
                yield policy.continueOnMaxRetries()
                        ? bypass(stepIndex, policy.next(), reason)
                        : PolicyDecision.stop(reason);
            }
        };
    }

    private PolicyDecision bypass(int stepIndex, String next, String reason) {
        if (next == null) {
            return PolicyDecision.bypass(successor(stepIndex), reason);
        }
        Integer target = indexByName.get(next);
        if (target == null) {
            return PolicyDecision.stop("Unknown next step: " + next);
        }
        return PolicyDecision.bypass(target, reason);
    }

    private int successor(int stepIndex) {
        int next = stepIndex + 1;
        return next < chain.steps().size() ? next : PolicyDecision.END;
    }
}
