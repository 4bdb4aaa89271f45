package io.chainrun.core.chain;

import io.chainrun.core.operation.OperationDefinition;
import io.chainrun.core.operation.OperationRegistry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Load-time checks that a chain can run as declared.
///
/// ### Checks
/// - the chain has at least one step
/// - operation names are not blank and, when a registry is given, registered and enabled
/// - step names are unique
/// - every `next` names a step of the same chain
/// - every RETRY policy declares `maxRetries >= 1`
/// - in parallel mode no policy declares `next`, unless branching is tolerated, in which
///   case the fields are ignored with a warning
///
/// All problems are collected before reporting.
public final class ChainValidator {

    private static final Logger logger = Logger.getLogger(ChainValidator.class.getName());

    private ChainValidator() {}

    /// Returns every configuration problem of the chain.
    ///
    /// @param chain                     chain to check, not null
    /// @param mode                      mode the chain will run in, not null
    /// @param registry                  registry to check operations against, may be null
    /// @param rejectBranchingInParallel whether `next` in parallel mode is an error
    /// @return problems in step order, empty when the chain is valid
    public static List<String> validate(
            ChainDefinition chain,
            ExecutionMode mode,
            OperationRegistry registry,
            boolean rejectBranchingInParallel) {
        Objects.requireNonNull(chain, "chain must not be null");
        Objects.requireNonNull(mode, "mode must not be null");

        List<String> problems = new ArrayList<>();
        if (chain.steps().isEmpty()) {
            problems.add("Chain " + label(chain) + " has no steps");
            return problems;
        }

        Set<String> names = new HashSet<>();
        for (StepDefinition step : chain.steps()) {
            if (step.stepName() != null && !names.add(step.stepName())) {
                problems.add("Duplicate step name: " + step.stepName());
            }
        }

        for (int i = 0; i < chain.steps().size(); i++) {
            StepDefinition step = chain.steps().get(i);
            String id = step.id(i);

            checkOperation(id, step.operationName(), registry, problems);

            FailurePolicy onFailure = step.onFailure();
            if (onFailure.action() == FailurePolicy.Action.RETRY
                    && (onFailure.maxRetries() == null || onFailure.maxRetries() < 1)) {
                problems.add("Step '" + id + "' uses RETRY without max_retries >= 1");
            }

            checkTarget(id, "on_success", step.onSuccess().next(), names, problems);
            checkTarget(id, "on_failure", onFailure.next(), names, problems);

            if (mode == ExecutionMode.PARALLEL
                    && (step.onSuccess().next() != null || onFailure.next() != null)) {
                if (rejectBranchingInParallel) {
                    problems.add("Step '" + id + "' declares next, which parallel mode cannot honor");
                } else {
                    logger.warning(
                            "Ignoring next of step '" + id + "' in parallel chain " + label(chain));
                }
            }
        }
        return problems;
    }

    /// Validates and throws on the first invalid chain.
    ///
    /// @throws ChainConfigurationException listing every problem found
    public static void requireValid(
            ChainDefinition chain,
            ExecutionMode mode,
            OperationRegistry registry,
            boolean rejectBranchingInParallel) {
        List<String> problems = validate(chain, mode, registry, rejectBranchingInParallel);
        if (!problems.isEmpty()) {
            throw new ChainConfigurationException(problems);
        }
    }

    private static void checkOperation(
            String stepId, String operationName, OperationRegistry registry, List<String> problems) {
        if (operationName.isBlank()) {
            problems.add("Step '" + stepId + "' has no operation");
            return;
        }
        if (registry == null) {
            return;
        }
        Optional<OperationDefinition> operation = registry.get(operationName);
        if (operation.isEmpty()) {
            problems.add("Step '" + stepId + "' references unknown operation: " + operationName);
        } else if (!operation.get().enabled()) {
            problems.add("Step '" + stepId + "' references disabled operation: " + operationName);
        }
    }

    private static void checkTarget(
            String stepId, String policy, String target, Set<String> names, List<String> problems) {
        if (target != null && !names.contains(target)) {
            problems.add("Step '" + stepId + "' " + policy + ".next references unknown step: " + target);
        }
    }

    private static String label(ChainDefinition chain) {
        return chain.name() != null ? "'" + chain.name() + "'" : "<unnamed>";
    }
}
