package io.chainrun.core.chain;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Applies caller overrides to the inputs of a chain before it runs.
///
/// Override keys have the form `<target>.<input>`, where `<target>` is a step id (its
/// name or `step_<index>`) or an operation name. A key naming an operation applies to
/// every step that invokes it. Overridden inputs become literals.
///
/// {@snippet :
/// ChainDefinition tuned = InputOverrides.apply(chain, Map.of("search.max_results", 5));
/// }
public final class InputOverrides {

    private InputOverrides() {}

    /// Returns a copy of the chain with the overrides applied.
    ///
    /// @param chain     chain to adjust, not null
    /// @param overrides `<target>.<input>` to value, not null
    /// @return the adjusted chain, or `chain` itself when no override applies
    public static ChainDefinition apply(ChainDefinition chain, Map<String, Object> overrides) {
        Objects.requireNonNull(chain, "chain must not be null");
        Objects.requireNonNull(overrides, "overrides must not be null");
        if (overrides.isEmpty()) {
            return chain;
        }

        boolean changed = false;
        List<StepDefinition> steps = new ArrayList<>(chain.size());
        for (int i = 0; i < chain.size(); i++) {
            StepDefinition step = chain.steps().get(i);
            Map<String, InputBinding> inputs = new LinkedHashMap<>(step.inputs());
            for (Map.Entry<String, Object> entry : overrides.entrySet()) {
                String input = inputFor(entry.getKey(), step.id(i), step.operationName());
                if (input != null) {
                    inputs.put(input, InputBinding.literal(entry.getValue()));
                }
            }
            if (!inputs.equals(step.inputs())) {
                changed = true;
                steps.add(step.withInputs(inputs));
            } else {
                steps.add(step);
            }
        }
        return changed ? chain.withSteps(steps) : chain;
    }

    private static String inputFor(String key, String stepId, String operationName) {
        for (String target : new String[] {stepId, operationName}) {
            String prefix = target + ".";
            if (key.startsWith(prefix) && key.length() > prefix.length()) {
                return key.substring(prefix.length());
            }
        }
        return null;
    }
}
