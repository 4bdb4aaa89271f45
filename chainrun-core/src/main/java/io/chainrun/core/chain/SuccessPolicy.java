package io.chainrun.core.chain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// What happens after a step's operation returns successfully.
///
/// @param outputMappings result field name to chain state key, not null (may be empty);
///                       iteration order is the order mappings are applied
/// @param next           explicit step name to jump to, may be null for fallthrough
/// @see FailurePolicy
public record SuccessPolicy(Map<String, String> outputMappings, String next) {

    public SuccessPolicy {
        outputMappings =
                outputMappings != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(outputMappings))
                        : Map.of();
    }

    /// Policy that maps nothing and falls through to the next step in sequence.
    public static SuccessPolicy fallthrough() {
        return new SuccessPolicy(Map.of(), null);
    }

    /// Policy that maps the given outputs and falls through.
    ///
    /// @param outputMappings result field to state key, not null
    /// @return new policy, never null
    public static SuccessPolicy mapping(Map<String, String> outputMappings) {
        Objects.requireNonNull(outputMappings, "outputMappings must not be null");
        return new SuccessPolicy(outputMappings, null);
    }

    /// Returns a copy that jumps to the named step.
    ///
    /// @param stepName target step, not null
    /// @return new policy, never null
    public SuccessPolicy thenGoTo(String stepName) {
        Objects.requireNonNull(stepName, "stepName must not be null");
        return new SuccessPolicy(outputMappings, stepName);
    }

    public Optional<String> nextStep() {
        return Optional.ofNullable(next);
    }
}
