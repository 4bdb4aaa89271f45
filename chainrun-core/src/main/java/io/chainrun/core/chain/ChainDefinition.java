package io.chainrun.core.chain;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// An ordered list of steps executed as one unit.
///
/// A definition invoked by name from a {@link ChainRepository} is a composite operation:
/// `mode` is the mode it runs in unless the caller overrides it, and a disabled
/// definition cannot be executed.
///
/// @param name        chain name, may be null for ad hoc chains
/// @param description human-readable description, may be null
/// @param mode        preferred execution mode, may be null to use the engine default
/// @param enabled     whether the chain may be invoked
/// @param steps       ordered steps, not null (emptiness is reported by {@link ChainValidator})
public record ChainDefinition(
        String name,
        String description,
        ExecutionMode mode,
        boolean enabled,
        List<StepDefinition> steps) {

    public ChainDefinition {
        Objects.requireNonNull(steps, "steps must not be null");
        steps = List.copyOf(steps);
    }

    /// Creates an enabled chain without a preferred mode.
    public static ChainDefinition of(String name, List<StepDefinition> steps) {
        return new ChainDefinition(name, null, null, true, steps);
    }

    /// Creates an unnamed, enabled chain without a preferred mode.
    public static ChainDefinition of(StepDefinition... steps) {
        return of(null, Arrays.asList(steps));
    }

    /// Returns the preferred mode, or `fallback` when the chain declares none.
    public ExecutionMode modeOr(ExecutionMode fallback) {
        return mode != null ? mode : fallback;
    }

    public Optional<String> chainName() {
        return Optional.ofNullable(name);
    }

    /// Returns the identity of the step at `index`.
    public String stepId(int index) {
        return steps.get(index).id(index);
    }

    public int size() {
        return steps.size();
    }

    public ChainDefinition withName(String newName) {
        return new ChainDefinition(newName, description, mode, enabled, steps);
    }

    public ChainDefinition withSteps(List<StepDefinition> newSteps) {
        return new ChainDefinition(name, description, mode, enabled, newSteps);
    }

    public ChainDefinition withMode(ExecutionMode newMode) {
        return new ChainDefinition(name, description, newMode, enabled, steps);
    }
}
