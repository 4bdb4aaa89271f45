package io.chainrun.core.chain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// One declared unit of work in a chain.
///
/// ### Contracts
/// - **Precondition**: `operationName` must not be null
/// - **Postcondition**: `inputs` keeps declaration order and is unmodifiable
/// - **Postcondition**: missing policies default to {@link SuccessPolicy#fallthrough()} and
///   {@link FailurePolicy#stop()}
///
/// Blank operation names are accepted here and reported by {@link ChainValidator}.
///
/// @param operationName key into the operation registry, not null
/// @param inputs        input name to binding, not null (may be empty)
/// @param onSuccess     success policy, not null after construction
/// @param onFailure     failure policy, not null after construction
/// @param stepName      optional name used as jump target and step id, may be null
public record StepDefinition(
        String operationName,
        Map<String, InputBinding> inputs,
        SuccessPolicy onSuccess,
        FailurePolicy onFailure,
        String stepName) {

    /// Prefix of the identity of unnamed steps, followed by the step index.
    public static final String UNNAMED_PREFIX = "step_";

    public StepDefinition {
        Objects.requireNonNull(operationName, "operationName must not be null");
        inputs =
                inputs != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(inputs))
                        : Map.of();
        onSuccess = onSuccess != null ? onSuccess : SuccessPolicy.fallthrough();
        onFailure = onFailure != null ? onFailure : FailurePolicy.stop();
    }

    /// Returns the identity of this step at the given position.
    ///
    /// @param index zero-based position in the chain
    /// @return `stepName` if present, otherwise `step_<index>`
    public String id(int index) {
        return stepName != null ? stepName : UNNAMED_PREFIX + index;
    }

    public Optional<String> name() {
        return Optional.ofNullable(stepName);
    }

    /// Returns a copy with the given inputs.
    public StepDefinition withInputs(Map<String, InputBinding> newInputs) {
        return new StepDefinition(operationName, newInputs, onSuccess, onFailure, stepName);
    }

    public static Builder builder(String operationName) {
        return new Builder(operationName);
    }

    /// Fluent builder for steps declared in code.
    public static final class Builder {
        private final String operationName;
        private final Map<String, InputBinding> inputs = new LinkedHashMap<>();
        private SuccessPolicy onSuccess;
        private FailurePolicy onFailure;
        private String stepName;

        private Builder(String operationName) {
            this.operationName =
                    Objects.requireNonNull(operationName, "operationName must not be null");
        }

        public Builder name(String stepName) {
            this.stepName = stepName;
            return this;
        }

        /// Adds an input from its authored form, see {@link InputBinding#of(Object)}.
        public Builder input(String name, Object value) {
            inputs.put(Objects.requireNonNull(name, "name must not be null"), InputBinding.of(value));
            return this;
        }

        public Builder binding(String name, InputBinding binding) {
            inputs.put(
                    Objects.requireNonNull(name, "name must not be null"),
                    Objects.requireNonNull(binding, "binding must not be null"));
            return this;
        }

        public Builder onSuccess(SuccessPolicy onSuccess) {
            this.onSuccess = onSuccess;
            return this;
        }

        public Builder onFailure(FailurePolicy onFailure) {
            this.onFailure = onFailure;
            return this;
        }

        public StepDefinition build() {
            return new StepDefinition(operationName, inputs, onSuccess, onFailure, stepName);
        }
    }
}
