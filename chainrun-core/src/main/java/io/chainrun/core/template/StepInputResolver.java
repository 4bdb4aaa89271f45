package io.chainrun.core.template;

import io.chainrun.core.chain.InputBinding;
import io.chainrun.core.chain.InputBinding.Literal;
import io.chainrun.core.chain.InputBinding.Reference;
import io.chainrun.core.chain.InputBinding.Template;
import io.chainrun.core.state.Undefined;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Binds a step's declared inputs against chain state.
///
/// ### Contracts
/// - Literal bindings pass through unchanged
/// - References substitute the current state value; an absent key yields
///   {@link Undefined#VALUE}, never an error
/// - Templates are substituted textually through the {@link TemplateResolver}
/// - Only the data map is visible; engine metadata is never resolved
///
/// No expressions are evaluated.
public class StepInputResolver {

    private final TemplateResolver templateResolver;

    public StepInputResolver() {
        this(new SimpleTemplateResolver());
    }

    public StepInputResolver(TemplateResolver templateResolver) {
        this.templateResolver =
                Objects.requireNonNull(templateResolver, "templateResolver must not be null");
    }

    /// Resolves all inputs.
    ///
    /// @param inputs declared bindings, not null
    /// @param state  data visible to the step, not null
    /// @return argument map in declaration order, unmodifiable, may contain null values
    public Map<String, Object> resolve(Map<String, InputBinding> inputs, Map<String, Object> state) {
        Objects.requireNonNull(inputs, "inputs must not be null");
        Objects.requireNonNull(state, "state must not be null");

        Map<String, Object> arguments = new LinkedHashMap<>();
        inputs.forEach((name, binding) -> arguments.put(name, resolveOne(binding, state)));
        return Collections.unmodifiableMap(arguments);
    }

    private Object resolveOne(InputBinding binding, Map<String, Object> state) {
        if (binding instanceof Literal literal) {
            return literal.value();
        }
        if (binding instanceof Reference reference) {
            return state.containsKey(reference.key()) ? state.get(reference.key()) : Undefined.VALUE;
        }
        return templateResolver.resolve(((Template) binding).text(), state);
    }
}
