package io.chainrun.core.chain;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Declared value of one step input.
///
/// ### Authoring forms
/// {@link #of(Object)} maps authored values onto bindings:
/// ```
/// "{{ state.customer_id }}"   -> Reference("customer_id")
/// "{{ customer_id }}"         -> Reference("customer_id")
/// "state.customer_id"         -> Reference("customer_id")
/// "Hello {{ state.name }}!"   -> Template("Hello {{ state.name }}!")
/// 42, "plain", {...}          -> Literal(value)
/// ```
///
/// @see io.chainrun.core.template.StepInputResolver for resolution against chain state
public sealed interface InputBinding {

    /// Prefix that marks an explicit reference into chain state.
    String STATE_PREFIX = "state.";

    /// Matches a value that is exactly one placeholder, e.g. `{{ state.key }}`.
    Pattern WHOLE_PLACEHOLDER = Pattern.compile("^\\{\\{\\s*([^{}\\s]+)\\s*}}$");

    /// Value passed to the operation unchanged.
    record Literal(Object value) implements InputBinding {}

    /// Reference to a chain state key. The `state.` prefix is stripped on construction.
    record Reference(String key) implements InputBinding {

        public Reference {
            Objects.requireNonNull(key, "key must not be null");
            if (key.startsWith(STATE_PREFIX)) {
                key = key.substring(STATE_PREFIX.length());
            }
            if (key.isBlank()) {
                throw new IllegalArgumentException("reference key must not be blank");
            }
        }

        /// Returns the authored form, `{{ state.key }}`.
        public String expression() {
            return "{{ " + STATE_PREFIX + key + " }}";
        }
    }

    /// Text with embedded placeholders, substituted textually.
    record Template(String text) implements InputBinding {

        public Template {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    static InputBinding literal(Object value) {
        return new Literal(value);
    }

    static InputBinding ref(String key) {
        return new Reference(key);
    }

    static InputBinding template(String text) {
        return new Template(text);
    }

    /// Interprets an authored input value.
    ///
    /// @param raw authored value, may be null
    /// @return the binding for the value, never null
    static InputBinding of(Object raw) {
        if (raw instanceof InputBinding binding) {
            return binding;
        }
        if (!(raw instanceof String text)) {
            return new Literal(raw);
        }
        String trimmed = text.trim();
        Matcher whole = WHOLE_PLACEHOLDER.matcher(trimmed);
        if (whole.matches()) {
            return new Reference(whole.group(1));
        }
        if (text.contains("{{") && text.contains("}}")) {
            return new Template(text);
        }
        if (trimmed.startsWith(STATE_PREFIX) && trimmed.length() > STATE_PREFIX.length()) {
            return new Reference(trimmed);
        }
        return new Literal(raw);
    }
}
