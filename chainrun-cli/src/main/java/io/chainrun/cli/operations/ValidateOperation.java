package io.chainrun.cli.operations;

import io.chainrun.core.execution.ExecutionContext;
import io.chainrun.core.operation.Operation;
import io.chainrun.core.operation.OperationException;
import io.chainrun.core.state.Undefined;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/// Checks one input against simple rules and fails the step when any rule is broken.
///
/// Inputs:
///
/// - **value** - Value to check; an undefined reference counts as absent
/// - **field** - Name used in messages (default: "value")
/// - **required** - Whether the value must be present and not blank (default: false)
/// - **minLength** - Minimum string length
/// - **maxLength** - Maximum string length
/// - **pattern** - Regex the whole value must match
/// - **errorMessage** - Message for a pattern mismatch (default: "Invalid format")
///
/// On failure the step fails with code `VALIDATION_FAILED` and the list of broken rules
/// under the `errors` detail.
public class ValidateOperation implements Operation {

    private static final Logger logger = Logger.getLogger(ValidateOperation.class.getName());

    public static final String NAME = "validate";

    @Override
    public Map<String, Object> invoke(Map<String, Object> arguments, ExecutionContext context)
            throws OperationException {
        String field = String.valueOf(arguments.getOrDefault("field", "value"));
        Object raw = arguments.get("value");
        String value = raw == null || raw == Undefined.VALUE ? null : raw.toString();

        List<String> errors = new ArrayList<>();

        if (isTrue(arguments.get("required")) && (value == null || value.isBlank())) {
            errors.add(field + " is required");
        }

        if (value != null && !value.isEmpty()) {
            Integer minLength = intOrNull(arguments.get("minLength"));
            if (minLength != null && value.length() < minLength) {
                errors.add(field + " must be at least " + minLength + " characters");
            }

            Integer maxLength = intOrNull(arguments.get("maxLength"));
            if (maxLength != null && value.length() > maxLength) {
                errors.add(field + " must be at most " + maxLength + " characters");
            }

            Object pattern = arguments.get("pattern");
            if (pattern instanceof String regex && !Pattern.matches(regex, value)) {
                errors.add(
                        String.valueOf(arguments.getOrDefault("errorMessage", "Invalid format")));
            }
        }

        if (!errors.isEmpty()) {
            String message = String.join("; ", errors);
            logger.warning("Validation failed for " + field + ": " + message);
            throw new OperationException(
                    "VALIDATION_FAILED", message, Map.of("errors", List.copyOf(errors)), null);
        }

        logger.fine("Validation passed for " + field);
        return value != null
                ? Map.of("valid", true, "value", value)
                : Map.of("valid", true);
    }

    private static boolean isTrue(Object raw) {
        return raw instanceof Boolean flag ? flag : Boolean.parseBoolean(String.valueOf(raw));
    }

    private static Integer intOrNull(Object raw) {
        if (raw instanceof Number number) {
            return number.intValue();
        }
        if (raw instanceof String text && !text.isBlank()) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
