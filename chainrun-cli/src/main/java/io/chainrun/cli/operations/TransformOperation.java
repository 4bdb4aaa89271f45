package io.chainrun.cli.operations;

import io.chainrun.core.execution.ExecutionContext;
import io.chainrun.core.operation.Operation;
import io.chainrun.core.operation.OperationException;
import io.chainrun.core.state.Undefined;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/// Applies a sequence of string transformations to one input.
///
/// ### Inputs
/// | Key | Type | Default | Description |
/// |-----|------|---------|-------------|
/// | `value` | any | required | Value to transform, converted with `toString()` |
/// | `operations` | List&lt;String&gt; or comma-separated String | `[]` | Applied in order |
///
/// ### Supported Transformations
/// - `trim` - Remove leading/trailing whitespace
/// - `lowercase` - Convert to lowercase
/// - `uppercase` - Convert to uppercase
/// - `normalize` - Collapse runs of whitespace to a single space
///
/// Unknown transformations fail the step with code `UNKNOWN_TRANSFORMATION`.
///
/// Output: `{"value": <result>, "operations_applied": [...]}`.
public class TransformOperation implements Operation {

    private static final Logger logger = Logger.getLogger(TransformOperation.class.getName());

    public static final String NAME = "transform";
    static final String VALUE = "value";
    static final String OPERATIONS = "operations";

    @Override
    public Map<String, Object> invoke(Map<String, Object> arguments, ExecutionContext context)
            throws OperationException {
        Object input = arguments.get(VALUE);
        if (input == null || input == Undefined.VALUE) {
            throw new OperationException("MISSING_INPUT", "Input '" + VALUE + "' not found");
        }

        String value = input.toString();
        List<String> operations = operationsOf(arguments.get(OPERATIONS));
        for (String op : operations) {
            value =
                    switch (op.toLowerCase(Locale.ROOT)) {
                        case "trim" -> value.trim();
                        case "lowercase" -> value.toLowerCase(Locale.ROOT);
                        case "uppercase" -> value.toUpperCase(Locale.ROOT);
                        case "normalize" -> value.replaceAll("\\s+", " ");
                        default -> throw new OperationException(
                                "UNKNOWN_TRANSFORMATION", "Unknown transformation: " + op);
                    };
        }

        logger.fine("Applied " + operations + " to '" + input + "'");
        return Map.of(VALUE, value, "operations_applied", operations);
    }

    private static List<String> operationsOf(Object raw) {
        if (raw == null || raw == Undefined.VALUE) {
            return List.of();
        }
        List<String> operations = new ArrayList<>();
        if (raw instanceof List<?> list) {
            list.forEach(item -> operations.add(String.valueOf(item).trim()));
        } else {
            Arrays.stream(raw.toString().split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(operations::add);
        }
        return List.copyOf(operations);
    }
}
