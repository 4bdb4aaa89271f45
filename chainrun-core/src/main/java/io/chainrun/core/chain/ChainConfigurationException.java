package io.chainrun.core.chain;

import java.io.Serial;
import java.util.List;
import java.util.Objects;

/// Thrown when a chain definition cannot be executed as declared.
///
/// Carries every problem found, so a caller can report them together.
public class ChainConfigurationException extends RuntimeException {
    @Serial private static final long serialVersionUID = 4127730952871160324L;

    private final transient List<String> problems;

    public ChainConfigurationException(String message) {
        this(List.of(message));
    }

    public ChainConfigurationException(List<String> problems) {
        super(format(problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }

    private static String format(List<String> problems) {
        Objects.requireNonNull(problems, "problems must not be null");
        if (problems.size() == 1) {
            return problems.get(0);
        }
        return "Invalid chain configuration: " + String.join("; ", problems);
    }
}
