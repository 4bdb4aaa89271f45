package io.chainrun.core.operation;

import java.io.Serial;
import java.util.Map;

/// Failure raised by an operation with a structured error code.
///
/// The code and details are copied into the step's failure record; any other exception
/// type is recorded with its class name only.
public class OperationException extends Exception {
    @Serial private static final long serialVersionUID = 7390517276094015923L;

    private final String code;
    private final transient Map<String, Object> details;

    public OperationException(String code, String message) {
        this(code, message, Map.of(), null);
    }

    public OperationException(String code, String message, Throwable cause) {
        this(code, message, Map.of(), cause);
    }

    public OperationException(
            String code, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    public String code() {
        return code;
    }

    public Map<String, Object> details() {
        return details;
    }
}
