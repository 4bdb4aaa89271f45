package io.chainrun.cli.operations;

import io.chainrun.core.execution.ExecutionContext;
import io.chainrun.core.operation.Operation;
import java.util.LinkedHashMap;
import java.util.Map;

/// Returns its arguments unchanged, so every input is available to `map_outputs`.
public class EchoOperation implements Operation {

    public static final String NAME = "echo";

    @Override
    public Map<String, Object> invoke(Map<String, Object> arguments, ExecutionContext context) {
        return new LinkedHashMap<>(arguments);
    }
}
