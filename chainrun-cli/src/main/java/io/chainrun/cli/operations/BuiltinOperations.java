package io.chainrun.cli.operations;

import io.chainrun.core.operation.OperationDefinition;
import io.chainrun.core.operation.OperationRegistry;
import java.util.List;

/// Operations available to every chain run from the command line.
///
/// @see EchoOperation
/// @see TransformOperation
/// @see ValidateOperation
public final class BuiltinOperations {

    private BuiltinOperations() {}

    public static List<OperationDefinition> definitions() {
        return List.of(
                OperationDefinition.of(
                        EchoOperation.NAME, "Returns its inputs as outputs", new EchoOperation()),
                OperationDefinition.of(
                        TransformOperation.NAME,
                        "Trims, re-cases or normalizes a string",
                        new TransformOperation()),
                OperationDefinition.of(
                        ValidateOperation.NAME,
                        "Fails when a value breaks length, pattern or presence rules",
                        new ValidateOperation()));
    }

    public static void registerAll(OperationRegistry registry) {
        definitions().forEach(registry::register);
    }
}
