package io.chainrun.core.operation;

import java.util.Objects;

/// A registered operation together with its descriptor.
///
/// ### Contracts
/// - **Precondition**: `name` must not be null or blank
/// - **Precondition**: `operation` must not be null
///
/// A disabled definition stays registered but cannot be invoked; chains that reference it
/// fail validation.
///
/// @param name        unique operation identifier, not null
/// @param description human-readable description, not null (may be empty)
/// @param enabled     whether the operation may be invoked
/// @param operation   the implementation, not null
/// @see OperationRegistry for registration
public record OperationDefinition(
        String name, String description, boolean enabled, Operation operation) {

    public OperationDefinition {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        description = description != null ? description : "";
        Objects.requireNonNull(operation, "operation must not be null");
    }

    /// Creates an enabled operation with an empty description.
    public static OperationDefinition simple(String name, Operation operation) {
        return new OperationDefinition(name, "", true, operation);
    }

    /// Creates an enabled operation.
    public static OperationDefinition of(String name, String description, Operation operation) {
        return new OperationDefinition(name, description, true, operation);
    }

    /// Returns a copy with the given enabled flag.
    public OperationDefinition withEnabled(boolean flag) {
        return new OperationDefinition(name, description, flag, operation);
    }
}
