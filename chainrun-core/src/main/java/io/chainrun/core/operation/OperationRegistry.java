package io.chainrun.core.operation;

import java.util.List;
import java.util.Optional;

/// Registry of operations that chain steps can invoke by name.
///
/// ### Contracts
/// - Registering a name that already exists replaces the previous definition
/// - Lookups of unknown names return empty, never throw
///
/// ### Thread Safety
/// @implNote Implementations must be thread-safe. Operations may be registered while
/// chains are executing; a chain sees the registry as it is at invoke time.
///
/// @see DefaultOperationRegistry for the default implementation
public interface OperationRegistry {

    /// Registers an operation, replacing any definition with the same name.
    ///
    /// @param operation definition to register, not null
    void register(OperationDefinition operation);

    /// Looks up an operation by name.
    ///
    /// @param name operation name, not null
    /// @return the definition, or empty if not registered
    Optional<OperationDefinition> get(String name);

    /// Returns a snapshot of all registered operations.
    ///
    /// @return unmodifiable list, never null
    List<OperationDefinition> all();

    boolean contains(String name);

    /// Removes an operation.
    ///
    /// @param name operation name, not null
    /// @return true if an operation was removed
    boolean remove(String name);

    int size();
}
