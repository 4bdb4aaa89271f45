package io.chainrun.core.operation;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Default thread-safe implementation of {@link OperationRegistry}.
///
/// ### Thread Safety
/// @implNote Thread-safe. Backed by a ConcurrentHashMap shared by all executing chains.
///
/// ### Usage
/// {@snippet :
/// OperationRegistry registry = new DefaultOperationRegistry();
/// registry.register(OperationDefinition.simple("echo", (args, ctx) -> args));
/// }
public final class DefaultOperationRegistry implements OperationRegistry {

    private final Map<String, OperationDefinition> operations = new ConcurrentHashMap<>();

    public DefaultOperationRegistry() {}

    /// Creates a registry with initial operations.
    ///
    /// @param initial operations to register, not null
    public DefaultOperationRegistry(List<OperationDefinition> initial) {
        Objects.requireNonNull(initial, "initial must not be null");
        initial.forEach(this::register);
    }

    @Override
    public void register(OperationDefinition operation) {
        Objects.requireNonNull(operation, "operation must not be null");
        operations.put(operation.name(), operation);
    }

    @Override
    public Optional<OperationDefinition> get(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(operations.get(name));
    }

    @Override
    public List<OperationDefinition> all() {
        return List.copyOf(operations.values());
    }

    @Override
    public boolean contains(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return operations.containsKey(name);
    }

    @Override
    public boolean remove(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return operations.remove(name) != null;
    }

    @Override
    public int size() {
        return operations.size();
    }
}
