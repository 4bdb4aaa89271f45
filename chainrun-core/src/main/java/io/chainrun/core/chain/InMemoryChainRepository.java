package io.chainrun.core.chain;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory chain repository (default implementation).
///
/// @implNote Uses ConcurrentHashMap for thread-safety.
/// @see ChainRepository for contract
public final class InMemoryChainRepository implements ChainRepository {

    private final Map<String, ChainDefinition> storage = new ConcurrentHashMap<>();

    @Override
    public void save(ChainDefinition chain) {
        Objects.requireNonNull(chain, "chain must not be null");
        if (chain.name() == null || chain.name().isBlank()) {
            throw new IllegalArgumentException("Only named chains can be stored");
        }
        storage.put(chain.name(), chain);
    }

    @Override
    public Optional<ChainDefinition> findByName(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(storage.get(name));
    }

    @Override
    public List<ChainDefinition> findAll() {
        return storage.values().stream()
                .sorted(Comparator.comparing(ChainDefinition::name))
                .toList();
    }

    @Override
    public boolean exists(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return storage.containsKey(name);
    }

    @Override
    public boolean delete(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return storage.remove(name) != null;
    }

    @Override
    public int count() {
        return storage.size();
    }
}
