package io.chainrun.core.chain;

import java.util.List;
import java.util.Optional;

/// Named chain definitions that callers invoke by name.
///
/// ### Idempotent Save
/// Saving a chain whose name already exists overwrites the previous definition.
///
/// ### Usage
/// {@snippet :
/// repository.save(chain);
/// Optional<ChainDefinition> triage = repository.findByName("triage");
/// }
///
/// @see InMemoryChainRepository for the default implementation
public interface ChainRepository {

    /// Saves a named chain.
    ///
    /// @param chain definition to store, not null
    /// @throws IllegalArgumentException if the chain has no name
    void save(ChainDefinition chain);

    /// Finds a chain by name.
    ///
    /// @param name chain name, not null
    /// @return the chain, or empty when unknown
    Optional<ChainDefinition> findByName(String name);

    /// Lists all chains, ordered by name.
    ///
    /// @return chains, never null (may be empty)
    List<ChainDefinition> findAll();

    boolean exists(String name);

    boolean delete(String name);

    int count();
}
