package io.chainrun.core.execution;

import io.chainrun.core.chain.ExecutionMode;
import java.time.Instant;
import java.util.Objects;

/// A run that has started and not yet completed.
///
/// @param chainId   run identifier, not null
/// @param chainName chain name, may be null for ad hoc chains
/// @param mode      execution mode, not null
/// @param stepCount number of steps in the chain
/// @param startedAt when the run started, not null
public record ActiveChain(
        String chainId, String chainName, ExecutionMode mode, int stepCount, Instant startedAt) {

    public ActiveChain {
        Objects.requireNonNull(chainId, "chainId must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
    }
}
