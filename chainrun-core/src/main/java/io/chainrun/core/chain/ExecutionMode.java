package io.chainrun.core.chain;

/// How the steps of a chain are scheduled within one run.
public enum ExecutionMode {
    /// One cursor, steps run one after another with branching and retry.
    SEQUENTIAL,
    /// All steps fan out concurrently against the initial state; branching is not used.
    PARALLEL
}
