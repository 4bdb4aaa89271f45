package io.chainrun.core.execution;

/// Aggregate outcome of a chain run.
///
/// - `COMPLETED`: no execution ended in a failure
/// - `FAILED`: the chain stopped on an unrecovered failure, or every execution failed
/// - `PARTIALLY_COMPLETED`: some executions succeeded and some failures were bypassed, or
///   the run was cancelled
public enum ChainStatus {
    COMPLETED,
    FAILED,
    PARTIALLY_COMPLETED
}
