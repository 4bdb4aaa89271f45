package io.chainrun.core.execution;

/// Observer for chain execution events.
///
/// Exceptions thrown by an observer are logged and never affect the run.
///
/// ### Thread Safety
/// @implNote Implementations must be thread-safe: in parallel mode step events are
/// delivered from worker threads.
///
/// ### Usage
/// {@snippet :
/// ChainObserver audit = event -> {
///     if (event instanceof ChainEvent.StepCompleted completed) {
///         log.info(completed.stepId() + " " + completed.status());
///     }
/// };
/// executor.addObserver(audit);
/// }
@FunctionalInterface
public interface ChainObserver {

    /// Called when a chain event occurs.
    ///
    /// @param event the event, never null
    void onEvent(ChainEvent event);
}
