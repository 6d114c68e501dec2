package io.arbor.core.execution;

/// Listener for interpreter step events.
///
/// Invoked synchronously on the executing thread before each node, including nodes of
/// called sub-workflows. A listener that throws is logged and ignored, except for
/// {@link io.arbor.core.exception.ExecutionStoppedException}, which ends the run with a
/// stopped result.
///
/// @see io.arbor.core.execution.control.SteppingExecutionListener
public interface ExecutionListener {

    /// Called before a node is processed.
    ///
    /// @param event the step snapshot, not null
    default void onStep(StepEvent event) {}

    /// No-op listener instance that ignores all events.
    ExecutionListener NOOP = new ExecutionListener() {};
}
