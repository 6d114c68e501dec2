package io.arbor.core.execution.control;

import io.arbor.core.exception.ExecutionStoppedException;
import io.arbor.core.execution.ExecutionListener;
import io.arbor.core.execution.StepEvent;
import java.time.Duration;
import java.util.Objects;

/// Listener that honours an {@link ExecutionControl} and forwards events to a delegate.
///
/// Each step first waits out a pause (failing on stop), then forwards the event, then
/// sleeps for the configured step delay. The delay makes step-by-step visualizations
/// watchable.
public final class SteppingExecutionListener implements ExecutionListener {

    private final ExecutionControl control;
    private final ExecutionListener delegate;
    private final Duration stepDelay;

    public SteppingExecutionListener(ExecutionControl control, ExecutionListener delegate) {
        this(control, delegate, Duration.ZERO);
    }

    /// @param control the execution's control handle, not null
    /// @param delegate listener receiving events, not null
    /// @param stepDelay pause after each step, not null (zero for none)
    public SteppingExecutionListener(
            ExecutionControl control, ExecutionListener delegate, Duration stepDelay) {
        this.control = Objects.requireNonNull(control, "control must not be null");
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.stepDelay = Objects.requireNonNull(stepDelay, "stepDelay must not be null");
    }

    @Override
    public void onStep(StepEvent event) {
        control.awaitStep();
        delegate.onStep(event);
        if (!stepDelay.isZero() && !stepDelay.isNegative()) {
            try {
                Thread.sleep(stepDelay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ExecutionStoppedException(
                        "Execution " + control.getExecutionId() + " interrupted");
            }
        }
    }
}
