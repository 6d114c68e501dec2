package io.arbor.core.exception;

import java.io.Serial;

/// Signals that a running execution was asked to stop.
///
/// Unchecked so it can be raised from {@link io.arbor.core.execution.ExecutionListener}
/// callbacks and unwind nested sub-workflow calls. The interpreter reports it as a
/// stopped result rather than a failure.
public class ExecutionStoppedException extends RuntimeException {

    @Serial private static final long serialVersionUID = -6387021583390446402L;

    public ExecutionStoppedException(String message) {
        super(message);
    }
}
