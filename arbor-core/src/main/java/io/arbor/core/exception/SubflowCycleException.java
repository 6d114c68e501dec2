package io.arbor.core.exception;

import java.io.Serial;

/// Thrown when a sub-workflow call would re-enter a workflow already on the call stack.
public class SubflowCycleException extends InterpreterException {

    @Serial private static final long serialVersionUID = -1553960214707823114L;

    public SubflowCycleException(String message) {
        super(message);
    }
}
