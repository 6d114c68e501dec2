package io.arbor.core.exception;

import java.io.Serial;

/// Thrown when a workflow execution cannot continue.
///
/// Raised for invalid inputs, unresolvable branches, missing children and sub-workflow
/// failures. The interpreter converts it into a failed
/// {@link io.arbor.core.execution.ExecutionResult}; it never escapes
/// {@link io.arbor.core.execution.WorkflowInterpreter#execute}.
public class InterpreterException extends Exception {

    @Serial private static final long serialVersionUID = 7710582394718253530L;

    public InterpreterException(String message) {
        super(message);
    }

    public InterpreterException(String message, Throwable cause) {
        super(message, cause);
    }
}
