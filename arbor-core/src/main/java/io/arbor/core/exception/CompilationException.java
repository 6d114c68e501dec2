package io.arbor.core.exception;

import java.io.Serial;

/// Thrown for structural compilation failures that abort the whole pass.
///
/// Node-level problems never raise this; they are reported as warnings on the
/// {@link io.arbor.core.compiler.CompilationResult}.
public class CompilationException extends Exception {

    @Serial private static final long serialVersionUID = 5019347784410238836L;

    public CompilationException(String message) {
        super(message);
    }
}
