package io.arbor.core.exception;

import java.io.Serial;

/// Thrown when a condition or calculation cannot be evaluated.
///
/// Common causes:
/// - Referenced variable missing from the context
/// - Unknown comparator or operator
/// - Operand type mismatch (e.g., a numeric comparator given a boolean)
/// - Domain errors such as division by zero or an unparseable date
public class EvaluationException extends Exception {

    @Serial private static final long serialVersionUID = -2406314889257107734L;

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
