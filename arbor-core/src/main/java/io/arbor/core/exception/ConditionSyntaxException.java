package io.arbor.core.exception;

import java.io.Serial;

/// Thrown when condition text cannot be tokenized or parsed.
///
/// Carries the offending source text and the approximate character position so callers
/// can point the user at the problem.
///
/// @see io.arbor.core.expression.ConditionLexer
/// @see io.arbor.core.expression.ConditionParser
public class ConditionSyntaxException extends Exception {

    @Serial private static final long serialVersionUID = 3185067245926514411L;

    private final String source;
    private final int position;

    /// Creates exception with message, source text and position.
    ///
    /// @param message description of the syntax problem, not null
    /// @param source the condition text being parsed, may be null
    /// @param position 0-based character offset, or -1 when unknown
    public ConditionSyntaxException(String message, String source, int position) {
        super(message);
        this.source = source;
        this.position = position;
    }

    /// Returns the condition text that failed to parse.
    ///
    /// @return the source text, may be null
    public String getSource() {
        return source;
    }

    /// Returns the approximate position of the error.
    ///
    /// @return 0-based offset, or -1 when unknown
    public int getPosition() {
        return position;
    }
}
