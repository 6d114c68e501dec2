package io.arbor.core.expression;

/// Lexical token categories produced by {@link ConditionLexer}.
public enum TokenType {
    IDENTIFIER,
    NUMBER,
    STRING,
    BOOL,
    GTE,
    LTE,
    EQ,
    NEQ,
    GT,
    LT,
    AND,
    OR,
    NOT,
    LPAREN,
    RPAREN,
    EOF;

    /// Returns whether this token type is one of the six comparison operators.
    ///
    /// @return `true` for `>= <= == != > <`
    public boolean isComparison() {
        return this == GTE || this == LTE || this == EQ || this == NEQ || this == GT || this == LT;
    }
}
