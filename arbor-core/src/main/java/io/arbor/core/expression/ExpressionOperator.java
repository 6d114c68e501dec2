package io.arbor.core.expression;

/// Operators that can appear in an expression AST.
public enum ExpressionOperator {
    AND("AND"),
    OR("OR"),
    NOT("NOT"),
    GTE(">="),
    LTE("<="),
    EQ("=="),
    NEQ("!="),
    GT(">"),
    LT("<");

    private final String symbol;

    ExpressionOperator(String symbol) {
        this.symbol = symbol;
    }

    /// Returns the operator as written in condition text.
    ///
    /// @return the textual symbol, never null
    public String symbol() {
        return symbol;
    }

    /// Maps a comparison token to its operator.
    ///
    /// @param type a comparison token type, not null
    /// @return the matching operator, never null
    /// @throws IllegalArgumentException if the token is not a comparison
    static ExpressionOperator fromComparison(TokenType type) {
        return switch (type) {
            case GTE -> GTE;
            case LTE -> LTE;
            case EQ -> EQ;
            case NEQ -> NEQ;
            case GT -> GT;
            case LT -> LT;
            default -> throw new IllegalArgumentException("Not a comparison token: " + type);
        };
    }
}
