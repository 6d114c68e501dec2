package io.arbor.core.expression;

/// A lexical token with its decoded value and source position.
///
/// @param type the token category, not null
/// @param value decoded value: `Long`/`Double` for numbers, `Boolean` for BOOL, `String`
/// for identifiers, strings and operators, null for EOF
/// @param position 0-based character offset where the token starts
public record Token(TokenType type, Object value, int position) {

    @Override
    public String toString() {
        return "Token(" + type + ", " + value + ", pos=" + position + ")";
    }
}
