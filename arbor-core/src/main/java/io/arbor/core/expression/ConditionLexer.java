package io.arbor.core.expression;

import io.arbor.core.exception.ConditionSyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/// Tokenizes legacy condition strings such as `Age >= 18 AND NOT Smoker == True`.
///
/// ### Lexical Rules
/// - Numbers: digits with at most one decimal point, decoded as `Long` or `Double`
/// - Strings: single- or double-quoted, no escape sequences
/// - Keywords `AND`, `OR`, `NOT`, `TRUE`, `FALSE` are case-insensitive
/// - Identifiers: a letter or `_`, followed by letters, digits or `_`
/// - Operators: `>= <= == != > <` and parentheses
///
/// @implNote **Not thread-safe**. Create one lexer per input string.
/// @see ConditionParser
public final class ConditionLexer {

    private final String text;
    private int pos;

    /// Creates a lexer over the given text.
    ///
    /// @param text the condition string, null is treated as empty
    public ConditionLexer(String text) {
        this.text = text != null ? text : "";
        this.pos = 0;
    }

    /// Tokenizes the whole input.
    ///
    /// @return tokens in source order, always terminated by an EOF token, never null
    /// @throws ConditionSyntaxException on an unexpected character, an unterminated string
    /// or a malformed number
    public List<Token> tokenize() throws ConditionSyntaxException {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    private Token nextToken() throws ConditionSyntaxException {
        while (pos < text.length()) {
            char c = text.charAt(pos);

            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }
            if (Character.isDigit(c)) {
                return readNumber();
            }
            if (c == '"' || c == '\'') {
                return readString(c);
            }
            if (Character.isLetter(c) || c == '_') {
                return readIdentifierOrKeyword();
            }

            int start = pos;
            char next = peek();
            if (next == '=') {
                TokenType twoChar =
                        switch (c) {
                            case '>' -> TokenType.GTE;
                            case '<' -> TokenType.LTE;
                            case '=' -> TokenType.EQ;
                            case '!' -> TokenType.NEQ;
                            default -> null;
                        };
                if (twoChar != null) {
                    pos += 2;
                    return new Token(twoChar, text.substring(start, pos), start);
                }
            }

            TokenType single =
                    switch (c) {
                        case '>' -> TokenType.GT;
                        case '<' -> TokenType.LT;
                        case '(' -> TokenType.LPAREN;
                        case ')' -> TokenType.RPAREN;
                        default -> null;
                    };
            if (single == null) {
                throw new ConditionSyntaxException(
                        "Unexpected character '" + c + "' at position " + pos, text, pos);
            }
            pos++;
            return new Token(single, String.valueOf(c), start);
        }
        return new Token(TokenType.EOF, null, pos);
    }

    private char peek() {
        return pos + 1 < text.length() ? text.charAt(pos + 1) : '\0';
    }

    private Token readNumber() throws ConditionSyntaxException {
        int start = pos;
        boolean hasDecimal = false;
        while (pos < text.length()
                && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '.')) {
            if (text.charAt(pos) == '.') {
                if (hasDecimal) {
                    throw new ConditionSyntaxException(
                            "Invalid number format at position " + pos, text, pos);
                }
                hasDecimal = true;
            }
            pos++;
        }

        String literal = text.substring(start, pos);
        try {
            Object value = hasDecimal ? (Object) Double.valueOf(literal) : Long.valueOf(literal);
            return new Token(TokenType.NUMBER, value, start);
        } catch (NumberFormatException e) {
            throw new ConditionSyntaxException(
                    "Invalid number '" + literal + "' at position " + start, text, start);
        }
    }

    private Token readString(char quote) throws ConditionSyntaxException {
        int start = pos;
        pos++;
        int contentStart = pos;
        while (pos < text.length() && text.charAt(pos) != quote) {
            pos++;
        }
        if (pos >= text.length()) {
            throw new ConditionSyntaxException(
                    "Unclosed string starting at position " + start, text, start);
        }
        String value = text.substring(contentStart, pos);
        pos++;
        return new Token(TokenType.STRING, value, start);
    }

    private Token readIdentifierOrKeyword() {
        int start = pos;
        while (pos < text.length()
                && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
            pos++;
        }
        String word = text.substring(start, pos);

        return switch (word.toUpperCase(Locale.ROOT)) {
            case "AND" -> new Token(TokenType.AND, "AND", start);
            case "OR" -> new Token(TokenType.OR, "OR", start);
            case "NOT" -> new Token(TokenType.NOT, "NOT", start);
            case "TRUE" -> new Token(TokenType.BOOL, Boolean.TRUE, start);
            case "FALSE" -> new Token(TokenType.BOOL, Boolean.FALSE, start);
            default -> new Token(TokenType.IDENTIFIER, word, start);
        };
    }
}
