package io.arbor.core.expression;

import io.arbor.core.exception.ConditionSyntaxException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// Recursive-descent parser for legacy condition strings.
///
/// ### Grammar
/// ```
/// or_expr    := and_expr ('OR' and_expr)*
/// and_expr   := not_expr ('AND' not_expr)*
/// not_expr   := 'NOT' not_expr | comparison
/// comparison := term (('>=' | '<=' | '==' | '!=' | '>' | '<') term)?
/// term       := IDENTIFIER | NUMBER | STRING | BOOL | '(' or_expr ')'
/// ```
///
/// `NOT` is right-associative and binds tighter than `AND`/`OR`; parentheses reset
/// precedence.
///
/// ### Usage
/// {@snippet :
/// Expr expr = ConditionParser.parse("BMI >= 18.5 AND BMI < 25");
/// boolean result = new ExpressionEvaluator().evaluate(expr, Map.of("BMI", 22.0));
/// }
///
/// @implNote Instances are single-use. Use {@link #parse(String)} for one-shot parsing.
/// @see ConditionLexer
/// @see ExpressionEvaluator
public final class ConditionParser {

    private final String source;
    private final List<Token> tokens;
    private int index;

    private ConditionParser(String source, List<Token> tokens) {
        this.source = source;
        this.tokens = tokens;
        this.index = 0;
    }

    /// Parses a condition string into an expression tree.
    ///
    /// @param condition the condition text, may be null
    /// @return the parsed expression, never null
    /// @throws ConditionSyntaxException if the text is blank, cannot be tokenized, is
    /// missing an operand or closing parenthesis, or has trailing tokens
    public static Expr parse(String condition) throws ConditionSyntaxException {
        if (condition == null || condition.isBlank()) {
            throw new ConditionSyntaxException("Empty condition string", condition, 0);
        }
        List<Token> tokens = new ConditionLexer(condition).tokenize();
        ConditionParser parser = new ConditionParser(condition, tokens);
        Expr expr = parser.parseOr();
        Token trailing = parser.current();
        if (trailing.type() != TokenType.EOF) {
            throw new ConditionSyntaxException(
                    "Unexpected token " + trailing.type() + " at position " + trailing.position(),
                    condition,
                    trailing.position());
        }
        return expr;
    }

    /// Collects the distinct variable names referenced by an expression, in order of
    /// first appearance.
    ///
    /// @param expr the expression to scan, not null
    /// @return referenced names, never null
    public static Set<String> referencedNames(Expr expr) {
        Set<String> names = new LinkedHashSet<>();
        collectNames(expr, names);
        return names;
    }

    private static void collectNames(Expr expr, Set<String> names) {
        if (expr instanceof Expr.VariableRef ref) {
            names.add(ref.name());
        } else if (expr instanceof Expr.BinaryOp op) {
            collectNames(op.left(), names);
            collectNames(op.right(), names);
        } else if (expr instanceof Expr.UnaryOp op) {
            collectNames(op.operand(), names);
        }
    }

    private Token current() {
        return index < tokens.size() ? tokens.get(index) : tokens.get(tokens.size() - 1);
    }

    private void advance() {
        if (index < tokens.size()) {
            index++;
        }
    }

    private Token expect(TokenType type) throws ConditionSyntaxException {
        Token token = current();
        if (token.type() != type) {
            throw new ConditionSyntaxException(
                    "Expected " + type + ", got " + token.type() + " at position "
                            + token.position(),
                    source,
                    token.position());
        }
        advance();
        return token;
    }

    private Expr parseOr() throws ConditionSyntaxException {
        Expr left = parseAnd();
        while (current().type() == TokenType.OR) {
            advance();
            left = new Expr.BinaryOp(left, ExpressionOperator.OR, parseAnd());
        }
        return left;
    }

    private Expr parseAnd() throws ConditionSyntaxException {
        Expr left = parseNot();
        while (current().type() == TokenType.AND) {
            advance();
            left = new Expr.BinaryOp(left, ExpressionOperator.AND, parseNot());
        }
        return left;
    }

    private Expr parseNot() throws ConditionSyntaxException {
        if (current().type() == TokenType.NOT) {
            advance();
            return new Expr.UnaryOp(ExpressionOperator.NOT, parseNot());
        }
        return parseComparison();
    }

    private Expr parseComparison() throws ConditionSyntaxException {
        Expr left = parseTerm();
        TokenType type = current().type();
        if (type.isComparison()) {
            advance();
            return new Expr.BinaryOp(left, ExpressionOperator.fromComparison(type), parseTerm());
        }
        return left;
    }

    private Expr parseTerm() throws ConditionSyntaxException {
        Token token = current();
        switch (token.type()) {
            case LPAREN -> {
                advance();
                Expr inner = parseOr();
                expect(TokenType.RPAREN);
                return inner;
            }
            case IDENTIFIER -> {
                advance();
                return new Expr.VariableRef((String) token.value());
            }
            case NUMBER, STRING, BOOL -> {
                advance();
                return new Expr.Literal(token.value());
            }
            default ->
                    throw new ConditionSyntaxException(
                            "Expected operand, got " + token.type() + " at position "
                                    + token.position(),
                            source,
                            token.position());
        }
    }
}
