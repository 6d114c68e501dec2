package io.arbor.core.expression;

import io.arbor.core.exception.EvaluationException;
import java.util.Map;
import java.util.Objects;

/// Evaluates legacy expression trees against a name-to-value context.
///
/// ### Semantics
/// - `VariableRef` resolves by friendly name; a missing name is an error
/// - `AND`/`OR` short-circuit and coerce operands by truthiness
/// - `==`/`!=` compare numbers by value regardless of `Long`/`Double` representation
/// - Ordering operators accept number/number, string/string (lexicographic) and
/// boolean/boolean pairs; any other pairing fails
///
/// Truthiness: `null` and `false` are false, numbers are true when non-zero, strings are
/// true when non-empty; anything else is true.
///
/// @implNote Stateless and thread-safe.
/// @see ConditionParser
public class ExpressionEvaluator {

    /// Evaluates an expression and coerces the outcome to a boolean.
    ///
    /// @param expr the parsed expression, not null
    /// @param context variable values keyed by friendly name, not null
    /// @return the truthiness of the result
    /// @throws EvaluationException if a variable is missing or operand types are incompatible
    public boolean evaluate(Expr expr, Map<String, Object> context) throws EvaluationException {
        return isTruthy(evaluateValue(expr, context));
    }

    /// Evaluates an expression to its raw value.
    ///
    /// @param expr the parsed expression, not null
    /// @param context variable values keyed by friendly name, not null
    /// @return the value, may be null when a variable is bound to null
    /// @throws EvaluationException if a variable is missing or operand types are incompatible
    public Object evaluateValue(Expr expr, Map<String, Object> context)
            throws EvaluationException {
        Objects.requireNonNull(expr, "expr must not be null");
        Objects.requireNonNull(context, "context must not be null");

        if (expr instanceof Expr.Literal literal) {
            return literal.value();
        }
        if (expr instanceof Expr.VariableRef ref) {
            if (!context.containsKey(ref.name())) {
                throw new EvaluationException(
                        "Variable '" + ref.name() + "' not found in context");
            }
            return context.get(ref.name());
        }
        if (expr instanceof Expr.UnaryOp unary) {
            if (unary.operator() != ExpressionOperator.NOT) {
                throw new EvaluationException("Unknown unary operator: " + unary.operator());
            }
            return !isTruthy(evaluateValue(unary.operand(), context));
        }
        if (expr instanceof Expr.BinaryOp binary) {
            return evaluateBinary(binary, context);
        }
        throw new EvaluationException("Unknown expression type: " + expr.getClass().getName());
    }

    private Object evaluateBinary(Expr.BinaryOp expr, Map<String, Object> context)
            throws EvaluationException {
        if (expr.operator() == ExpressionOperator.AND) {
            return isTruthy(evaluateValue(expr.left(), context))
                    && isTruthy(evaluateValue(expr.right(), context));
        }
        if (expr.operator() == ExpressionOperator.OR) {
            return isTruthy(evaluateValue(expr.left(), context))
                    || isTruthy(evaluateValue(expr.right(), context));
        }

        Object left = evaluateValue(expr.left(), context);
        Object right = evaluateValue(expr.right(), context);

        return switch (expr.operator()) {
            case EQ -> valuesEqual(left, right);
            case NEQ -> !valuesEqual(left, right);
            case GT, LT, GTE, LTE -> compare(left, right, expr.operator());
            default -> throw new EvaluationException("Unknown binary operator: " + expr.operator());
        };
    }

    /// Applies truthiness coercion.
    ///
    /// @param value any value, may be null
    /// @return the boolean interpretation of the value
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        return true;
    }

    static boolean valuesEqual(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            if (isIntegral(l) && isIntegral(r)) {
                return l.longValue() == r.longValue();
            }
            return Double.compare(l.doubleValue(), r.doubleValue()) == 0;
        }
        return Objects.equals(left, right);
    }

    private static boolean compare(Object left, Object right, ExpressionOperator operator)
            throws EvaluationException {
        int cmp;
        if (left instanceof Number l && right instanceof Number r) {
            cmp = isIntegral(l) && isIntegral(r)
                    ? Long.compare(l.longValue(), r.longValue())
                    : Double.compare(l.doubleValue(), r.doubleValue());
        } else if (left instanceof String l && right instanceof String r) {
            cmp = l.compareTo(r);
        } else if (left instanceof Boolean l && right instanceof Boolean r) {
            cmp = Boolean.compare(l, r);
        } else {
            throw new EvaluationException(
                    "Cannot compare "
                            + typeName(left)
                            + " and "
                            + typeName(right)
                            + " with operator '"
                            + operator.symbol()
                            + "'");
        }

        return switch (operator) {
            case GT -> cmp > 0;
            case LT -> cmp < 0;
            case GTE -> cmp >= 0;
            case LTE -> cmp <= 0;
            default -> throw new EvaluationException("Not an ordering operator: " + operator);
        };
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
