package io.arbor.core.compiler;

import io.arbor.core.condition.ComparatorType;
import io.arbor.core.condition.Condition;
import io.arbor.core.condition.StructuredConditionEvaluator;
import io.arbor.core.exception.CompilationException;
import io.arbor.core.exception.ConditionSyntaxException;
import io.arbor.core.exception.EvaluationException;
import io.arbor.core.expression.ConditionParser;
import io.arbor.core.expression.Expr;
import io.arbor.core.expression.ExpressionOperator;
import java.util.Locale;
import java.util.Set;

/// Lowers decision conditions to Java boolean expressions.
///
/// Structured conditions use one template per comparator. Legacy label expressions are
/// parsed and compiled through the AST with static typing: numeric, string and boolean
/// operands compare directly; operands of unknown type go through the
/// {@link RuntimeHelper} functions that mirror the interpreter.
///
/// Anything the interpreter would reject for every input (unknown variable, unknown
/// comparator, a comparison between incompatible static types) fails with a
/// {@link CompilationException}.
final class ConditionCompiler {

    private record Typed(String code, JavaType type) {}

    private final Set<RuntimeHelper> helpers;

    /// @param helpers receives the runtime helpers the compiled expressions call
    ConditionCompiler(Set<RuntimeHelper> helpers) {
        this.helpers = helpers;
    }

    String compile(Condition condition, SymbolTable symbols) throws CompilationException {
        if (condition instanceof Condition.Structured structured) {
            return compileStructured(structured, symbols);
        }
        return compileExpression(((Condition.Expression) condition).text(), symbols);
    }

    // -- Structured ---------------------------------------------------------

    String compileStructured(Condition.Structured condition, SymbolTable symbols)
            throws CompilationException {
        String inputId = condition.inputId();
        if (inputId == null || inputId.isBlank()) {
            throw new CompilationException("Condition has no input_id");
        }
        SymbolTable.Symbol symbol =
                symbols.byIdFirst(inputId)
                        .orElseThrow(
                                () ->
                                        new CompilationException(
                                                "Unknown variable '" + inputId + "'"));
        ComparatorType comparator =
                ComparatorType.fromWireName(condition.comparator())
                        .orElseThrow(
                                () ->
                                        new CompilationException(
                                                "Unknown comparator: '"
                                                        + condition.comparator()
                                                        + "'"));

        return switch (comparator.family()) {
            case NUMERIC -> numeric(comparator, symbol, condition);
            case BOOLEAN -> bool(comparator, symbol);
            case STRING, ENUM -> text(comparator, symbol, condition.value());
            case DATE -> date(comparator, symbol, condition);
        };
    }

    private String numeric(
            ComparatorType comparator, SymbolTable.Symbol symbol, Condition.Structured condition)
            throws CompilationException {
        String left =
                switch (symbol.type()) {
                    case LONG, DOUBLE -> symbol.javaName();
                    case BOOLEAN -> throw new CompilationException(
                            "Numeric comparator '"
                                    + comparator.wireName()
                                    + "' cannot be applied to a boolean value");
                    default -> {
                        helpers.add(RuntimeHelper.TO_NUMBER);
                        yield "toNumber(" + symbol.javaName() + ")";
                    }
                };
        String right = numberLiteral(condition.value(), comparator);

        return switch (comparator) {
            case EQ -> "(Double.compare(" + left + ", " + right + ") == 0)";
            case NEQ -> "(Double.compare(" + left + ", " + right + ") != 0)";
            case LT -> "(" + left + " < " + right + ")";
            case LTE -> "(" + left + " <= " + right + ")";
            case GT -> "(" + left + " > " + right + ")";
            case GTE -> "(" + left + " >= " + right + ")";
            case WITHIN_RANGE -> {
                String upper = numberLiteral(requireSecondValue(condition, comparator), comparator);
                yield "(" + left + " >= " + right + " && " + left + " <= " + upper + ")";
            }
            default -> throw unsupported(comparator);
        };
    }

    private static String bool(ComparatorType comparator, SymbolTable.Symbol symbol)
            throws CompilationException {
        boolean expected = comparator == ComparatorType.IS_TRUE;
        return switch (symbol.type()) {
            case BOOLEAN -> expected ? symbol.javaName() : "!" + symbol.javaName();
            case OBJECT -> (expected ? "Boolean.TRUE" : "Boolean.FALSE")
                    + ".equals("
                    + symbol.javaName()
                    + ")";
            default -> throw new CompilationException(
                    "Comparator '" + comparator.wireName() + "' requires a boolean value");
        };
    }

    private static String text(
            ComparatorType comparator, SymbolTable.Symbol symbol, Object expected)
            throws CompilationException {
        String left =
                (symbol.type() == JavaType.STRING
                                ? symbol.javaName()
                                : "String.valueOf(" + symbol.javaName() + ")")
                        + ".toLowerCase(Locale.ROOT)";
        String right =
                CodeWriter.stringLiteral(
                        expected == null ? "" : String.valueOf(expected).toLowerCase(Locale.ROOT));

        return switch (comparator) {
            case STR_EQ, ENUM_EQ -> left + ".equals(" + right + ")";
            case STR_NEQ, ENUM_NEQ -> "!" + left + ".equals(" + right + ")";
            case STR_CONTAINS, ENUM_CONTAINS -> left + ".contains(" + right + ")";
            case STR_STARTS_WITH, ENUM_STARTS_WITH -> left + ".startsWith(" + right + ")";
            case STR_ENDS_WITH, ENUM_ENDS_WITH -> left + ".endsWith(" + right + ")";
            default -> throw unsupported(comparator);
        };
    }

    private String date(
            ComparatorType comparator, SymbolTable.Symbol symbol, Condition.Structured condition)
            throws CompilationException {
        String left =
                switch (symbol.type()) {
                    case STRING -> "toDateTime(" + symbol.javaName() + ")";
                    case OBJECT -> "toDateTime(String.valueOf(" + symbol.javaName() + "))";
                    default -> throw new CompilationException(
                            "Comparator '"
                                    + comparator.wireName()
                                    + "' requires an ISO-8601 date variable");
                };
        helpers.add(RuntimeHelper.TO_DATE_TIME);
        String right = dateLiteral(condition.value());

        return switch (comparator) {
            case DATE_EQ -> left + ".isEqual(" + right + ")";
            case DATE_BEFORE -> left + ".isBefore(" + right + ")";
            case DATE_AFTER -> left + ".isAfter(" + right + ")";
            case DATE_BETWEEN -> {
                String upper = dateLiteral(requireSecondValue(condition, comparator));
                yield "(!" + left + ".isBefore(" + right + ") && !" + left + ".isAfter(" + upper
                        + "))";
            }
            default -> throw unsupported(comparator);
        };
    }

    private static String numberLiteral(Object value, ComparatorType comparator)
            throws CompilationException {
        double number;
        if (value instanceof Boolean) {
            throw new CompilationException(
                    "Numeric comparator '"
                            + comparator.wireName()
                            + "' cannot be applied to a boolean value");
        } else if (value instanceof Number n) {
            number = n.doubleValue();
        } else if (value instanceof String s) {
            try {
                number = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new CompilationException(
                        "Numeric comparator '"
                                + comparator.wireName()
                                + "' cannot parse '"
                                + s
                                + "' as a number");
            }
        } else {
            throw new CompilationException(
                    "Numeric comparator '" + comparator.wireName() + "' requires a number value");
        }
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            throw new CompilationException("Comparison value is not a finite number: " + value);
        }
        return CodeWriter.doubleLiteral(number);
    }

    private static String dateLiteral(Object value) throws CompilationException {
        try {
            StructuredConditionEvaluator.toDateTime(value);
        } catch (EvaluationException e) {
            throw new CompilationException(e.getMessage());
        }
        return "toDateTime(" + CodeWriter.stringLiteral(String.valueOf(value)) + ")";
    }

    private static Object requireSecondValue(
            Condition.Structured condition, ComparatorType comparator)
            throws CompilationException {
        if (condition.value2() == null) {
            throw new CompilationException(
                    "Comparator '" + comparator.wireName() + "' requires value2");
        }
        return condition.value2();
    }

    private static CompilationException unsupported(ComparatorType comparator) {
        return new CompilationException("Unsupported comparator: '" + comparator.wireName() + "'");
    }

    // -- Legacy expressions -------------------------------------------------

    String compileExpression(String text, SymbolTable symbols) throws CompilationException {
        Expr expr;
        try {
            expr = ConditionParser.parse(text);
        } catch (ConditionSyntaxException e) {
            throw new CompilationException(e.getMessage());
        }
        return truthy(compileExpr(expr, symbols));
    }

    private Typed compileExpr(Expr expr, SymbolTable symbols) throws CompilationException {
        if (expr instanceof Expr.Literal literal) {
            return literal(literal.value());
        }
        if (expr instanceof Expr.VariableRef ref) {
            SymbolTable.Symbol symbol =
                    symbols.byNameFirst(ref.name())
                            .orElseThrow(
                                    () ->
                                            new CompilationException(
                                                    "Variable '"
                                                            + ref.name()
                                                            + "' not found in context"));
            return new Typed(symbol.javaName(), symbol.type());
        }
        if (expr instanceof Expr.UnaryOp unary) {
            return new Typed("!" + truthy(compileExpr(unary.operand(), symbols)), JavaType.BOOLEAN);
        }
        Expr.BinaryOp binary = (Expr.BinaryOp) expr;
        Typed left = compileExpr(binary.left(), symbols);
        Typed right = compileExpr(binary.right(), symbols);
        return switch (binary.operator()) {
            case AND -> new Typed(
                    "(" + truthy(left) + " && " + truthy(right) + ")", JavaType.BOOLEAN);
            case OR -> new Typed(
                    "(" + truthy(left) + " || " + truthy(right) + ")", JavaType.BOOLEAN);
            case EQ -> new Typed(equality(left, right), JavaType.BOOLEAN);
            case NEQ -> new Typed("!" + equality(left, right), JavaType.BOOLEAN);
            case GT, LT, GTE, LTE -> new Typed(
                    ordering(left, right, binary.operator()), JavaType.BOOLEAN);
            default -> throw new CompilationException(
                    "Unknown binary operator: " + binary.operator());
        };
    }

    private static Typed literal(Object value) throws CompilationException {
        if (value instanceof Long l) {
            return new Typed(CodeWriter.longLiteral(l), JavaType.LONG);
        }
        if (value instanceof Double d) {
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new CompilationException("Literal is not a finite number: " + d);
            }
            return new Typed(CodeWriter.doubleLiteral(d), JavaType.DOUBLE);
        }
        if (value instanceof Boolean b) {
            return new Typed(b.toString(), JavaType.BOOLEAN);
        }
        return new Typed(CodeWriter.stringLiteral(String.valueOf(value)), JavaType.STRING);
    }

    private String equality(Typed left, Typed right) {
        if (left.type() == JavaType.LONG && right.type() == JavaType.LONG) {
            return "(" + left.code() + " == " + right.code() + ")";
        }
        if (left.type().isNumeric() && right.type().isNumeric()) {
            return "(Double.compare(" + left.code() + ", " + right.code() + ") == 0)";
        }
        if (left.type() == JavaType.BOOLEAN && right.type() == JavaType.BOOLEAN) {
            return "(" + left.code() + " == " + right.code() + ")";
        }
        if (left.type() == JavaType.STRING && right.type() == JavaType.STRING) {
            return "Objects.equals(" + left.code() + ", " + right.code() + ")";
        }
        helpers.add(RuntimeHelper.VALUES_EQUAL);
        return "valuesEqual(" + left.code() + ", " + right.code() + ")";
    }

    private String ordering(Typed left, Typed right, ExpressionOperator operator)
            throws CompilationException {
        String op = operator.symbol();
        if (left.type().isNumeric() && right.type().isNumeric()) {
            return "(" + left.code() + " " + op + " " + right.code() + ")";
        }
        if (left.type() == JavaType.STRING && right.type() == JavaType.STRING) {
            return "(" + left.code() + ".compareTo(" + right.code() + ") " + op + " 0)";
        }
        if (left.type() == JavaType.BOOLEAN && right.type() == JavaType.BOOLEAN) {
            return "(Boolean.compare(" + left.code() + ", " + right.code() + ") " + op + " 0)";
        }
        if (left.type() == JavaType.OBJECT || right.type() == JavaType.OBJECT) {
            helpers.add(RuntimeHelper.COMPARE_VALUES);
            return "(compareValues("
                    + left.code()
                    + ", "
                    + right.code()
                    + ", "
                    + CodeWriter.stringLiteral(op)
                    + ") "
                    + op
                    + " 0)";
        }
        throw new CompilationException(
                "Cannot compare "
                        + boxedName(left.type())
                        + " and "
                        + boxedName(right.type())
                        + " with operator '"
                        + op
                        + "'");
    }

    private String truthy(Typed value) {
        return switch (value.type()) {
            case BOOLEAN -> value.code();
            case LONG -> "(" + value.code() + " != 0L)";
            case DOUBLE -> "(" + value.code() + " != 0.0)";
            case STRING -> "(" + value.code() + " != null && !" + value.code() + ".isEmpty())";
            case OBJECT -> {
                helpers.add(RuntimeHelper.IS_TRUTHY);
                yield "isTruthy(" + value.code() + ")";
            }
        };
    }

    private static String boxedName(JavaType type) {
        return switch (type) {
            case LONG -> "Long";
            case DOUBLE -> "Double";
            case BOOLEAN -> "Boolean";
            case STRING -> "String";
            case OBJECT -> "Object";
        };
    }
}
