package io.arbor.core.calculation;

import io.arbor.core.exception.EvaluationException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/// Mathematical operators available to calculation nodes.
///
/// Each operator declares its arity: unary and binary operators take exactly one or two
/// operands; variadic operators take two or more.
///
/// ### Domain errors
/// - `sqrt` of a negative number
/// - `reciprocal`, `divide`, `floor_divide`, `modulo` by zero
/// - `ln`, `log10`, `log` of a non-positive number; `log` base `<= 0` or `== 1`
/// - `asin`/`acos` outside `[-1, 1]`
/// - `geometric_mean` with a negative value; `harmonic_mean` with a non-positive value
///
/// `round` rounds half to even; `modulo` and `floor_divide` follow floor semantics so the
/// result takes the sign of the divisor.
///
/// @see Calculation
public enum CalculationOperator {
    NEGATE("negate", 1, 1, ops -> -ops[0]),
    ABS("abs", 1, 1, ops -> Math.abs(ops[0])),
    SQRT(
            "sqrt",
            1,
            1,
            ops -> {
                if (ops[0] < 0) {
                    throw error("sqrt", "Cannot compute square root of negative number: " + ops[0]);
                }
                return Math.sqrt(ops[0]);
            }),
    SQUARE("square", 1, 1, ops -> ops[0] * ops[0]),
    CUBE("cube", 1, 1, ops -> ops[0] * ops[0] * ops[0]),
    RECIPROCAL(
            "reciprocal",
            1,
            1,
            ops -> {
                if (ops[0] == 0) {
                    throw error("reciprocal", "Cannot compute reciprocal of zero");
                }
                return 1.0 / ops[0];
            }),
    FLOOR("floor", 1, 1, ops -> Math.floor(ops[0])),
    CEIL("ceil", 1, 1, ops -> Math.ceil(ops[0])),
    ROUND("round", 1, 1, ops -> Math.rint(ops[0])),
    SIGN("sign", 1, 1, ops -> Math.signum(ops[0])),
    LN(
            "ln",
            1,
            1,
            ops -> {
                if (ops[0] <= 0) {
                    throw error("ln", "Cannot compute natural log of non-positive number: " + ops[0]);
                }
                return Math.log(ops[0]);
            }),
    LOG10(
            "log10",
            1,
            1,
            ops -> {
                if (ops[0] <= 0) {
                    throw error("log10", "Cannot compute log10 of non-positive number: " + ops[0]);
                }
                return Math.log10(ops[0]);
            }),
    EXP("exp", 1, 1, ops -> Math.exp(ops[0])),
    SIN("sin", 1, 1, ops -> Math.sin(ops[0])),
    COS("cos", 1, 1, ops -> Math.cos(ops[0])),
    TAN("tan", 1, 1, ops -> Math.tan(ops[0])),
    ASIN(
            "asin",
            1,
            1,
            ops -> {
                if (ops[0] < -1 || ops[0] > 1) {
                    throw error("asin", "asin argument must be in [-1, 1], got: " + ops[0]);
                }
                return Math.asin(ops[0]);
            }),
    ACOS(
            "acos",
            1,
            1,
            ops -> {
                if (ops[0] < -1 || ops[0] > 1) {
                    throw error("acos", "acos argument must be in [-1, 1], got: " + ops[0]);
                }
                return Math.acos(ops[0]);
            }),
    ATAN("atan", 1, 1, ops -> Math.atan(ops[0])),
    DEGREES("degrees", 1, 1, ops -> Math.toDegrees(ops[0])),
    RADIANS("radians", 1, 1, ops -> Math.toRadians(ops[0])),

    SUBTRACT("subtract", 2, 2, ops -> ops[0] - ops[1]),
    DIVIDE(
            "divide",
            2,
            2,
            ops -> {
                if (ops[1] == 0) {
                    throw error("divide", "Division by zero");
                }
                return ops[0] / ops[1];
            }),
    FLOOR_DIVIDE(
            "floor_divide",
            2,
            2,
            ops -> {
                if (ops[1] == 0) {
                    throw error("floor_divide", "Floor division by zero");
                }
                return Math.floor(ops[0] / ops[1]);
            }),
    MODULO(
            "modulo",
            2,
            2,
            ops -> {
                if (ops[1] == 0) {
                    throw error("modulo", "Modulo by zero");
                }
                return ops[0] - ops[1] * Math.floor(ops[0] / ops[1]);
            }),
    POWER("power", 2, 2, ops -> Math.pow(ops[0], ops[1])),
    LOG(
            "log",
            2,
            2,
            ops -> {
                if (ops[0] <= 0) {
                    throw error("log", "Cannot compute log of non-positive number: " + ops[0]);
                }
                if (ops[1] <= 0 || ops[1] == 1) {
                    throw error("log", "Log base must be positive and != 1, got: " + ops[1]);
                }
                return Math.log(ops[0]) / Math.log(ops[1]);
            }),
    ATAN2("atan2", 2, 2, ops -> Math.atan2(ops[0], ops[1])),

    ADD("add", 2, -1, Statistics::sum),
    MULTIPLY("multiply", 2, -1, Statistics::product),
    MIN("min", 2, -1, ops -> Arrays.stream(ops).min().orElseThrow()),
    MAX("max", 2, -1, ops -> Arrays.stream(ops).max().orElseThrow()),
    SUM("sum", 2, -1, Statistics::sum),
    AVERAGE("average", 2, -1, Statistics::mean),
    HYPOT("hypot", 2, -1, Statistics::hypot),
    GEOMETRIC_MEAN(
            "geometric_mean",
            2,
            -1,
            ops -> {
                for (double x : ops) {
                    if (x < 0) {
                        throw error(
                                "geometric_mean",
                                "Cannot compute geometric mean with negative value: " + x);
                    }
                }
                return Statistics.geometricMean(ops);
            }),
    HARMONIC_MEAN(
            "harmonic_mean",
            2,
            -1,
            ops -> {
                for (double x : ops) {
                    if (x <= 0) {
                        throw error(
                                "harmonic_mean", "Harmonic mean requires positive values, got: " + x);
                    }
                }
                return Statistics.harmonicMean(ops);
            }),
    VARIANCE("variance", 2, -1, Statistics::variance),
    STD_DEV("std_dev", 2, -1, Statistics::stdDev),
    RANGE("range", 2, -1, Statistics::range);

    private final String wireName;
    private final int minArity;
    private final int maxArity;
    private final OperatorFunction function;

    CalculationOperator(String wireName, int minArity, int maxArity, OperatorFunction function) {
        this.wireName = wireName;
        this.minArity = minArity;
        this.maxArity = maxArity;
        this.function = function;
    }

    public String wireName() {
        return wireName;
    }

    public int minArity() {
        return minArity;
    }

    /// Returns the maximum operand count.
    ///
    /// @return the maximum, or -1 when unbounded
    public int maxArity() {
        return maxArity;
    }

    public boolean isVariadic() {
        return maxArity < 0;
    }

    /// Checks the operand count against this operator's arity.
    ///
    /// @param count number of operands supplied
    /// @return an error message, or empty if the count is acceptable
    public Optional<String> checkArity(int count) {
        if (count < minArity) {
            return Optional.of(
                    "Operator '"
                            + wireName
                            + "' requires at least "
                            + minArity
                            + " operand(s), got "
                            + count);
        }
        if (maxArity >= 0 && count > maxArity) {
            return Optional.of(
                    "Operator '"
                            + wireName
                            + "' accepts at most "
                            + maxArity
                            + " operand(s), got "
                            + count);
        }
        return Optional.empty();
    }

    /// Applies the operator after checking arity.
    ///
    /// @param operands operand values, not null
    /// @return the result
    /// @throws EvaluationException on an arity violation or a domain error
    public double apply(double... operands) throws EvaluationException {
        Optional<String> arityError = checkArity(operands.length);
        if (arityError.isPresent()) {
            throw new EvaluationException(arityError.get());
        }
        return function.apply(operands);
    }

    /// Looks up an operator by wire name, case-insensitively.
    ///
    /// @param name the wire name, may be null
    /// @return the operator, or empty if unknown
    public static Optional<CalculationOperator> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (CalculationOperator op : values()) {
            if (op.wireName.equals(normalized)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }

    /// Resolves an operator by name and applies it.
    ///
    /// @param name operator wire name, may be null
    /// @param operands operand values, not null
    /// @return the result
    /// @throws EvaluationException if the operator is unknown, the arity is wrong or the
    /// operands are outside the operator's domain
    public static double execute(String name, double... operands) throws EvaluationException {
        CalculationOperator op =
                fromWireName(name)
                        .orElseThrow(
                                () -> new EvaluationException("Unknown operator: '" + name + "'"));
        return op.apply(operands);
    }

    private static EvaluationException error(String operator, String message) {
        return new EvaluationException("Operator '" + operator + "' error: " + message);
    }

    @FunctionalInterface
    interface OperatorFunction {
        double apply(double[] operands) throws EvaluationException;
    }
}
