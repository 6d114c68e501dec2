package io.arbor.core.execution;

import io.arbor.core.condition.StructuredConditionEvaluator;
import io.arbor.core.exception.EvaluationException;
import io.arbor.core.exception.InterpreterException;
import io.arbor.core.workflow.ValueRange;
import io.arbor.core.workflow.Variable;
import io.arbor.core.workflow.VariableType;
import io.arbor.core.workflow.Workflow;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/// Checks caller-supplied inputs against the workflow's declared input variables.
///
/// Inputs may be keyed by variable id or by friendly name. Integral values are widened to
/// `Long` and float/number values to `Double` so downstream code sees one representation.
final class InputValidator {

    /// Validates and normalizes inputs.
    ///
    /// @return input values keyed by variable id
    /// @throws InterpreterException on the first missing, mistyped or out-of-range input
    Map<String, Object> validate(Workflow workflow, Map<String, Object> inputs)
            throws InterpreterException {
        Map<String, Object> normalized = new LinkedHashMap<>();
        for (Variable variable : workflow.inputVariables()) {
            String id = variable.getId();
            Object value;
            if (inputs.containsKey(id)) {
                value = inputs.get(id);
            } else if (inputs.containsKey(variable.getName())) {
                value = inputs.get(variable.getName());
            } else {
                throw new InterpreterException("Missing required input: " + id);
            }
            normalized.put(id, check(variable, value));
        }
        return normalized;
    }

    private Object check(Variable variable, Object value) throws InterpreterException {
        String id = variable.getId();
        Object typed =
                switch (variable.getType()) {
                    case INT -> {
                        if (!isIntegral(value)) {
                            throw typeError(variable, value);
                        }
                        yield ((Number) value).longValue();
                    }
                    case FLOAT, NUMBER -> {
                        if (!(value instanceof Number) || value instanceof Boolean) {
                            throw typeError(variable, value);
                        }
                        yield ((Number) value).doubleValue();
                    }
                    case BOOL -> {
                        if (!(value instanceof Boolean)) {
                            throw typeError(variable, value);
                        }
                        yield value;
                    }
                    case STRING, ENUM -> {
                        if (!(value instanceof String)) {
                            throw new InterpreterException(
                                    id + " must be string, got " + typeName(value));
                        }
                        yield value;
                    }
                    case DATE -> {
                        if (!(value instanceof String)
                                && !(value instanceof LocalDate)
                                && !(value instanceof LocalDateTime)) {
                            throw new InterpreterException(id + " must be an ISO-8601 date");
                        }
                        try {
                            StructuredConditionEvaluator.toDateTime(value);
                        } catch (EvaluationException e) {
                            throw new InterpreterException(id + " must be an ISO-8601 date", e);
                        }
                        yield value;
                    }
                    case JSON -> value;
                };

        if (variable.getType().isNumeric() && variable.getRange() != null) {
            checkRange(id, ((Number) typed).doubleValue(), variable.getRange());
        }
        if (variable.getType() == VariableType.ENUM
                && !variable.getEnumValues().isEmpty()
                && !variable.getEnumValues().contains(typed)) {
            throw new InterpreterException(
                    "Value error: "
                            + id
                            + " must be one of "
                            + variable.getEnumValues()
                            + ", got '"
                            + typed
                            + "'");
        }
        return typed;
    }

    private static void checkRange(String id, double value, ValueRange range)
            throws InterpreterException {
        if (range.min() != null && value < range.min()) {
            throw new InterpreterException(
                    "Value error: "
                            + id
                            + "="
                            + formatNumber(value)
                            + " below minimum "
                            + formatNumber(range.min()));
        }
        if (range.max() != null && value > range.max()) {
            throw new InterpreterException(
                    "Value error: "
                            + id
                            + "="
                            + formatNumber(value)
                            + " exceeds maximum "
                            + formatNumber(range.max()));
        }
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Long
                || value instanceof Integer
                || value instanceof Short
                || value instanceof Byte
                || (value instanceof BigInteger big && big.bitLength() < 64);
    }

    private static InterpreterException typeError(Variable variable, Object value) {
        return new InterpreterException(
                variable.getId()
                        + " must be "
                        + variable.getType().wireName()
                        + ", got "
                        + typeName(value));
    }

    static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
