package io.arbor.core.condition;

import io.arbor.core.exception.EvaluationException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/// Type-checked evaluator for {@link Condition.Structured} conditions.
///
/// Resolves `input_id` in the context, then dispatches on the comparator. The outcome
/// depends only on `context.get(inputId)` and the condition's value(s).
///
/// ### Comparison rules
/// - Numeric comparators accept numbers and numeric strings; booleans are rejected
/// - `within_range` and `date_between` include both bounds
/// - String and enum comparators ignore case
/// - Dates are ISO-8601, with or without a time part; a date without time is midnight
///
/// @implNote Stateless and thread-safe.
/// @see ComparatorType
public class StructuredConditionEvaluator {

    /// Evaluates a structured condition.
    ///
    /// @param condition the condition, not null
    /// @param context variable values keyed by variable id, not null
    /// @return the comparison outcome
    /// @throws EvaluationException if the variable is missing, the comparator is unknown,
    /// or a value has the wrong type or cannot be parsed
    public boolean evaluate(Condition.Structured condition, Map<String, Object> context)
            throws EvaluationException {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(context, "context must not be null");

        String inputId = condition.inputId();
        if (inputId == null || !context.containsKey(inputId)) {
            throw new EvaluationException("Variable '" + inputId + "' not found in context");
        }
        Object actual = context.get(inputId);

        ComparatorType comparator =
                ComparatorType.fromWireName(condition.comparator())
                        .orElseThrow(
                                () ->
                                        new EvaluationException(
                                                "Unknown comparator: '"
                                                        + condition.comparator()
                                                        + "'"));

        return switch (comparator.family()) {
            case NUMERIC -> evaluateNumeric(comparator, actual, condition);
            case BOOLEAN -> evaluateBoolean(comparator, actual);
            case STRING, ENUM -> evaluateText(comparator, actual, condition.value());
            case DATE -> evaluateDate(comparator, actual, condition);
        };
    }

    private boolean evaluateNumeric(
            ComparatorType comparator, Object actual, Condition.Structured condition)
            throws EvaluationException {
        double left = toNumber(actual, comparator);
        double right = toNumber(condition.value(), comparator);

        return switch (comparator) {
            case EQ -> Double.compare(left, right) == 0;
            case NEQ -> Double.compare(left, right) != 0;
            case LT -> left < right;
            case LTE -> left <= right;
            case GT -> left > right;
            case GTE -> left >= right;
            case WITHIN_RANGE -> {
                double upper = toNumber(requireSecondValue(condition, comparator), comparator);
                yield left >= right && left <= upper;
            }
            default -> throw unsupported(comparator);
        };
    }

    private boolean evaluateBoolean(ComparatorType comparator, Object actual)
            throws EvaluationException {
        if (!(actual instanceof Boolean flag)) {
            throw new EvaluationException(
                    "Comparator '"
                            + comparator.wireName()
                            + "' requires a boolean value, got "
                            + typeName(actual));
        }
        return comparator == ComparatorType.IS_TRUE ? flag : !flag;
    }

    private boolean evaluateText(ComparatorType comparator, Object actual, Object expected)
            throws EvaluationException {
        if (actual == null) {
            throw new EvaluationException(
                    "Comparator '" + comparator.wireName() + "' requires a value, got null");
        }
        String left = String.valueOf(actual).toLowerCase(Locale.ROOT);
        String right = expected == null ? "" : String.valueOf(expected).toLowerCase(Locale.ROOT);

        return switch (comparator) {
            case STR_EQ, ENUM_EQ -> left.equals(right);
            case STR_NEQ, ENUM_NEQ -> !left.equals(right);
            case STR_CONTAINS, ENUM_CONTAINS -> left.contains(right);
            case STR_STARTS_WITH, ENUM_STARTS_WITH -> left.startsWith(right);
            case STR_ENDS_WITH, ENUM_ENDS_WITH -> left.endsWith(right);
            default -> throw unsupported(comparator);
        };
    }

    private boolean evaluateDate(
            ComparatorType comparator, Object actual, Condition.Structured condition)
            throws EvaluationException {
        LocalDateTime left = toDateTime(actual);
        LocalDateTime right = toDateTime(condition.value());

        return switch (comparator) {
            case DATE_EQ -> left.isEqual(right);
            case DATE_BEFORE -> left.isBefore(right);
            case DATE_AFTER -> left.isAfter(right);
            case DATE_BETWEEN -> {
                LocalDateTime upper = toDateTime(requireSecondValue(condition, comparator));
                yield !left.isBefore(right) && !left.isAfter(upper);
            }
            default -> throw unsupported(comparator);
        };
    }

    private static Object requireSecondValue(
            Condition.Structured condition, ComparatorType comparator)
            throws EvaluationException {
        if (condition.value2() == null) {
            throw new EvaluationException(
                    "Comparator '" + comparator.wireName() + "' requires value2");
        }
        return condition.value2();
    }

    private static double toNumber(Object value, ComparatorType comparator)
            throws EvaluationException {
        if (value instanceof Boolean) {
            throw new EvaluationException(
                    "Numeric comparator '"
                            + comparator.wireName()
                            + "' cannot be applied to a boolean value");
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new EvaluationException(
                        "Numeric comparator '"
                                + comparator.wireName()
                                + "' cannot parse '"
                                + s
                                + "' as a number",
                        e);
            }
        }
        throw new EvaluationException(
                "Numeric comparator '"
                        + comparator.wireName()
                        + "' requires a number, got "
                        + typeName(value));
    }

    /// Parses an ISO-8601 date or date-time.
    ///
    /// @param value a `String`, `LocalDate` or `LocalDateTime`, may be null
    /// @return the value as a local date-time (midnight for plain dates), never null
    /// @throws EvaluationException if the value is not a recognizable ISO-8601 date
    public static LocalDateTime toDateTime(Object value) throws EvaluationException {
        if (value instanceof LocalDateTime dateTime) {
            return dateTime;
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay();
        }
        if (!(value instanceof String text)) {
            throw new EvaluationException(
                    "Expected an ISO-8601 date, got " + typeName(value));
        }
        String trimmed = text.trim();
        try {
            if (trimmed.length() <= 10) {
                return LocalDate.parse(trimmed).atStartOfDay();
            }
            try {
                return LocalDateTime.parse(trimmed);
            } catch (DateTimeParseException e) {
                return OffsetDateTime.parse(trimmed).toLocalDateTime();
            }
        } catch (DateTimeParseException e) {
            throw new EvaluationException("Invalid ISO-8601 date: '" + text + "'", e);
        }
    }

    private static EvaluationException unsupported(ComparatorType comparator) {
        return new EvaluationException("Unsupported comparator: '" + comparator.wireName() + "'");
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
