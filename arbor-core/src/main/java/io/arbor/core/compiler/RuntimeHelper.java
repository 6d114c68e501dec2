package io.arbor.core.compiler;

import java.util.List;

/// Private static helper methods that generated classes may need.
///
/// Each helper is emitted at most once per class, after the workflow methods, together with
/// the helpers it depends on. Their bodies mirror the interpreter's evaluation rules so the
/// generated code returns what the interpreter returns.
enum RuntimeHelper {
    IS_INTEGRAL(
            """
            private static boolean isIntegral(Object value) {
                return value instanceof Long || value instanceof Integer
                        || value instanceof Short || value instanceof Byte;
            }
            """),
    IS_TRUTHY(
            """
            private static boolean isTruthy(Object value) {
                if (value == null) {
                    return false;
                }
                if (value instanceof Boolean) {
                    return (Boolean) value;
                }
                if (value instanceof Number) {
                    return ((Number) value).doubleValue() != 0.0;
                }
                if (value instanceof String) {
                    return !((String) value).isEmpty();
                }
                return true;
            }
            """),
    VALUES_EQUAL(
            """
            private static boolean valuesEqual(Object left, Object right) {
                if (left instanceof Number && right instanceof Number) {
                    Number l = (Number) left;
                    Number r = (Number) right;
                    if (isIntegral(l) && isIntegral(r)) {
                        return l.longValue() == r.longValue();
                    }
                    return Double.compare(l.doubleValue(), r.doubleValue()) == 0;
                }
                return java.util.Objects.equals(left, right);
            }
            """,
            IS_INTEGRAL),
    COMPARE_VALUES(
            """
            private static int compareValues(Object left, Object right, String operator) {
                if (left instanceof Number && right instanceof Number) {
                    Number l = (Number) left;
                    Number r = (Number) right;
                    return isIntegral(l) && isIntegral(r)
                            ? Long.compare(l.longValue(), r.longValue())
                            : Double.compare(l.doubleValue(), r.doubleValue());
                }
                if (left instanceof String && right instanceof String) {
                    return ((String) left).compareTo((String) right);
                }
                if (left instanceof Boolean && right instanceof Boolean) {
                    return Boolean.compare((Boolean) left, (Boolean) right);
                }
                throw new IllegalStateException("Cannot compare " + left + " and " + right
                        + " with operator '" + operator + "'");
            }
            """,
            IS_INTEGRAL),
    TO_NUMBER(
            """
            private static double toNumber(Object value) {
                if (value instanceof Boolean) {
                    throw new IllegalStateException(
                            "Numeric comparator cannot be applied to a boolean value");
                }
                if (value instanceof Number) {
                    return ((Number) value).doubleValue();
                }
                if (value instanceof String) {
                    return Double.parseDouble(((String) value).trim());
                }
                throw new IllegalStateException(
                        "Numeric comparator requires a number, got " + value);
            }
            """),
    TO_DATE_TIME(
            """
            private static java.time.LocalDateTime toDateTime(String text) {
                String trimmed = text.trim();
                if (trimmed.length() <= 10) {
                    return java.time.LocalDate.parse(trimmed).atStartOfDay();
                }
                try {
                    return java.time.LocalDateTime.parse(trimmed);
                } catch (java.time.format.DateTimeParseException e) {
                    return java.time.OffsetDateTime.parse(trimmed).toLocalDateTime();
                }
            }
            """),
    TO_LONG(
            """
            private static Long toLong(Object value) {
                if (value instanceof Number && !(value instanceof Boolean)) {
                    return ((Number) value).longValue();
                }
                return Long.parseLong(String.valueOf(value).trim());
            }
            """),
    TO_DOUBLE(
            """
            private static Double toDouble(Object value) {
                if (value instanceof Number && !(value instanceof Boolean)) {
                    return ((Number) value).doubleValue();
                }
                return Double.parseDouble(String.valueOf(value).trim());
            }
            """),
    TO_BOOL(
            """
            private static Boolean toBool(Object value) {
                if (value instanceof Boolean) {
                    return (Boolean) value;
                }
                String text = String.valueOf(value).trim().toLowerCase(java.util.Locale.ROOT);
                return text.equals("true") || text.equals("1")
                        || text.equals("yes") || text.equals("on");
            }
            """),
    HYPOT(
            """
            private static double hypot(double... values) {
                double squares = 0.0;
                for (double v : values) {
                    squares += v * v;
                }
                return Math.sqrt(squares);
            }
            """),
    GEOMETRIC_MEAN(
            """
            private static double geometricMean(double... values) {
                double logSum = 0.0;
                for (double v : values) {
                    if (v == 0) {
                        return 0.0;
                    }
                    logSum += Math.log(v);
                }
                return Math.exp(logSum / values.length);
            }
            """),
    HARMONIC_MEAN(
            """
            private static double harmonicMean(double... values) {
                double reciprocalSum = 0.0;
                for (double v : values) {
                    reciprocalSum += 1.0 / v;
                }
                return values.length / reciprocalSum;
            }
            """),
    VARIANCE(
            """
            private static double variance(double... values) {
                double total = 0.0;
                for (double v : values) {
                    total += v;
                }
                double mean = total / values.length;
                double squared = 0.0;
                for (double v : values) {
                    squared += (v - mean) * (v - mean);
                }
                return squared / (values.length - 1);
            }
            """),
    STD_DEV(
            """
            private static double stdDev(double... values) {
                return Math.sqrt(variance(values));
            }
            """,
            VARIANCE),
    RANGE(
            """
            private static double range(double... values) {
                double min = values[0];
                double max = values[0];
                for (double v : values) {
                    min = Math.min(min, v);
                    max = Math.max(max, v);
                }
                return max - min;
            }
            """);

    private final String source;
    private final List<RuntimeHelper> dependencies;

    RuntimeHelper(String source, RuntimeHelper... dependencies) {
        this.source = source;
        this.dependencies = List.of(dependencies);
    }

    String source() {
        return source;
    }

    List<RuntimeHelper> dependencies() {
        return dependencies;
    }
}
