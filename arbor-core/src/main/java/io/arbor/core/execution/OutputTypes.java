package io.arbor.core.execution;

import io.arbor.core.exception.EvaluationException;
import java.util.Locale;
import java.util.Set;

/// Coercion of end-node output to its declared output type.
///
/// ### Casting rules
/// - `int` → `Long`
/// - `float`, `number` → `Double`
/// - `bool` → `Boolean`; text is true when it is one of `true/1/yes/on` (case-insensitive)
/// - `json` → decoded with the configured {@link ValueDecoder}; kept as text without one
/// - anything else → `String`
///
/// @implNote Stateless and thread-safe.
public final class OutputTypes {

    /// Text values that cast to `true` for `bool` output.
    public static final Set<String> TRUTHY_TEXT = Set.of("true", "1", "yes", "on");

    private OutputTypes() {}

    /// Returns whether a single-placeholder template of this type yields the raw value.
    ///
    /// @param outputType declared output type, may be null
    /// @return `true` for `int`, `float`, `number`, `bool` and `json`
    public static boolean keepsRawValue(String outputType) {
        return switch (normalize(outputType)) {
            case "int", "float", "number", "bool", "json" -> true;
            default -> false;
        };
    }

    /// Casts a value to the declared output type.
    ///
    /// @param outputType declared output type, may be null (treated as `string`)
    /// @param value the value to cast, may be null
    /// @param decoder decoder for `json` text, may be null
    /// @return the cast value
    /// @throws EvaluationException if the value cannot be represented in the type
    public static Object cast(String outputType, Object value, ValueDecoder decoder)
            throws EvaluationException {
        String type = normalize(outputType);
        return switch (type) {
            case "int" -> toLong(value);
            case "float", "number" -> toDouble(value);
            case "bool" -> toBoolean(value);
            case "json" -> {
                if (value instanceof String text && decoder != null) {
                    yield decoder.decode(text);
                }
                yield value;
            }
            default -> value == null ? "" : String.valueOf(value);
        };
    }

    /// Coerces a raw typed value without going through text, for single-placeholder
    /// templates.
    ///
    /// @param outputType declared output type, may be null
    /// @param value the raw variable value, may be null
    /// @param decoder decoder for `json` text, may be null
    /// @return the typed value
    /// @throws EvaluationException if the value cannot be represented in the type
    public static Object coerceRaw(String outputType, Object value, ValueDecoder decoder)
            throws EvaluationException {
        return switch (normalize(outputType)) {
            case "int" -> value instanceof Number n && !(value instanceof Boolean)
                    ? (Object) n.longValue()
                    : toLong(value);
            case "float", "number" -> value instanceof Number n && !(value instanceof Boolean)
                    ? (Object) n.doubleValue()
                    : toDouble(value);
            case "bool" -> value instanceof Boolean ? value : toBoolean(value);
            case "json" -> value;
            default -> cast(outputType, value, decoder);
        };
    }

    /// Returns the effective output type: the workflow-level type wins over the node's.
    ///
    /// @param workflowType workflow-level output type, may be null
    /// @param nodeType the end node's effective output type, not null
    /// @return the type to cast to, never null
    public static String effectiveType(String workflowType, String nodeType) {
        return workflowType != null && !workflowType.isBlank() ? workflowType : nodeType;
    }

    private static Long toLong(Object value) throws EvaluationException {
        if (value instanceof Number n && !(value instanceof Boolean)) {
            return n.longValue();
        }
        String text = String.valueOf(value).trim();
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new EvaluationException("Cannot cast output '" + value + "' to int", e);
        }
    }

    private static Double toDouble(Object value) throws EvaluationException {
        if (value instanceof Number n && !(value instanceof Boolean)) {
            return n.doubleValue();
        }
        String text = String.valueOf(value).trim();
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new EvaluationException("Cannot cast output '" + value + "' to number", e);
        }
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        return TRUTHY_TEXT.contains(String.valueOf(value).trim().toLowerCase(Locale.ROOT));
    }

    private static String normalize(String outputType) {
        return outputType == null ? "string" : outputType.trim().toLowerCase(Locale.ROOT);
    }
}
