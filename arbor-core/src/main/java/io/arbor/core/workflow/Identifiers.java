package io.arbor.core.workflow;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/// Naming helpers shared by the interpreter, validator and compiler.
///
/// ### Derived variable ids
/// - Calculation output: `var_calc_{slug}_number`
/// - Sub-workflow output: `var_sub_{slug}_{type}`
///
/// where `slug` is the lowercased name with every run of characters outside `[a-z0-9]`
/// replaced by `_` and leading/trailing underscores stripped.
public final class Identifiers {

    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private Identifiers() {}

    /// Converts a friendly name to a slug.
    ///
    /// @param name the name, may be null
    /// @return slug, never null (empty for null or symbol-only names)
    public static String slugify(String name) {
        if (name == null) {
            return "";
        }
        String slug = NON_ALNUM.matcher(name.toLowerCase(Locale.ROOT)).replaceAll("_");
        int start = 0;
        int end = slug.length();
        while (start < end && slug.charAt(start) == '_') {
            start++;
        }
        while (end > start && slug.charAt(end - 1) == '_') {
            end--;
        }
        return slug.substring(start, end);
    }

    /// Returns the derived variable id for a calculation output.
    ///
    /// @param outputName the calculation's output name, not null
    /// @return derived id, never null
    public static String calculationVariableId(String outputName) {
        return "var_calc_" + slugify(outputName) + "_number";
    }

    /// Returns the derived variable id for a sub-workflow output.
    ///
    /// @param outputVariable the subprocess node's output variable name, not null
    /// @param typeName inferred value type (`bool`, `int`, `float`, `string`, `json`), not null
    /// @return derived id, never null
    public static String subprocessVariableId(String outputVariable, String typeName) {
        return "var_sub_" + slugify(outputVariable) + "_" + typeName;
    }

    /// Infers the wire type name of a runtime value.
    ///
    /// @param value the value, may be null
    /// @return one of `bool`, `int`, `float`, `string`, `json`
    public static String inferTypeName(Object value) {
        if (value instanceof Boolean) {
            return "bool";
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short) {
            return "int";
        }
        if (value instanceof Number) {
            return "float";
        }
        if (value instanceof Map || value instanceof List) {
            return "json";
        }
        return "string";
    }

    /// Returns whether the text is a plain identifier (`[A-Za-z_][A-Za-z0-9_]*`).
    ///
    /// @param text the candidate, may be null
    /// @return `true` for a non-null identifier
    public static boolean isIdentifier(String text) {
        return text != null && IDENTIFIER.matcher(text).matches();
    }
}
