package io.arbor.core.compiler;

import io.arbor.core.workflow.Identifiers;
import java.util.HashSet;
import java.util.Set;

/// Allocates unique, legal Java identifiers from friendly names.
///
/// Names are slugified; a leading digit or a reserved word gets a `var_` prefix and
/// collisions get a `_2`, `_3`, ... suffix. One resolver per generated method.
public final class JavaNameResolver {

    static final Set<String> RESERVED =
            Set.of(
                    "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char",
                    "class", "const", "continue", "default", "do", "double", "else", "enum",
                    "extends", "final", "finally", "float", "for", "goto", "if", "implements",
                    "import", "instanceof", "int", "interface", "long", "native", "new",
                    "package", "private", "protected", "public", "return", "short", "static",
                    "strictfp", "super", "switch", "synchronized", "this", "throw", "throws",
                    "transient", "try", "void", "volatile", "while", "true", "false", "null",
                    "var", "record", "yield", "sealed", "permits");

    private final Set<String> used = new HashSet<>();

    /// Returns a fresh identifier for the name.
    ///
    /// @param friendlyName the variable's friendly name, may be null
    /// @return an identifier not returned before by this resolver, never null
    public String allocate(String friendlyName) {
        String base = sanitize(friendlyName);
        String candidate = base;
        int counter = 2;
        while (!used.add(candidate)) {
            candidate = base + "_" + counter++;
        }
        return candidate;
    }

    /// Converts a name to a legal Java identifier without reserving it.
    ///
    /// @param name the name, may be null
    /// @return identifier, never null or empty
    public static String sanitize(String name) {
        String slug = Identifiers.slugify(name);
        if (slug.isEmpty()) {
            return "var";
        }
        if (Character.isDigit(slug.charAt(0)) || RESERVED.contains(slug)) {
            return "var_" + slug;
        }
        return slug;
    }
}
