package io.arbor.core.compiler;

import io.arbor.core.workflow.VariableType;

/// Static Java type of a value in generated code.
enum JavaType {
    LONG("long"),
    DOUBLE("double"),
    BOOLEAN("boolean"),
    STRING("String"),
    OBJECT("Object");

    private final String declaration;

    JavaType(String declaration) {
        this.declaration = declaration;
    }

    /// @return the type as written in a declaration
    String declaration() {
        return declaration;
    }

    boolean isNumeric() {
        return this == LONG || this == DOUBLE;
    }

    /// Maps a declared variable type to its parameter type.
    ///
    /// int→`long`, float/number→`double`, bool→`boolean`, json→`Object`, and every other
    /// type→`String`.
    static JavaType forVariable(VariableType type) {
        if (type == null) {
            return STRING;
        }
        return switch (type) {
            case INT -> LONG;
            case FLOAT, NUMBER -> DOUBLE;
            case BOOL -> BOOLEAN;
            case JSON -> OBJECT;
            default -> STRING;
        };
    }
}
