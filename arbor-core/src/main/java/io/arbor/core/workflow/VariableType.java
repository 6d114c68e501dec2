package io.arbor.core.workflow;

import java.util.Locale;
import java.util.Optional;

/// Declared type of a workflow variable.
///
/// `NUMBER` is the unified numeric type produced by calculations; `JSON` only appears on
/// values injected by sub-workflow calls.
public enum VariableType {
    INT("int"),
    FLOAT("float"),
    NUMBER("number"),
    BOOL("bool"),
    STRING("string"),
    ENUM("enum"),
    DATE("date"),
    JSON("json");

    private final String wireName;

    VariableType(String wireName) {
        this.wireName = wireName;
    }

    /// Returns the lowercase name used in workflow documents.
    ///
    /// @return wire name, never null
    public String wireName() {
        return wireName;
    }

    /// Returns whether values of this type are numbers.
    ///
    /// @return `true` for INT, FLOAT and NUMBER
    public boolean isNumeric() {
        return this == INT || this == FLOAT || this == NUMBER;
    }

    /// Looks up a type by wire name, case-insensitively.
    ///
    /// @param name the wire name, may be null
    /// @return the matching type, or empty if unknown
    public static Optional<VariableType> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (VariableType type : values()) {
            if (type.wireName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
