package io.arbor.core.condition;

import io.arbor.core.workflow.VariableType;
import java.util.Optional;

/// Group of comparators valid for one kind of variable type.
public enum ComparatorFamily {
    NUMERIC,
    BOOLEAN,
    STRING,
    ENUM,
    DATE;

    /// Returns the family whose comparators apply to the given variable type.
    ///
    /// @param type declared variable type, may be null
    /// @return the family, or empty for `json` and null
    public static Optional<ComparatorFamily> forType(VariableType type) {
        if (type == null) {
            return Optional.empty();
        }
        return switch (type) {
            case INT, FLOAT, NUMBER -> Optional.of(NUMERIC);
            case BOOL -> Optional.of(BOOLEAN);
            case STRING -> Optional.of(STRING);
            case ENUM -> Optional.of(ENUM);
            case DATE -> Optional.of(DATE);
            case JSON -> Optional.empty();
        };
    }
}
