package io.arbor.core.calculation;

import java.util.Objects;

/// Operand of a calculation: a numeric constant or a reference to a variable.
///
/// ### Permitted Subtypes
/// - {@link Literal} - constant value
/// - {@link Reference} - variable id or friendly name
public sealed interface Operand {

    /// @param value the constant
    record Literal(double value) implements Operand {}

    /// Reference resolved by id, then by friendly name, then by slugified name.
    ///
    /// @param ref variable id or name, not null
    record Reference(String ref) implements Operand {
        public Reference {
            Objects.requireNonNull(ref, "ref must not be null");
        }
    }

    static Operand literal(double value) {
        return new Literal(value);
    }

    static Operand ref(String ref) {
        return new Reference(ref);
    }
}
