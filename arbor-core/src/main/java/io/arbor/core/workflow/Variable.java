package io.arbor.core.workflow;

import java.util.List;
import java.util.Objects;

/// Declared workflow variable.
///
/// Conditions reference variables by id; templates and legacy expressions reference them
/// by friendly name. Calculated and sub-workflow variables are usually derived at run time
/// rather than declared, but may also be declared explicitly.
///
/// @implNote Immutable and thread-safe after construction.
/// @see VariableType
/// @see Identifiers for derived id conventions
public final class Variable {

    private final String id;
    private final String name;
    private final VariableType type;
    private final ValueRange range;
    private final List<String> enumValues;
    private final VariableSource source;
    private final String description;

    private Variable(Builder builder) {
        this.id = builder.id;
        this.name = builder.name != null ? builder.name : builder.id;
        this.type = builder.type;
        this.range = builder.range;
        this.enumValues = builder.enumValues != null ? List.copyOf(builder.enumValues) : List.of();
        this.source = builder.source != null ? builder.source : VariableSource.INPUT;
        this.description = builder.description;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the unique variable id.
    ///
    /// @return id, never null
    public String getId() {
        return id;
    }

    /// Returns the friendly name used in templates and legacy expressions.
    ///
    /// @return name, never null (defaults to the id)
    public String getName() {
        return name;
    }

    public VariableType getType() {
        return type;
    }

    /// Returns the inclusive numeric bounds.
    ///
    /// @return range, or null if unbounded
    public ValueRange getRange() {
        return range;
    }

    /// Returns the allowed values for `enum` variables.
    ///
    /// @return unmodifiable list, never null (may be empty)
    public List<String> getEnumValues() {
        return enumValues;
    }

    public VariableSource getSource() {
        return source;
    }

    /// Returns the optional human-readable description.
    ///
    /// @return description, may be null
    public String getDescription() {
        return description;
    }

    /// Returns whether the caller must supply this variable.
    ///
    /// @return `true` when the source is INPUT
    public boolean isInput() {
        return source == VariableSource.INPUT;
    }

    /// Builder for {@link Variable}.
    ///
    /// Required fields: `id`, `type`
    public static final class Builder {
        private String id;
        private String name;
        private VariableType type;
        private ValueRange range;
        private List<String> enumValues;
        private VariableSource source;
        private String description;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(VariableType type) {
            this.type = type;
            return this;
        }

        public Builder range(ValueRange range) {
            this.range = range;
            return this;
        }

        /// Convenience for setting both numeric bounds.
        ///
        /// @param min lower bound, may be null
        /// @param max upper bound, may be null
        /// @return this builder for chaining
        public Builder range(Double min, Double max) {
            this.range = new ValueRange(min, max);
            return this;
        }

        public Builder enumValues(List<String> enumValues) {
            this.enumValues = enumValues;
            return this;
        }

        public Builder source(VariableSource source) {
            this.source = source;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /// Builds the immutable variable.
        ///
        /// @return new Variable instance, never null
        /// @throws IllegalStateException if `id` is blank or `type` is missing
        public Variable build() {
            if (id == null || id.isBlank()) {
                throw new IllegalStateException("Variable id is required");
            }
            if (type == null) {
                throw new IllegalStateException("Variable type is required for '" + id + "'");
            }
            return new Variable(this);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        var that = (Variable) obj;
        return Objects.equals(this.id, that.id)
                && Objects.equals(this.name, that.name)
                && this.type == that.type
                && Objects.equals(this.range, that.range)
                && Objects.equals(this.enumValues, that.enumValues)
                && this.source == that.source
                && Objects.equals(this.description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, type, range, enumValues, source, description);
    }

    @Override
    public String toString() {
        return "Variable[id=" + id + ", name=" + name + ", type=" + type + ", source=" + source
                + "]";
    }
}
