package io.arbor.core.workflow.node;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Base class for all workflow node types.
///
/// Nodes carry the common fields `id`, `label` and canvas coordinates `x`/`y`. Any of
/// them may be missing in a partially-built workflow; the validator reports such nodes as
/// incomplete instead of the model rejecting them at construction.
///
/// ### Node Types
/// - {@link StartNode} - entry point
/// - {@link ProcessNode} - pass-through step
/// - {@link DecisionNode} - two-way branch on a condition
/// - {@link CalculationNode} - arithmetic producing a derived variable
/// - {@link SubprocessNode} - call into another workflow
/// - {@link EndNode} - terminal output
/// - {@link UnrecognizedNode} - node whose type string is unknown
///
/// @implNote Subclasses are immutable after construction.
/// @see NodeType
public abstract sealed class Node
        permits StartNode,
                ProcessNode,
                DecisionNode,
                CalculationNode,
                SubprocessNode,
                EndNode,
                UnrecognizedNode {

    protected final String id;
    protected final String label;
    protected final Double x;
    protected final Double y;

    protected Node(Builder<?, ?> builder) {
        this.id = builder.id;
        this.label = builder.label;
        this.x = builder.x;
        this.y = builder.y;
    }

    /// Returns the node identifier.
    ///
    /// @return node id, may be null only in partially-built workflows
    public String getId() {
        return id;
    }

    /// Returns the display label. For decisions without a structured condition the label
    /// doubles as the legacy condition text.
    ///
    /// @return label, may be null
    public String getLabel() {
        return label;
    }

    public Double getX() {
        return x;
    }

    public Double getY() {
        return y;
    }

    /// Returns the node type for dispatch.
    ///
    /// @return the node type, never null
    public abstract NodeType getNodeType();

    /// Returns the type string as it appears in workflow documents.
    ///
    /// @return wire type name, never null
    public String getTypeName() {
        return getNodeType().wireName();
    }

    /// Returns the label if present, otherwise the id.
    ///
    /// @return a name suitable for messages, may be null only if both are null
    public String displayName() {
        return label != null && !label.isBlank() ? label : id;
    }

    /// Lists the common fields that are absent.
    ///
    /// @return missing field names in `id, type, label, x, y` order, never null
    public List<String> missingRequiredFields() {
        List<String> missing = new ArrayList<>();
        if (id == null || id.isBlank()) missing.add("id");
        if (getTypeName().isBlank()) missing.add("type");
        if (label == null || label.isBlank()) missing.add("label");
        if (x == null) missing.add("x");
        if (y == null) missing.add("y");
        return missing;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        var that = (Node) obj;
        return Objects.equals(this.id, that.id)
                && Objects.equals(this.label, that.label)
                && Objects.equals(this.x, that.x)
                && Objects.equals(this.y, that.y);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), id, label, x, y);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[id=" + id + ", label=" + label + "]";
    }

    /// Shared builder for the common node fields.
    ///
    /// @param <N> the node type built
    /// @param <B> the concrete builder type, for fluent chaining
    public abstract static class Builder<N extends Node, B extends Builder<N, B>> {
        private String id;
        private String label;
        private Double x;
        private Double y;

        protected Builder() {}

        protected abstract B self();

        /// Builds the immutable node.
        ///
        /// @return new node, never null
        public abstract N build();

        public B id(String id) {
            this.id = id;
            return self();
        }

        public B label(String label) {
            this.label = label;
            return self();
        }

        /// Sets the canvas position.
        ///
        /// @param x horizontal coordinate, may be null
        /// @param y vertical coordinate, may be null
        /// @return this builder for chaining
        public B position(Double x, Double y) {
            this.x = x;
            this.y = y;
            return self();
        }
    }
}
