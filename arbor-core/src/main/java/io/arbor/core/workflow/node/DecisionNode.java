package io.arbor.core.workflow.node;

import io.arbor.core.condition.Condition;
import java.util.Objects;
import java.util.Optional;

/// Two-way branch on a condition.
///
/// Holds an optional structured condition; when absent, the label is treated as a legacy
/// expression such as `Age >= 18`. {@link #effectiveCondition()} is the single place that
/// applies this resolution order.
public final class DecisionNode extends Node {

    private final Condition.Structured condition;

    private DecisionNode(Builder builder) {
        super(builder);
        this.condition = builder.condition;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the structured condition, if any.
    ///
    /// @return structured condition, may be null
    public Condition.Structured getCondition() {
        return condition;
    }

    /// Resolves the condition to evaluate: the structured condition first, otherwise the
    /// label as an expression.
    ///
    /// @return the effective condition, or empty when neither is present
    public Optional<Condition> effectiveCondition() {
        if (condition != null) {
            return Optional.of(condition);
        }
        if (label != null && !label.isBlank()) {
            return Optional.of(new Condition.Expression(label));
        }
        return Optional.empty();
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.DECISION;
    }

    @Override
    public boolean equals(Object obj) {
        return super.equals(obj) && Objects.equals(condition, ((DecisionNode) obj).condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), condition);
    }

    public static final class Builder extends Node.Builder<DecisionNode, Builder> {
        private Condition.Structured condition;

        private Builder() {}

        /// Sets the structured condition.
        ///
        /// @param condition the condition, may be null to fall back to the label
        /// @return this builder for chaining
        public Builder condition(Condition.Structured condition) {
            this.condition = condition;
            return this;
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public DecisionNode build() {
            return new DecisionNode(this);
        }
    }
}
