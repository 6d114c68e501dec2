package io.arbor.core.workflow.node;

import io.arbor.core.calculation.Calculation;
import java.util.Objects;

/// Applies a {@link Calculation} and stores its result as a derived variable.
public final class CalculationNode extends Node {

    private final Calculation calculation;

    private CalculationNode(Builder builder) {
        super(builder);
        this.calculation = builder.calculation;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the calculation definition.
    ///
    /// @return calculation, may be null in partially-built workflows
    public Calculation getCalculation() {
        return calculation;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.CALCULATION;
    }

    @Override
    public boolean equals(Object obj) {
        return super.equals(obj)
                && Objects.equals(calculation, ((CalculationNode) obj).calculation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), calculation);
    }

    public static final class Builder extends Node.Builder<CalculationNode, Builder> {
        private Calculation calculation;

        private Builder() {}

        public Builder calculation(Calculation calculation) {
            this.calculation = calculation;
            return this;
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public CalculationNode build() {
            return new CalculationNode(this);
        }
    }
}
