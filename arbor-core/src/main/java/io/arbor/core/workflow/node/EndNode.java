package io.arbor.core.workflow.node;

import java.util.Objects;

/// Terminal node producing the workflow output.
///
/// ### Output resolution
/// Priority: `outputTemplate` (with `{Var}` placeholders), then `outputValue`, then the
/// label. The declared `outputType` (default `string`) controls coercion; a workflow-level
/// output type takes precedence.
public final class EndNode extends Node {

    /// Output type used when none is declared.
    public static final String DEFAULT_OUTPUT_TYPE = "string";

    private final String outputType;
    private final String outputTemplate;
    private final Object outputValue;

    private EndNode(Builder builder) {
        super(builder);
        this.outputType = builder.outputType;
        this.outputTemplate = builder.outputTemplate;
        this.outputValue = builder.outputValue;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the declared output type as written.
    ///
    /// @return output type, may be null
    public String getOutputType() {
        return outputType;
    }

    /// Returns the declared output type, defaulting to `string`.
    ///
    /// @return effective output type, never null
    public String effectiveOutputType() {
        return outputType != null && !outputType.isBlank() ? outputType : DEFAULT_OUTPUT_TYPE;
    }

    public String getOutputTemplate() {
        return outputTemplate;
    }

    /// Returns the static output value.
    ///
    /// @return the value, may be null
    public Object getOutputValue() {
        return outputValue;
    }

    /// Returns whether a non-blank template is configured.
    ///
    /// @return `true` if a template drives the output
    public boolean hasTemplate() {
        return outputTemplate != null && !outputTemplate.isEmpty();
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.END;
    }

    @Override
    public boolean equals(Object obj) {
        if (!super.equals(obj)) return false;
        var that = (EndNode) obj;
        return Objects.equals(outputType, that.outputType)
                && Objects.equals(outputTemplate, that.outputTemplate)
                && Objects.equals(outputValue, that.outputValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), outputType, outputTemplate, outputValue);
    }

    public static final class Builder extends Node.Builder<EndNode, Builder> {
        private String outputType;
        private String outputTemplate;
        private Object outputValue;

        private Builder() {}

        public Builder outputType(String outputType) {
            this.outputType = outputType;
            return this;
        }

        public Builder outputTemplate(String outputTemplate) {
            this.outputTemplate = outputTemplate;
            return this;
        }

        public Builder outputValue(Object outputValue) {
            this.outputValue = outputValue;
            return this;
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public EndNode build() {
            return new EndNode(this);
        }
    }
}
