package io.arbor.core.workflow.node;

import io.arbor.core.workflow.Identifiers;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Calls another workflow and injects its output into the caller's context.
///
/// `inputMapping` keys are parent variable names (or ids); values are the sub-workflow's
/// input names (or ids). The output is stored under `var_sub_{slug}_{type}` where the type
/// is inferred from the returned value.
///
/// @implNote Immutable. Mapping iteration order is preserved.
public final class SubprocessNode extends Node {

    private final String subworkflowId;
    private final Map<String, String> inputMapping;
    private final String outputVariable;

    private SubprocessNode(Builder builder) {
        super(builder);
        this.subworkflowId = builder.subworkflowId;
        this.inputMapping =
                builder.inputMapping != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.inputMapping))
                        : Map.of();
        this.outputVariable = builder.outputVariable;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the id of the workflow to call.
    ///
    /// @return sub-workflow id, may be null in partially-built workflows
    public String getSubworkflowId() {
        return subworkflowId;
    }

    /// Returns the parent-to-child input mapping.
    ///
    /// @return unmodifiable mapping, never null (may be empty)
    public Map<String, String> getInputMapping() {
        return inputMapping;
    }

    /// Returns the friendly name under which the sub-workflow result is exposed.
    ///
    /// @return output variable name, may be null in partially-built workflows
    public String getOutputVariable() {
        return outputVariable;
    }

    /// Returns the derived id for a given result type.
    ///
    /// @param typeName inferred value type, not null
    /// @return `var_sub_{slug}_{type}`, never null
    public String derivedVariableId(String typeName) {
        return Identifiers.subprocessVariableId(outputVariable, typeName);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.SUBPROCESS;
    }

    @Override
    public boolean equals(Object obj) {
        if (!super.equals(obj)) return false;
        var that = (SubprocessNode) obj;
        return Objects.equals(subworkflowId, that.subworkflowId)
                && Objects.equals(inputMapping, that.inputMapping)
                && Objects.equals(outputVariable, that.outputVariable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), subworkflowId, inputMapping, outputVariable);
    }

    public static final class Builder extends Node.Builder<SubprocessNode, Builder> {
        private String subworkflowId;
        private Map<String, String> inputMapping;
        private String outputVariable;

        private Builder() {}

        public Builder subworkflowId(String subworkflowId) {
            this.subworkflowId = subworkflowId;
            return this;
        }

        /// Sets the input mapping.
        ///
        /// @param inputMapping parent name to sub-workflow input name, may be null
        /// @return this builder for chaining
        public Builder inputMapping(Map<String, String> inputMapping) {
            this.inputMapping = inputMapping;
            return this;
        }

        public Builder outputVariable(String outputVariable) {
            this.outputVariable = outputVariable;
            return this;
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public SubprocessNode build() {
            return new SubprocessNode(this);
        }
    }
}
