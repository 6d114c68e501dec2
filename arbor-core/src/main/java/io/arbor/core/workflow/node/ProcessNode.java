package io.arbor.core.workflow.node;

/// Pass-through step with no behavior of its own. Advances to its single child.
public final class ProcessNode extends Node {

    private ProcessNode(Builder builder) {
        super(builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.PROCESS;
    }

    public static final class Builder extends Node.Builder<ProcessNode, Builder> {
        private Builder() {}

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public ProcessNode build() {
            return new ProcessNode(this);
        }
    }
}
