package io.arbor.core.workflow.node;

/// Entry point of a workflow. Advances to its single child.
public final class StartNode extends Node {

    private StartNode(Builder builder) {
        super(builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.START;
    }

    public static final class Builder extends Node.Builder<StartNode, Builder> {
        private Builder() {}

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public StartNode build() {
            return new StartNode(this);
        }
    }
}
