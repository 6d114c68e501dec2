package io.arbor.core.workflow.node;

import java.util.Objects;

/// Node whose document type matched no known {@link NodeType}.
///
/// Kept in the model so the validator can report `INVALID_NODE_TYPE` and the interpreter
/// can fail with a precise message instead of the reader rejecting the whole document.
public final class UnrecognizedNode extends Node {

    private final String rawType;

    private UnrecognizedNode(Builder builder) {
        super(builder);
        this.rawType = builder.rawType != null ? builder.rawType : "";
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the type string as found in the document.
    ///
    /// @return raw type, never null (empty when the type was missing)
    public String getRawType() {
        return rawType;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.UNRECOGNIZED;
    }

    @Override
    public String getTypeName() {
        return rawType;
    }

    @Override
    public boolean equals(Object obj) {
        return super.equals(obj) && Objects.equals(rawType, ((UnrecognizedNode) obj).rawType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), rawType);
    }

    public static final class Builder extends Node.Builder<UnrecognizedNode, Builder> {
        private String rawType;

        private Builder() {}

        public Builder rawType(String rawType) {
            this.rawType = rawType;
            return this;
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public UnrecognizedNode build() {
            return new UnrecognizedNode(this);
        }
    }
}
