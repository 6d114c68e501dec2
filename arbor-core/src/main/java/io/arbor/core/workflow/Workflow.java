package io.arbor.core.workflow;

import io.arbor.core.workflow.node.Node;
import io.arbor.core.workflow.node.NodeType;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Workflow definition: nodes, edges and declared variables.
///
/// The graph is kept exactly as authored (including duplicates or dangling edges) so the
/// validator can report every problem; executors build their own
/// {@link SuccessorIndex} and never mutate the workflow.
///
/// ### Usage
/// {@snippet :
/// Workflow workflow = Workflow.builder()
///     .id("bmi")
///     .name("BMI classifier")
///     .variables(List.of(bmiVariable))
///     .nodes(List.of(start, decision, low, normal))
///     .edges(List.of(Edge.of("start", "decision"),
///                    Edge.of("decision", "low", "yes"),
///                    Edge.of("decision", "normal", "no")))
///     .build();
/// }
///
/// @implNote Immutable and thread-safe after construction.
public final class Workflow {

    private final String id;
    private final String name;
    private final List<Node> nodes;
    private final List<Edge> edges;
    private final List<Variable> variables;
    private final String outputType;

    private Workflow(Builder builder) {
        this.id = builder.id;
        this.name = builder.name != null ? builder.name : builder.id;
        this.nodes = builder.nodes != null ? List.copyOf(builder.nodes) : List.of();
        this.edges = builder.edges != null ? List.copyOf(builder.edges) : List.of();
        this.variables = builder.variables != null ? List.copyOf(builder.variables) : List.of();
        this.outputType = builder.outputType;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the workflow id used for sub-workflow resolution and cycle detection.
    ///
    /// @return id, may be null for ad-hoc workflows
    public String getId() {
        return id;
    }

    /// Returns the display name.
    ///
    /// @return name, may be null only if id is null too
    public String getName() {
        return name;
    }

    /// @return nodes in document order, never null
    public List<Node> getNodes() {
        return nodes;
    }

    /// @return edges in document order, never null
    public List<Edge> getEdges() {
        return edges;
    }

    /// @return declared variables in document order, never null
    public List<Variable> getVariables() {
        return variables;
    }

    /// Returns the declared workflow-level output type.
    ///
    /// @return output type, or null when each end node decides
    public String getOutputType() {
        return outputType;
    }

    /// Finds the first node with the given id.
    ///
    /// @param nodeId node id, may be null
    /// @return the node, or empty if absent
    public Optional<Node> findNode(String nodeId) {
        if (nodeId == null) {
            return Optional.empty();
        }
        return nodes.stream().filter(n -> nodeId.equals(n.getId())).findFirst();
    }

    /// Returns every start node in document order.
    ///
    /// @return start nodes, never null
    public List<Node> startNodes() {
        return nodes.stream().filter(n -> n.getNodeType() == NodeType.START).toList();
    }

    /// Returns the declared variables supplied by the caller.
    ///
    /// @return input variables in document order, never null
    public List<Variable> inputVariables() {
        return variables.stream().filter(Variable::isInput).toList();
    }

    /// Finds a declared variable by id, falling back to friendly name.
    ///
    /// @param idOrName variable id or name, may be null
    /// @return the variable, or empty if absent
    public Optional<Variable> findVariable(String idOrName) {
        if (idOrName == null) {
            return Optional.empty();
        }
        Optional<Variable> byId =
                variables.stream().filter(v -> idOrName.equals(v.getId())).findFirst();
        if (byId.isPresent()) {
            return byId;
        }
        return variables.stream().filter(v -> idOrName.equals(v.getName())).findFirst();
    }

    public static final class Builder {
        private String id;
        private String name;
        private List<Node> nodes;
        private List<Edge> edges;
        private List<Variable> variables;
        private String outputType;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder nodes(List<Node> nodes) {
            this.nodes = nodes;
            return this;
        }

        public Builder edges(List<Edge> edges) {
            this.edges = edges;
            return this;
        }

        public Builder variables(List<Variable> variables) {
            this.variables = variables;
            return this;
        }

        /// Sets the workflow-level output type that every end node must match.
        ///
        /// @param outputType output type, may be null
        /// @return this builder for chaining
        public Builder outputType(String outputType) {
            this.outputType = outputType;
            return this;
        }

        /// Builds the immutable workflow.
        ///
        /// @return new Workflow instance, never null
        public Workflow build() {
            return new Workflow(this);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        var that = (Workflow) obj;
        return Objects.equals(this.id, that.id)
                && Objects.equals(this.name, that.name)
                && Objects.equals(this.nodes, that.nodes)
                && Objects.equals(this.edges, that.edges)
                && Objects.equals(this.variables, that.variables)
                && Objects.equals(this.outputType, that.outputType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, nodes, edges, variables, outputType);
    }

    @Override
    public String toString() {
        return "Workflow[id=" + id + ", name=" + name + ", nodes=" + nodes.size() + ", edges="
                + edges.size() + "]";
    }
}
