package io.arbor.core.workflow;

import io.arbor.core.workflow.node.Node;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Immutable view from node id to its ordered children.
///
/// Built once per run from a workflow's edge list; edges whose endpoints do not exist are
/// skipped. Children keep edge order, which is what positional branch fallback relies on.
///
/// ### Branch selection
/// {@link #selectBranch(List, boolean)} implements the edge-label convention:
/// 1. A single child is always taken
/// 2. A child labeled `yes/true/y/t/1` is the true branch, `no/false/n/f/0` the false branch
/// 3. With one side labeled, the first unlabeled child is the other side
/// 4. With no labels, position 0 is true and position 1 is false
/// 5. Anything else (e.g. three unlabeled children) is unresolvable
///
/// @implNote Immutable and thread-safe.
public final class SuccessorIndex {

    /// Edge labels selecting the true branch (compared lowercase, trimmed).
    public static final Set<String> TRUE_LABELS = Set.of("yes", "true", "y", "t", "1");

    /// Edge labels selecting the false branch (compared lowercase, trimmed).
    public static final Set<String> FALSE_LABELS = Set.of("no", "false", "n", "f", "0");

    /// A child node reached through a labeled edge.
    ///
    /// @param node the child node, not null
    /// @param edgeLabel the label on the connecting edge, may be null
    public record Successor(Node node, String edgeLabel) {

        /// @return `TRUE`/`FALSE` when the label matches a convention, otherwise empty
        public Optional<Boolean> branchValue() {
            String normalized = normalize(edgeLabel);
            if (TRUE_LABELS.contains(normalized)) {
                return Optional.of(Boolean.TRUE);
            }
            if (FALSE_LABELS.contains(normalized)) {
                return Optional.of(Boolean.FALSE);
            }
            return Optional.empty();
        }

        /// @return `true` when the edge label is missing or blank
        public boolean isUnlabeled() {
            return normalize(edgeLabel).isEmpty();
        }
    }

    private final Map<String, List<Successor>> successors;

    private SuccessorIndex(Map<String, List<Successor>> successors) {
        this.successors = successors;
    }

    /// Builds the index for a workflow.
    ///
    /// @param workflow the workflow, not null
    /// @return the index, never null
    public static SuccessorIndex of(Workflow workflow) {
        Map<String, Node> nodesById = new HashMap<>();
        for (Node node : workflow.getNodes()) {
            if (node.getId() != null) {
                nodesById.putIfAbsent(node.getId(), node);
            }
        }

        Map<String, List<Successor>> index = new LinkedHashMap<>();
        for (Edge edge : workflow.getEdges()) {
            Node target = nodesById.get(edge.to());
            if (edge.from() == null || !nodesById.containsKey(edge.from()) || target == null) {
                continue;
            }
            index.computeIfAbsent(edge.from(), k -> new ArrayList<>())
                    .add(new Successor(target, edge.label()));
        }

        Map<String, List<Successor>> frozen = new LinkedHashMap<>();
        index.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        return new SuccessorIndex(Collections.unmodifiableMap(frozen));
    }

    /// Returns the children of a node in edge order.
    ///
    /// @param nodeId node id, may be null
    /// @return children, never null (may be empty)
    public List<Successor> childrenOf(String nodeId) {
        return nodeId == null ? List.of() : successors.getOrDefault(nodeId, List.of());
    }

    /// Returns the first child of a node.
    ///
    /// @param nodeId node id, may be null
    /// @return first child, or empty if the node has none
    public Optional<Node> firstChild(String nodeId) {
        List<Successor> children = childrenOf(nodeId);
        return children.isEmpty() ? Optional.empty() : Optional.of(children.get(0).node());
    }

    /// Picks the branch matching a decision outcome.
    ///
    /// @param children the decision's children, not null
    /// @param outcome the evaluated condition
    /// @return the selected child, or empty if the branch cannot be resolved
    public static Optional<Node> selectBranch(List<Successor> children, boolean outcome) {
        if (children.isEmpty()) {
            return Optional.empty();
        }
        if (children.size() == 1) {
            return Optional.of(children.get(0).node());
        }

        Successor trueBranch = null;
        Successor falseBranch = null;
        for (Successor child : children) {
            Optional<Boolean> value = child.branchValue();
            if (value.isEmpty()) {
                continue;
            }
            if (value.get() && trueBranch == null) {
                trueBranch = child;
            } else if (!value.get() && falseBranch == null) {
                falseBranch = child;
            }
        }

        if (trueBranch != null || falseBranch != null) {
            Successor labeled = outcome ? trueBranch : falseBranch;
            if (labeled != null) {
                return Optional.of(labeled.node());
            }
            return children.stream()
                    .filter(Successor::isUnlabeled)
                    .findFirst()
                    .map(Successor::node);
        }

        if (children.size() == 2) {
            return Optional.of(children.get(outcome ? 0 : 1).node());
        }
        return Optional.empty();
    }

    private static String normalize(String label) {
        return label == null ? "" : label.trim().toLowerCase(Locale.ROOT);
    }
}
