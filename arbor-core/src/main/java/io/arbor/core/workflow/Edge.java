package io.arbor.core.workflow;

/// Directed connection between two nodes.
///
/// The label carries the branch convention for decision nodes (`yes`/`no`,
/// `true`/`false`, ...). When no id is supplied, `from->to` is used.
///
/// @param id edge identifier, never null after construction when both endpoints are set
/// @param from source node id, may be null in partially-built workflows
/// @param to target node id, may be null in partially-built workflows
/// @param label branch label, may be null
public record Edge(String id, String from, String to, String label) {

    public Edge {
        if (id == null || id.isBlank()) {
            id = from + "->" + to;
        }
    }

    /// Creates an unlabeled edge with a derived id.
    ///
    /// @param from source node id, not null
    /// @param to target node id, not null
    /// @return new edge, never null
    public static Edge of(String from, String to) {
        return new Edge(null, from, to, null);
    }

    /// Creates a labeled edge with a derived id.
    ///
    /// @param from source node id, not null
    /// @param to target node id, not null
    /// @param label branch label, may be null
    /// @return new edge, never null
    public static Edge of(String from, String to, String label) {
        return new Edge(null, from, to, label);
    }
}
