package io.arbor.core.validation;

/// How much of a workflow {@link WorkflowValidator} checks.
public enum ValidationMode {
    /// Structural rules only: node shape, ids, edge endpoints, start count and cycles.
    LENIENT,

    /// Structural rules plus branching, reachability and semantic checks on conditions,
    /// calculations, sub-workflow calls, templates and output types.
    STRICT
}
