package io.arbor.core.execution;

import java.util.Map;
import java.util.Optional;

/// Snapshot handed to {@link ExecutionListener#onStep} before a node runs.
///
/// @param nodeId id of the node about to run, may be null for malformed nodes
/// @param nodeType wire type of the node, not null
/// @param nodeLabel display label, falls back to the id
/// @param stepIndex 0-based index within the current (sub-)workflow
/// @param context copy of variable values keyed by id, not null
/// @param subflow sub-workflow metadata, null at the top level
public record StepEvent(
        String nodeId,
        String nodeType,
        String nodeLabel,
        int stepIndex,
        Map<String, Object> context,
        SubflowContext subflow) {

    /// @return sub-workflow metadata, or empty at the top level
    public Optional<SubflowContext> subflowContext() {
        return Optional.ofNullable(subflow);
    }

    /// @return `true` when the step runs inside a sub-workflow
    public boolean isInSubflow() {
        return subflow != null;
    }
}
