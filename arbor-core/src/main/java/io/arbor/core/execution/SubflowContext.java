package io.arbor.core.execution;

/// Where a step runs when it is inside a sub-workflow.
///
/// @param parentNodeId the subprocess node that made the call, not null
/// @param subworkflowId the called workflow, not null
/// @param depth nesting depth, 1 for a direct child of the top-level workflow
public record SubflowContext(String parentNodeId, String subworkflowId, int depth) {}
