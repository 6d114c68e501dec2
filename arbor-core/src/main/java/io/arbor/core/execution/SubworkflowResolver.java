package io.arbor.core.execution;

import io.arbor.core.workflow.Workflow;
import java.util.Optional;

/// Looks up workflows called from subprocess nodes.
///
/// @see io.arbor.core.workflow.InMemoryWorkflowRepository
@FunctionalInterface
public interface SubworkflowResolver {

    /// Resolves a workflow by id.
    ///
    /// @param workflowId the id referenced by a subprocess node, not null
    /// @return the workflow, or empty if unknown
    Optional<Workflow> resolve(String workflowId);
}
