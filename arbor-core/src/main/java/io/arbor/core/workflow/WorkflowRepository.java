package io.arbor.core.workflow;

import io.arbor.core.execution.SubworkflowResolver;
import java.util.List;
import java.util.Optional;

/// Repository for workflow definitions.
///
/// Doubles as the {@link SubworkflowResolver} that subprocess nodes and the compiler use
/// to look up called workflows.
///
/// ### Idempotent Operations
/// The {@link #save} method is idempotent - saving a workflow with an existing ID
/// will overwrite the previous definition.
///
/// @see InMemoryWorkflowRepository for in-memory implementation
public interface WorkflowRepository extends SubworkflowResolver {

    /// Saves a workflow definition (idempotent).
    ///
    /// @param workflow the workflow definition, not null, with a non-null id
    /// @throws NullPointerException if workflow or its id is null
    void save(Workflow workflow);

    /// Finds a workflow by ID.
    ///
    /// @param workflowId the workflow identifier, not null
    /// @return the workflow if found, empty otherwise
    Optional<Workflow> findById(String workflowId);

    /// Lists all workflows.
    ///
    /// @return list of all workflows, never null (may be empty)
    List<Workflow> findAll();

    boolean exists(String workflowId);

    /// Deletes a workflow by ID.
    ///
    /// @param workflowId the workflow to delete, not null
    /// @return true if the workflow was deleted, false if not found
    boolean delete(String workflowId);

    int count();

    @Override
    default Optional<Workflow> resolve(String workflowId) {
        return findById(workflowId);
    }
}
