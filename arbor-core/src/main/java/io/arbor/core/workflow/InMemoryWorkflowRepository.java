package io.arbor.core.workflow;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory workflow repository (default implementation).
///
/// Thread-safe, no external dependencies. Saving a workflow with an existing ID
/// overwrites the previous definition.
///
/// @implNote Uses ConcurrentHashMap for thread-safety.
/// @see WorkflowRepository for contract
public final class InMemoryWorkflowRepository implements WorkflowRepository {

    private final Map<String, Workflow> storage = new ConcurrentHashMap<>();

    @Override
    public void save(Workflow workflow) {
        Objects.requireNonNull(workflow, "workflow must not be null");
        Objects.requireNonNull(workflow.getId(), "workflow id must not be null");
        storage.put(workflow.getId(), workflow);
    }

    @Override
    public Optional<Workflow> findById(String workflowId) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        return Optional.ofNullable(storage.get(workflowId));
    }

    @Override
    public List<Workflow> findAll() {
        return List.copyOf(storage.values());
    }

    @Override
    public boolean exists(String workflowId) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        return storage.containsKey(workflowId);
    }

    @Override
    public boolean delete(String workflowId) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        return storage.remove(workflowId) != null;
    }

    @Override
    public int count() {
        return storage.size();
    }
}
