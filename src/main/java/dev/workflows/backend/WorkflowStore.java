package dev.workflows.backend;

import dev.workflows.model.WorkflowDefinition;

import java.util.List;

/**
 * Persistence of workflow definitions, scoped by space.
 */
public interface WorkflowStore {

    StoreResult<List<WorkflowDefinition>> list(String spaceId);

    StoreResult<WorkflowDefinition> get(String spaceId, String workflowId);

    /**
     * Store a new workflow. The store assigns the workflow id, missing step ids and timestamps;
     * any id on {@code input} is ignored.
     */
    StoreResult<WorkflowDefinition> create(String spaceId, WorkflowDefinition input);

    StoreResult<WorkflowDefinition> update(String spaceId, String workflowId, WorkflowPatch patch);

    StoreResult<Void> delete(String spaceId, String workflowId);
}
