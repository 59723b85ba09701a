package dev.workflows.backend;

import dev.workflows.model.WorkflowSettings;
import dev.workflows.model.WorkflowStep;

import java.time.Instant;
import java.util.List;

/**
 * Fields to change on a stored workflow. Null fields are left as they are.
 */
public record WorkflowPatch(
    String name,
    String description,
    List<WorkflowStep> steps,
    WorkflowSettings settings,
    Instant lastRunAt,
    String lastConversationId
) {
    public static WorkflowPatch runMetadata(Instant lastRunAt, String lastConversationId) {
        return new WorkflowPatch(null, null, null, null, lastRunAt, lastConversationId);
    }
}
