package dev.workflows.model;

import java.time.Instant;
import java.util.List;

/**
 * A user-authored, ordered sequence of steps owned by a space.
 */
public record WorkflowDefinition(
    String id,
    String spaceId,
    String name,
    String description,          // nullable
    List<WorkflowStep> steps,
    WorkflowSettings settings,
    Instant createdAt,           // nullable
    Instant updatedAt,           // nullable
    Instant lastRunAt,           // nullable
    String lastConversationId    // nullable
) {
    public WorkflowDefinition {
        steps = List.copyOf(steps);
        settings = settings != null ? settings : WorkflowSettings.defaults();
    }
}
