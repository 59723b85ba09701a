package dev.workflows.model;

/**
 * Per-workflow toggles forwarded to the agent backend with every step message.
 * Null means "backend default".
 */
public record WorkflowSettings(
    Boolean thinkingEnabled,
    Boolean aiBrowserEnabled
) {
    public static WorkflowSettings defaults() {
        return new WorkflowSettings(null, null);
    }
}
