package dev.workflows.engine;

import dev.workflows.model.RunPhase;
import dev.workflows.model.WorkflowRunState;

/**
 * Identifies the agent turn a run is waiting for. Every transition changes at least one
 * component, so a key taken when a message is sent stops matching once that turn completes.
 */
public record TurnKey(String runId, String conversationId, RunPhase phase, int stepIndex) {

    public static TurnKey of(WorkflowRunState run) {
        return new TurnKey(run.runId(), run.conversationId(), run.phase(), run.currentStepIndex());
    }
}
