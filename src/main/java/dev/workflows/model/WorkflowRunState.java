package dev.workflows.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Snapshot of one workflow execution. Immutable: every transition produces a new instance,
 * so readers never observe a half-applied change.
 */
public record WorkflowRunState(
    String runId,
    WorkflowDefinition workflow,
    String spaceId,
    String conversationId,
    int currentStepIndex,
    List<StepRunState> steps,
    boolean isRunning,
    RunPhase phase,
    String summaryText, // nullable, set only while phase is SUMMARY_INJECT
    Instant startedAt,
    Instant endedAt     // nullable
) {
    public WorkflowRunState {
        steps = List.copyOf(steps);
        if (steps.size() != workflow.steps().size()) {
            throw new IllegalArgumentException("Run has %d step states for %d workflow steps"
                .formatted(steps.size(), workflow.steps().size()));
        }
    }

    /**
     * Initial state of a run: every step pending, phase STEP at index 0.
     */
    public static WorkflowRunState start(WorkflowDefinition workflow, String spaceId,
                                         String conversationId, Instant now) {
        var steps = new ArrayList<StepRunState>();
        for (WorkflowStep step : workflow.steps()) {
            steps.add(StepRunState.pending(step.id()));
        }
        return new WorkflowRunState(UUID.randomUUID().toString(), workflow, spaceId, conversationId,
            0, steps, true, RunPhase.STEP, null, now, null);
    }

    public WorkflowStep currentStep() {
        if (currentStepIndex < 0 || currentStepIndex >= workflow.steps().size()) {
            return null;
        }
        return workflow.steps().get(currentStepIndex);
    }

    public StepRunState currentStepState() {
        if (currentStepIndex < 0 || currentStepIndex >= steps.size()) {
            return null;
        }
        return steps.get(currentStepIndex);
    }

    public boolean isLastStep() {
        return currentStepIndex >= workflow.steps().size() - 1;
    }

    public WorkflowRunState withStep(int index, StepRunState step) {
        var updated = new ArrayList<>(steps);
        updated.set(index, step);
        return new WorkflowRunState(runId, workflow, spaceId, conversationId, currentStepIndex,
            updated, isRunning, phase, summaryText, startedAt, endedAt);
    }

    public WorkflowRunState withCurrentStep(StepRunState step) {
        return withStep(currentStepIndex, step);
    }

    public WorkflowRunState withPhase(RunPhase nextPhase) {
        return new WorkflowRunState(runId, workflow, spaceId, conversationId, currentStepIndex,
            steps, isRunning, nextPhase, summaryText, startedAt, endedAt);
    }

    /** Move to the handoff conversation carrying the given summary. */
    public WorkflowRunState handedOff(String nextConversationId, String summary) {
        return new WorkflowRunState(runId, workflow, spaceId, nextConversationId, currentStepIndex,
            steps, isRunning, RunPhase.SUMMARY_INJECT, summary, startedAt, endedAt);
    }

    /** Make the following step current, back in phase STEP. */
    public WorkflowRunState advanced() {
        return new WorkflowRunState(runId, workflow, spaceId, conversationId, currentStepIndex + 1,
            steps, isRunning, RunPhase.STEP, null, startedAt, endedAt);
    }

    /** Successful end of the run after its last step. */
    public WorkflowRunState finished(Instant now) {
        return new WorkflowRunState(runId, workflow, spaceId, conversationId, currentStepIndex,
            steps, false, RunPhase.STEP, null, startedAt, now);
    }

    public WorkflowRunState ended(Instant now) {
        return new WorkflowRunState(runId, workflow, spaceId, conversationId, currentStepIndex,
            steps, false, phase, summaryText, startedAt, now);
    }
}
