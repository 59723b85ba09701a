package dev.workflows.engine;

import dev.workflows.backend.ConversationAdapter;
import dev.workflows.backend.ConversationRef;
import dev.workflows.backend.SendOptions;
import dev.workflows.model.AgentCompleteEvent;
import dev.workflows.model.FailureKind;
import dev.workflows.model.RunFailure;
import dev.workflows.model.RunPhase;
import dev.workflows.model.WorkflowRunState;
import dev.workflows.model.WorkflowSettings;
import dev.workflows.model.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Advances the active run from agent completion events.
 *
 * <p>A run moves through three phases per step:
 * <ul>
 *   <li>{@link RunPhase#STEP}: the step's message was sent, its reply is awaited;</li>
 *   <li>{@link RunPhase#SUMMARY}: the step asked for a handoff and the summary prompt was sent
 *       to the same conversation;</li>
 *   <li>{@link RunPhase#SUMMARY_INJECT}: the summary was posted to a fresh conversation, whose
 *       acknowledgment lets the next step start there.</li>
 * </ul>
 *
 * <p>Not thread-safe. Callers serialize {@link #startStep()}, {@link #handleAgentComplete} and
 * {@link #expireTurn}.
 */
public final class PhaseTransitionEngine {

    private static final Logger log = LoggerFactory.getLogger(PhaseTransitionEngine.class);

    private static final SendOptions HANDOFF_OPTIONS =
        new SendOptions(false, false, ConversationAdapter.ORIGIN_WORKFLOW_STEP);

    private final RunStateStore runs;
    private final ConversationAdapter conversations;
    private final Clock clock;
    private final RunListener listener;

    public PhaseTransitionEngine(RunStateStore runs, ConversationAdapter conversations,
                                 Clock clock, RunListener listener) {
        this.runs = runs;
        this.conversations = conversations;
        this.clock = clock;
        this.listener = listener;
    }

    /**
     * Send the current step's message. Does nothing unless the run is active in phase STEP.
     */
    public void startStep() {
        WorkflowRunState run = runs.get();
        if (run == null || !run.isRunning() || run.phase() != RunPhase.STEP) {
            return;
        }
        WorkflowStep step = run.currentStep();
        if (step == null) {
            return;
        }

        WorkflowRunState started = run.withCurrentStep(run.currentStepState().running(clock.instant()));
        runs.set(started);

        String message = StepMessageBuilder.build(step);
        if (message.isEmpty()) {
            fail(started, FailureKind.BUILD, "Workflow step %d (%s) has no message to send"
                .formatted(started.currentStepIndex() + 1, step.kind().jsonName()));
            return;
        }

        log.info("Workflow '{}' step {}/{}: {} {}", run.workflow().name(), run.currentStepIndex() + 1,
            run.steps().size(), step.kind().jsonName(), step.name() != null ? step.name() : "");
        WorkflowSettings settings = run.workflow().settings();
        send(started, message, new SendOptions(settings.thinkingEnabled(), settings.aiBrowserEnabled(),
            ConversationAdapter.ORIGIN_WORKFLOW_STEP));
    }

    /**
     * Apply a completion event to the active run.
     *
     * @return false if the event was ignored because no run is active or it belongs to
     *         another conversation or space
     */
    public boolean handleAgentComplete(AgentCompleteEvent event) {
        WorkflowRunState run = runs.get();
        if (run == null || !run.isRunning()) {
            return false;
        }
        if (!run.conversationId().equals(event.conversationId()) || !run.spaceId().equals(event.spaceId())) {
            log.debug("Ignoring completion for conversation {} in space {}",
                event.conversationId(), event.spaceId());
            return false;
        }

        switch (run.phase()) {
            case STEP -> completeStep(run);
            case SUMMARY -> completeSummary(run);
            case SUMMARY_INJECT -> completeHandoff(run);
        }
        return true;
    }

    /**
     * End the run if it is still waiting for the given turn.
     *
     * @return true if the run was ended
     */
    public boolean expireTurn(TurnKey turn, Duration timeout) {
        WorkflowRunState run = runs.get();
        if (run == null || !run.isRunning() || !turn.equals(TurnKey.of(run))) {
            return false;
        }
        try {
            conversations.stopGeneration(run.conversationId());
        } catch (RuntimeException e) {
            log.warn("Failed to stop generation in conversation {}", run.conversationId(), e);
        }
        fail(run, FailureKind.TIMEOUT, "Workflow step %d timed out after %s"
            .formatted(run.currentStepIndex() + 1, describe(timeout)));
        return true;
    }

    private void completeStep(WorkflowRunState run) {
        Instant now = clock.instant();
        WorkflowStep step = run.currentStep();
        WorkflowRunState updated = run;
        if (step != null) {
            String output = runs.lastAssistantText(run.conversationId()).orElse(null);
            updated = run.withCurrentStep(run.currentStepState().completed(output, now));
        }

        if (step != null && step.summarizeAfter() && !run.isLastStep()) {
            WorkflowRunState summarizing = updated.withPhase(RunPhase.SUMMARY);
            runs.set(summarizing);
            log.info("Workflow '{}' step {} done, requesting handoff summary",
                run.workflow().name(), run.currentStepIndex() + 1);
            send(summarizing, StepMessageBuilder.buildSummaryPrompt(), HANDOFF_OPTIONS);
            return;
        }
        advance(updated, now);
    }

    private void completeSummary(WorkflowRunState run) {
        String summary = runs.lastAssistantText(run.conversationId()).orElse("");
        if (summary.isEmpty()) {
            fail(run, FailureKind.SUMMARY_EXTRACTION, "Workflow step %d produced no summary"
                .formatted(run.currentStepIndex() + 1));
            return;
        }

        String title = "%s (Step %d)".formatted(run.workflow().name(), run.currentStepIndex() + 2);
        ConversationRef next;
        try {
            next = conversations.createConversation(run.spaceId(), title);
        } catch (RuntimeException e) {
            log.warn("Failed to create handoff conversation '{}'", title, e);
            next = null;
        }
        if (next == null) {
            // step states stay as they are; only the run ends
            WorkflowRunState ended = run.ended(clock.instant());
            runs.set(ended);
            report(ended, new RunFailure(FailureKind.CONVERSATION_CREATE,
                "Failed to create handoff conversation '%s'".formatted(title)));
            return;
        }

        WorkflowRunState handedOff = run.handedOff(next.id(), summary);
        runs.set(handedOff);
        log.info("Workflow '{}' handing off to conversation {}", run.workflow().name(), next.id());
        send(handedOff, StepMessageBuilder.buildSummaryInjection(summary), HANDOFF_OPTIONS);
    }

    private void completeHandoff(WorkflowRunState run) {
        advance(run, clock.instant());
    }

    private void advance(WorkflowRunState run, Instant now) {
        if (run.isLastStep()) {
            WorkflowRunState finished = run.finished(now);
            runs.set(finished);
            log.info("Workflow '{}' completed ({} steps)", run.workflow().name(), run.steps().size());
            listener.onRunFinished(finished);
            return;
        }
        runs.set(run.advanced());
        startStep();
    }

    private void send(WorkflowRunState run, String text, SendOptions options) {
        try {
            conversations.sendMessage(run.spaceId(), run.conversationId(), text, options);
        } catch (RuntimeException e) {
            log.warn("Failed to send message to conversation {}", run.conversationId(), e);
            fail(run, FailureKind.SEND, "Failed to send message for workflow step %d: %s"
                .formatted(run.currentStepIndex() + 1, e.getMessage()));
            return;
        }
        listener.onTurnSent(run);
    }

    /** Mark the current step as failed and end the run. */
    private void fail(WorkflowRunState run, FailureKind kind, String message) {
        Instant now = clock.instant();
        WorkflowRunState failed = run.withCurrentStep(run.currentStepState().failed(now)).ended(now);
        runs.set(failed);
        report(failed, new RunFailure(kind, message));
    }

    private void report(WorkflowRunState run, RunFailure failure) {
        log.warn("Workflow '{}' ended: {}", run.workflow().name(), failure.message());
        listener.onRunFailed(run, failure);
    }

    static String describe(Duration timeout) {
        if (timeout.toMillis() % 1000 == 0) {
            return timeout.toSeconds() + "s";
        }
        return timeout.toMillis() + "ms";
    }
}
