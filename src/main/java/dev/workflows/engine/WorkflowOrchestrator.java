package dev.workflows.engine;

import dev.workflows.backend.ConversationAdapter;
import dev.workflows.backend.ConversationRef;
import dev.workflows.backend.ResourceCatalogs;
import dev.workflows.backend.StoreResult;
import dev.workflows.backend.WorkflowPatch;
import dev.workflows.backend.WorkflowStore;
import dev.workflows.model.AgentCompleteEvent;
import dev.workflows.model.FailureKind;
import dev.workflows.model.RunFailure;
import dev.workflows.model.WorkflowDefinition;
import dev.workflows.model.WorkflowRunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for running workflows: validates resources, opens the conversation, and feeds
 * completion events into the {@link PhaseTransitionEngine}.
 *
 * <p>At most one run exists per instance. All state changes happen under a single lock, so
 * {@link #runWorkflow}, {@link #stopRun}, completion events and turn deadlines never interleave.
 * A completion event that arrives while another completion is being processed is dropped, whether
 * it comes from another thread or from inside the transition itself (an adapter that reports
 * completion before {@code sendMessage} returns). Other events wait for the lock.
 */
public final class WorkflowOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);

    /** Mid-run failures that are reported through {@link #error()}. */
    private static final String LOAD_FAILED = "Failed to load workflow";

    private static final Set<FailureKind> SURFACED = EnumSet.of(
        FailureKind.BUILD, FailureKind.SEND, FailureKind.TIMEOUT);

    private final WorkflowStore workflows;
    private final ResourceCatalogs catalogs;
    private final ConversationAdapter conversations;
    private final EngineSettings settings;
    private final Clock clock;
    private final ScheduledExecutorService deadlines;
    private final boolean ownsDeadlines;

    private final RunStateStore runs;
    private final PhaseTransitionEngine engine;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile String error;
    private volatile RunFailure lastFailure;
    private ScheduledFuture<?> pendingDeadline; // guarded by lock
    // odd while a completion event is being processed
    private final AtomicLong transitions = new AtomicLong();

    public WorkflowOrchestrator(WorkflowStore workflows, ResourceCatalogs catalogs,
                                ConversationAdapter conversations, EngineSettings settings) {
        this(workflows, catalogs, conversations, settings, Clock.systemUTC(),
            Executors.newSingleThreadScheduledExecutor(r -> {
                Thread thread = new Thread(r, "workflow-deadline");
                thread.setDaemon(true);
                return thread;
            }), true);
    }

    WorkflowOrchestrator(WorkflowStore workflows, ResourceCatalogs catalogs,
                         ConversationAdapter conversations, EngineSettings settings,
                         Clock clock, ScheduledExecutorService deadlines) {
        this(workflows, catalogs, conversations, settings, clock, deadlines, false);
    }

    private WorkflowOrchestrator(WorkflowStore workflows, ResourceCatalogs catalogs,
                                 ConversationAdapter conversations, EngineSettings settings,
                                 Clock clock, ScheduledExecutorService deadlines, boolean ownsDeadlines) {
        this.workflows = workflows;
        this.catalogs = catalogs;
        this.conversations = conversations;
        this.settings = settings;
        this.clock = clock;
        this.deadlines = deadlines;
        this.ownsDeadlines = ownsDeadlines;
        this.runs = new RunStateStore(conversations);
        this.engine = new PhaseTransitionEngine(runs, conversations, clock, new EngineEvents());
    }

    /**
     * Start a run of the given workflow. Does nothing while another run is active.
     * When the workflow cannot be loaded or references missing resources, {@link #error()}
     * describes why and no conversation is created.
     */
    public void runWorkflow(String spaceId, String workflowId) {
        lock.lock();
        try {
            if (runs.isRunning()) {
                log.debug("Run already active, ignoring request for workflow {}", workflowId);
                return;
            }
            error = null;
            lastFailure = null;

            StoreResult<WorkflowDefinition> loaded = load(spaceId, workflowId);
            if (!loaded.hasData()) {
                reject(FailureKind.LOAD, loaded.error() != null ? loaded.error() : LOAD_FAILED);
                return;
            }
            WorkflowDefinition workflow = loaded.data();
            if (workflow.steps().isEmpty()) {
                reject(FailureKind.VALIDATION, "Workflow '%s' has no steps".formatted(workflow.name()));
                return;
            }

            List<String> missing = ResourceValidator.validate(workflow, catalogs, spaceId, settings.locale());
            if (!missing.isEmpty()) {
                reject(FailureKind.VALIDATION, ResourceValidator.describe(missing));
                return;
            }

            ConversationRef conversation = openConversation(spaceId, workflow.name());
            if (conversation == null) {
                reject(FailureKind.CONVERSATION_CREATE, "Failed to create workflow conversation");
                return;
            }

            Instant now = clock.instant();
            runs.set(WorkflowRunState.start(workflow, spaceId, conversation.id(), now));
            log.info("Starting workflow '{}' ({} steps) in conversation {}",
                workflow.name(), workflow.steps().size(), conversation.id());
            recordRun(spaceId, workflowId, now, conversation.id());

            engine.startStep();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop the active run. Step states are left as they are. Idempotent.
     */
    public void stopRun() {
        lock.lock();
        try {
            WorkflowRunState run = runs.get();
            if (run == null || !run.isRunning()) {
                return;
            }
            try {
                conversations.stopGeneration(run.conversationId());
            } catch (RuntimeException e) {
                log.warn("Failed to stop generation in conversation {}", run.conversationId(), e);
            }
            runs.set(run.ended(clock.instant()));
            cancelDeadline();
            log.info("Workflow '{}' stopped at step {}", run.workflow().name(), run.currentStepIndex() + 1);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Feed a completion event from the agent backend. Events for other conversations or spaces,
     * events after the run ended, and events arriving while another completion is being processed
     * are ignored.
     */
    public void handleAgentComplete(AgentCompleteEvent event) {
        long seen = transitions.get();
        if (lock.isHeldByCurrentThread() || seen % 2 != 0) {
            dropped(event);
            return;
        }
        lock.lock();
        try {
            if (transitions.get() != seen) {
                dropped(event);
                return;
            }
            transitions.incrementAndGet();
            try {
                engine.handleAgentComplete(event);
            } finally {
                transitions.incrementAndGet();
            }
        } finally {
            lock.unlock();
        }
    }

    /** The current or most recent run. */
    public Optional<WorkflowRunState> activeRun() {
        return Optional.ofNullable(runs.get());
    }

    /** Human-readable reason the last run did not start or ended early. */
    public Optional<String> error() {
        return Optional.ofNullable(error);
    }

    public Optional<RunFailure> lastFailure() {
        return Optional.ofNullable(lastFailure);
    }

    @Override
    public void close() {
        lock.lock();
        try {
            cancelDeadline();
        } finally {
            lock.unlock();
        }
        if (ownsDeadlines) {
            deadlines.shutdownNow();
        }
    }

    private ConversationRef openConversation(String spaceId, String title) {
        try {
            return conversations.createConversation(spaceId, title);
        } catch (RuntimeException e) {
            log.warn("Failed to create conversation '{}' in space {}", title, spaceId, e);
            return null;
        }
    }

    private StoreResult<WorkflowDefinition> load(String spaceId, String workflowId) {
        try {
            return workflows.get(spaceId, workflowId);
        } catch (RuntimeException e) {
            log.warn("Failed to load workflow {} in space {}", workflowId, spaceId, e);
            return StoreResult.failed(LOAD_FAILED);
        }
    }

    private void recordRun(String spaceId, String workflowId, Instant startedAt, String conversationId) {
        StoreResult<WorkflowDefinition> updated;
        try {
            updated = workflows.update(spaceId, workflowId, WorkflowPatch.runMetadata(startedAt, conversationId));
        } catch (RuntimeException e) {
            log.warn("Failed to record run metadata for workflow {}", workflowId, e);
            return;
        }
        if (!updated.success()) {
            log.warn("Failed to record run metadata for workflow {}: {}", workflowId, updated.error());
        }
    }

    private static void dropped(AgentCompleteEvent event) {
        log.debug("Transition in progress, dropping completion for conversation {}", event.conversationId());
    }

    private void reject(FailureKind kind, String message) {
        log.warn(message);
        lastFailure = new RunFailure(kind, message);
        error = message;
    }

    private void armDeadline(WorkflowRunState run) {
        cancelDeadline();
        if (!settings.hasTurnTimeout()) {
            return;
        }
        TurnKey turn = TurnKey.of(run);
        pendingDeadline = deadlines.schedule(() -> expire(turn),
            settings.turnTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void expire(TurnKey turn) {
        lock.lock();
        try {
            engine.expireTurn(turn, settings.turnTimeout());
        } finally {
            lock.unlock();
        }
    }

    private void cancelDeadline() {
        if (pendingDeadline != null) {
            pendingDeadline.cancel(false);
            pendingDeadline = null;
        }
    }

    private final class EngineEvents implements RunListener {

        @Override
        public void onTurnSent(WorkflowRunState run) {
            armDeadline(run);
        }

        @Override
        public void onRunFinished(WorkflowRunState run) {
            cancelDeadline();
        }

        @Override
        public void onRunFailed(WorkflowRunState run, RunFailure failure) {
            cancelDeadline();
            lastFailure = failure;
            if (SURFACED.contains(failure.kind())) {
                error = failure.message();
            }
        }
    }
}
