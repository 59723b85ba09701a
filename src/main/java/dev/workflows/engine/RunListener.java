package dev.workflows.engine;

import dev.workflows.model.RunFailure;
import dev.workflows.model.WorkflowRunState;

/**
 * Callbacks from the {@link PhaseTransitionEngine}. Invoked on the thread driving the transition.
 */
public interface RunListener {

    /** A message was handed to the agent backend and its completion is now awaited. */
    default void onTurnSent(WorkflowRunState run) {}

    /** The last step finished and the run ended successfully. */
    default void onRunFinished(WorkflowRunState run) {}

    /** The run ended early. */
    default void onRunFailed(WorkflowRunState run, RunFailure failure) {}
}
