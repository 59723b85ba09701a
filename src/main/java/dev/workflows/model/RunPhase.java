package dev.workflows.model;

/**
 * Sub-state of a running workflow, distinct from the per-step status.
 */
public enum RunPhase {
    /** The current step's message has been sent and its reply is awaited. */
    STEP,
    /** The summarization prompt has been sent to the step's conversation. */
    SUMMARY,
    /** The summary has been injected into a fresh conversation and the acknowledgment is awaited. */
    SUMMARY_INJECT
}
