package dev.workflows.model;

import java.time.Instant;

/**
 * Progress of one workflow step within a run.
 */
public record StepRunState(
    String id,
    StepStatus status,
    String output,      // nullable, last assistant text once completed
    Instant startedAt,  // nullable
    Instant endedAt     // nullable
) {
    public static StepRunState pending(String id) {
        return new StepRunState(id, StepStatus.PENDING, null, null, null);
    }

    public StepRunState running(Instant now) {
        return new StepRunState(id, StepStatus.RUNNING, output, now, null);
    }

    public StepRunState completed(String output, Instant now) {
        return new StepRunState(id, StepStatus.COMPLETED, output, startedAt, now);
    }

    public StepRunState failed(Instant now) {
        return new StepRunState(id, StepStatus.ERROR, output, startedAt, now);
    }
}
