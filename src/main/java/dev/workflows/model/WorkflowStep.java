package dev.workflows.model;

/**
 * A single entry of a workflow definition.
 */
public record WorkflowStep(
    String id,
    StepKind kind,
    String name,   // nullable, may be namespace-qualified as "namespace:name"
    String input,  // nullable
    String args,   // nullable, skill steps only
    boolean summarizeAfter
) {}
