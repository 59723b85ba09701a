package dev.workflows.backend;

/**
 * Per-message flags passed to the agent backend.
 */
public record SendOptions(
    Boolean thinkingEnabled,   // nullable, backend default
    Boolean aiBrowserEnabled,  // nullable, backend default
    String originTag
) {}
