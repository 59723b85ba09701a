package dev.workflows.model;

/**
 * Why a run did not start or ended early.
 */
public record RunFailure(FailureKind kind, String message) {}
