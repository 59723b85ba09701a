package dev.workflows.model;

public enum FailureKind {
    /** The workflow definition could not be loaded. */
    LOAD,
    /** One or more step resources are missing; the run never starts. */
    VALIDATION,
    /** A step produced an empty message. */
    BUILD,
    /** The summarization turn left no assistant text. */
    SUMMARY_EXTRACTION,
    /** A conversation could not be created. */
    CONVERSATION_CREATE,
    /** The agent backend rejected a message. */
    SEND,
    /** No completion event arrived before the turn deadline. */
    TIMEOUT
}
