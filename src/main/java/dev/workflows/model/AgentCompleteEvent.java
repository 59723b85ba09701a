package dev.workflows.model;

/**
 * Reported by the agent backend when a turn in a conversation has finished.
 * Carries identity only; the reply itself is read from the conversation cache.
 */
public record AgentCompleteEvent(String spaceId, String conversationId) {}
