package dev.workflows.backend;

import java.util.List;

/**
 * Messages of a conversation as currently held in the client-side cache, oldest first.
 */
public record CachedConversation(String id, List<CachedMessage> messages) {
    public CachedConversation {
        messages = messages != null ? List.copyOf(messages) : List.of();
    }
}
