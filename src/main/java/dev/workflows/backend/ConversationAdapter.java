package dev.workflows.backend;

/**
 * Abstraction over the conversational agent backend. Replies are not returned from
 * {@link #sendMessage}; the backend reports a finished turn later through a completion event
 * and the reply is read back with {@link #getCachedConversation}.
 */
public interface ConversationAdapter {

    /** Origin tag attached to every message the workflow engine sends. */
    String ORIGIN_WORKFLOW_STEP = "workflow-step";

    /**
     * Create a conversation in the given space.
     *
     * @return the new conversation, or null if the backend could not create one
     */
    ConversationRef createConversation(String spaceId, String title);

    /**
     * Post a user message and start generation. Fire-and-forget.
     */
    void sendMessage(String spaceId, String conversationId, String text, SendOptions options);

    /** Ask the backend to abort any in-flight generation in the conversation. */
    void stopGeneration(String conversationId);

    /**
     * @return the cached conversation, or null if it is not cached
     */
    CachedConversation getCachedConversation(String conversationId);
}
