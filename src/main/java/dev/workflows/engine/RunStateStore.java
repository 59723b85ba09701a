package dev.workflows.engine;

import dev.workflows.backend.CachedConversation;
import dev.workflows.backend.CachedMessage;
import dev.workflows.backend.ConversationAdapter;
import dev.workflows.model.WorkflowRunState;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the single active {@link WorkflowRunState}. Writers replace the whole record;
 * readers on any thread see either the previous or the next snapshot.
 */
public final class RunStateStore {

    private final AtomicReference<WorkflowRunState> current = new AtomicReference<>();
    private final ConversationAdapter conversations;

    public RunStateStore(ConversationAdapter conversations) {
        this.conversations = conversations;
    }

    /**
     * @return the latest run, finished or not, or null if no run was started yet
     */
    public WorkflowRunState get() {
        return current.get();
    }

    public void set(WorkflowRunState next) {
        current.set(next);
    }

    public boolean isRunning() {
        WorkflowRunState run = current.get();
        return run != null && run.isRunning();
    }

    /**
     * The trimmed text of the most recent assistant message in a cached conversation.
     */
    public Optional<String> lastAssistantText(String conversationId) {
        CachedConversation conversation = conversations.getCachedConversation(conversationId);
        if (conversation == null) {
            return Optional.empty();
        }
        List<CachedMessage> messages = conversation.messages();
        for (int i = messages.size() - 1; i >= 0; i--) {
            CachedMessage message = messages.get(i);
            if (message.isAssistant()) {
                return Optional.ofNullable(message.content()).map(String::trim);
            }
        }
        return Optional.empty();
    }
}
