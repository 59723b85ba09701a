package dev.workflows.engine;

import dev.workflows.backend.CachedConversation;
import dev.workflows.backend.CachedMessage;
import dev.workflows.backend.ConversationAdapter;
import dev.workflows.backend.ConversationRef;
import dev.workflows.backend.SendOptions;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * In-memory conversation backend that records every call. Replies are scripted per
 * conversation with {@link #reply}.
 */
class RecordingConversations implements ConversationAdapter {

    record Sent(String spaceId, String conversationId, String text, SendOptions options) {}

    final List<String> createdTitles = new ArrayList<>();
    final List<Sent> sent = new ArrayList<>();
    final List<String> stopped = new ArrayList<>();

    private final Map<String, List<CachedMessage>> messages = new HashMap<>();
    private int nextId = 1;
    private boolean failCreate;
    private RuntimeException sendFailure;
    private Consumer<Sent> onSend = s -> {};

    @Override
    public ConversationRef createConversation(String spaceId, String title) {
        createdTitles.add(title);
        if (failCreate) {
            return null;
        }
        String id = "conv-" + nextId++;
        messages.put(id, new ArrayList<>());
        return new ConversationRef(id);
    }

    @Override
    public void sendMessage(String spaceId, String conversationId, String text, SendOptions options) {
        if (sendFailure != null) {
            throw sendFailure;
        }
        Sent record = new Sent(spaceId, conversationId, text, options);
        sent.add(record);
        messages.computeIfAbsent(conversationId, k -> new ArrayList<>())
            .add(new CachedMessage(CachedMessage.ROLE_USER, text));
        onSend.accept(record);
    }

    @Override
    public void stopGeneration(String conversationId) {
        stopped.add(conversationId);
    }

    @Override
    public CachedConversation getCachedConversation(String conversationId) {
        List<CachedMessage> cached = messages.get(conversationId);
        return cached == null ? null : new CachedConversation(conversationId, cached);
    }

    /** Append an assistant reply as if the agent had answered. */
    void reply(String conversationId, String content) {
        messages.computeIfAbsent(conversationId, k -> new ArrayList<>())
            .add(new CachedMessage(CachedMessage.ROLE_ASSISTANT, content));
    }

    Sent lastSent() {
        return sent.get(sent.size() - 1);
    }

    void failCreate() {
        this.failCreate = true;
    }

    void failSends(RuntimeException failure) {
        this.sendFailure = failure;
    }

    void onSend(Consumer<Sent> callback) {
        this.onSend = callback;
    }
}
