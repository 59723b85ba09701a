package dev.workflows.engine;

import dev.workflows.model.RunPhase;
import dev.workflows.model.WorkflowRunState;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static dev.workflows.engine.WorkflowFixtures.message;
import static dev.workflows.engine.WorkflowFixtures.workflow;
import static org.assertj.core.api.Assertions.assertThat;

class RunStateStoreTest {

    private final RecordingConversations conversations = new RecordingConversations();
    private final RunStateStore store = new RunStateStore(conversations);

    @Test
    void startsEmpty() {
        assertThat(store.get()).isNull();
        assertThat(store.isRunning()).isFalse();
    }

    @Test
    void setReplacesWholeSnapshot() {
        var run = WorkflowRunState.start(workflow("wf", message("s1", "hi")), "space-1", "conv-1", Instant.EPOCH);
        store.set(run);

        WorkflowRunState held = store.get();
        store.set(run.withPhase(RunPhase.SUMMARY));

        assertThat(held.phase()).isEqualTo(RunPhase.STEP);
        assertThat(store.get().phase()).isEqualTo(RunPhase.SUMMARY);
        assertThat(store.isRunning()).isTrue();
    }

    @Test
    void lastAssistantTextIsTrimmedLatestReply() {
        String id = conversations.createConversation("space-1", "t").id();
        conversations.reply(id, "first");
        conversations.sendMessage("space-1", id, "next please", null);
        conversations.reply(id, "  second \n");
        conversations.sendMessage("space-1", id, "and again", null);

        assertThat(store.lastAssistantText(id)).contains("second");
    }

    @Test
    void lastAssistantTextIsEmptyWithoutReplies() {
        String id = conversations.createConversation("space-1", "t").id();
        conversations.sendMessage("space-1", id, "hello?", null);

        assertThat(store.lastAssistantText(id)).isEmpty();
        assertThat(store.lastAssistantText("not-cached")).isEmpty();
    }
}
