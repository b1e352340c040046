package me.golemcore.bench.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationTest {

    @Test
    void shouldStartWithSystemAndUser() {
        Conversation conversation = Conversation.start("system", "question");

        assertEquals(2, conversation.size());
        assertEquals(ConversationItem.Type.SYSTEM, conversation.getItems().get(0).getType());
        assertEquals("question", conversation.getItems().get(1).getContent());
    }

    @Test
    void shouldSkipBlankSystemPrompt() {
        Conversation conversation = Conversation.start(" ", "question");

        assertEquals(1, conversation.size());
        assertEquals(ConversationItem.Type.USER, conversation.getItems().get(0).getType());
    }

    @Test
    void shouldTrackPendingCallsUntilAnswered() {
        Conversation conversation = Conversation.start("system", "question");
        conversation.appendToolCall(call("c1"));
        conversation.appendToolCall(call("c2"));

        assertTrue(conversation.hasPendingToolCalls());
        assertEquals(List.of("c1", "c2"), conversation.getPendingCallIds());

        conversation.appendToolResult("c2", "two");
        conversation.appendToolResult("c1", "one");

        assertFalse(conversation.hasPendingToolCalls());
        conversation.appendAssistant("done", null);
        assertEquals(7, conversation.size());
    }

    @Test
    void shouldRejectMessagesWhileCallsAreUnanswered() {
        Conversation conversation = Conversation.start("system", "question");
        conversation.appendToolCall(call("c1"));

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> conversation.appendAssistant("too early", null));
        assertTrue(error.getMessage().contains("c1"));
        assertThrows(IllegalStateException.class, () -> conversation.appendUser("hello"));
    }

    @Test
    void shouldRejectOrphanAndDuplicateIds() {
        Conversation conversation = Conversation.start("system", "question");

        assertThrows(IllegalStateException.class, () -> conversation.appendToolResult("nope", "x"));

        conversation.appendToolCall(call("c1"));
        conversation.appendToolResult("c1", "x");
        assertTrue(conversation.isCallIdUsed("c1"));
        assertThrows(IllegalStateException.class, () -> conversation.appendToolCall(call("c1")));
        assertThrows(IllegalStateException.class, () -> conversation.appendToolCall(call(" ")));
    }

    @Test
    void shouldValidateItemsWhenRebuilding() {
        List<ConversationItem> valid = List.of(
                ConversationItem.user("q"),
                ConversationItem.toolCall(call("c1")),
                ConversationItem.toolResult("c1", "r"),
                ConversationItem.assistant("a", null));
        assertEquals(4, Conversation.of(valid).size());

        List<ConversationItem> broken = List.of(
                ConversationItem.user("q"),
                ConversationItem.toolCall(call("c1")),
                ConversationItem.assistant("a", null));
        assertThrows(IllegalStateException.class, () -> Conversation.of(broken));
    }

    @Test
    void shouldExposeReadOnlyItems() {
        Conversation conversation = Conversation.start("system", "question");

        assertThrows(UnsupportedOperationException.class,
                () -> conversation.getItems().add(ConversationItem.user("x")));
    }

    private static ToolCall call(String id) {
        return ToolCall.builder().id(id).name("web_fetch").arguments("{}").build();
    }
}
