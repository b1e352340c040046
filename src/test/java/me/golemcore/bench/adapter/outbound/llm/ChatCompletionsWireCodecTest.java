package me.golemcore.bench.adapter.outbound.llm;

import me.golemcore.bench.domain.model.ConversationItem;
import me.golemcore.bench.domain.model.ToolCall;
import me.golemcore.bench.domain.model.TurnOutput;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChatCompletionsWireCodecTest {

    @Test
    void shouldCoalesceAssistantTextAndFollowingToolCalls() {
        List<ChatCompletionsWireCodec.ApiMessage> messages = ChatCompletionsWireCodec.encodeItems(conversation());

        assertEquals(List.of("system", "user", "assistant", "tool", "tool", "assistant", "tool", "assistant"),
                messages.stream().map(ChatCompletionsWireCodec.ApiMessage::getRole).toList());

        ChatCompletionsWireCodec.ApiMessage withText = messages.get(2);
        assertEquals("Checking two pages.", withText.getContent());
        assertEquals(2, withText.getToolCalls().size());
        assertEquals("call_2", withText.getToolCalls().get(1).getId());
        assertEquals("function", withText.getToolCalls().get(1).getType());

        ChatCompletionsWireCodec.ApiMessage callsOnly = messages.get(5);
        assertNull(callsOnly.getContent());
        assertEquals("call_3", callsOnly.getToolCalls().get(0).getId());
        assertEquals("call_3", messages.get(6).getToolCallId());
    }

    @Test
    void shouldDecodeEncodedMessagesBackToConversation() {
        List<ConversationItem> items = conversation();

        assertEquals(items, ChatCompletionsWireCodec.decodeItems(ChatCompletionsWireCodec.encodeItems(items)));
    }

    @Test
    void shouldRejectUnknownRole() {
        ChatCompletionsWireCodec.ApiMessage message = new ChatCompletionsWireCodec.ApiMessage();
        message.setRole("developer");

        assertThrows(IllegalArgumentException.class, () -> ChatCompletionsWireCodec.decodeItems(List.of(message)));
    }

    @Test
    void shouldGenerateIdsForAnonymousToolCalls() {
        ChatCompletionsWireCodec.ApiFunction function = new ChatCompletionsWireCodec.ApiFunction();
        function.setName("web_fetch");
        ChatCompletionsWireCodec.ApiToolCall call = new ChatCompletionsWireCodec.ApiToolCall();
        call.setFunction(function);
        ChatCompletionsWireCodec.ApiMessage message = new ChatCompletionsWireCodec.ApiMessage();
        message.setRole("assistant");
        message.setToolCalls(List.of(call));
        ChatCompletionsWireCodec.ChatChoice choice = new ChatCompletionsWireCodec.ChatChoice();
        choice.setMessage(message);
        ChatCompletionsWireCodec.ChatCompletionResponse response = new ChatCompletionsWireCodec.ChatCompletionResponse();
        response.setChoices(List.of(choice));

        TurnOutput output = ChatCompletionsWireCodec.decode(response);

        ToolCall decoded = output.getToolCalls().get(0);
        assertTrue(decoded.getId().startsWith("call_"));
        assertEquals("{}", decoded.getArguments());
        assertNull(output.getUsage());
    }

    private static List<ConversationItem> conversation() {
        return List.of(
                ConversationItem.system("system"),
                ConversationItem.user("question"),
                ConversationItem.assistant("Checking two pages.", null),
                call("call_1", "web_fetch"),
                call("call_2", "analyze_page"),
                ConversationItem.toolResult("call_1", "first"),
                ConversationItem.toolResult("call_2", "second"),
                call("call_3", "verifaible_cite"),
                ConversationItem.toolResult("call_3", "Citation created (user_seq=4)."),
                ConversationItem.assistant("Answer [@v:4]", null));
    }

    private static ConversationItem call(String id, String name) {
        return ConversationItem.toolCall(ToolCall.builder().id(id).name(name).arguments("{}").build());
    }
}
