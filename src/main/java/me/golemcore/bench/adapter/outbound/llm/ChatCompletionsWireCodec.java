package me.golemcore.bench.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import me.golemcore.bench.domain.model.ConversationItem;
import me.golemcore.bench.domain.model.LlmRequest;
import me.golemcore.bench.domain.model.OutputItem;
import me.golemcore.bench.domain.model.TokenUsage;
import me.golemcore.bench.domain.model.ToolCall;
import me.golemcore.bench.domain.model.ToolDefinition;
import me.golemcore.bench.domain.model.TurnOutput;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Wire codec for the OpenAI-compatible chat-completions protocol.
 *
 * <p>
 * The full history is sent every round. An assistant message followed by tool
 * calls, and any run of consecutive tool calls, collapse into one assistant
 * message carrying a {@code tool_calls} array; each tool result becomes a
 * {@code role=tool} message.
 */
public final class ChatCompletionsWireCodec {

    private static final String ROLE_SYSTEM = "system";
    private static final String ROLE_USER = "user";
    private static final String ROLE_ASSISTANT = "assistant";
    private static final String ROLE_TOOL = "tool";
    private static final String TYPE_FUNCTION = "function";
    private static final int GENERATED_ID_HEX_CHARS = 24;

    private ChatCompletionsWireCodec() {
    }

    public static ChatCompletionRequest encode(LlmRequest request) {
        ChatCompletionRequest wire = new ChatCompletionRequest();
        wire.setModel(request.getModel());
        wire.setMessages(encodeItems(request.getItems()));
        if (request.getTools() != null && !request.getTools().isEmpty()) {
            wire.setTools(request.getTools().stream().map(ChatCompletionsWireCodec::encodeTool).toList());
        }
        wire.setTemperature(request.getTemperature());
        wire.setMaxTokens(request.getMaxOutputTokens());
        return wire;
    }

    public static List<ApiMessage> encodeItems(List<ConversationItem> items) {
        List<ApiMessage> messages = new ArrayList<>();
        if (items == null) {
            return messages;
        }

        ApiMessage pendingAssistant = null;
        for (ConversationItem item : items) {
            switch (item.getType()) {
            case SYSTEM -> {
                pendingAssistant = null;
                messages.add(message(ROLE_SYSTEM, item.getContent()));
            }
            case USER -> {
                pendingAssistant = null;
                messages.add(message(ROLE_USER, item.getContent()));
            }
            case ASSISTANT -> {
                pendingAssistant = message(ROLE_ASSISTANT, item.getContent());
                messages.add(pendingAssistant);
            }
            case TOOL_CALL -> {
                if (pendingAssistant == null) {
                    pendingAssistant = new ApiMessage();
                    pendingAssistant.setRole(ROLE_ASSISTANT);
                    messages.add(pendingAssistant);
                }
                if (pendingAssistant.getToolCalls() == null) {
                    pendingAssistant.setToolCalls(new ArrayList<>());
                }
                pendingAssistant.getToolCalls().add(encodeToolCall(item));
            }
            case TOOL_RESULT -> {
                pendingAssistant = null;
                ApiMessage tool = message(ROLE_TOOL, item.getContent());
                tool.setToolCallId(item.getCallId());
                messages.add(tool);
            }
            default -> throw new IllegalStateException("Unsupported item type: " + item.getType());
            }
        }
        return messages;
    }

    /**
     * Parses encoded messages back into canonical items. An assistant message
     * without text but with tool calls yields only the calls.
     */
    public static List<ConversationItem> decodeItems(List<ApiMessage> messages) {
        List<ConversationItem> items = new ArrayList<>();
        for (ApiMessage message : messages) {
            String role = message.getRole();
            if (ROLE_SYSTEM.equals(role)) {
                items.add(ConversationItem.system(message.getContent()));
            } else if (ROLE_USER.equals(role)) {
                items.add(ConversationItem.user(message.getContent()));
            } else if (ROLE_ASSISTANT.equals(role)) {
                boolean hasCalls = message.getToolCalls() != null && !message.getToolCalls().isEmpty();
                if (message.getContent() != null || !hasCalls) {
                    items.add(ConversationItem.assistant(message.getContent(), message.getReasoningContent()));
                }
                if (hasCalls) {
                    for (ApiToolCall call : message.getToolCalls()) {
                        items.add(ConversationItem.toolCall(decodeToolCall(call)));
                    }
                }
            } else if (ROLE_TOOL.equals(role)) {
                items.add(ConversationItem.toolResult(message.getToolCallId(), message.getContent()));
            } else {
                throw new IllegalArgumentException("Unrecognized message role: " + role);
            }
        }
        return items;
    }

    /**
     * Converts the first choice into canonical output: reasoning, then text,
     * then tool calls.
     */
    public static TurnOutput decode(ChatCompletionResponse response) {
        List<OutputItem> items = new ArrayList<>();
        String finishReason = null;

        if (response.getChoices() != null && !response.getChoices().isEmpty()) {
            ChatChoice choice = response.getChoices().get(0);
            finishReason = choice.getFinishReason();
            ApiMessage message = choice.getMessage();
            if (message != null) {
                if (message.getReasoningContent() != null && !message.getReasoningContent().isEmpty()) {
                    items.add(new OutputItem.ReasoningOutput(message.getReasoningContent()));
                }
                if (message.getContent() != null && !message.getContent().isEmpty()) {
                    items.add(new OutputItem.TextOutput(message.getContent()));
                }
                if (message.getToolCalls() != null) {
                    for (ApiToolCall call : message.getToolCalls()) {
                        items.add(new OutputItem.ToolCallOutput(decodeToolCall(call)));
                    }
                }
            }
        }

        TokenUsage usage = null;
        if (response.getUsage() != null) {
            usage = new TokenUsage(response.getUsage().getPromptTokens(), response.getUsage().getCompletionTokens());
        }

        String responseId = response.getId() != null && !response.getId().isBlank()
                ? response.getId()
                : "chat-" + UUID.randomUUID();

        return TurnOutput.builder()
                .responseId(responseId)
                .model(response.getModel())
                .status(finishReason)
                .items(items)
                .usage(usage)
                .build();
    }

    static String generateCallId() {
        return "call_" + UUID.randomUUID().toString().replace("-", "").substring(0, GENERATED_ID_HEX_CHARS);
    }

    private static ToolCall decodeToolCall(ApiToolCall call) {
        String id = call.getId() != null && !call.getId().isBlank() ? call.getId() : generateCallId();
        ApiFunction function = call.getFunction();
        String name = function != null ? function.getName() : null;
        String arguments = function != null && function.getArguments() != null ? function.getArguments() : "{}";
        return ToolCall.builder().id(id).name(name).arguments(arguments).build();
    }

    private static ApiToolCall encodeToolCall(ConversationItem item) {
        ApiFunction function = new ApiFunction();
        function.setName(item.getToolName());
        function.setArguments(item.getArguments());

        ApiToolCall call = new ApiToolCall();
        call.setId(item.getCallId());
        call.setType(TYPE_FUNCTION);
        call.setFunction(function);
        return call;
    }

    private static ApiMessage message(String role, String content) {
        ApiMessage message = new ApiMessage();
        message.setRole(role);
        message.setContent(content != null ? content : "");
        return message;
    }

    private static ApiTool encodeTool(ToolDefinition tool) {
        ApiToolFunction function = new ApiToolFunction();
        function.setName(tool.getName());
        function.setDescription(tool.getDescription());
        function.setParameters(tool.getInputSchema());

        ApiTool apiTool = new ApiTool();
        apiTool.setType(TYPE_FUNCTION);
        apiTool.setFunction(function);
        return apiTool;
    }

    // API DTOs
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChatCompletionRequest {
        private String model;
        private List<ApiMessage> messages;
        private List<ApiTool> tools;
        private Double temperature;
        @JsonProperty("max_tokens")
        private Integer maxTokens;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChatCompletionResponse {
        private String id;
        private String model;
        private List<ChatChoice> choices;
        private ApiUsage usage;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChatChoice {
        private int index;
        private ApiMessage message;
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiMessage {
        private String role;
        @JsonInclude(JsonInclude.Include.ALWAYS)
        private String content;
        @JsonProperty("reasoning_content")
        private String reasoningContent;
        @JsonProperty("tool_calls")
        private List<ApiToolCall> toolCalls;
        @JsonProperty("tool_call_id")
        private String toolCallId;
    }

    @Data
    public static class ApiTool {
        private String type;
        private ApiToolFunction function;
    }

    @Data
    public static class ApiToolFunction {
        private String name;
        private String description;
        private Map<String, Object> parameters;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiToolCall {
        private String id;
        private String type;
        private ApiFunction function;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiFunction {
        private String name;
        private String arguments;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiUsage {
        @JsonProperty("prompt_tokens")
        private int promptTokens;
        @JsonProperty("completion_tokens")
        private int completionTokens;
        @JsonProperty("total_tokens")
        private int totalTokens;
    }
}
