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

/**
 * Wire codec for the Responses protocol: role messages, {@code function_call}
 * and {@code function_call_output} items in one flat {@code input} list.
 */
public final class ResponsesWireCodec {

    static final String TYPE_FUNCTION = "function";
    static final String TYPE_FUNCTION_CALL = "function_call";
    static final String TYPE_FUNCTION_CALL_OUTPUT = "function_call_output";
    static final String TYPE_TEXT = "text";
    static final String TYPE_MESSAGE = "message";
    static final String TYPE_OUTPUT_TEXT = "output_text";
    static final String TYPE_REASONING = "reasoning";
    static final String STATUS_FAILED = "failed";

    private static final String ROLE_SYSTEM = "system";
    private static final String ROLE_USER = "user";
    private static final String ROLE_ASSISTANT = "assistant";

    private ResponsesWireCodec() {
    }

    public static ResponsesRequest encode(LlmRequest request) {
        ResponsesRequest wire = new ResponsesRequest();
        wire.setModel(request.getModel());
        wire.setInput(encodeItems(request.getItems()));
        if (request.getTools() != null && !request.getTools().isEmpty()) {
            wire.setTools(request.getTools().stream().map(ResponsesWireCodec::encodeTool).toList());
        }
        wire.setTemperature(request.getTemperature());
        wire.setMaxOutputTokens(request.getMaxOutputTokens());
        wire.setPreviousResponseId(request.getPreviousResponseId());
        return wire;
    }

    public static List<InputItem> encodeItems(List<ConversationItem> items) {
        List<InputItem> input = new ArrayList<>();
        if (items == null) {
            return input;
        }
        for (ConversationItem item : items) {
            InputItem wire = new InputItem();
            switch (item.getType()) {
            case SYSTEM -> message(wire, ROLE_SYSTEM, item.getContent());
            case USER -> message(wire, ROLE_USER, item.getContent());
            case ASSISTANT -> message(wire, ROLE_ASSISTANT, item.getContent());
            case TOOL_CALL -> {
                wire.setType(TYPE_FUNCTION_CALL);
                wire.setCallId(item.getCallId());
                wire.setName(item.getToolName());
                wire.setArguments(item.getArguments());
            }
            case TOOL_RESULT -> {
                wire.setType(TYPE_FUNCTION_CALL_OUTPUT);
                wire.setCallId(item.getCallId());
                wire.setOutput(item.getContent() != null ? item.getContent() : "");
            }
            default -> throw new IllegalStateException("Unsupported item type: " + item.getType());
            }
            input.add(wire);
        }
        return input;
    }

    /**
     * Parses an encoded input list back into canonical items.
     */
    public static List<ConversationItem> decodeItems(List<InputItem> input) {
        List<ConversationItem> items = new ArrayList<>();
        for (InputItem wire : input) {
            if (TYPE_FUNCTION_CALL.equals(wire.getType())) {
                items.add(ConversationItem.toolCall(ToolCall.builder()
                        .id(wire.getCallId())
                        .name(wire.getName())
                        .arguments(wire.getArguments())
                        .build()));
            } else if (TYPE_FUNCTION_CALL_OUTPUT.equals(wire.getType())) {
                items.add(ConversationItem.toolResult(wire.getCallId(), wire.getOutput()));
            } else if (ROLE_SYSTEM.equals(wire.getRole())) {
                items.add(ConversationItem.system(wire.getContent()));
            } else if (ROLE_USER.equals(wire.getRole())) {
                items.add(ConversationItem.user(wire.getContent()));
            } else if (ROLE_ASSISTANT.equals(wire.getRole())) {
                items.add(ConversationItem.assistant(wire.getContent(), null));
            } else {
                throw new IllegalArgumentException("Unrecognized input item: type=" + wire.getType()
                        + ", role=" + wire.getRole());
            }
        }
        return items;
    }

    /**
     * Converts a response into canonical output. Unknown item types are
     * skipped.
     *
     * @throws LlmTransportException
     *             if the body reports an error or a failed status
     */
    public static TurnOutput decode(ResponsesResult result) {
        if (result.getError() != null || STATUS_FAILED.equals(result.getStatus())) {
            String message = result.getError() != null && result.getError().getMessage() != null
                    ? result.getError().getMessage()
                    : "response status " + result.getStatus();
            throw new LlmTransportException("openrouter error: " + message, LlmTransportException.NO_STATUS, false);
        }

        List<OutputItem> items = new ArrayList<>();
        if (result.getOutput() != null) {
            for (ResponseOutput output : result.getOutput()) {
                decodeOutput(output, items);
            }
        }

        TokenUsage usage = null;
        if (result.getUsage() != null) {
            usage = new TokenUsage(result.getUsage().getInputTokens(), result.getUsage().getOutputTokens());
        }

        return TurnOutput.builder()
                .responseId(result.getId())
                .model(result.getModel())
                .status(result.getStatus())
                .items(items)
                .usage(usage)
                .build();
    }

    private static void decodeOutput(ResponseOutput output, List<OutputItem> items) {
        String type = output.getType();
        if (TYPE_FUNCTION_CALL.equals(type)) {
            String callId = output.getCallId() != null ? output.getCallId() : output.getId();
            items.add(new OutputItem.ToolCallOutput(ToolCall.builder()
                    .id(callId)
                    .name(output.getName())
                    .arguments(output.getArguments() != null ? output.getArguments() : "{}")
                    .build()));
        } else if (TYPE_TEXT.equals(type)) {
            if (output.getText() != null) {
                items.add(new OutputItem.TextOutput(output.getText()));
            }
        } else if (TYPE_MESSAGE.equals(type)) {
            for (ContentPart part : nonNull(output.getContent())) {
                if (TYPE_OUTPUT_TEXT.equals(part.getType()) && part.getText() != null && !part.getText().isEmpty()) {
                    items.add(new OutputItem.TextOutput(part.getText()));
                }
            }
        } else if (TYPE_REASONING.equals(type)) {
            List<ContentPart> parts = nonNull(output.getContent()).isEmpty()
                    ? nonNull(output.getSummary())
                    : output.getContent();
            for (ContentPart part : parts) {
                if (part.getText() != null && !part.getText().isEmpty()) {
                    items.add(new OutputItem.ReasoningOutput(part.getText()));
                }
            }
        }
    }

    private static void message(InputItem wire, String role, String content) {
        wire.setRole(role);
        wire.setContent(content != null ? content : "");
    }

    private static FunctionTool encodeTool(ToolDefinition tool) {
        FunctionTool wire = new FunctionTool();
        wire.setType(TYPE_FUNCTION);
        wire.setName(tool.getName());
        wire.setDescription(tool.getDescription());
        wire.setParameters(tool.getInputSchema());
        return wire;
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list != null ? list : List.of();
    }

    // API DTOs
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ResponsesRequest {
        private String model;
        private List<InputItem> input;
        private List<FunctionTool> tools;
        private Double temperature;
        @JsonProperty("max_output_tokens")
        private Integer maxOutputTokens;
        @JsonProperty("previous_response_id")
        private String previousResponseId;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class InputItem {
        private String type;
        private String role;
        private String content;
        @JsonProperty("call_id")
        private String callId;
        private String name;
        private String arguments;
        private String output;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class FunctionTool {
        private String type;
        private String name;
        private String description;
        private Map<String, Object> parameters;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ResponsesResult {
        private String id;
        private String model;
        private String status;
        private List<ResponseOutput> output;
        private ResponsesUsage usage;
        private ResponsesError error;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ResponseOutput {
        private String type;
        private String id;
        @JsonProperty("call_id")
        private String callId;
        private String name;
        private String arguments;
        private String text;
        private String status;
        private List<ContentPart> content;
        private List<ContentPart> summary;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContentPart {
        private String type;
        private String text;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ResponsesUsage {
        @JsonProperty("input_tokens")
        private int inputTokens;
        @JsonProperty("output_tokens")
        private int outputTokens;
        @JsonProperty("total_tokens")
        private int totalTokens;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ResponsesError {
        private String code;
        private String message;
    }
}
