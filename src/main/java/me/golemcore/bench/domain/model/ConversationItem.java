package me.golemcore.bench.domain.model;

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

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One canonical conversation entry. Provider adapters translate lists of these
 * into their own wire format.
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class ConversationItem {

    public enum Type {
        SYSTEM, USER, ASSISTANT, TOOL_CALL, TOOL_RESULT
    }

    private final Type type;

    /** Message text, or the tool output for {@link Type#TOOL_RESULT}. */
    private final String content;
    private final String reasoning;

    private final String callId;
    private final String toolName;
    private final String arguments;

    public static ConversationItem system(String content) {
        return ConversationItem.builder().type(Type.SYSTEM).content(content).build();
    }

    public static ConversationItem user(String content) {
        return ConversationItem.builder().type(Type.USER).content(content).build();
    }

    public static ConversationItem assistant(String content, String reasoning) {
        return ConversationItem.builder().type(Type.ASSISTANT).content(content).reasoning(reasoning).build();
    }

    public static ConversationItem toolCall(ToolCall call) {
        return ConversationItem.builder()
                .type(Type.TOOL_CALL)
                .callId(call.getId())
                .toolName(call.getName())
                .arguments(call.getArguments() != null ? call.getArguments() : "{}")
                .build();
    }

    public static ConversationItem toolResult(String callId, String output) {
        return ConversationItem.builder().type(Type.TOOL_RESULT).callId(callId).content(output).build();
    }

    public boolean isToolCall() {
        return type == Type.TOOL_CALL;
    }

    public boolean isToolResult() {
        return type == Type.TOOL_RESULT;
    }

    public ToolCall toToolCall() {
        if (!isToolCall()) {
            throw new IllegalStateException("Not a tool call item: " + type);
        }
        return ToolCall.builder().id(callId).name(toolName).arguments(arguments).build();
    }
}
