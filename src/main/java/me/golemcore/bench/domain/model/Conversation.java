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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Append-only canonical conversation owned by a single session.
 *
 * <p>
 * Invariant: every tool call is answered by exactly one tool result with the
 * same id before any further system, user or assistant message is appended.
 * Appends that would break it are rejected with {@link IllegalStateException}.
 */
public class Conversation {

    private final List<ConversationItem> items = new ArrayList<>();
    private final Set<String> issuedCallIds = new HashSet<>();
    private final Set<String> pendingCallIds = new LinkedHashSet<>();

    public static Conversation start(String systemPrompt, String userMessage) {
        Conversation conversation = new Conversation();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            conversation.appendSystem(systemPrompt);
        }
        conversation.appendUser(userMessage);
        return conversation;
    }

    /**
     * Rebuilds a conversation from items, validating the pairing invariant.
     */
    public static Conversation of(List<ConversationItem> items) {
        Conversation conversation = new Conversation();
        for (ConversationItem item : items) {
            conversation.append(item);
        }
        return conversation;
    }

    public void appendSystem(String content) {
        append(ConversationItem.system(content));
    }

    public void appendUser(String content) {
        append(ConversationItem.user(content));
    }

    public void appendAssistant(String content, String reasoning) {
        append(ConversationItem.assistant(content, reasoning));
    }

    public void appendToolCall(ToolCall call) {
        append(ConversationItem.toolCall(call));
    }

    public void appendToolResult(String callId, String output) {
        append(ConversationItem.toolResult(callId, output));
    }

    private void append(ConversationItem item) {
        switch (item.getType()) {
        case SYSTEM, USER, ASSISTANT -> requireNoPendingCalls(item.getType());
        case TOOL_CALL -> {
            String id = item.getCallId();
            if (id == null || id.isBlank()) {
                throw new IllegalStateException("Tool call without id: " + item.getToolName());
            }
            if (!issuedCallIds.add(id)) {
                throw new IllegalStateException("Duplicate tool call id: " + id);
            }
            pendingCallIds.add(id);
        }
        case TOOL_RESULT -> {
            if (!pendingCallIds.remove(item.getCallId())) {
                throw new IllegalStateException("Tool result without pending call: " + item.getCallId());
            }
        }
        default -> throw new IllegalStateException("Unsupported item type: " + item.getType());
        }
        items.add(item);
    }

    private void requireNoPendingCalls(ConversationItem.Type type) {
        if (!pendingCallIds.isEmpty()) {
            throw new IllegalStateException("Cannot append " + type + " while tool calls are unanswered: "
                    + pendingCallIds);
        }
    }

    public List<ConversationItem> getItems() {
        return Collections.unmodifiableList(items);
    }

    /**
     * Whether a tool call with this id was ever appended.
     */
    public boolean isCallIdUsed(String callId) {
        return issuedCallIds.contains(callId);
    }

    public boolean hasPendingToolCalls() {
        return !pendingCallIds.isEmpty();
    }

    public List<String> getPendingCallIds() {
        return List.copyOf(pendingCallIds);
    }

    public int size() {
        return items.size();
    }
}
