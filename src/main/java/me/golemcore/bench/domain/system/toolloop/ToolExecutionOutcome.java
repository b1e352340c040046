package me.golemcore.bench.domain.system.toolloop;

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

import me.golemcore.bench.domain.model.ToolCall;
import me.golemcore.bench.domain.model.ToolFailureKind;
import me.golemcore.bench.domain.model.ToolResult;

import java.util.Map;

/**
 * Result of executing one tool call.
 *
 * @param toolCallId
 *            id of the call being answered
 * @param toolName
 *            name requested by the model
 * @param arguments
 *            leniently parsed arguments, for the turn log
 * @param toolResult
 *            handler result or synthesized failure
 * @param messageContent
 *            text appended to the conversation (already truncated)
 * @param durationMs
 *            wall-clock execution time
 * @param synthetic
 *            whether the result was produced without running a handler
 */
public record ToolExecutionOutcome(String toolCallId, String toolName, Map<String, Object> arguments,
        ToolResult toolResult, String messageContent, long durationMs, boolean synthetic) {

    /**
     * Failure produced without running a handler; {@code reason} is cut to
     * {@code maxReasonChars} like any other tool error.
     */
    public static ToolExecutionOutcome synthetic(ToolCall toolCall, Map<String, Object> arguments,
            ToolFailureKind kind, String reason, int maxReasonChars) {
        ToolResult result = ToolResult.failure(kind, bound(reason, maxReasonChars));
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), arguments, result,
                result.toMessageContent(), 0, true);
    }

    static String bound(String message, int maxChars) {
        if (message == null) {
            return "unknown error";
        }
        if (maxChars <= 0 || message.length() <= maxChars) {
            return message;
        }
        return message.substring(0, maxChars) + "...";
    }
}
