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
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Canonical result of one provider round: ordered output items plus usage.
 */
@Data
@Builder
public class TurnOutput {

    private String responseId;
    private String model;
    private String status;
    private List<OutputItem> items;
    private TokenUsage usage;

    public String getText() {
        return join(OutputItem.Kind.TEXT);
    }

    /**
     * Returns joined reasoning text, or {@code null} when the provider sent none.
     */
    public String getReasoning() {
        String reasoning = join(OutputItem.Kind.REASONING);
        return reasoning.isEmpty() ? null : reasoning;
    }

    public List<ToolCall> getToolCalls() {
        List<ToolCall> calls = new ArrayList<>();
        if (items == null) {
            return calls;
        }
        for (OutputItem item : items) {
            switch (item.kind()) {
            case TOOL_CALL -> calls.add(((OutputItem.ToolCallOutput) item).call());
            case TEXT, REASONING -> {
                // not a call
            }
            default -> throw new IllegalStateException("Unhandled output kind: " + item.kind());
            }
        }
        return calls;
    }

    public boolean hasToolCalls() {
        return !getToolCalls().isEmpty();
    }

    public TokenUsage getUsageOrZero() {
        return usage != null ? usage : TokenUsage.ZERO;
    }

    private String join(OutputItem.Kind wanted) {
        if (items == null) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        for (OutputItem item : items) {
            String text = switch (item.kind()) {
            case TEXT -> ((OutputItem.TextOutput) item).text();
            case REASONING -> ((OutputItem.ReasoningOutput) item).text();
            case TOOL_CALL -> null;
            };
            if (item.kind() == wanted && text != null) {
                parts.add(text);
            }
        }
        return String.join("\n", parts);
    }
}
