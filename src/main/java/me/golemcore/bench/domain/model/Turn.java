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

import java.util.List;

/**
 * One provider round as seen in the transcript. Created once the response is
 * received and never edited afterwards.
 *
 * @param index
 *            1-based round ordinal
 * @param content
 *            visible assistant text (fallback-extracted JSON already stripped)
 * @param reasoning
 *            provider reasoning, kept verbatim and never scored
 * @param toolCalls
 *            calls executed in this round, in emitted order
 * @param usage
 *            tokens for this round
 */
public record Turn(int index, String content, String reasoning, List<ToolCallRecord> toolCalls, TokenUsage usage) {

    public Turn {
        content = content != null ? content : "";
        toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
        usage = usage != null ? usage : TokenUsage.ZERO;
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
