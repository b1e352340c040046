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

/**
 * One item of a provider response, normalized across wire protocols.
 */
public interface OutputItem {

    enum Kind {
        TEXT, TOOL_CALL, REASONING
    }

    Kind kind();

    record TextOutput(String text) implements OutputItem {
        @Override
        public Kind kind() {
            return Kind.TEXT;
        }
    }

    record ToolCallOutput(ToolCall call) implements OutputItem {
        @Override
        public Kind kind() {
            return Kind.TOOL_CALL;
        }
    }

    record ReasoningOutput(String text) implements OutputItem {
        @Override
        public Kind kind() {
            return Kind.REASONING;
        }
    }
}
