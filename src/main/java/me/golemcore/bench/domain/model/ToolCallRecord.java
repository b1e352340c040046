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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Audit record of one executed tool call.
 *
 * @param name
 *            tool name as requested by the model
 * @param arguments
 *            parsed arguments ({@code raw} holds unparseable input)
 * @param result
 *            tool output as recorded in the turn log (possibly truncated)
 * @param durationMs
 *            wall-clock execution time
 */
public record ToolCallRecord(String name, Map<String, Object> arguments, String result, long durationMs) {

    public ToolCallRecord {
        arguments = arguments != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments))
                : Map.of();
        result = result != null ? result : "";
    }
}
