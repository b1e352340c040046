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
import me.golemcore.bench.domain.service.ToolRegistry;

public interface ToolExecutorPort {

    /**
     * Executes one call against the registry. Never throws for tool-level
     * problems: unknown tools, bad arguments, handler exceptions and timeouts all
     * come back as failed outcomes.
     */
    ToolExecutionOutcome execute(ToolRegistry registry, ToolCall toolCall);
}
