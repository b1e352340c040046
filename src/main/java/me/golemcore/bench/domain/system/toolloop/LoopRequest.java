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

import lombok.Builder;
import lombok.Data;
import me.golemcore.bench.domain.service.ToolRegistry;

/**
 * Input of one loop run. Unset limits fall back to {@code bench.tool-loop}.
 */
@Data
@Builder
public class LoopRequest {

    private String model;
    private String systemPrompt;
    private String userMessage;
    private ToolRegistry registry;
    private Integer maxRoundTrips;
    private Double temperature;
}
