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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.bench.domain.component.ToolComponent;
import me.golemcore.bench.domain.service.ToolRegistry;
import me.golemcore.bench.infrastructure.config.BenchProperties;
import me.golemcore.bench.port.outbound.LlmPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
public class ToolLoopConfiguration {

    @Bean
    public ToolRegistry toolRegistry(List<ToolComponent> tools) {
        return new ToolRegistry(tools);
    }

    @Bean
    public TextToolCallExtractor textToolCallExtractor(ObjectMapper objectMapper) {
        return new TextToolCallExtractor(objectMapper);
    }

    @Bean
    public ToolExecutorPort toolExecutorPort(BenchProperties properties, Clock clock) {
        return new DefaultToolExecutor(properties.getToolLoop(), clock);
    }

    @Bean
    public ToolLoopSystem toolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutorPort,
            TextToolCallExtractor extractor, BenchProperties properties, Clock clock) {
        return new DefaultToolLoopSystem(llmPort, toolExecutorPort, extractor, properties.getToolLoop(), clock);
    }
}
