package me.golemcore.bench;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Evidence-collection benchmark for tool-using LLM agents.
 *
 * <p>
 * Each benchmark case asks a model to find a fact on a live web page or video
 * and back it with a verifiable citation. The model drives a bounded tool loop
 * against the evidence service; the transcript is then scored by a gated
 * rubric (answer 40, citation created 25, citation marker 15, evidence type
 * 20) whose only possible totals are 0, 80 and 100.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Runner             → TestSetLoader, PromptService, BenchmarkRunner
 * Domain Layer       → ToolLoopSystem, TextToolCallExtractor, ScoringEngine
 * Infrastructure     → Responses / Chat Completions adapters, evidence tools
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.yml} under the {@code bench.*}
 * prefix. Set {@code bench.runner.enabled=true} to run the benchmark on
 * startup.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class BenchApplication {

    public static void main(String[] args) {
        SpringApplication.run(BenchApplication.class, args);
    }

}
