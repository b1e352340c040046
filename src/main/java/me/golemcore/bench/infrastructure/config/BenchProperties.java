package me.golemcore.bench.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the benchmark, bound from
 * application.yml.
 *
 * <p>
 * All configuration is organized under the {@code bench.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - providers, model routing and retry policy</li>
 * <li>{@link ToolLoopProperties} - round-trip cap and output limits</li>
 * <li>{@link EvidenceProperties} - evidence service used by the tools</li>
 * <li>{@link VideoProperties} - transcript service</li>
 * <li>{@link RunnerProperties} - the model x case matrix</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bench")
@Data
public class BenchProperties {

    private LlmProperties llm = new LlmProperties();
    private ToolLoopProperties toolLoop = new ToolLoopProperties();
    private EvidenceProperties evidence = new EvidenceProperties();
    private VideoProperties video = new VideoProperties();
    private HttpProperties http = new HttpProperties();
    private RunnerProperties runner = new RunnerProperties();
    private PromptsProperties prompts = new PromptsProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String defaultProvider = "openrouter";

        /**
         * Model name prefix to provider id, checked in declaration order.
         */
        private Map<String, String> modelProviders = new LinkedHashMap<>();
        private Map<String, ProviderProperties> providers = new LinkedHashMap<>();

        private int maxRetries = 5;
        private long initialBackoffMs = 5000;
        private double backoffMultiplier = 2.0;
        private long maxBackoffMs = 120000;
    }

    @Data
    public static class ProviderProperties {
        private String apiUrl;
        private String apiKey;
        private Map<String, String> headers = new LinkedHashMap<>();
    }

    // ==================== TOOL LOOP ====================

    @Data
    public static class ToolLoopProperties {
        private int maxRoundTrips = 30;
        private double temperature = 0.3;
        private Integer maxOutputTokens;
        private int maxToolResultChars = 16000;
        private int maxRecordedResultChars = 2000;
        private int maxErrorChars = 500;
        private Duration toolTimeout = Duration.ofMinutes(5);
        private Duration toolDrainTimeout = Duration.ofMinutes(3);
    }

    // ==================== TOOLS ====================

    @Data
    public static class EvidenceProperties {
        private String baseUrl = "https://ai.verifaible.space/api/v1";
        private String userId = "9";
        private long timeoutMs = 180000;
    }

    @Data
    public static class VideoProperties {
        private String baseUrl = "https://api.supadata.ai/v1";
        private String apiKey;
        private String lang = "en";
        private int pollAttempts = 10;
        private long pollIntervalMs = 3000;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 120000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== RUNNER ====================

    @Data
    public static class RunnerProperties {
        private boolean enabled = false;
        private String testsetPath = "testset.json";
        private List<String> models = new ArrayList<>(List.of(
                "moonshotai/kimi-k2.5",
                "minimax/minimax-m2.5",
                "z-ai/glm-5"));

        /** Empty means all cases. */
        private List<String> caseIds = new ArrayList<>();
        private int parallelism = 1;
    }

    @Data
    public static class PromptsProperties {
        private String systemPromptPath = "prompts/system-prompt.md";
    }
}
