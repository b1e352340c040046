package me.golemcore.bench.adapter.outbound.llm;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.bench.domain.model.LlmRequest;
import me.golemcore.bench.domain.model.TurnOutput;
import me.golemcore.bench.infrastructure.config.BenchProperties;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * OpenRouter adapter speaking the Responses protocol
 * ({@code POST {apiUrl}/responses}).
 *
 * <p>
 * The whole input list is sent every round together with
 * {@code previous_response_id} when the loop has one.
 *
 * @see ResponsesWireCodec
 */
@Component
@Slf4j
public class OpenRouterResponsesAdapter extends AbstractHttpLlmAdapter {

    public static final String PROVIDER_ID = "openrouter";
    private static final String DEFAULT_API_URL = "https://openrouter.ai/api/v1";

    public OpenRouterResponsesAdapter(BenchProperties properties, OkHttpClient httpClient,
            ObjectMapper objectMapper) {
        super(properties, httpClient, objectMapper);
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    protected String getDefaultApiUrl() {
        return DEFAULT_API_URL;
    }

    @Override
    public CompletableFuture<TurnOutput> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            BenchProperties.ProviderProperties provider = requireProvider();
            String body = toJson(ResponsesWireCodec.encode(request));
            log.debug("[LLM] {} -> {} items, previous response {}", request.getModel(),
                    request.getItems() != null ? request.getItems().size() : 0, request.getPreviousResponseId());

            String response = postWithRetry(apiUrl(provider) + "/responses", headers(provider), body);
            TurnOutput output = ResponsesWireCodec.decode(fromJson(response, ResponsesWireCodec.ResponsesResult.class));
            log.debug("[LLM] {} <- {} output items, {} tool calls", request.getModel(),
                    output.getItems().size(), output.getToolCalls().size());
            return output;
        });
    }
}
