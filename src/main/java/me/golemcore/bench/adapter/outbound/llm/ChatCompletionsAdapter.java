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
 * Adapter for OpenAI-compatible chat-completions endpoints, used for
 * Volcengine ARK ({@code POST {apiUrl}/chat/completions}).
 *
 * <p>
 * The protocol is stateless: the previous response id is ignored and the full
 * history goes out every round.
 *
 * @see ChatCompletionsWireCodec
 */
@Component
@Slf4j
public class ChatCompletionsAdapter extends AbstractHttpLlmAdapter {

    public static final String PROVIDER_ID = "ark";
    private static final String DEFAULT_API_URL = "https://ark.cn-beijing.volces.com/api/v3";

    public ChatCompletionsAdapter(BenchProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper) {
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
            ChatCompletionsWireCodec.ChatCompletionRequest wire = ChatCompletionsWireCodec.encode(request);
            log.debug("[LLM] {} -> {} messages", request.getModel(), wire.getMessages().size());

            String response = postWithRetry(apiUrl(provider) + "/chat/completions", headers(provider), toJson(wire));
            TurnOutput output = ChatCompletionsWireCodec.decode(
                    fromJson(response, ChatCompletionsWireCodec.ChatCompletionResponse.class));
            log.debug("[LLM] {} <- finish={}, {} tool calls", request.getModel(), output.getStatus(),
                    output.getToolCalls().size());
            return output;
        });
    }
}
