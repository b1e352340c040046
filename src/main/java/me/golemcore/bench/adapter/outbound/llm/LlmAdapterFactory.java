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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.bench.domain.model.LlmRequest;
import me.golemcore.bench.domain.model.TurnOutput;
import me.golemcore.bench.infrastructure.config.BenchProperties;
import me.golemcore.bench.port.outbound.LlmPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes each request to a provider adapter by model name.
 *
 * <p>
 * The first entry of {@code bench.llm.model-providers} whose key is a prefix of
 * the requested model selects the provider; otherwise
 * {@code bench.llm.default-provider} is used. For example, with
 * {@code doubao-: ark} every {@code doubao-seed-2.0-*} model goes to the
 * chat-completions adapter and everything else to OpenRouter.
 *
 * @see OpenRouterResponsesAdapter
 * @see ChatCompletionsAdapter
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class LlmAdapterFactory implements LlmPort {

    private static final String PROVIDER_ROUTER = "router";

    private final BenchProperties properties;
    private final List<LlmProviderAdapter> adapters;

    private final Map<String, LlmProviderAdapter> adaptersByProvider = new ConcurrentHashMap<>();
    private final Map<String, Boolean> initialized = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        for (LlmProviderAdapter adapter : adapters) {
            adaptersByProvider.put(adapter.getProviderId(), adapter);
            log.debug("Registered LLM adapter: {}", adapter.getProviderId());
        }
        log.info("[LLM] Providers: {}, default: {}", adaptersByProvider.keySet(),
                properties.getLlm().getDefaultProvider());
    }

    /**
     * Resolves the provider id for a model.
     */
    public String resolveProviderId(String model) {
        BenchProperties.LlmProperties llm = properties.getLlm();
        if (model != null) {
            for (Map.Entry<String, String> route : llm.getModelProviders().entrySet()) {
                if (model.startsWith(route.getKey())) {
                    return route.getValue();
                }
            }
        }
        return llm.getDefaultProvider();
    }

    /**
     * Get the adapter serving a model.
     *
     * @throws IllegalStateException
     *             if the resolved provider has no adapter
     */
    public LlmProviderAdapter getAdapterForModel(String model) {
        String providerId = resolveProviderId(model);
        LlmProviderAdapter adapter = adaptersByProvider.get(providerId);
        if (adapter == null) {
            throw new IllegalStateException("Unknown LLM provider '" + providerId + "' for model " + model);
        }
        initialized.computeIfAbsent(providerId, id -> {
            adapter.initialize();
            return Boolean.TRUE;
        });
        return adapter;
    }

    /**
     * Check if a provider is available.
     */
    public boolean isProviderAvailable(String providerId) {
        LlmProviderAdapter adapter = adaptersByProvider.get(providerId);
        return adapter != null && adapter.isAvailable();
    }

    // ==================== LlmPort delegation ====================

    @Override
    public String getProviderId() {
        return PROVIDER_ROUTER;
    }

    @Override
    public CompletableFuture<TurnOutput> chat(LlmRequest request) {
        LlmProviderAdapter adapter;
        try {
            adapter = getAdapterForModel(request.getModel());
        } catch (IllegalStateException e) {
            return CompletableFuture.failedFuture(e);
        }
        return adapter.chat(request);
    }

    @Override
    public boolean isAvailable() {
        return adaptersByProvider.values().stream().anyMatch(LlmProviderAdapter::isAvailable);
    }
}
