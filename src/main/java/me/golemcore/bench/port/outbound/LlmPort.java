package me.golemcore.bench.port.outbound;

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

import me.golemcore.bench.domain.model.LlmRequest;
import me.golemcore.bench.domain.model.TurnOutput;

import java.util.concurrent.CompletableFuture;

public interface LlmPort {

    /**
     * Returns the provider identifier (e.g., "openrouter", "ark").
     */
    String getProviderId();

    /**
     * Sends the conversation and returns the canonical turn output. The future
     * completes exceptionally with
     * {@link me.golemcore.bench.adapter.outbound.llm.LlmTransportException} once
     * retries are exhausted or the failure is not retryable.
     */
    CompletableFuture<TurnOutput> chat(LlmRequest request);

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}
