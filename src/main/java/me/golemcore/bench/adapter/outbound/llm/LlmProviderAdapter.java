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

import me.golemcore.bench.port.outbound.LlmPort;

/**
 * Interface for LLM provider adapters.
 *
 * <p>
 * Extends {@link LlmPort} with initialization. All provider adapters must
 * implement this interface to be managed by {@link LlmAdapterFactory}.
 *
 * @see LlmAdapterFactory
 */
public interface LlmProviderAdapter extends LlmPort {

    /**
     * Initialize the adapter. Called before the first request.
     */
    default void initialize() {
        // Default no-op
    }
}
