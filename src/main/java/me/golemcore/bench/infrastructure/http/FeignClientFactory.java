package me.golemcore.bench.infrastructure.http;

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
import feign.Feign;
import feign.Request;
import feign.Retryer;
import feign.jackson.JacksonDecoder;
import feign.jackson.JacksonEncoder;
import feign.okhttp.OkHttpClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Creates Feign clients for the remote tool back ends, sharing the OkHttp
 * connection pool and the application {@link ObjectMapper}.
 *
 * <pre>{@code
 * EvidenceServiceApi api = factory.create(EvidenceServiceApi.class, baseUrl, 180_000);
 * }</pre>
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
public class FeignClientFactory {

    private static final long CONNECT_TIMEOUT_MS = 10_000;

    private final okhttp3.OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    /**
     * Create a Feign client for the given API interface.
     */
    public <T> T create(Class<T> apiType, String baseUrl) {
        return create(apiType, baseUrl, Feign.builder());
    }

    /**
     * Create a Feign client whose calls time out after {@code readTimeoutMs}.
     * Tool calls are never retried at the HTTP level.
     */
    public <T> T create(Class<T> apiType, String baseUrl, long readTimeoutMs) {
        Feign.Builder builder = Feign.builder()
                .options(new Request.Options(CONNECT_TIMEOUT_MS, TimeUnit.MILLISECONDS,
                        readTimeoutMs, TimeUnit.MILLISECONDS, true))
                .retryer(Retryer.NEVER_RETRY);
        return create(apiType, baseUrl, builder);
    }

    /**
     * Create a Feign client with custom options.
     */
    public <T> T create(Class<T> apiType, String baseUrl, Feign.Builder builder) {
        return builder
                .client(new OkHttpClient(okHttpClient))
                .encoder(new JacksonEncoder(objectMapper))
                .decoder(new JacksonDecoder(objectMapper))
                .target(apiType, baseUrl);
    }
}
