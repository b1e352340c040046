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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.bench.infrastructure.config.BenchProperties;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base for adapters that POST a JSON body to an HTTP endpoint.
 *
 * <p>
 * HTTP 429, 5xx and I/O failures (timeouts included) are retried with
 * exponential backoff: {@code maxRetries} retries after the first attempt,
 * delay {@code initialBackoffMs * backoffMultiplier^attempt} capped at
 * {@code maxBackoffMs}, or the server's {@code Retry-After} when that is
 * larger. Any other non-2xx status fails at once.
 */
@Slf4j
public abstract class AbstractHttpLlmAdapter implements LlmProviderAdapter {

    protected static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_ERROR_BODY_CHARS = 1000;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int HTTP_SERVER_ERROR = 500;

    protected final BenchProperties properties;
    protected final OkHttpClient httpClient;
    protected final ObjectMapper objectMapper;

    protected AbstractHttpLlmAdapter(BenchProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Base URL used when {@code bench.llm.providers.<id>.api-url} is not set.
     */
    protected abstract String getDefaultApiUrl();

    @Override
    public boolean isAvailable() {
        BenchProperties.ProviderProperties provider = properties.getLlm().getProviders().get(getProviderId());
        return provider != null && provider.getApiKey() != null && !provider.getApiKey().isBlank();
    }

    protected BenchProperties.ProviderProperties requireProvider() {
        BenchProperties.ProviderProperties provider = properties.getLlm().getProviders().get(getProviderId());
        if (provider == null || provider.getApiKey() == null || provider.getApiKey().isBlank()) {
            throw new IllegalStateException("API key for provider '" + getProviderId() + "' is not configured");
        }
        return provider;
    }

    protected String apiUrl(BenchProperties.ProviderProperties provider) {
        String url = provider.getApiUrl() != null && !provider.getApiUrl().isBlank()
                ? provider.getApiUrl()
                : getDefaultApiUrl();
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * Bearer authorization plus the provider's configured extra headers.
     */
    protected Map<String, String> headers(BenchProperties.ProviderProperties provider) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bearer " + provider.getApiKey());
        headers.putAll(provider.getHeaders());
        return headers;
    }

    protected String toJson(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + getProviderId() + " request", e);
        }
    }

    protected <T> T fromJson(String body, Class<T> type) {
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new LlmTransportException(getProviderId() + " returned malformed JSON: " + e.getOriginalMessage(),
                    LlmTransportException.NO_STATUS, false, e);
        }
    }

    /**
     * POSTs {@code jsonBody} and returns the response body of the first
     * successful attempt.
     *
     * @throws LlmTransportException
     *             on a non-retryable status or once retries are exhausted
     */
    protected String postWithRetry(String url, Map<String, String> headers, String jsonBody) {
        BenchProperties.LlmProperties llm = properties.getLlm();
        int maxRetries = Math.max(0, llm.getMaxRetries());
        LlmTransportException lastFailure = null;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            long retryAfterMs = 0;
            try (Response response = httpClient.newCall(buildRequest(url, headers, jsonBody)).execute()) {
                ResponseBody responseBody = response.body();
                String body = responseBody != null ? responseBody.string() : "";
                if (response.isSuccessful()) {
                    return body;
                }

                int code = response.code();
                boolean retryable = code == HTTP_TOO_MANY_REQUESTS || code >= HTTP_SERVER_ERROR;
                lastFailure = new LlmTransportException(
                        getProviderId() + " " + code + ": " + abbreviate(body), code, retryable);
                if (!retryable) {
                    throw lastFailure;
                }
                retryAfterMs = parseRetryAfterMs(response.header("Retry-After"));
            } catch (IOException e) {
                lastFailure = new LlmTransportException(
                        getProviderId() + " I/O error: " + e.getMessage(), LlmTransportException.NO_STATUS, true, e);
            }

            if (attempt < maxRetries) {
                long backoffMs = computeBackoffMs(attempt, retryAfterMs);
                log.warn("[LLM] {} request failed (attempt {}/{}): {}, retrying in {}ms",
                        getProviderId(), attempt + 1, maxRetries, lastFailure.getMessage(), backoffMs);
                sleep(backoffMs);
            }
        }

        throw new LlmTransportException(
                getProviderId() + " failed after " + (maxRetries + 1) + " attempts: " + lastFailure.getMessage(),
                lastFailure.getStatusCode(), true, lastFailure);
    }

    long computeBackoffMs(int attempt, long retryAfterMs) {
        BenchProperties.LlmProperties llm = properties.getLlm();
        long exponential = (long) (llm.getInitialBackoffMs() * Math.pow(llm.getBackoffMultiplier(), attempt));
        long capped = Math.min(exponential, llm.getMaxBackoffMs());
        return Math.max(capped, retryAfterMs);
    }

    private Request buildRequest(String url, Map<String, String> headers, String jsonBody) {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .post(RequestBody.create(jsonBody, JSON));
        headers.forEach(builder::header);
        return builder.build();
    }

    private static long parseRetryAfterMs(String header) {
        if (header == null || header.isBlank()) {
            return 0;
        }
        try {
            return Long.parseLong(header.trim()) * 1000;
        } catch (NumberFormatException e) {
            // HTTP-date form is not worth honouring here
            return 0;
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > MAX_ERROR_BODY_CHARS ? body.substring(0, MAX_ERROR_BODY_CHARS) : body;
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmTransportException("LLM request interrupted during retry backoff",
                    LlmTransportException.NO_STATUS, false, e);
        }
    }
}
