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

/**
 * Provider call failed for good: either the failure was not retryable or the
 * retry budget ran out.
 */
public class LlmTransportException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Status code for failures that never produced an HTTP response. */
    public static final int NO_STATUS = -1;

    private final int statusCode;
    private final boolean retryable;

    public LlmTransportException(String message, int statusCode, boolean retryable) {
        super(message);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public LlmTransportException(String message, int statusCode, boolean retryable, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Whether the underlying failure was of a retryable kind (429, 5xx, I/O).
     */
    public boolean isRetryable() {
        return retryable;
    }
}
