package me.golemcore.bench.domain.system.toolloop;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.bench.domain.component.ToolComponent;
import me.golemcore.bench.domain.model.ToolArguments;
import me.golemcore.bench.domain.model.ToolCall;
import me.golemcore.bench.domain.model.ToolFailureKind;
import me.golemcore.bench.domain.model.ToolResult;
import me.golemcore.bench.domain.service.ToolRegistry;
import me.golemcore.bench.infrastructure.config.BenchProperties;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a tool call through its registry handler and turns every outcome into
 * the text the model gets back.
 */
@Slf4j
public class DefaultToolExecutor implements ToolExecutorPort {

    private final BenchProperties.ToolLoopProperties settings;
    private final Clock clock;

    public DefaultToolExecutor(BenchProperties.ToolLoopProperties settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public ToolExecutionOutcome execute(ToolRegistry registry, ToolCall toolCall) {
        Map<String, Object> loggedArguments = ToolArguments.parseLenient(toolCall.getArguments());

        Optional<ToolComponent> tool = registry.find(toolCall.getName());
        if (tool.isEmpty()) {
            log.warn("[Tools] Unknown tool requested: {}", toolCall.getName());
            return ToolExecutionOutcome.synthetic(toolCall, loggedArguments, ToolFailureKind.UNKNOWN_TOOL,
                    "Unknown tool: " + toolCall.getName(), settings.getMaxErrorChars());
        }

        Map<String, Object> arguments;
        try {
            arguments = ToolArguments.parse(toolCall.getArguments());
        } catch (IllegalArgumentException e) {
            log.warn("[Tools] Invalid arguments for {}: {}", toolCall.getName(), e.getMessage());
            return ToolExecutionOutcome.synthetic(toolCall, loggedArguments, ToolFailureKind.INVALID_ARGUMENTS,
                    "invalid arguments JSON: " + e.getMessage(), settings.getMaxErrorChars());
        }

        long start = clock.millis();
        ToolResult result = invoke(tool.get(), toolCall.getName(), arguments);
        long durationMs = Math.max(0, clock.millis() - start);

        if (!result.isSuccess()) {
            log.warn("[Tools] {} failed in {}ms: {}", toolCall.getName(), durationMs, result.getError());
        } else {
            log.debug("[Tools] {} completed in {}ms", toolCall.getName(), durationMs);
        }

        String content = truncateToolResult(result.toMessageContent(), toolCall.getName());
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), loggedArguments, result, content,
                durationMs, false);
    }

    private ToolResult invoke(ToolComponent tool, String toolName, Map<String, Object> arguments) {
        CompletableFuture<ToolResult> future = null;
        long timeoutMs = settings.getToolTimeout().toMillis();
        try {
            future = tool.execute(arguments);
            ToolResult result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (result == null) {
                return ToolResult.failure("tool returned no result");
            }
            if (!result.isSuccess()) {
                return ToolResult.failure(
                        result.getFailureKind() != null ? result.getFailureKind() : ToolFailureKind.EXECUTION_FAILED,
                        bound(result.getError()));
            }
            return result;
        } catch (TimeoutException e) {
            awaitAbandoned(future, toolName);
            return ToolResult.failure(ToolFailureKind.TIMEOUT, "timed out after " + timeoutMs + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "interrupted");
        } catch (ExecutionException e) {
            log.error("[Tools] {} threw", toolName, e.getCause());
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, bound(safeCauseMessage(e)));
        } catch (RuntimeException e) {
            log.error("[Tools] {} threw", toolName, e);
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, bound(safeCauseMessage(e)));
        }
    }

    /**
     * Cancelling a {@code supplyAsync} future does not stop its task, so a
     * timed-out handler is given up to {@code toolDrainTimeout} to finish before
     * the next call of the round starts. Its late result is discarded.
     */
    private void awaitAbandoned(CompletableFuture<ToolResult> future, String toolName) {
        long drainMs = settings.getToolDrainTimeout().toMillis();
        log.warn("[Tools] {} exceeded its deadline, waiting up to {}ms for it to stop", toolName, drainMs);
        try {
            future.get(drainMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("[Tools] {} still running after {}ms, abandoning it", toolName, drainMs);
        } catch (ExecutionException | CancellationException e) {
            log.debug("[Tools] {} stopped after its deadline: {}", toolName, safeCauseMessage(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
        }
    }

    /**
     * Cuts tool output that would not fit the context window, leaving a marker
     * with the original size.
     */
    public String truncateToolResult(String content, String toolName) {
        if (content == null) {
            return "";
        }
        int maxChars = settings.getMaxToolResultChars();
        if (maxChars <= 0 || content.length() <= maxChars) {
            return content;
        }

        String suffix = "\n\n[OUTPUT TRUNCATED: " + content.length() + " chars total, showing first "
                + maxChars + " chars. Try a narrower query or a more specific selector.]";
        int cutPoint = Math.max(0, maxChars - suffix.length());
        log.warn("[Tools] Truncating '{}' result: {} chars -> ~{} chars",
                toolName, content.length(), cutPoint + suffix.length());
        return content.substring(0, cutPoint) + suffix;
    }

    private String bound(String message) {
        return ToolExecutionOutcome.bound(message, settings.getMaxErrorChars());
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && cause != cursor) {
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            return cursor.getClass().getSimpleName();
        }
        return message;
    }
}
