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

import me.golemcore.bench.domain.model.AgentSession;
import me.golemcore.bench.domain.model.Conversation;
import me.golemcore.bench.domain.model.LlmRequest;
import me.golemcore.bench.domain.model.TokenUsage;
import me.golemcore.bench.domain.model.ToolArguments;
import me.golemcore.bench.domain.model.ToolCall;
import me.golemcore.bench.domain.model.ToolCallRecord;
import me.golemcore.bench.domain.model.ToolDefinition;
import me.golemcore.bench.domain.model.ToolFailureKind;
import me.golemcore.bench.domain.model.Turn;
import me.golemcore.bench.domain.model.TurnOutput;
import me.golemcore.bench.domain.service.ToolRegistry;
import me.golemcore.bench.infrastructure.config.BenchProperties;
import me.golemcore.bench.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletionException;

/**
 * Round-trip loop between one model and the tool registry.
 *
 * <p>
 * Each round sends the whole conversation; a response with tool calls (from
 * the structured channel, or recovered from text when that channel is empty)
 * moves the session to TOOL_DISPATCH, where calls run one after another in the
 * order the model emitted them. A response without calls completes the
 * session. A provider failure ends it as FAILED, and reaching the round-trip
 * cap ends it as MAX_ROUNDS_EXCEEDED.
 */
public class DefaultToolLoopSystem implements ToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolLoopSystem.class);

    static final String RECORD_TRUNCATED_MARKER = "...[truncated]";
    private static final int CALL_ID_HEX_CHARS = 24;

    private final LlmPort llmPort;
    private final ToolExecutorPort toolExecutor;
    private final TextToolCallExtractor extractor;
    private final BenchProperties.ToolLoopProperties settings;
    private final Clock clock;

    public DefaultToolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutor, TextToolCallExtractor extractor,
            BenchProperties.ToolLoopProperties settings) {
        this(llmPort, toolExecutor, extractor, settings, Clock.systemUTC());
    }

    // Visible for testing
    public DefaultToolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutor, TextToolCallExtractor extractor,
            BenchProperties.ToolLoopProperties settings, Clock clock) {
        this.llmPort = llmPort;
        this.toolExecutor = toolExecutor;
        this.extractor = extractor;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public AgentSession run(LoopRequest request) {
        int maxRoundTrips = request.getMaxRoundTrips() != null ? request.getMaxRoundTrips()
                : settings.getMaxRoundTrips();
        double temperature = request.getTemperature() != null ? request.getTemperature() : settings.getTemperature();
        ToolRegistry registry = request.getRegistry();
        List<ToolDefinition> tools = registry.definitions();

        Conversation conversation = Conversation.start(request.getSystemPrompt(), request.getUserMessage());
        AgentSession session = new AgentSession(request.getModel(), conversation, clock.instant());
        String previousResponseId = null;

        while (session.getRoundTrips() < maxRoundTrips) {
            int round = session.nextRound();
            log.debug("[ToolLoop] {} round {}/{}", request.getModel(), round, maxRoundTrips);

            TurnOutput output;
            try {
                output = llmPort.chat(LlmRequest.builder()
                        .model(request.getModel())
                        .items(conversation.getItems())
                        .tools(tools)
                        .temperature(temperature)
                        .maxOutputTokens(settings.getMaxOutputTokens())
                        .previousResponseId(previousResponseId)
                        .build()).join();
            } catch (RuntimeException e) {
                String message = rootMessage(e);
                log.error("[ToolLoop] {} failed in round {}: {}", request.getModel(), round, message);
                session.fail(message, clock.instant());
                return session;
            }

            previousResponseId = output.getResponseId();
            TokenUsage usage = output.getUsageOrZero();
            session.addUsage(usage);

            String text = output.getText();
            String reasoning = output.getReasoning();
            List<ToolCall> calls = output.getToolCalls();
            if (calls.isEmpty()) {
                TextToolCallExtractor.ExtractionResult extracted = extractor.extract(text);
                if (extracted.isFound()) {
                    log.warn("[ToolLoop] {} embedded {} tool call(s) in text, recovered", request.getModel(),
                            extracted.calls().size());
                    calls = extracted.calls();
                    text = extracted.cleanedText();
                }
            }

            if (calls.isEmpty()) {
                conversation.appendAssistant(text, reasoning);
                session.recordTurn(new Turn(round, text, reasoning, List.of(), usage));
                session.complete(text, clock.instant());
                log.info("[ToolLoop] {} completed after {} round(s), {} tool call(s)", request.getModel(), round,
                        session.getToolCallCount());
                return session;
            }

            session.enterToolDispatch();
            List<ToolCallRecord> records = dispatch(registry, conversation, text, reasoning, calls);
            session.recordTurn(new Turn(round, text, reasoning, records, usage));
        }

        log.warn("[ToolLoop] {} reached max round-trips ({})", request.getModel(), maxRoundTrips);
        session.exceedRounds(clock.instant());
        return session;
    }

    private List<ToolCallRecord> dispatch(ToolRegistry registry, Conversation conversation, String text,
            String reasoning, List<ToolCall> calls) {
        if (text != null && !text.isBlank()) {
            conversation.appendAssistant(text, reasoning);
        }

        List<ToolCall> issued = new ArrayList<>(calls.size());
        for (ToolCall call : calls) {
            ToolCall normalized = withUsableId(conversation, call);
            conversation.appendToolCall(normalized);
            issued.add(normalized);
        }

        List<ToolCallRecord> records = new ArrayList<>(issued.size());
        for (ToolCall call : issued) {
            ToolExecutionOutcome outcome;
            try {
                outcome = toolExecutor.execute(registry, call);
            } catch (RuntimeException e) {
                outcome = ToolExecutionOutcome.synthetic(call, ToolArguments.parseLenient(call.getArguments()),
                        ToolFailureKind.EXECUTION_FAILED, "Tool execution failed: " + rootMessage(e),
                        settings.getMaxErrorChars());
            }
            conversation.appendToolResult(call.getId(), outcome.messageContent());
            records.add(new ToolCallRecord(call.getName(), outcome.arguments(),
                    capRecordedResult(outcome.messageContent()), outcome.durationMs()));
        }
        return records;
    }

    /**
     * Providers occasionally omit or reuse call ids; the conversation needs them
     * unique.
     */
    private static ToolCall withUsableId(Conversation conversation, ToolCall call) {
        String id = call.getId();
        if (id != null && !id.isBlank() && !conversation.isCallIdUsed(id)) {
            return call;
        }
        String freshId = "call_" + UUID.randomUUID().toString().replace("-", "").substring(0, CALL_ID_HEX_CHARS);
        log.debug("[ToolLoop] Replacing unusable call id '{}' with {}", id, freshId);
        return ToolCall.builder()
                .id(freshId)
                .name(call.getName())
                .arguments(call.getArguments())
                .build();
    }

    private String capRecordedResult(String content) {
        int maxChars = settings.getMaxRecordedResultChars();
        if (content == null || maxChars <= 0 || content.length() <= maxChars) {
            return content;
        }
        return content.substring(0, maxChars) + RECORD_TRUNCATED_MARKER;
    }

    private static String rootMessage(Throwable error) {
        Throwable cursor = error;
        while (cursor.getCause() != null && cursor.getCause() != cursor
                && (cursor instanceof CompletionException || cursor.getMessage() == null)) {
            cursor = cursor.getCause();
        }
        String message = cursor.getMessage();
        return message != null && !message.isBlank() ? message : cursor.getClass().getSimpleName();
    }
}
