package me.golemcore.bench.domain.service;

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
import me.golemcore.bench.domain.model.AgentSession;
import me.golemcore.bench.domain.model.BenchmarkCase;
import me.golemcore.bench.domain.model.BenchmarkSummary;
import me.golemcore.bench.domain.model.RunRecord;
import me.golemcore.bench.domain.model.ScoreResult;
import me.golemcore.bench.domain.system.toolloop.LoopRequest;
import me.golemcore.bench.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.bench.infrastructure.config.BenchProperties;
import me.golemcore.bench.port.outbound.ResultStorePort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs every (model, case) pair through the tool loop, scores the outcome and
 * hands the record to the results store.
 *
 * <p>
 * Each run owns its own session; runs may execute in parallel
 * ({@code bench.runner.parallelism}) and results come back in submission
 * order.
 */
@Service
@Slf4j
public class BenchmarkRunner {

    private final ToolLoopSystem toolLoopSystem;
    private final ToolRegistry toolRegistry;
    private final ScoringEngine scoringEngine;
    private final PromptService promptService;
    private final ResultStorePort resultStore;
    private final BenchProperties properties;

    public BenchmarkRunner(ToolLoopSystem toolLoopSystem, ToolRegistry toolRegistry, ScoringEngine scoringEngine,
            PromptService promptService, ResultStorePort resultStore, BenchProperties properties) {
        this.toolLoopSystem = toolLoopSystem;
        this.toolRegistry = toolRegistry;
        this.scoringEngine = scoringEngine;
        this.promptService = promptService;
        this.resultStore = resultStore;
        this.properties = properties;
    }

    public List<RunRecord> run(List<String> models, List<BenchmarkCase> cases) {
        int parallelism = Math.max(1, properties.getRunner().getParallelism());
        log.info("[Runner] {} model(s) x {} case(s), parallelism {}", models.size(), cases.size(), parallelism);

        ExecutorService executor = Executors.newFixedThreadPool(parallelism);
        try {
            List<Future<RunRecord>> futures = new ArrayList<>();
            for (String model : models) {
                for (BenchmarkCase testCase : cases) {
                    futures.add(executor.submit(() -> runCase(model, testCase)));
                }
            }

            List<RunRecord> records = new ArrayList<>(futures.size());
            for (Future<RunRecord> future : futures) {
                records.add(future.get());
            }
            return records;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Benchmark interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Benchmark run crashed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Runs one case against one model. Loop failures end up in the record, never
     * as an exception.
     */
    public RunRecord runCase(String model, BenchmarkCase testCase) {
        log.info("[Runner] {} / {}: {}", model, testCase.getId(), testCase.getQuestion());

        AgentSession session = toolLoopSystem.run(LoopRequest.builder()
                .model(model)
                .systemPrompt(promptService.getSystemPrompt())
                .userMessage(promptService.renderUserPrompt(testCase))
                .registry(toolRegistry)
                .build());

        RunRecord record = RunRecord.builder()
                .model(model)
                .caseId(testCase.getId())
                .category(testCase.getCategory())
                .question(testCase.getQuestion())
                .expectedAnswer(testCase.getAnswer())
                .status(session.getStatus())
                .answer(session.getAnswer())
                .error(session.getError())
                .turns(session.getTurns())
                .usage(session.getTotalUsage())
                .roundTrips(session.getRoundTrips())
                .toolCallCount(session.getToolCallCount())
                .citeCallCount(ScoringEngine.citeCalls(session.getTurns()).size())
                .citationCount(ScoringEngine.countCitationMarkers(session.getAnswer()))
                .durationMs(session.getDuration().toMillis())
                .build();

        if (!record.isFailed() && testCase.hasExpectedAnswer()) {
            ScoreResult score = scoringEngine.score(testCase, session.getAnswer(), session.getTurns());
            record.setScore(score);
            log.info("[Runner] {} / {}: {} -> score {} (raw {}), {} round(s), {} tokens", model, testCase.getId(),
                    session.getStatus(), score.totalScore(), score.rawScore(), session.getRoundTrips(),
                    session.getTotalUsage().totalTokens());
        } else if (record.isFailed()) {
            log.warn("[Runner] {} / {}: FAILED after {} round(s): {}", model, testCase.getId(),
                    session.getRoundTrips(), session.getError());
        } else {
            log.info("[Runner] {} / {}: {} (no expected answer, not scored)", model, testCase.getId(),
                    session.getStatus());
        }

        resultStore.save(record);
        return record;
    }

    public BenchmarkSummary summarize() {
        return BenchmarkSummary.of(resultStore.findAll());
    }
}
