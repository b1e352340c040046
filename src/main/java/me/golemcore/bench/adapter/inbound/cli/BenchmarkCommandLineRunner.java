package me.golemcore.bench.adapter.inbound.cli;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.bench.domain.model.BenchmarkCase;
import me.golemcore.bench.domain.model.BenchmarkSummary;
import me.golemcore.bench.domain.model.TestSet;
import me.golemcore.bench.domain.service.BenchmarkRunner;
import me.golemcore.bench.domain.service.TestSetLoader;
import me.golemcore.bench.infrastructure.config.BenchProperties;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Runs the configured model x case matrix on startup and logs the per-model
 * summary table.
 */
@Component
@ConditionalOnProperty(prefix = "bench.runner", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class BenchmarkCommandLineRunner implements CommandLineRunner {

    private final TestSetLoader testSetLoader;
    private final BenchmarkRunner benchmarkRunner;
    private final BenchProperties properties;

    @Override
    public void run(String... args) {
        BenchProperties.RunnerProperties runner = properties.getRunner();
        TestSet testSet = testSetLoader.load(Path.of(runner.getTestsetPath()));
        List<BenchmarkCase> cases = TestSetLoader.filter(testSet.getCases(), runner.getCaseIds());
        if (cases.isEmpty()) {
            log.warn("[Runner] No cases selected from {}", runner.getTestsetPath());
            return;
        }

        benchmarkRunner.run(runner.getModels(), cases);
        logSummary(benchmarkRunner.summarize());
    }

    static List<String> formatSummary(BenchmarkSummary summary) {
        List<String> lines = new ArrayList<>();
        lines.add(String.format(Locale.ROOT, "%-32s %6s %6s %7s %7s %7s %7s %10s %9s", "model", "scored",
                "failed", "score", "answer", "cited", "marker", "tokens", "time"));
        for (BenchmarkSummary.ModelSummary model : summary.models()) {
            lines.add(String.format(Locale.ROOT, "%-32s %6d %6d %7.1f %6.0f%% %6.0f%% %6.0f%% %10.0f %8.1fs",
                    model.model(), model.scoredRuns(), model.failedRuns(), model.averageScore(),
                    model.averageAnswerCorrect() * 100, model.citationCreatedRate() * 100,
                    model.citationInTextRate() * 100, model.averageTokens(), model.averageDurationMs() / 1000));
        }
        return lines;
    }

    private static void logSummary(BenchmarkSummary summary) {
        log.info("[Runner] Summary:");
        for (String line : formatSummary(summary)) {
            log.info("[Runner] {}", line);
        }
    }
}
