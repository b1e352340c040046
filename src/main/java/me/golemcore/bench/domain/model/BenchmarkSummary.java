package me.golemcore.bench.domain.model;

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

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-model aggregates over scored runs. Failed runs are counted but never
 * averaged.
 */
public record BenchmarkSummary(List<ModelSummary> models) {

    public record ModelSummary(String model, int scoredRuns, int failedRuns, double averageScore,
            double averageAnswerCorrect, double citationCreatedRate, double citationInTextRate,
            double averageTokens, double averageDurationMs) {
    }

    public static BenchmarkSummary of(Collection<RunRecord> records) {
        Map<String, List<RunRecord>> byModel = new LinkedHashMap<>();
        for (RunRecord record : records) {
            byModel.computeIfAbsent(record.getModel(), k -> new ArrayList<>()).add(record);
        }

        List<ModelSummary> summaries = new ArrayList<>();
        for (Map.Entry<String, List<RunRecord>> entry : byModel.entrySet()) {
            summaries.add(summarize(entry.getKey(), entry.getValue()));
        }
        return new BenchmarkSummary(List.copyOf(summaries));
    }

    private static ModelSummary summarize(String model, List<RunRecord> records) {
        int failed = 0;
        List<RunRecord> scored = new ArrayList<>();
        for (RunRecord record : records) {
            if (record.isFailed()) {
                failed++;
            } else if (record.isScored()) {
                scored.add(record);
            }
        }

        int n = scored.size();
        if (n == 0) {
            return new ModelSummary(model, 0, failed, 0, 0, 0, 0, 0, 0);
        }

        double score = 0;
        double answer = 0;
        int cited = 0;
        int inText = 0;
        double tokens = 0;
        double duration = 0;
        for (RunRecord record : scored) {
            ScoreResult s = record.getScore();
            score += s.totalScore();
            answer += s.answerCorrect();
            cited += s.citationCreated() ? 1 : 0;
            inText += s.citationInText() ? 1 : 0;
            tokens += record.getUsage() != null ? record.getUsage().totalTokens() : 0;
            duration += record.getDurationMs();
        }
        return new ModelSummary(model, n, failed, score / n, answer / n, (double) cited / n,
                (double) inText / n, tokens / n, duration / n);
    }
}
