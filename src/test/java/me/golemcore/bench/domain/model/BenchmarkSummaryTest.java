package me.golemcore.bench.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class BenchmarkSummaryTest {

    @Test
    void shouldAverageScoredRunsPerModel() {
        BenchmarkSummary summary = BenchmarkSummary.of(List.of(
                scored("m1", "a", 100, 1.0, true, true, 1000, 2000),
                scored("m1", "b", 0, 0.5, false, false, 3000, 4000),
                scored("m2", "a", 80, 1.0, true, false, 500, 1000)));

        assertEquals(2, summary.models().size());
        BenchmarkSummary.ModelSummary first = summary.models().get(0);
        assertEquals("m1", first.model());
        assertEquals(2, first.scoredRuns());
        assertEquals(50.0, first.averageScore());
        assertEquals(0.75, first.averageAnswerCorrect());
        assertEquals(0.5, first.citationCreatedRate());
        assertEquals(0.5, first.citationInTextRate());
        assertEquals(2000.0, first.averageTokens());
        assertEquals(3000.0, first.averageDurationMs());
        assertEquals(80.0, summary.models().get(1).averageScore());
    }

    @Test
    void shouldCountFailedAndIgnoreUnscoredRuns() {
        RunRecord failed = RunRecord.builder().model("m1").caseId("a").status(SessionStatus.FAILED).build();
        RunRecord unscored = RunRecord.builder().model("m1").caseId("b").status(SessionStatus.COMPLETED).build();

        BenchmarkSummary.ModelSummary summary = BenchmarkSummary.of(List.of(failed, unscored)).models().get(0);

        assertEquals(1, summary.failedRuns());
        assertEquals(0, summary.scoredRuns());
        assertEquals(0.0, summary.averageScore());
    }

    private static RunRecord scored(String model, String caseId, int total, double answer, boolean created,
            boolean inText, int tokens, long durationMs) {
        ScoreResult score = new ScoreResult(answer, created, inText, EvidenceTypeMatch.MATCHED, total, total,
                new ScoreResult.Details(List.of(), List.of(), "text", "text"));
        return RunRecord.builder()
                .model(model)
                .caseId(caseId)
                .status(SessionStatus.COMPLETED)
                .usage(new TokenUsage(tokens, 0))
                .durationMs(durationMs)
                .score(score)
                .build();
    }
}
