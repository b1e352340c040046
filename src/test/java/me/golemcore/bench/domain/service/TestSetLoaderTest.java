package me.golemcore.bench.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.bench.domain.model.BenchmarkCase;
import me.golemcore.bench.domain.model.TestSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TestSetLoaderTest {

    private final TestSetLoader loader = new TestSetLoader(new ObjectMapper());

    @Test
    void shouldParseTestSetFormat() {
        TestSet testSet = loader.parse("""
                {
                  "version": "2.1",
                  "description": "evidence benchmark",
                  "cases": [
                    {"id": "t1", "category": "text", "url": "https://a", "question": "q1", "answer": "42"},
                    {"id": "v1", "category": "video_youtube", "evidence_type": "video|text",
                     "url": "https://youtu.be/x", "question": "q2", "answer": "Paris", "extra": true}
                  ]
                }
                """);

        assertEquals("2.1", testSet.getVersion());
        assertEquals(2, testSet.getCases().size());
        BenchmarkCase video = testSet.getCases().get(1);
        assertEquals("video|text", video.getEvidenceType());
        assertTrue(video.isVideo());
        assertTrue(video.hasExpectedAnswer());
        assertNull(video.getPrompt());
    }

    @Test
    void shouldParseLegacyTaskArrayAsUnscoredCases() {
        TestSet testSet = loader.parse("""
                [{"id": "task-1", "name": "GDP of France", "prompt": "Find the GDP of France"}]
                """);

        assertEquals("legacy", testSet.getVersion());
        BenchmarkCase legacy = testSet.getCases().get(0);
        assertEquals("task-1", legacy.getId());
        assertEquals(TestSetLoader.LEGACY_CATEGORY, legacy.getCategory());
        assertEquals("GDP of France", legacy.getQuestion());
        assertEquals("Find the GDP of France", legacy.getPrompt());
        assertFalse(legacy.hasExpectedAnswer());
    }

    @Test
    void shouldRejectMalformedAndUnknownFormats() {
        IllegalArgumentException malformed = assertThrows(IllegalArgumentException.class,
                () -> loader.parse("{not json"));
        assertTrue(malformed.getMessage().startsWith("Malformed test set JSON"));

        IllegalArgumentException unknown = assertThrows(IllegalArgumentException.class,
                () -> loader.parse("{\"tasks\": []}"));
        assertTrue(unknown.getMessage().startsWith("Unrecognized test set format"));
    }

    @Test
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("testset.json");
        Files.writeString(file, "{\"version\":\"1\",\"cases\":[{\"id\":\"a\",\"answer\":\"1\"}]}",
                StandardCharsets.UTF_8);

        assertEquals(1, loader.load(file).getCases().size());
        assertThrows(UncheckedIOException.class, () -> loader.load(dir.resolve("missing.json")));
    }

    @Test
    void shouldFilterByCaseIds() {
        List<BenchmarkCase> cases = List.of(
                BenchmarkCase.builder().id("a").build(),
                BenchmarkCase.builder().id("b").build(),
                BenchmarkCase.builder().id("c").build());

        assertEquals(3, TestSetLoader.filter(cases, List.of()).size());
        assertEquals(3, TestSetLoader.filter(cases, null).size());
        List<BenchmarkCase> filtered = TestSetLoader.filter(cases, List.of("c", "a"));
        assertEquals(List.of("a", "c"), filtered.stream().map(BenchmarkCase::getId).toList());
    }
}
