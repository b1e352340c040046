package me.golemcore.bench.tools;

import me.golemcore.bench.adapter.outbound.evidence.TranscriptApi;
import me.golemcore.bench.domain.model.ToolResult;
import me.golemcore.bench.infrastructure.config.BenchProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atMost;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class VideoTranscriptToolTest {

    private static final String VIDEO_URL = "https://www.youtube.com/watch?v=abc123";
    private static final String API_KEY = "sd-key";

    private TranscriptApi transcriptApi;
    private BenchProperties properties;
    private VideoTranscriptTool tool;

    @BeforeEach
    void setUp() {
        transcriptApi = mock(TranscriptApi.class);
        properties = new BenchProperties();
        properties.getVideo().setApiKey(API_KEY);
        properties.getVideo().setPollIntervalMs(0);
        properties.getVideo().setPollAttempts(3);
        tool = new VideoTranscriptTool(transcriptApi, properties);
    }

    @Test
    void execute_formatsTimestampedSegments() throws Exception {
        when(transcriptApi.transcript(API_KEY, VIDEO_URL, "en"))
                .thenReturn(transcript("en", List.of(segment(0, "Hello"), segment(75_500, "GDP grew 3%"))));

        ToolResult result = tool.execute(Map.of("url", VIDEO_URL)).get();

        assertTrue(result.isSuccess());
        assertEquals("Language: en\nSegments: 2\n\n[0:00] Hello\n[1:15] GDP grew 3%", result.getOutput());
    }

    @Test
    void execute_pollsJobUntilContentArrives() throws Exception {
        TranscriptApi.TranscriptResponse queued = new TranscriptApi.TranscriptResponse();
        queued.setJobId("job-1");
        TranscriptApi.TranscriptResponse pending = new TranscriptApi.TranscriptResponse();
        pending.setStatus("active");
        when(transcriptApi.transcript(anyString(), anyString(), anyString())).thenReturn(queued);
        when(transcriptApi.job(API_KEY, "job-1"))
                .thenThrow(FeignErrors.status(503, "busy"))
                .thenReturn(pending)
                .thenReturn(transcript("en", List.of(segment(3_000, "Done"))));

        ToolResult result = tool.execute(Map.of("url", VIDEO_URL)).get();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().endsWith("[0:03] Done"));
        verify(transcriptApi, times(3)).job(API_KEY, "job-1");
    }

    @Test
    void execute_stopsPollingAtToolDeadline() throws Exception {
        properties.getToolLoop().setToolTimeout(Duration.ofMillis(50));
        properties.getVideo().setPollIntervalMs(40);
        properties.getVideo().setPollAttempts(10);
        TranscriptApi.TranscriptResponse queued = new TranscriptApi.TranscriptResponse();
        queued.setJobId("job-3");
        TranscriptApi.TranscriptResponse pending = new TranscriptApi.TranscriptResponse();
        pending.setStatus("active");
        when(transcriptApi.transcript(anyString(), anyString(), anyString())).thenReturn(queued);
        when(transcriptApi.job(API_KEY, "job-3")).thenReturn(pending);

        ToolResult result = tool.execute(Map.of("url", VIDEO_URL)).get();

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("not ready before the tool deadline"));
        verify(transcriptApi, atMost(1)).job(API_KEY, "job-3");
    }

    @Test
    void execute_failsWhenJobNeverCompletes() throws Exception {
        TranscriptApi.TranscriptResponse queued = new TranscriptApi.TranscriptResponse();
        queued.setJobId("job-2");
        TranscriptApi.TranscriptResponse pending = new TranscriptApi.TranscriptResponse();
        pending.setStatus("queued");
        when(transcriptApi.transcript(anyString(), anyString(), anyString())).thenReturn(queued);
        when(transcriptApi.job(API_KEY, "job-2")).thenReturn(pending);

        ToolResult result = tool.execute(Map.of("url", VIDEO_URL)).get();

        assertFalse(result.isSuccess());
        assertEquals("Transcript fetch failed: Transcript job timed out after 3 polls", result.getError());
    }

    @Test
    void execute_failsWhenJobFails() throws Exception {
        TranscriptApi.TranscriptResponse queued = new TranscriptApi.TranscriptResponse();
        queued.setJobId("job-3");
        TranscriptApi.TranscriptResponse failed = new TranscriptApi.TranscriptResponse();
        failed.setStatus("failed");
        when(transcriptApi.transcript(anyString(), anyString(), anyString())).thenReturn(queued);
        when(transcriptApi.job(API_KEY, "job-3")).thenReturn(failed);

        ToolResult result = tool.execute(Map.of("url", VIDEO_URL)).get();

        assertEquals("Transcript fetch failed: Transcript job failed", result.getError());
        verify(transcriptApi, times(1)).job(API_KEY, "job-3");
    }

    @Test
    void execute_reportsMissingSubtitles() throws Exception {
        when(transcriptApi.transcript(anyString(), anyString(), anyString()))
                .thenReturn(new TranscriptApi.TranscriptResponse());

        ToolResult result = tool.execute(Map.of("url", VIDEO_URL)).get();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().startsWith("No transcript available"));
    }

    @Test
    void execute_mapsHttpError() throws Exception {
        when(transcriptApi.transcript(anyString(), anyString(), anyString()))
                .thenThrow(FeignErrors.status(401, "invalid key"));

        ToolResult result = tool.execute(Map.of("url", VIDEO_URL)).get();

        assertEquals("Transcript fetch failed: API 401: invalid key", result.getError());
    }

    @Test
    void execute_failsWithoutApiKey() throws Exception {
        properties.getVideo().setApiKey(" ");

        ToolResult result = tool.execute(Map.of("url", VIDEO_URL)).get();

        assertFalse(result.isSuccess());
        assertEquals("transcript API key is not configured", result.getError());
        verifyNoInteractions(transcriptApi);
    }

    @Test
    void formatTimestamp_usesMinutesAndSeconds() {
        assertEquals("0:09", VideoTranscriptTool.formatTimestamp(9_999));
        assertEquals("62:05", VideoTranscriptTool.formatTimestamp(3_725_000));
    }

    private static TranscriptApi.TranscriptResponse transcript(String lang, List<TranscriptApi.Segment> segments) {
        TranscriptApi.TranscriptResponse response = new TranscriptApi.TranscriptResponse();
        response.setLang(lang);
        response.setContent(segments);
        return response;
    }

    private static TranscriptApi.Segment segment(long offsetMs, String text) {
        TranscriptApi.Segment segment = new TranscriptApi.Segment();
        segment.setOffset(offsetMs);
        segment.setText(text);
        return segment;
    }
}
