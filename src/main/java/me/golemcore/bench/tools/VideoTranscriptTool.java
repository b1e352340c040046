package me.golemcore.bench.tools;

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

import feign.FeignException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.bench.adapter.outbound.evidence.TranscriptApi;
import me.golemcore.bench.adapter.outbound.evidence.TranscriptApi.Segment;
import me.golemcore.bench.adapter.outbound.evidence.TranscriptApi.TranscriptResponse;
import me.golemcore.bench.domain.component.ToolComponent;
import me.golemcore.bench.domain.model.ToolDefinition;
import me.golemcore.bench.domain.model.ToolFailureKind;
import me.golemcore.bench.domain.model.ToolResult;
import me.golemcore.bench.infrastructure.config.BenchProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Timestamped video transcript, one {@code [m:ss] text} line per segment.
 *
 * <p>
 * Long videos are processed asynchronously by the transcript service: the
 * first call returns a job id that is polled
 * ({@code bench.video.poll-attempts} times, {@code poll-interval-ms} apart)
 * until the segments arrive or the job fails.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VideoTranscriptTool implements ToolComponent {

    public static final String NAME = "video_transcript";

    private static final String PARAM_URL = "url";
    private static final String STATUS_FAILED = "failed";

    private final TranscriptApi transcriptApi;
    private final BenchProperties properties;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Get the subtitles of a YouTube video with timestamps, formatted as "
                        + "[m:ss] text. Workflow: find the video URL with verifaible_web_search, read the "
                        + "transcript, then cite it with verifaible_cite (evidence_type=\"video\").")
                .inputSchema(ToolSupport.objectSchema(
                        Map.of(PARAM_URL, ToolSupport.property(ToolSupport.TYPE_STRING, "YouTube video URL")),
                        List.of(PARAM_URL)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            String url;
            try {
                url = ToolSupport.requiredArg(parameters, PARAM_URL);
            } catch (IllegalArgumentException e) {
                return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, e.getMessage());
            }
            BenchProperties.VideoProperties video = properties.getVideo();
            if (video.getApiKey() == null || video.getApiKey().isBlank()) {
                return ToolResult.failure("transcript API key is not configured");
            }

            long deadlineNanos = System.nanoTime() + properties.getToolLoop().getToolTimeout().toNanos();
            try {
                TranscriptResponse response = transcriptApi.transcript(video.getApiKey(), url, video.getLang());
                List<Segment> segments;
                if (response.getJobId() != null && !response.getJobId().isBlank()) {
                    log.debug("[Tools] Transcript for {} is processed as job {}", url, response.getJobId());
                    segments = pollJob(video, response.getJobId(), deadlineNanos);
                } else if (response.hasContent()) {
                    segments = response.getContent();
                } else {
                    return ToolResult.success(
                            "No transcript available for this video. The video may not have subtitles.");
                }
                return ToolResult.success(format(response.getLang(), segments));
            } catch (Exception e) { // NOSONAR - remote failures become tool errors
                log.warn("[Tools] Transcript failed for {}: {}", url, e.getMessage());
                return ToolResult.failure("Transcript fetch failed: " + ToolSupport.remoteFailure(e).getError());
            }
        });
    }

    private List<Segment> pollJob(BenchProperties.VideoProperties video, String jobId, long deadlineNanos) {
        for (int attempt = 0; attempt < video.getPollAttempts(); attempt++) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
            if (remainingMs <= video.getPollIntervalMs()) {
                throw new IllegalStateException("Transcript job " + jobId + " not ready before the tool deadline");
            }
            sleep(video.getPollIntervalMs());
            TranscriptResponse job;
            try {
                job = transcriptApi.job(video.getApiKey(), jobId);
            } catch (FeignException e) {
                log.debug("[Tools] Transcript job {} poll {} failed: {}", jobId, attempt + 1, e.status());
                continue;
            }
            if (job.hasContent()) {
                return job.getContent();
            }
            if (STATUS_FAILED.equals(job.getStatus())) {
                throw new IllegalStateException("Transcript job failed");
            }
        }
        throw new IllegalStateException("Transcript job timed out after " + video.getPollAttempts() + " polls");
    }

    static String format(String lang, List<Segment> segments) {
        List<String> lines = new ArrayList<>();
        lines.add("Language: " + (lang != null && !lang.isBlank() ? lang : "en"));
        lines.add("Segments: " + segments.size());
        lines.add("");
        for (Segment segment : segments) {
            lines.add("[" + formatTimestamp(segment.getOffset()) + "] " + segment.getText());
        }
        return String.join("\n", lines);
    }

    static String formatTimestamp(long offsetMs) {
        long totalSeconds = offsetMs / 1000;
        return String.format("%d:%02d", totalSeconds / 60, totalSeconds % 60);
    }

    private static void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Transcript polling interrupted", e);
        }
    }
}
