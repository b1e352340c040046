package me.golemcore.bench.adapter.outbound.evidence;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.Data;

import java.util.List;

/**
 * Video transcript service. Short videos answer inline; longer ones return a
 * {@code jobId} to poll.
 */
public interface TranscriptApi {

    @RequestLine("GET /transcript?url={url}&text=false&lang={lang}")
    @Headers("x-api-key: {apiKey}")
    TranscriptResponse transcript(@Param("apiKey") String apiKey, @Param("url") String url,
            @Param("lang") String lang);

    @RequestLine("GET /transcript/{jobId}")
    @Headers("x-api-key: {apiKey}")
    TranscriptResponse job(@Param("apiKey") String apiKey, @Param("jobId") String jobId);

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class TranscriptResponse {
        private String lang;
        private List<String> availableLangs;
        private List<Segment> content;
        private String jobId;
        private String status;

        public boolean hasContent() {
            return content != null && !content.isEmpty();
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class Segment {
        private String text;
        /** Milliseconds from the start of the video. */
        private long offset;
        private long duration;
        private String lang;
    }
}
