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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Evidence service endpoints behind the web and citation tools. Every call is
 * stateless: page operations start from a fresh browser context each time.
 */
@Headers("Content-Type: application/json")
public interface EvidenceServiceApi {

    @RequestLine("POST /agent/web/search")
    WebSearchResponse search(WebSearchRequest request);

    @RequestLine("POST /agent/web/fetch")
    WebFetchResponse fetch(WebFetchRequest request);

    @RequestLine("POST /evidence/analyze")
    JsonNode analyze(AnalyzeRequest request);

    @RequestLine("POST /evidence/test-steps")
    JsonNode testSteps(TestStepsRequest request);

    @RequestLine("POST /agent/evidence/create-from-web")
    @Headers("X-User-ID: {userId}")
    CreateEvidenceResponse createEvidence(@Param("userId") String userId, CreateEvidenceRequest request);

    // ==================== DTOs ====================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    class WebSearchRequest {
        private String query;
        @JsonProperty("max_results")
        private Integer maxResults;
        @JsonProperty("search_depth")
        private String searchDepth;
        @JsonProperty("include_answer")
        private Boolean includeAnswer;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class WebSearchResponse {
        private boolean success;
        private String answer;
        private List<WebSearchResult> results;
        private String message;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class WebSearchResult {
        private String title;
        private String url;
        private String content;
        @JsonProperty("published_date")
        private String publishedDate;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    class WebFetchRequest {
        private String url;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class WebFetchResponse {
        private boolean success;
        private String content;
        private String message;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    class AnalyzeRequest {
        private String url;
        @JsonProperty("action_steps")
        private String actionSteps;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    class TestStepsRequest {
        private String url;
        @JsonProperty("action_steps")
        private String actionSteps;
        @JsonProperty("verify_type")
        private String verifyType;
        private String anchor;
        @JsonProperty("row_anchor")
        private String rowAnchor;
        @JsonProperty("element_selector")
        private String elementSelector;
        @JsonProperty("element_alt")
        private String elementAlt;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    class CreateEvidenceRequest {
        private String claim;
        @JsonProperty("source_url")
        private String sourceUrl;
        @JsonProperty("quoted_text")
        private String quotedText;
        private String anchor;
        @JsonProperty("source_title")
        private String sourceTitle;
        @JsonProperty("action_steps")
        private String actionSteps;
        @JsonProperty("evidence_type")
        private String evidenceType;
        @JsonProperty("table_selector")
        private String tableSelector;
        @JsonProperty("row_anchor")
        private String rowAnchor;
        @JsonProperty("col_anchor")
        private String colAnchor;
        @JsonProperty("element_selector")
        private String elementSelector;
        @JsonProperty("element_alt")
        private String elementAlt;
        @JsonProperty("page_number")
        private Integer pageNumber;
        private Double timestamp;
        @JsonProperty("video_id")
        private String videoId;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class CreateEvidenceResponse {
        @JsonProperty("evidence_id")
        private Long evidenceId;
        @JsonProperty("user_seq")
        private Long userSeq;
        @JsonProperty("verifaible_url")
        private String verifaibleUrl;
        @JsonProperty("screenshot_url")
        private String screenshotUrl;
    }
}
