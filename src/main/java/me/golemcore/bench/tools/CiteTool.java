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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.bench.adapter.outbound.evidence.EvidenceServiceApi;
import me.golemcore.bench.adapter.outbound.evidence.EvidenceServiceApi.CreateEvidenceRequest;
import me.golemcore.bench.adapter.outbound.evidence.EvidenceServiceApi.CreateEvidenceResponse;
import me.golemcore.bench.domain.component.ToolComponent;
import me.golemcore.bench.domain.model.ToolDefinition;
import me.golemcore.bench.domain.model.ToolFailureKind;
import me.golemcore.bench.domain.model.ToolResult;
import me.golemcore.bench.domain.service.ScoringEngine;
import me.golemcore.bench.infrastructure.config.BenchProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static me.golemcore.bench.tools.ToolSupport.TYPE_NUMBER;
import static me.golemcore.bench.tools.ToolSupport.TYPE_STRING;

/**
 * Creates a verifiable citation for a claim. The result names the
 * {@code user_seq} the model must reference as {@code [@v:N]} in its answer.
 *
 * <p>
 * Static pages need {@code source_url}, {@code quoted_text} and
 * {@code anchor}; dynamic pages add {@code action_steps}; tables, images,
 * videos and PDFs add their locator fields.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CiteTool implements ToolComponent {

    public static final String NAME = ScoringEngine.CITE_TOOL_NAME;

    private static final String PARAM_CLAIM = "claim";
    private static final String PARAM_SOURCE_URL = "source_url";
    private static final String PARAM_QUOTED_TEXT = "quoted_text";
    private static final String PARAM_ANCHOR = "anchor";
    private static final String PARAM_SOURCE_TITLE = "source_title";
    private static final String PARAM_ACTION_STEPS = "action_steps";
    private static final String PARAM_EVIDENCE_TYPE = "evidence_type";
    private static final String PARAM_TABLE_SELECTOR = "table_selector";
    private static final String PARAM_ROW_ANCHOR = "row_anchor";
    private static final String PARAM_COL_ANCHOR = "col_anchor";
    private static final String PARAM_ELEMENT_SELECTOR = "element_selector";
    private static final String PARAM_ELEMENT_ALT = "element_alt";
    private static final String PARAM_PAGE_NUMBER = "page_number";
    private static final String PARAM_TIMESTAMP = "timestamp";
    private static final String PARAM_VIDEO_ID = "video_id";

    private final EvidenceServiceApi evidenceApi;
    private final BenchProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put(PARAM_CLAIM, ToolSupport.property(TYPE_STRING, "The specific conclusion stated in the answer"));
        schema.put(PARAM_SOURCE_URL, ToolSupport.property(TYPE_STRING, "Source page URL"));
        schema.put(PARAM_QUOTED_TEXT, ToolSupport.property(TYPE_STRING, "Verbatim quote from the source"));
        schema.put(PARAM_ANCHOR, ToolSupport.property(TYPE_STRING, "Locator anchor text (3-20 characters)"));
        schema.put(PARAM_SOURCE_TITLE, ToolSupport.property(TYPE_STRING, "Source page title"));
        schema.put(PARAM_ACTION_STEPS, ToolSupport.property(TYPE_STRING,
                "action_steps JSON array string replayed on dynamic pages"));
        schema.put(PARAM_EVIDENCE_TYPE, ToolSupport.enumProperty(List.of("text", "table", "image", "video", "pdf"),
                "Evidence type (default text)"));
        schema.put(PARAM_TABLE_SELECTOR, ToolSupport.property(TYPE_STRING, "Table CSS selector"));
        schema.put(PARAM_ROW_ANCHOR, ToolSupport.property(TYPE_STRING,
                "Row locator text, or a JSON array string for several rows"));
        schema.put(PARAM_COL_ANCHOR, ToolSupport.property(TYPE_STRING,
                "Column locator text, or a JSON array string for several columns"));
        schema.put(PARAM_ELEMENT_SELECTOR, ToolSupport.property(TYPE_STRING, "Target element CSS selector"));
        schema.put(PARAM_ELEMENT_ALT, ToolSupport.property(TYPE_STRING, "Image alt or video title"));
        schema.put(PARAM_PAGE_NUMBER, ToolSupport.property(TYPE_NUMBER, "PDF page number (1-based)"));
        schema.put(PARAM_TIMESTAMP, ToolSupport.property(TYPE_NUMBER,
                "Video timestamp in seconds for the screenshot"));
        schema.put(PARAM_VIDEO_ID, ToolSupport.property(TYPE_STRING, "Video id, e.g. the YouTube video id"));
        return ToolDefinition.builder()
                .name(NAME)
                .description("Create a verifiable citation for a claim. Returns user_seq; mark the claim with "
                        + "[@v:user_seq] in the answer. Static pages: source_url + quoted_text + anchor. "
                        + "Dynamic pages: explore with analyze_page first, then pass action_steps. "
                        + "Tables: evidence_type=\"table\" with row_anchor x col_anchor. "
                        + "Images/videos: evidence_type=\"image\"/\"video\" + element_selector. "
                        + "PDF: evidence_type=\"pdf\" + page_number.")
                .inputSchema(ToolSupport.objectSchema(schema,
                        List.of(PARAM_CLAIM, PARAM_SOURCE_URL, PARAM_QUOTED_TEXT, PARAM_ANCHOR)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            CreateEvidenceRequest request;
            try {
                request = toRequest(parameters);
            } catch (IllegalArgumentException e) {
                return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, e.getMessage());
            }

            try {
                CreateEvidenceResponse response = evidenceApi.createEvidence(properties.getEvidence().getUserId(),
                        request);
                log.info("[Tools] Citation created: user_seq={}, evidence_id={}", response.getUserSeq(),
                        response.getEvidenceId());
                return ToolResult.success(format(response));
            } catch (Exception e) { // NOSONAR - remote failures become tool errors
                log.warn("[Tools] Citation failed for {}: {}", request.getSourceUrl(), e.getMessage());
                return ToolSupport.remoteFailure(e);
            }
        });
    }

    private CreateEvidenceRequest toRequest(Map<String, Object> parameters) {
        String actionSteps = ToolSupport.stringArg(parameters, PARAM_ACTION_STEPS);
        ToolSupport.validateActionSteps(objectMapper, actionSteps);
        Number pageNumber = ToolSupport.numberArg(parameters, PARAM_PAGE_NUMBER);
        Number timestamp = ToolSupport.numberArg(parameters, PARAM_TIMESTAMP);
        return CreateEvidenceRequest.builder()
                .claim(ToolSupport.requiredArg(parameters, PARAM_CLAIM))
                .sourceUrl(ToolSupport.requiredArg(parameters, PARAM_SOURCE_URL))
                .quotedText(ToolSupport.requiredArg(parameters, PARAM_QUOTED_TEXT))
                .anchor(ToolSupport.requiredArg(parameters, PARAM_ANCHOR))
                .sourceTitle(ToolSupport.stringArg(parameters, PARAM_SOURCE_TITLE))
                .actionSteps(actionSteps != null && !actionSteps.isBlank() ? actionSteps : null)
                .evidenceType(ToolSupport.stringArg(parameters, PARAM_EVIDENCE_TYPE))
                .tableSelector(ToolSupport.stringArg(parameters, PARAM_TABLE_SELECTOR))
                .rowAnchor(ToolSupport.stringArg(parameters, PARAM_ROW_ANCHOR))
                .colAnchor(ToolSupport.stringArg(parameters, PARAM_COL_ANCHOR))
                .elementSelector(ToolSupport.stringArg(parameters, PARAM_ELEMENT_SELECTOR))
                .elementAlt(ToolSupport.stringArg(parameters, PARAM_ELEMENT_ALT))
                .pageNumber(pageNumber != null ? pageNumber.intValue() : null)
                .timestamp(timestamp != null ? timestamp.doubleValue() : null)
                .videoId(ToolSupport.stringArg(parameters, PARAM_VIDEO_ID))
                .build();
    }

    static String format(CreateEvidenceResponse response) {
        String result = "Citation created (user_seq=" + response.getUserSeq() + "). Use [@v:"
                + response.getUserSeq() + "] in your answer to mark this citation.";
        if (response.getScreenshotUrl() != null && !response.getScreenshotUrl().isBlank()) {
            result += "\nScreenshot preview: " + response.getScreenshotUrl();
        }
        return result;
    }
}
