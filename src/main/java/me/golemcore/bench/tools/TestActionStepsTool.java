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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.bench.adapter.outbound.evidence.EvidenceServiceApi;
import me.golemcore.bench.domain.component.ToolComponent;
import me.golemcore.bench.domain.model.ToolDefinition;
import me.golemcore.bench.domain.model.ToolFailureKind;
import me.golemcore.bench.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static me.golemcore.bench.tools.ToolSupport.TYPE_STRING;

/**
 * Replays action steps without a screenshot and reports step errors,
 * {@code exec_js} return values and the verification payload for the chosen
 * {@code verify_type}. Each call starts from a fresh page, so the full step
 * sequence must be sent every time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TestActionStepsTool implements ToolComponent {

    public static final String NAME = "test_action_steps";

    private static final String PARAM_URL = "url";
    private static final String PARAM_ACTION_STEPS = "action_steps";
    private static final String PARAM_VERIFY_TYPE = "verify_type";
    private static final String PARAM_ANCHOR = "anchor";
    private static final String PARAM_ROW_ANCHOR = "row_anchor";
    private static final String PARAM_ELEMENT_SELECTOR = "element_selector";
    private static final String PARAM_ELEMENT_ALT = "element_alt";

    private static final String VERIFY_TEXT = "text";
    private static final String VERIFY_TABLE = "table";
    private static final String VERIFY_IMAGE = "image";
    private static final int MAX_TABLE_ROWS = 15;

    private final EvidenceServiceApi evidenceApi;
    private final ObjectMapper objectMapper;

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(PARAM_URL, ToolSupport.property(TYPE_STRING, "Target page URL"));
        properties.put(PARAM_ACTION_STEPS, ToolSupport.property(TYPE_STRING,
                "action_steps JSON array string to test"));
        properties.put(PARAM_VERIFY_TYPE, ToolSupport.enumProperty(List.of(VERIFY_TEXT, VERIFY_TABLE, VERIFY_IMAGE),
                "Verification: text = search for anchor, table = extract tables, image = find element"));
        properties.put(PARAM_ANCHOR, ToolSupport.property(TYPE_STRING, "Text to search for (text mode)"));
        properties.put(PARAM_ROW_ANCHOR, ToolSupport.property(TYPE_STRING, "Row locator text (table mode)"));
        properties.put(PARAM_ELEMENT_SELECTOR, ToolSupport.property(TYPE_STRING, "CSS selector (image mode)"));
        properties.put(PARAM_ELEMENT_ALT, ToolSupport.property(TYPE_STRING,
                "Image alt or video title to match (image mode)"));
        return ToolDefinition.builder()
                .name(NAME)
                .description("Quickly check what action_steps do, as plain text without screenshots. "
                        + "Probe mode: use exec_js to read function source or inspect page state. "
                        + "Verify mode: run the steps, then check the result with verify_type. "
                        + "Returns the page title, step errors, exec_js return values and verification data. "
                        + "Every call is stateless: always send the full step sequence.")
                .inputSchema(ToolSupport.objectSchema(properties, List.of(PARAM_URL, PARAM_ACTION_STEPS)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            EvidenceServiceApi.TestStepsRequest request;
            try {
                String actionSteps = ToolSupport.requiredArg(parameters, PARAM_ACTION_STEPS);
                ToolSupport.validateActionSteps(objectMapper, actionSteps);
                String verifyType = ToolSupport.stringArg(parameters, PARAM_VERIFY_TYPE);
                request = EvidenceServiceApi.TestStepsRequest.builder()
                        .url(ToolSupport.requiredArg(parameters, PARAM_URL))
                        .actionSteps(actionSteps)
                        .verifyType(verifyType != null && !verifyType.isBlank() ? verifyType : VERIFY_TEXT)
                        .anchor(ToolSupport.stringArg(parameters, PARAM_ANCHOR))
                        .rowAnchor(ToolSupport.stringArg(parameters, PARAM_ROW_ANCHOR))
                        .elementSelector(ToolSupport.stringArg(parameters, PARAM_ELEMENT_SELECTOR))
                        .elementAlt(ToolSupport.stringArg(parameters, PARAM_ELEMENT_ALT))
                        .build();
            } catch (IllegalArgumentException e) {
                return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, e.getMessage());
            }

            try {
                log.debug("[Tools] Test steps on {} ({})", request.getUrl(), request.getVerifyType());
                return ToolResult.success(format(request, evidenceApi.testSteps(request)));
            } catch (Exception e) { // NOSONAR - remote failures become tool errors
                log.warn("[Tools] Test steps failed for {}: {}", request.getUrl(), e.getMessage());
                return ToolSupport.remoteFailure(e);
            }
        });
    }

    static String format(EvidenceServiceApi.TestStepsRequest request, JsonNode data) {
        List<String> lines = new ArrayList<>();
        lines.add("## Action steps test result\n");
        String title = data.path("page_title").asText("");
        lines.add("**Page title**: " + (title.isEmpty() ? "(none)" : title));

        JsonNode stepErrors = data.path("step_errors");
        if (stepErrors.isArray() && !stepErrors.isEmpty()) {
            lines.add("\n**Step errors** (" + stepErrors.size() + "):");
            stepErrors.forEach(error -> lines.add("  - " + error.asText()));
        } else {
            lines.add("\nAll steps succeeded");
        }

        JsonNode execResults = data.path("exec_results");
        if (execResults.isArray() && !execResults.isEmpty()) {
            lines.add("\n### exec_js return values");
            for (JsonNode result : execResults) {
                lines.add("**Step " + result.path("step").asText() + "**:\n```\n" + result.path("result").asText()
                        + "\n```");
            }
        }

        switch (request.getVerifyType()) {
        case VERIFY_TABLE -> appendTableVerification(lines, request, data);
        case VERIFY_IMAGE -> appendImageVerification(lines, data);
        default -> {
            boolean found = data.path("anchor_found").asBoolean(false);
            lines.add("\n**Anchor search**: " + (found ? "found" : "not found"));
            if (found && data.hasNonNull("anchor_context")) {
                lines.add("**Context**: " + data.get("anchor_context").asText());
            }
        }
        }
        return String.join("\n", lines);
    }

    private static void appendTableVerification(List<String> lines, EvidenceServiceApi.TestStepsRequest request,
            JsonNode data) {
        JsonNode tables = data.path("tables");
        if (tables.isArray() && !tables.isEmpty()) {
            lines.add("\n### Table data (" + tables.size() + ")");
            for (JsonNode table : tables) {
                JsonNode headers = table.path("headers");
                if (headers.isArray() && !headers.isEmpty()) {
                    lines.add("Columns: " + AnalyzePageTool.joinCells(headers));
                }
                JsonNode rows = table.path("rows");
                if (rows.isArray()) {
                    for (int r = 0; r < Math.min(rows.size(), MAX_TABLE_ROWS); r++) {
                        lines.add("  " + AnalyzePageTool.joinCells(rows.get(r)));
                    }
                    if (rows.size() > MAX_TABLE_ROWS) {
                        lines.add("  ... " + (rows.size() - MAX_TABLE_ROWS) + " more rows");
                    }
                }
                lines.add("");
            }
        } else {
            lines.add("\nNo table data found");
        }

        if (data.path("matched_row").isArray()) {
            lines.add("**Matched row**: " + AnalyzePageTool.joinCells(data.get("matched_row")));
        } else if (request.getRowAnchor() != null) {
            lines.add("**Matched row**: no row contains \"" + request.getRowAnchor() + "\"");
        }
    }

    private static void appendImageVerification(List<String> lines, JsonNode data) {
        boolean found = data.path("element_found").asBoolean(false);
        lines.add("\n**Element lookup**: " + (found ? "found" : "not found"));
        JsonNode info = data.path("element_info");
        if (found && info.isObject()) {
            String alt = info.path("alt").asText("");
            lines.add("  tag: " + info.path("tag").asText() + ", alt: " + (alt.isEmpty() ? "(none)" : alt));
            lines.add("  size: " + info.path("width").asText() + "x" + info.path("height").asText()
                    + ", visible: " + (info.path("visible").asBoolean(false) ? "yes" : "no"));
        }
    }
}
