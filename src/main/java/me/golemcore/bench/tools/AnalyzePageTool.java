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
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Deep page analysis through the evidence service.
 *
 * <p>
 * For HTML pages the report lists network requests (first 20), global JS
 * objects (first 15), interactive elements (first 30), tables (first 5, 10
 * rows each) and an accessibility tree summary (2000 chars). PDF documents are
 * rendered page by page, 3000 chars per page. Either report is capped at 12000
 * characters.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnalyzePageTool implements ToolComponent {

    public static final String NAME = "analyze_page";

    static final int MAX_REPORT_CHARS = 12_000;
    private static final int MAX_REQUESTS = 20;
    private static final int MAX_GLOBALS = 15;
    private static final int MAX_ELEMENTS = 30;
    private static final int MAX_TABLES = 5;
    private static final int MAX_TABLE_ROWS = 10;
    private static final int MAX_A11Y_CHARS = 2000;
    private static final int MAX_PDF_PAGE_CHARS = 3000;

    private static final String PARAM_URL = "url";
    private static final String PARAM_ACTION_STEPS = "action_steps";

    private final EvidenceServiceApi evidenceApi;
    private final ObjectMapper objectMapper;

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(PARAM_URL, ToolSupport.property(ToolSupport.TYPE_STRING, "URL of the page to analyze"));
        properties.put(PARAM_ACTION_STEPS, ToolSupport.property(ToolSupport.TYPE_STRING,
                "Optional action_steps JSON array string replayed before the analysis"));
        return ToolDefinition.builder()
                .name(NAME)
                .description("Analyze a web page in depth: network requests, global JS objects (with method "
                        + "source), interactive elements, tables and the accessibility tree. Suited to dynamic "
                        + "pages rendered by JavaScript. Workflow: analyze_page to learn the page structure, "
                        + "build action_steps, then verifaible_cite.")
                .inputSchema(ToolSupport.objectSchema(properties, List.of(PARAM_URL)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            String url;
            String actionSteps;
            try {
                url = ToolSupport.requiredArg(parameters, PARAM_URL);
                actionSteps = ToolSupport.stringArg(parameters, PARAM_ACTION_STEPS);
                ToolSupport.validateActionSteps(objectMapper, actionSteps);
            } catch (IllegalArgumentException e) {
                return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, e.getMessage());
            }

            try {
                log.debug("[Tools] Analyze: {}", url);
                JsonNode data = evidenceApi.analyze(new EvidenceServiceApi.AnalyzeRequest(url, actionSteps));
                return ToolResult.success(format(url, data));
            } catch (Exception e) { // NOSONAR - remote failures become tool errors
                log.warn("[Tools] Analyze failed for {}: {}", url, e.getMessage());
                return ToolSupport.remoteFailure(e);
            }
        });
    }

    static String format(String url, JsonNode data) {
        if ("pdf".equals(data.path("content_type").asText())) {
            return capReport(formatPdf(url, data), "\n\n... [PDF content truncated]");
        }

        List<String> lines = new ArrayList<>();
        lines.add("## Page analysis: " + url + "\n");
        appendNetworkRequests(lines, data.path("network_requests"));
        appendGlobalObjects(lines, data.path("global_objects"));
        appendInteractiveElements(lines, data.path("interactive_elements"));
        appendTables(lines, data.path("tables"));

        String tree = data.path("accessibility_tree").asText("");
        if (!tree.isEmpty()) {
            lines.add("### Accessibility tree (summary)");
            lines.add(ToolSupport.truncate(tree, MAX_A11Y_CHARS));
            lines.add("");
        }

        if (lines.size() <= 1) {
            return "Page analysis returned no usable content. URL: " + url;
        }
        return capReport(String.join("\n", lines), "\n\n... [analysis truncated]");
    }

    private static String formatPdf(String url, JsonNode data) {
        List<String> lines = new ArrayList<>();
        String title = data.path("title").asText("");
        lines.add("## PDF document: " + (title.isEmpty() ? url : title) + "\n");
        lines.add("Total pages: " + data.path("total_pages").asText("?") + "\n");
        for (JsonNode page : data.path("pages")) {
            lines.add("### Page " + page.path("page_number").asText());
            String text = page.path("text").asText("");
            lines.add(text.length() > MAX_PDF_PAGE_CHARS
                    ? text.substring(0, MAX_PDF_PAGE_CHARS) + "\n... [text truncated]"
                    : text);
            lines.add("");
        }
        return String.join("\n", lines);
    }

    private static void appendNetworkRequests(List<String> lines, JsonNode requests) {
        if (!requests.isArray() || requests.isEmpty()) {
            return;
        }
        lines.add("### Network requests (" + requests.size() + ")");
        for (int i = 0; i < Math.min(requests.size(), MAX_REQUESTS); i++) {
            JsonNode request = requests.get(i);
            lines.add("- [" + request.path("method").asText("GET") + "] "
                    + ToolSupport.truncate(request.path("url").asText(), 120)
                    + " (" + request.path("type").asText() + ", " + request.path("status").asText() + ")");
        }
        if (requests.size() > MAX_REQUESTS) {
            lines.add("  ... " + (requests.size() - MAX_REQUESTS) + " more requests");
        }
        lines.add("");
    }

    private static void appendGlobalObjects(List<String> lines, JsonNode globals) {
        if (!globals.isObject() || globals.isEmpty()) {
            return;
        }
        lines.add("### Global objects (" + globals.size() + ")");
        Iterator<Map.Entry<String, JsonNode>> fields = globals.fields();
        for (int i = 0; i < MAX_GLOBALS && fields.hasNext(); i++) {
            Map.Entry<String, JsonNode> field = fields.next();
            lines.add("**" + field.getKey() + "**: " + ToolSupport.truncate(field.getValue().toString(), 300));
        }
        lines.add("");
    }

    private static void appendInteractiveElements(List<String> lines, JsonNode elements) {
        if (!elements.isArray() || elements.isEmpty()) {
            return;
        }
        lines.add("### Interactive elements (" + elements.size() + ")");
        for (int i = 0; i < Math.min(elements.size(), MAX_ELEMENTS); i++) {
            JsonNode element = elements.get(i);
            StringBuilder line = new StringBuilder("- <").append(element.path("tag").asText());
            if (element.hasNonNull("role")) {
                line.append(" role=\"").append(element.get("role").asText()).append('"');
            }
            line.append('>');
            if (element.hasNonNull("text") && !element.get("text").asText().isEmpty()) {
                line.append(" \"").append(ToolSupport.truncate(element.get("text").asText(), 50)).append('"');
            }
            if (element.hasNonNull("selector")) {
                line.append(" -> ").append(element.get("selector").asText());
            }
            lines.add(line.toString());
        }
        lines.add("");
    }

    private static void appendTables(List<String> lines, JsonNode tables) {
        if (!tables.isArray() || tables.isEmpty()) {
            return;
        }
        lines.add("### Tables (" + tables.size() + ")");
        for (int t = 0; t < Math.min(tables.size(), MAX_TABLES); t++) {
            JsonNode table = tables.get(t);
            if (table.hasNonNull("title")) {
                lines.add("**" + table.get("title").asText() + "**");
            }
            if (table.path("headers").isArray()) {
                lines.add("Columns: " + joinCells(table.get("headers")));
            }
            JsonNode rows = table.path("rows");
            if (rows.isArray()) {
                for (int r = 0; r < Math.min(rows.size(), MAX_TABLE_ROWS); r++) {
                    lines.add("  " + joinCells(rows.get(r)));
                }
                if (rows.size() > MAX_TABLE_ROWS) {
                    lines.add("  ... " + (rows.size() - MAX_TABLE_ROWS) + " more rows");
                }
            }
            lines.add("");
        }
    }

    static String joinCells(JsonNode cells) {
        List<String> values = new ArrayList<>();
        cells.forEach(cell -> values.add(cell.asText()));
        return String.join(" | ", values);
    }

    private static String capReport(String report, String marker) {
        return report.length() > MAX_REPORT_CHARS ? report.substring(0, MAX_REPORT_CHARS) + marker : report;
    }
}
