package me.golemcore.bench.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.bench.adapter.outbound.evidence.EvidenceServiceApi;
import me.golemcore.bench.domain.model.ToolFailureKind;
import me.golemcore.bench.domain.model.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AnalyzePageToolTest {

    private static final String URL = "https://data.example.org/dashboard";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private EvidenceServiceApi evidenceApi;
    private AnalyzePageTool tool;

    @BeforeEach
    void setUp() {
        evidenceApi = mock(EvidenceServiceApi.class);
        tool = new AnalyzePageTool(evidenceApi, objectMapper);
    }

    @Test
    void execute_formatsHtmlSections() throws Exception {
        when(evidenceApi.analyze(any())).thenReturn(objectMapper.readTree("""
                {
                  "network_requests": [{"method": "POST", "url": "https://data.example.org/api/q", "type": "xhr",
                                        "status": 200}],
                  "global_objects": {"chart": {"type": "object"}},
                  "interactive_elements": [{"tag": "button", "role": "tab", "text": "2023",
                                            "selector": "#tab-2023"}],
                  "tables": [{"title": "GDP", "headers": ["Year", "Value"], "rows": [["2023", "1,234"]]}],
                  "accessibility_tree": "main > heading 'Dashboard'"
                }
                """));

        ToolResult result = tool.execute(Map.of("url", URL)).get();

        String output = result.getOutput();
        assertTrue(output.startsWith("## Page analysis: " + URL));
        assertTrue(output.contains("### Network requests (1)\n- [POST] https://data.example.org/api/q (xhr, 200)"));
        assertTrue(output.contains("**chart**: {\"type\":\"object\"}"));
        assertTrue(output.contains("- <button role=\"tab\"> \"2023\" -> #tab-2023"));
        assertTrue(output.contains("**GDP**\nColumns: Year | Value\n  2023 | 1,234"));
        assertTrue(output.contains("### Accessibility tree (summary)"));
    }

    @Test
    void execute_formatsPdfPages() throws Exception {
        when(evidenceApi.analyze(any())).thenReturn(objectMapper.readTree("""
                {"content_type": "pdf", "title": "Annual report", "total_pages": 2,
                 "pages": [{"page_number": 1, "text": "Intro"}, {"page_number": 2, "text": "Revenue 42"}]}
                """));

        String output = tool.execute(Map.of("url", URL)).get().getOutput();

        assertTrue(output.startsWith("## PDF document: Annual report"));
        assertTrue(output.contains("Total pages: 2"));
        assertTrue(output.contains("### Page 2\nRevenue 42"));
    }

    @Test
    void execute_reportsEmptyAnalysis() throws Exception {
        when(evidenceApi.analyze(any())).thenReturn(objectMapper.readTree("{}"));

        assertEquals("Page analysis returned no usable content. URL: " + URL,
                tool.execute(Map.of("url", URL)).get().getOutput());
    }

    @Test
    void execute_capsLongReports() throws Exception {
        when(evidenceApi.analyze(any())).thenReturn(objectMapper.readTree("{\"tables\": [" + tables(5) + "]}"));

        String output = tool.execute(Map.of("url", URL)).get().getOutput();

        assertTrue(output.length() <= AnalyzePageTool.MAX_REPORT_CHARS + 30);
        assertTrue(output.endsWith("... [analysis truncated]"));
    }

    @Test
    void execute_forwardsValidActionSteps() throws Exception {
        when(evidenceApi.analyze(any())).thenReturn(objectMapper.readTree("{}"));
        String steps = "[{\"action\":\"click\",\"selector\":\"#tab-2023\"}]";

        tool.execute(Map.of("url", URL, "action_steps", steps)).get();

        ArgumentCaptor<EvidenceServiceApi.AnalyzeRequest> captor = ArgumentCaptor
                .forClass(EvidenceServiceApi.AnalyzeRequest.class);
        verify(evidenceApi).analyze(captor.capture());
        assertEquals(steps, captor.getValue().getActionSteps());
    }

    @Test
    void execute_rejectsMalformedActionStepsBeforeCallingService() throws Exception {
        ToolResult notJson = tool.execute(Map.of("url", URL, "action_steps", "[{click")).get();
        ToolResult notArray = tool.execute(Map.of("url", URL, "action_steps", "{\"action\":\"click\"}")).get();

        assertFalse(notJson.isSuccess());
        assertEquals(ToolFailureKind.INVALID_ARGUMENTS, notJson.getFailureKind());
        assertTrue(notJson.getError().startsWith("action_steps is not valid JSON"));
        assertEquals("action_steps must be a JSON array of steps", notArray.getError());
        verifyNoInteractions(evidenceApi);
    }

    @Test
    void joinCells_separatesWithPipes() throws Exception {
        JsonNode cells = objectMapper.readTree("[\"a\", 1, true]");

        assertEquals("a | 1 | true", AnalyzePageTool.joinCells(cells));
    }

    private static String tables(int count) {
        StringBuilder json = new StringBuilder();
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                json.append(',');
            }
            json.append("{\"rows\": [[\"").append("v".repeat(3000)).append("\"]]}");
        }
        return json.toString();
    }
}
