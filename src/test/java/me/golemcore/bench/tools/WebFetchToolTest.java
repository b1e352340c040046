package me.golemcore.bench.tools;

import me.golemcore.bench.adapter.outbound.evidence.EvidenceServiceApi;
import me.golemcore.bench.domain.model.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WebFetchToolTest {

    private static final String URL = "https://example.org/article";

    private EvidenceServiceApi evidenceApi;
    private WebFetchTool tool;

    @BeforeEach
    void setUp() {
        evidenceApi = mock(EvidenceServiceApi.class);
        tool = new WebFetchTool(evidenceApi);
    }

    @Test
    void execute_returnsMarkdownWithUrlHeader() throws Exception {
        when(evidenceApi.fetch(any())).thenReturn(response(true, "# Title\n\nBody", null));

        ToolResult result = tool.execute(Map.of("url", URL)).get();

        assertTrue(result.isSuccess());
        assertEquals("## " + URL + "\n\n# Title\n\nBody", result.getOutput());
    }

    @Test
    void execute_truncatesLongContent() throws Exception {
        when(evidenceApi.fetch(any())).thenReturn(response(true, "a".repeat(9000), null));

        String output = tool.execute(Map.of("url", URL)).get().getOutput();

        assertTrue(output.endsWith("a".repeat(10) + WebFetchTool.TRUNCATED_MARKER));
        assertEquals(("## " + URL + "\n\n").length() + WebFetchTool.MAX_CONTENT_CHARS
                + WebFetchTool.TRUNCATED_MARKER.length(), output.length());
    }

    @Test
    void execute_passesServiceMessageThrough() throws Exception {
        when(evidenceApi.fetch(any())).thenReturn(response(false, null, "blocked by robots.txt"));

        ToolResult result = tool.execute(Map.of("url", URL)).get();

        assertTrue(result.isSuccess());
        assertEquals("blocked by robots.txt", result.getOutput());
    }

    @Test
    void execute_mapsTransportError() throws Exception {
        when(evidenceApi.fetch(any())).thenThrow(new IllegalStateException("connect timed out"));

        ToolResult result = tool.execute(Map.of("url", URL)).get();

        assertFalse(result.isSuccess());
        assertEquals("connect timed out", result.getError());
    }

    private static EvidenceServiceApi.WebFetchResponse response(boolean success, String content, String message) {
        EvidenceServiceApi.WebFetchResponse response = new EvidenceServiceApi.WebFetchResponse();
        response.setSuccess(success);
        response.setContent(content);
        response.setMessage(message);
        return response;
    }
}
