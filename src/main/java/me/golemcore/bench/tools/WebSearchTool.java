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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.bench.adapter.outbound.evidence.EvidenceServiceApi;
import me.golemcore.bench.adapter.outbound.evidence.EvidenceServiceApi.WebSearchResponse;
import me.golemcore.bench.adapter.outbound.evidence.EvidenceServiceApi.WebSearchResult;
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

import static me.golemcore.bench.tools.ToolSupport.TYPE_BOOLEAN;
import static me.golemcore.bench.tools.ToolSupport.TYPE_NUMBER;
import static me.golemcore.bench.tools.ToolSupport.TYPE_STRING;

/**
 * Web search through the evidence service.
 *
 * <p>
 * Returns the optional answer summary followed by numbered results, each
 * snippet cut to 500 characters. At most 10 results are requested.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSearchTool implements ToolComponent {

    public static final String NAME = "verifaible_web_search";

    private static final String PARAM_QUERY = "query";
    private static final String PARAM_MAX_RESULTS = "max_results";
    private static final String PARAM_SEARCH_DEPTH = "search_depth";
    private static final String PARAM_INCLUDE_ANSWER = "include_answer";

    private static final int DEFAULT_RESULTS = 5;
    private static final int MAX_RESULTS = 10;
    private static final int MAX_SNIPPET_CHARS = 500;

    private final EvidenceServiceApi evidenceApi;

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(PARAM_QUERY, ToolSupport.property(TYPE_STRING, "Search query"));
        properties.put(PARAM_MAX_RESULTS, ToolSupport.property(TYPE_NUMBER,
                "Number of results (default " + DEFAULT_RESULTS + ", max " + MAX_RESULTS + ")"));
        properties.put(PARAM_SEARCH_DEPTH, ToolSupport.enumProperty(List.of("basic", "advanced"),
                "Search depth: basic (fast) or advanced (more thorough)"));
        properties.put(PARAM_INCLUDE_ANSWER, ToolSupport.property(TYPE_BOOLEAN,
                "Include an AI-generated answer summary"));
        return ToolDefinition.builder()
                .name(NAME)
                .description("Search the internet for current information: news, data, events, or the source "
                        + "site of a fact. Follow up with verifaible_cite to create a verifiable citation; "
                        + "use analyze_page for dynamic pages.")
                .inputSchema(ToolSupport.objectSchema(properties, List.of(PARAM_QUERY)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            EvidenceServiceApi.WebSearchRequest request;
            try {
                Number maxResults = ToolSupport.numberArg(parameters, PARAM_MAX_RESULTS);
                Boolean includeAnswer = ToolSupport.booleanArg(parameters, PARAM_INCLUDE_ANSWER);
                String depth = ToolSupport.stringArg(parameters, PARAM_SEARCH_DEPTH);
                request = EvidenceServiceApi.WebSearchRequest.builder()
                        .query(ToolSupport.requiredArg(parameters, PARAM_QUERY))
                        .maxResults(Math.max(1, Math.min(maxResults != null ? maxResults.intValue() : DEFAULT_RESULTS,
                                MAX_RESULTS)))
                        .searchDepth(depth != null && !depth.isBlank() ? depth : "basic")
                        .includeAnswer(includeAnswer != null ? includeAnswer : Boolean.TRUE)
                        .build();
            } catch (IllegalArgumentException e) {
                return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, e.getMessage());
            }

            try {
                log.debug("[Tools] Web search: '{}' (max {})", request.getQuery(), request.getMaxResults());
                return ToolResult.success(format(evidenceApi.search(request)));
            } catch (Exception e) { // NOSONAR - remote failures become tool errors
                log.warn("[Tools] Web search failed for '{}': {}", request.getQuery(), e.getMessage());
                return ToolSupport.remoteFailure(e);
            }
        });
    }

    static String format(WebSearchResponse response) {
        if (!response.isSuccess()) {
            return response.getMessage() != null ? response.getMessage() : "Search failed";
        }

        List<String> lines = new ArrayList<>();
        if (response.getAnswer() != null && !response.getAnswer().isBlank()) {
            lines.add("## Answer summary");
            lines.add(response.getAnswer());
            lines.add("");
        }

        List<WebSearchResult> results = response.getResults();
        if (results == null || results.isEmpty()) {
            lines.add("No results found");
            return String.join("\n", lines);
        }

        lines.add("## Search results");
        lines.add("");
        for (int i = 0; i < results.size(); i++) {
            WebSearchResult result = results.get(i);
            lines.add("### " + (i + 1) + ". " + result.getTitle());
            lines.add("URL: " + result.getUrl());
            if (result.getPublishedDate() != null) {
                lines.add("Published: " + result.getPublishedDate());
            }
            lines.add("");
            lines.add(ToolSupport.truncate(result.getContent(), MAX_SNIPPET_CHARS));
            lines.add("");
        }
        return String.join("\n", lines);
    }
}
