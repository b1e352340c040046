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
import me.golemcore.bench.domain.component.ToolComponent;
import me.golemcore.bench.domain.model.ToolDefinition;
import me.golemcore.bench.domain.model.ToolFailureKind;
import me.golemcore.bench.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Static page text (markdown) through the evidence service. Content beyond
 * 8000 characters is cut with a marker.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebFetchTool implements ToolComponent {

    public static final String NAME = "web_fetch";

    static final int MAX_CONTENT_CHARS = 8000;
    static final String TRUNCATED_MARKER = "\n\n... [content truncated]";

    private static final String PARAM_URL = "url";

    private final EvidenceServiceApi evidenceApi;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Fetch the static text content of a URL as markdown. Suited to articles, blogs and "
                        + "documentation. Content rendered by JavaScript needs analyze_page instead.")
                .inputSchema(ToolSupport.objectSchema(
                        Map.of(PARAM_URL, ToolSupport.property(ToolSupport.TYPE_STRING, "URL of the page to fetch")),
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

            try {
                log.debug("[Tools] Fetch: {}", url);
                EvidenceServiceApi.WebFetchResponse response = evidenceApi
                        .fetch(new EvidenceServiceApi.WebFetchRequest(url));
                if (!response.isSuccess()) {
                    return ToolResult.success(response.getMessage() != null ? response.getMessage() : "Fetch failed");
                }
                String content = response.getContent() != null ? response.getContent() : "";
                if (content.length() > MAX_CONTENT_CHARS) {
                    content = content.substring(0, MAX_CONTENT_CHARS) + TRUNCATED_MARKER;
                }
                return ToolResult.success("## " + url + "\n\n" + content);
            } catch (Exception e) { // NOSONAR - remote failures become tool errors
                log.warn("[Tools] Fetch failed for {}: {}", url, e.getMessage());
                return ToolSupport.remoteFailure(e);
            }
        });
    }
}
