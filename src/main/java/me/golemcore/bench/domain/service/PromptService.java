package me.golemcore.bench.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.bench.domain.model.BenchmarkCase;
import me.golemcore.bench.infrastructure.config.BenchProperties;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders the prompts sent to the agent. The system prompt is a resource file;
 * per-case user prompts come from two templates with {@code {url}} and
 * {@code {question}} placeholders, one for web pages and one for videos.
 */
@Service
@Slf4j
public class PromptService {

    static final String CASE_TEMPLATE = "prompts/case-prompt.md";
    static final String VIDEO_TEMPLATE = "prompts/video-case-prompt.md";

    private final BenchProperties properties;
    private volatile String systemPrompt;

    public PromptService(BenchProperties properties) {
        this.properties = properties;
    }

    public String getSystemPrompt() {
        String prompt = systemPrompt;
        if (prompt == null) {
            prompt = readResource(properties.getPrompts().getSystemPromptPath());
            systemPrompt = prompt;
            log.debug("[Runner] System prompt loaded: {} chars", prompt.length());
        }
        return prompt;
    }

    /**
     * Legacy cases keep their own prompt; everything else is rendered from the
     * matching template.
     */
    public String renderUserPrompt(BenchmarkCase testCase) {
        if (testCase.getPrompt() != null && !testCase.getPrompt().isBlank()) {
            return testCase.getPrompt();
        }
        String template = readResource(testCase.isVideo() ? VIDEO_TEMPLATE : CASE_TEMPLATE);
        return template
                .replace("{url}", nullToEmpty(testCase.getUrl()))
                .replace("{question}", nullToEmpty(testCase.getQuestion()))
                .strip();
    }

    private static String readResource(String location) {
        Path path = Path.of(location);
        Resource resource = Files.isRegularFile(path)
                ? new FileSystemResource(path)
                : new ClassPathResource(location);
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read prompt resource " + location, e);
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
