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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.bench.domain.model.BenchmarkCase;
import me.golemcore.bench.domain.model.TestSet;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Reads benchmark cases from either the testset format
 * ({@code {version, description, cases}}) or the legacy task array
 * ({@code [{id, name, prompt}]}). Legacy tasks keep their prompt and carry no
 * expected answer, so they are run but never scored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TestSetLoader {

    static final String LEGACY_CATEGORY = "unknown";

    private final ObjectMapper objectMapper;

    public TestSet load(Path path) {
        String json;
        try {
            json = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read test set " + path, e);
        }
        TestSet testSet = parse(json);
        log.info("[Runner] Loaded {} case(s) from {} (version {})", testSet.getCases().size(), path,
                testSet.getVersion());
        return testSet;
    }

    public TestSet parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed test set JSON: " + e.getOriginalMessage(), e);
        }

        if (root != null && root.isObject() && root.path("cases").isArray()) {
            TestSet testSet = objectMapper.convertValue(root, TestSet.class);
            if (testSet.getCases() == null) {
                testSet.setCases(new ArrayList<>());
            }
            return testSet;
        }
        if (root != null && root.isArray()) {
            return TestSet.builder()
                    .version("legacy")
                    .cases(parseLegacy(root))
                    .build();
        }
        throw new IllegalArgumentException("Unrecognized test set format: expected {cases: [...]} or an array");
    }

    /**
     * Keeps the cases whose id is listed; an empty filter keeps everything.
     */
    public static List<BenchmarkCase> filter(List<BenchmarkCase> cases, Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return cases;
        }
        return cases.stream().filter(c -> ids.contains(c.getId())).toList();
    }

    private static List<BenchmarkCase> parseLegacy(JsonNode tasks) {
        List<BenchmarkCase> cases = new ArrayList<>();
        for (JsonNode task : tasks) {
            cases.add(BenchmarkCase.builder()
                    .id(task.path("id").asText())
                    .category(LEGACY_CATEGORY)
                    .url("")
                    .question(task.path("name").asText(""))
                    .answer("")
                    .prompt(task.path("prompt").asText(null))
                    .build());
        }
        return cases;
    }
}
