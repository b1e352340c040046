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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.FeignException;
import me.golemcore.bench.domain.model.ToolResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Argument access, schema building and error mapping shared by the evidence
 * tools.
 */
final class ToolSupport {

    static final String TYPE_STRING = "string";
    static final String TYPE_NUMBER = "number";
    static final String TYPE_BOOLEAN = "boolean";
    static final String TYPE_OBJECT = "object";

    private static final int MAX_API_ERROR_CHARS = 500;

    private ToolSupport() {
    }

    static Map<String, Object> property(String type, String description) {
        return Map.of("type", type, "description", description);
    }

    static Map<String, Object> enumProperty(List<String> values, String description) {
        return Map.of("type", TYPE_STRING, "enum", values, "description", description);
    }

    static Map<String, Object> objectSchema(Map<String, Object> properties, List<String> required) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", TYPE_OBJECT);
        schema.put("properties", properties);
        schema.put("required", required);
        return schema;
    }

    static String stringArg(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        if (value == null) {
            return null;
        }
        return value instanceof String s ? s : String.valueOf(value);
    }

    static String requiredArg(Map<String, Object> parameters, String name) {
        String value = stringArg(parameters, name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }

    static Number numberArg(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        if (value instanceof Number n) {
            return n;
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(name + " must be a number, got: " + s, e);
            }
        }
        return null;
    }

    static Boolean booleanArg(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s && !s.isBlank()) {
            return Boolean.parseBoolean(s.trim());
        }
        return null;
    }

    /**
     * Rejects action steps that are not a JSON array, so a malformed sequence
     * never reaches the evidence service. Blank values pass as "no steps".
     */
    static void validateActionSteps(ObjectMapper objectMapper, String actionSteps) {
        if (actionSteps == null || actionSteps.isBlank()) {
            return;
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(actionSteps);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("action_steps is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isArray()) {
            throw new IllegalArgumentException("action_steps must be a JSON array of steps");
        }
    }

    static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxChars ? text : text.substring(0, maxChars) + "...";
    }

    /**
     * Maps a remote failure to a tool-level failure the model can read.
     */
    static ToolResult remoteFailure(Exception e) {
        if (e instanceof FeignException fe && fe.status() > 0) {
            return ToolResult.failure("API " + fe.status() + ": " + truncate(fe.contentUTF8(), MAX_API_ERROR_CHARS));
        }
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return ToolResult.failure(message);
    }
}
