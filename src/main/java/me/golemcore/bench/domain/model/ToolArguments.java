package me.golemcore.bench.domain.model;

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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON helpers for tool call arguments.
 */
public final class ToolArguments {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private ToolArguments() {
    }

    /**
     * Strict parse used before dispatching a call.
     *
     * @throws IllegalArgumentException
     *             if the string is not a JSON object
     */
    public static Map<String, Object> parse(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> parsed = JSON_MAPPER.readValue(json, MAP_TYPE_REF);
            return parsed != null ? parsed : new LinkedHashMap<>();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e.getOriginalMessage(), e);
        }
    }

    /**
     * Lenient parse used for the turn log: malformed input is kept under
     * {@code raw}.
     */
    public static Map<String, Object> parseLenient(String json) {
        try {
            return parse(json);
        } catch (IllegalArgumentException e) {
            Map<String, Object> raw = new LinkedHashMap<>();
            raw.put("raw", json);
            return Collections.unmodifiableMap(raw);
        }
    }

    public static String write(Object value) {
        if (value == null) {
            return "{}";
        }
        if (value instanceof String s) {
            return s;
        }
        try {
            return JSON_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return "{}";
        }
    }

    public static String getString(Map<String, Object> args, String key) {
        Object value = args != null ? args.get(key) : null;
        if (value == null) {
            return null;
        }
        return value instanceof String s ? s : String.valueOf(value);
    }
}
