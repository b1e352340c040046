package me.golemcore.bench.domain.system.toolloop;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.bench.domain.model.ToolCall;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers tool calls that a model wrote into its visible text instead of the
 * structured tool-call channel.
 *
 * <p>
 * Only text carrying one of the known sentinel tokens is considered. Candidates
 * are tried in order: fenced code blocks, then the last balanced bracket pair
 * before each sentinel (last sentinel first), then the first balanced pair
 * after it. A candidate counts when it is a JSON object or array whose elements
 * have {@code name} and {@code arguments}. On success the JSON and every
 * sentinel token are removed from the text; otherwise the text is returned
 * untouched. Never throws.
 */
@Slf4j
public class TextToolCallExtractor {

    static final List<String> SENTINELS = List.of(
            // Kimi
            "<|tool_calls_section_begin|>", "<|tool_calls_section_end|>",
            "<|tool_call_begin|>", "<|tool_call_end|>", "<|tool_call_argument_begin|>",
            // Doubao
            "<|FunctionCallBegin|>", "<|FunctionCallEnd|>",
            // MiniMax
            "<minimax:tool_call>", "</minimax:tool_call>",
            // Qwen, GLM
            "<tool_call>", "</tool_call>",
            // Mistral
            "[TOOL_CALLS]",
            // DeepSeek
            "<｜tool▁calls▁begin｜>", "<｜tool▁calls▁end｜>",
            "<｜tool▁call▁begin｜>", "<｜tool▁call▁end｜>", "<｜tool▁sep｜>");

    private static final Pattern FENCED_BLOCK = Pattern.compile("```[a-zA-Z]*\\s*\\n?([\\s\\S]*?)```");
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");
    private static final int MAX_BACKWARD_CANDIDATES = 64;
    private static final int CALL_ID_HEX_CHARS = 24;

    private final ObjectMapper objectMapper;

    public TextToolCallExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public TextToolCallExtractor() {
        this(new ObjectMapper());
    }

    /**
     * Recovered calls plus the visible text with the tool-call markup removed.
     */
    public record ExtractionResult(List<ToolCall> calls, String cleanedText) {

        public ExtractionResult {
            calls = calls != null ? List.copyOf(calls) : List.of();
        }

        static ExtractionResult none(String text) {
            return new ExtractionResult(List.of(), text);
        }

        public boolean isFound() {
            return !calls.isEmpty();
        }
    }

    public ExtractionResult extract(String text) {
        if (text == null || text.isEmpty() || !containsSentinel(text)) {
            return ExtractionResult.none(text);
        }
        try {
            ExtractionResult result = extractFenced(text);
            if (result == null) {
                result = extractAroundSentinels(text);
            }
            if (result == null) {
                log.debug("[ToolLoop] Sentinel tokens present but no parseable tool call JSON");
                return ExtractionResult.none(text);
            }
            return result;
        } catch (RuntimeException e) {
            log.warn("[ToolLoop] Tool call extraction failed: {}", e.getMessage());
            return ExtractionResult.none(text);
        }
    }

    public static boolean containsSentinel(String text) {
        for (String sentinel : SENTINELS) {
            if (text.contains(sentinel)) {
                return true;
            }
        }
        return false;
    }

    // ==================== candidate search ====================

    private ExtractionResult extractFenced(String text) {
        Matcher matcher = FENCED_BLOCK.matcher(text);
        while (matcher.find()) {
            List<ToolCall> calls = parseCalls(matcher.group(1).trim());
            if (!calls.isEmpty()) {
                return success(calls, text, matcher.start(), matcher.end());
            }
        }
        return null;
    }

    private ExtractionResult extractAroundSentinels(String text) {
        List<int[]> positions = sentinelPositions(text);

        for (int i = positions.size() - 1; i >= 0; i--) {
            ExtractionResult result = scanBackward(text, positions.get(i)[0]);
            if (result != null) {
                return result;
            }
        }
        for (int i = positions.size() - 1; i >= 0; i--) {
            ExtractionResult result = scanForward(text, positions.get(i)[1]);
            if (result != null) {
                return result;
            }
        }
        return null;
    }

    private ExtractionResult scanBackward(String text, int sentinelPos) {
        int candidates = 0;
        for (int close = sentinelPos - 1; close >= 0 && candidates < MAX_BACKWARD_CANDIDATES; close--) {
            char c = text.charAt(close);
            if (c != ']' && c != '}') {
                continue;
            }
            int open = findOpening(text, close);
            if (open < 0) {
                continue;
            }
            candidates++;
            List<ToolCall> calls = parseCalls(text.substring(open, close + 1));
            if (!calls.isEmpty()) {
                return success(calls, text, open, close + 1);
            }
        }
        return null;
    }

    private ExtractionResult scanForward(String text, int sentinelEnd) {
        for (int open = sentinelEnd; open < text.length(); open++) {
            char c = text.charAt(open);
            if (c != '[' && c != '{') {
                continue;
            }
            int close = findClosing(text, open);
            if (close < 0) {
                return null;
            }
            List<ToolCall> calls = parseCalls(text.substring(open, close + 1));
            if (!calls.isEmpty()) {
                return success(calls, text, open, close + 1);
            }
            return null;
        }
        return null;
    }

    /**
     * Start and end offsets of every sentinel occurrence, by start offset.
     */
    private static List<int[]> sentinelPositions(String text) {
        List<int[]> positions = new ArrayList<>();
        for (String sentinel : SENTINELS) {
            int idx = text.indexOf(sentinel);
            while (idx >= 0) {
                positions.add(new int[] { idx, idx + sentinel.length() });
                idx = text.indexOf(sentinel, idx + sentinel.length());
            }
        }
        positions.sort(Comparator.comparingInt(position -> position[0]));
        return positions;
    }

    // ==================== bracket matching ====================

    static int findClosing(String text, int open) {
        Deque<Character> stack = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '[' || c == '{') {
                stack.push(c == '[' ? ']' : '}');
            } else if (c == ']' || c == '}') {
                if (stack.isEmpty() || stack.pop() != c) {
                    return -1;
                }
                if (stack.isEmpty()) {
                    return i;
                }
            }
        }
        return -1;
    }

    static int findOpening(String text, int close) {
        Deque<Character> stack = new ArrayDeque<>();
        boolean inString = false;
        for (int i = close; i >= 0; i--) {
            char c = text.charAt(i);
            if (c == '"' && !isEscaped(text, i)) {
                inString = !inString;
                continue;
            }
            if (inString) {
                continue;
            }
            if (c == ']' || c == '}') {
                stack.push(c == ']' ? '[' : '{');
            } else if (c == '[' || c == '{') {
                if (stack.isEmpty() || stack.pop() != c) {
                    return -1;
                }
                if (stack.isEmpty()) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static boolean isEscaped(String text, int quotePos) {
        int backslashes = 0;
        for (int i = quotePos - 1; i >= 0 && text.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    // ==================== JSON ====================

    private List<ToolCall> parseCalls(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            return List.of();
        }
        if (root == null) {
            return List.of();
        }

        List<JsonNode> elements = new ArrayList<>();
        if (root.isArray()) {
            root.forEach(elements::add);
        } else if (root.isObject() && root.has("tool_calls") && root.get("tool_calls").isArray()) {
            root.get("tool_calls").forEach(elements::add);
        } else if (root.isObject()) {
            elements.add(root);
        }

        List<ToolCall> calls = new ArrayList<>();
        for (JsonNode element : elements) {
            ToolCall call = toToolCall(element);
            if (call == null) {
                // all or nothing: a half-recognized block is not a tool call block
                return List.of();
            }
            calls.add(call);
        }
        return calls;
    }

    private ToolCall toToolCall(JsonNode element) {
        if (element == null || !element.isObject()) {
            return null;
        }
        JsonNode node = element.has("function") && element.get("function").isObject()
                ? element.get("function")
                : element;

        JsonNode name = node.get("name");
        JsonNode arguments = node.has("arguments") ? node.get("arguments") : node.get("parameters");
        if (name == null || !name.isTextual() || name.asText().isBlank() || arguments == null) {
            return null;
        }

        String argumentsJson;
        if (arguments.isObject()) {
            argumentsJson = arguments.toString();
        } else if (arguments.isTextual()) {
            argumentsJson = arguments.asText();
        } else {
            return null;
        }

        return ToolCall.builder()
                .id(newCallId())
                .name(name.asText())
                .arguments(argumentsJson)
                .build();
    }

    // ==================== cleanup ====================

    private ExtractionResult success(List<ToolCall> calls, String text, int start, int end) {
        String cleaned = text.substring(0, start) + text.substring(end);
        for (String sentinel : SENTINELS) {
            cleaned = cleaned.replace(sentinel, "");
        }
        cleaned = EXCESS_BLANK_LINES.matcher(cleaned).replaceAll("\n\n").trim();
        log.info("[ToolLoop] Recovered {} tool call(s) from text: {}", calls.size(),
                calls.stream().map(ToolCall::getName).toList());
        return new ExtractionResult(calls, cleaned);
    }

    private static String newCallId() {
        return "call_" + UUID.randomUUID().toString().replace("-", "").substring(0, CALL_ID_HEX_CHARS);
    }
}
