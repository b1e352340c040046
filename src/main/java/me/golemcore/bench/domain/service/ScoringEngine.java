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

import me.golemcore.bench.domain.model.BenchmarkCase;
import me.golemcore.bench.domain.model.EvidenceTypeMatch;
import me.golemcore.bench.domain.model.ScoreResult;
import me.golemcore.bench.domain.model.ToolArguments;
import me.golemcore.bench.domain.model.ToolCallRecord;
import me.golemcore.bench.domain.model.ToolResult;
import me.golemcore.bench.domain.model.Turn;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Grades a finished run against its case.
 *
 * <p>
 * Four dimensions: answer correctness (40), citation created (25), citation
 * marker in the answer (15) and evidence type (20). The total is gated: unless
 * every expected key is present and a citation was created the score is 0.
 * Past the gate the total is 65 plus the marker and evidence-type points.
 *
 * <p>
 * Pure and deterministic; safe to call from any thread and to re-run offline on
 * stored transcripts.
 */
@Service
public class ScoringEngine {

    public static final String CITE_TOOL_NAME = "verifaible_cite";

    static final int WEIGHT_ANSWER = 40;
    static final int WEIGHT_CITATION_CREATED = 25;
    static final int WEIGHT_CITATION_IN_TEXT = 15;
    static final int WEIGHT_EVIDENCE_TYPE = 20;

    private static final String DEFAULT_EVIDENCE_TYPE = "text";
    private static final Pattern CITATION_MARKER = Pattern.compile("\\[@v:\\d+]");
    private static final Pattern CREATED_RECORD_ID = Pattern.compile(
            "(?:user_seq|evidence_id)\\W{0,3}\\d+|\"id\"\\s*:");
    private static final String TOOL_ERROR_MARKER = ToolResult.ERROR_PREFIX.trim();

    public ScoreResult score(BenchmarkCase testCase, String finalAnswer, List<Turn> turns) {
        String answer = finalAnswer != null ? finalAnswer : "";
        List<ToolCallRecord> citeCalls = citeCalls(turns);

        List<String> expectedKeys = AnswerMatcher.extractKeys(testCase.getAnswer());
        String searchable = searchableText(answer, citeCalls);
        List<String> matchedKeys = new ArrayList<>();
        for (String key : expectedKeys) {
            if (AnswerMatcher.isPresent(key, searchable)) {
                matchedKeys.add(key);
            }
        }
        double answerCorrect = expectedKeys.isEmpty() ? 0.0 : (double) matchedKeys.size() / expectedKeys.size();

        boolean citationCreated = citeCalls.stream().anyMatch(ScoringEngine::isCreatedCitation);
        boolean citationInText = hasCitationMarker(answer);

        String expectedType = expectedEvidenceType(testCase);
        String actualType = citeCalls.isEmpty() ? null : actualEvidenceType(citeCalls.get(citeCalls.size() - 1));
        EvidenceTypeMatch typeMatch = matchEvidenceType(expectedType, actualType);

        double raw = answerCorrect * WEIGHT_ANSWER
                + (citationCreated ? WEIGHT_CITATION_CREATED : 0)
                + (citationInText ? WEIGHT_CITATION_IN_TEXT : 0)
                + (typeMatch.isSatisfied() ? WEIGHT_EVIDENCE_TYPE : 0);
        int rawScore = (int) Math.round(raw);

        int totalScore = 0;
        if (answerCorrect >= 1.0 && citationCreated) {
            totalScore = WEIGHT_ANSWER + WEIGHT_CITATION_CREATED
                    + (citationInText ? WEIGHT_CITATION_IN_TEXT : 0)
                    + (typeMatch.isSatisfied() ? WEIGHT_EVIDENCE_TYPE : 0);
        }

        return new ScoreResult(answerCorrect, citationCreated, citationInText, typeMatch, rawScore, totalScore,
                new ScoreResult.Details(expectedKeys, matchedKeys, actualType, expectedType));
    }

    public static boolean hasCitationMarker(String answer) {
        return answer != null && CITATION_MARKER.matcher(answer).find();
    }

    /**
     * Counts {@code [@v:N]} markers in the answer.
     */
    public static int countCitationMarkers(String answer) {
        if (answer == null) {
            return 0;
        }
        return (int) CITATION_MARKER.matcher(answer).results().count();
    }

    public static List<ToolCallRecord> citeCalls(List<Turn> turns) {
        List<ToolCallRecord> calls = new ArrayList<>();
        if (turns == null) {
            return calls;
        }
        for (Turn turn : turns) {
            for (ToolCallRecord call : turn.toolCalls()) {
                if (CITE_TOOL_NAME.equals(call.name())) {
                    calls.add(call);
                }
            }
        }
        return calls;
    }

    static boolean isCreatedCitation(ToolCallRecord call) {
        String result = call.result();
        return !result.contains(TOOL_ERROR_MARKER) && CREATED_RECORD_ID.matcher(result).find();
    }

    static String expectedEvidenceType(BenchmarkCase testCase) {
        if (testCase.getEvidenceType() != null && !testCase.getEvidenceType().isBlank()) {
            return testCase.getEvidenceType().trim();
        }
        String category = testCase.getCategory();
        if (category == null) {
            return null;
        }
        if ("text".equals(category) || "table".equals(category)) {
            return category;
        }
        if (testCase.isVideo()) {
            return "video";
        }
        return null;
    }

    private static String actualEvidenceType(ToolCallRecord citeCall) {
        String type = ToolArguments.getString(citeCall.arguments(), "evidence_type");
        return type != null && !type.isBlank() ? type.trim() : DEFAULT_EVIDENCE_TYPE;
    }

    static EvidenceTypeMatch matchEvidenceType(String expected, String actual) {
        if (expected == null) {
            return EvidenceTypeMatch.UNKNOWN;
        }
        if (actual == null) {
            return EvidenceTypeMatch.MISMATCHED;
        }
        String normalizedActual = actual.toLowerCase(Locale.ROOT);
        for (String option : expected.split("\\|")) {
            if (option.trim().toLowerCase(Locale.ROOT).equals(normalizedActual)) {
                return EvidenceTypeMatch.MATCHED;
            }
        }
        return EvidenceTypeMatch.MISMATCHED;
    }

    /**
     * Answer text plus the cite arguments, with citation markers removed: a
     * marker id is never an answer value.
     */
    private static String searchableText(String answer, List<ToolCallRecord> citeCalls) {
        StringBuilder text = new StringBuilder(answer);
        for (ToolCallRecord call : citeCalls) {
            appendArgument(text, call, "claim");
            appendArgument(text, call, "quoted_text");
        }
        return CITATION_MARKER.matcher(text).replaceAll(" ");
    }

    private static void appendArgument(StringBuilder text, ToolCallRecord call, String name) {
        String value = ToolArguments.getString(call.arguments(), name);
        if (value != null && !value.isEmpty()) {
            text.append('\n').append(value);
        }
    }
}
