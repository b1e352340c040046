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

import java.util.List;

/**
 * Score of one run.
 *
 * @param answerCorrect
 *            share of expected key values found, 0..1
 * @param citationCreated
 *            a citation call produced a record
 * @param citationInText
 *            the final answer carries a {@code [@v:N]} marker
 * @param evidenceTypeMatch
 *            evidence type of the last citation against the expectation
 * @param rawScore
 *            weighted sum before the gate, for auditing only
 * @param totalScore
 *            gated score: 0, 80 or 100
 * @param details
 *            keys and types behind the decision
 */
public record ScoreResult(double answerCorrect, boolean citationCreated, boolean citationInText,
        EvidenceTypeMatch evidenceTypeMatch, int rawScore, int totalScore, Details details) {

    public record Details(List<String> expectedKeys, List<String> matchedKeys, String actualEvidenceType,
            String expectedEvidenceType) {

        public Details {
            expectedKeys = expectedKeys != null ? List.copyOf(expectedKeys) : List.of();
            matchedKeys = matchedKeys != null ? List.copyOf(matchedKeys) : List.of();
        }
    }
}
