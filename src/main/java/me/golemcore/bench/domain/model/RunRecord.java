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

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Transcript record of one (model, case) run, as handed to the results store.
 */
@Data
@Builder
public class RunRecord {

    private String model;
    private String caseId;
    private String category;
    private String question;
    private String expectedAnswer;

    private SessionStatus status;
    private String answer;
    private String error;

    private List<Turn> turns;
    private TokenUsage usage;
    private int roundTrips;
    private int toolCallCount;
    private int citeCallCount;
    private int citationCount;
    private long durationMs;

    /** Absent for failed runs and for cases without an expected answer. */
    private ScoreResult score;

    public RunKey key() {
        return new RunKey(model, caseId);
    }

    public boolean isFailed() {
        return status == SessionStatus.FAILED;
    }

    public boolean isScored() {
        return score != null;
    }
}
