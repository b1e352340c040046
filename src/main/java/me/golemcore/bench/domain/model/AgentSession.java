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

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One full run of one (model, case) pair. Owns its conversation, turn log and
 * counters for its lifetime; nothing here is shared between sessions.
 */
@Getter
public class AgentSession {

    public static final String MAX_ROUNDS_PLACEHOLDER = "[Max round-trips exceeded]";

    private final String model;
    private final Conversation conversation;
    private final Instant startedAt;

    private final List<Turn> turns = new ArrayList<>();
    private TokenUsage totalUsage = TokenUsage.ZERO;
    private int roundTrips;
    private int toolCallCount;
    private SessionStatus status = SessionStatus.RUNNING;
    private String answer;
    private String error;
    private Duration duration = Duration.ZERO;

    public AgentSession(String model, Conversation conversation, Instant startedAt) {
        this.model = model;
        this.conversation = conversation;
        this.startedAt = startedAt;
    }

    public List<Turn> getTurns() {
        return Collections.unmodifiableList(turns);
    }

    public int nextRound() {
        requireActive();
        status = SessionStatus.RUNNING;
        return ++roundTrips;
    }

    public void enterToolDispatch() {
        requireActive();
        status = SessionStatus.TOOL_DISPATCH;
    }

    public void addUsage(TokenUsage usage) {
        totalUsage = totalUsage.plus(usage);
    }

    public void recordTurn(Turn turn) {
        turns.add(turn);
        toolCallCount += turn.toolCalls().size();
    }

    public void complete(String finalAnswer, Instant now) {
        finish(SessionStatus.COMPLETED, now);
        this.answer = finalAnswer != null ? finalAnswer : "";
    }

    public void exceedRounds(Instant now) {
        finish(SessionStatus.MAX_ROUNDS_EXCEEDED, now);
        this.answer = MAX_ROUNDS_PLACEHOLDER;
    }

    public void fail(String errorMessage, Instant now) {
        finish(SessionStatus.FAILED, now);
        this.error = errorMessage;
    }

    public boolean isFailed() {
        return status == SessionStatus.FAILED;
    }

    private void finish(SessionStatus terminal, Instant now) {
        requireActive();
        this.status = terminal;
        this.duration = Duration.between(startedAt, now);
    }

    private void requireActive() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Session already finished with status " + status);
        }
    }
}
