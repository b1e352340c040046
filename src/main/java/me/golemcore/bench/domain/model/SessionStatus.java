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

/**
 * Loop state of an {@link AgentSession}. The last three values are terminal.
 */
public enum SessionStatus {

    RUNNING,

    TOOL_DISPATCH,

    /** The provider answered with text only. */
    COMPLETED,

    /** The round-trip budget ran out. Scored normally. */
    MAX_ROUNDS_EXCEEDED,

    /** Transport failure. Recorded but never scored. */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == MAX_ROUNDS_EXCEEDED || this == FAILED;
    }
}
