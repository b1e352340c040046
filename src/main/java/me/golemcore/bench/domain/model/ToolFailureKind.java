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

public enum ToolFailureKind {

    /**
     * The model asked for a tool the registry does not know.
     */
    UNKNOWN_TOOL,

    /**
     * Arguments were not a JSON object or failed handler validation.
     */
    INVALID_ARGUMENTS,

    /**
     * Tool execution failed during runtime (exceptions, remote errors).
     */
    EXECUTION_FAILED,

    /**
     * The tool did not finish within the configured timeout.
     */
    TIMEOUT
}
