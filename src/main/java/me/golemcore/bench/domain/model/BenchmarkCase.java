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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One benchmark question with its expected answer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BenchmarkCase {

    private String id;

    /** text, table, dynamic, dynamic+pdf or a video-prefixed category. */
    private String category;

    /**
     * Explicit expected evidence type; may list alternatives separated by
     * {@code |}.
     */
    @JsonProperty("evidence_type")
    private String evidenceType;

    private String url;
    private String question;
    private String answer;

    /** Ready-made prompt from the legacy task format. */
    private String prompt;

    public boolean isVideo() {
        return category != null && category.startsWith("video");
    }

    public boolean hasExpectedAnswer() {
        return answer != null && !answer.isBlank();
    }
}
