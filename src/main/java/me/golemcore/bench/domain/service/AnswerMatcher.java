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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Key-value extraction and presence tests used for answer correctness.
 *
 * <p>
 * A list answer ({@code A、B、C}) yields one key per item; otherwise every
 * signed decimal number is a key (thousands separators ignored); otherwise the whole trimmed answer is. Text
 * keys match as substrings after whitespace normalization. Numeric keys match
 * only as whole numbers once thousands separators are stripped, so {@code 91}
 * is not found inside {@code 910} or {@code 91.5}.
 */
public final class AnswerMatcher {

    public static final String LIST_SEPARATOR = "、";

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern THOUSANDS_SEPARATOR = Pattern.compile("(?<=\\d),(?=\\d{3})");

    private AnswerMatcher() {
    }

    public static List<String> extractKeys(String expectedAnswer) {
        List<String> keys = new ArrayList<>();
        if (expectedAnswer == null || expectedAnswer.isBlank()) {
            return keys;
        }

        if (expectedAnswer.contains(LIST_SEPARATOR)) {
            for (String item : expectedAnswer.split(LIST_SEPARATOR)) {
                String trimmed = item.trim();
                if (!trimmed.isEmpty()) {
                    keys.add(trimmed);
                }
            }
            return keys;
        }

        Matcher matcher = NUMBER.matcher(THOUSANDS_SEPARATOR.matcher(expectedAnswer).replaceAll(""));
        while (matcher.find()) {
            keys.add(matcher.group());
        }
        if (keys.isEmpty()) {
            keys.add(expectedAnswer.trim());
        }
        return keys;
    }

    public static boolean isPresent(String key, String text) {
        if (key == null || key.isBlank() || text == null) {
            return false;
        }
        String normalizedText = normalizeWhitespace(text);
        String normalizedKey = normalizeWhitespace(key).trim();

        if (!isNumeric(normalizedKey)) {
            return normalizedText.contains(normalizedKey);
        }
        String withoutSeparators = THOUSANDS_SEPARATOR.matcher(normalizedText).replaceAll("");
        return numberPattern(normalizedKey).matcher(withoutSeparators).find();
    }

    static boolean isNumeric(String key) {
        return NUMBER.matcher(key).matches();
    }

    private static Pattern numberPattern(String key) {
        boolean negative = key.startsWith("-");
        String digits = Pattern.quote(negative ? key.substring(1) : key);
        String tail = "(?!\\d|\\.\\d)";
        if (negative) {
            return Pattern.compile("[-−]\\s*" + digits + tail);
        }
        return Pattern.compile("(?<![\\d.])" + digits + tail);
    }

    private static String normalizeWhitespace(String value) {
        return WHITESPACE.matcher(value).replaceAll(" ");
    }
}
