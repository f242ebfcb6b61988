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

package me.golemcore.bridge.domain.service;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Strips web-answer artifacts from extracted responses before they are
 * relayed: citation markers such as {@code [1]}, {@code Source:} lines and
 * superscript digits. Runs of spaces are collapsed and at most one blank line
 * is kept between paragraphs.
 */
@Component
public class ResponseTextCleaner {

    private static final Pattern CITATION = Pattern.compile("\\[\\d+(?:\\s*,\\s*\\d+)*]");
    private static final Pattern SOURCE_LINE = Pattern.compile("(?im)^[ \\t]*sources?:.*$");
    private static final Pattern SUPERSCRIPT = Pattern.compile("[\\u00B9\\u00B2\\u00B3\\u2070\\u2074-\\u2079]");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t\\u00A0]+");
    private static final Pattern SPACE_BEFORE_PUNCTUATION = Pattern.compile(" +([.,;:!?])");
    private static final Pattern EDGE_SPACE = Pattern.compile("(?m)^ +| +$");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");

    public String clean(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = text.replace("\r\n", "\n");
        cleaned = CITATION.matcher(cleaned).replaceAll("");
        cleaned = SOURCE_LINE.matcher(cleaned).replaceAll("");
        cleaned = SUPERSCRIPT.matcher(cleaned).replaceAll("");
        cleaned = HORIZONTAL_SPACE.matcher(cleaned).replaceAll(" ");
        cleaned = SPACE_BEFORE_PUNCTUATION.matcher(cleaned).replaceAll("$1");
        cleaned = EDGE_SPACE.matcher(cleaned).replaceAll("");
        cleaned = BLANK_LINES.matcher(cleaned).replaceAll("\n\n");
        return cleaned.strip();
    }
}
