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

import me.golemcore.bridge.domain.model.MessageKind;
import org.springframework.stereotype.Component;

/**
 * Fills conversation prompt templates. The {@code {message}} placeholder is
 * replaced with the message text; a template without the placeholder gets the
 * text appended on a new line.
 */
@Component
public class PromptComposer {

    public static final String PLACEHOLDER = "{message}";
    static final String DEFAULT_TEXT_TEMPLATE = PLACEHOLDER;
    static final String DEFAULT_IMAGE_TEMPLATE = "Describe this image briefly.";

    public String compose(String template, String text, MessageKind kind) {
        String effective = template != null && !template.isBlank() ? template : defaultTemplate(kind);
        String value = text != null ? text.strip() : "";
        String prompt;
        if (effective.contains(PLACEHOLDER)) {
            prompt = effective.replace(PLACEHOLDER, value);
        } else if (value.isEmpty()) {
            prompt = effective;
        } else {
            prompt = effective + "\n" + value;
        }
        return prompt.strip();
    }

    /**
     * Cuts a prompt to the provider's size limit.
     */
    public static String truncate(String prompt, int maxChars) {
        if (prompt == null || maxChars <= 0 || prompt.length() <= maxChars) {
            return prompt;
        }
        int end = maxChars;
        if (Character.isHighSurrogate(prompt.charAt(end - 1))) {
            end--;
        }
        return prompt.substring(0, end);
    }

    private static String defaultTemplate(MessageKind kind) {
        return kind == MessageKind.IMAGE ? DEFAULT_IMAGE_TEMPLATE : DEFAULT_TEXT_TEMPLATE;
    }
}
