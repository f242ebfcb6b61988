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

package me.golemcore.bridge.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Transport-specific description of one provider. UI providers carry the page
 * url and the selectors of their input, response and upload elements; API
 * providers carry the platform whose credentials and endpoint they use.
 */
@Value
@Builder
public class ProviderDefinition {

    String id;
    TransportKind transport;

    // UI transport
    String url;
    String inputSelector;
    String submitSelector;
    String responseSelector;
    String uploadSelector;
    String imagePreviewSelector;
    String readySelector;
    boolean reloadAfterResponse;

    /** Longest prompt the page accepts; longer prompts are truncated. */
    @Builder.Default
    int maxPromptChars = 8000;

    // API transport
    String platform;

    /**
     * Element whose presence proves an authenticated page. Falls back to the
     * input field, which login walls usually hide.
     */
    public String effectiveReadySelector() {
        return readySelector != null && !readySelector.isBlank() ? readySelector : inputSelector;
    }
}
