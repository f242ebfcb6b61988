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

package me.golemcore.bridge.adapter.outbound.provider;

import java.util.Locale;
import java.util.Optional;

/**
 * Network API platforms an API provider can target. Every platform except
 * Anthropic speaks the OpenAI-compatible chat completions contract.
 */
public enum ApiPlatform {

    OPENAI("openai", null),
    ANTHROPIC("anthropic", null),
    GEMINI("gemini", "https://generativelanguage.googleapis.com/v1beta/openai/"),
    GROK("grok", "https://api.x.ai/v1"),
    PERPLEXITY("perplexity", "https://api.perplexity.ai");

    private final String id;
    private final String defaultBaseUrl;

    ApiPlatform(String id, String defaultBaseUrl) {
        this.id = id;
        this.defaultBaseUrl = defaultBaseUrl;
    }

    public String getId() {
        return id;
    }

    /**
     * Base URL used when none is configured; {@code null} means the client
     * library default.
     */
    public String getDefaultBaseUrl() {
        return defaultBaseUrl;
    }

    public boolean isOpenAiCompatible() {
        return this != ANTHROPIC;
    }

    public static Optional<ApiPlatform> fromId(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        if ("claude".equals(normalized)) {
            return Optional.of(ANTHROPIC);
        }
        for (ApiPlatform platform : values()) {
            if (platform.id.equals(normalized)) {
                return Optional.of(platform);
            }
        }
        return Optional.empty();
    }
}
