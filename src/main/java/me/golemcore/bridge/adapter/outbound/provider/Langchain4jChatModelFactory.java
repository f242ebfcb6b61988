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

import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Builds langchain4j chat models. Anthropic gets its native client, every other
 * platform the OpenAI client pointed at the platform's base URL.
 *
 * <p>
 * Client-side retries are disabled: the adapter owns the retry curve.
 */
@Component
@Slf4j
public class Langchain4jChatModelFactory implements ChatModelFactory {

    @Override
    public ChatModel create(ApiPlatform platform, BridgeProperties.PlatformProperties settings, String modelName,
            Duration timeout) {
        String baseUrl = settings.getBaseUrl() != null && !settings.getBaseUrl().isBlank()
                ? settings.getBaseUrl()
                : platform.getDefaultBaseUrl();
        log.debug("[ApiProvider] Creating {} model {} (base url: {})", platform.getId(), modelName,
                baseUrl != null ? baseUrl : "default");

        if (!platform.isOpenAiCompatible()) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(settings.getApiKey())
                    .modelName(modelName)
                    .maxRetries(0) // Retry handled by our backoff logic
                    .timeout(timeout);
            if (baseUrl != null) {
                builder.baseUrl(baseUrl);
            }
            if (settings.getMaxTokens() != null) {
                builder.maxTokens(settings.getMaxTokens());
            }
            if (settings.getTemperature() != null) {
                builder.temperature(settings.getTemperature());
            }
            return builder.build();
        }

        var builder = OpenAiChatModel.builder()
                .apiKey(settings.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // Retry handled by our backoff logic
                .timeout(timeout);
        if (baseUrl != null) {
            builder.baseUrl(baseUrl);
        }
        if (settings.getMaxTokens() != null) {
            builder.maxTokens(settings.getMaxTokens());
        }
        if (settings.getTemperature() != null) {
            builder.temperature(settings.getTemperature());
        }
        return builder.build();
    }
}
