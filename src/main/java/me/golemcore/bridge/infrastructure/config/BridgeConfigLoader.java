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

package me.golemcore.bridge.infrastructure.config;

import me.golemcore.bridge.domain.model.BridgeConfig;
import me.golemcore.bridge.domain.model.ConversationMapping;
import me.golemcore.bridge.domain.model.ProviderDefinition;
import me.golemcore.bridge.domain.model.TransportKind;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads the JSON bridge configuration file into an immutable
 * {@link BridgeConfig}.
 *
 * <p>
 * Example:
 *
 * <pre>
 * {
 *   "messaging_url": "https://web.whatsapp.com",
 *   "ignore": ["Family"],
 *   "providers": {
 *     "chatgpt": {"transport": "ui", "url": "https://chatgpt.com",
 *                 "input_selector": "#prompt-textarea",
 *                 "response_selector": "div[data-message-author-role='assistant']"},
 *     "openai": {"transport": "api", "platform": "openai"}
 *   },
 *   "conversations": {
 *     "Capivara": {"provider": "chatgpt", "timeout_seconds": 30},
 *     "VanDog": {"provider": "openai", "text_model": "gpt-4o-mini", "vision_model": "gpt-4o"}
 *   }
 * }
 * </pre>
 *
 * Conversation and provider order is kept. Every problem is reported as a
 * {@link ConfigurationException}; an API provider without a key is not a
 * problem here.
 */
@Component
@Slf4j
public class BridgeConfigLoader {

    private static final String TRANSPORT_UI = "ui";
    private static final String TRANSPORT_API = "api";

    private final ObjectMapper objectMapper;

    public BridgeConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public BridgeConfig load(Path path) {
        String json;
        try {
            json = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file " + path + ": " + e.getMessage(), e);
        }

        ConfigFile file;
        try {
            file = objectMapper.readValue(json, ConfigFile.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid configuration file " + path + ": " + e.getOriginalMessage(), e);
        }
        if (file == null) {
            throw new ConfigurationException("Configuration file " + path + " is empty");
        }

        BridgeConfig config = toConfig(file);
        log.info("Loaded configuration from {}: {} providers, {} conversations, {} ignored", path,
                config.getProviders().size(), config.getConversations().size(), config.getIgnored().size());
        return config;
    }

    private BridgeConfig toConfig(ConfigFile file) {
        if (isBlank(file.getMessagingUrl())) {
            throw new ConfigurationException("messaging_url is required");
        }

        if (file.getProviders() == null || file.getProviders().isEmpty()) {
            throw new ConfigurationException("No providers configured");
        }
        Map<String, ProviderDefinition> providers = new LinkedHashMap<>();
        file.getProviders().forEach((id, entry) -> providers.put(id, toProvider(id, entry)));

        Map<String, ConversationMapping> conversations = new LinkedHashMap<>();
        Map<String, ConversationEntry> entries = file.getConversations() != null
                ? file.getConversations()
                : Map.of();
        entries.forEach((name, entry) -> {
            if (entry == null || isBlank(entry.getProvider())) {
                throw new ConfigurationException("Conversation '" + name + "' has no provider");
            }
            ProviderDefinition provider = providers.get(entry.getProvider());
            if (provider == null) {
                throw new ConfigurationException(
                        "Conversation '" + name + "' references unknown provider: " + entry.getProvider());
            }
            conversations.put(name, toConversation(name, provider, entry));
        });

        List<String> ignored = new ArrayList<>();
        if (file.getIgnore() != null) {
            file.getIgnore().stream().filter(name -> !isBlank(name)).forEach(ignored::add);
        }

        return BridgeConfig.builder()
                .messagingUrl(file.getMessagingUrl())
                .ignored(List.copyOf(ignored))
                .providers(Collections.unmodifiableMap(providers))
                .conversations(Collections.unmodifiableMap(conversations))
                .build();
    }

    private ProviderDefinition toProvider(String id, ProviderEntry entry) {
        if (entry == null) {
            throw new ConfigurationException("Provider '" + id + "' is empty");
        }
        String transport = entry.getTransport() != null
                ? entry.getTransport().strip().toLowerCase(Locale.ROOT)
                : TRANSPORT_UI;

        ProviderDefinition.ProviderDefinitionBuilder builder = ProviderDefinition.builder().id(id);
        switch (transport) {
        case TRANSPORT_UI -> {
            require(id, "url", entry.getUrl());
            require(id, "input_selector", entry.getInputSelector());
            require(id, "response_selector", entry.getResponseSelector());
            builder.transport(TransportKind.UI)
                    .url(entry.getUrl())
                    .inputSelector(entry.getInputSelector())
                    .submitSelector(entry.getSubmitSelector())
                    .responseSelector(entry.getResponseSelector())
                    .uploadSelector(entry.getUploadSelector())
                    .imagePreviewSelector(entry.getImagePreviewSelector())
                    .readySelector(entry.getReadySelector())
                    .reloadAfterResponse(Boolean.TRUE.equals(entry.getReloadAfterResponse()));
            if (entry.getMaxPromptChars() != null) {
                builder.maxPromptChars(entry.getMaxPromptChars());
            }
        }
        case TRANSPORT_API -> {
            require(id, "platform", entry.getPlatform());
            builder.transport(TransportKind.API).platform(entry.getPlatform().strip());
        }
        default -> throw new ConfigurationException("Provider '" + id + "' has unknown transport: " + transport);
        }
        return builder.build();
    }

    private ConversationMapping toConversation(String name, ProviderDefinition provider, ConversationEntry entry) {
        return ConversationMapping.builder()
                .name(name)
                .transport(provider.getTransport())
                .providerId(provider.getId())
                .textModel(entry.getTextModel())
                .visionModel(entry.getVisionModel())
                .textPromptTemplate(entry.getTextPrompt())
                .imagePromptTemplate(entry.getImagePrompt())
                .timeout(seconds(name, "timeout_seconds", entry.getTimeoutSeconds()))
                .responseWait(seconds(name, "response_wait_seconds", entry.getResponseWaitSeconds()))
                .enabled(entry.getEnabled() == null || entry.getEnabled())
                .build();
    }

    private static Duration seconds(String conversation, String field, Integer value) {
        if (value == null) {
            return null;
        }
        if (value <= 0) {
            throw new ConfigurationException(
                    "Conversation '" + conversation + "' has non-positive " + field + ": " + value);
        }
        return Duration.ofSeconds(value);
    }

    private static void require(String providerId, String field, String value) {
        if (isBlank(value)) {
            throw new ConfigurationException("Provider '" + providerId + "' is missing " + field);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ConfigFile {
        @JsonProperty("messaging_url")
        private String messagingUrl;
        private List<String> ignore = new ArrayList<>();
        private Map<String, ProviderEntry> providers = new LinkedHashMap<>();
        private Map<String, ConversationEntry> conversations = new LinkedHashMap<>();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ProviderEntry {
        private String transport;
        private String url;
        @JsonProperty("input_selector")
        private String inputSelector;
        @JsonProperty("submit_selector")
        private String submitSelector;
        @JsonProperty("response_selector")
        private String responseSelector;
        @JsonProperty("upload_selector")
        private String uploadSelector;
        @JsonProperty("image_preview_selector")
        private String imagePreviewSelector;
        @JsonProperty("ready_selector")
        private String readySelector;
        @JsonProperty("reload_after_response")
        private Boolean reloadAfterResponse;
        @JsonProperty("max_prompt_chars")
        private Integer maxPromptChars;
        private String platform;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ConversationEntry {
        private String provider;
        @JsonProperty("text_model")
        private String textModel;
        @JsonProperty("vision_model")
        private String visionModel;
        @JsonProperty("text_prompt")
        private String textPrompt;
        @JsonProperty("image_prompt")
        private String imagePrompt;
        @JsonProperty("timeout_seconds")
        private Integer timeoutSeconds;
        @JsonProperty("response_wait_seconds")
        private Integer responseWaitSeconds;
        private Boolean enabled;
    }
}
