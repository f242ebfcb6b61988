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

import me.golemcore.bridge.domain.model.BridgeConfig;
import me.golemcore.bridge.domain.model.ConversationMapping;
import me.golemcore.bridge.domain.model.Message;
import me.golemcore.bridge.domain.model.ProviderRequest;
import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Maps a conversation to its provider and turns messages into provider
 * requests. Lookups are exact and case-sensitive; an unknown conversation is
 * simply not routed.
 */
@Service
public class ChatRouter {

    private final BridgeConfig config;
    private final PromptComposer promptComposer;
    private final BridgeProperties.TimingProperties timing;

    public ChatRouter(BridgeConfig config, PromptComposer promptComposer, BridgeProperties properties) {
        this.config = config;
        this.promptComposer = promptComposer;
        this.timing = properties.getTiming();
    }

    public Optional<ConversationMapping> resolve(String conversation) {
        if (conversation == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(config.getConversations().get(conversation));
    }

    /**
     * Enabled conversations in configuration order.
     */
    public List<ConversationMapping> conversations() {
        return config.getConversations().values().stream()
                .filter(ConversationMapping::isEnabled)
                .toList();
    }

    /**
     * Builds the request for a message: model and prompt template by message
     * kind, and the conversation's wait overrides.
     *
     * @throws UnroutableMessageException
     *             if the message cannot produce a valid request (empty text, or
     *             an image that was never materialized)
     */
    public ProviderRequest route(ConversationMapping mapping, Message message) {
        if (message.isImage() && message.getImageRef() == null) {
            throw new UnroutableMessageException("image was not materialized");
        }
        if (!message.isImage() && message.promptText().isBlank()) {
            throw new UnroutableMessageException("empty message text");
        }

        String prompt = promptComposer.compose(mapping.templateFor(message.getKind()), message.promptText(),
                message.getKind());
        if (prompt.isBlank()) {
            throw new UnroutableMessageException("prompt template produced an empty prompt");
        }

        Duration defaultWait = message.isImage() ? timing.getResponseWaitImage() : timing.getResponseWaitText();
        return ProviderRequest.builder()
                .prompt(prompt)
                .imageRef(message.getImageRef())
                .model(mapping.modelFor(message.getKind()))
                .timeout(mapping.getTimeout() != null ? mapping.getTimeout() : timing.getMaxResponseWait())
                .responseWait(mapping.getResponseWait() != null ? mapping.getResponseWait() : defaultWait)
                .build();
    }

    /**
     * A message that can never be turned into a provider request.
     */
    public static class UnroutableMessageException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        public UnroutableMessageException(String message) {
            super(message);
        }
    }
}
