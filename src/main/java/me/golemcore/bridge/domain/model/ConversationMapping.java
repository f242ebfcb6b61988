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

import java.time.Duration;

/**
 * Routing entry for one monitored conversation: which provider answers it,
 * with which models and prompt templates, and under which wait overrides.
 * Immutable for the process lifetime.
 */
@Value
@Builder
public class ConversationMapping {

    /** Conversation display name, case-sensitive. */
    String name;

    TransportKind transport;

    /** Provider id, the key of the provider's session and adapter. */
    String providerId;

    String textModel;
    String visionModel;

    String textPromptTemplate;
    String imagePromptTemplate;

    /** Overrides the global maximum response wait when set. */
    Duration timeout;

    /** Overrides the global initial response wait when set. */
    Duration responseWait;

    @Builder.Default
    boolean enabled = true;

    public String modelFor(MessageKind kind) {
        if (kind == MessageKind.IMAGE && visionModel != null && !visionModel.isBlank()) {
            return visionModel;
        }
        return textModel;
    }

    public String templateFor(MessageKind kind) {
        return kind == MessageKind.IMAGE ? imagePromptTemplate : textPromptTemplate;
    }
}
