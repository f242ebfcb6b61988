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

import java.util.List;
import java.util.Map;

/**
 * Loaded bridge configuration file. Conversation order is the configuration
 * order and is the order conversations are serviced in each cycle.
 */
@Value
@Builder
public class BridgeConfig {

    String messagingUrl;

    @Builder.Default
    List<String> ignored = List.of();

    /** Provider definitions by id, in declaration order. */
    Map<String, ProviderDefinition> providers;

    /** Conversation mappings by name, in declaration order. */
    Map<String, ConversationMapping> conversations;

    public boolean isIgnored(String name) {
        return name != null && ignored.contains(name);
    }
}
