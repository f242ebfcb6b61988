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
import dev.langchain4j.model.chat.ChatModel;

import java.time.Duration;

/**
 * Creates the chat model client of an API provider.
 */
public interface ChatModelFactory {

    ChatModel create(ApiPlatform platform, BridgeProperties.PlatformProperties settings, String modelName,
            Duration timeout);
}
