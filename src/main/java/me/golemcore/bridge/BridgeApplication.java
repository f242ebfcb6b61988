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

package me.golemcore.bridge;

import me.golemcore.bridge.infrastructure.config.CommandLineTranslator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class of the chat bridge.
 *
 * <p>
 * The bridge watches named conversations on a web messaging surface, forwards
 * each new message to the AI provider mapped to that conversation, and posts
 * the answer back.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → WebChatMessageSource
 * Domain Layer       → BridgeOrchestrator, SessionRegistry, ChatRouter, MessageCacheService
 * Infrastructure     → UI/API provider adapters, Playwright browser, local storage
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * Application settings under the {@code bridge.*} prefix in
 * {@code application.yml}; conversation and provider mappings in the JSON file
 * given by {@code --config}.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class BridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(BridgeApplication.class, CommandLineTranslator.translate(args));
    }

}
