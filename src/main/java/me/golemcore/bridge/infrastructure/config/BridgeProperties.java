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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Application settings of the bridge, bound from application.yml.
 *
 * <p>
 * All settings live under the {@code bridge.*} prefix and are grouped by
 * subsystem:
 * <ul>
 * <li>{@link StorageProperties} - workspace location</li>
 * <li>{@link CacheProperties} - processed-message cache file and retention</li>
 * <li>{@link ImagesProperties} - temp image store</li>
 * <li>{@link BrowserProperties} - the shared Playwright browser</li>
 * <li>{@link MessagingProperties} - selectors of the messaging surface</li>
 * <li>{@link TimingProperties} - per-phase delays and waits</li>
 * <li>{@link RetryProperties} - API transport retry curve</li>
 * <li>{@link DispatchProperties} - redelivery and queue bounds</li>
 * <li>{@link PlatformProperties} - API credentials per platform</li>
 * </ul>
 *
 * <p>
 * Plain numbers in timing settings are read as seconds, so the environment
 * variables of the classic deployment ({@code LOOP_INTERVAL_DELAY=5}) keep
 * working.
 */
@Component
@ConfigurationProperties(prefix = "bridge")
@Data
public class BridgeProperties {

    /** Path of the JSON bridge configuration file. */
    private String configPath = "config.json";

    private StorageProperties storage = new StorageProperties();
    private CacheProperties cache = new CacheProperties();
    private ImagesProperties images = new ImagesProperties();
    private BrowserProperties browser = new BrowserProperties();
    private MessagingProperties messaging = new MessagingProperties();
    private TimingProperties timing = new TimingProperties();
    private RetryProperties retry = new RetryProperties();
    private DispatchProperties dispatch = new DispatchProperties();
    private Map<String, PlatformProperties> platforms = new LinkedHashMap<>();

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/bridge";
    }

    @Data
    public static class CacheProperties {
        private String directory = "cache";
        private String file = "processed.json";
        private boolean backup = true;

        /** Entries older than this are pruned; unset keeps every entry. */
        @DurationUnit(ChronoUnit.DAYS)
        private Duration retention;
    }

    @Data
    public static class ImagesProperties {
        private String directory = "images";

        @DurationUnit(ChronoUnit.MINUTES)
        private Duration maxAge = Duration.ofMinutes(30);
    }

    @Data
    public static class BrowserProperties {
        private boolean headless = false;
        private String profileDir = "${user.home}/.golemcore/bridge/profile";
        private String userAgent;

        /** Upper bound of a single page action (click, fill, evaluate). */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration actionTimeout = Duration.ofSeconds(15);

        /** Upper bound of a page navigation. */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration navigationTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class MessagingProperties {
        private String chatSelector = "div[role='listitem'] span[title='%s']";
        private String readySelector = "div[role='grid']";
        private String incomingRowSelector = "div.message-in";
        private String textSelector = "span.selectable-text";
        private String imageSelector = "img[src^='blob:']";
        private String metaAttributeSelector = "div[data-pre-plain-text]";
        private String metaAttribute = "data-pre-plain-text";
        private String composeSelector = "div[aria-label='Type a message']";

        /** Pattern of the timestamp inside the row metadata attribute. */
        private String timestampPattern = "H:mm, d/M/yyyy";
    }

    @Data
    public static class TimingProperties {
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration uploadDelay = Duration.ofSeconds(2);

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration responseWaitText = Duration.ofSeconds(2);

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration responseWaitImage = Duration.ofSeconds(5);

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration loginWait = Duration.ofSeconds(30);

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration loopInterval = Duration.ofSeconds(5);

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration maxResponseWait = Duration.ofSeconds(120);

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration pollInterval = Duration.ofSeconds(2);

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration imageDownloadDelay = Duration.ofSeconds(2);

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration sessionProbeInterval = Duration.ofSeconds(30);

        private int tempCleanupEveryCycles = 120;
    }

    @Data
    public static class RetryProperties {
        private int maxAttempts = 4;

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration initialBackoff = Duration.ofSeconds(1);

        private double backoffMultiplier = 2.0;

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration maxBackoff = Duration.ofSeconds(8);
    }

    @Data
    public static class DispatchProperties {
        private int maxRedeliveryAttempts = 5;
        private int maxPendingPerConversation = 50;
    }

    @Data
    public static class PlatformProperties {
        private String apiKey;
        private String baseUrl;
        private Integer maxTokens = 1024;
        private Double temperature = 0.7;
        private int maxPromptChars = 8000;
        private int maxImageKb = 500;
    }
}
