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

import me.golemcore.bridge.adapter.outbound.image.ImageCompressor;
import me.golemcore.bridge.domain.model.BridgeConfig;
import me.golemcore.bridge.domain.model.ProviderDefinition;
import me.golemcore.bridge.domain.model.TransportKind;
import me.golemcore.bridge.domain.service.ResponseStabilizer;
import me.golemcore.bridge.domain.service.ResponseTextCleaner;
import me.golemcore.bridge.domain.service.Sleeper;
import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import me.golemcore.bridge.infrastructure.config.ConfigurationException;
import me.golemcore.bridge.port.outbound.BrowserSurfacePort;
import me.golemcore.bridge.port.outbound.ProviderCatalogPort;
import me.golemcore.bridge.port.outbound.ProviderPort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds one provider adapter per configured provider definition.
 *
 * <p>
 * The transport of each definition selects the variant:
 * <ul>
 * <li>ui - {@link UiProviderAdapter} on the shared browser surface
 * <li>api - {@link ApiProviderAdapter} on the platform's credentials
 * </ul>
 *
 * <p>
 * Adapters are indexed by provider id in {@link #init()}, in declaration
 * order. A provider whose platform has no API key is still registered: its
 * session probe reports it logged out.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProviderAdapterFactory implements ProviderCatalogPort {

    private final BridgeConfig config;
    private final BridgeProperties properties;
    private final BrowserSurfacePort browser;
    private final ResponseStabilizer stabilizer;
    private final ResponseTextCleaner cleaner;
    private final ChatModelFactory chatModelFactory;
    private final ProviderErrorClassifier errorClassifier;
    private final ImageCompressor imageCompressor;
    private final Clock clock;
    private final Sleeper sleeper;

    private final Map<String, ProviderPort> adaptersById = new LinkedHashMap<>();
    private ExecutorService apiCallExecutor;

    @PostConstruct
    public void init() {
        AtomicInteger threadCounter = new AtomicInteger();
        this.apiCallExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "api-call-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        for (ProviderDefinition definition : config.getProviders().values()) {
            ProviderPort adapter = definition.getTransport() == TransportKind.UI
                    ? createUiAdapter(definition)
                    : createApiAdapter(definition);
            adaptersById.put(definition.getId(), adapter);
            log.debug("Registered {} provider adapter: {}", definition.getTransport(), definition.getId());
        }
        log.info("Provider adapters ready: {}", adaptersById.keySet());
    }

    @PreDestroy
    public void shutdown() {
        if (apiCallExecutor != null) {
            apiCallExecutor.shutdownNow();
        }
    }

    @Override
    public Optional<ProviderPort> find(String providerId) {
        return Optional.ofNullable(adaptersById.get(providerId));
    }

    @Override
    public Collection<ProviderPort> all() {
        return Collections.unmodifiableCollection(adaptersById.values());
    }

    private ProviderPort createUiAdapter(ProviderDefinition definition) {
        return new UiProviderAdapter(definition, browser, stabilizer, cleaner, clock, sleeper,
                properties.getTiming());
    }

    private ProviderPort createApiAdapter(ProviderDefinition definition) {
        ApiPlatform platform = ApiPlatform.fromId(definition.getPlatform())
                .orElseThrow(() -> new ConfigurationException(
                        "Provider " + definition.getId() + " uses unknown platform: " + definition.getPlatform()));
        BridgeProperties.PlatformProperties settings = properties.getPlatforms().get(platform.getId());
        if (settings == null) {
            settings = new BridgeProperties.PlatformProperties();
        }
        if (settings.getApiKey() == null || settings.getApiKey().isBlank()) {
            log.warn("No API key for platform {}: provider {} stays logged out", platform.getId(),
                    definition.getId());
        }
        return new ApiProviderAdapter(definition, platform, settings, properties.getRetry(), chatModelFactory,
                errorClassifier, imageCompressor, cleaner, apiCallExecutor, clock, sleeper);
    }
}
