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
import me.golemcore.bridge.domain.service.CacheRetentionPolicy;
import me.golemcore.bridge.domain.service.Sleeper;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;

/**
 * Shared infrastructure beans: clock, JSON mapper, sleeper, cache retention and
 * the loaded bridge configuration.
 */
@Configuration
@Slf4j
public class BridgeConfiguration {

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public Sleeper sleeper() {
        return duration -> Thread.sleep(duration.toMillis());
    }

    @Bean
    public CacheRetentionPolicy cacheRetentionPolicy(BridgeProperties properties) {
        Duration retention = properties.getCache().getRetention();
        if (retention == null || retention.isZero() || retention.isNegative()) {
            return CacheRetentionPolicy.unbounded();
        }
        log.info("[Cache] Retention window: {} days", retention.toDays());
        return CacheRetentionPolicy.window(retention);
    }

    @Bean
    public BridgeConfig bridgeConfig(BridgeConfigLoader loader, BridgeProperties properties) {
        return loader.load(Paths.get(properties.getConfigPath()));
    }
}
