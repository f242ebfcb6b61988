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

import me.golemcore.bridge.domain.model.CacheEntry;
import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import me.golemcore.bridge.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted set of processed-message fingerprints.
 *
 * <p>
 * The whole set is stored as one JSON document ({@code cache/processed.json}
 * by default) that is replaced atomically on every flush, so an auxiliary
 * reader never sees a half-written file. {@link #mark} flushes synchronously:
 * once it returns, a restart will not process the fingerprint again.
 *
 * <p>
 * An unreadable or corrupt document loads as an empty cache with a warning;
 * startup is never blocked by it. Retention is delegated to a
 * {@link CacheRetentionPolicy}, unbounded unless a window is configured.
 */
@Service
@Slf4j
public class MessageCacheService {

    static final int FORMAT_VERSION = 1;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final CacheRetentionPolicy retentionPolicy;
    private final String directory;
    private final String file;
    private final boolean backup;

    private final Map<String, Instant> entries = new LinkedHashMap<>();

    public MessageCacheService(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            CacheRetentionPolicy retentionPolicy, BridgeProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.retentionPolicy = retentionPolicy;
        this.directory = properties.getCache().getDirectory();
        this.file = properties.getCache().getFile();
        this.backup = properties.getCache().isBackup();
    }

    /**
     * Replaces the in-memory set with the persisted one.
     */
    public synchronized void load() {
        entries.clear();
        try {
            String json = storagePort.getText(directory, file).join();
            if (json == null || json.isBlank()) {
                log.info("[Cache] No processed-message cache found, starting empty");
                return;
            }
            CacheDocument document = objectMapper.readValue(json, CacheDocument.class);
            if (document.getEntries() != null) {
                document.getEntries().forEach((fingerprint, processedAt) -> {
                    if (fingerprint != null && !fingerprint.isBlank()) {
                        entries.put(fingerprint, processedAt);
                    }
                });
            }
            int pruned = prune();
            log.info("[Cache] Loaded {} processed fingerprints ({} pruned)", entries.size(), pruned);
        } catch (IOException | RuntimeException e) { // NOSONAR - corrupt cache must not block startup
            entries.clear();
            log.warn("[Cache] Cache document unreadable, starting empty: {}", e.getMessage());
        }
    }

    public synchronized boolean seen(String fingerprint) {
        return entries.containsKey(fingerprint);
    }

    /**
     * Records a fingerprint as processed and flushes before returning.
     *
     * @throws IllegalStateException
     *             if the document could not be persisted; the entry stays in
     *             memory and is written by the next successful flush
     */
    public synchronized void mark(String fingerprint, Instant processedAt) {
        entries.put(fingerprint, processedAt);
        flush();
    }

    /**
     * Writes the whole set as one atomically replaced document.
     *
     * @throws IllegalStateException
     *             if serialization or the write fails
     */
    public synchronized void flush() {
        prune();
        String json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(new CacheDocument(FORMAT_VERSION, new LinkedHashMap<>(entries)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize message cache", e);
        }
        try {
            storagePort.putTextAtomic(directory, file, json, backup).join();
            log.debug("[Cache] Flushed {} entries", entries.size());
        } catch (RuntimeException e) {
            throw new IllegalStateException("Failed to persist message cache", e);
        }
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized List<CacheEntry> entries() {
        List<CacheEntry> result = new ArrayList<>(entries.size());
        entries.forEach((fingerprint, processedAt) -> result.add(CacheEntry.builder()
                .fingerprint(fingerprint)
                .processedAt(processedAt)
                .build()));
        return result;
    }

    private int prune() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.entrySet().removeIf(entry -> !retentionPolicy.retains(CacheEntry.builder()
                .fingerprint(entry.getKey())
                .processedAt(entry.getValue())
                .build(), now));
        return before - entries.size();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class CacheDocument {
        private int version;
        private Map<String, Instant> entries = new LinkedHashMap<>();
    }
}
