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

package me.golemcore.bridge.adapter.outbound.storage;

import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import me.golemcore.bridge.port.outbound.ImageStorePort;
import me.golemcore.bridge.port.outbound.StoragePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Temp image store on top of {@link StoragePort}. Images pulled from the
 * messaging surface land in the images directory until the periodic cleanup
 * removes them.
 */
@Component
@Slf4j
public class TempImageStore implements ImageStorePort {

    private static final String DATA_PREFIX = "data:";
    private static final String BASE64_MARKER = ";base64,";
    private static final Map<String, String> EXTENSIONS = Map.of(
            "image/jpeg", "jpg",
            "image/jpg", "jpg",
            "image/png", "png",
            "image/webp", "webp",
            "image/gif", "gif");

    private final StoragePort storagePort;
    private final Clock clock;
    private final String directory;
    private final AtomicLong sequence = new AtomicLong();

    public TempImageStore(StoragePort storagePort, Clock clock, BridgeProperties properties) {
        this.storagePort = storagePort;
        this.clock = clock;
        this.directory = properties.getImages().getDirectory();
    }

    @Override
    public Path saveDataUrl(String dataUrl, String prefix) {
        if (dataUrl == null || !dataUrl.startsWith(DATA_PREFIX)) {
            throw new IllegalArgumentException("Not a data URL");
        }
        int marker = dataUrl.indexOf(BASE64_MARKER);
        if (marker < 0) {
            throw new IllegalArgumentException("Data URL is not base64 encoded");
        }
        String mimeType = dataUrl.substring(DATA_PREFIX.length(), marker).toLowerCase(Locale.ROOT);
        byte[] bytes = Base64.getDecoder().decode(dataUrl.substring(marker + BASE64_MARKER.length()));
        if (bytes.length == 0) {
            throw new IllegalArgumentException("Data URL is empty");
        }

        String name = sanitize(prefix) + "-" + clock.millis() + "-" + sequence.incrementAndGet() + "."
                + EXTENSIONS.getOrDefault(mimeType, "jpg");
        storagePort.putObject(directory, name, bytes).join();
        log.debug("[Images] Saved {} ({} bytes)", name, bytes.length);
        return storagePort.resolve(directory, name);
    }

    @Override
    public int cleanup(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        List<String> files = storagePort.listObjects(directory, "").join();
        int removed = 0;
        for (String file : files) {
            Instant modified = storagePort.lastModified(directory, file).join();
            if (modified != null && modified.isBefore(cutoff)) {
                storagePort.deleteObject(directory, file).join();
                removed++;
            }
        }
        if (removed > 0) {
            log.info("[Images] Removed {} temp images older than {}", removed, maxAge);
        }
        return removed;
    }

    private static String sanitize(String prefix) {
        String value = prefix != null ? prefix.replaceAll("[^A-Za-z0-9_-]", "_") : "";
        return value.isEmpty() ? "image" : value;
    }
}
