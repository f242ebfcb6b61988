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

import java.time.Duration;
import java.time.Instant;

/**
 * Decides which processed-message entries the cache keeps.
 */
@FunctionalInterface
public interface CacheRetentionPolicy {

    boolean retains(CacheEntry entry, Instant now);

    /** Keeps every entry forever. */
    static CacheRetentionPolicy unbounded() {
        return (entry, now) -> true;
    }

    /** Keeps entries processed within the window before {@code now}. */
    static CacheRetentionPolicy window(Duration window) {
        return (entry, now) -> entry.getProcessedAt() == null
                || !entry.getProcessedAt().isBefore(now.minus(window));
    }
}
