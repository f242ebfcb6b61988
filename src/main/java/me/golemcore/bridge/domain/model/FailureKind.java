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

/**
 * Classification of a failed provider interaction. Drives whether the message
 * is retried on the next cycle or recorded as processed.
 */
public enum FailureKind {

    /**
     * The response never stabilized, or the request outlived its timeout.
     */
    EXTRACTION_TIMEOUT(true),

    /**
     * Network, rate limit or browser surface failure.
     */
    TRANSPORT_FAILURE(true),

    /**
     * The request itself is unusable (blank prompt, unreadable image, rejected
     * by the provider). Retrying would fail the same way.
     */
    MALFORMED_INPUT(false),

    /**
     * The provider rejected our credentials or lost its login mid-request.
     */
    SESSION_NOT_READY(true);

    private final boolean retriable;

    FailureKind(boolean retriable) {
        this.retriable = retriable;
    }

    public boolean isRetriable() {
        return retriable;
    }
}
