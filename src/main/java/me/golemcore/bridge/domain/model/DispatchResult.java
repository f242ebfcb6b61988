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

/**
 * Per-message outcome of one dispatch attempt. Only logged, never persisted.
 */
@Value
@Builder
public class DispatchResult {

    DispatchStatus status;
    String conversation;
    String fingerprint;
    String responseText;
    FailureKind failureKind;
    String reason;

    /** The fingerprint was recorded as processed. */
    boolean cached;

    /** The message stays queued and is offered again next cycle. */
    boolean retryPending;

    public static DispatchResult delivered(Message message, String text, boolean cached) {
        return DispatchResult.builder()
                .status(DispatchStatus.DELIVERED)
                .conversation(message.getConversation())
                .fingerprint(message.fingerprint())
                .responseText(text)
                .cached(cached)
                .build();
    }

    /**
     * A message dropped without dispatch: duplicate or unmapped.
     */
    public static DispatchResult discarded(Message message, String reason) {
        return DispatchResult.builder()
                .status(DispatchStatus.SKIPPED)
                .conversation(message.getConversation())
                .fingerprint(message.fingerprint())
                .reason(reason)
                .build();
    }

    /**
     * A message held back for a later cycle without dispatch.
     */
    public static DispatchResult deferred(Message message, String reason) {
        return DispatchResult.builder()
                .status(DispatchStatus.SKIPPED)
                .conversation(message.getConversation())
                .fingerprint(message.fingerprint())
                .reason(reason)
                .retryPending(true)
                .build();
    }

    public static DispatchResult failed(Message message, FailureKind kind, String reason, boolean cached) {
        return DispatchResult.builder()
                .status(DispatchStatus.FAILED)
                .conversation(message.getConversation())
                .fingerprint(message.fingerprint())
                .failureKind(kind)
                .reason(reason)
                .cached(cached)
                .retryPending(!cached)
                .build();
    }

    public boolean isDelivered() {
        return status == DispatchStatus.DELIVERED;
    }
}
