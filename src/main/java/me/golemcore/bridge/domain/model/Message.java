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

import me.golemcore.bridge.domain.service.MessageFingerprints;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;

/**
 * An inbound item read from a monitored conversation. Created by the message
 * source on each poll and discarded once dispatched; never mutated.
 */
@Value
@Builder
public class Message {

    String conversation;
    MessageKind kind;

    /**
     * Message text, or the source reference of the image for image messages.
     */
    String content;

    /** Text sent together with an image, if any. */
    String caption;

    /** Materialized image file for image messages. */
    Path imageRef;

    String sender;
    Instant arrivedAt;

    /**
     * Stable identity of this logical event, used for deduplication.
     */
    public String fingerprint() {
        return MessageFingerprints.of(conversation, kind, content, arrivedAt);
    }

    public boolean isImage() {
        return kind == MessageKind.IMAGE;
    }

    /**
     * Text the prompt template is filled with.
     */
    public String promptText() {
        if (isImage()) {
            return caption != null ? caption : "";
        }
        return content != null ? content : "";
    }
}
