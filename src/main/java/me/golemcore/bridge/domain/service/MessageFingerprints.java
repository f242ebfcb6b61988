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

import me.golemcore.bridge.domain.model.MessageKind;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Derives message fingerprints.
 *
 * <p>
 * A fingerprint is the SHA-256 of the conversation name, message kind,
 * normalized content and the arrival time truncated to the minute. Minute
 * granularity matches the timestamps chat surfaces display, so two polls of
 * the same message agree, while the same text sent again a few minutes later
 * is a new event.
 */
public final class MessageFingerprints {

    public static final ChronoUnit GRANULARITY = ChronoUnit.MINUTES;

    private static final char SEPARATOR = '\u001F';

    private MessageFingerprints() {
    }

    public static String of(String conversation, MessageKind kind, String content, Instant arrivedAt) {
        StringBuilder key = new StringBuilder();
        key.append(conversation != null ? conversation : "").append(SEPARATOR);
        key.append(kind != null ? kind.name() : MessageKind.TEXT.name()).append(SEPARATOR);
        key.append(normalize(content)).append(SEPARATOR);
        key.append(arrivedAt != null ? arrivedAt.truncatedTo(GRANULARITY).getEpochSecond() : 0L);
        return sha256(key.toString());
    }

    static String normalize(String content) {
        if (content == null) {
            return "";
        }
        return content.strip().toLowerCase(Locale.ROOT);
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
