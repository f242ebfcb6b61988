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
import lombok.Data;

import java.time.Instant;

/**
 * Liveness record of one provider channel, owned by the session registry.
 */
@Data
@Builder
public class ProviderSession {

    private String providerId;
    private TransportKind transport;

    @Builder.Default
    private SessionState state = SessionState.LOGGED_OUT;

    private Instant lastCheckedAt;

    public boolean isReady() {
        return state == SessionState.READY;
    }
}
