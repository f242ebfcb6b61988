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

package me.golemcore.bridge.port.outbound;

import me.golemcore.bridge.domain.model.ProviderRequest;
import me.golemcore.bridge.domain.model.ProviderResponse;
import me.golemcore.bridge.domain.model.SessionState;
import me.golemcore.bridge.domain.model.TransportKind;

/**
 * Uniform capability of one AI provider: submit a prompt, optionally with an
 * image, and return the extracted text under a timeout.
 */
public interface ProviderPort {

    /**
     * Returns the provider id from configuration (e.g., "chatgpt", "claude-api").
     */
    String getProviderId();

    TransportKind getTransport();

    /**
     * Prepares the provider channel (opens the page for UI providers). Default
     * implementation does nothing.
     */
    default void open() {
        // nothing to prepare
    }

    /**
     * Submits the request and waits for the response. Never blocks beyond the
     * request timeout plus one poll interval, and never throws: every failure is
     * returned as a classified {@link ProviderResponse}.
     */
    ProviderResponse ask(ProviderRequest request);

    /**
     * Transport-specific liveness probe. UI providers look for the authenticated
     * marker on their page; API providers check that a credential is present.
     */
    SessionState probeSession();
}
