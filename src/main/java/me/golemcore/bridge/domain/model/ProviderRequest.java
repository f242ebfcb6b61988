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

import java.nio.file.Path;
import java.time.Duration;

/**
 * A routed prompt ready for a provider adapter.
 */
@Value
@Builder
public class ProviderRequest {

    String prompt;

    /** Image to attach; {@code null} for text requests. */
    Path imageRef;

    /** Model id for API providers; UI providers use whatever the page has. */
    String model;

    /** Hard bound on the whole interaction, enforced by the adapter. */
    Duration timeout;

    /** Initial wait after submission before the first response poll. */
    Duration responseWait;

    public boolean hasImage() {
        return imageRef != null;
    }
}
