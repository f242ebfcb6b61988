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
 * Outcome of a provider interaction: the extracted text, or a classified
 * failure.
 */
@Value
@Builder
public class ProviderResponse {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    boolean success;
    String text;
    FailureKind failureKind;
    String reason;

    public static ProviderResponse success(String text) {
        return ProviderResponse.builder()
                .success(true)
                .text(text)
                .build();
    }

    public static ProviderResponse failure(FailureKind kind, String reason) {
        return ProviderResponse.builder()
                .success(false)
                .failureKind(kind)
                .reason(reason)
                .build();
    }
}
