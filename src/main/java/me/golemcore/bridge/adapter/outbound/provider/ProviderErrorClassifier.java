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

package me.golemcore.bridge.adapter.outbound.provider;

import me.golemcore.bridge.domain.model.FailureKind;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RetriableException;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Maps API client exceptions to failure kinds.
 *
 * <ul>
 * <li>authentication errors - {@link FailureKind#SESSION_NOT_READY}</li>
 * <li>rate limits, timeouts, server errors, I/O in the cause chain -
 * {@link FailureKind#TRANSPORT_FAILURE}</li>
 * <li>invalid requests, filtered content, unknown models -
 * {@link FailureKind#MALFORMED_INPUT}</li>
 * </ul>
 * Anything unrecognized is treated as a transport failure and retried.
 */
@Component
public class ProviderErrorClassifier {

    public FailureKind classify(Throwable error) {
        Throwable root = unwrap(error);
        if (root instanceof AuthenticationException) {
            return FailureKind.SESSION_NOT_READY;
        }
        if (root instanceof RetriableException) {
            return FailureKind.TRANSPORT_FAILURE;
        }
        if (root instanceof NonRetriableException) {
            return FailureKind.MALFORMED_INPUT;
        }
        if (root instanceof HttpException http) {
            return classifyStatus(http.statusCode());
        }
        // I/O errors and anything unrecognized
        return FailureKind.TRANSPORT_FAILURE;
    }

    static FailureKind classifyStatus(int status) {
        if (status == 401 || status == 403) {
            return FailureKind.SESSION_NOT_READY;
        }
        if (status == 408 || status == 429 || status >= 500) {
            return FailureKind.TRANSPORT_FAILURE;
        }
        if (status >= 400) {
            return FailureKind.MALFORMED_INPUT;
        }
        return FailureKind.TRANSPORT_FAILURE;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
