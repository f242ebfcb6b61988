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

import me.golemcore.bridge.adapter.outbound.image.ImageCompressor;
import me.golemcore.bridge.domain.model.FailureKind;
import me.golemcore.bridge.domain.model.ProviderDefinition;
import me.golemcore.bridge.domain.model.ProviderRequest;
import me.golemcore.bridge.domain.model.ProviderResponse;
import me.golemcore.bridge.domain.model.SessionState;
import me.golemcore.bridge.domain.model.TransportKind;
import me.golemcore.bridge.domain.service.PromptComposer;
import me.golemcore.bridge.domain.service.ResponseTextCleaner;
import me.golemcore.bridge.domain.service.Sleeper;
import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import me.golemcore.bridge.port.outbound.ProviderPort;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.Content;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Provider reached through a network chat API.
 *
 * <p>
 * Each attempt runs on the call executor and is awaited for the time left
 * before the request deadline, so the adapter itself enforces the timeout.
 * Transient failures (rate limits, server errors, I/O) are retried with
 * exponential backoff up to the configured attempt ceiling; the backoff never
 * sleeps past the deadline. Authentication and invalid-request failures are
 * returned at once.
 */
@Slf4j
public class ApiProviderAdapter implements ProviderPort {

    private final ProviderDefinition definition;
    private final ApiPlatform platform;
    private final BridgeProperties.PlatformProperties settings;
    private final BridgeProperties.RetryProperties retry;
    private final ChatModelFactory chatModelFactory;
    private final ProviderErrorClassifier errorClassifier;
    private final ImageCompressor imageCompressor;
    private final ResponseTextCleaner cleaner;
    private final ExecutorService callExecutor;
    private final Clock clock;
    private final Sleeper sleeper;

    // Clients carry their HTTP timeout, so one is kept per model and timeout.
    private final Map<ModelKey, ChatModel> models = new ConcurrentHashMap<>();

    @SuppressWarnings("java:S107")
    public ApiProviderAdapter(ProviderDefinition definition, ApiPlatform platform,
            BridgeProperties.PlatformProperties settings, BridgeProperties.RetryProperties retry,
            ChatModelFactory chatModelFactory, ProviderErrorClassifier errorClassifier,
            ImageCompressor imageCompressor, ResponseTextCleaner cleaner, ExecutorService callExecutor,
            Clock clock, Sleeper sleeper) {
        this.definition = definition;
        this.platform = platform;
        this.settings = settings;
        this.retry = retry;
        this.chatModelFactory = chatModelFactory;
        this.errorClassifier = errorClassifier;
        this.imageCompressor = imageCompressor;
        this.cleaner = cleaner;
        this.callExecutor = callExecutor;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    @Override
    public String getProviderId() {
        return definition.getId();
    }

    @Override
    public TransportKind getTransport() {
        return TransportKind.API;
    }

    @Override
    public SessionState probeSession() {
        return hasCredential() ? SessionState.READY : SessionState.LOGGED_OUT;
    }

    @Override
    public ProviderResponse ask(ProviderRequest request) {
        String id = definition.getId();
        if (!hasCredential()) {
            return ProviderResponse.failure(FailureKind.SESSION_NOT_READY, "no API key for " + platform.getId());
        }
        if (request.getModel() == null || request.getModel().isBlank()) {
            return ProviderResponse.failure(FailureKind.MALFORMED_INPUT, "no model configured");
        }
        String prompt = PromptComposer.truncate(request.getPrompt(), settings.getMaxPromptChars());
        if ((prompt == null || prompt.isBlank()) && !request.hasImage()) {
            return ProviderResponse.failure(FailureKind.MALFORMED_INPUT, "empty prompt");
        }

        ChatRequest chatRequest;
        try {
            chatRequest = ChatRequest.builder().messages(buildMessage(prompt, request)).build();
        } catch (IOException e) {
            return ProviderResponse.failure(FailureKind.MALFORMED_INPUT, "unreadable image: " + e.getMessage());
        }

        Instant deadline = clock.instant().plus(request.getTimeout());
        int maxAttempts = Math.max(1, retry.getMaxAttempts());
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                return timedOut(request);
            }

            ChatModel model;
            try {
                model = models.computeIfAbsent(new ModelKey(request.getModel(), request.getTimeout()),
                        key -> chatModelFactory.create(platform, settings, key.model(), key.timeout()));
            } catch (RuntimeException e) {
                return ProviderResponse.failure(FailureKind.MALFORMED_INPUT, "cannot create model: " + e.getMessage());
            }

            Future<ChatResponse> call = callExecutor.submit(() -> model.chat(chatRequest));
            try {
                ChatResponse response = call.get(remaining.toMillis(), TimeUnit.MILLISECONDS);
                return toResponse(response);
            } catch (TimeoutException e) {
                call.cancel(true);
                return timedOut(request);
            } catch (InterruptedException e) {
                call.cancel(true);
                Thread.currentThread().interrupt();
                return ProviderResponse.failure(FailureKind.TRANSPORT_FAILURE, "interrupted");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                FailureKind kind = errorClassifier.classify(cause);
                if (kind != FailureKind.TRANSPORT_FAILURE) {
                    log.warn("[ApiProvider] {}: request rejected ({}): {}", id, kind, cause.getMessage());
                    return ProviderResponse.failure(kind, cause.getMessage());
                }
                if (attempt == maxAttempts) {
                    log.warn("[ApiProvider] {}: giving up after {} attempts: {}", id, attempt, cause.getMessage());
                    return ProviderResponse.failure(FailureKind.TRANSPORT_FAILURE,
                            "failed after " + attempt + " attempts: " + cause.getMessage());
                }
                Duration backoff = backoff(attempt, Duration.between(clock.instant(), deadline));
                log.warn("[ApiProvider] {}: transient failure (attempt {}/{}), retrying in {}ms: {}",
                        id, attempt, maxAttempts, backoff.toMillis(), cause.getMessage());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return ProviderResponse.failure(FailureKind.TRANSPORT_FAILURE, "interrupted");
                }
            }
        }
        return ProviderResponse.failure(FailureKind.TRANSPORT_FAILURE, "retries exhausted");
    }

    /**
     * Backoff before the attempt after {@code attempt}: initial x multiplier^(attempt-1),
     * capped by the maximum backoff and the time left.
     */
    Duration backoff(int attempt, Duration remaining) {
        double millis = retry.getInitialBackoff().toMillis() * Math.pow(retry.getBackoffMultiplier(), attempt - 1.0);
        long capped = (long) Math.min(millis, retry.getMaxBackoff().toMillis());
        if (remaining != null && !remaining.isNegative()) {
            capped = Math.min(capped, remaining.toMillis());
        }
        return Duration.ofMillis(Math.max(0, capped));
    }

    private UserMessage buildMessage(String prompt, ProviderRequest request) throws IOException {
        List<Content> contents = new ArrayList<>();
        if (prompt != null && !prompt.isBlank()) {
            contents.add(TextContent.from(prompt));
        }
        if (request.hasImage()) {
            ImageCompressor.EncodedImage image = imageCompressor.compress(request.getImageRef(),
                    settings.getMaxImageKb());
            contents.add(ImageContent.from(Base64.getEncoder().encodeToString(image.data()), image.mimeType()));
        }
        return UserMessage.from(contents);
    }

    private ProviderResponse toResponse(ChatResponse response) {
        AiMessage message = response != null ? response.aiMessage() : null;
        String text = message != null ? cleaner.clean(message.text()) : "";
        if (text.isEmpty()) {
            return ProviderResponse.failure(FailureKind.TRANSPORT_FAILURE, "empty completion");
        }
        return ProviderResponse.success(text);
    }

    private ProviderResponse timedOut(ProviderRequest request) {
        log.warn("[ApiProvider] {}: no response within {}s", definition.getId(), request.getTimeout().toSeconds());
        return ProviderResponse.failure(FailureKind.EXTRACTION_TIMEOUT,
                "no response within " + request.getTimeout().toSeconds() + "s");
    }

    private boolean hasCredential() {
        return settings.getApiKey() != null && !settings.getApiKey().isBlank();
    }

    private record ModelKey(String model, Duration timeout) {
    }
}
