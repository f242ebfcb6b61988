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
import me.golemcore.bridge.domain.model.ProviderDefinition;
import me.golemcore.bridge.domain.model.ProviderRequest;
import me.golemcore.bridge.domain.model.ProviderResponse;
import me.golemcore.bridge.domain.model.SessionState;
import me.golemcore.bridge.domain.model.TransportKind;
import me.golemcore.bridge.domain.service.PromptComposer;
import me.golemcore.bridge.domain.service.ResponseStabilizer;
import me.golemcore.bridge.domain.service.ResponseTextCleaner;
import me.golemcore.bridge.domain.service.Sleeper;
import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import me.golemcore.bridge.port.outbound.BrowserSurfacePort;
import me.golemcore.bridge.port.outbound.ProviderPort;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Provider reached by driving its chat page in the shared browser.
 *
 * <p>
 * A request counts the existing response blocks, uploads the image if any and
 * waits for the upload to settle, inserts the prompt in one input event and
 * submits it. It then waits the initial response delay and polls the last
 * response block until its text is the same on two consecutive polls. Only the
 * newest block is read, never the whole transcript.
 */
@Slf4j
public class UiProviderAdapter implements ProviderPort {

    private static final String ENTER = "Enter";
    private static final Duration MIN_READ_BOUND = Duration.ofMillis(1);

    private final ProviderDefinition definition;
    private final BrowserSurfacePort browser;
    private final ResponseStabilizer stabilizer;
    private final ResponseTextCleaner cleaner;
    private final Clock clock;
    private final Sleeper sleeper;
    private final BridgeProperties.TimingProperties timing;

    public UiProviderAdapter(ProviderDefinition definition, BrowserSurfacePort browser,
            ResponseStabilizer stabilizer, ResponseTextCleaner cleaner, Clock clock, Sleeper sleeper,
            BridgeProperties.TimingProperties timing) {
        this.definition = definition;
        this.browser = browser;
        this.stabilizer = stabilizer;
        this.cleaner = cleaner;
        this.clock = clock;
        this.sleeper = sleeper;
        this.timing = timing;
    }

    @Override
    public String getProviderId() {
        return definition.getId();
    }

    @Override
    public TransportKind getTransport() {
        return TransportKind.UI;
    }

    @Override
    public void open() {
        browser.open(definition.getId(), definition.getUrl());
    }

    @Override
    public SessionState probeSession() {
        if (!browser.isOpen(definition.getId())) {
            return SessionState.LOGGED_OUT;
        }
        return browser.isPresent(definition.getId(), definition.effectiveReadySelector())
                ? SessionState.READY
                : SessionState.AWAITING_LOGIN;
    }

    @Override
    public ProviderResponse ask(ProviderRequest request) {
        String id = definition.getId();
        if (request.hasImage() && isBlank(definition.getUploadSelector())) {
            return ProviderResponse.failure(FailureKind.MALFORMED_INPUT, "provider " + id + " does not accept images");
        }
        String prompt = PromptComposer.truncate(request.getPrompt(), definition.getMaxPromptChars());
        if (isBlank(prompt) && !request.hasImage()) {
            return ProviderResponse.failure(FailureKind.MALFORMED_INPUT, "empty prompt");
        }

        Instant deadline = clock.instant().plus(request.getTimeout());
        try {
            if (!browser.isOpen(id) || !browser.isPresent(id, definition.effectiveReadySelector())) {
                return ProviderResponse.failure(FailureKind.SESSION_NOT_READY, "page of " + id + " is not ready");
            }

            int baseline = browser.count(id, definition.getResponseSelector());

            if (request.hasImage()) {
                browser.upload(id, definition.getUploadSelector(), request.getImageRef());
                pause(timing.getUploadDelay(), deadline);
                if (!isBlank(definition.getImagePreviewSelector())
                        && !browser.isPresent(id, definition.getImagePreviewSelector())) {
                    return ProviderResponse.failure(FailureKind.TRANSPORT_FAILURE, "image preview did not appear");
                }
            }

            if (!isBlank(prompt)) {
                browser.insertText(id, definition.getInputSelector(), prompt);
            }
            submit(id);
            log.debug("[UiProvider] {}: prompt submitted ({} chars, image: {})", id,
                    prompt != null ? prompt.length() : 0, request.hasImage());

            pause(request.getResponseWait(), deadline);
            ResponseStabilizer.Outcome outcome = stabilizer.await(
                    () -> snapshot(id, deadline), baseline, deadline, timing.getPollInterval());

            if (!outcome.isStable()) {
                log.warn("[UiProvider] {}: response did not stabilize after {} polls", id, outcome.polls());
                return ProviderResponse.failure(FailureKind.EXTRACTION_TIMEOUT,
                        "no stable response within " + request.getTimeout().toSeconds() + "s");
            }

            String text = cleaner.clean(outcome.text());
            if (definition.isReloadAfterResponse()) {
                reload(id);
            }
            if (text.isEmpty()) {
                return ProviderResponse.failure(FailureKind.TRANSPORT_FAILURE, "response was empty after cleanup");
            }
            log.debug("[UiProvider] {}: response stable after {} polls", id, outcome.polls());
            return ProviderResponse.success(text);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProviderResponse.failure(FailureKind.TRANSPORT_FAILURE, "interrupted");
        } catch (RuntimeException e) { // NOSONAR - page errors become failures, never escape
            log.warn("[UiProvider] {}: page interaction failed: {}", id, e.getMessage());
            return ProviderResponse.failure(FailureKind.TRANSPORT_FAILURE, e.getMessage());
        }
    }

    private void submit(String id) {
        if (!isBlank(definition.getSubmitSelector())) {
            browser.click(id, definition.getSubmitSelector());
        } else {
            browser.press(id, definition.getInputSelector(), ENTER);
        }
    }

    private ResponseStabilizer.Snapshot snapshot(String id, Instant deadline) {
        try {
            String selector = definition.getResponseSelector();
            return new ResponseStabilizer.Snapshot(browser.count(id, selector),
                    browser.lastText(id, selector, readBound(deadline)));
        } catch (RuntimeException e) { // NOSONAR - a stale read counts as no response yet
            log.debug("[UiProvider] {}: response read failed: {}", id, e.getMessage());
            return null;
        }
    }

    /**
     * A read waits at most one poll interval and never past the deadline.
     */
    Duration readBound(Instant deadline) {
        Duration left = Duration.between(clock.instant(), deadline);
        Duration bound = left.compareTo(timing.getPollInterval()) < 0 ? left : timing.getPollInterval();
        return bound.compareTo(MIN_READ_BOUND) < 0 ? MIN_READ_BOUND : bound;
    }

    private void reload(String id) {
        try {
            browser.reload(id);
        } catch (RuntimeException e) {
            log.warn("[UiProvider] {}: reload after response failed: {}", id, e.getMessage());
        }
    }

    private void pause(Duration delay, Instant deadline) throws InterruptedException {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        Duration remaining = Duration.between(clock.instant(), deadline);
        if (remaining.isNegative() || remaining.isZero()) {
            return;
        }
        sleeper.sleep(delay.compareTo(remaining) < 0 ? delay : remaining);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
