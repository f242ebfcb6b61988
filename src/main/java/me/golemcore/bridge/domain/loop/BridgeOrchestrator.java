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

package me.golemcore.bridge.domain.loop;

import me.golemcore.bridge.domain.model.ConversationMapping;
import me.golemcore.bridge.domain.model.DispatchResult;
import me.golemcore.bridge.domain.model.FailureKind;
import me.golemcore.bridge.domain.model.Message;
import me.golemcore.bridge.domain.model.ProviderRequest;
import me.golemcore.bridge.domain.model.ProviderResponse;
import me.golemcore.bridge.domain.service.ChatRouter;
import me.golemcore.bridge.domain.service.MessageCacheService;
import me.golemcore.bridge.domain.service.SessionRegistry;
import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import me.golemcore.bridge.port.inbound.MessageSourcePort;
import me.golemcore.bridge.port.outbound.BrowserSurfacePort;
import me.golemcore.bridge.port.outbound.ImageStorePort;
import me.golemcore.bridge.port.outbound.ProviderCatalogPort;
import me.golemcore.bridge.port.outbound.ProviderPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * The bridge control loop.
 *
 * <p>
 * Each cycle walks the enabled conversations in configuration order. A
 * conversation whose provider session is not ready is skipped without polling.
 * Otherwise its new messages are appended to the conversation's pending queue
 * and the queue is drained in arrival order:
 *
 * <pre>
 * detected → deduped (skip | continue) → dispatched → awaiting response
 *          → extracted → delivered → cached
 * </pre>
 *
 * A message whose fingerprint is cached is dropped. A successful response is
 * replied first and cached second; a crash between the two may repeat a reply
 * after restart, but never loses one. Non-retriable failures are cached so
 * they are not retried. Transient failures and lost sessions leave the message
 * at the head of the queue, which stops the queue for this cycle so later
 * messages cannot overtake it. A message that fails transiently on
 * {@code max-redelivery-attempts} cycles is cached and abandoned.
 *
 * <p>
 * Shutdown is checked before each conversation and between messages, never
 * during a provider call. All methods must be called from the loop thread,
 * except {@link #requestShutdown()}.
 */
@Service
@Slf4j
public class BridgeOrchestrator {

    private final MessageSourcePort messageSource;
    private final ChatRouter chatRouter;
    private final SessionRegistry sessionRegistry;
    private final ProviderCatalogPort providerCatalog;
    private final MessageCacheService messageCache;
    private final ImageStorePort imageStore;
    private final BrowserSurfacePort browser;
    private final Clock clock;
    private final BridgeProperties properties;

    private final Map<String, Deque<Message>> pending = new HashMap<>();
    private final Map<String, Integer> transientFailures = new HashMap<>();
    private final CountDownLatch shutdownSignal = new CountDownLatch(1);
    private volatile boolean shutdownRequested;
    private long cycles;

    @SuppressWarnings("java:S107")
    public BridgeOrchestrator(MessageSourcePort messageSource, ChatRouter chatRouter,
            SessionRegistry sessionRegistry, ProviderCatalogPort providerCatalog, MessageCacheService messageCache,
            ImageStorePort imageStore, BrowserSurfacePort browser, Clock clock, BridgeProperties properties) {
        this.messageSource = messageSource;
        this.chatRouter = chatRouter;
        this.sessionRegistry = sessionRegistry;
        this.providerCatalog = providerCatalog;
        this.messageCache = messageCache;
        this.imageStore = imageStore;
        this.browser = browser;
        this.clock = clock;
        this.properties = properties;
    }

    /**
     * Loads the cache, opens the messaging surface and every provider channel,
     * waits for manual logins, then probes all sessions.
     */
    public void start() throws InterruptedException {
        messageCache.load();
        messageSource.start();
        for (ProviderPort provider : providerCatalog.all()) {
            provider.open();
        }

        Duration loginWait = properties.getTiming().getLoginWait();
        if (loginWait != null && !loginWait.isZero() && !loginWait.isNegative()) {
            log.info("[Bridge] Waiting {}s for manual logins", loginWait.toSeconds());
            awaitShutdown(loginWait);
        }

        sessionRegistry.refreshAll();
        log.info("[Bridge] Started: {} conversations, {} cached fingerprints", chatRouter.conversations().size(),
                messageCache.size());
    }

    /**
     * Runs one pass over all conversations and returns every dispatch outcome.
     */
    public List<DispatchResult> runCycle() {
        cycles++;
        List<DispatchResult> results = new ArrayList<>();

        if (!messageSource.isReady()) {
            log.warn("[Bridge] Messaging surface not ready, skipping cycle {}", cycles);
        } else {
            for (ConversationMapping mapping : chatRouter.conversations()) {
                if (shutdownRequested) {
                    break;
                }
                try {
                    results.addAll(serviceConversation(mapping));
                } catch (RuntimeException e) { // NOSONAR - one conversation must not stop the loop
                    log.error("[Bridge] Cycle failed for {}: {}", mapping.getName(), e.getMessage(), e);
                }
            }
        }

        cleanupTempImages();
        return results;
    }

    /**
     * Decides and carries out one message's dispatch.
     */
    DispatchResult process(ConversationMapping mapping, Message message) {
        String fingerprint = message.fingerprint();
        if (messageCache.seen(fingerprint)) {
            return DispatchResult.discarded(message, "duplicate");
        }

        String providerId = mapping.getProviderId();
        if (!sessionRegistry.ready(providerId)) {
            return DispatchResult.deferred(message, "session of " + providerId + " not ready");
        }
        ProviderPort provider = providerCatalog.find(providerId).orElse(null);
        if (provider == null) {
            return DispatchResult.deferred(message, "provider " + providerId + " unavailable");
        }

        ProviderRequest request;
        try {
            request = chatRouter.route(mapping, message);
        } catch (ChatRouter.UnroutableMessageException e) {
            return DispatchResult.failed(message, FailureKind.MALFORMED_INPUT, e.getMessage(), markCached(fingerprint));
        }

        ProviderResponse response = provider.ask(request);
        if (response.isSuccess()) {
            if (!messageSource.reply(message.getConversation(), response.getText())) {
                return transientFailure(message, FailureKind.TRANSPORT_FAILURE, "reply could not be posted");
            }
            transientFailures.remove(fingerprint);
            return DispatchResult.delivered(message, response.getText(), markCached(fingerprint));
        }

        FailureKind kind = response.getFailureKind() != null ? response.getFailureKind()
                : FailureKind.TRANSPORT_FAILURE;
        if (kind == FailureKind.SESSION_NOT_READY) {
            sessionRegistry.markExpired(providerId, response.getReason());
            return DispatchResult.deferred(message, "session of " + providerId + " lost: " + response.getReason());
        }
        if (!kind.isRetriable()) {
            transientFailures.remove(fingerprint);
            return DispatchResult.failed(message, kind, response.getReason(), markCached(fingerprint));
        }
        return transientFailure(message, kind, response.getReason());
    }

    public void requestShutdown() {
        if (!shutdownRequested) {
            shutdownRequested = true;
            shutdownSignal.countDown();
            log.info("[Bridge] Shutdown requested");
        }
    }

    public boolean isShutdownRequested() {
        return shutdownRequested;
    }

    /**
     * Sleeps the loop interval, returning early when shutdown is requested.
     */
    public void awaitNextCycle() throws InterruptedException {
        awaitShutdown(properties.getTiming().getLoopInterval());
    }

    /**
     * Closes the browser. Called once from the loop thread after the last cycle.
     */
    public void close() {
        browser.close();
        log.info("[Bridge] Stopped after {} cycles", cycles);
    }

    /**
     * Number of messages waiting in the conversation's queue.
     */
    public int pendingCount(String conversation) {
        Deque<Message> queue = pending.get(conversation);
        return queue != null ? queue.size() : 0;
    }

    private List<DispatchResult> serviceConversation(ConversationMapping mapping) {
        String name = mapping.getName();
        if (!sessionRegistry.ready(mapping.getProviderId())) {
            log.debug("[Bridge] Skipping {}: session of {} not ready", name, mapping.getProviderId());
            return List.of();
        }

        Deque<Message> queue = pending.computeIfAbsent(name, key -> new ArrayDeque<>());
        for (Message message : messageSource.pollNew(name)) {
            enqueue(queue, message);
        }

        List<DispatchResult> results = new ArrayList<>();
        while (!queue.isEmpty() && !shutdownRequested) {
            DispatchResult result = process(mapping, queue.peekFirst());
            logResult(result);
            results.add(result);
            if (result.isRetryPending()) {
                break;
            }
            queue.pollFirst();
        }
        return results;
    }

    private void enqueue(Deque<Message> queue, Message message) {
        String fingerprint = message.fingerprint();
        boolean queued = queue.stream().anyMatch(existing -> existing.fingerprint().equals(fingerprint));
        if (queued) {
            return;
        }
        int limit = properties.getDispatch().getMaxPendingPerConversation();
        if (limit > 0 && queue.size() >= limit) {
            log.warn("[Bridge] Pending queue of {} full ({} messages), dropping message {}",
                    message.getConversation(), queue.size(), fingerprint);
            return;
        }
        queue.addLast(message);
    }

    private DispatchResult transientFailure(Message message, FailureKind kind, String reason) {
        String fingerprint = message.fingerprint();
        int attempts = transientFailures.merge(fingerprint, 1, Integer::sum);
        int ceiling = properties.getDispatch().getMaxRedeliveryAttempts();
        if (ceiling > 0 && attempts >= ceiling) {
            transientFailures.remove(fingerprint);
            log.error("[Bridge] Abandoning message {} in {} after {} failed attempts: {}", fingerprint,
                    message.getConversation(), attempts, reason);
            return DispatchResult.failed(message, kind, "abandoned after " + attempts + " attempts: " + reason,
                    markCached(fingerprint));
        }
        return DispatchResult.failed(message, kind, reason, false);
    }

    private boolean markCached(String fingerprint) {
        try {
            messageCache.mark(fingerprint, clock.instant());
            return true;
        } catch (IllegalStateException e) {
            log.error("[Bridge] Could not persist fingerprint {}: {}", fingerprint, e.getMessage(), e);
            return false;
        }
    }

    private void logResult(DispatchResult result) {
        switch (result.getStatus()) {
        case DELIVERED -> log.info("[Bridge] Delivered reply in {} ({} chars)", result.getConversation(),
                result.getResponseText() != null ? result.getResponseText().length() : 0);
        case SKIPPED -> log.debug("[Bridge] Skipped message in {}: {}", result.getConversation(), result.getReason());
        case FAILED -> log.warn("[Bridge] Failed message in {} ({}{}): {}", result.getConversation(),
                result.getFailureKind(), result.isCached() ? ", cached" : ", will retry", result.getReason());
        }
    }

    private void cleanupTempImages() {
        int every = properties.getTiming().getTempCleanupEveryCycles();
        if (every <= 0 || cycles % every != 0) {
            return;
        }
        try {
            imageStore.cleanup(properties.getImages().getMaxAge());
        } catch (RuntimeException e) {
            log.warn("[Bridge] Temp image cleanup failed: {}", e.getMessage());
        }
    }

    private void awaitShutdown(Duration timeout) throws InterruptedException {
        if (shutdownSignal.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            log.debug("[Bridge] Wait interrupted by shutdown");
        }
    }
}
