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

import me.golemcore.bridge.domain.model.ProviderSession;
import me.golemcore.bridge.domain.model.SessionState;
import me.golemcore.bridge.domain.model.TransportKind;
import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import me.golemcore.bridge.port.outbound.ProviderCatalogPort;
import me.golemcore.bridge.port.outbound.ProviderPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Liveness state of every provider channel, keyed by provider id.
 *
 * <p>
 * Probes are transport specific and delegated to the provider. A channel that
 * was {@code READY} and fails its probe becomes {@code EXPIRED}; one that never
 * passed stays {@code AWAITING_LOGIN}. An API channel marked expired after an
 * authentication failure keeps that state: its credential will not start
 * working without a restart. {@link #ready} re-probes a channel that is not
 * ready, or whose last probe is older than the probe interval.
 */
@Service
@Slf4j
public class SessionRegistry {

    private final ProviderCatalogPort providerCatalog;
    private final Clock clock;
    private final Duration probeInterval;

    private final Map<String, ProviderSession> sessions = new ConcurrentHashMap<>();

    public SessionRegistry(ProviderCatalogPort providerCatalog, Clock clock, BridgeProperties properties) {
        this.providerCatalog = providerCatalog;
        this.clock = clock;
        this.probeInterval = properties.getTiming().getSessionProbeInterval();
    }

    /**
     * Returns whether the provider can take a request now, probing it first when
     * its state is stale or not ready.
     */
    public boolean ready(String providerId) {
        ProviderSession session = sessions.get(providerId);
        if (session == null || !session.isReady() || isStale(session)) {
            session = refresh(providerId);
        }
        return session.isReady();
    }

    /**
     * Runs the provider's liveness probe and records the resulting state.
     */
    public ProviderSession refresh(String providerId) {
        Optional<ProviderPort> provider = providerCatalog.find(providerId);
        Instant now = clock.instant();
        if (provider.isEmpty()) {
            return sessions.compute(providerId, (id, existing) -> ProviderSession.builder()
                    .providerId(id)
                    .state(SessionState.LOGGED_OUT)
                    .lastCheckedAt(now)
                    .build());
        }

        ProviderPort port = provider.get();
        ProviderSession session = sessions.computeIfAbsent(providerId, id -> ProviderSession.builder()
                .providerId(id)
                .transport(port.getTransport())
                .build());

        SessionState previous = session.getState();
        SessionState next;
        if (previous == SessionState.EXPIRED && port.getTransport() == TransportKind.API) {
            next = SessionState.EXPIRED;
        } else {
            next = transition(previous, probe(port));
        }

        session.setState(next);
        session.setLastCheckedAt(now);
        if (previous != next) {
            log.info("[Session] {}: {} -> {}", providerId, previous, next);
        }
        return session;
    }

    public void refreshAll() {
        providerCatalog.all().forEach(provider -> refresh(provider.getProviderId()));
    }

    /**
     * Records that the provider rejected a request for lost authentication.
     */
    public void markExpired(String providerId, String reason) {
        ProviderSession session = sessions.computeIfAbsent(providerId, id -> ProviderSession.builder()
                .providerId(id)
                .transport(providerCatalog.find(id).map(ProviderPort::getTransport).orElse(null))
                .build());
        if (session.getState() != SessionState.EXPIRED) {
            log.warn("[Session] {} expired: {}", providerId, reason);
        }
        session.setState(SessionState.EXPIRED);
        session.setLastCheckedAt(clock.instant());
    }

    public Optional<ProviderSession> get(String providerId) {
        return Optional.ofNullable(sessions.get(providerId));
    }

    private SessionState probe(ProviderPort provider) {
        try {
            SessionState state = provider.probeSession();
            return state != null ? state : SessionState.AWAITING_LOGIN;
        } catch (RuntimeException e) { // NOSONAR - a broken probe means not ready
            log.debug("[Session] Probe of {} failed: {}", provider.getProviderId(), e.getMessage());
            return SessionState.AWAITING_LOGIN;
        }
    }

    private static SessionState transition(SessionState previous, SessionState probed) {
        if (probed == SessionState.READY || probed == SessionState.LOGGED_OUT) {
            return probed;
        }
        if (previous == SessionState.READY || previous == SessionState.EXPIRED) {
            return SessionState.EXPIRED;
        }
        return probed;
    }

    private boolean isStale(ProviderSession session) {
        Instant checked = session.getLastCheckedAt();
        return checked == null || !clock.instant().isBefore(checked.plus(probeInterval));
    }
}
