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

package me.golemcore.bridge.runner;

import me.golemcore.bridge.domain.loop.BridgeOrchestrator;
import me.golemcore.bridge.domain.service.ProcessExitService;
import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs the bridge loop on its own thread once the application is ready.
 *
 * <p>
 * The loop thread owns the browser: it starts the orchestrator, runs every
 * cycle and closes the browser on exit. A failed start terminates the process
 * with a non-zero status. On context shutdown the loop is asked to stop and
 * given the maximum response wait to finish its in-flight provider call.
 */
@Component
@Slf4j
public class BridgeLoopRunner {

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);

    private final BridgeOrchestrator orchestrator;
    private final ProcessExitService exitService;
    private final BridgeProperties properties;

    private ExecutorService loopExecutor;
    private volatile boolean startupFailed;

    public BridgeLoopRunner(BridgeOrchestrator orchestrator, ProcessExitService exitService,
            BridgeProperties properties) {
        this.orchestrator = orchestrator;
        this.exitService = exitService;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        loopExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "bridge-loop");
            t.setDaemon(false);
            return t;
        });
        loopExecutor.submit(this::runLoop);
        log.info("[Bridge] Loop thread started");
    }

    void runLoop() {
        try {
            orchestrator.start();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            orchestrator.close();
            return;
        } catch (RuntimeException e) { // NOSONAR - any startup failure is fatal
            orchestrator.close();
            startupFailed = true;
            exitService.exitAfterStartupFailure(e);
            return;
        }

        try {
            while (!orchestrator.isShutdownRequested()) {
                orchestrator.runCycle();
                orchestrator.awaitNextCycle();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("[Bridge] Loop interrupted");
        } catch (RuntimeException e) { // NOSONAR - last-resort guard, cycles catch their own failures
            log.error("[Bridge] Loop terminated unexpectedly: {}", e.getMessage(), e);
        } finally {
            orchestrator.close();
        }
    }

    @PreDestroy
    public void shutdown() {
        orchestrator.requestShutdown();
        if (loopExecutor == null || startupFailed) {
            // The loop thread is the one exiting the process
            return;
        }
        loopExecutor.shutdown();
        Duration grace = properties.getTiming().getMaxResponseWait().plus(SHUTDOWN_GRACE);
        try {
            if (!loopExecutor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[Bridge] Loop did not stop within {}s, interrupting", grace.toSeconds());
                loopExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            loopExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Bridge] Shut down");
    }
}
