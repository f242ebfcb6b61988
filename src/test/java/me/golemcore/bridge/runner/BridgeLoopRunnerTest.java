package me.golemcore.bridge.runner;

import me.golemcore.bridge.domain.loop.BridgeOrchestrator;
import me.golemcore.bridge.domain.service.ProcessExitService;
import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class BridgeLoopRunnerTest {

    private BridgeOrchestrator orchestrator;
    private ProcessExitService exitService;
    private BridgeLoopRunner runner;

    @BeforeEach
    void setUp() {
        orchestrator = mock(BridgeOrchestrator.class);
        exitService = mock(ProcessExitService.class);
        BridgeProperties properties = new BridgeProperties();
        properties.getTiming().setMaxResponseWait(Duration.ofSeconds(2));
        runner = new BridgeLoopRunner(orchestrator, exitService, properties);
    }

    @Test
    void shouldRunCyclesUntilShutdownRequested() throws InterruptedException {
        when(orchestrator.isShutdownRequested()).thenReturn(false, false, true);

        runner.runLoop();

        InOrder order = inOrder(orchestrator);
        order.verify(orchestrator).start();
        order.verify(orchestrator, times(2)).runCycle();
        order.verify(orchestrator).close();
        verifyNoInteractions(exitService);
    }

    @Test
    void shouldExitWhenStartFails() throws InterruptedException {
        IllegalStateException failure = new IllegalStateException("browser launch failed");
        doThrow(failure).when(orchestrator).start();

        runner.runLoop();

        verify(orchestrator).close();
        verify(exitService).exitAfterStartupFailure(failure);
        verify(orchestrator, never()).runCycle();
    }

    @Test
    void shouldCloseWithoutExitWhenInterruptedDuringStart() throws InterruptedException {
        doThrow(new InterruptedException()).when(orchestrator).start();

        runner.runLoop();

        verify(orchestrator).close();
        verifyNoInteractions(exitService);
        assertTrue(Thread.interrupted());
    }

    @Test
    void shouldCloseBrowserWhenLoopFails() {
        when(orchestrator.isShutdownRequested()).thenReturn(false);
        when(orchestrator.runCycle()).thenThrow(new IllegalStateException("boom"));

        runner.runLoop();

        verify(orchestrator).close();
    }

    @Test
    void shouldRequestShutdownEvenIfLoopNeverStarted() {
        runner.shutdown();

        verify(orchestrator).requestShutdown();
    }

    @Test
    void shouldStopLoopThreadOnShutdown() throws InterruptedException {
        AtomicBoolean stop = new AtomicBoolean();
        CountDownLatch cycling = new CountDownLatch(1);
        when(orchestrator.isShutdownRequested()).thenAnswer(invocation -> stop.get());
        doAnswer(invocation -> {
            stop.set(true);
            return null;
        }).when(orchestrator).requestShutdown();
        doAnswer(invocation -> {
            cycling.countDown();
            Thread.sleep(10);
            return null;
        }).when(orchestrator).awaitNextCycle();

        runner.onApplicationReady();
        assertTrue(cycling.await(5, TimeUnit.SECONDS));
        runner.shutdown();

        verify(orchestrator, timeout(5000)).close();
        verify(orchestrator, atLeastOnce()).runCycle();
    }
}
