package me.golemcore.bridge.domain.service;

import me.golemcore.bridge.domain.service.ResponseStabilizer.Outcome;
import me.golemcore.bridge.domain.service.ResponseStabilizer.Snapshot;
import me.golemcore.bridge.domain.service.ResponseStabilizer.State;
import me.golemcore.bridge.testsupport.ClockAdvancingSleeper;
import me.golemcore.bridge.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class ResponseStabilizerTest {

    private static final Instant START = Instant.parse("2026-10-18T10:00:00Z");
    private static final Duration POLL = Duration.ofSeconds(2);

    private MutableClock clock;
    private ClockAdvancingSleeper sleeper;
    private ResponseStabilizer stabilizer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        sleeper = new ClockAdvancingSleeper(clock);
        stabilizer = new ResponseStabilizer(clock, sleeper);
    }

    @Test
    void becomesStableWhenTextRepeatsOnConsecutivePolls() throws InterruptedException {
        Supplier<Snapshot> source = sequence(
                new Snapshot(1, "Hi"),
                new Snapshot(1, "Hi there"),
                new Snapshot(1, "Hi there"));

        Outcome outcome = stabilizer.await(source, 0, START.plusSeconds(30), POLL);

        assertEquals(State.STABLE, outcome.state());
        assertEquals("Hi there", outcome.text());
        assertEquals(3, outcome.polls());
    }

    @Test
    void ignoresBlocksThatExistedBeforeSubmission() throws InterruptedException {
        Supplier<Snapshot> source = sequence(
                new Snapshot(2, "previous answer"),
                new Snapshot(2, "previous answer"),
                new Snapshot(3, "new answer"),
                new Snapshot(3, "new answer"));

        Outcome outcome = stabilizer.await(source, 2, START.plusSeconds(30), POLL);

        assertTrue(outcome.isStable());
        assertEquals("new answer", outcome.text());
        assertEquals(4, outcome.polls());
    }

    @Test
    void blankTextIsNotACandidate() throws InterruptedException {
        Supplier<Snapshot> source = sequence(
                new Snapshot(1, ""),
                new Snapshot(1, "   "),
                new Snapshot(1, "done"),
                new Snapshot(1, "done "));

        Outcome outcome = stabilizer.await(source, 0, START.plusSeconds(30), POLL);

        assertTrue(outcome.isStable());
        assertEquals("done", outcome.text());
    }

    @Test
    void failedReadResetsCandidate() throws InterruptedException {
        Supplier<Snapshot> source = sequence(
                new Snapshot(1, "partial"),
                null,
                new Snapshot(1, "partial"),
                new Snapshot(1, "partial"));

        Outcome outcome = stabilizer.await(source, 0, START.plusSeconds(30), POLL);

        assertTrue(outcome.isStable());
        assertEquals(4, outcome.polls());
    }

    @Test
    void timesOutNoLaterThanDeadlinePlusOnePollInterval() throws InterruptedException {
        Instant deadline = START.plusSeconds(9);
        int[] counter = { 0 };
        Supplier<Snapshot> changing = () -> new Snapshot(1, "token " + counter[0]++);

        Outcome outcome = stabilizer.await(changing, 0, deadline, POLL);

        assertEquals(State.TIMED_OUT, outcome.state());
        assertFalse(clock.instant().isAfter(deadline.plus(POLL)));
        assertFalse(clock.instant().isBefore(deadline));
    }

    @Test
    void timesOutWithoutReadingWhenDeadlineAlreadyPassed() throws InterruptedException {
        Outcome outcome = stabilizer.await(() -> fail("must not read"), 0, START, POLL);

        assertEquals(State.TIMED_OUT, outcome.state());
        assertEquals(0, outcome.polls());
        assertTrue(sleeper.getSleeps().isEmpty());
    }

    @Test
    void sleepsOnePollIntervalBetweenReads() throws InterruptedException {
        Supplier<Snapshot> source = sequence(new Snapshot(1, "a"), new Snapshot(1, "a"));

        stabilizer.await(source, 0, START.plusSeconds(30), POLL);

        assertEquals(List.of(POLL), sleeper.getSleeps());
    }

    private static Supplier<Snapshot> sequence(Snapshot... snapshots) {
        Deque<Snapshot> queue = new ArrayDeque<>();
        Snapshot last = null;
        for (Snapshot snapshot : snapshots) {
            queue.add(snapshot != null ? snapshot : new Snapshot(-1, null));
            last = snapshot;
        }
        Snapshot fallback = last;
        return () -> {
            Snapshot next = queue.isEmpty() ? fallback : queue.poll();
            return next != null && next.blocks() < 0 ? null : next;
        };
    }
}
