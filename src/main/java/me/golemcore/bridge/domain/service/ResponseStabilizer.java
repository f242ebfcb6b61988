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

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Waits for a rendered response to stop changing.
 *
 * <p>
 * The wait is a bounded state machine over {@link State}: it stays
 * {@code POLLING} while the latest response block is missing or still
 * changing, becomes {@code STABLE} once the same non-blank text is read on two
 * consecutive polls, and becomes {@code TIMED_OUT} when the deadline passes
 * first. The deadline is checked before every read and polls are one interval
 * apart, so as long as a read never runs past the deadline the wait ends no
 * later than the deadline plus one poll interval.
 *
 * <p>
 * Snapshots come from a supplier, so the machine runs without a browser in
 * tests.
 */
@Component
@RequiredArgsConstructor
public class ResponseStabilizer {

    private final Clock clock;
    private final Sleeper sleeper;

    public enum State {
        POLLING, STABLE, TIMED_OUT
    }

    /**
     * One read of the response region: how many response blocks exist and the
     * text of the last one.
     */
    public record Snapshot(int blocks, String text) {
    }

    public record Outcome(State state, String text, int polls) {

        public boolean isStable() {
            return state == State.STABLE;
        }
    }

    /**
     * Polls the source until the text of a block newer than {@code baseline}
     * settles or the deadline passes.
     *
     * @param source
     *            reads the current response region
     * @param baseline
     *            number of response blocks present before the prompt was sent
     * @param deadline
     *            instant after which no further read is made
     * @param pollInterval
     *            pause between two reads
     */
    public Outcome await(Supplier<Snapshot> source, int baseline, Instant deadline, Duration pollInterval)
            throws InterruptedException {
        String candidate = null;
        int polls = 0;
        while (true) {
            if (!clock.instant().isBefore(deadline)) {
                return new Outcome(State.TIMED_OUT, candidate, polls);
            }
            Snapshot snapshot = source.get();
            polls++;
            String text = snapshot != null && snapshot.blocks() > baseline ? normalize(snapshot.text()) : null;
            if (text == null) {
                candidate = null;
            } else if (text.equals(candidate)) {
                return new Outcome(State.STABLE, text, polls);
            } else {
                candidate = text;
            }
            sleeper.sleep(pollInterval);
        }
    }

    private static String normalize(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        return text.strip();
    }
}
