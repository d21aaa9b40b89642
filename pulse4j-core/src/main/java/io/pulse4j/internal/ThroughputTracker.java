package io.pulse4j.internal;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Sliding one-minute count of completed queue jobs.
 */
final class ThroughputTracker {

    private static final Duration WINDOW = Duration.ofMinutes(1);

    private final Clock clock;
    private final ConcurrentLinkedDeque<Instant> completions = new ConcurrentLinkedDeque<>();

    ThroughputTracker(Clock clock) {
        this.clock = clock;
    }

    void record() {
        completions.addLast(clock.instant());
        prune();
    }

    long perMinute() {
        prune();
        return completions.size();
    }

    private void prune() {
        Instant cutoff = clock.instant().minus(WINDOW);
        Iterator<Instant> it = completions.iterator();
        while (it.hasNext()) {
            if (it.next().isBefore(cutoff)) {
                it.remove();
            } else {
                break;
            }
        }
    }
}
