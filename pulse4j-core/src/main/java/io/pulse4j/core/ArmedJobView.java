package io.pulse4j.core;

import java.time.Instant;

/**
 * Read-only view of one armed timer.
 */
public record ArmedJobView(String jobId, String name, Instant nextRun, boolean running) {
}
