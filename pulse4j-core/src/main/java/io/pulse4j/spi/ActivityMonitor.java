package io.pulse4j.spi;

import io.pulse4j.core.JobPhase;

/**
 * Fire-and-forget observability sink. Implementations must never throw.
 */
public interface ActivityMonitor {

    void logJobExecution(String jobId, String name, JobPhase phase, Long durationMs);

    void logError(Throwable error, String context);
}
