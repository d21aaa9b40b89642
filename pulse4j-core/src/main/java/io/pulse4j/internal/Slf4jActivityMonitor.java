package io.pulse4j.internal;

import io.pulse4j.core.JobPhase;
import io.pulse4j.spi.ActivityMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link ActivityMonitor} writing lifecycle events to the {@code pulse.activity} logger.
 */
public class Slf4jActivityMonitor implements ActivityMonitor {
    private static final Logger log = LoggerFactory.getLogger("pulse.activity");

    @Override
    public void logJobExecution(String jobId, String name, JobPhase phase, Long durationMs) {
        if (phase == JobPhase.FAILED) {
            log.warn("job {} id={} name={} durationMs={}", phase, jobId, name, durationMs);
        } else {
            log.info("job {} id={} name={} durationMs={}", phase, jobId, name, durationMs);
        }
    }

    @Override
    public void logError(Throwable error, String context) {
        log.error("error context={} msg={}", context, error == null ? null : error.getMessage(), error);
    }
}
