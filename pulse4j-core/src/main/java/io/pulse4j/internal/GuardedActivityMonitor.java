package io.pulse4j.internal;

import io.pulse4j.core.JobPhase;
import io.pulse4j.spi.ActivityMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Wraps a user-supplied {@link ActivityMonitor} so that a failing sink never reaches the engine threads.
 */
final class GuardedActivityMonitor implements ActivityMonitor {
    private static final Logger log = LoggerFactory.getLogger(GuardedActivityMonitor.class);

    private final ActivityMonitor delegate;

    private GuardedActivityMonitor(ActivityMonitor delegate) {
        this.delegate = delegate;
    }

    static ActivityMonitor wrap(ActivityMonitor monitor) {
        Objects.requireNonNull(monitor, "monitor must not be null");
        if (monitor instanceof GuardedActivityMonitor || monitor instanceof Slf4jActivityMonitor) {
            return monitor;
        }
        return new GuardedActivityMonitor(monitor);
    }

    @Override
    public void logJobExecution(String jobId, String name, JobPhase phase, Long durationMs) {
        try {
            delegate.logJobExecution(jobId, name, phase, durationMs);
        } catch (RuntimeException e) {
            log.warn("activity monitor failed on job event id={} phase={} msg={}", jobId, phase, e.getMessage());
        }
    }

    @Override
    public void logError(Throwable error, String context) {
        try {
            delegate.logError(error, context);
        } catch (RuntimeException e) {
            log.warn("activity monitor failed on error event context={} msg={}", context, e.getMessage());
        }
    }
}
