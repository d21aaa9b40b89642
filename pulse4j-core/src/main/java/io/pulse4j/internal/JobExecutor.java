package io.pulse4j.internal;

import io.pulse4j.core.GeneratedContent;
import io.pulse4j.core.GenerationResult;
import io.pulse4j.core.JobPhase;
import io.pulse4j.core.RunStatus;
import io.pulse4j.core.ScheduledJob;
import io.pulse4j.exception.DeliveryException;
import io.pulse4j.exception.GenerationException;
import io.pulse4j.spi.ActivityMonitor;
import io.pulse4j.spi.ContentGenerator;
import io.pulse4j.spi.DeliveryService;
import io.pulse4j.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Runs one occurrence of a scheduled job: {@code running -> {success | error}}.
 *
 * <ol>
 *   <li>mark running, record lastRun</li>
 *   <li>generate content; a failure ends the run as error</li>
 *   <li>persist the artifact, then attempt delivery; a delivery failure is logged only</li>
 * </ol>
 *
 * <p>{@link #execute} never throws. Re-arming is the caller's job and happens regardless of the outcome.
 */
public class JobExecutor {
    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final JobStore store;
    private final ContentGenerator generator;
    private final DeliveryService delivery;
    private final ActivityMonitor monitor;
    private final CallGuard guard;
    private final Duration callTimeout;
    private final Clock clock;

    public JobExecutor(JobStore store,
                       ContentGenerator generator,
                       DeliveryService delivery,
                       ActivityMonitor monitor,
                       CallGuard guard,
                       Duration callTimeout,
                       Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.delivery = Objects.requireNonNull(delivery, "delivery must not be null");
        this.monitor = GuardedActivityMonitor.wrap(monitor);
        this.guard = Objects.requireNonNull(guard, "guard must not be null");
        this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public RunStatus execute(ScheduledJob job) {
        Objects.requireNonNull(job, "job must not be null");
        String id = job.id();
        Instant startedAt = clock.instant();

        log.debug("pulse job started id={} name={} at={}", id, job.displayName(), startedAt);
        monitor.logJobExecution(id, job.displayName(), JobPhase.STARTED, null);
        persist("mark running", id, () -> store.updateScheduledJobStatus(id, RunStatus.RUNNING, null));
        persist("record lastRun", id, () -> store.updateScheduledJobLastRun(id, startedAt));

        String content;
        String contentId;
        try {
            GenerationResult result = guard.call(
                    () -> generator.generate(job.templateRef(), job.userContext(), job.variables()),
                    callTimeout,
                    GenerationException.class,
                    GenerationException::new
            );
            if (result == null || result.content() == null) {
                throw new GenerationException("generator returned no content");
            }
            content = result.content();
            contentId = store.saveGeneratedContent(new GeneratedContent(
                    id,
                    job.templateRef(),
                    job.userContext(),
                    content,
                    result.metadata(),
                    clock.instant()
            ));
        } catch (RuntimeException e) {
            recordFailure(job, e, startedAt);
            return RunStatus.ERROR;
        }

        try {
            guard.call(
                    () -> {
                        delivery.deliver(content, contentId, job.userContext(), job.templateRef());
                        return null;
                    },
                    callTimeout,
                    DeliveryException.class,
                    DeliveryException::new
            );
        } catch (DeliveryException e) {
            log.warn("pulse job delivery failed id={} contentId={} msg={}", id, contentId, e.getMessage());
            monitor.logError(e, "delivery for job " + id);
        }

        persist("increment successCount", id, () -> store.incrementScheduledJobSuccessCount(id));
        persist("mark success", id, () -> store.updateScheduledJobStatus(id, RunStatus.SUCCESS, null));

        long durationMs = elapsedMs(startedAt);
        log.debug("pulse job succeeded id={} contentId={} durationMs={}", id, contentId, durationMs);
        monitor.logJobExecution(id, job.displayName(), JobPhase.COMPLETED, durationMs);
        return RunStatus.SUCCESS;
    }

    private void recordFailure(ScheduledJob job, RuntimeException e, Instant startedAt) {
        String id = job.id();
        String message = CallGuard.describe(e);
        log.error("pulse job failed id={} name={} msg={}", id, job.displayName(), message, e);

        persist("mark error", id, () -> store.updateScheduledJobStatus(id, RunStatus.ERROR, message));
        persist("increment errorCount", id, () -> store.incrementScheduledJobErrorCount(id));

        monitor.logError(e, "execution of job " + id);
        monitor.logJobExecution(id, job.displayName(), JobPhase.FAILED, elapsedMs(startedAt));
    }

    private void persist(String what, String id, Runnable write) {
        try {
            write.run();
        } catch (RuntimeException e) {
            log.error("pulse store write failed op={} id={} msg={}", what, id, e.getMessage(), e);
        }
    }

    private long elapsedMs(Instant startedAt) {
        return Math.max(0, Duration.between(startedAt, clock.instant()).toMillis());
    }
}
