package io.pulse4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.pulse4j.QueueJobHandler;
import io.pulse4j.core.JobPhase;
import io.pulse4j.core.QueueJob;
import io.pulse4j.core.QueueJobHandlerRegistry;
import io.pulse4j.core.QueueJobStatus;
import io.pulse4j.core.QueueJobType;
import io.pulse4j.core.QueueJobUpdate;
import io.pulse4j.core.QueueMetrics;
import io.pulse4j.exception.QueueJobException;
import io.pulse4j.spi.ActivityMonitor;
import io.pulse4j.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Drains queue jobs with a fixed pool of independent polling loops.
 *
 * <p>Each loop, once per tick, claims at most one pending job through the store's atomic claim and
 * runs it to completion. Pausing only gates new claims; a job already executing finishes normally.
 * Once {@link #pause()} returns no claim is in progress and none will start until {@link #resume()}.
 */
public class WorkQueueDispatcher {
    private static final Logger log = LoggerFactory.getLogger(WorkQueueDispatcher.class);

    private final JobStore store;
    private final QueueJobHandlerRegistry handlers;
    private final RetryPolicy retryPolicy;
    private final ObjectMapper objectMapper;
    private final CallGuard guard;
    private final Duration jobTimeout;
    private final ActivityMonitor monitor;
    private final Clock clock;
    private final ThroughputTracker throughput;

    private final AtomicBoolean processing = new AtomicBoolean(true);
    // workers hold the read side from the pause check through the claim
    private final ReadWriteLock claimGate = new ReentrantReadWriteLock();
    private final AtomicInteger inFlight = new AtomicInteger();

    private ScheduledExecutorService workers;

    public WorkQueueDispatcher(JobStore store,
                               QueueJobHandlerRegistry handlers,
                               RetryPolicy retryPolicy,
                               ObjectMapper objectMapper,
                               CallGuard guard,
                               Duration jobTimeout,
                               ActivityMonitor monitor,
                               Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.handlers = Objects.requireNonNull(handlers, "handlers must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.guard = Objects.requireNonNull(guard, "guard must not be null");
        this.jobTimeout = Objects.requireNonNull(jobTimeout, "jobTimeout must not be null");
        this.monitor = GuardedActivityMonitor.wrap(monitor);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.throughput = new ThroughputTracker(clock);
    }

    /**
     * Releases claims abandoned by a previous process, then spawns {@code workerCount} loops.
     */
    public synchronized void start(int workerCount, Duration tick, Duration staleAfter) {
        if (workers != null) {
            return;
        }
        releaseStale(staleAfter);

        AtomicInteger seq = new AtomicInteger();
        workers = Executors.newScheduledThreadPool(workerCount, r -> {
            Thread t = new Thread(r);
            t.setName("pulse.queue-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        long tickMs = tick.toMillis();
        for (int i = 0; i < workerCount; i++) {
            final int workerIndex = i;
            workers.scheduleWithFixedDelay(() -> tick(workerIndex), tickMs, tickMs, TimeUnit.MILLISECONDS);
        }
        log.info("pulse queue started workers={} tick={} paused={}", workerCount, tick, isPaused());
    }

    /**
     * Stops the loops, letting in-flight jobs finish for up to {@code timeout}.
     */
    public synchronized void stop(Duration timeout) {
        if (workers == null) {
            return;
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("pulse queue workers did not finish within {}; interrupting inFlight={}", timeout, inFlight.get());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        } finally {
            workers = null;
        }
        log.info("pulse queue stopped");
    }

    /**
     * Stops new claims, waiting for claims already past the pause check to land.
     */
    public void pause() {
        claimGate.writeLock().lock();
        try {
            if (processing.compareAndSet(true, false)) {
                log.info("pulse queue paused inFlight={}", inFlight.get());
            }
        } finally {
            claimGate.writeLock().unlock();
        }
    }

    public void resume() {
        if (processing.compareAndSet(false, true)) {
            log.info("pulse queue resumed");
        }
    }

    public boolean isPaused() {
        return !processing.get();
    }

    public int inFlight() {
        return inFlight.get();
    }

    /**
     * One worker tick: claim and run at most one job.
     *
     * @return true if a job was claimed
     */
    public boolean processNext(int workerIndex) {
        Optional<QueueJob> claimed;
        claimGate.readLock().lock();
        try {
            if (!processing.get()) {
                return false;
            }
            claimed = store.claimNextPending(clock.instant());
        } catch (RuntimeException e) {
            log.warn("pulse worker={} claim failed msg={}", workerIndex, e.getMessage());
            return false;
        } finally {
            claimGate.readLock().unlock();
        }
        if (claimed.isEmpty()) {
            return false;
        }

        inFlight.incrementAndGet();
        try {
            process(claimed.get(), workerIndex);
        } finally {
            inFlight.decrementAndGet();
        }
        return true;
    }

    public QueueMetrics metrics() {
        long perMinute = throughput.perMinute();
        try {
            return store.getQueueMetrics().withThroughput(perMinute);
        } catch (RuntimeException e) {
            log.warn("pulse queue metrics unavailable msg={}", e.getMessage());
            return QueueMetrics.empty().withThroughput(perMinute);
        }
    }

    private void tick(int workerIndex) {
        try {
            processNext(workerIndex);
        } catch (RuntimeException e) {
            log.error("pulse worker={} tick failed msg={}", workerIndex, e.getMessage(), e);
        }
    }

    private void releaseStale(Duration staleAfter) {
        try {
            long released = store.releaseStaleQueueJobs(clock.instant().minus(staleAfter),
                    retryPolicy.defaultMaxAttempts());
            if (released > 0) {
                log.warn("pulse released {} queue jobs abandoned in processing", released);
            }
        } catch (RuntimeException e) {
            log.warn("pulse stale claim release failed msg={}", e.getMessage());
        }
    }

    private void process(QueueJob job, int workerIndex) {
        Instant startedAt = clock.instant();
        String label = "queue:" + job.type();
        log.debug("pulse worker={} claimed id={} type={} attempt={}/{}",
                workerIndex, job.id(), job.type(), job.attempts(), retryPolicy.maxAttempts(job));
        monitor.logJobExecution(job.id(), label, JobPhase.STARTED, null);

        try {
            QueueJobType type = job.knownType()
                    .orElseThrow(() -> QueueJobException.permanent("Unknown job type: " + job.type(), null));
            QueueJobHandler<?> handler = handlers.find(type)
                    .orElseThrow(() -> QueueJobException.permanent("No handler registered for type: " + type.value(), null));

            guard.call(() -> {
                invoke(handler, job);
                return null;
            }, jobTimeout, QueueJobException.class, QueueJobException::new);
        } catch (RuntimeException e) {
            onFailure(job, e, workerIndex, startedAt);
            return;
        }

        Instant finishedAt = clock.instant();
        try {
            store.updateQueueJob(job.id(), QueueJobUpdate.completed(finishedAt, null));
        } catch (RuntimeException e) {
            log.error("pulse worker={} failed to mark completed id={} msg={}", workerIndex, job.id(), e.getMessage(), e);
        }
        throughput.record();
        long durationMs = Duration.between(startedAt, finishedAt).toMillis();
        log.debug("pulse worker={} completed id={} type={} durationMs={}", workerIndex, job.id(), job.type(), durationMs);
        monitor.logJobExecution(job.id(), label, JobPhase.COMPLETED, durationMs);
    }

    private void onFailure(QueueJob job, RuntimeException error, int workerIndex, Instant startedAt) {
        Instant failedAt = clock.instant();
        QueueJobUpdate update = retryPolicy.onFailure(job, error, failedAt);

        if (update.status() == QueueJobStatus.FAILED) {
            log.warn("pulse worker={} job failed permanently id={} type={} attempts={} msg={}",
                    workerIndex, job.id(), job.type(), job.attempts(), update.error(), error);
        } else {
            log.info("pulse worker={} job failed, will retry id={} type={} attempts={} notBefore={} msg={}",
                    workerIndex, job.id(), job.type(), job.attempts(), update.availableAt(), update.error());
        }

        try {
            store.updateQueueJob(job.id(), update);
        } catch (RuntimeException e) {
            log.error("pulse worker={} failed to record failure id={} msg={}", workerIndex, job.id(), e.getMessage(), e);
        }
        monitor.logJobExecution(job.id(), "queue:" + job.type(), JobPhase.FAILED,
                Duration.between(startedAt, failedAt).toMillis());
    }

    private <T> void invoke(QueueJobHandler<T> handler, QueueJob job) throws Exception {
        T payload;
        try {
            payload = objectMapper.convertValue(job.data(), handler.payloadClass());
        } catch (IllegalArgumentException e) {
            throw QueueJobException.permanent("Unreadable payload for type " + job.type() + ": " + e.getMessage(), e);
        }
        handler.execute(job, payload);
    }
}
