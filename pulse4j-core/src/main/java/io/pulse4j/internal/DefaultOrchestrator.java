package io.pulse4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.pulse4j.Orchestrator;
import io.pulse4j.config.PulseProperties;
import io.pulse4j.core.NewQueueJob;
import io.pulse4j.core.OrchestratorStatus;
import io.pulse4j.core.QueueJob;
import io.pulse4j.core.QueueJobHandlerRegistry;
import io.pulse4j.core.QueueJobType;
import io.pulse4j.spi.ActivityMonitor;
import io.pulse4j.spi.ContentGenerator;
import io.pulse4j.spi.DeliveryService;
import io.pulse4j.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default {@link Orchestrator}: an explicit, injectable owner of all scheduling and queue state.
 *
 * <p>{@link #start()} creates the timer pool, runs one reconciliation at once and then every
 * {@code pulse.pollInterval} on its own thread, and spawns the queue workers. {@link #stop()} tears
 * all of it down and releases the call threads, so one instance can be started again.
 */
public class DefaultOrchestrator implements Orchestrator {
    private static final Logger log = LoggerFactory.getLogger(DefaultOrchestrator.class);

    // one live call per caller thread plus room for one abandoned after a timeout
    static final int CALL_THREADS_PER_CALLER = 2;

    private final PulseProperties props;
    private final JobStore store;
    private final ContentGenerator generator;
    private final DeliveryService delivery;
    private final ActivityMonitor monitor;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final WorkQueueDispatcher dispatcher;
    private final CallGuard queueGuard;

    private ScheduledExecutorService timerPool;
    private ScheduledExecutorService reconcilePool;
    private CallGuard collaboratorGuard;
    private volatile TimerArmer armer;

    public DefaultOrchestrator(PulseProperties props,
                               JobStore store,
                               ContentGenerator generator,
                               DeliveryService delivery,
                               ActivityMonitor monitor,
                               QueueJobHandlerRegistry handlers,
                               ObjectMapper objectMapper,
                               Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.delivery = Objects.requireNonNull(delivery, "delivery must not be null");
        this.monitor = GuardedActivityMonitor.wrap(monitor);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");

        this.queueGuard = new CallGuard("pulse.queue-call",
                Math.max(1, props.getWorkers()) * CALL_THREADS_PER_CALLER);
        this.dispatcher = new WorkQueueDispatcher(
                store,
                Objects.requireNonNull(handlers, "handlers must not be null"),
                new RetryPolicy(props.getMaxAttempts(), props.getProcessEvery()),
                Objects.requireNonNull(objectMapper, "objectMapper must not be null"),
                queueGuard,
                props.getQueueJobTimeout(),
                this.monitor,
                clock
        );
        if (props.isStartPaused()) {
            dispatcher.pause();
        }
    }

    @Override
    public synchronized void start() {
        if (started.get()) {
            return;
        }
        props.validate();
        started.set(true);

        log.info("pulse starting pollInterval={} timerThreads={} workers={} processEvery={} maxAttempts={} callTimeout={}",
                props.getPollInterval(),
                props.getTimerThreads(),
                props.getWorkers(),
                props.getProcessEvery(),
                props.getMaxAttempts(),
                props.getCallTimeout());

        timerPool = newTimerPool(props.getTimerThreads());
        collaboratorGuard = new CallGuard("pulse.job-call", props.getTimerThreads() * CALL_THREADS_PER_CALLER);
        JobExecutor executor = new JobExecutor(store, generator, delivery, monitor, collaboratorGuard,
                props.getCallTimeout(), clock);
        armer = new TimerArmer(store, executor, timerPool, monitor, clock);
        ScheduleReconciler reconciler = new ScheduleReconciler(store, armer, monitor);

        long pollMs = props.getPollInterval().toMillis();
        reconcilePool = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("pulse.reconcile");
            t.setDaemon(true);
            return t;
        });
        reconcilePool.scheduleWithFixedDelay(() -> {
            try {
                reconciler.reconcile();
            } catch (RuntimeException e) {
                log.error("pulse reconcile tick failed msg={}", e.getMessage(), e);
            }
        }, 0, pollMs, TimeUnit.MILLISECONDS);

        dispatcher.start(props.getWorkers(), props.getProcessEvery(), props.getStaleProcessingAfter());
        log.info("pulse started successfully.");
    }

    @Override
    public synchronized void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("pulse stopping...");

        TimerArmer current = armer;
        armer = null;
        if (current != null) {
            current.close();
        }

        Duration timeout = props.getShutdownTimeout();
        shutdown(reconcilePool, timeout);
        reconcilePool = null;
        shutdown(timerPool, timeout);
        timerPool = null;
        if (collaboratorGuard != null) {
            collaboratorGuard.close();
            collaboratorGuard = null;
        }

        dispatcher.stop(timeout);
        queueGuard.close();
        log.info("pulse stopped successfully.");
    }

    @Override
    public boolean triggerNow(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        TimerArmer current = armer;
        if (current == null) {
            log.warn("pulse trigger ignored, orchestrator not started id={}", jobId);
            return false;
        }
        return current.triggerNow(jobId);
    }

    @Override
    public void pause() {
        dispatcher.pause();
    }

    @Override
    public void resume() {
        dispatcher.resume();
    }

    @Override
    public boolean isPaused() {
        return dispatcher.isPaused();
    }

    @Override
    public long retryFailedJobs() {
        long requeued = store.requeueFailedQueueJobs();
        log.info("pulse requeued {} failed queue jobs", requeued);
        return requeued;
    }

    @Override
    public QueueJob enqueue(NewQueueJob job) {
        Objects.requireNonNull(job, "job must not be null");
        QueueJob created = store.createQueueJob(job.hasMaxAttempts() ? job : job.withMaxAttempts(props.getMaxAttempts()));
        log.debug("pulse enqueued id={} type={} priority={}", created.id(), created.type(), created.priority());
        return created;
    }

    @Override
    public QueueJob enqueueCampaign(String campaignId, String userId, int priority) {
        Objects.requireNonNull(campaignId, "campaignId must not be null");
        return enqueue(NewQueueJob.builder(QueueJobType.CAMPAIGN)
                .put("campaignId", campaignId)
                .put("userId", userId)
                .priority(priority)
                .build());
    }

    @Override
    public OrchestratorStatus status() {
        TimerArmer current = armer;
        var upcoming = current == null ? List.<io.pulse4j.core.ArmedJobView>of() : current.snapshot();
        return new OrchestratorStatus(
                started.get(),
                dispatcher.isPaused(),
                upcoming.size(),
                upcoming,
                dispatcher.metrics()
        );
    }

    private static void shutdown(ScheduledExecutorService pool, Duration timeout) {
        if (pool == null) {
            return;
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    /**
     * Timer pool factory; overridable for tests.
     */
    protected ScheduledExecutorService newTimerPool(int threads) {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newScheduledThreadPool(threads, r -> {
            Thread t = new Thread(r);
            t.setName("pulse.timer-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
