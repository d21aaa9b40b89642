package io.pulse4j.internal;

import io.pulse4j.core.ArmedJobView;
import io.pulse4j.core.RunStatus;
import io.pulse4j.core.ScheduledJob;
import io.pulse4j.exception.SchedulingException;
import io.pulse4j.spi.ActivityMonitor;
import io.pulse4j.spi.JobStore;
import io.pulse4j.utils.CronSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Owns the armed-timer set: at most one one-shot timer per active job id.
 *
 * <p>Scheduling is a chain of one-shot timers, never a fixed-rate interval: when a timer fires the
 * job runs through {@link JobExecutor}, then the job is reloaded and armed for its following
 * occurrence. Each link is a fresh task on the timer pool, so the chain does not nest.
 *
 * <p>All access to the timer map goes through {@code lock}; store and cron work happens outside it.
 */
public class TimerArmer {
    private static final Logger log = LoggerFactory.getLogger(TimerArmer.class);

    private final JobStore store;
    private final JobExecutor executor;
    private final ScheduledExecutorService timers;
    private final ActivityMonitor monitor;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<String, ArmedTimer> armed = new HashMap<>();
    private final Map<String, ArmedTimer> manualRuns = new HashMap<>();
    private boolean closed;

    public TimerArmer(JobStore store,
                      JobExecutor executor,
                      ScheduledExecutorService timers,
                      ActivityMonitor monitor,
                      Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.timers = Objects.requireNonNull(timers, "timers must not be null");
        this.monitor = GuardedActivityMonitor.wrap(monitor);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Arms {@code job} for its next occurrence unless it is already armed (or running).
     *
     * @return true if the job is armed after this call
     */
    public boolean arm(ScheduledJob job) {
        return arm(job, null);
    }

    /**
     * Cancels the job's pending fire and forgets it. A run in progress finishes but is not re-armed.
     *
     * @return true if the job was armed
     */
    public boolean disarm(String jobId) {
        ArmedTimer removed;
        synchronized (lock) {
            removed = armed.remove(jobId);
            if (removed != null) {
                removed.cancel();
            }
        }
        if (removed != null) {
            log.info("pulse job disarmed id={}", jobId);
        }
        return removed != null;
    }

    /**
     * Runs the job at once, replacing its pending timer. Active jobs continue their chain afterwards;
     * inactive jobs run once.
     *
     * @return false when the job is unknown or already running
     */
    public boolean triggerNow(String jobId) {
        Optional<ScheduledJob> loaded;
        try {
            loaded = store.findScheduledJob(jobId);
        } catch (RuntimeException e) {
            log.warn("pulse trigger failed to load job id={} msg={}", jobId, e.getMessage());
            return false;
        }
        if (loaded.isEmpty()) {
            return false;
        }
        ScheduledJob job = loaded.get();

        synchronized (lock) {
            if (closed) {
                return false;
            }
            ArmedTimer timer = armed.get(jobId);
            ArmedTimer manual = manualRuns.get(jobId);
            if ((timer != null && timer.running()) || manual != null) {
                log.info("pulse trigger ignored, job already running id={}", jobId);
                return false;
            }
            if (timer != null) {
                timer.cancel();
            } else if (job.active()) {
                timer = new ArmedTimer(jobId, false);
                armed.put(jobId, timer);
            } else {
                timer = new ArmedTimer(jobId, true);
                manualRuns.put(jobId, timer);
            }
            if (!scheduleLocked(timer, job, clock.instant())) {
                return false;
            }
        }
        log.info("pulse job triggered manually id={}", jobId);
        return true;
    }

    public boolean isArmed(String jobId) {
        synchronized (lock) {
            return armed.containsKey(jobId);
        }
    }

    public Set<String> armedJobIds() {
        synchronized (lock) {
            return new LinkedHashSet<>(armed.keySet());
        }
    }

    /**
     * Armed jobs ordered by next fire time; running jobs (no next fire yet) come last.
     */
    public List<ArmedJobView> snapshot() {
        List<ArmedJobView> views = new ArrayList<>();
        synchronized (lock) {
            for (ArmedTimer t : armed.values()) {
                views.add(t.view());
            }
        }
        views.sort(Comparator.comparing(ArmedJobView::nextRun, Comparator.nullsLast(Comparator.naturalOrder())));
        return views;
    }

    /**
     * Cancels every pending fire and refuses further arming.
     */
    public void close() {
        synchronized (lock) {
            closed = true;
            armed.values().forEach(ArmedTimer::cancel);
            armed.clear();
            manualRuns.values().forEach(ArmedTimer::cancel);
            manualRuns.clear();
        }
    }

    private boolean arm(ScheduledJob job, ArmedTimer expected) {
        String id = job.id();
        Instant after = clock.instant();
        if (expected != null) {
            synchronized (lock) {
                // a timer may fire a little early; never hand out the slot that just ran
                Instant fired = expected.lastFireAt();
                if (fired != null && fired.isAfter(after)) {
                    after = fired;
                }
            }
        }
        Instant next;
        try {
            next = CronSchedule.nextOccurrence(job.cronExpression(), job.timezone(), after);
        } catch (SchedulingException e) {
            unschedulable(job, e, expected);
            return false;
        }

        try {
            store.updateScheduledJobNextRun(id, next);
        } catch (RuntimeException e) {
            // the timer is still armed; nextRun is rewritten on the following occurrence
            log.warn("pulse failed to persist nextRun id={} nextRun={} msg={}", id, next, e.getMessage());
        }

        synchronized (lock) {
            if (closed) {
                return false;
            }
            ArmedTimer current = armed.get(id);
            ArmedTimer timer;
            if (expected == null) {
                if (current != null) {
                    return true;
                }
                timer = new ArmedTimer(id, false);
                armed.put(id, timer);
            } else {
                if (current != expected) {
                    return false;
                }
                timer = expected;
            }
            if (!scheduleLocked(timer, job, next)) {
                return false;
            }
        }

        log.info("pulse job armed id={} cron={} tz={} nextRun={}", id, job.cronExpression(), job.timezone(), next);
        return true;
    }

    private boolean scheduleLocked(ArmedTimer timer, ScheduledJob job, Instant fireAt) {
        long delayMs = ceilMillis(Duration.between(clock.instant(), fireAt));
        long generation = timer.nextGeneration();
        try {
            timer.scheduled(job, fireAt, timers.schedule(() -> fire(timer, generation), delayMs, TimeUnit.MILLISECONDS));
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("pulse timer pool rejected job id={}", timer.jobId());
            forgetLocked(timer);
            return false;
        }
    }

    private void fire(ArmedTimer timer, long generation) {
        ScheduledJob job;
        synchronized (lock) {
            if (closed || !owned(timer) || !timer.beginRun(generation)) {
                return;
            }
            job = timer.job();
        }

        try {
            executor.execute(job);
        } catch (RuntimeException e) {
            log.error("pulse executor escaped failure id={} msg={}", job.id(), e.getMessage(), e);
        } finally {
            synchronized (lock) {
                timer.endRun();
                if (timer.detached()) {
                    forgetLocked(timer);
                }
            }
        }

        if (!timer.detached()) {
            rearm(timer);
        }
    }

    private void rearm(ArmedTimer timer) {
        String id = timer.jobId();
        ScheduledJob latest;
        try {
            Optional<ScheduledJob> loaded = store.findScheduledJob(id);
            if (loaded.isEmpty() || !loaded.get().active()) {
                synchronized (lock) {
                    forgetLocked(timer);
                }
                log.info("pulse job no longer active, chain ends id={}", id);
                return;
            }
            latest = loaded.get();
        } catch (RuntimeException e) {
            log.warn("pulse failed to reload job, re-arming from last known definition id={} msg={}", id, e.getMessage());
            latest = timer.job();
        }
        arm(latest, timer);
    }

    private void unschedulable(ScheduledJob job, SchedulingException e, ArmedTimer expected) {
        String id = job.id();
        log.error("pulse job cannot be scheduled id={} cron={} tz={} msg={}",
                id, job.cronExpression(), job.timezone(), e.getMessage());
        monitor.logError(e, "scheduling job " + id);
        if (expected != null) {
            synchronized (lock) {
                forgetLocked(expected);
            }
        }
        try {
            store.updateScheduledJobStatus(id, RunStatus.ERROR, e.getMessage());
        } catch (RuntimeException storeEx) {
            log.warn("pulse failed to record scheduling error id={} msg={}", id, storeEx.getMessage());
        }
    }

    // rounded up so the timer never fires before fireAt
    static long ceilMillis(Duration delay) {
        if (delay.isNegative() || delay.isZero()) {
            return 0;
        }
        long ms = delay.toMillis();
        return delay.minusMillis(ms).isZero() ? ms : ms + 1;
    }

    private boolean owned(ArmedTimer timer) {
        Map<String, ArmedTimer> home = timer.detached() ? manualRuns : armed;
        return home.get(timer.jobId()) == timer;
    }

    private void forgetLocked(ArmedTimer timer) {
        Map<String, ArmedTimer> home = timer.detached() ? manualRuns : armed;
        home.remove(timer.jobId(), timer);
        timer.cancel();
    }
}
