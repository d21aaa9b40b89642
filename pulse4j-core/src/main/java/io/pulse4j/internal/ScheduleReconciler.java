package io.pulse4j.internal;

import io.pulse4j.core.ScheduledJob;
import io.pulse4j.spi.ActivityMonitor;
import io.pulse4j.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Keeps the armed-timer set congruent with the store's active job set.
 *
 * <p>Jobs already armed are left untouched: their next occurrence was fixed at arm time, so an
 * edited cron expression takes effect on the job's next re-arm. A failed fetch changes nothing.
 */
public class ScheduleReconciler {
    private static final Logger log = LoggerFactory.getLogger(ScheduleReconciler.class);

    private final JobStore store;
    private final TimerArmer armer;
    private final ActivityMonitor monitor;

    public ScheduleReconciler(JobStore store, TimerArmer armer, ActivityMonitor monitor) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.armer = Objects.requireNonNull(armer, "armer must not be null");
        this.monitor = GuardedActivityMonitor.wrap(monitor);
    }

    /**
     * One reconciliation pass. Never throws.
     */
    public Result reconcile() {
        List<ScheduledJob> active;
        try {
            active = store.getActiveScheduledJobs();
        } catch (RuntimeException e) {
            log.error("pulse reconcile fetch failed, keeping {} armed jobs msg={}",
                    armer.armedJobIds().size(), e.getMessage(), e);
            monitor.logError(e, "schedule reconciliation");
            return Result.FETCH_FAILED;
        }

        Set<String> activeIds = new HashSet<>();
        int armedNow = 0;
        int unschedulable = 0;
        for (ScheduledJob job : active) {
            if (job == null || !job.active()) {
                continue;
            }
            activeIds.add(job.id());
            if (armer.isArmed(job.id())) {
                continue;
            }
            try {
                if (armer.arm(job)) {
                    armedNow++;
                } else {
                    unschedulable++;
                }
            } catch (RuntimeException e) {
                unschedulable++;
                log.error("pulse reconcile failed to arm id={} msg={}", job.id(), e.getMessage(), e);
            }
        }

        int disarmed = 0;
        for (String id : armer.armedJobIds()) {
            if (!activeIds.contains(id) && armer.disarm(id)) {
                disarmed++;
            }
        }

        if (armedNow > 0 || disarmed > 0 || unschedulable > 0) {
            log.info("pulse reconciled active={} armed={} disarmed={} unschedulable={}",
                    activeIds.size(), armedNow, disarmed, unschedulable);
        } else {
            log.debug("pulse reconciled active={} no changes", activeIds.size());
        }
        return new Result(true, activeIds.size(), armedNow, disarmed, unschedulable);
    }

    /**
     * Outcome of one pass.
     */
    public record Result(boolean fetched, int active, int armed, int disarmed, int unschedulable) {
        static final Result FETCH_FAILED = new Result(false, 0, 0, 0, 0);
    }
}
