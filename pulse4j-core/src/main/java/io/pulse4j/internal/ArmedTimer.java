package io.pulse4j.internal;

import io.pulse4j.core.ArmedJobView;
import io.pulse4j.core.ScheduledJob;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * In-process handle for one job's next occurrence. Not persisted.
 *
 * <p>Every field is guarded by the owning {@link TimerArmer}'s lock. {@code generation} changes each
 * time the timer is rescheduled or cancelled, so a fire that was already queued when that happened
 * recognises itself as stale and does nothing.
 */
final class ArmedTimer {

    private final String jobId;
    private final boolean detached;

    private ScheduledJob job;
    private ScheduledFuture<?> future;
    private Instant nextRun;
    private Instant lastFireAt;
    private long generation;
    private boolean running;

    ArmedTimer(String jobId, boolean detached) {
        this.jobId = jobId;
        this.detached = detached;
    }

    String jobId() {
        return jobId;
    }

    /**
     * A one-off manual run of an inactive job; never re-armed.
     */
    boolean detached() {
        return detached;
    }

    ScheduledJob job() {
        return job;
    }

    boolean running() {
        return running;
    }

    /**
     * The occurrence the most recent run was scheduled for.
     */
    Instant lastFireAt() {
        return lastFireAt;
    }

    long nextGeneration() {
        return ++generation;
    }

    void scheduled(ScheduledJob job, Instant nextRun, ScheduledFuture<?> future) {
        this.job = job;
        this.nextRun = nextRun;
        this.future = future;
    }

    boolean beginRun(long firedGeneration) {
        if (running || firedGeneration != generation) {
            return false;
        }
        running = true;
        lastFireAt = nextRun;
        future = null;
        return true;
    }

    void endRun() {
        running = false;
        nextRun = null;
    }

    /**
     * Cancels the pending fire only; a run already in progress is not interrupted.
     */
    void cancel() {
        generation++;
        if (future != null) {
            future.cancel(false);
            future = null;
        }
        nextRun = null;
    }

    ArmedJobView view() {
        return new ArmedJobView(jobId, job == null ? jobId : job.displayName(), nextRun, running);
    }
}
