package io.pulse4j.spi;

import io.pulse4j.core.GeneratedContent;
import io.pulse4j.core.NewQueueJob;
import io.pulse4j.core.QueueJob;
import io.pulse4j.core.QueueJobStatus;
import io.pulse4j.core.QueueJobUpdate;
import io.pulse4j.core.QueueMetrics;
import io.pulse4j.core.RunStatus;
import io.pulse4j.core.ScheduledJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of scheduled-job definitions and queue jobs; the only source of truth across restarts.
 *
 * <p>Implementations signal transient failures with {@link io.pulse4j.exception.StoreException}.
 */
public interface JobStore {

    // ---- scheduled jobs ----

    List<ScheduledJob> getActiveScheduledJobs();

    Optional<ScheduledJob> findScheduledJob(String id);

    void updateScheduledJobNextRun(String id, Instant nextRun);

    /**
     * Records the start of a run: sets {@code lastRun} and increments {@code totalRuns}.
     */
    void updateScheduledJobLastRun(String id, Instant lastRun);

    /**
     * Sets {@code lastStatus}. {@code ERROR} stores {@code error} as {@code lastError},
     * {@code SUCCESS} clears it, {@code RUNNING} leaves it untouched.
     */
    void updateScheduledJobStatus(String id, RunStatus status, String error);

    void incrementScheduledJobSuccessCount(String id);

    void incrementScheduledJobErrorCount(String id);

    /**
     * @return id of the stored artifact
     */
    String saveGeneratedContent(GeneratedContent content);

    // ---- queue ----

    /**
     * Newest first.
     *
     * @param status filter, or null for all
     */
    List<QueueJob> getQueueJobs(QueueJobStatus status, int limit);

    /**
     * Atomically claims the highest-priority, oldest pending job whose {@code availableAt} is not
     * after {@code now}: status becomes {@code processing}, {@code processedAt = now},
     * {@code attempts + 1}. Two concurrent callers never receive the same job.
     */
    Optional<QueueJob> claimNextPending(Instant now);

    void updateQueueJob(String id, QueueJobUpdate update);

    QueueJob createQueueJob(NewQueueJob job);

    /**
     * Moves every failed job back to pending with attempts reset and error cleared.
     *
     * @return number of requeued jobs
     */
    long requeueFailedQueueJobs();

    /**
     * Releases jobs left in {@code processing} since before {@code processedBefore}: back to pending,
     * or failed when their attempts are exhausted.
     *
     * @param defaultMaxAttempts attempt budget for jobs stored without one ({@code maxAttempts == 0})
     * @return number of released jobs
     */
    long releaseStaleQueueJobs(Instant processedBefore, int defaultMaxAttempts);

    /**
     * Deletes completed and failed jobs that finished before {@code cutoff}.
     */
    long deleteQueueJobsFinishedBefore(Instant cutoff);

    QueueMetrics getQueueMetrics();
}
