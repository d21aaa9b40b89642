package io.pulse4j;

import io.pulse4j.core.NewQueueJob;
import io.pulse4j.core.OrchestratorStatus;
import io.pulse4j.core.QueueJob;

/**
 * Main orchestration API.
 *
 * <p>Owns two independent engines:
 * <ul>
 *   <li>Cron scheduling: keeps one armed timer per active scheduled job and runs
 *       generate &rarr; persist &rarr; deliver on each occurrence</li>
 *   <li>Work queue: a fixed pool of workers draining persisted queue jobs with retry</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * orchestrator.start();
 *
 * orchestrator.enqueue(NewQueueJob.builder(QueueJobType.CLEANUP)
 *         .put("olderThanDays", 14)
 *         .build());
 *
 * orchestrator.triggerNow("daily-digest");
 * orchestrator.stop();
 * }</pre>
 */
public interface Orchestrator {

    /**
     * Start reconciliation and queue workers. Idempotent.
     */
    void start();

    /**
     * Cancel all armed timers and stop the workers. Runs in progress are allowed to finish. Idempotent.
     */
    void stop();

    /**
     * Run a scheduled job now, replacing its pending timer. The following occurrence is computed
     * from the freshly loaded definition.
     *
     * @return false if the job does not exist or a run of it is already in progress
     */
    boolean triggerNow(String jobId);

    /**
     * Stop claiming new queue jobs. Jobs already executing finish normally.
     */
    void pause();

    void resume();

    boolean isPaused();

    /**
     * Requeue every permanently failed queue job with its attempts reset.
     *
     * @return number of requeued jobs
     */
    long retryFailedJobs();

    QueueJob enqueue(NewQueueJob job);

    QueueJob enqueueCampaign(String campaignId, String userId, int priority);

    OrchestratorStatus status();
}
