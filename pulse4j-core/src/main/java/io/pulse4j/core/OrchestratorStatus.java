package io.pulse4j.core;

import java.util.List;

/**
 * Snapshot of the orchestrator for operator tooling.
 *
 * @param running     whether {@code start()} has been called and not yet stopped
 * @param paused      whether queue claiming is paused
 * @param activeJobs  number of armed scheduled jobs
 * @param upcoming    armed jobs ordered by next fire time
 * @param queue       queue counts; {@link QueueMetrics#empty()} when the store could not be read
 */
public record OrchestratorStatus(
        boolean running,
        boolean paused,
        int activeJobs,
        List<ArmedJobView> upcoming,
        QueueMetrics queue
) {

    public OrchestratorStatus {
        upcoming = (upcoming == null) ? List.of() : List.copyOf(upcoming);
    }
}
