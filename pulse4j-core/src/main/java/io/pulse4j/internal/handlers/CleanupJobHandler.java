package io.pulse4j.internal.handlers;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.pulse4j.QueueJobHandler;
import io.pulse4j.core.QueueJob;
import io.pulse4j.core.QueueJobType;
import io.pulse4j.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Deletes completed and failed queue jobs older than {@code olderThanDays} (default 30).
 */
public class CleanupJobHandler implements QueueJobHandler<CleanupJobHandler.CleanupPayload> {
    private static final Logger log = LoggerFactory.getLogger(CleanupJobHandler.class);

    static final int DEFAULT_RETENTION_DAYS = 30;

    private final JobStore store;
    private final Clock clock;

    public CleanupJobHandler(JobStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public QueueJobType type() {
        return QueueJobType.CLEANUP;
    }

    @Override
    public Class<CleanupPayload> payloadClass() {
        return CleanupPayload.class;
    }

    @Override
    public void execute(QueueJob job, CleanupPayload payload) {
        int days = (payload == null || payload.olderThanDays() == null || payload.olderThanDays() < 0)
                ? DEFAULT_RETENTION_DAYS
                : payload.olderThanDays();
        Instant cutoff = clock.instant().minus(Duration.ofDays(days));
        long deleted = store.deleteQueueJobsFinishedBefore(cutoff);
        log.info("pulse cleanup removed {} finished queue jobs older than {} days", deleted, days);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CleanupPayload(Integer olderThanDays) {
    }
}
