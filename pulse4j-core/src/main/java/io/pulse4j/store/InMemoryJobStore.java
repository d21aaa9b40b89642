package io.pulse4j.store;

import io.pulse4j.core.GeneratedContent;
import io.pulse4j.core.NewQueueJob;
import io.pulse4j.core.QueueJob;
import io.pulse4j.core.QueueJobStatus;
import io.pulse4j.core.QueueJobUpdate;
import io.pulse4j.core.QueueMetrics;
import io.pulse4j.core.RunStatus;
import io.pulse4j.core.ScheduledJob;
import io.pulse4j.exception.StoreException;
import io.pulse4j.spi.JobStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Process-local {@link JobStore} for tests and single-node embedding.
 *
 * <p>Every method is synchronized on the store, which makes {@link #claimNextPending(Instant)}
 * atomic. Nothing survives a restart.
 */
public class InMemoryJobStore implements JobStore {

    private static final Comparator<QueueJob> CLAIM_ORDER = Comparator
            .comparingInt(QueueJob::priority).reversed()
            .thenComparing(QueueJob::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(QueueJob::id);

    private final Clock clock;
    private final Map<String, ScheduledJob> scheduled = new LinkedHashMap<>();
    private final Map<String, QueueJob> queue = new LinkedHashMap<>();
    private final Map<String, GeneratedContent> generated = new LinkedHashMap<>();

    public InMemoryJobStore() {
        this(Clock.systemUTC());
    }

    public InMemoryJobStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---- definition management ----

    public synchronized ScheduledJob saveScheduledJob(ScheduledJob job) {
        Objects.requireNonNull(job, "job must not be null");
        scheduled.put(job.id(), job);
        return job;
    }

    public synchronized boolean deleteScheduledJob(String id) {
        return scheduled.remove(id) != null;
    }

    public synchronized void setActive(String id, boolean active) {
        modifyScheduled(id, b -> b.active(active));
    }

    public synchronized List<ScheduledJob> getScheduledJobs() {
        return new ArrayList<>(scheduled.values());
    }

    public synchronized List<GeneratedContent> getGeneratedContent(String scheduledJobId) {
        return generated.values().stream()
                .filter(c -> Objects.equals(c.scheduledJobId(), scheduledJobId))
                .collect(Collectors.toList());
    }

    public synchronized Optional<QueueJob> findQueueJob(String id) {
        return Optional.ofNullable(queue.get(id));
    }

    /**
     * Stores a queue job as-is; used to seed state such as stale claims.
     */
    public synchronized QueueJob saveQueueJob(QueueJob job) {
        Objects.requireNonNull(job, "job must not be null");
        queue.put(job.id(), job);
        return job;
    }

    // ---- scheduled jobs ----

    @Override
    public synchronized List<ScheduledJob> getActiveScheduledJobs() {
        return scheduled.values().stream()
                .filter(ScheduledJob::active)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized Optional<ScheduledJob> findScheduledJob(String id) {
        return Optional.ofNullable(scheduled.get(id));
    }

    @Override
    public synchronized void updateScheduledJobNextRun(String id, Instant nextRun) {
        modifyScheduled(id, b -> b.nextRun(nextRun));
    }

    @Override
    public synchronized void updateScheduledJobLastRun(String id, Instant lastRun) {
        ScheduledJob current = scheduled.get(id);
        if (current != null) {
            scheduled.put(id, current.toBuilder().lastRun(lastRun).totalRuns(current.totalRuns() + 1).build());
        }
    }

    @Override
    public synchronized void updateScheduledJobStatus(String id, RunStatus status, String error) {
        Objects.requireNonNull(status, "status must not be null");
        modifyScheduled(id, b -> {
            b.lastStatus(status);
            if (status == RunStatus.ERROR) {
                b.lastError(error);
            } else if (status == RunStatus.SUCCESS) {
                b.lastError(null);
            }
            return b;
        });
    }

    @Override
    public synchronized void incrementScheduledJobSuccessCount(String id) {
        ScheduledJob current = scheduled.get(id);
        if (current != null) {
            scheduled.put(id, current.toBuilder().successCount(current.successCount() + 1).build());
        }
    }

    @Override
    public synchronized void incrementScheduledJobErrorCount(String id) {
        ScheduledJob current = scheduled.get(id);
        if (current != null) {
            scheduled.put(id, current.toBuilder().errorCount(current.errorCount() + 1).build());
        }
    }

    @Override
    public synchronized String saveGeneratedContent(GeneratedContent content) {
        Objects.requireNonNull(content, "content must not be null");
        String id = UUID.randomUUID().toString();
        generated.put(id, content);
        return id;
    }

    // ---- queue ----

    @Override
    public synchronized List<QueueJob> getQueueJobs(QueueJobStatus status, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        return queue.values().stream()
                .filter(j -> status == null || j.status() == status)
                .sorted(Comparator.comparing(QueueJob::createdAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized Optional<QueueJob> claimNextPending(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        Optional<QueueJob> next = queue.values().stream()
                .filter(j -> j.status() == QueueJobStatus.PENDING)
                .filter(j -> j.availableAt() == null || !j.availableAt().isAfter(now))
                .min(CLAIM_ORDER);
        if (next.isEmpty()) {
            return Optional.empty();
        }
        QueueJob claimed = next.get().toBuilder()
                .status(QueueJobStatus.PROCESSING)
                .processedAt(now)
                .attempts(next.get().attempts() + 1)
                .build();
        queue.put(claimed.id(), claimed);
        return Optional.of(claimed);
    }

    @Override
    public synchronized void updateQueueJob(String id, QueueJobUpdate update) {
        Objects.requireNonNull(update, "update must not be null");
        QueueJob current = queue.get(id);
        if (current == null) {
            throw new StoreException("Queue job not found: " + id);
        }
        QueueJob.Builder b = current.toBuilder().status(update.status());
        switch (update.status()) {
            case COMPLETED -> b.completedAt(update.completedAt()).result(update.result()).error(null);
            case PENDING -> b.error(update.error()).failedAt(null).availableAt(update.availableAt());
            case FAILED -> b.error(update.error()).failedAt(update.failedAt());
            default -> {
            }
        }
        queue.put(id, b.build());
    }

    @Override
    public synchronized QueueJob createQueueJob(NewQueueJob job) {
        Objects.requireNonNull(job, "job must not be null");
        Instant now = clock.instant();
        QueueJob created = QueueJob.builder(UUID.randomUUID().toString())
                .type(job.type().value())
                .data(job.data())
                .priority(job.priority())
                .maxAttempts(job.maxAttempts())
                .status(QueueJobStatus.PENDING)
                .createdAt(now)
                .availableAt(now)
                .build();
        queue.put(created.id(), created);
        return created;
    }

    @Override
    public synchronized long requeueFailedQueueJobs() {
        long count = 0;
        Instant now = clock.instant();
        for (QueueJob job : new ArrayList<>(queue.values())) {
            if (job.status() == QueueJobStatus.FAILED) {
                queue.put(job.id(), job.toBuilder()
                        .status(QueueJobStatus.PENDING)
                        .attempts(0)
                        .error(null)
                        .failedAt(null)
                        .availableAt(now)
                        .build());
                count++;
            }
        }
        return count;
    }

    @Override
    public synchronized long releaseStaleQueueJobs(Instant processedBefore, int defaultMaxAttempts) {
        Objects.requireNonNull(processedBefore, "processedBefore must not be null");
        long count = 0;
        Instant now = clock.instant();
        for (QueueJob job : new ArrayList<>(queue.values())) {
            if (job.status() != QueueJobStatus.PROCESSING
                    || job.processedAt() == null
                    || !job.processedAt().isBefore(processedBefore)) {
                continue;
            }
            QueueJob.Builder b = job.toBuilder();
            int maxAttempts = job.maxAttempts() > 0 ? job.maxAttempts() : defaultMaxAttempts;
            if (job.attempts() >= maxAttempts) {
                b.status(QueueJobStatus.FAILED).error("Abandoned while processing").failedAt(now);
            } else {
                b.status(QueueJobStatus.PENDING).availableAt(now);
            }
            queue.put(job.id(), b.build());
            count++;
        }
        return count;
    }

    @Override
    public synchronized long deleteQueueJobsFinishedBefore(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        List<String> doomed = queue.values().stream()
                .filter(j -> {
                    Instant finished = j.status() == QueueJobStatus.COMPLETED ? j.completedAt()
                            : j.status() == QueueJobStatus.FAILED ? j.failedAt()
                            : null;
                    return finished != null && finished.isBefore(cutoff);
                })
                .map(QueueJob::id)
                .collect(Collectors.toList());
        doomed.forEach(queue::remove);
        return doomed.size();
    }

    @Override
    public synchronized QueueMetrics getQueueMetrics() {
        long pending = 0;
        long processing = 0;
        long completed = 0;
        long failed = 0;
        for (QueueJob job : queue.values()) {
            switch (job.status()) {
                case PENDING -> pending++;
                case PROCESSING -> processing++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
            }
        }
        return new QueueMetrics(pending, processing, completed, failed, queue.size(), 0);
    }

    private void modifyScheduled(String id, UnaryOperator<ScheduledJob.Builder> change) {
        ScheduledJob current = scheduled.get(id);
        if (current != null) {
            scheduled.put(id, change.apply(current.toBuilder()).build());
        }
    }
}
