package io.pulse4j.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.result.UpdateResult;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * MongoDB persistence layer for scheduled jobs, queue jobs and generated content.
 *
 * <p>Queue claiming is a single {@code findAndModify} (read + update atomically), so any number of
 * workers across any number of processes can claim concurrently without double-processing.
 * Driver and mapping failures surface as {@link StoreException}.
 */
public class MongoJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(MongoJobStore.class);

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this(mongoTemplate, objectMapper, Clock.systemUTC());
    }

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---- scheduled job definitions (operator side) ----

    /**
     * Upsert a scheduled job definition by id. Run-state fields are written as given.
     */
    public ScheduledJob saveScheduledJob(ScheduledJob job) {
        Objects.requireNonNull(job, "job must not be null");
        return run("save scheduled job", () -> {
            mongoTemplate.save(toDocument(job));
            return job;
        });
    }

    public boolean deleteScheduledJob(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return run("delete scheduled job", () ->
                mongoTemplate.remove(byId(id), ScheduledJobDocument.class).getDeletedCount() > 0);
    }

    public boolean setActive(String id, boolean active) {
        Objects.requireNonNull(id, "id must not be null");
        return run("set active", () ->
                mongoTemplate.updateFirst(byId(id), new Update().set("active", active), ScheduledJobDocument.class)
                        .getMatchedCount() > 0);
    }

    // ---- scheduled jobs ----

    @Override
    public List<ScheduledJob> getActiveScheduledJobs() {
        List<ScheduledJobDocument> docs = run("load active scheduled jobs", () -> mongoTemplate.find(
                new Query(Criteria.where("active").is(true)),
                ScheduledJobDocument.class));
        return readEach(docs, MongoJobStore::readScheduledJob);
    }

    @Override
    public Optional<ScheduledJob> findScheduledJob(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return run("find scheduled job", () ->
                Optional.ofNullable(mongoTemplate.findById(id, ScheduledJobDocument.class)))
                .map(MongoJobStore::readScheduledJob);
    }

    @Override
    public void updateScheduledJobNextRun(String id, Instant nextRun) {
        updateScheduled("update nextRun", id, new Update().set("nextRun", nextRun));
    }

    @Override
    public void updateScheduledJobLastRun(String id, Instant lastRun) {
        updateScheduled("update lastRun", id, new Update().set("lastRun", lastRun).inc("totalRuns", 1));
    }

    @Override
    public void updateScheduledJobStatus(String id, RunStatus status, String error) {
        Objects.requireNonNull(status, "status must not be null");
        Update u = new Update().set("lastStatus", status.value());
        if (status == RunStatus.ERROR) {
            u.set("lastError", error);
        } else if (status == RunStatus.SUCCESS) {
            u.unset("lastError");
        }
        updateScheduled("update status", id, u);
    }

    @Override
    public void incrementScheduledJobSuccessCount(String id) {
        updateScheduled("increment successCount", id, new Update().inc("successCount", 1));
    }

    @Override
    public void incrementScheduledJobErrorCount(String id) {
        updateScheduled("increment errorCount", id, new Update().inc("errorCount", 1));
    }

    @Override
    public String saveGeneratedContent(GeneratedContent content) {
        Objects.requireNonNull(content, "content must not be null");
        GeneratedContentDocument doc = new GeneratedContentDocument();
        doc.setScheduledJobId(content.scheduledJobId());
        doc.setTemplateRef(content.templateRef());
        doc.setUserContext(content.userContext());
        doc.setContent(content.content());
        doc.setMetadata(toMap(content.metadata()));
        doc.setCreatedAt(content.createdAt());
        return run("save generated content", () -> mongoTemplate.insert(doc).getId());
    }

    // ---- queue ----

    @Override
    public List<QueueJob> getQueueJobs(QueueJobStatus status, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        Query q = status == null ? new Query() : new Query(Criteria.where("status").is(status.value()));
        q.with(Sort.by(Sort.Order.desc("createdAt"))).limit(limit);
        List<QueueJobDocument> docs = run("list queue jobs", () -> mongoTemplate.find(q, QueueJobDocument.class));
        return readEach(docs, MongoJobStore::readQueueJob);
    }

    public Optional<QueueJob> findQueueJob(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return run("find queue job", () ->
                Optional.ofNullable(mongoTemplate.findById(id, QueueJobDocument.class)))
                .map(MongoJobStore::readQueueJob);
    }

    /**
     * Atomically claims the next pending job.
     *
     * <p>A job is claimable when:
     * <ul>
     *   <li>{@code status == pending}</li>
     *   <li>and {@code availableAt} is absent or {@code availableAt <= now}</li>
     * </ul>
     * Highest priority first, then oldest.
     */
    @Override
    public Optional<QueueJob> claimNextPending(Instant now) {
        Objects.requireNonNull(now, "now must not be null");

        Query q = new Query(
                Criteria.where("status").is(QueueJobStatus.PENDING.value())
                        .orOperator(
                                Criteria.where("availableAt").is(null),
                                Criteria.where("availableAt").lte(now)
                        )
        );
        q.with(Sort.by(Sort.Order.desc("priority"), Sort.Order.asc("createdAt")));

        Update claim = new Update()
                .set("status", QueueJobStatus.PROCESSING.value())
                .set("processedAt", now)
                .inc("attempts", 1);

        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true);
        return run("claim queue job", () ->
                Optional.ofNullable(mongoTemplate.findAndModify(q, claim, options, QueueJobDocument.class)))
                .map(MongoJobStore::readQueueJob);
    }

    @Override
    public void updateQueueJob(String id, QueueJobUpdate update) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(update, "update must not be null");

        Update u = new Update().set("status", update.status().value());
        switch (update.status()) {
            case COMPLETED -> {
                u.set("completedAt", update.completedAt()).unset("error");
                if (update.result() != null) {
                    u.set("result", toMap(update.result()));
                }
            }
            case PENDING -> u.set("error", update.error())
                    .set("availableAt", update.availableAt())
                    .unset("failedAt");
            case FAILED -> u.set("error", update.error()).set("failedAt", update.failedAt());
            default -> {
            }
        }

        UpdateResult r = run("update queue job", () -> mongoTemplate.updateFirst(byId(id), u, QueueJobDocument.class));
        if (r.getMatchedCount() == 0) {
            throw new StoreException("Queue job not found: " + id);
        }
    }

    @Override
    public QueueJob createQueueJob(NewQueueJob job) {
        Objects.requireNonNull(job, "job must not be null");
        Instant now = clock.instant();

        QueueJobDocument doc = new QueueJobDocument();
        doc.setType(job.type().value());
        doc.setData(toMap(job.data()));
        doc.setPriority(job.priority());
        doc.setStatus(QueueJobStatus.PENDING.value());
        doc.setAttempts(0);
        doc.setMaxAttempts(job.maxAttempts());
        doc.setCreatedAt(now);
        doc.setAvailableAt(now);

        return readQueueJob(run("create queue job", () -> mongoTemplate.insert(doc)));
    }

    @Override
    public long requeueFailedQueueJobs() {
        Query q = new Query(Criteria.where("status").is(QueueJobStatus.FAILED.value()));
        Update u = new Update()
                .set("status", QueueJobStatus.PENDING.value())
                .set("attempts", 0)
                .set("availableAt", clock.instant())
                .unset("error")
                .unset("failedAt");
        return run("requeue failed jobs", () -> mongoTemplate.updateMulti(q, u, QueueJobDocument.class).getModifiedCount());
    }

    /**
     * Each stale job is released with its own conditional update, so a job that a live worker
     * finishes in the meantime is left alone.
     */
    @Override
    public long releaseStaleQueueJobs(Instant processedBefore, int defaultMaxAttempts) {
        Objects.requireNonNull(processedBefore, "processedBefore must not be null");
        Criteria stale = Criteria.where("status").is(QueueJobStatus.PROCESSING.value())
                .and("processedAt").lt(processedBefore);

        return run("release stale jobs", () -> {
            Instant now = clock.instant();
            long released = 0;
            for (QueueJobDocument doc : mongoTemplate.find(new Query(stale), QueueJobDocument.class)) {
                Update u = new Update();
                int maxAttempts = doc.getMaxAttempts() > 0 ? doc.getMaxAttempts() : defaultMaxAttempts;
                if (doc.getAttempts() >= maxAttempts) {
                    u.set("status", QueueJobStatus.FAILED.value())
                            .set("error", "Abandoned while processing")
                            .set("failedAt", now);
                } else {
                    u.set("status", QueueJobStatus.PENDING.value()).set("availableAt", now);
                }
                Query guard = new Query(Criteria.where("_id").is(doc.getId())
                        .and("status").is(QueueJobStatus.PROCESSING.value())
                        .and("processedAt").is(doc.getProcessedAt()));
                released += mongoTemplate.updateFirst(guard, u, QueueJobDocument.class).getModifiedCount();
            }
            return released;
        });
    }

    @Override
    public long deleteQueueJobsFinishedBefore(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        Query q = new Query(new Criteria().orOperator(
                Criteria.where("status").is(QueueJobStatus.COMPLETED.value()).and("completedAt").lt(cutoff),
                Criteria.where("status").is(QueueJobStatus.FAILED.value()).and("failedAt").lt(cutoff)
        ));
        return run("delete finished jobs", () -> mongoTemplate.remove(q, QueueJobDocument.class).getDeletedCount());
    }

    @Override
    public QueueMetrics getQueueMetrics() {
        return run("queue metrics", () -> {
            long pending = countByStatus(QueueJobStatus.PENDING);
            long processing = countByStatus(QueueJobStatus.PROCESSING);
            long completed = countByStatus(QueueJobStatus.COMPLETED);
            long failed = countByStatus(QueueJobStatus.FAILED);
            long total = mongoTemplate.count(new Query(), QueueJobDocument.class);
            return new QueueMetrics(pending, processing, completed, failed, total, 0);
        });
    }

    // ---- helpers ----

    private long countByStatus(QueueJobStatus status) {
        return mongoTemplate.count(new Query(Criteria.where("status").is(status.value())), QueueJobDocument.class);
    }

    private void updateScheduled(String op, String id, Update update) {
        Objects.requireNonNull(id, "id must not be null");
        UpdateResult r = run(op, () -> mongoTemplate.updateFirst(byId(id), update, ScheduledJobDocument.class));
        if (r.getMatchedCount() == 0) {
            log.debug("pulse store {} matched no scheduled job id={}", op, id);
        }
    }

    private <T> T run(String op, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StoreException("Mongo " + op + " failed: " + e.getMessage(), e);
        }
    }

    // a document that no longer maps is logged and left out of the listing
    private static <D, T> List<T> readEach(List<D> docs, Function<D, T> reader) {
        List<T> out = new ArrayList<>(docs.size());
        for (D doc : docs) {
            try {
                out.add(reader.apply(doc));
            } catch (StoreException e) {
                log.warn("pulse store skipped unreadable document msg={}", e.getMessage());
            }
        }
        return out;
    }

    private static ScheduledJob readScheduledJob(ScheduledJobDocument doc) {
        try {
            return toScheduledJob(doc);
        } catch (RuntimeException e) {
            throw new StoreException("Unreadable scheduled job id=" + doc.getId() + ": " + e.getMessage(), e);
        }
    }

    private static QueueJob readQueueJob(QueueJobDocument doc) {
        try {
            return toQueueJob(doc);
        } catch (RuntimeException e) {
            throw new StoreException("Unreadable queue job id=" + doc.getId() + ": " + e.getMessage(), e);
        }
    }

    private Map<String, Object> toMap(Map<String, Object> source) {
        if (source == null) {
            return null;
        }
        return objectMapper.convertValue(source, new TypeReference<>() {
        });
    }

    private static Query byId(String id) {
        return new Query(Criteria.where("_id").is(id));
    }

    private ScheduledJobDocument toDocument(ScheduledJob job) {
        ScheduledJobDocument doc = new ScheduledJobDocument();
        doc.setId(job.id());
        doc.setName(job.name());
        doc.setCronExpression(job.cronExpression());
        doc.setTimezone(job.timezone());
        doc.setActive(job.active());
        doc.setTemplateRef(job.templateRef());
        doc.setUserContext(job.userContext());
        doc.setVariables(toMap(job.variables()));
        doc.setNextRun(job.nextRun());
        doc.setLastRun(job.lastRun());
        doc.setLastStatus(job.lastStatus() == null ? null : job.lastStatus().value());
        doc.setLastError(job.lastError());
        doc.setTotalRuns(job.totalRuns());
        doc.setSuccessCount(job.successCount());
        doc.setErrorCount(job.errorCount());
        return doc;
    }

    static ScheduledJob toScheduledJob(ScheduledJobDocument doc) {
        return ScheduledJob.builder(doc.getId())
                .name(doc.getName())
                .cronExpression(doc.getCronExpression())
                .timezone(doc.getTimezone())
                .active(doc.isActive())
                .templateRef(doc.getTemplateRef())
                .userContext(doc.getUserContext())
                .variables(doc.getVariables())
                .nextRun(doc.getNextRun())
                .lastRun(doc.getLastRun())
                .lastStatus(RunStatus.fromValue(doc.getLastStatus()))
                .lastError(doc.getLastError())
                .totalRuns(doc.getTotalRuns())
                .successCount(doc.getSuccessCount())
                .errorCount(doc.getErrorCount())
                .build();
    }

    static QueueJob toQueueJob(QueueJobDocument doc) {
        return QueueJob.builder(doc.getId())
                .type(doc.getType())
                .data(doc.getData())
                .priority(doc.getPriority())
                .status(QueueJobStatus.fromValue(doc.getStatus()))
                .attempts(doc.getAttempts())
                .maxAttempts(doc.getMaxAttempts())
                .error(doc.getError())
                .result(doc.getResult())
                .createdAt(doc.getCreatedAt())
                .processedAt(doc.getProcessedAt())
                .completedAt(doc.getCompletedAt())
                .failedAt(doc.getFailedAt())
                .availableAt(doc.getAvailableAt())
                .build();
    }
}
