package io.pulse4j.config;

import io.pulse4j.internal.mongo.QueueJobDocument;
import io.pulse4j.internal.mongo.ScheduledJobDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for pulse4j.
 *
 * <p>Indexes are <b>not</b> created at startup unless {@code pulse.ensure-indexes-on-startup=true}.
 * In production they are usually managed by migrations or ops scripts.
 *
 * <h3>Collection {@code queue_jobs}</h3>
 * <ul>
 *   <li><b>idx_queue_claim</b>: { status: 1, priority: -1, createdAt: 1 }
 *       <br/>Used by the worker claim (pending filter, priority then age ordering).</li>
 *   <li><b>idx_queue_processed</b>: { status: 1, processedAt: 1 }
 *       <br/>Used by stale-claim release.</li>
 * </ul>
 *
 * <h3>Collection {@code scheduled_jobs}</h3>
 * <ul>
 *   <li><b>idx_scheduled_active</b>: { active: 1 }
 *       <br/>Used by every reconciliation poll.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.queue_jobs.createIndex({ status: 1, priority: -1, createdAt: 1 }, { name: "idx_queue_claim" });
 * db.queue_jobs.createIndex({ status: 1, processedAt: 1 }, { name: "idx_queue_processed" });
 * db.scheduled_jobs.createIndex({ active: 1 }, { name: "idx_scheduled_active" });
 * </pre>
 */
public class PulseMongoIndexConfig {

    public static final String IDX_QUEUE_CLAIM = "idx_queue_claim";
    public static final String IDX_QUEUE_PROCESSED = "idx_queue_processed";
    public static final String IDX_SCHEDULED_ACTIVE = "idx_scheduled_active";

    private final MongoTemplate mongoTemplate;

    public PulseMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(QueueJobDocument.class).ensureIndex(queueClaimIndex());
        mongoTemplate.indexOps(QueueJobDocument.class).ensureIndex(queueProcessedIndex());
        mongoTemplate.indexOps(ScheduledJobDocument.class).ensureIndex(scheduledActiveIndex());
    }

    public static Index queueClaimIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("priority", Sort.Direction.DESC)
                .on("createdAt", Sort.Direction.ASC)
                .named(IDX_QUEUE_CLAIM);
    }

    public static Index queueProcessedIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("processedAt", Sort.Direction.ASC)
                .named(IDX_QUEUE_PROCESSED);
    }

    public static Index scheduledActiveIndex() {
        return new Index()
                .on("active", Sort.Direction.ASC)
                .named(IDX_SCHEDULED_ACTIVE);
    }
}
