package io.sentinel.work.config;

import io.sentinel.work.internal.mongo.QueuedJobDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the work engine.
 *
 * <p>Indexes are <b>not</b> created automatically unless
 * {@code sentinel.work.ensure-indexes-on-startup=true}; in production they usually come from
 * migrations or ops scripts.
 *
 * <h3>Required indexes (collection: {@code work_jobs})</h3>
 * <ul>
 *   <li><b>idx_pending_claim</b>: { status: 1, priorityRank: 1, availableAt: 1, createdAt: 1 }
 *       <br/>Used when claiming due jobs in dispatch order.</li>
 *   <li><b>idx_lock_expiry</b>: { status: 1, lockUntil: 1 }
 *       <br/>Used when reclaiming jobs whose lock expired.</li>
 *   <li><b>idx_status_created</b>: { status: 1, createdAt: -1 }
 *       <br/>Used by status listings.</li>
 * </ul>
 *
 * <p>{@code work_completions} is keyed by item id and needs no extra index.
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.work_jobs.createIndex({ status: 1, priorityRank: 1, availableAt: 1, createdAt: 1 }, { name: "idx_pending_claim" });
 * db.work_jobs.createIndex({ status: 1, lockUntil: 1 }, { name: "idx_lock_expiry" });
 * db.work_jobs.createIndex({ status: 1, createdAt: -1 }, { name: "idx_status_created" });
 * </pre>
 */
public class WorkMongoIndexConfig {

    public static final String IDX_PENDING_CLAIM = "idx_pending_claim";
    public static final String IDX_LOCK_EXPIRY = "idx_lock_expiry";
    public static final String IDX_STATUS_CREATED = "idx_status_created";

    private final MongoTemplate mongoTemplate;

    public WorkMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Manually ensure required indexes. Not called on startup unless configured.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(QueuedJobDocument.class).ensureIndex(pendingClaimIndex());
        mongoTemplate.indexOps(QueuedJobDocument.class).ensureIndex(lockExpiryIndex());
        mongoTemplate.indexOps(QueuedJobDocument.class).ensureIndex(statusCreatedIndex());
    }

    public static Index pendingClaimIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("priorityRank", Sort.Direction.ASC)
                .on("availableAt", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.ASC)
                .named(IDX_PENDING_CLAIM);
    }

    public static Index lockExpiryIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("lockUntil", Sort.Direction.ASC)
                .named(IDX_LOCK_EXPIRY);
    }

    public static Index statusCreatedIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.DESC)
                .named(IDX_STATUS_CREATED);
    }
}
