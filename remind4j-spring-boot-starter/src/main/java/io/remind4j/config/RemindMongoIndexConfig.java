package io.remind4j.config;

import io.remind4j.internal.mongo.ScheduleDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;

/**
 * MongoDB index definitions for the schedules collection.
 *
 * <p>Indexes are <b>not</b> created at startup unless {@code remind.ensure-indexes-on-startup=true}.
 * In production they are usually managed by migrations or ops scripts.
 *
 * <h3>Required indexes (collection: {@code schedules})</h3>
 * <ul>
 *   <li><b>idx_due_claim</b>: { active: 1, nextRun: 1, lockUntil: 1 }
 *       <br/>Used by claiming due schedules with lock filtering.</li>
 *   <li><b>idx_recipient_active</b>: { recipientId: 1, active: 1 }
 *       <br/>Used by listing a recipient's schedules.</li>
 *   <li><b>idx_active_created</b>: { active: 1, createdAt: 1 }
 *       <br/>Used by purging old inactive schedules.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.schedules.createIndex({ active: 1, nextRun: 1, lockUntil: 1 }, { name: "idx_due_claim" });
 * db.schedules.createIndex({ recipientId: 1, active: 1 }, { name: "idx_recipient_active" });
 * db.schedules.createIndex({ active: 1, createdAt: 1 }, { name: "idx_active_created" });
 * </pre>
 */
public class RemindMongoIndexConfig {

    public static final String IDX_DUE_CLAIM = "idx_due_claim";
    public static final String IDX_RECIPIENT_ACTIVE = "idx_recipient_active";
    public static final String IDX_ACTIVE_CREATED = "idx_active_created";

    private final MongoTemplate mongoTemplate;

    public RemindMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        IndexOperations ops = mongoTemplate.indexOps(ScheduleDocument.class);
        ops.ensureIndex(dueClaimIndex());
        ops.ensureIndex(recipientActiveIndex());
        ops.ensureIndex(activeCreatedIndex());
    }

    /**
     * Keys: active ASC, nextRun ASC, lockUntil ASC
     */
    public static Index dueClaimIndex() {
        return new Index()
                .on("active", Sort.Direction.ASC)
                .on("nextRun", Sort.Direction.ASC)
                .on("lockUntil", Sort.Direction.ASC)
                .named(IDX_DUE_CLAIM);
    }

    /**
     * Keys: recipientId ASC, active ASC
     */
    public static Index recipientActiveIndex() {
        return new Index()
                .on("recipientId", Sort.Direction.ASC)
                .on("active", Sort.Direction.ASC)
                .named(IDX_RECIPIENT_ACTIVE);
    }

    public static Index activeCreatedIndex() {
        return new Index()
                .on("active", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.ASC)
                .named(IDX_ACTIVE_CREATED);
    }
}
