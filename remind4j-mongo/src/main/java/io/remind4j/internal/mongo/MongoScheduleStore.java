package io.remind4j.internal.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.result.UpdateResult;
import io.remind4j.core.CancelResult;
import io.remind4j.core.NewSchedule;
import io.remind4j.core.Schedule;
import io.remind4j.core.ScheduleStats;
import io.remind4j.core.ScheduleStore;
import io.remind4j.core.ScheduleStoreException;
import io.remind4j.core.ScheduleUpdate;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * MongoDB persistence layer for schedules.
 *
 * <p>Claims use {@code findAndModify} so concurrent passes never hand the same row to two workers
 * while its lock is live. Write-backs are conditional on {@code lockedBy} and release the lock.
 */
public class MongoScheduleStore implements ScheduleStore {

    private final MongoTemplate mongoTemplate;

    public MongoScheduleStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public String insert(NewSchedule schedule) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        ScheduleDocument doc = toDocument(schedule);
        return execute("insert", () -> mongoTemplate.insert(doc).getId());
    }

    private static ScheduleDocument toDocument(NewSchedule s) {
        ScheduleDocument doc = new ScheduleDocument();
        doc.setRecipientId(s.recipientId());
        doc.setMessage(s.message());
        doc.setKind(s.kind());
        doc.setSpec(s.spec());
        doc.setStartAt(s.startAt());
        doc.setNextRun(s.nextRun());
        doc.setActive(true);
        doc.setMaxRepetitions(s.maxRepetitions());
        doc.setRepetitionCount(0);
        doc.setCreatedAt(s.createdAt());
        doc.setConsecutiveFailures(0);
        return doc;
    }

    /**
     * Converts a persisted {@link ScheduleDocument} into the engine's {@link Schedule}.
     */
    static Schedule toSchedule(ScheduleDocument doc) {
        return new Schedule(
                doc.getId(),
                doc.getRecipientId(),
                doc.getMessage(),
                doc.getKind(),
                doc.getSpec(),
                doc.getStartAt(),
                doc.getNextRun(),
                doc.isActive(),
                doc.getMaxRepetitions(),
                doc.getRepetitionCount(),
                doc.getLastRun(),
                doc.getCreatedAt(),
                doc.getConsecutiveFailures(),
                doc.getLastError(),
                doc.getLockedBy(),
                doc.getLockUntil()
        );
    }

    @Override
    public Optional<Schedule> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        ScheduleDocument doc = execute("findById", () -> mongoTemplate.findById(id, ScheduleDocument.class));
        return Optional.ofNullable(doc).map(MongoScheduleStore::toSchedule);
    }

    @Override
    public List<Schedule> find(String recipientId, boolean includeInactive) {
        Query q = new Query();
        if (!isBlank(recipientId)) {
            q.addCriteria(Criteria.where("recipientId").is(recipientId));
        }
        if (!includeInactive) {
            q.addCriteria(Criteria.where("active").is(true));
        }
        q.with(Sort.by(Sort.Order.asc("nextRun"), Sort.Order.asc("createdAt")));

        List<ScheduleDocument> docs = execute("find", () -> mongoTemplate.find(q, ScheduleDocument.class));
        List<Schedule> out = new ArrayList<>(docs.size());
        for (ScheduleDocument d : docs) {
            out.add(toSchedule(d));
        }
        return out;
    }

    /**
     * Atomically claims (locks) at most {@code limit} due schedules.
     *
     * <p>A schedule is due when it is active, {@code nextRun <= now}, and it is not locked or its
     * lock has expired: {@code lockUntil == null || lockUntil <= now}.
     */
    @Override
    public List<Schedule> claimDue(Instant now, int limit, Duration lockLifetime, String workerId,
                                   Set<String> excludeIds) {
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(excludeIds, "excludeIds must not be null");
        Objects.requireNonNull(lockLifetime, "lockLifetime must not be null");
        if (limit <= 0) {
            return List.of();
        }
        if (lockLifetime.isZero() || lockLifetime.isNegative()) {
            throw new IllegalArgumentException("lockLifetime must be a positive duration");
        }
        if (isBlank(workerId)) {
            throw new IllegalArgumentException("workerId must not be blank");
        }

        Query dueQuery = new Query(
                Criteria.where("active").is(true)
                        .and("nextRun").ne(null).lte(now)
                        .orOperator(
                                Criteria.where("lockUntil").is(null),
                                Criteria.where("lockUntil").lte(now)
                        )
        );
        if (!excludeIds.isEmpty()) {
            dueQuery.addCriteria(Criteria.where("_id").nin(excludeIds));
        }
        dueQuery.with(Sort.by(Sort.Order.asc("nextRun")));

        Update lockUpdate = new Update()
                .set("lockedAt", now)
                .set("lockUntil", now.plus(lockLifetime))
                .set("lockedBy", workerId);

        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true);

        List<Schedule> claimed = new ArrayList<>(Math.min(limit, 64));
        for (int i = 0; i < limit; i++) {
            ScheduleDocument doc = execute("claimDue",
                    () -> mongoTemplate.findAndModify(dueQuery, lockUpdate, options, ScheduleDocument.class));
            if (doc == null) {
                break;
            }
            claimed.add(toSchedule(doc));
        }
        return claimed;
    }

    @Override
    public boolean applyUpdate(ScheduleUpdate update, String workerId) {
        Objects.requireNonNull(update, "update must not be null");
        Objects.requireNonNull(workerId, "workerId must not be null");

        Query q = new Query(
                Criteria.where("_id").is(update.id())
                        // Prevent stale write-back if another worker already re-claimed this schedule.
                        .and("lockedBy").is(workerId)
        );

        Update u = new Update()
                .set("active", update.active())
                .set("repetitionCount", update.repetitionCount())
                .set("consecutiveFailures", update.consecutiveFailures())
                .unset("lockedAt")
                .unset("lockUntil")
                .unset("lockedBy");

        setOrUnset(u, "nextRun", update.nextRun());
        setOrUnset(u, "lastRun", update.lastRun());
        setOrUnset(u, "lastError", update.lastError());

        UpdateResult r = execute("applyUpdate", () -> mongoTemplate.updateFirst(q, u, ScheduleDocument.class));
        return r.getMatchedCount() > 0;
    }

    /**
     * Disable (cancel) one schedule. Keeps the document for history and clears its lock, so a pass
     * still delivering it cannot write it back as active.
     */
    @Override
    public CancelResult deactivate(String id) {
        Objects.requireNonNull(id, "id must not be null");

        Query activeById = new Query(Criteria.where("_id").is(id).and("active").is(true));
        UpdateResult r = execute("deactivate",
                () -> mongoTemplate.updateFirst(activeById, new Update()
                        .set("active", false)
                        .unset("lockedAt")
                        .unset("lockUntil")
                        .unset("lockedBy"), ScheduleDocument.class));
        if (r.getModifiedCount() > 0) {
            return CancelResult.CANCELLED;
        }

        boolean exists = execute("deactivate",
                () -> mongoTemplate.exists(new Query(Criteria.where("_id").is(id)), ScheduleDocument.class));
        return exists ? CancelResult.ALREADY_INACTIVE : CancelResult.NOT_FOUND;
    }

    /**
     * Hard delete inactive schedules created before {@code createdBefore}.
     */
    @Override
    public long purgeInactive(Instant createdBefore) {
        Objects.requireNonNull(createdBefore, "createdBefore must not be null");
        Query q = new Query(Criteria.where("active").is(false).and("createdAt").lt(createdBefore));
        return execute("purgeInactive", () -> mongoTemplate.remove(q, ScheduleDocument.class)).getDeletedCount();
    }

    @Override
    public ScheduleStats stats() {
        long total = execute("stats", () -> mongoTemplate.count(new Query(), ScheduleDocument.class));
        long active = execute("stats",
                () -> mongoTemplate.count(new Query(Criteria.where("active").is(true)), ScheduleDocument.class));
        return new ScheduleStats(total, active, total - active,
                createdAtEdge(Sort.Direction.ASC), createdAtEdge(Sort.Direction.DESC));
    }

    private Instant createdAtEdge(Sort.Direction direction) {
        Query q = new Query().with(Sort.by(direction, "createdAt")).limit(1);
        q.fields().include("createdAt");
        ScheduleDocument doc = execute("stats", () -> mongoTemplate.findOne(q, ScheduleDocument.class));
        return doc == null ? null : doc.getCreatedAt();
    }

    private static void setOrUnset(Update u, String field, Object value) {
        if (value != null) {
            u.set(field, value);
        } else {
            u.unset(field);
        }
    }

    private static <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | MongoException ex) {
            throw new ScheduleStoreException("schedule store " + operation + " failed: " + ex.getMessage(), ex);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
