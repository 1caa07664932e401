package io.remind4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable storage for schedules.
 *
 * <p>Implementations wrap driver failures in {@link ScheduleStoreException}.
 * The engine never deletes rows; {@link #purgeInactive(Instant)} is an explicit housekeeping call.
 */
public interface ScheduleStore {

    /**
     * Insert a validated schedule.
     *
     * @return the store-assigned id
     */
    String insert(NewSchedule schedule);

    Optional<Schedule> findById(String id);

    /**
     * List schedules ordered by {@code nextRun} ascending.
     *
     * @param recipientId     null for every recipient
     * @param includeInactive false to return active schedules only
     */
    List<Schedule> find(String recipientId, boolean includeInactive);

    /**
     * Atomically claims at most {@code limit} due schedules, oldest {@code nextRun} first.
     *
     * <p>A schedule is claimable when it is active, {@code nextRun <= now}, and it is not locked
     * or its lock has expired. Each claim marks the row in flight for {@code lockLifetime}.
     * Nothing is written when nothing is due.
     */
    default List<Schedule> claimDue(Instant now, int limit, Duration lockLifetime, String workerId) {
        return claimDue(now, limit, lockLifetime, workerId, Set.of());
    }

    /**
     * Same as {@link #claimDue(Instant, int, Duration, String)}, skipping the schedules in
     * {@code excludeIds}, typically the ones a pass has already handled.
     */
    List<Schedule> claimDue(Instant now, int limit, Duration lockLifetime, String workerId, Set<String> excludeIds);

    /**
     * Writes the post-attempt state and releases the in-flight lock in one update.
     *
     * @return false when the row is no longer locked by {@code workerId} (stale write-back)
     */
    boolean applyUpdate(ScheduleUpdate update, String workerId);

    /**
     * Marks a schedule inactive and drops any in-flight lock, so a write-back from a pass that
     * was delivering it at the time is rejected as stale.
     */
    CancelResult deactivate(String id);

    /**
     * Hard delete inactive schedules created before {@code createdBefore}.
     *
     * @return deleted count
     */
    long purgeInactive(Instant createdBefore);

    ScheduleStats stats();
}
