package io.remind4j.engine;

import io.remind4j.core.Schedule;
import io.remind4j.core.ScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * Claims due schedules one at a time, oldest due first.
 *
 * <p>Claiming marks the row in flight for this worker, so an overlapping pass cannot select it
 * until it is written back or its lock expires. A row is claimed only right before it is delivered:
 * the lock has to outlive one delivery, never a whole batch.
 */
public class DueScheduleSelector {
    private static final Logger log = LoggerFactory.getLogger(DueScheduleSelector.class);

    private final ScheduleStore store;
    private final int maxPerPass;
    private final Duration lockLifetime;
    private final String workerId;

    public DueScheduleSelector(ScheduleStore store, int maxPerPass, Duration lockLifetime, String workerId) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.lockLifetime = Objects.requireNonNull(lockLifetime, "lockLifetime must not be null");
        this.workerId = Objects.requireNonNull(workerId, "workerId must not be null");
        if (maxPerPass <= 0) {
            throw new IllegalArgumentException("maxPerPass must be a positive number");
        }
        this.maxPerPass = maxPerPass;
    }

    /**
     * The schedules due at {@code now}, oldest due first, at most {@code maxPerPass} of them.
     *
     * <p>Lazy: each row is claimed by {@link Iterator#hasNext()} when the caller is ready for it, and
     * a row returned once is not returned again by the same sequence, even if its write-back left it due.
     */
    public Iterable<Schedule> selectDue(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        return () -> new Iterator<>() {
            private final Set<String> handled = new HashSet<>();
            private Schedule next;
            private boolean exhausted;

            @Override
            public boolean hasNext() {
                if (next != null) {
                    return true;
                }
                if (exhausted || handled.size() >= maxPerPass) {
                    return false;
                }
                List<Schedule> claimed = store.claimDue(now, 1, lockLifetime, workerId, handled);
                if (claimed.isEmpty()) {
                    exhausted = true;
                    return false;
                }
                next = claimed.get(0);
                handled.add(next.id());
                log.debug("remind claimed schedule id={} nextRun={} lockUntil={}", next.id(), next.nextRun(), next.lockUntil());
                return true;
            }

            @Override
            public Schedule next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Schedule out = next;
                next = null;
                return out;
            }
        };
    }

    /**
     * Upper bound on claims per pass; what is left waits for the next pass.
     */
    public int maxPerPass() {
        return maxPerPass;
    }

    public String workerId() {
        return workerId;
    }
}
