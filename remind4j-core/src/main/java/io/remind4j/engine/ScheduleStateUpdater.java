package io.remind4j.engine;

import io.remind4j.core.Schedule;
import io.remind4j.core.ScheduleKind;
import io.remind4j.core.ScheduleStore;
import io.remind4j.core.ScheduleUpdate;
import io.remind4j.delivery.DeliveryOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Decides a schedule's state after a delivery attempt and writes it through the store.
 *
 * <ul>
 *   <li>DELIVERED: ONCE ends; CRON moves to its next occurrence; INTERVAL counts the repetition
 *       and either ends at its cap or moves on by one interval</li>
 *   <li>PERMANENT_FAILURE: every kind ends</li>
 *   <li>TRANSIENT_FAILURE: every kind keeps its next run so the next pass retries it, until the
 *       configured streak of consecutive transient failures is reached</li>
 * </ul>
 */
public class ScheduleStateUpdater {
    private static final Logger log = LoggerFactory.getLogger(ScheduleStateUpdater.class);

    private final ScheduleStore store;
    private final int maxConsecutiveTransientFailures;

    public ScheduleStateUpdater(ScheduleStore store, int maxConsecutiveTransientFailures) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        if (maxConsecutiveTransientFailures < 0) {
            throw new IllegalArgumentException("maxConsecutiveTransientFailures must not be negative");
        }
        this.maxConsecutiveTransientFailures = maxConsecutiveTransientFailures;
    }

    /**
     * Computes the new state without writing it.
     *
     * @throws io.remind4j.core.ScheduleIntegrityException if the next run of a recurring schedule cannot be computed
     */
    public ScheduleUpdate advance(Schedule schedule, DeliveryOutcome outcome, Instant now) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        Instant at = Objects.requireNonNull(now, "now must not be null").truncatedTo(ChronoUnit.SECONDS);

        return switch (outcome.status()) {
            case DELIVERED -> delivered(schedule, at);
            case PERMANENT_FAILURE -> new ScheduleUpdate(
                    schedule.id(),
                    false,
                    schedule.nextRun(),
                    schedule.repetitionCount(),
                    at,
                    schedule.consecutiveFailures() + 1,
                    outcome.reason()
            );
            case TRANSIENT_FAILURE -> transientFailure(schedule, outcome, at);
        };
    }

    private ScheduleUpdate delivered(Schedule schedule, Instant now) {
        if (schedule.kind() == ScheduleKind.ONCE) {
            return new ScheduleUpdate(schedule.id(), false, schedule.nextRun(), schedule.repetitionCount(),
                    now, 0, null);
        }

        int count = schedule.repetitionCount() + 1;
        if (schedule.kind() == ScheduleKind.INTERVAL
                && schedule.hasRepetitionCap()
                && count >= schedule.maxRepetitions()) {
            log.info("remind schedule completed repetitions id={} count={} max={}",
                    schedule.id(), count, schedule.maxRepetitions());
            return new ScheduleUpdate(schedule.id(), false, schedule.nextRun(), count, now, 0, null);
        }

        Instant next = NextRunCalculator.nextAfterDelivery(schedule, count, now).orElse(null);
        return new ScheduleUpdate(schedule.id(), next != null, next != null ? next : schedule.nextRun(),
                count, now, 0, null);
    }

    private ScheduleUpdate transientFailure(Schedule schedule, DeliveryOutcome outcome, Instant now) {
        int streak = schedule.consecutiveFailures() + 1;
        if (maxConsecutiveTransientFailures > 0 && streak >= maxConsecutiveTransientFailures) {
            log.warn("remind schedule gave up after consecutive transient failures id={} streak={} max={}",
                    schedule.id(), streak, maxConsecutiveTransientFailures);
            return new ScheduleUpdate(schedule.id(), false, schedule.nextRun(), schedule.repetitionCount(),
                    now, streak, "gave up after " + streak + " consecutive transient failures: " + outcome.reason());
        }
        return new ScheduleUpdate(schedule.id(), true, schedule.nextRun(), schedule.repetitionCount(),
                now, streak, outcome.reason());
    }

    /**
     * State for a schedule whose stored spec can no longer be evaluated: deactivated with the reason.
     */
    public ScheduleUpdate integrityFailure(Schedule schedule, String reason, Instant now) {
        return new ScheduleUpdate(
                schedule.id(),
                false,
                schedule.nextRun(),
                schedule.repetitionCount(),
                now.truncatedTo(ChronoUnit.SECONDS),
                schedule.consecutiveFailures(),
                reason
        );
    }

    /**
     * Writes {@code update} and releases the in-flight lock held by {@code workerId}.
     *
     * @return false when the lock was lost and the write was skipped
     */
    public boolean write(ScheduleUpdate update, String workerId) {
        boolean written = store.applyUpdate(update, workerId);
        if (!written) {
            log.warn("remind stale write-back skipped id={} workerId={}", update.id(), workerId);
        }
        return written;
    }

    /**
     * {@link #advance} followed by {@link #write}.
     */
    public ScheduleUpdate apply(Schedule schedule, DeliveryOutcome outcome, Instant now, String workerId) {
        ScheduleUpdate update = advance(schedule, outcome, now);
        write(update, workerId);
        return update;
    }
}
