package io.remind4j;

import io.remind4j.core.CancelResult;
import io.remind4j.core.CreateResult;
import io.remind4j.core.PassSummary;
import io.remind4j.core.Schedule;
import io.remind4j.core.ScheduleKind;
import io.remind4j.core.ScheduleStats;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Main scheduling API.
 *
 * <p>Supports three schedule kinds:
 * <ul>
 *   <li>Once: a single delivery at an absolute time</li>
 *   <li>Cron: a 5-field cron recurrence, evaluated in UTC</li>
 *   <li>Interval: a fixed repeat interval, optionally gated by a start time and capped by a repetition count</li>
 * </ul>
 */
public interface Reminders {

    /**
     * Start executing due schedules in the background. Idempotent.
     */
    void start();

    /**
     * Stop the background loop, letting the schedule in flight finish. Idempotent.
     */
    void stop();

    /**
     * Create a schedule builder. Nothing is stored until {@code save()} is called.
     */
    ScheduleBuilder create(String recipientId, String message);

    /**
     * Validate and store a schedule in one call.
     *
     * @param startAt        INTERVAL only; null for the first occurrence at now + interval
     * @param maxRepetitions INTERVAL only; null for unbounded
     */
    CreateResult create(String recipientId, String message, ScheduleKind kind, String spec,
                        Instant startAt, Integer maxRepetitions);

    CancelResult cancel(String scheduleId);

    /**
     * @param recipientId null for every recipient
     */
    List<Schedule> list(String recipientId, boolean includeInactive);

    /**
     * Process everything due now on the calling thread.
     */
    PassSummary runOnce();

    /**
     * Process due schedules every {@code interval} on the calling thread until {@link #stop()}.
     */
    void runLoop(Duration interval);

    /**
     * Delete inactive schedules created more than {@code age} ago.
     */
    long purgeInactive(Duration age);

    ScheduleStats stats();
}
