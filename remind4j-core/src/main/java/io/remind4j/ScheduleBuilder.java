package io.remind4j;

import io.remind4j.core.CreateResult;
import io.remind4j.core.NewSchedule;

import java.time.Instant;
import java.util.List;

/**
 * Fluent builder for a schedule before it is stored.
 *
 * <p>Note:
 * <ul>
 *   <li>validate(): every problem with the current settings, empty when valid</li>
 *   <li>build(): validated in-memory schedule</li>
 *   <li>save(): validate + insert; problems come back in the result instead of being thrown</li>
 * </ul>
 */
public interface ScheduleBuilder {

    /**
     * Deliver once at an absolute time.
     */
    ScheduleBuilder once(Instant time);

    /**
     * Deliver once at an ISO-8601 timestamp.
     */
    ScheduleBuilder once(String isoTimestamp);

    /**
     * Deliver on a 5-field cron expression (UTC).
     */
    ScheduleBuilder cron(String expression);

    /**
     * Deliver every interval, e.g. "30s", "5m", "1h" or "2 hours".
     */
    ScheduleBuilder every(String interval);

    /**
     * First occurrence of an interval schedule. Must be in the future.
     */
    ScheduleBuilder startAt(Instant startAt);

    /**
     * Total deliveries of an interval schedule before it ends.
     */
    ScheduleBuilder maxRepetitions(int maxRepetitions);

    List<String> validate();

    /**
     * @throws IllegalArgumentException listing every validation problem
     */
    NewSchedule build();

    CreateResult save();
}
