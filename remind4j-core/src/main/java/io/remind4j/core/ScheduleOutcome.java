package io.remind4j.core;

import java.time.Instant;

/**
 * Per-schedule result of one pass.
 */
public record ScheduleOutcome(
        String scheduleId,
        String recipientId,
        Status status,
        String detail,
        Instant nextRun
) {

    public enum Status {
        DELIVERED,
        RESCHEDULED,
        FAILED
    }
}
