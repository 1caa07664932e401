package io.remind4j.core;

import java.time.Instant;

/**
 * Validated schedule produced by {@code ScheduleBuilder.build()}, ready to insert.
 * This is a pure data object with no persistence logic.
 */
public record NewSchedule(
        String recipientId,
        String message,
        ScheduleKind kind,
        String spec,
        Instant startAt,
        Integer maxRepetitions,
        Instant nextRun,
        Instant createdAt
) {
}
