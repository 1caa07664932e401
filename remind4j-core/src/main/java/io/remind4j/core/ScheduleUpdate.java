package io.remind4j.core;

import java.time.Instant;

/**
 * Full post-attempt state of one schedule, written in a single conditional update.
 *
 * @param nextRun next due time; unchanged from the claimed row for transient failures
 */
public record ScheduleUpdate(
        String id,
        boolean active,
        Instant nextRun,
        int repetitionCount,
        Instant lastRun,
        int consecutiveFailures,
        String lastError
) {
}
