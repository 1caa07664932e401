package io.remind4j.core;

import java.time.Instant;

public record ScheduleStats(
        long total,
        long active,
        long inactive,
        Instant oldestCreatedAt,
        Instant newestCreatedAt
) {
}
