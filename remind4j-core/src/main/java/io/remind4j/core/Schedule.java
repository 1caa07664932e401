package io.remind4j.core;

import java.time.Instant;

/**
 * Persisted schedule as seen by the engine.
 *
 * <p>{@code lockedBy} and {@code lockUntil} are set only while a pass has the row in flight.
 */
public record Schedule(

        // identity
        String id,
        String recipientId,
        String message,

        // scheduling
        ScheduleKind kind,
        String spec,
        Instant startAt,
        Instant nextRun,
        boolean active,

        // repetition
        Integer maxRepetitions,
        int repetitionCount,

        // bookkeeping
        Instant lastRun,
        Instant createdAt,
        int consecutiveFailures,
        String lastError,

        // in-flight marker
        String lockedBy,
        Instant lockUntil
) {

    public boolean isDue(Instant now) {
        return active && nextRun != null && !nextRun.isAfter(now);
    }

    public boolean hasRepetitionCap() {
        return maxRepetitions != null;
    }
}
