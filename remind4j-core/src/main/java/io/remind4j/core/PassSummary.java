package io.remind4j.core;

import java.util.List;

/**
 * Counts of one execution pass, with the per-schedule detail behind them.
 *
 * delivered   : deliveries that succeeded
 * failed      : permanent failures, escalated transient failures and integrity errors
 * rescheduled : transient failures left due for the next pass
 */
public record PassSummary(
        int delivered,
        int failed,
        int rescheduled,
        List<ScheduleOutcome> outcomes
) {

    public PassSummary {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public static PassSummary empty() {
        return new PassSummary(0, 0, 0, List.of());
    }

    public static PassSummary of(List<ScheduleOutcome> outcomes) {
        int delivered = 0;
        int failed = 0;
        int rescheduled = 0;
        for (ScheduleOutcome o : outcomes) {
            switch (o.status()) {
                case DELIVERED -> delivered++;
                case FAILED -> failed++;
                case RESCHEDULED -> rescheduled++;
            }
        }
        return new PassSummary(delivered, failed, rescheduled, outcomes);
    }

    public int total() {
        return delivered + failed + rescheduled;
    }
}
