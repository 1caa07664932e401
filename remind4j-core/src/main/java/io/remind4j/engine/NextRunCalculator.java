package io.remind4j.engine;

import io.remind4j.core.Schedule;
import io.remind4j.core.ScheduleIntegrityException;
import io.remind4j.core.ScheduleKind;
import io.remind4j.utils.ScheduleSpecParser;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes when a schedule is next due. Pure functions of their arguments; all results are UTC
 * instants truncated to whole seconds.
 */
public final class NextRunCalculator {

    private NextRunCalculator() {
    }

    /**
     * Next due time relative to {@code reference}.
     *
     * <ul>
     *   <li>ONCE: the parsed timestamp while nothing has run yet, empty afterwards</li>
     *   <li>CRON: earliest occurrence strictly after {@code reference}</li>
     *   <li>INTERVAL: {@code reference + interval}, empty once the repetition cap is reached</li>
     * </ul>
     *
     * @throws IllegalArgumentException if {@code spec} does not match the kind's grammar
     */
    public static Optional<Instant> computeNext(
            ScheduleKind kind,
            String spec,
            Instant reference,
            int repetitionCount,
            Integer maxRepetitions
    ) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(reference, "reference must not be null");

        return switch (kind) {
            case ONCE -> repetitionCount == 0
                    ? Optional.of(ScheduleSpecParser.parseInstant(spec))
                    : Optional.empty();
            case CRON -> ScheduleSpecParser.nextCronOccurrence(spec, reference)
                    .map(i -> i.truncatedTo(ChronoUnit.SECONDS));
            case INTERVAL -> {
                if (maxRepetitions != null && repetitionCount >= maxRepetitions) {
                    yield Optional.empty();
                }
                Duration d = ScheduleSpecParser.parseDuration(spec);
                yield Optional.of(addInterval(reference, d, spec));
            }
        };
    }

    /**
     * First due time of a schedule being created at {@code now}.
     * An INTERVAL with a future {@code startAt} first fires at {@code startAt}; otherwise at {@code now + interval}.
     */
    public static Optional<Instant> firstRun(ScheduleKind kind, String spec, Instant startAt, Instant now) {
        Instant base = now.truncatedTo(ChronoUnit.SECONDS);
        if (kind == ScheduleKind.INTERVAL && startAt != null && startAt.isAfter(base)) {
            ScheduleSpecParser.parseDuration(spec);
            return Optional.of(startAt.truncatedTo(ChronoUnit.SECONDS));
        }
        return computeNext(kind, spec, base, 0, null);
    }

    /**
     * Next due time after a successful delivery at {@code now}.
     *
     * <p>Cron is evaluated from the later of the previous due time and {@code now}. Interval keeps its
     * phase: it adds whole intervals to the previous due time until the result is after {@code now}.
     *
     * @param repetitionCount count including the delivery that just succeeded
     * @throws ScheduleIntegrityException if the stored spec cannot be evaluated or a cron never fires again
     */
    public static Optional<Instant> nextAfterDelivery(Schedule schedule, int repetitionCount, Instant now) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(now, "now must not be null");

        Instant previous = schedule.nextRun() != null ? schedule.nextRun() : now;
        try {
            return switch (schedule.kind()) {
                case ONCE -> Optional.empty();
                case CRON -> {
                    Optional<Instant> next = computeNext(ScheduleKind.CRON, schedule.spec(),
                            laterOf(previous, now), repetitionCount, null);
                    if (next.isEmpty()) {
                        throw new ScheduleIntegrityException(schedule.id(),
                                "cron expression has no future occurrence: " + schedule.spec());
                    }
                    yield next;
                }
                case INTERVAL -> computeNext(ScheduleKind.INTERVAL, schedule.spec(), previous,
                        repetitionCount, schedule.maxRepetitions())
                        .map(next -> skipPast(next, ScheduleSpecParser.parseDuration(schedule.spec()), now));
            };
        } catch (IllegalArgumentException ex) {
            throw new ScheduleIntegrityException(schedule.id(),
                    "stored " + schedule.kind() + " spec is invalid: " + ex.getMessage(), ex);
        }
    }

    // the result has to fit a stored date (epoch milliseconds)
    private static Instant addInterval(Instant reference, Duration interval, String spec) {
        try {
            Instant next = reference.plus(interval).truncatedTo(ChronoUnit.SECONDS);
            next.toEpochMilli();
            return next;
        } catch (DateTimeException | ArithmeticException ex) {
            throw new IllegalArgumentException("Interval too large: " + spec);
        }
    }

    private static Instant skipPast(Instant next, Duration interval, Instant now) {
        if (next.isAfter(now)) {
            return next;
        }
        long behind = Duration.between(next, now).getSeconds();
        long steps = behind / interval.getSeconds() + 1;
        return next.plusSeconds(steps * interval.getSeconds());
    }

    private static Instant laterOf(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }
}
