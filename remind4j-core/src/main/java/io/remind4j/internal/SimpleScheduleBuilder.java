package io.remind4j.internal;

import io.remind4j.ScheduleBuilder;
import io.remind4j.core.CreateResult;
import io.remind4j.core.NewSchedule;
import io.remind4j.core.ScheduleKind;
import io.remind4j.delivery.MessagingApiException;
import io.remind4j.engine.NextRunCalculator;
import io.remind4j.recipient.RecipientDirectory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Default {@link ScheduleBuilder} implementation.
 */
public class SimpleScheduleBuilder implements ScheduleBuilder {

    private final String recipientId;
    private final String message;
    private final Clock clock;
    private final Function<NewSchedule, String> inserter;
    private final RecipientDirectory directory;

    private ScheduleKind kind;
    private String spec;
    private int kindsSet;
    private Instant startAt;
    private Integer maxRepetitions;

    /**
     * @param directory recipients checked before saving; null skips the check
     */
    public SimpleScheduleBuilder(String recipientId, String message, Clock clock,
                                 Function<NewSchedule, String> inserter, RecipientDirectory directory) {
        this.recipientId = recipientId == null ? null : recipientId.trim();
        this.message = message;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.inserter = Objects.requireNonNull(inserter, "inserter must not be null");
        this.directory = directory;
    }

    @Override
    public ScheduleBuilder once(Instant time) {
        Objects.requireNonNull(time, "time must not be null");
        return kind(ScheduleKind.ONCE, time.truncatedTo(ChronoUnit.SECONDS).toString());
    }

    @Override
    public ScheduleBuilder once(String isoTimestamp) {
        Objects.requireNonNull(isoTimestamp, "isoTimestamp must not be null");
        return kind(ScheduleKind.ONCE, isoTimestamp.trim());
    }

    @Override
    public ScheduleBuilder cron(String expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        return kind(ScheduleKind.CRON, expression.trim().replaceAll("\\s+", " "));
    }

    @Override
    public ScheduleBuilder every(String interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        return kind(ScheduleKind.INTERVAL, interval.trim());
    }

    private ScheduleBuilder kind(ScheduleKind kind, String spec) {
        this.kind = kind;
        this.spec = spec;
        this.kindsSet++;
        return this;
    }

    @Override
    public ScheduleBuilder startAt(Instant startAt) {
        this.startAt = Objects.requireNonNull(startAt, "startAt must not be null");
        return this;
    }

    @Override
    public ScheduleBuilder maxRepetitions(int maxRepetitions) {
        this.maxRepetitions = maxRepetitions;
        return this;
    }

    @Override
    public List<String> validate() {
        return check(clock.instant().truncatedTo(ChronoUnit.SECONDS)).errors;
    }

    @Override
    public NewSchedule build() {
        Checked checked = check(clock.instant().truncatedTo(ChronoUnit.SECONDS));
        if (!checked.errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid schedule: " + String.join("; ", checked.errors));
        }
        return checked.schedule;
    }

    @Override
    public CreateResult save() {
        Checked checked = check(clock.instant().truncatedTo(ChronoUnit.SECONDS));
        if (!checked.errors.isEmpty()) {
            return CreateResult.rejected(checked.errors);
        }
        return CreateResult.created(inserter.apply(checked.schedule));
    }

    private Checked check(Instant now) {
        List<String> errors = new ArrayList<>(4);

        if (isBlank(recipientId)) {
            errors.add("recipientId is required");
        }
        if (isBlank(message)) {
            errors.add("message is required");
        }
        if (kindsSet == 0) {
            errors.add("one of once, cron or every is required");
            return new Checked(errors, null);
        }
        if (kindsSet > 1) {
            errors.add("only one of once, cron or every may be set");
            return new Checked(errors, null);
        }

        if (kind != ScheduleKind.INTERVAL) {
            if (startAt != null) {
                errors.add("startAt applies to interval schedules only");
            }
            if (maxRepetitions != null) {
                errors.add("maxRepetitions applies to interval schedules only");
            }
        } else {
            if (maxRepetitions != null && maxRepetitions <= 0) {
                errors.add("maxRepetitions must be a positive number");
            }
            if (startAt != null && !startAt.isAfter(now)) {
                errors.add("startAt must be in the future: " + startAt);
            }
        }

        Instant nextRun = firstRun(now, errors);

        if (errors.isEmpty() && directory != null) {
            checkRecipient(errors);
        }

        if (!errors.isEmpty()) {
            return new Checked(errors, null);
        }

        String storedSpec = kind == ScheduleKind.ONCE ? nextRun.toString() : spec;
        return new Checked(errors, new NewSchedule(
                recipientId,
                message,
                kind,
                storedSpec,
                startAt == null ? null : startAt.truncatedTo(ChronoUnit.SECONDS),
                maxRepetitions,
                nextRun,
                now
        ));
    }

    private Instant firstRun(Instant now, List<String> errors) {
        try {
            Optional<Instant> first = NextRunCalculator.firstRun(kind, spec, startAt, now);
            if (first.isEmpty()) {
                errors.add("cron expression has no future occurrence: " + spec);
                return null;
            }
            if (kind == ScheduleKind.ONCE && !first.get().isAfter(now)) {
                errors.add("once time must be in the future: " + spec);
                return null;
            }
            return first.get();
        } catch (IllegalArgumentException ex) {
            errors.add(ex.getMessage());
            return null;
        }
    }

    private void checkRecipient(List<String> errors) {
        try {
            if (!directory.exists(recipientId)) {
                errors.add("recipient not found: " + recipientId);
            }
        } catch (MessagingApiException ex) {
            errors.add("could not verify recipient " + recipientId + ": " + ex.getMessage());
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    private record Checked(List<String> errors, NewSchedule schedule) {
    }
}
