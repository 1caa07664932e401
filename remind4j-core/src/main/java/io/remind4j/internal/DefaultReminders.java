package io.remind4j.internal;

import io.remind4j.RemindOptions;
import io.remind4j.Reminders;
import io.remind4j.ScheduleBuilder;
import io.remind4j.core.CancelResult;
import io.remind4j.core.CreateResult;
import io.remind4j.core.PassSummary;
import io.remind4j.core.Schedule;
import io.remind4j.core.ScheduleKind;
import io.remind4j.core.ScheduleStats;
import io.remind4j.core.ScheduleStore;
import io.remind4j.delivery.DeliveryClient;
import io.remind4j.engine.DueScheduleSelector;
import io.remind4j.engine.ScheduleRunner;
import io.remind4j.engine.ScheduleStateUpdater;
import io.remind4j.recipient.RecipientDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Store-agnostic {@link Reminders} wiring the selector, delivery client, state updater and runner.
 *
 * <p>Typical usage:
 * <pre>{@code
 * reminders.create("agent-1", "ping")
 *          .cron("*&#47;15 * * * *")
 *          .save();
 *
 * reminders.start();
 * ...
 * reminders.stop();
 * }</pre>
 */
public class DefaultReminders implements Reminders {
    private static final Logger log = LoggerFactory.getLogger(DefaultReminders.class);

    private final ScheduleStore store;
    private final RemindOptions options;
    private final Clock clock;
    private final RecipientDirectory directory;
    private final ScheduleRunner runner;
    private final String workerId;

    /**
     * @param directory used to validate recipients when {@code options.validateRecipients()}; may be null
     */
    public DefaultReminders(ScheduleStore store, DeliveryClient deliveryClient, RemindOptions options,
                            Clock clock, RecipientDirectory directory) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(deliveryClient, "deliveryClient must not be null");
        if (options.validateRecipients() && directory == null) {
            throw new IllegalArgumentException("validateRecipients requires a RecipientDirectory");
        }
        this.directory = directory;
        this.workerId = resolveWorkerId(options.workerId());

        this.runner = new ScheduleRunner(
                new DueScheduleSelector(store, options.maxPerPass(), options.lockLifetime(), workerId),
                deliveryClient,
                new ScheduleStateUpdater(store, options.maxConsecutiveTransientFailures()),
                clock,
                options.processEvery(),
                options.lockLifetime()
        );
    }

    public DefaultReminders(ScheduleStore store, DeliveryClient deliveryClient, RemindOptions options) {
        this(store, deliveryClient, options, Clock.systemUTC(), null);
    }

    @Override
    public void start() {
        runner.start();
    }

    @Override
    public void stop() {
        runner.stop();
    }

    @Override
    public ScheduleBuilder create(String recipientId, String message) {
        return new SimpleScheduleBuilder(recipientId, message, clock, this::insert,
                options.validateRecipients() ? directory : null);
    }

    @Override
    public CreateResult create(String recipientId, String message, ScheduleKind kind, String spec,
                               Instant startAt, Integer maxRepetitions) {
        if (kind == null) {
            return CreateResult.rejected(List.of("schedule kind is required"));
        }
        if (spec == null || spec.isBlank()) {
            return CreateResult.rejected(List.of("schedule spec is required"));
        }

        ScheduleBuilder b = create(recipientId, message);
        switch (kind) {
            case ONCE -> b.once(spec);
            case CRON -> b.cron(spec);
            case INTERVAL -> b.every(spec);
        }
        if (startAt != null) {
            b.startAt(startAt);
        }
        if (maxRepetitions != null) {
            b.maxRepetitions(maxRepetitions);
        }
        return b.save();
    }

    private String insert(io.remind4j.core.NewSchedule schedule) {
        String id = store.insert(schedule);
        log.info("remind schedule created id={} recipient={} kind={} spec={} nextRun={} maxRepetitions={}",
                id, schedule.recipientId(), schedule.kind(), schedule.spec(), schedule.nextRun(),
                schedule.maxRepetitions());
        return id;
    }

    @Override
    public CancelResult cancel(String scheduleId) {
        if (scheduleId == null || scheduleId.isBlank()) {
            return CancelResult.NOT_FOUND;
        }
        CancelResult result = store.deactivate(scheduleId);
        log.info("remind schedule cancel id={} result={}", scheduleId, result);
        return result;
    }

    @Override
    public List<Schedule> list(String recipientId, boolean includeInactive) {
        String recipient = (recipientId == null || recipientId.isBlank()) ? null : recipientId.trim();
        return store.find(recipient, includeInactive);
    }

    @Override
    public PassSummary runOnce() {
        return runner.runOnce();
    }

    @Override
    public void runLoop(Duration interval) {
        runner.runLoop(interval);
    }

    @Override
    public long purgeInactive(Duration age) {
        Objects.requireNonNull(age, "age must not be null");
        if (age.isNegative()) {
            throw new IllegalArgumentException("age must not be negative");
        }
        Instant cutoff = clock.instant().minus(age);
        long deleted = store.purgeInactive(cutoff);
        log.info("remind purged inactive schedules count={} createdBefore={}", deleted, cutoff);
        return deleted;
    }

    @Override
    public ScheduleStats stats() {
        return store.stats();
    }

    public boolean isRunning() {
        return runner.isRunning();
    }

    public String workerId() {
        return workerId;
    }

    private static String resolveWorkerId(String configuredWorkerId) {
        if (configuredWorkerId != null && !configuredWorkerId.isBlank()) {
            return configuredWorkerId;
        }

        String host = "remind4j";
        try {
            host = java.net.InetAddress.getLocalHost().getHostName();
        } catch (java.io.IOException e) {
            log.debug("remind could not resolve host name for worker id msg={}", e.getMessage());
        }

        String pid = Long.toString(ProcessHandle.current().pid());
        String generated = host + "-" + pid + "-" + java.util.UUID.randomUUID();
        if (generated.length() > 128) {
            return generated.substring(0, 128);
        }
        return generated;
    }
}
