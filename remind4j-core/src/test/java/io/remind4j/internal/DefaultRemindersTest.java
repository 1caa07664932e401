package io.remind4j.internal;

import io.remind4j.RemindOptions;
import io.remind4j.core.CancelResult;
import io.remind4j.core.CreateResult;
import io.remind4j.core.Schedule;
import io.remind4j.core.ScheduleKind;
import io.remind4j.core.ScheduleStats;
import io.remind4j.delivery.DeliveryClient;
import io.remind4j.delivery.DeliveryOutcome;
import io.remind4j.recipient.RecipientDirectory;
import io.remind4j.recipient.RecipientInfo;
import io.remind4j.support.InMemoryScheduleStore;
import io.remind4j.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DefaultRemindersTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private final InMemoryScheduleStore store = new InMemoryScheduleStore();
    private final MutableClock clock = new MutableClock(NOW);
    private final DeliveryClient delivered = (recipient, message) -> DeliveryOutcome.delivered(1, false);
    private final DefaultReminders reminders = new DefaultReminders(store, delivered,
            RemindOptions.defaults().withWorkerId("test-worker"), clock, null);

    @Test
    void createWithKindShouldMapToBuilder() {
        CreateResult r = reminders.create("agent-1", "hello", ScheduleKind.INTERVAL, "10m",
                NOW.plusSeconds(60), 5);

        assertTrue(r.isCreated());
        Schedule s = store.get(r.scheduleId());
        assertEquals(ScheduleKind.INTERVAL, s.kind());
        assertEquals(NOW.plusSeconds(60), s.nextRun());
        assertEquals(5, s.maxRepetitions());
    }

    @Test
    void createWithoutKindOrSpecShouldBeRejected() {
        assertEquals(List.of("schedule kind is required"),
                reminders.create("agent-1", "hello", null, "10m", null, null).errors());
        assertEquals(List.of("schedule spec is required"),
                reminders.create("agent-1", "hello", ScheduleKind.CRON, " ", null, null).errors());
    }

    @Test
    void cancelShouldDistinguishOutcomes() {
        String id = reminders.create("agent-1", "hello").every("1h").save().scheduleId();

        assertEquals(CancelResult.CANCELLED, reminders.cancel(id));
        assertEquals(CancelResult.ALREADY_INACTIVE, reminders.cancel(id));
        assertEquals(CancelResult.NOT_FOUND, reminders.cancel("missing"));
        assertEquals(CancelResult.NOT_FOUND, reminders.cancel(""));
    }

    @Test
    void cancelledScheduleShouldNeverBeDelivered() {
        String id = reminders.create("agent-1", "hello").every("1m").save().scheduleId();
        reminders.cancel(id);
        clock.advance(Duration.ofMinutes(5));

        assertEquals(0, reminders.runOnce().total());
    }

    @Test
    void listShouldFilterByRecipientAndActivity() {
        String a = reminders.create("agent-1", "a").every("2h").save().scheduleId();
        reminders.create("agent-1", "b").every("1h").save();
        reminders.create("agent-2", "c").every("1h").save();
        reminders.cancel(a);

        assertEquals(1, reminders.list("agent-1", false).size());
        assertEquals(2, reminders.list("agent-1", true).size());
        assertEquals(2, reminders.list(null, false).size());
        assertEquals(3, reminders.list(" ", true).size());
    }

    @Test
    void purgeShouldRemoveOnlyOldInactiveSchedules() {
        String old = reminders.create("agent-1", "old").every("1h").save().scheduleId();
        reminders.create("agent-1", "kept").every("1h").save();
        reminders.cancel(old);
        clock.advance(Duration.ofDays(40));
        String recent = reminders.create("agent-1", "recent").every("1h").save().scheduleId();
        reminders.cancel(recent);

        assertEquals(1, reminders.purgeInactive(Duration.ofDays(30)));

        ScheduleStats stats = reminders.stats();
        assertEquals(2, stats.total());
        assertEquals(1, stats.active());
        assertEquals(1, stats.inactive());
        assertEquals(NOW, stats.oldestCreatedAt());
        assertThrows(IllegalArgumentException.class, () -> reminders.purgeInactive(Duration.ofDays(-1)));
    }

    @Test
    void validateRecipientsShouldConsultDirectory() {
        RecipientDirectory directory = mock(RecipientDirectory.class);
        when(directory.exists("agent-1")).thenReturn(true);
        RemindOptions options = new RemindOptions(Duration.ofSeconds(60), Duration.ofMinutes(10), 100, 10,
                "w", true);
        DefaultReminders validating = new DefaultReminders(store, delivered, options, clock, directory);

        assertTrue(validating.create("agent-1", "hi").every("1h").save().isCreated());
        assertFalse(validating.create("agent-x", "hi").every("1h").save().isCreated());
    }

    @Test
    void validateRecipientsWithoutDirectoryShouldFail() {
        RemindOptions options = new RemindOptions(Duration.ofSeconds(60), Duration.ofMinutes(10), 100, 10,
                null, true);
        assertThrows(IllegalArgumentException.class,
                () -> new DefaultReminders(store, delivered, options, clock, null));
    }

    @Test
    void generatedWorkerIdShouldBeBounded() {
        DefaultReminders generated = new DefaultReminders(store, delivered, RemindOptions.defaults(), clock, null);
        assertNotNull(generated.workerId());
        assertTrue(generated.workerId().length() <= 128);
        assertEquals("test-worker", reminders.workerId());
    }

    @Test
    void directoryDefaultExistsShouldScanList() {
        RecipientDirectory directory = () -> List.of(new RecipientInfo("agent-1", "Ada", null));
        assertTrue(directory.exists("agent-1"));
        assertFalse(directory.exists("agent-2"));
        assertFalse(directory.exists(null));
    }
}
