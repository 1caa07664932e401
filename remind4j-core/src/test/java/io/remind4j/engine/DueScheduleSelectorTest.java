package io.remind4j.engine;

import io.remind4j.core.Schedule;
import io.remind4j.core.ScheduleKind;
import io.remind4j.core.ScheduleUpdate;
import io.remind4j.support.InMemoryScheduleStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DueScheduleSelectorTest {

    private static final Instant NOW = Instant.parse("2025-01-01T10:00:00Z");

    private final InMemoryScheduleStore store = new InMemoryScheduleStore();

    @Test
    void shouldClaimOnlyWhenTheNextScheduleIsRequested() {
        store.put(due("s-1", NOW.minusSeconds(20)));
        store.put(due("s-2", NOW.minusSeconds(10)));
        DueScheduleSelector selector = new DueScheduleSelector(store, 100, Duration.ofMinutes(10), "worker-A");

        Iterator<Schedule> due = selector.selectDue(NOW).iterator();

        assertNull(store.get("s-1").lockedBy());
        assertTrue(due.hasNext());
        assertEquals("s-1", due.next().id());
        assertEquals("worker-A", store.get("s-1").lockedBy());
        assertEquals(NOW.plus(Duration.ofMinutes(10)), store.get("s-1").lockUntil());
        assertNull(store.get("s-2").lockedBy());
    }

    @Test
    void scheduleLeftDueShouldNotComeBackInTheSameSequence() {
        store.put(due("s-1", NOW.minusSeconds(20)));
        store.put(due("s-2", NOW.minusSeconds(10)));
        DueScheduleSelector selector = new DueScheduleSelector(store, 100, Duration.ofMinutes(10), "worker-A");

        List<String> seen = new ArrayList<>();
        for (Schedule s : selector.selectDue(NOW)) {
            seen.add(s.id());
            // write back unchanged, as after a transient failure
            store.applyUpdate(new ScheduleUpdate(s.id(), true, s.nextRun(), 0, NOW, 1, "status 503"), "worker-A");
        }

        assertEquals(List.of("s-1", "s-2"), seen);
        assertTrue(store.get("s-1").isDue(NOW));
    }

    @Test
    void shouldStopAtPassLimit() {
        for (int i = 1; i <= 3; i++) {
            store.put(due("s-" + i, NOW.minusSeconds(30 - i)));
        }
        DueScheduleSelector selector = new DueScheduleSelector(store, 2, Duration.ofMinutes(10), "worker-A");

        List<String> seen = new ArrayList<>();
        selector.selectDue(NOW).forEach(s -> seen.add(s.id()));

        assertEquals(List.of("s-1", "s-2"), seen);
        assertNull(store.get("s-3").lockedBy());
    }

    @Test
    void nothingDueShouldWriteNothing() {
        store.put(due("s-1", NOW.plusSeconds(60)));
        int before = store.writeCount();

        assertFalse(new DueScheduleSelector(store, 10, Duration.ofMinutes(1), "w").selectDue(NOW).iterator().hasNext());
        assertEquals(before, store.writeCount());
    }

    private static Schedule due(String id, Instant nextRun) {
        return new Schedule(id, "agent-1", "ping", ScheduleKind.CRON, "*/5 * * * *", null, nextRun, true,
                null, 0, null, NOW.minusSeconds(3600), 0, null, null, null);
    }
}
