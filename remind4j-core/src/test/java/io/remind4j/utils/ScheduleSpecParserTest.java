package io.remind4j.utils;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleSpecParserTest {

    @Test
    void parseInstantShouldAcceptUtcOffsetAndLocalForms() {
        assertEquals(Instant.parse("2026-01-20T09:30:00Z"), ScheduleSpecParser.parseInstant("2026-01-20T09:30:00Z"));
        assertEquals(Instant.parse("2026-01-20T07:30:00Z"), ScheduleSpecParser.parseInstant("2026-01-20T09:30:00+02:00"));
        assertEquals(Instant.parse("2026-01-20T09:30:00Z"), ScheduleSpecParser.parseInstant("2026-01-20T09:30:00"));
    }

    @Test
    void parseInstantShouldTruncateToSeconds() {
        assertEquals(Instant.parse("2026-01-20T09:30:00Z"), ScheduleSpecParser.parseInstant("2026-01-20T09:30:00.750Z"));
    }

    @Test
    void parseInstantShouldRejectGarbage() {
        assertThrows(IllegalArgumentException.class, () -> ScheduleSpecParser.parseInstant("tomorrow at nine"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleSpecParser.parseInstant("  "));
    }

    @Test
    void parseDurationShouldSupportAllForms() {
        assertEquals(Duration.ofSeconds(90), ScheduleSpecParser.parseDuration("90"));
        assertEquals(Duration.ofSeconds(30), ScheduleSpecParser.parseDuration("30s"));
        assertEquals(Duration.ofMinutes(5), ScheduleSpecParser.parseDuration("5m"));
        assertEquals(Duration.ofHours(1), ScheduleSpecParser.parseDuration("1h"));
        assertEquals(Duration.ofDays(2), ScheduleSpecParser.parseDuration("2d"));
        assertEquals(Duration.ofMinutes(90), ScheduleSpecParser.parseDuration("1 hour 30 minutes"));
    }

    @Test
    void parseDurationShouldRejectZeroAndUnknownUnits() {
        assertThrows(IllegalArgumentException.class, () -> ScheduleSpecParser.parseDuration("0s"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleSpecParser.parseDuration("5 fortnights"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleSpecParser.parseDuration("abc"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleSpecParser.parseDuration("1 hour 2 hours"));
    }

    @Test
    void parseDurationShouldRejectOverflowInsteadOfWrapping() {
        assertThrows(IllegalArgumentException.class, () -> ScheduleSpecParser.parseDuration("9999999999999999d"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleSpecParser.parseDuration("9999999999999999h"));
        assertThrows(IllegalArgumentException.class,
                () -> ScheduleSpecParser.parseDuration("100000000000000 days 9000000000000000000 seconds"));
    }

    @Test
    void toQuartzCronsShouldPrependSecondsAndRenumberWeekdays() {
        assertEquals(List.of("0 */15 * * * ?"), ScheduleSpecParser.toQuartzCrons("*/15 * * * *"));
        assertEquals(List.of("0 0 9 ? * 2-6"), ScheduleSpecParser.toQuartzCrons("0 9 * * 1-5"));
        assertEquals(List.of("0 0 9 ? * 1"), ScheduleSpecParser.toQuartzCrons("0 9 * * 0"));
        assertEquals(List.of("0 0 9 ? * 1"), ScheduleSpecParser.toQuartzCrons("0 9 * * 7"));
        assertEquals(List.of("0 0 9 ? * 2#2"), ScheduleSpecParser.toQuartzCrons("0 9 * * 1#2"));
        assertEquals(List.of("0 30 8 15 * ?"), ScheduleSpecParser.toQuartzCrons("30 8 15 * *"));
    }

    @Test
    void restrictedDayOfMonthAndDayOfWeekShouldFireOnEither() {
        assertEquals(List.of("0 0 9 1 * ?", "0 0 9 ? * 2"), ScheduleSpecParser.toQuartzCrons("0 9 1 * 1"));
        assertTrue(ScheduleSpecParser.isValidCron("0 9 1 * 1"));

        // 2025-01-01 is a Wednesday: the next Monday comes before the next 1st
        assertEquals(Optional.of(Instant.parse("2025-01-06T09:00:00Z")),
                ScheduleSpecParser.nextCronOccurrence("0 9 1 * 1", Instant.parse("2025-01-01T10:00:00Z")));
        // 2025-02-01 is a Saturday and comes before Monday 2025-02-03
        assertEquals(Optional.of(Instant.parse("2025-02-01T09:00:00Z")),
                ScheduleSpecParser.nextCronOccurrence("0 9 1 * 1", Instant.parse("2025-01-28T10:00:00Z")));
    }

    @Test
    void cronShouldRequireFiveFields() {
        assertThrows(IllegalArgumentException.class, () -> ScheduleSpecParser.toQuartzCrons("0 0 9 * * ?"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleSpecParser.toQuartzCrons("* * *"));
        assertFalse(ScheduleSpecParser.isValidCron("not a cron"));
        assertFalse(ScheduleSpecParser.isValidCron("61 * * * *"));
        assertTrue(ScheduleSpecParser.isValidCron("0 9 * * *"));
    }

    @Test
    void nextCronOccurrenceShouldBeStrictlyAfterReference() {
        Optional<Instant> next = ScheduleSpecParser.nextCronOccurrence("0 9 * * *", Instant.parse("2025-01-01T10:00:00Z"));
        assertEquals(Optional.of(Instant.parse("2025-01-02T09:00:00Z")), next);

        Optional<Instant> onBoundary = ScheduleSpecParser.nextCronOccurrence("0 9 * * *", Instant.parse("2025-01-02T09:00:00Z"));
        assertEquals(Optional.of(Instant.parse("2025-01-03T09:00:00Z")), onBoundary);
    }
}
