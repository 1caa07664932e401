package io.remind4j.utils;

import java.text.ParseException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.quartz.CronExpression;

/**
 * Parses the kind-specific schedule specs.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Once: ISO-8601 instant ("2026-01-20T09:30:00Z"), offset date-time, or a local date-time read as UTC</li>
 *   <li>Cron: 5-field expression (minute hour day-of-month month day-of-week), evaluated in UTC</li>
 *   <li>Interval: seconds ("90"), compact ("30s", "5m", "1h", "2d") or pairs ("1 hour 30 minutes")</li>
 * </ul>
 * <p>
 * Every method throws {@link IllegalArgumentException} for input outside its grammar.
 */
public final class ScheduleSpecParser {

    private static final Pattern COMPACT = Pattern.compile("^(\\d+)\\s*([smhd])$");
    private static final Pattern DAY_NUMBER = Pattern.compile("\\d+");
    private static final TimeZone UTC = TimeZone.getTimeZone("UTC");

    private ScheduleSpecParser() {
    }

    /**
     * Parse an absolute timestamp, truncated to whole seconds.
     */
    public static Instant parseInstant(String spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("timestamp must not be empty");
        }

        try {
            return Instant.parse(s).truncatedTo(ChronoUnit.SECONDS);
        } catch (DateTimeParseException ignored) {
            // fall through to the offset and local forms
        }
        try {
            return OffsetDateTime.parse(s).toInstant().truncatedTo(ChronoUnit.SECONDS);
        } catch (DateTimeParseException ignored) {
            // fall through to the local form
        }
        try {
            return LocalDateTime.parse(s).toInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.SECONDS);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid timestamp. Expected ISO-8601 like 2026-01-20T09:30:00Z: " + spec);
        }
    }

    /**
     * Parse an interval spec into a positive {@link Duration} of whole seconds.
     */
    public static Duration parseDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }

        Duration d;
        if (s.matches("^\\d+$")) {
            try {
                d = Duration.ofSeconds(Long.parseLong(s));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Interval seconds out of range: " + input);
            }
        } else {
            Matcher compact = COMPACT.matcher(s);
            d = compact.matches() ? parseCompact(compact, input) : parsePairs(s, input);
        }

        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive: " + input);
        }
        return d;
    }

    private static Duration parseCompact(Matcher m, String input) {
        long n;
        try {
            n = Long.parseLong(m.group(1));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Interval value out of range: " + input);
        }
        ChronoUnit unit = switch (m.group(2).charAt(0)) {
            case 's' -> ChronoUnit.SECONDS;
            case 'm' -> ChronoUnit.MINUTES;
            case 'h' -> ChronoUnit.HOURS;
            case 'd' -> ChronoUnit.DAYS;
            default -> throw new IllegalArgumentException("Unsupported compact unit: " + input);
        };
        return Duration.ofSeconds(toSeconds(n, unit, input));
    }

    private static Duration parsePairs(String s, String input) {
        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid interval format. Use '30s', '5m', '1h' or pairs like '3 minutes': " + input);
        }

        boolean seenDay = false, seenHour = false, seenMinute = false, seenSecond = false;
        long totalSeconds = 0;

        for (int i = 0; i < parts.length; i += 2) {
            long n;
            try {
                n = Long.parseLong(parts[i]);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid number in interval: " + parts[i]);
            }
            if (n < 0) {
                throw new IllegalArgumentException("Interval values must be non-negative");
            }

            String unit = parts[i + 1];
            if (unit.endsWith("s")) {
                unit = unit.substring(0, unit.length() - 1);
            }

            long seconds;
            switch (unit) {
                case "day" -> {
                    if (seenDay) throw new IllegalArgumentException("Duplicate unit: day");
                    seenDay = true;
                    seconds = toSeconds(n, ChronoUnit.DAYS, input);
                }
                case "hour" -> {
                    if (seenHour) throw new IllegalArgumentException("Duplicate unit: hour");
                    seenHour = true;
                    seconds = toSeconds(n, ChronoUnit.HOURS, input);
                }
                case "minute" -> {
                    if (seenMinute) throw new IllegalArgumentException("Duplicate unit: minute");
                    seenMinute = true;
                    seconds = toSeconds(n, ChronoUnit.MINUTES, input);
                }
                case "second" -> {
                    if (seenSecond) throw new IllegalArgumentException("Duplicate unit: second");
                    seenSecond = true;
                    seconds = n;
                }
                default -> throw new IllegalArgumentException("Unsupported interval unit: " + parts[i + 1]);
            }
            try {
                totalSeconds = Math.addExact(totalSeconds, seconds);
            } catch (ArithmeticException ex) {
                throw new IllegalArgumentException("Interval out of range: " + input);
            }
        }

        return Duration.ofSeconds(totalSeconds);
    }

    private static long toSeconds(long n, ChronoUnit unit, String input) {
        try {
            return Math.multiplyExact(n, unit.getDuration().getSeconds());
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("Interval out of range: " + input);
        }
    }

    /**
     * Translate a 5-field cron expression into Quartz syntax.
     * <ul>
     *   <li>prepends seconds "0"</li>
     *   <li>renumbers day-of-week from 0-7 (0 and 7 are Sunday) to Quartz 1-7</li>
     *   <li>replaces the unused day field with "?"</li>
     * </ul>
     * When both day-of-month and day-of-week are restricted, a day matching either one fires, as in
     * classic cron. Quartz cannot say that in one expression, so two are returned: one per day field.
     */
    public static List<String> toQuartzCrons(String spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("cron expression must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length != 5) {
            throw new IllegalArgumentException(
                    "Cron expression must have 5 fields (minute hour day-of-month month day-of-week): " + spec);
        }

        String dom = parts[2];
        String dow = renumberDaysOfWeek(parts[4]);

        if (isUnrestricted(dow)) {
            return List.of(quartz(parts, dom, "?"));
        }
        if (isUnrestricted(dom)) {
            return List.of(quartz(parts, "?", dow));
        }
        return List.of(quartz(parts, dom, "?"), quartz(parts, "?", dow));
    }

    private static boolean isUnrestricted(String field) {
        return "*".equals(field) || "?".equals(field);
    }

    private static String quartz(String[] parts, String dom, String dow) {
        return String.join(" ", "0", parts[0], parts[1], dom, parts[3], dow);
    }

    private static String renumberDaysOfWeek(String field) {
        StringBuilder out = new StringBuilder();
        for (String item : field.split(",", -1)) {
            if (out.length() > 0) {
                out.append(',');
            }
            // step ("/2") and nth ("#3") suffixes are counts, not days
            int cut = indexOfAny(item, '/', '#');
            String base = cut < 0 ? item : item.substring(0, cut);
            String suffix = cut < 0 ? "" : item.substring(cut);

            Matcher m = DAY_NUMBER.matcher(base);
            StringBuilder renumbered = new StringBuilder();
            while (m.find()) {
                int day = Integer.parseInt(m.group());
                if (day > 7) {
                    throw new IllegalArgumentException("Day-of-week out of range 0-7: " + field);
                }
                m.appendReplacement(renumbered, Integer.toString(day % 7 + 1));
            }
            m.appendTail(renumbered);
            out.append(renumbered).append(suffix);
        }
        return out.toString();
    }

    private static int indexOfAny(String s, char a, char b) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == a || c == b) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Parse a 5-field cron expression into UTC Quartz {@link CronExpression}s; a time matches when
     * any of them matches.
     */
    public static List<CronExpression> parseCron(String spec) {
        List<CronExpression> out = new ArrayList<>(2);
        for (String quartz : toQuartzCrons(spec)) {
            try {
                CronExpression exp = new CronExpression(quartz);
                exp.setTimeZone(UTC);
                out.add(exp);
            } catch (ParseException ex) {
                throw new IllegalArgumentException("Invalid cron expression '" + spec + "': " + ex.getMessage());
            }
        }
        return out;
    }

    /**
     * Returns true if the string is a valid 5-field cron expression.
     */
    public static boolean isValidCron(String spec) {
        try {
            parseCron(spec);
            return true;
        } catch (IllegalArgumentException | NullPointerException ignored) {
            return false;
        }
    }

    /**
     * Earliest cron occurrence strictly after {@code after}, or empty when the expression never fires again.
     */
    public static Optional<Instant> nextCronOccurrence(String spec, Instant after) {
        Objects.requireNonNull(after, "after must not be null");
        Instant earliest = null;
        for (CronExpression exp : parseCron(spec)) {
            Date next = exp.getNextValidTimeAfter(Date.from(after));
            if (next != null && (earliest == null || next.toInstant().isBefore(earliest))) {
                earliest = next.toInstant();
            }
        }
        return Optional.ofNullable(earliest);
    }
}
