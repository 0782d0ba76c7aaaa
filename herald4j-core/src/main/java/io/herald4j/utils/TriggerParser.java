package io.herald4j.utils;

import io.herald4j.core.JobRecord;
import io.herald4j.core.TriggerSpec;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Date;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses trigger input and computes firing times.
 * <p>
 * Supported operator input:
 * <ul>
 *   <li>Whole seconds: "300"</li>
 *   <li>Human-readable intervals: "5 minutes", "1 hour 30 minutes", "90s"</li>
 *   <li>A local date-time for a single delivery: "2026-06-05 14:00:00"</li>
 * </ul>
 * <p>
 * Note: a one-shot trigger fires at the time-of-day of its date-time and, until cancelled, again at
 * that time on every following day. The scheduler cancels it after the first successful delivery.
 */
public final class TriggerParser {

    public static final DateTimeFormatter FIRE_AT_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss", Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);

    private static final Pattern INTEGER = Pattern.compile("^[+-]?\\d+$");
    private static final Pattern FIRE_AT_SHAPE = Pattern.compile("^\\d{4}-\\d{1,2}-\\d{1,2}\\s+\\d{1,2}:\\d{1,2}(:\\d{1,2})?$");
    private static final Pattern COMPACT = Pattern.compile("^(\\d+)\\s*([smhdw])$");

    private static final Map<String, Long> UNIT_SECONDS = Map.of(
            "second", 1L,
            "minute", 60L,
            "hour", 3_600L,
            "day", 86_400L,
            "week", 604_800L
    );

    private static final String TOO_LARGE =
            "Interval is too large! The maximum is " + TriggerSpec.MAX_INTERVAL.toDays() + " days.";

    private TriggerParser() {
    }

    /**
     * Parse what an operator typed as the schedule's timing.
     *
     * @throws IllegalArgumentException with an operator-facing message when the input is not understood
     */
    public static TriggerSpec parseOperatorInput(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Enter a number of seconds (e.g. '300') or a time (YYYY-MM-DD HH:MM:SS).");
        }
        String s = input.trim();

        if (INTEGER.matcher(s).matches()) {
            long seconds;
            try {
                seconds = Long.parseLong(s);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException(TOO_LARGE, ex);
            }
            if (seconds <= 0) {
                throw new IllegalArgumentException("Interval must be a positive number of seconds!");
            }
            if (seconds > TriggerSpec.MAX_INTERVAL.toSeconds()) {
                throw new IllegalArgumentException(TOO_LARGE);
            }
            return TriggerSpec.everySeconds(seconds);
        }

        if (looksLikeFireAt(s)) {
            return TriggerSpec.at(parseFireAt(s));
        }

        Duration interval;
        try {
            interval = parseHumanDuration(s);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(
                    "Invalid input! Enter a number of seconds (e.g. '300'), an interval (e.g. '5 minutes') "
                            + "or a time (YYYY-MM-DD HH:MM:SS).", ex);
        }
        if (interval.compareTo(TriggerSpec.MAX_INTERVAL) > 0) {
            throw new IllegalArgumentException(TOO_LARGE);
        }
        return TriggerSpec.every(interval);
    }

    /**
     * Returns true if the text has the shape of a date-time ("2026-06-05 14:00:00"), valid or not.
     */
    public static boolean looksLikeFireAt(String text) {
        return text != null && FIRE_AT_SHAPE.matcher(text.trim()).matches();
    }

    public static LocalDateTime parseFireAt(String text) {
        Objects.requireNonNull(text, "text must not be null");
        try {
            return LocalDateTime.parse(text.trim(), FIRE_AT_FORMAT);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid time, expected YYYY-MM-DD HH:MM:SS: " + text, ex);
        }
    }

    public static String formatFireAt(LocalDateTime fireAt) {
        return FIRE_AT_FORMAT.format(fireAt.withNano(0));
    }

    /**
     * Rebuild the trigger of a stored record.
     *
     * @throws IllegalArgumentException if the stored interval is not a positive number, the stored time
     *                                  cannot be parsed, or neither is present
     */
    public static TriggerSpec fromRecord(JobRecord record) {
        Objects.requireNonNull(record, "record must not be null");

        Object raw = record.intervalSeconds();
        if (raw != null) {
            if (!(raw instanceof Number n)) {
                throw new IllegalArgumentException("interval_seconds is not numeric: " + raw);
            }
            double seconds = n.doubleValue();
            if (!(seconds > 0) || Double.isInfinite(seconds)) {
                throw new IllegalArgumentException("interval_seconds must be positive: " + raw);
            }
            // fractions round up to the whole seconds intervals are kept in
            long whole = (seconds % 1 == 0) ? n.longValue() : (long) Math.ceil(seconds);
            return TriggerSpec.everySeconds(whole);
        }

        if (record.fireAt() != null) {
            return TriggerSpec.at(parseFireAt(record.fireAt()));
        }

        throw new IllegalArgumentException("record has neither interval_seconds nor fire_at");
    }

    /**
     * First firing after installation.
     * <ul>
     *   <li>interval: {@code now + interval}</li>
     *   <li>fire-at: the date-time itself when it is in the future, otherwise the next daily
     *       occurrence of its time-of-day</li>
     * </ul>
     */
    public static Instant initialFireAt(TriggerSpec spec, Instant now, ZoneId zone) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(zone, "zone must not be null");

        if (spec.isRecurring()) {
            return now.plus(spec.interval());
        }
        Instant at = spec.fireAt().atZone(zone).toInstant();
        if (at.isAfter(now)) {
            return at;
        }
        return nextDailyOccurrence(spec.fireAt().toLocalTime(), now, zone);
    }

    /**
     * Firing that follows one at {@code firedAt}.
     */
    public static Instant computeNextFireAt(TriggerSpec spec, Instant firedAt, ZoneId zone) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(firedAt, "firedAt must not be null");

        if (spec.isRecurring()) {
            return firedAt.plus(spec.interval());
        }
        return nextDailyOccurrence(spec.fireAt().toLocalTime(), firedAt, zone);
    }

    /**
     * Next instant strictly after {@code after} whose local time in {@code zone} is {@code timeOfDay}.
     */
    public static Instant nextDailyOccurrence(LocalTime timeOfDay, Instant after, ZoneId zone) {
        String cron = dailyCron(timeOfDay);
        CronExpression exp;
        try {
            exp = new CronExpression(cron);
        } catch (ParseException ex) {
            throw new IllegalStateException("Invalid daily cron expression: " + cron, ex);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone));

        Date next = exp.getNextValidTimeAfter(Date.from(after));
        if (next == null) {
            throw new IllegalStateException("Cron expression produced no next execution time: " + cron);
        }
        return next.toInstant();
    }

    /**
     * Quartz expression firing once a day at the given time, e.g. {@code "0 30 9 * * ?"}.
     */
    public static String dailyCron(LocalTime timeOfDay) {
        Objects.requireNonNull(timeOfDay, "timeOfDay must not be null");
        return timeOfDay.getSecond() + " " + timeOfDay.getMinute() + " " + timeOfDay.getHour() + " * * ?";
    }

    public static Duration parseHumanDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }

        Matcher compact = COMPACT.matcher(s);
        if (compact.matches()) {
            long n = Long.parseLong(compact.group(1));
            String unit = switch (compact.group(2)) {
                case "s" -> "second";
                case "m" -> "minute";
                case "h" -> "hour";
                case "d" -> "day";
                default -> "week";
            };
            return positive(Duration.ofSeconds(multiply(n, UNIT_SECONDS.get(unit), input)), input);
        }

        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid interval format. Expected pairs like '3 minutes': " + input);
        }

        long total = 0;
        Set<String> seen = new HashSet<>();
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
            Long factor = UNIT_SECONDS.get(unit);
            if (factor == null) {
                throw new IllegalArgumentException("Unsupported interval unit: " + parts[i + 1]);
            }
            if (!seen.add(unit)) {
                throw new IllegalArgumentException("Duplicate unit: " + unit);
            }
            try {
                total = Math.addExact(total, Math.multiplyExact(n, factor));
            } catch (ArithmeticException ex) {
                throw new IllegalArgumentException("Interval is too large: " + input, ex);
            }
        }

        return positive(Duration.ofSeconds(total), input);
    }

    private static long multiply(long n, long factor, String input) {
        try {
            return Math.multiplyExact(n, factor);
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("Interval is too large: " + input, ex);
        }
    }

    private static Duration positive(Duration d, String input) {
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive: " + input);
        }
        return d;
    }
}
