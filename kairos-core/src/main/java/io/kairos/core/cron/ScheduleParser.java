package io.kairos.core.cron;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses human-entered schedule text into {@link CronSchedule} values.
 *
 * <ul>
 *   <li>intervals: {@code 500ms}, {@code 30s}, {@code 5m}, {@code 2h}, {@code 1d}; a bare number is seconds</li>
 *   <li>one-shot times: {@code in 10 minutes}, {@code today at 6pm}, {@code tomorrow}, ISO-8601 instants,
 *   {@code yyyy-MM-dd HH:mm} and ISO local date-times (interpreted in the given zone)</li>
 * </ul>
 */
public final class ScheduleParser {
    private static final Pattern INTERVAL = Pattern.compile("^(\\d+)\\s*(ms|s|sec|secs|m|min|mins|h|hr|hrs|d|day|days)?$");
    private static final Pattern RELATIVE = Pattern.compile(
        "^in\\s+(\\d+)\\s*(s|sec|secs|second|seconds|m|min|mins|minute|minutes|h|hr|hrs|hour|hours|d|day|days)$"
    );
    private static final Pattern DAY_AT = Pattern.compile("^(today|tomorrow)(?:\\s+at\\s+(.+))?$");
    private static final Pattern MERIDIEM = Pattern.compile("^(\\d{1,2})(?::(\\d{2}))?(am|pm)$");
    private static final Pattern CLOCK = Pattern.compile("^(\\d{1,2})(?::(\\d{2}))?$");
    private static final DateTimeFormatter DATE_TIME_SPACE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final LocalTime DEFAULT_TIME_OF_DAY = LocalTime.of(9, 0);

    private final Clock clock;
    private final ZoneId zone;

    public ScheduleParser(Clock clock, ZoneId zone) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public CronSchedule.Every every(String text) {
        return CronSchedule.every(parseInterval(text).toMillis());
    }

    public CronSchedule.At at(String text) {
        Instant instant = parseInstant(text);
        try {
            return CronSchedule.at(instant.toEpochMilli());
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("invalid time expression: " + text + " (out of range)", e);
        }
    }

    public Duration parseInterval(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("interval is required");
        }
        Matcher matcher = INTERVAL.matcher(text.trim().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new IllegalArgumentException("invalid interval: " + text);
        }
        String unit = matcher.group(2) == null ? "s" : matcher.group(2);
        Duration interval;
        try {
            long value = Long.parseLong(matcher.group(1));
            interval = switch (unit) {
                case "ms" -> Duration.ofMillis(value);
                case "s", "sec", "secs" -> Duration.ofSeconds(value);
                case "m", "min", "mins" -> Duration.ofMinutes(value);
                case "h", "hr", "hrs" -> Duration.ofHours(value);
                case "d", "day", "days" -> Duration.ofDays(value);
                default -> throw new IllegalArgumentException("unsupported interval unit: " + unit);
            };
            // schedules store milliseconds
            interval.toMillis();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("invalid interval: " + text + " (out of range)", e);
        }
        if (interval.isZero()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        return interval;
    }

    public Instant parseInstant(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("time expression is required");
        }
        String raw = text.trim();
        String normalized = raw.toLowerCase(Locale.ROOT);
        Instant now = clock.instant();

        Matcher relative = RELATIVE.matcher(normalized);
        if (relative.matches()) {
            try {
                long value = Long.parseLong(relative.group(1));
                Instant target = now.plus(relativeUnit(relative.group(2)).multipliedBy(value));
                target.toEpochMilli();
                return target;
            } catch (ArithmeticException | DateTimeException e) {
                throw new IllegalArgumentException("invalid time expression: " + text + " (out of range)", e);
            }
        }

        Matcher dayAt = DAY_AT.matcher(normalized);
        if (dayAt.matches()) {
            LocalDate date = LocalDateTime.ofInstant(now, zone).toLocalDate();
            if ("tomorrow".equals(dayAt.group(1))) {
                date = date.plusDays(1);
            }
            return LocalDateTime.of(date, timeOfDay(dayAt.group(2))).atZone(zone).toInstant();
        }

        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException ignored) {
            // try the local formats below
        }
        try {
            return LocalDateTime.parse(raw, DATE_TIME_SPACE).atZone(zone).toInstant();
        } catch (DateTimeParseException ignored) {
            // try ISO local date-time
        }
        try {
            return LocalDateTime.parse(raw).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("unable to parse time expression: " + text, e);
        }
    }

    private static Duration relativeUnit(String unit) {
        return switch (unit) {
            case "s", "sec", "secs", "second", "seconds" -> Duration.ofSeconds(1);
            case "m", "min", "mins", "minute", "minutes" -> Duration.ofMinutes(1);
            case "h", "hr", "hrs", "hour", "hours" -> Duration.ofHours(1);
            case "d", "day", "days" -> Duration.ofDays(1);
            default -> throw new IllegalArgumentException("unsupported time unit: " + unit);
        };
    }

    private static LocalTime timeOfDay(String token) {
        if (token == null || token.isBlank()) {
            return DEFAULT_TIME_OF_DAY;
        }
        try {
            return parseTimeOfDay(token);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("invalid time of day: " + token, e);
        }
    }

    private static LocalTime parseTimeOfDay(String token) {
        String value = token.trim().replace(" ", "");

        Matcher meridiem = MERIDIEM.matcher(value);
        if (meridiem.matches()) {
            int hour = Integer.parseInt(meridiem.group(1)) % 12;
            int minute = meridiem.group(2) == null ? 0 : Integer.parseInt(meridiem.group(2));
            if ("pm".equals(meridiem.group(3))) {
                hour += 12;
            }
            return LocalTime.of(hour, minute);
        }

        Matcher clockTime = CLOCK.matcher(value);
        if (clockTime.matches()) {
            int hour = Integer.parseInt(clockTime.group(1));
            int minute = clockTime.group(2) == null ? 0 : Integer.parseInt(clockTime.group(2));
            return LocalTime.of(hour, minute);
        }

        throw new IllegalArgumentException("invalid time of day: " + token);
    }
}
