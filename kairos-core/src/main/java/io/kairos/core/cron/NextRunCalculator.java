package io.kairos.core.cron;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a schedule and the current time to the next run time. Stateless and thread-safe.
 */
public final class NextRunCalculator {
    private static final Logger LOG = LoggerFactory.getLogger(NextRunCalculator.class);

    private static final CronParser MINUTE_PARSER =
        new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
    private static final CronParser SECOND_PARSER = new CronParser(secondsFirstDefinition());

    public OptionalLong nextRun(CronSchedule schedule, long nowMs) {
        if (schedule instanceof CronSchedule.At at) {
            return at.atMs() > nowMs ? OptionalLong.of(at.atMs()) : OptionalLong.empty();
        }
        if (schedule instanceof CronSchedule.Every every) {
            return nextInterval(every, nowMs);
        }
        if (schedule instanceof CronSchedule.Cron cron) {
            return nextCalendarRun(cron, nowMs);
        }
        return OptionalLong.empty();
    }

    /**
     * Convenience for callers that store the result as a nullable field.
     */
    public Long nextRunOrNull(CronSchedule schedule, long nowMs) {
        OptionalLong next = nextRun(schedule, nowMs);
        return next.isPresent() ? next.getAsLong() : null;
    }

    public boolean isValid(CronSchedule.Cron cron) {
        return parse(cron.expr()).isPresent() && zone(cron.tz()).isPresent();
    }

    private OptionalLong nextInterval(CronSchedule.Every every, long nowMs) {
        if (every.everyMs() <= 0) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Math.addExact(nowMs, every.everyMs()));
        } catch (ArithmeticException e) {
            LOG.warn("Interval of {}ms from {} overflows; job will not be scheduled", every.everyMs(), nowMs);
            return OptionalLong.empty();
        }
    }

    private OptionalLong nextCalendarRun(CronSchedule.Cron cron, long nowMs) {
        Optional<ExecutionTime> executionTime = parse(cron.expr());
        Optional<ZoneId> zone = zone(cron.tz());
        if (executionTime.isEmpty() || zone.isEmpty()) {
            LOG.warn("Cron expression '{}' (tz={}) cannot be evaluated; job will not be scheduled", cron.expr(), cron.tz());
            return OptionalLong.empty();
        }

        ZonedDateTime base = ZonedDateTime.ofInstant(Instant.ofEpochMilli(nowMs), zone.get());
        Optional<ZonedDateTime> next = executionTime.get().nextExecution(base);
        // nextExecution may return the base instant itself when it lands exactly on a match
        while (next.isPresent() && next.get().toInstant().toEpochMilli() <= nowMs) {
            next = executionTime.get().nextExecution(next.get().plusNanos(1_000_000));
        }
        return next
            .map(value -> OptionalLong.of(value.toInstant().toEpochMilli()))
            .orElseGet(OptionalLong::empty);
    }

    private Optional<ExecutionTime> parse(String expr) {
        if (expr == null || expr.isBlank()) {
            return Optional.empty();
        }
        String normalized = expr.trim();
        int fields = normalized.split("\\s+").length;
        CronParser parser = switch (fields) {
            case 5 -> MINUTE_PARSER;
            case 6, 7 -> SECOND_PARSER;
            default -> null;
        };
        if (parser == null) {
            return Optional.empty();
        }
        try {
            Cron parsed = parser.parse(normalized);
            parsed.validate();
            return Optional.of(ExecutionTime.forCron(parsed));
        } catch (IllegalArgumentException e) {
            LOG.debug("Unparsable cron expression '{}': {}", normalized, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<ZoneId> zone(String tz) {
        if (tz == null || tz.isBlank()) {
            return Optional.of(ZoneOffset.UTC);
        }
        try {
            return Optional.of(ZoneId.of(tz.trim()));
        } catch (DateTimeException e) {
            LOG.debug("Unknown timezone '{}': {}", tz, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Seconds-first layout with an optional trailing year. Day-of-week runs 1-7 starting on Sunday, and either day
     * field may be {@code *} or {@code ?}.
     */
    private static CronDefinition secondsFirstDefinition() {
        return CronDefinitionBuilder.defineCron()
            .withSeconds().withValidRange(0, 59).and()
            .withMinutes().withValidRange(0, 59).and()
            .withHours().withValidRange(0, 23).and()
            .withDayOfMonth().withValidRange(1, 31).supportsL().supportsW().supportsLW().supportsQuestionMark().and()
            .withMonth().withValidRange(1, 12).and()
            .withDayOfWeek().withValidRange(1, 7).withMondayDoWValue(2).supportsHash().supportsL()
                .supportsQuestionMark().and()
            .withYear().withValidRange(1970, 2099).withStrictRange().optional().and()
            .instance();
    }
}
