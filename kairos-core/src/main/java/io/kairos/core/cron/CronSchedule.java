package io.kairos.core.cron;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * When a job runs. Persisted with a {@code kind} discriminator: {@code at}, {@code every} or {@code cron}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = CronSchedule.At.class, name = "at"),
    @JsonSubTypes.Type(value = CronSchedule.Every.class, name = "every"),
    @JsonSubTypes.Type(value = CronSchedule.Cron.class, name = "cron")
})
public sealed interface CronSchedule permits CronSchedule.At, CronSchedule.Every, CronSchedule.Cron {

    static At at(long atMs) {
        return new At(atMs);
    }

    static Every every(long everyMs) {
        return new Every(everyMs);
    }

    static Cron cron(String expr) {
        return new Cron(expr, null);
    }

    static Cron cron(String expr, String tz) {
        return new Cron(expr, tz);
    }

    /**
     * One-shot at an absolute epoch millisecond.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record At(@JsonProperty(required = true) long atMs) implements CronSchedule {
    }

    /**
     * Fixed interval, measured from the moment the next run is computed.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Every(@JsonProperty(required = true) long everyMs) implements CronSchedule {
        public Every {
            if (everyMs <= 0) {
                throw new IllegalArgumentException("everyMs must be > 0");
            }
        }
    }

    /**
     * Calendar expression: five fields (minute precision), or six or seven fields (leading seconds, optional
     * trailing year). A blank {@code tz} means UTC.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Cron(@JsonProperty(required = true) String expr, String tz) implements CronSchedule {
        public Cron {
            if (expr == null || expr.isBlank()) {
                throw new IllegalArgumentException("cron expression is required");
            }
            expr = expr.trim();
            tz = tz == null || tz.isBlank() ? null : tz.trim();
        }
    }
}
