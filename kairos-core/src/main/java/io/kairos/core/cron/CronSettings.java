package io.kairos.core.cron;

import java.time.Duration;
import java.util.Objects;

/**
 * @param idleInterval how long the loop sleeps when no enabled job has a next run time
 * @param shutdownTimeout how long {@link CronService#close()} waits for an in-flight batch
 */
public record CronSettings(Duration idleInterval, Duration shutdownTimeout) {
    public static final Duration DEFAULT_IDLE_INTERVAL = Duration.ofSeconds(60);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    public CronSettings {
        Objects.requireNonNull(idleInterval, "idleInterval must not be null");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout must not be null");
        if (idleInterval.isNegative() || idleInterval.isZero()) {
            throw new IllegalArgumentException("idleInterval must be > 0");
        }
    }

    public static CronSettings defaults() {
        return new CronSettings(DEFAULT_IDLE_INTERVAL, DEFAULT_SHUTDOWN_TIMEOUT);
    }
}
