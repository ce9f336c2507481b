package io.kairos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.kairos.core.cron.CronSettings;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CronConfig(String storePath, long idleIntervalMs, long shutdownTimeoutMs) {

    public static CronConfig defaults() {
        return new CronConfig(
            "~/.kairos/cron/jobs.json",
            CronSettings.DEFAULT_IDLE_INTERVAL.toMillis(),
            CronSettings.DEFAULT_SHUTDOWN_TIMEOUT.toMillis()
        );
    }

    public CronSettings toSettings() {
        return new CronSettings(Duration.ofMillis(idleIntervalMs), Duration.ofMillis(shutdownTimeoutMs));
    }
}
