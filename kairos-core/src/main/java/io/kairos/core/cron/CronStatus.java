package io.kairos.core.cron;

public record CronStatus(boolean running, int jobCount, Long nextWakeAtMs) {
}
