package io.kairos.core.cron;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

public record CronJob(
    @JsonProperty(required = true) String id,
    String name,
    boolean enabled,
    @JsonProperty(required = true) CronSchedule schedule,
    CronPayload payload,
    CronJobState state,
    long createdAtMs,
    long updatedAtMs,
    boolean deleteAfterRun
) {
    public CronJob {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("job id is required");
        }
        Objects.requireNonNull(schedule, "schedule must not be null");
        name = name == null ? "" : name;
        payload = payload == null ? CronPayload.agentTurn("") : payload;
        state = state == null ? CronJobState.empty() : state;
        updatedAtMs = Math.max(updatedAtMs, createdAtMs);
    }

    public boolean oneShot() {
        return schedule instanceof CronSchedule.At;
    }

    public boolean dueAt(long nowMs) {
        return enabled && state.nextRunAtMs() != null && state.nextRunAtMs() <= nowMs;
    }

    public CronJob withEnabled(boolean value, Long nextRunAtMs, long nowMs) {
        return new CronJob(
            id,
            name,
            value,
            schedule,
            payload,
            state.withNextRunAtMs(nextRunAtMs),
            createdAtMs,
            nowMs,
            deleteAfterRun
        );
    }

    public CronJob withState(CronJobState value, long nowMs) {
        return new CronJob(id, name, enabled, schedule, payload, value, createdAtMs, nowMs, deleteAfterRun);
    }
}
