package io.kairos.core.cron;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Runtime state of a job. A {@code null} field is absent in the store; a {@code null} status means the job never ran.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CronJobState(
    Long nextRunAtMs,
    Long lastRunAtMs,
    JobStatus lastStatus,
    String lastError
) {

    public static CronJobState empty() {
        return new CronJobState(null, null, null, null);
    }

    public static CronJobState scheduled(Long nextRunAtMs) {
        return new CronJobState(nextRunAtMs, null, null, null);
    }

    public CronJobState withNextRunAtMs(Long next) {
        return new CronJobState(next, lastRunAtMs, lastStatus, lastError);
    }

    public CronJobState completed(long startedAtMs, JobStatus status, String error) {
        return new CronJobState(nextRunAtMs, startedAtMs, status, status == JobStatus.ERROR ? error : null);
    }
}
