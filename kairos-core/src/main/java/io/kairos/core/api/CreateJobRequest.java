package io.kairos.core.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.kairos.core.cron.CronPayload;
import io.kairos.core.cron.CronSchedule;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CreateJobRequest(
    String name,
    CronSchedule schedule,
    CronPayload payload,
    boolean deleteAfterRun
) {
}
