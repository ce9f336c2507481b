package io.kairos.cli;

import io.kairos.core.cron.CronJob;
import io.kairos.core.cron.CronSchedule;
import java.time.Instant;
import java.time.format.DateTimeFormatter;

final class JobFormatter {

    private JobFormatter() {
    }

    static String line(CronJob job) {
        return job.id()
            + " | " + job.name()
            + " | " + (job.enabled() ? "enabled" : "disabled")
            + " | " + schedule(job.schedule())
            + " | next " + timestamp(job.state().nextRunAtMs())
            + " | last " + (job.state().lastStatus() == null ? "-" : job.state().lastStatus().wireName());
    }

    static String schedule(CronSchedule schedule) {
        if (schedule instanceof CronSchedule.At at) {
            return "once at " + timestamp(at.atMs());
        }
        if (schedule instanceof CronSchedule.Every every) {
            long ms = every.everyMs();
            return ms % 1000 == 0 ? "every " + (ms / 1000) + "s" : "every " + ms + "ms";
        }
        CronSchedule.Cron cron = (CronSchedule.Cron) schedule;
        return "cron '" + cron.expr() + "'" + (cron.tz() == null ? "" : " " + cron.tz());
    }

    static String timestamp(Long epochMs) {
        return epochMs == null ? "-" : DateTimeFormatter.ISO_INSTANT.format(Instant.ofEpochMilli(epochMs));
    }
}
