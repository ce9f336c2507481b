package io.kairos.core.cron;

import java.util.List;

public record CronStoreDocument(int version, List<CronJob> jobs) {
    public static final int CURRENT_VERSION = 1;

    public CronStoreDocument {
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
    }

    public static CronStoreDocument empty() {
        return new CronStoreDocument(CURRENT_VERSION, List.of());
    }

    public static CronStoreDocument of(List<CronJob> jobs) {
        return new CronStoreDocument(CURRENT_VERSION, jobs);
    }
}
