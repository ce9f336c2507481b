package io.kairos.core.cron;

import java.io.IOException;

public interface CronStore {
    CronStoreDocument load() throws IOException;

    void save(CronStoreDocument document) throws IOException;
}
