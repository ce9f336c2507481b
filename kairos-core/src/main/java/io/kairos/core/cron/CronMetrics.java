package io.kairos.core.cron;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

public final class CronMetrics implements CronEventListener {
    private final AtomicLong executions = new AtomicLong();
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong totalDurationMs = new AtomicLong();
    private final AtomicLong storeLoadFailures = new AtomicLong();
    private final AtomicLong storeSaveFailures = new AtomicLong();

    @Override
    public void onJobStarted(CronJob job) {
        executions.incrementAndGet();
    }

    @Override
    public void onJobFinished(CronJob job, JobStatus status, String error, long durationMs) {
        if (status == JobStatus.ERROR) {
            failed.incrementAndGet();
        } else {
            succeeded.incrementAndGet();
        }
        totalDurationMs.addAndGet(Math.max(0, durationMs));
    }

    @Override
    public void onStoreLoadFailed(Exception error) {
        storeLoadFailures.incrementAndGet();
    }

    @Override
    public void onStoreSaveFailed(Exception error) {
        storeSaveFailures.incrementAndGet();
    }

    public long executions() {
        return executions.get();
    }

    public long succeeded() {
        return succeeded.get();
    }

    public long failed() {
        return failed.get();
    }

    public long storeLoadFailures() {
        return storeLoadFailures.get();
    }

    public long storeSaveFailures() {
        return storeSaveFailures.get();
    }

    public double averageDurationMs() {
        long finished = succeeded.get() + failed.get();
        return finished == 0 ? 0.0 : (double) totalDurationMs.get() / finished;
    }

    public Map<String, Object> snapshot() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("executions", executions());
        values.put("succeeded", succeeded());
        values.put("failed", failed());
        values.put("average_duration_ms", averageDurationMs());
        values.put("store_load_failures", storeLoadFailures());
        values.put("store_save_failures", storeSaveFailures());
        return values;
    }
}
