package io.kairos.core.cron;

/**
 * Hook for failures the scheduler absorbs instead of raising: executor errors and store I/O.
 */
public interface CronEventListener {

    CronEventListener NOOP = new CronEventListener() {
    };

    default void onJobStarted(CronJob job) {
    }

    default void onJobFinished(CronJob job, JobStatus status, String error, long durationMs) {
    }

    default void onStoreLoadFailed(Exception error) {
    }

    default void onStoreSaveFailed(Exception error) {
    }
}
