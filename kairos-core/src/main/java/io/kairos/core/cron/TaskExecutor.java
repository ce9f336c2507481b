package io.kairos.core.cron;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Performs the real action for a due job. A normally completed stage is success; an exceptionally
 * completed stage, or an exception thrown by {@link #execute}, is failure and its message is recorded
 * as the job's last error. The scheduler never cancels a stage; an executor owns its own timeouts.
 */
@FunctionalInterface
public interface TaskExecutor {

    CompletionStage<Void> execute(CronJob job);

    static TaskExecutor noop() {
        return job -> CompletableFuture.completedFuture(null);
    }

    static TaskExecutor blocking(BlockingTask task) {
        return job -> {
            try {
                task.run(job);
                return CompletableFuture.completedFuture(null);
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
        };
    }

    @FunctionalInterface
    interface BlockingTask {
        void run(CronJob job) throws Exception;
    }
}
