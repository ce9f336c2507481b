package io.kairos.app;

import io.kairos.core.cron.CronJob;
import io.kairos.core.cron.CronPayload;
import io.kairos.core.cron.TaskExecutor;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default host action: writes each fired job's payload to the log. Embedders replace it with a real executor through
 * {@link io.kairos.core.cron.CronService#setExecutor}.
 */
final class LoggingTaskExecutor implements TaskExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingTaskExecutor.class);

    @Override
    public CompletionStage<Void> execute(CronJob job) {
        CronPayload payload = job.payload();
        if (payload.deliver()) {
            LOG.info("[{}] {} -> {}:{}: {}", job.name(), payload.kind(), payload.channel(), payload.to(), payload.message());
        } else {
            LOG.info("[{}] {}: {}", job.name(), payload.kind(), payload.message());
        }
        return CompletableFuture.completedFuture(null);
    }
}
