package io.kairos.app;

import static org.assertj.core.api.Assertions.assertThat;

import io.kairos.core.cron.CronJob;
import io.kairos.core.cron.CronPayload;
import io.kairos.core.cron.CronSchedule;
import org.junit.jupiter.api.Test;

class LoggingTaskExecutorTest {

    @Test
    void shouldCompleteNormallyForEveryPayloadShape() {
        LoggingTaskExecutor executor = new LoggingTaskExecutor();
        CronJob plain = new CronJob("a1b2c3d4", "plain", true, CronSchedule.every(1_000),
            CronPayload.agentTurn("hello"), null, 0, 0, false);
        CronJob delivered = new CronJob("e5f6a7b8", "delivered", true, CronSchedule.at(5),
            CronPayload.delivered("digest", "telegram", "42"), null, 0, 0, true);

        assertThat(executor.execute(plain).toCompletableFuture()).isCompleted();
        assertThat(executor.execute(delivered).toCompletableFuture()).isCompleted();
        assertThat(executor.execute(delivered).toCompletableFuture()).isNotCompletedExceptionally();
    }
}
