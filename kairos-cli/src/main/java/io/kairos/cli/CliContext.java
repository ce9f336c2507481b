package io.kairos.cli;

import io.kairos.core.config.ConfigPaths;
import io.kairos.core.config.ConfigService;
import io.kairos.core.config.model.KairosConfig;
import io.kairos.core.cron.CronService;
import io.kairos.core.cron.FileCronStore;
import io.kairos.core.cron.TaskExecutor;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;

public record CliContext(
    ConfigService configService,
    Path configPath,
    TaskExecutor executor,
    Clock clock,
    ZoneId zone,
    GatewayRunner gatewayRunner
) {
    public CliContext(ConfigService configService, Path configPath, TaskExecutor executor) {
        this(configService, configPath, executor, Clock.systemUTC(), ZoneId.systemDefault(), portOverride -> {
            throw new UnsupportedOperationException("gateway runner is not configured");
        });
    }

    public KairosConfig config() throws IOException {
        return configService.load(configPath);
    }

    public Path storePath() throws IOException {
        return ConfigPaths.resolveStorePath(config().cron().storePath());
    }

    /**
     * Opens the persisted registry without starting the scheduler loop.
     */
    public CronService openCronService() throws IOException {
        KairosConfig config = config();
        CronService service = new CronService(
            new FileCronStore(ConfigPaths.resolveStorePath(config.cron().storePath())),
            clock,
            executor
        );
        service.load();
        return service;
    }
}
