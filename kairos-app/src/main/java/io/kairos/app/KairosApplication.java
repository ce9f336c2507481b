package io.kairos.app;

import io.kairos.cli.CliContext;
import io.kairos.cli.KairosCliCommand;
import io.kairos.core.api.CronGatewayServer;
import io.kairos.core.config.ConfigPaths;
import io.kairos.core.config.ConfigService;
import io.kairos.core.config.model.KairosConfig;
import io.kairos.core.cron.CronMetrics;
import io.kairos.core.cron.CronService;
import io.kairos.core.cron.FileCronStore;
import io.kairos.core.cron.TaskExecutor;
import io.kairos.core.heartbeat.HeartbeatService;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class KairosApplication {
    private static final Logger LOG = LoggerFactory.getLogger(KairosApplication.class);

    private KairosApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        TaskExecutor executor = new LoggingTaskExecutor();

        CliContext context = new CliContext(
            configService,
            configPath,
            executor,
            Clock.systemUTC(),
            ZoneId.systemDefault(),
            portOverride -> runGateway(configService, configPath, executor, portOverride)
        );

        int exitCode = KairosCliCommand.commandLine(context).execute(args);
        System.exit(exitCode);
    }

    static int runGateway(
        ConfigService configService,
        Path configPath,
        TaskExecutor executor,
        Integer portOverride
    ) throws Exception {
        KairosConfig config = configService.load(configPath);
        Path storePath = ConfigPaths.resolveStorePath(config.cron().storePath());
        Path workspace = ConfigPaths.resolveWorkspace(config.heartbeat().workspace());
        int port = portOverride != null ? portOverride : config.gateway().port();

        CronMetrics metrics = new CronMetrics();
        CountDownLatch shutdown = new CountDownLatch(1);
        try (CronService cronService = new CronService(
                new FileCronStore(storePath),
                Clock.systemUTC(),
                executor,
                config.cron().toSettings(),
                metrics
            );
             HeartbeatService heartbeat = new HeartbeatService(
                 workspace,
                 Duration.ofSeconds(config.heartbeat().intervalSeconds()),
                 config.heartbeat().enabled(),
                 prompt -> {
                     LOG.info("Heartbeat prompt issued for {}", workspace);
                     return HeartbeatService.OK_TOKEN;
                 }
             );
             CronGatewayServer server = new CronGatewayServer(port, config.gateway().host(), cronService, metrics)) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            cronService.start();
            heartbeat.start();
            server.start();
            System.out.println("Kairos gateway started on http://" + config.gateway().host() + ":" + server.port());
            System.out.println("Cron store: " + storePath);
            shutdown.await();
        }
        return 0;
    }
}
