package io.kairos.cli;

import io.kairos.core.config.ConfigPaths;
import io.kairos.core.config.model.KairosConfig;
import io.kairos.core.cron.CronStatus;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and scheduler status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            KairosConfig config = context.config();
            CronStatus status = context.openCronService().status();
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Cron store: " + context.storePath());
            System.out.println("Jobs: " + status.jobCount());
            System.out.println("Next wake: " + JobFormatter.timestamp(status.nextWakeAtMs()));
            System.out.println("Heartbeat: " + (config.heartbeat().enabled()
                ? "every " + config.heartbeat().intervalSeconds() + "s"
                : "disabled"));
            System.out.println("Workspace: " + ConfigPaths.resolveWorkspace(config.heartbeat().workspace()));
            System.out.println("Gateway: " + config.gateway().host() + ":" + config.gateway().port());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
