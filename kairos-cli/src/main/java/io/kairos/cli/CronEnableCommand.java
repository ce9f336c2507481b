package io.kairos.cli;

import io.kairos.core.cron.CronJob;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(description = "Enable or disable a job")
public final class CronEnableCommand implements Callable<Integer> {
    private final CliContext context;
    private final boolean enabled;

    @Parameters(index = "0", description = "Job id")
    String id;

    public CronEnableCommand(CliContext context, boolean enabled) {
        this.context = context;
        this.enabled = enabled;
    }

    @Override
    public Integer call() {
        try {
            Optional<CronJob> job = context.openCronService().enable(id, enabled);
            if (job.isEmpty()) {
                System.err.println("Not found: " + id);
                return 1;
            }
            System.out.println((enabled ? "Enabled: " : "Disabled: ") + JobFormatter.line(job.get()));
            return 0;
        } catch (Exception e) {
            System.err.println("Cron " + (enabled ? "enable" : "disable") + " failed: " + e.getMessage());
            return 1;
        }
    }
}
