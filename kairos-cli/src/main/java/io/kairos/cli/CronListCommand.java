package io.kairos.cli;

import io.kairos.core.cron.CronJob;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "list", description = "List scheduled jobs, soonest first")
public final class CronListCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-a", "--all"}, description = "Include disabled jobs")
    boolean includeDisabled;

    public CronListCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            List<CronJob> jobs = context.openCronService().list(includeDisabled);
            if (jobs.isEmpty()) {
                System.out.println("No jobs");
                return 0;
            }
            jobs.forEach(job -> System.out.println(JobFormatter.line(job)));
            return 0;
        } catch (Exception e) {
            System.err.println("Cron list failed: " + e.getMessage());
            return 1;
        }
    }
}
