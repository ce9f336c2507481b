package io.kairos.cli;

import io.kairos.core.cron.CronService;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "run", description = "Run a job now")
public final class CronRunCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Job id")
    String id;

    @Option(names = {"-f", "--force"}, description = "Run even if the job is disabled")
    boolean force;

    public CronRunCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CronService service = context.openCronService();
            if (!service.run(id, force)) {
                System.err.println("Not run: " + id + " (unknown id, or disabled without --force)");
                return 1;
            }
            String outcome = service.job(id)
                .map(job -> job.state().lastStatus() == null ? "-" : job.state().lastStatus().wireName()
                    + (job.state().lastError() == null ? "" : ": " + job.state().lastError()))
                .orElse("finished (job deleted after run)");
            System.out.println("Ran " + id + ": " + outcome);
            return 0;
        } catch (Exception e) {
            System.err.println("Cron run failed: " + e.getMessage());
            return 1;
        }
    }
}
