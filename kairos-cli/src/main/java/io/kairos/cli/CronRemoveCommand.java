package io.kairos.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "remove", description = "Remove a job")
public final class CronRemoveCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Job id")
    String id;

    public CronRemoveCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (context.openCronService().remove(id)) {
                System.out.println("Removed: " + id);
                return 0;
            }
            System.err.println("Not found: " + id);
            return 1;
        } catch (Exception e) {
            System.err.println("Cron remove failed: " + e.getMessage());
            return 1;
        }
    }
}
