package io.kairos.cli;

import io.kairos.core.cron.CronJob;
import io.kairos.core.cron.CronPayload;
import io.kairos.core.cron.CronSchedule;
import io.kairos.core.cron.NextRunCalculator;
import io.kairos.core.cron.ScheduleParser;
import java.util.concurrent.Callable;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "add", description = "Add a scheduled job")
public final class CronAddCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-n", "--name"}, required = true, description = "Job name")
    String name;

    @Option(names = {"-m", "--message"}, required = true, description = "Message handed to the executor")
    String message;

    @ArgGroup(exclusive = true, multiplicity = "1")
    When when;

    @Option(names = "--tz", description = "Timezone for --cron (default UTC)")
    String tz;

    @Option(names = "--kind", defaultValue = CronPayload.AGENT_TURN, description = "Payload kind (default: ${DEFAULT-VALUE})")
    String kind;

    @Option(names = "--deliver", description = "Deliver the executor's response")
    boolean deliver;

    @Option(names = "--channel", description = "Delivery channel")
    String channel;

    @Option(names = "--to", description = "Delivery recipient")
    String to;

    @Option(names = "--delete-after-run", description = "Delete a one-shot job after it runs")
    boolean deleteAfterRun;

    static final class When {
        @Option(names = "--every", description = "Interval, e.g. 30s, 5m, 2h")
        String every;

        @Option(names = "--at", description = "One-shot time, e.g. 'in 10m', 'tomorrow at 9am', ISO-8601")
        String at;

        @Option(names = "--cron", description = "Cron expression (5 fields, or 6 with seconds)")
        String cron;
    }

    public CronAddCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CronSchedule schedule = schedule();
            CronPayload payload = new CronPayload(kind, message, deliver, channel, to);
            CronJob job = context.openCronService().add(name, schedule, payload, deleteAfterRun);
            System.out.println("Created job " + job.id() + " (" + JobFormatter.schedule(job.schedule()) + ")");
            System.out.println("Next run: " + JobFormatter.timestamp(job.state().nextRunAtMs()));
            return 0;
        } catch (Exception e) {
            System.err.println("Cron add failed: " + e.getMessage());
            return 1;
        }
    }

    private CronSchedule schedule() {
        ScheduleParser parser = new ScheduleParser(context.clock(), context.zone());
        if (when.every != null) {
            return parser.every(when.every);
        }
        if (when.at != null) {
            return parser.at(when.at);
        }
        CronSchedule.Cron cron = CronSchedule.cron(when.cron, tz);
        if (!new NextRunCalculator().isValid(cron)) {
            throw new IllegalArgumentException("invalid cron expression or timezone: " + when.cron);
        }
        return cron;
    }
}
