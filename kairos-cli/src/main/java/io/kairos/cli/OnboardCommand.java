package io.kairos.cli;

import io.kairos.core.config.OnboardResult;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "onboard", description = "Write config.json and prepare the cron store and heartbeat workspace")
public final class OnboardCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--reset", "--overwrite"}, description = "Replace an existing config.json with defaults")
    boolean reset;

    public OnboardCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            OnboardResult result = context.configService().onboard(context.configPath(), reset);
            String configState = switch (result.configAction()) {
                case CREATED -> "created";
                case RESET -> "reset to defaults";
                case MERGED -> "kept, new keys filled in";
            };
            System.out.println("Config (" + configState + "): " + result.configPath());
            System.out.println("Cron store: " + result.storePath());
            System.out.println("Heartbeat file (" + (result.heartbeatCreated() ? "created" : "kept") + "): "
                + result.heartbeatFile());
            System.out.println("Add a job with: kairos cron add --name <name> --message <text> --every 1h");
            return 0;
        } catch (Exception e) {
            System.err.println("Onboard failed: " + e.getMessage());
            return 1;
        }
    }
}
