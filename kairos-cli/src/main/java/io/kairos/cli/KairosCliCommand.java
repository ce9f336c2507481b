package io.kairos.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(name = "kairos", mixinStandardHelpOptions = true, description = "Kairos durable job scheduler")
public final class KairosCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }

    public static CommandLine commandLine(CliContext context) {
        CommandLine cron = new CommandLine(new CronCommand());
        cron.addSubcommand("list", new CronListCommand(context));
        cron.addSubcommand("add", new CronAddCommand(context));
        cron.addSubcommand("remove", new CronRemoveCommand(context));
        cron.addSubcommand("enable", new CronEnableCommand(context, true));
        cron.addSubcommand("disable", new CronEnableCommand(context, false));
        cron.addSubcommand("run", new CronRunCommand(context));

        CommandLine root = new CommandLine(new KairosCliCommand());
        root.addSubcommand("onboard", new OnboardCommand(context));
        root.addSubcommand("status", new StatusCommand(context));
        root.addSubcommand("gateway", new GatewayCommand(context));
        root.addSubcommand("cron", cron);
        return root;
    }
}
