package io.kairos.cli;

import picocli.CommandLine.Command;

@Command(name = "cron", mixinStandardHelpOptions = true, description = "Manage scheduled jobs")
public final class CronCommand implements Runnable {

    @Override
    public void run() {
        // Group command only shows help when no subcommand is provided.
    }
}
