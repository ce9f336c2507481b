package io.kairos.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "gateway", description = "Run the scheduler, heartbeat and HTTP control gateway until interrupted")
public final class GatewayCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--port"}, description = "Gateway port override")
    Integer port;

    public GatewayCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return context.gatewayRunner().run(port);
        } catch (Exception e) {
            System.err.println("Gateway command failed: " + e.getMessage());
            return 1;
        }
    }
}
