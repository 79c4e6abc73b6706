package io.relay.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "gateway", description = "Start the HTTP/WebSocket gateway")
public final class GatewayCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--port"}, description = "Gateway port (defaults to the configured port)")
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
