package io.relay.cli;

import io.relay.core.config.ConfigService;
import io.relay.core.config.model.RelayConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show runtime and configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            RelayConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Store: " + config.store().type() + " (" + ConfigService.storeDirectory(config.store()) + ")");
            System.out.println("Claude backend: " + config.backends().claude().mode()
                + " (" + (config.backends().claude().bridgeMode()
                    ? String.join(" ", config.backends().claude().bridgeCommand())
                    : config.backends().claude().executable()) + ")");
            System.out.println("Research configured: " + config.backends().research().configured());
            System.out.println("Research model: " + config.backends().research().model());
            System.out.println("Auto branch: " + config.git().autoBranch()
                + ", worktrees: " + config.git().useWorktrees()
                + ", auto commit: " + config.git().autoCommit());
            System.out.println("Session max age: " + config.sessions().maxAgeDays() + " days");
            System.out.println("Gateway: " + config.gateway().host() + ":" + config.gateway().port());
            System.out.println("Conversations: " + context.orchestrator().listConversations().size());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
