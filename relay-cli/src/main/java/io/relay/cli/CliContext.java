package io.relay.cli;

import io.relay.core.agent.AgentOrchestrator;
import io.relay.core.bus.UiEventBus;
import io.relay.core.config.ConfigService;
import java.nio.file.Path;

public record CliContext(
    AgentOrchestrator orchestrator,
    UiEventBus eventBus,
    ConfigService configService,
    Path configPath,
    GatewayRunner gatewayRunner
) {
    public CliContext(AgentOrchestrator orchestrator, UiEventBus eventBus, ConfigService configService, Path configPath) {
        this(orchestrator, eventBus, configService, configPath, port -> {
            throw new UnsupportedOperationException("gateway runner is not configured");
        });
    }
}
