package io.relay.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.relay.cli.CliContext;
import io.relay.cli.ConversationCommand;
import io.relay.cli.GatewayCommand;
import io.relay.cli.HistoryCommand;
import io.relay.cli.OnboardCommand;
import io.relay.cli.RelayCliCommand;
import io.relay.cli.SendCommand;
import io.relay.cli.StatusCommand;
import io.relay.core.agent.AgentOrchestrator;
import io.relay.core.agent.OrchestratorContext;
import io.relay.core.api.GatewayServer;
import io.relay.core.backend.BackendRegistry;
import io.relay.core.backend.BackendRouter;
import io.relay.core.backend.claude.ClaudeBridgeBackend;
import io.relay.core.backend.claude.ClaudeCliBackend;
import io.relay.core.backend.research.OpenAiResearchBackend;
import io.relay.core.bus.InMemoryUiEventBus;
import io.relay.core.config.ConfigPaths;
import io.relay.core.config.ConfigService;
import io.relay.core.config.model.GatewayConfig;
import io.relay.core.config.model.RelayConfig;
import io.relay.core.config.model.StoreConfig;
import io.relay.core.store.FileMessageStore;
import io.relay.core.store.MessageStore;
import io.relay.core.store.SqliteMessageStore;
import io.relay.core.workspace.DirectWorkspaceBinder;
import io.relay.core.workspace.GitWorkspaceBinder;
import io.relay.core.workspace.WorkspaceBinder;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class RelayApplication {
    private static final Logger LOG = LoggerFactory.getLogger(RelayApplication.class);

    private RelayApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        RelayConfig config = loadConfig(configService, configPath);

        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        InMemoryUiEventBus eventBus = new InMemoryUiEventBus();
        OrchestratorContext context = OrchestratorContext.create(
            eventBus,
            Duration.ofSeconds(Math.max(1, config.permissions().timeoutSeconds())),
            Clock.systemUTC()
        );

        BackendRegistry registry = new BackendRegistry();
        if (config.backends().claude().bridgeMode()) {
            registry.register(new ClaudeBridgeBackend(config.backends().claude(), context.permissionGate(), mapper));
        } else {
            registry.register(new ClaudeCliBackend(config.backends().claude(), mapper));
        }
        registry.register(new OpenAiResearchBackend(config.backends().research(), mapper));

        WorkspaceBinder binder = config.git().autoBranch()
            ? new GitWorkspaceBinder(config.git())
            : new DirectWorkspaceBinder();

        AgentOrchestrator orchestrator = new AgentOrchestrator(
            context,
            buildMessageStore(config.store()),
            new BackendRouter(registry),
            binder,
            config.conversationDefaults(),
            Duration.ofDays(Math.max(1, config.sessions().maxAgeDays()))
        );

        CliContext cliContext = new CliContext(
            orchestrator,
            eventBus,
            configService,
            configPath,
            port -> runGateway(configService, configPath, port, orchestrator, eventBus)
        );

        CommandLine commandLine = new CommandLine(new RelayCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(cliContext));
        commandLine.addSubcommand("status", new StatusCommand(cliContext));
        commandLine.addSubcommand("conversation", new ConversationCommand(cliContext));
        commandLine.addSubcommand("send", new SendCommand(cliContext));
        commandLine.addSubcommand("history", new HistoryCommand(cliContext));
        commandLine.addSubcommand("gateway", new GatewayCommand(cliContext));

        int exitCode;
        try {
            exitCode = commandLine.execute(args);
        } finally {
            context.close();
        }
        System.exit(exitCode);
    }

    private static RelayConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Failed to load config from {}, using defaults: {}", configPath, e.getMessage());
            return RelayConfig.defaults();
        }
    }

    private static MessageStore buildMessageStore(StoreConfig store) {
        if (store.sqlite()) {
            Path sqlitePath = ConfigPaths.resolve(store.sqlitePath(), ConfigPaths.relayHome().resolve("relay.db"));
            try {
                return new SqliteMessageStore(sqlitePath);
            } catch (Exception e) {
                throw new IllegalStateException("Failed to initialize SQLite message store at " + sqlitePath, e);
            }
        }
        return new FileMessageStore(ConfigService.storeDirectory(store));
    }

    private static int runGateway(
        ConfigService configService,
        Path configPath,
        Integer portOverride,
        AgentOrchestrator orchestrator,
        InMemoryUiEventBus eventBus
    ) throws Exception {
        GatewayConfig gateway = configService.load(configPath).gateway();
        int port = portOverride != null ? portOverride : gateway.port();

        CountDownLatch shutdown = new CountDownLatch(1);
        try (GatewayServer server = new GatewayServer(port, gateway.host(), orchestrator, eventBus, gateway.token())) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            server.start();
            System.out.println("Gateway started on http://" + gateway.host() + ":" + server.port());
            System.out.println("Endpoints: WS /ws?client_id=<id>, GET|POST /conversations, GET /conversations/{id}, GET /healthz");
            shutdown.await();
        }
        return 0;
    }
}
