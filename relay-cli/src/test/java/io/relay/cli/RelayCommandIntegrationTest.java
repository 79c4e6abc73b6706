package io.relay.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.relay.core.agent.AgentOrchestrator;
import io.relay.core.agent.OrchestratorContext;
import io.relay.core.backend.BackendRegistry;
import io.relay.core.backend.BackendRouter;
import io.relay.core.backend.claude.ClaudeCliBackend;
import io.relay.core.bus.InMemoryUiEventBus;
import io.relay.core.config.ConfigService;
import io.relay.core.config.model.ClaudeBackendConfig;
import io.relay.core.model.Conversation;
import io.relay.core.store.FileMessageStore;
import io.relay.core.workspace.DirectWorkspaceBinder;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class RelayCommandIntegrationTest {

    @TempDir
    Path tempDir;

    private OrchestratorContext orchestratorContext;
    private AgentOrchestrator orchestrator;
    private CliContext context;
    private Path repo;

    @BeforeEach
    void setUp() throws Exception {
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")), "requires /bin/sh");
        repo = Files.createDirectories(tempDir.resolve("repo"));
        Path claude = tempDir.resolve("claude.sh");
        Files.writeString(claude, """
            #!/bin/sh
            echo '{"type":"system","subtype":"init","session_id":"S1","model":"sonnet"}'
            echo '{"type":"assistant","message":{"content":[{"type":"text","text":"Hi there"}]}}'
            echo '{"type":"result","session_id":"S1","total_cost_usd":0.01,"duration_ms":1000,"num_turns":1}'
            """);
        assertThat(claude.toFile().setExecutable(true)).isTrue();

        InMemoryUiEventBus bus = new InMemoryUiEventBus();
        orchestratorContext = OrchestratorContext.create(bus, Duration.ofMinutes(1), Clock.systemUTC());
        BackendRegistry registry = new BackendRegistry();
        registry.register(new ClaudeCliBackend(new ClaudeBackendConfig("cli", claude.toString(), List.of()), new ObjectMapper()));
        orchestrator = new AgentOrchestrator(
            orchestratorContext,
            new FileMessageStore(tempDir.resolve("store")),
            new BackendRouter(registry),
            new DirectWorkspaceBinder()
        );
        context = new CliContext(orchestrator, bus, new ConfigService(), tempDir.resolve("config.json"));
    }

    @AfterEach
    void tearDown() {
        if (orchestratorContext != null) {
            orchestratorContext.close();
        }
    }

    @Test
    void shouldCreateConversationAndStreamTurnOutput() throws Exception {
        String created = run(new ConversationCommand(context), 0, "--repo", repo.toString());
        assertThat(created).startsWith("Created conversation: ");
        String conversationId = created.substring("Created conversation: ".length()).trim();

        String sent = run(new SendCommand(context), 0, conversationId, "say hi", "--permissions", "deny");

        assertThat(sent).contains("Hi there").contains("[system] Session started with model sonnet").contains("Turn completed");
        assertThat(orchestrator.getResumeToken("claude")).contains("S1");

        String history = run(new HistoryCommand(context), 0, conversationId);
        assertThat(history)
            .contains("# say hi")
            .contains("[user] say hi")
            .contains("[assistant] Hi there");

        String listed = run(new ConversationCommand(context), 0, "--list");
        assertThat(listed).contains(conversationId).contains("4 messages");
    }

    @Test
    void shouldFailSendForUnknownConversation() throws Exception {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            run(new SendCommand(context), 1, "missing", "hello");
        } finally {
            System.setErr(originalErr);
        }
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Send failed: Unknown conversation: missing");
    }

    @Test
    void shouldOnboardAndReportStatus() throws Exception {
        Path storeDir = tempDir.resolve("sessions");
        Files.writeString(context.configPath(), """
            { "store": { "directory": "%s" } }
            """.formatted(storeDir.toString().replace("\\", "\\\\")));

        String onboard = run(new OnboardCommand(context), 0);
        assertThat(onboard).contains("Refreshed config with new defaults").contains("Session store ready");
        assertThat(Files.isDirectory(storeDir)).isTrue();

        String status = run(new StatusCommand(context), 0);
        assertThat(status)
            .contains("Config exists: true")
            .contains("Claude backend: cli (claude)")
            .contains("Research configured: false")
            .contains("Conversations: 0");
    }

    @Test
    void shouldStopTurnAtTimeoutEvenWhileOutputKeepsArriving() throws Exception {
        Path chatty = tempDir.resolve("chatty.sh");
        Files.writeString(chatty, """
            #!/bin/sh
            echo '{"type":"system","subtype":"init","session_id":"S2","model":"sonnet"}'
            while true; do
              echo '{"type":"assistant","message":{"content":[{"type":"text","text":"tick"}]}}'
              sleep 0.005
            done
            """);
        assertThat(chatty.toFile().setExecutable(true)).isTrue();
        BackendRegistry registry = new BackendRegistry();
        registry.register(new ClaudeCliBackend(new ClaudeBackendConfig("cli", chatty.toString(), List.of()), new ObjectMapper()));
        AgentOrchestrator chattyOrchestrator = new AgentOrchestrator(
            orchestratorContext,
            new FileMessageStore(tempDir.resolve("chatty-store")),
            new BackendRouter(registry),
            new DirectWorkspaceBinder()
        );
        CliContext chattyContext = new CliContext(chattyOrchestrator, context.eventBus(), new ConfigService(), context.configPath());
        Conversation conversation = chattyOrchestrator.createConversation("default", "claude", repo.toString(), "claude", null);

        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        String sent;
        try {
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            sent = run(new SendCommand(chattyContext), 1, conversation.id(), "talk", "--timeout", "1");
        } finally {
            System.setErr(originalErr);
        }

        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Turn timed out, stopping");
        assertThat(sent).contains("tick").contains("Turn cancelled");
        assertThat(chattyOrchestrator.isRunning(conversation.id())).isFalse();
    }

    @Test
    void shouldRenderToolInputAsJson() {
        SendCommand send = new SendCommand(context);

        assertThat(send.describeInput(Map.of("command", "ls -la"))).isEqualTo("{\"command\":\"ls -la\"}");
        assertThat(send.describeInput(null)).isEqualTo("{}");
    }

    @Test
    void shouldStoreAgentFileSetting() throws Exception {
        String created = run(new ConversationCommand(context), 0, "--repo", repo.toString(), "--agent-file", "REVIEWER.md");
        String conversationId = created.substring("Created conversation: ".length()).trim();

        Conversation conversation = orchestrator.loadConversation(conversationId).orElseThrow().conversation();

        assertThat(conversation.settings().agentFile()).isEqualTo("REVIEWER.md");
    }

    @Test
    void shouldRejectUnknownPermissionMode() throws Exception {
        run(new ConversationCommand(context), 1, "--repo", repo.toString(), "--permission-mode", "yolo");

        assertThat(orchestrator.listConversations()).isEmpty();
    }

    private static String run(Object command, int expectedCode, String... args) {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            int code = new CommandLine(command).execute(args);
            assertThat(code).isEqualTo(expectedCode);
        } finally {
            System.setOut(originalOut);
        }
        return out.toString(StandardCharsets.UTF_8);
    }
}
