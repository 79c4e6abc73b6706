package io.relay.core.agent;

import static org.assertj.core.api.Assertions.assertThat;

import io.relay.core.backend.BackendConfigurationException;
import io.relay.core.backend.BackendException;
import io.relay.core.backend.BackendRegistry;
import io.relay.core.backend.BackendRouter;
import io.relay.core.backend.TurnRequest;
import io.relay.core.bus.InMemoryUiEventBus;
import io.relay.core.bus.UiEvent;
import io.relay.core.bus.UiEventType;
import io.relay.core.model.Conversation;
import io.relay.core.model.ConversationSettings;
import io.relay.core.model.ConversationUpdate;
import io.relay.core.model.Message;
import io.relay.core.model.MessageType;
import io.relay.core.model.PermissionMode;
import io.relay.core.permission.PermissionDecision;
import io.relay.core.permission.PermissionResponse;
import io.relay.core.store.FileMessageStore;
import io.relay.core.turn.TurnOutcome;
import io.relay.core.workspace.RecordingWorkspaceBinder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AgentOrchestratorTest {
    private static final String INIT = "{\"type\":\"system\",\"subtype\":\"init\",\"session_id\":\"S1\",\"model\":\"sonnet\"}";
    private static final String HI = "{\"type\":\"assistant\",\"message\":{\"content\":[{\"type\":\"text\",\"text\":\"Hi\"}]}}";
    private static final String RESULT = "{\"type\":\"result\",\"session_id\":\"S1\",\"total_cost_usd\":0.01,"
        + "\"duration_ms\":1000,\"num_turns\":1}";

    @TempDir
    Path tempDir;

    private final InMemoryUiEventBus bus = new InMemoryUiEventBus();
    private final ScriptedBackend backend = new ScriptedBackend();
    private final RecordingWorkspaceBinder binder = new RecordingWorkspaceBinder();
    private final List<UiEvent> seen = new ArrayList<>();
    private OrchestratorContext context;
    private FileMessageStore store;
    private AgentOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        context = OrchestratorContext.create(bus, Duration.ofMinutes(1), Clock.systemUTC());
        store = new FileMessageStore(tempDir.resolve("store"));
        BackendRegistry registry = new BackendRegistry();
        registry.register(backend);
        orchestrator = new AgentOrchestrator(context, store, new BackendRouter(registry), binder);
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    @Test
    void shouldRunTurnAndPersistConversation() throws Exception {
        Conversation conversation = create();
        backend.completedScript(INIT, HI, RESULT);

        TurnOutcome outcome = orchestrator.startTurn(conversation.id(), "hello").get(5, TimeUnit.SECONDS);

        assertThat(outcome).isEqualTo(TurnOutcome.COMPLETED);
        assertThat(contents(conversation.id())).containsExactly(
            "hello",
            "Session started with model sonnet",
            "Hi",
            "Turn completed: 1 turns, $0.0100 USD, 1.0s"
        );
        Conversation updated = store.require(conversation.id());
        assertThat(updated.sessionId()).isEqualTo("S1");
        assertThat(updated.title()).isEqualTo("hello");
        assertThat(orchestrator.getResumeToken("agent-1")).contains("S1");
        assertThat(orchestrator.isRunning(conversation.id())).isFalse();

        List<String> statuses = statuses();
        assertThat(statuses).first().isEqualTo(UiEvent.BUSY);
        assertThat(statuses).last().isEqualTo(UiEvent.READY);
    }

    @Test
    void shouldResumeWithStoredSessionOnNextTurn() throws Exception {
        Conversation conversation = create();
        backend.completedScript(INIT, HI, RESULT);
        orchestrator.startTurn(conversation.id(), "hello").get(5, TimeUnit.SECONDS);
        backend.completedScript(HI);

        orchestrator.startTurn(conversation.id(), "again").get(5, TimeUnit.SECONDS);

        assertThat(backend.requests).extracting(request -> request.resumeToken()).containsExactly(null, "S1");
        assertThat(backend.requests.get(1).history()).extracting(Message::content).contains("hello", "Hi");
        assertThat(store.require(conversation.id()).title()).isEqualTo("hello");
    }

    @Test
    void shouldStartFreshSessionWhenStoredOneExpired() throws Exception {
        Conversation conversation = create();
        Instant expiredAt = Instant.now().minus(Duration.ofDays(30));
        store.update(conversation.id(), ConversationUpdate.session("OLD", expiredAt));
        backend.completedScript(INIT, HI, RESULT);

        orchestrator.startTurn(conversation.id(), "hello").get(5, TimeUnit.SECONDS);

        assertThat(backend.requests.get(0).resumeToken()).isNull();
        Conversation updated = store.require(conversation.id());
        assertThat(updated.sessionId()).isEqualTo("S1");
        assertThat(updated.sessionCreatedAt()).isAfter(expiredAt.plus(Duration.ofDays(29)));
        assertThat(updated.title()).isEqualTo(Conversation.DEFAULT_TITLE);
    }

    @Test
    void shouldStopRunningTurnAndRecordStop() throws Exception {
        Conversation conversation = create();
        backend.script(INIT);

        CompletableFuture<TurnOutcome> turn = orchestrator.startTurn(conversation.id(), "long task");
        assertThat(backend.awaitInvocation()).isTrue();
        awaitEvent(event -> event.type() == UiEventType.SESSION_UPDATE);

        assertThat(orchestrator.stop(conversation.id())).isTrue();

        assertThat(turn.get(5, TimeUnit.SECONDS)).isEqualTo(TurnOutcome.CANCELLED);
        List<Message> messages = store.load(conversation.id()).orElseThrow().messages();
        assertThat(messages).extracting(Message::type).doesNotContain(MessageType.ASSISTANT);
        assertThat(messages.get(messages.size() - 1).content()).isEqualTo("Agent stopped by user");
        assertThat(orchestrator.stop(conversation.id())).isFalse();
        assertThat(orchestrator.isRunning(conversation.id())).isFalse();
        assertThat(statuses()).last().isEqualTo(UiEvent.READY);
    }

    @Test
    void shouldSupersedeRunningTurnAndKeepMessageOrder() throws Exception {
        Conversation conversation = create();
        backend.script(INIT);
        CompletableFuture<TurnOutcome> first = orchestrator.startTurn(conversation.id(), "first");
        assertThat(backend.awaitInvocation()).isTrue();

        backend.completedScript(HI);
        CompletableFuture<TurnOutcome> second = orchestrator.startTurn(conversation.id(), "second");

        assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo(TurnOutcome.CANCELLED);
        assertThat(second.get(5, TimeUnit.SECONDS)).isEqualTo(TurnOutcome.COMPLETED);
        List<String> contents = contents(conversation.id());
        assertThat(contents.indexOf("Agent stopped by user")).isLessThan(contents.indexOf("second"));
        assertThat(contents).endsWith("Hi");
        assertThat(orchestrator.activeTurns()).isZero();
    }

    @Test
    void shouldLeaveReadyStatusToTheSupersedingTurn() throws Exception {
        Conversation conversation = create();
        backend.script(INIT);
        CompletableFuture<TurnOutcome> first = orchestrator.startTurn(conversation.id(), "first");
        assertThat(backend.awaitInvocation()).isTrue();
        awaitEvent(event -> UiEvent.BUSY.equals(event.stringPayload("status")));

        backend.completedScript(HI);
        CompletableFuture<TurnOutcome> second = orchestrator.startTurn(conversation.id(), "second");

        assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo(TurnOutcome.CANCELLED);
        assertThat(second.get(5, TimeUnit.SECONDS)).isEqualTo(TurnOutcome.COMPLETED);
        assertThat(statuses()).containsExactly(UiEvent.BUSY, UiEvent.BUSY, UiEvent.READY);
    }

    @Test
    void shouldRunOneTurnAtATimePerWorkingDirectory() throws Exception {
        Conversation first = create();
        Conversation second = create();
        BlockingQueue<Object> firstScript = backend.script(INIT);
        CompletableFuture<TurnOutcome> running = orchestrator.startTurn(first.id(), "first");
        assertThat(backend.awaitInvocation()).isTrue();

        backend.completedScript(HI);
        CompletableFuture<TurnOutcome> waiting = orchestrator.startTurn(second.id(), "second");

        assertThat(backend.awaitInvocation(300)).isFalse();
        assertThat(waiting).isNotDone();
        assertThat(context.sessions().workspaces().isHeld(tempDir)).isTrue();
        assertThat(backend.openStreams()).isEqualTo(1);

        ScriptedBackend.end(firstScript);

        assertThat(running.get(5, TimeUnit.SECONDS)).isEqualTo(TurnOutcome.COMPLETED);
        assertThat(waiting.get(5, TimeUnit.SECONDS)).isEqualTo(TurnOutcome.COMPLETED);
        assertThat(backend.requests).extracting(TurnRequest::conversationId).containsExactly(first.id(), second.id());
        assertThat(backend.maxOpen).hasValue(1);
        assertThat(context.sessions().workspaces().isHeld(tempDir)).isFalse();
    }

    @Test
    void shouldStopTurnStillWaitingForItsWorkingDirectory() throws Exception {
        Conversation first = create();
        Conversation second = create();
        BlockingQueue<Object> firstScript = backend.script(INIT);
        CompletableFuture<TurnOutcome> running = orchestrator.startTurn(first.id(), "first");
        assertThat(backend.awaitInvocation()).isTrue();
        CompletableFuture<TurnOutcome> waiting = orchestrator.startTurn(second.id(), "second");
        awaitEvent(event -> second.id().equals(event.conversationId()) && UiEvent.BUSY.equals(event.stringPayload("status")));

        assertThat(orchestrator.stop(second.id())).isTrue();

        assertThat(waiting.get(5, TimeUnit.SECONDS)).isEqualTo(TurnOutcome.CANCELLED);
        assertThat(backend.requests).hasSize(1);
        ScriptedBackend.end(firstScript);
        assertThat(running.get(5, TimeUnit.SECONDS)).isEqualTo(TurnOutcome.COMPLETED);
    }

    @Test
    void shouldKeepOneLiveTurnWhenTurnsStartConcurrently() throws Exception {
        Conversation conversation = create();
        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<CompletableFuture<TurnOutcome>> turns = new ArrayList<>();
        try {
            List<Future<CompletableFuture<TurnOutcome>>> started = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                String text = "message " + i;
                started.add(pool.submit(() -> {
                    start.await();
                    return orchestrator.startTurn(conversation.id(), text);
                }));
            }
            start.countDown();
            for (Future<CompletableFuture<TurnOutcome>> future : started) {
                turns.add(future.get(5, TimeUnit.SECONDS));
            }

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (turns.stream().filter(CompletableFuture::isDone).count() < callers - 1 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }

            assertThat(turns).filteredOn(turn -> !turn.isDone()).hasSize(1);
            assertThat(orchestrator.activeTurns()).isEqualTo(1);
            assertThat(backend.maxOpen.get()).isLessThanOrEqualTo(1);
        } finally {
            pool.shutdownNow();
        }

        assertThat(orchestrator.stop(conversation.id())).isTrue();
        for (CompletableFuture<TurnOutcome> turn : turns) {
            assertThat(turn.get(5, TimeUnit.SECONDS)).isEqualTo(TurnOutcome.CANCELLED);
        }
        assertThat(orchestrator.activeTurns()).isZero();
    }

    @Test
    void shouldCompleteTurnWhenStopArrivesWhileFinalizing() throws Exception {
        binder.holdCommits();
        Conversation conversation = create();
        backend.completedScript(
            INIT,
            "{\"type\":\"hook\",\"hook_event_name\":\"PostToolUse\",\"tool_name\":\"Write\","
                + "\"tool_input\":{\"file_path\":\"notes.md\"}}",
            HI,
            RESULT
        );

        CompletableFuture<TurnOutcome> turn = orchestrator.startTurn(conversation.id(), "write notes");
        assertThat(binder.commitStarted.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(orchestrator.stop(conversation.id())).isFalse();
        binder.releaseCommits();

        assertThat(turn.get(5, TimeUnit.SECONDS)).isEqualTo(TurnOutcome.COMPLETED);
        assertThat(binder.commits).extracting(RecordingWorkspaceBinder.Commit::files).containsExactly(List.of("notes.md"));
        assertThat(contents(conversation.id())).doesNotContain("Agent stopped by user").contains("File written: notes.md");
    }

    @Test
    void shouldAppendAgentFileToNewSessionsOnly() throws Exception {
        Files.writeString(tempDir.resolve("REVIEWER.md"), "You review code.");
        ConversationSettings settings = new ConversationSettings(PermissionMode.DEFAULT, List.of(), null, "REVIEWER.md");
        Conversation conversation = orchestrator.createConversation("ws", "agent-1", tempDir.toString(), "claude", settings);
        backend.completedScript(INIT, HI, RESULT);
        orchestrator.startTurn(conversation.id(), "hello").get(5, TimeUnit.SECONDS);
        backend.completedScript(HI);

        orchestrator.startTurn(conversation.id(), "again").get(5, TimeUnit.SECONDS);

        assertThat(store.require(conversation.id()).settings().agentFile()).isEqualTo("REVIEWER.md");
        assertThat(backend.requests).extracting(TurnRequest::systemPrompt).containsExactly("You review code.", null);
    }

    @Test
    void shouldRunWithoutSystemPromptWhenAgentFileIsMissing() throws Exception {
        ConversationSettings settings = new ConversationSettings(PermissionMode.DEFAULT, List.of(), null, "missing.md");
        Conversation conversation = orchestrator.createConversation("ws", "agent-1", tempDir.toString(), "claude", settings);
        backend.completedScript(HI);

        TurnOutcome outcome = orchestrator.startTurn(conversation.id(), "hello").get(5, TimeUnit.SECONDS);

        assertThat(outcome).isEqualTo(TurnOutcome.COMPLETED);
        assertThat(backend.requests.get(0).systemPrompt()).isNull();
    }

    @Test
    void shouldDeliverDeniedPermissionToTheBackend() throws Exception {
        Conversation conversation = create();
        BlockingQueue<Object> script = backend.script();
        script.add((ScriptedBackend.Action) () -> {
            PermissionDecision decision = context.permissionGate().await(conversation.id(), "Bash", Map.of("command", "rm -rf build"));
            return "{\"type\":\"user\",\"message\":{\"content\":[{\"type\":\"tool_result\",\"tool_use_id\":\"tu-1\","
                + "\"content\":\"" + decision.message() + "\",\"is_error\":" + !decision.allowed() + "}]}}";
        });
        ScriptedBackend.end(script);

        CompletableFuture<TurnOutcome> turn = orchestrator.startTurn(conversation.id(), "clean up");
        UiEvent request = awaitEvent(event -> event.type() == UiEventType.PERMISSION_REQUEST);
        assertThat(request.stringPayload("toolName")).isEqualTo("Bash");

        assertThat(orchestrator.resolvePermission(request.stringPayload("requestId"), PermissionResponse.deny("no"))).isTrue();

        assertThat(turn.get(5, TimeUnit.SECONDS)).isEqualTo(TurnOutcome.COMPLETED);
        Message result = store.load(conversation.id()).orElseThrow().messages().stream()
            .filter(message -> message.type() == MessageType.TOOL_RESULT)
            .findFirst()
            .orElseThrow();
        assertThat(result.content()).isEqualTo("no");
        assertThat(result.isToolError()).isTrue();
        assertThat(orchestrator.resolvePermission(request.stringPayload("requestId"), PermissionResponse.approve())).isFalse();
    }

    @Test
    void shouldCancelPendingPermissionWhenStopped() throws Exception {
        Conversation conversation = create();
        BlockingQueue<Object> script = backend.script();
        script.add((ScriptedBackend.Action) () -> {
            context.permissionGate().await(conversation.id(), "Write", Map.of("file_path", "a.txt"));
            return "{\"type\":\"result\"}";
        });

        CompletableFuture<TurnOutcome> turn = orchestrator.startTurn(conversation.id(), "write it");
        awaitEvent(event -> event.type() == UiEventType.PERMISSION_REQUEST);

        orchestrator.stop(conversation.id());

        assertThat(turn.get(5, TimeUnit.SECONDS)).isEqualTo(TurnOutcome.CANCELLED);
        assertThat(context.permissionGate().pending()).isEmpty();
    }

    @Test
    void shouldPersistErrorAndReturnToReadyWhenBackendFails() throws Exception {
        Conversation conversation = create();
        backend.failure = new BackendException("claude exited with code 1: boom");

        TurnOutcome outcome = orchestrator.startTurn(conversation.id(), "hello").get(5, TimeUnit.SECONDS);

        assertThat(outcome).isEqualTo(TurnOutcome.FAILED);
        List<Message> messages = store.load(conversation.id()).orElseThrow().messages();
        assertThat(messages).extracting(Message::type).containsExactly(MessageType.USER, MessageType.ERROR);
        assertThat(messages.get(1).content()).isEqualTo("claude exited with code 1: boom");
        assertThat(statuses()).containsSubsequence(UiEvent.BUSY, UiEvent.ERROR, UiEvent.READY);
    }

    @Test
    void shouldReportConfigurationErrorsAsFailedTurns() throws Exception {
        Conversation conversation = create();
        backend.failure = new BackendConfigurationException("Claude CLI could not be started (claude): not found");

        TurnOutcome outcome = orchestrator.startTurn(conversation.id(), "hello").get(5, TimeUnit.SECONDS);

        assertThat(outcome).isEqualTo(TurnOutcome.FAILED);
        List<String> contents = contents(conversation.id());
        assertThat(contents.get(contents.size() - 1)).contains("could not be started");
    }

    @Test
    void shouldFailTurnForUnknownConversation() throws Exception {
        TurnOutcome outcome = orchestrator.startTurn("missing", "hello").get(5, TimeUnit.SECONDS);

        assertThat(outcome).isEqualTo(TurnOutcome.FAILED);
        assertThat(backend.requests).isEmpty();
    }

    @Test
    void shouldClearCachedResumeToken() throws Exception {
        Conversation conversation = create();
        backend.completedScript(INIT, RESULT);
        orchestrator.startTurn(conversation.id(), "hello").get(5, TimeUnit.SECONDS);

        orchestrator.clearSession("agent-1");

        assertThat(orchestrator.getResumeToken("agent-1")).isEmpty();
    }

    private Conversation create() throws Exception {
        return orchestrator.createConversation("ws", "agent-1", tempDir.toString(), "claude", null);
    }

    private List<String> contents(String conversationId) throws Exception {
        return store.load(conversationId).orElseThrow().messages().stream().map(Message::content).toList();
    }

    private List<String> statuses() {
        drain();
        return seen.stream()
            .filter(event -> event.type() == UiEventType.STATUS)
            .map(event -> event.stringPayload("status"))
            .toList();
    }

    private UiEvent awaitEvent(Predicate<UiEvent> predicate) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        int checked = 0;
        while (System.nanoTime() < deadline) {
            drain();
            for (; checked < seen.size(); checked++) {
                if (predicate.test(seen.get(checked))) {
                    return seen.get(checked);
                }
            }
            Thread.sleep(10);
        }
        throw new AssertionError("Timed out waiting for event");
    }

    private void drain() {
        Optional<UiEvent> next;
        while ((next = bus.poll()).isPresent()) {
            seen.add(next.get());
        }
    }
}
