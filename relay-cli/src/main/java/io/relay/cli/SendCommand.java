package io.relay.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.relay.core.bus.UiEvent;
import io.relay.core.model.Message;
import io.relay.core.permission.PermissionResponse;
import io.relay.core.turn.TurnOutcome;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "send", description = "Run one turn and stream its output")
public final class SendCommand implements Callable<Integer> {
    private static final long POLL_MILLIS = 20;

    private final CliContext context;
    private final ObjectMapper mapper = new ObjectMapper();

    @Parameters(index = "0", arity = "1", description = "Conversation id")
    String conversationId;

    @Parameters(index = "1", arity = "1", description = "Message to send")
    String text;

    @Option(
        names = {"--permissions"},
        description = "How to answer tool approvals: ask, allow or deny",
        defaultValue = "ask"
    )
    String permissions;

    @Option(names = {"--timeout"}, description = "Give up and stop the turn after this many seconds", defaultValue = "0")
    long timeoutSeconds;

    private BufferedReader stdin;

    public SendCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            context.orchestrator().loadConversation(conversationId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown conversation: " + conversationId));
            CompletableFuture<TurnOutcome> turn = context.orchestrator().startTurn(conversationId, text);
            long deadline = timeoutSeconds > 0 ? System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutSeconds) : Long.MAX_VALUE;
            while (!turn.isDone()) {
                boolean busy = drainEvents();
                if (System.nanoTime() > deadline) {
                    System.err.println("Turn timed out, stopping");
                    context.orchestrator().stop(conversationId);
                    deadline = Long.MAX_VALUE;
                }
                if (!busy) {
                    waitBriefly(turn);
                }
            }
            drainEvents();
            TurnOutcome outcome = turn.join();
            System.out.println();
            System.out.println("Turn " + outcome.name().toLowerCase(Locale.ROOT));
            return outcome == TurnOutcome.COMPLETED ? 0 : 1;
        } catch (Exception e) {
            System.err.println("Send failed: " + e.getMessage());
            return 1;
        }
    }

    private boolean drainEvents() throws IOException {
        boolean any = false;
        Optional<UiEvent> next;
        while ((next = context.eventBus().poll()).isPresent()) {
            UiEvent event = next.get();
            if (event.conversationId() != null && !conversationId.equals(event.conversationId())) {
                continue;
            }
            any = true;
            render(event);
        }
        return any;
    }

    private void render(UiEvent event) throws IOException {
        switch (event.type()) {
            case STREAM_DELTA -> System.out.print(event.stringPayload("delta"));
            case MESSAGE -> {
                if (event.payload().get("message") instanceof Message message) {
                    renderMessage(message);
                }
            }
            case PERMISSION_REQUEST -> answer(event);
            case FILE_CHANGED -> System.out.println("\n[file] " + event.stringPayload("filePath"));
            case STATUS -> {
                String error = event.stringPayload("error");
                if (error != null) {
                    System.err.println("[status] " + event.stringPayload("status") + ": " + error);
                }
            }
            default -> {
            }
        }
    }

    private void renderMessage(Message message) {
        switch (message.type()) {
            case TOOL_USE -> System.out.println("\n[tool] " + message.content());
            case TOOL_RESULT -> {
                if (Boolean.TRUE.equals(message.isToolError())) {
                    System.out.println("[tool error] " + message.content());
                }
            }
            case SYSTEM -> System.out.println("\n[system] " + message.content());
            case RESEARCH_PROGRESS -> System.out.println("[research] " + message.content());
            case ERROR -> System.err.println("[error] " + message.content());
            default -> {
            }
        }
    }

    private void answer(UiEvent event) throws IOException {
        String requestId = event.stringPayload("requestId");
        String toolName = event.stringPayload("toolName");
        String mode = permissions == null ? "ask" : permissions.trim().toLowerCase(Locale.ROOT);
        boolean approved = switch (mode) {
            case "allow" -> true;
            case "deny" -> false;
            default -> prompt(toolName, describeInput(event.payload().get("toolInput")));
        };
        PermissionResponse response = approved ? PermissionResponse.approve() : PermissionResponse.deny("Denied from CLI");
        if (!context.orchestrator().resolvePermission(requestId, response)) {
            System.err.println("Permission request " + requestId + " is no longer pending");
        }
    }

    String describeInput(Object toolInput) {
        if (toolInput == null) {
            return "{}";
        }
        try {
            return mapper.writeValueAsString(toolInput);
        } catch (JsonProcessingException e) {
            return String.valueOf(toolInput);
        }
    }

    private boolean prompt(String toolName, String toolInput) throws IOException {
        if (stdin == null) {
            stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        }
        System.out.println();
        System.out.print("Allow " + toolName + " " + toolInput + "? [y/N] ");
        System.out.flush();
        String line = stdin.readLine();
        return line != null && line.trim().toLowerCase(Locale.ROOT).startsWith("y");
    }

    private static void waitBriefly(CompletableFuture<TurnOutcome> turn) throws InterruptedException {
        if (!turn.isDone()) {
            Thread.sleep(POLL_MILLIS);
        }
    }
}
