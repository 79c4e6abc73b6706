package io.relay.core.backend.claude;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.relay.core.backend.EventNormalizer;
import io.relay.core.bus.UiEvent;
import io.relay.core.model.ConversationUpdate;
import io.relay.core.model.Message;
import io.relay.core.turn.Titles;
import io.relay.core.turn.Turn;
import java.io.IOException;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps Claude stream-json events onto conversation messages and UI events. Shared by the CLI and
 * bridge backends; they differ only in where file changes are observed.
 */
public final class ClaudeEventNormalizer implements EventNormalizer {
    private static final Logger LOG = LoggerFactory.getLogger(ClaudeEventNormalizer.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final Set<String> FILE_TOOLS = Set.of("Write", "Edit");
    static final String TODO_WRITE = "TodoWrite";
    static final String STOPPED = "Agent stopped by user";
    static final String COMMIT_PREFIX = "[Agent] ";

    private final Turn turn;
    private final ObjectMapper mapper;
    private final boolean fileChangesFromHooks;
    private final Map<String, PendingFileTool> pendingFileTools = new HashMap<>();

    /**
     * @param fileChangesFromHooks true when the backend reports file changes as PostToolUse hook
     *     events; otherwise they are derived from successful Write/Edit tool results
     */
    public ClaudeEventNormalizer(Turn turn, ObjectMapper mapper, boolean fileChangesFromHooks) {
        this.turn = Objects.requireNonNull(turn, "turn must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.fileChangesFromHooks = fileChangesFromHooks;
    }

    @Override
    public void onEvent(JsonNode event) throws IOException {
        String type = event.path("type").asText("");
        switch (type) {
            case "system" -> {
                if ("init".equals(event.path("subtype").asText())) {
                    onInit(event);
                }
            }
            case "assistant" -> onAssistant(event);
            case "user" -> onUser(event);
            case "result" -> onResult(event);
            case "hook" -> onHook(event);
            case NdjsonDecoder.RAW -> turn.appendText(event.path("text").asText(""));
            default -> LOG.debug("Ignoring {} event for conversation {}", type, turn.conversationId());
        }
    }

    @Override
    public void onComplete() throws IOException {
        JsonNode result = turn.lastResult();
        String text = turn.streamedText();
        if (!text.isBlank()) {
            JsonNode usage = turn.lastAssistant() == null
                ? null
                : turn.lastAssistant().path("message").path("usage");
            Message assistant = Message.assistant(
                text,
                turn.capturedSessionId(),
                intOrNull(usage, "input_tokens"),
                intOrNull(usage, "output_tokens"),
                doubleOrNull(result, "total_cost_usd"),
                longOrNull(result, "duration_ms"),
                turn.now()
            );
            turn.persist(assistant);
            if (turn.firstTurn()) {
                turn.applyTitle();
            }
        }
        if (result != null) {
            double cost = result.path("total_cost_usd").asDouble(0);
            long durationMs = result.path("duration_ms").asLong(0);
            int numTurns = result.path("num_turns").asInt(0);
            String summary = String.format(
                Locale.ROOT,
                "Turn completed: %d turns, $%.4f USD, %.1fs",
                numTurns,
                cost,
                durationMs / 1000.0
            );
            turn.persist(Message.turnSummary(
                summary,
                textOrNull(result, "session_id"),
                cost,
                durationMs,
                numTurns,
                turn.now()
            ));
        }
        List<String> touched = turn.touchedFiles();
        if (!touched.isEmpty()) {
            turn.commit(COMMIT_PREFIX + Titles.fromMessage(turn.userMessage()), touched);
        }
    }

    @Override
    public String stoppedMessage() {
        return STOPPED;
    }

    private void onInit(JsonNode event) throws IOException {
        String sessionId = textOrNull(event, "session_id");
        if (sessionId == null) {
            return;
        }
        captureSession(sessionId, true);
        String model = event.path("model").asText("unknown");
        turn.persist(Message.system("Session started with model " + model, turn.now()).withSessionId(sessionId));
    }

    private void captureSession(String sessionId, boolean fromInit) throws IOException {
        turn.captureSession(sessionId);
        String expected = turn.expectedSessionId();
        if (expected != null && !expected.equals(sessionId)) {
            LOG.warn(
                "Resume failed for conversation {}: expected session {}, got {}",
                turn.conversationId(),
                expected,
                sessionId
            );
        }
        boolean newSession = !fromInit || expected == null || !expected.equals(sessionId);
        Instant createdAt = newSession ? turn.now() : null;
        Instant previousCreatedAt = turn.conversation().sessionCreatedAt();
        turn.updateConversation(ConversationUpdate.session(sessionId, createdAt));
        turn.emit(UiEvent.sessionUpdate(
            turn.conversationId(),
            sessionId,
            createdAt != null ? createdAt : previousCreatedAt
        ));
    }

    private void onAssistant(JsonNode event) throws IOException {
        turn.recordAssistant(event);
        for (JsonNode block : event.path("message").path("content")) {
            switch (block.path("type").asText("")) {
                case "text" -> turn.appendText(block.path("text").asText(""));
                case "thinking" -> turn.streamOnly("\n<thinking>" + block.path("thinking").asText("") + "</thinking>\n");
                case "tool_use" -> onToolUse(block);
                default -> LOG.debug("Ignoring assistant block {}", block.path("type").asText());
            }
        }
    }

    private void onToolUse(JsonNode block) throws IOException {
        String name = block.path("name").asText("");
        String id = textOrNull(block, "id");
        JsonNode input = block.path("input");
        if (TODO_WRITE.equals(name)) {
            JsonNode todos = input.path("todos");
            if (todos.isMissingNode() || todos.isNull()) {
                return;
            }
            Object todoList = mapper.convertValue(todos, Object.class);
            turn.persist(Message.toolUse("TodoWrite update", TODO_WRITE, Map.of("todos", todoList), id, turn.now()));
            turn.emit(UiEvent.todoUpdate(turn.conversationId(), todoList));
            return;
        }
        Map<String, Object> toolInput = input.isObject() ? mapper.convertValue(input, MAP_TYPE) : Map.of();
        turn.persist(Message.toolUse("Using tool: " + name, name, toolInput, id, turn.now()));
        String filePath = textOrNull(input, "file_path");
        if (!fileChangesFromHooks && id != null && filePath != null && FILE_TOOLS.contains(name)) {
            pendingFileTools.put(id, new PendingFileTool(name, filePath));
        }
    }

    private void onUser(JsonNode event) throws IOException {
        for (JsonNode block : event.path("message").path("content")) {
            if (!"tool_result".equals(block.path("type").asText())) {
                continue;
            }
            JsonNode content = block.path("content");
            String text = content.isTextual() ? content.asText() : mapper.writeValueAsString(content);
            String toolUseId = textOrNull(block, "tool_use_id");
            boolean isError = block.path("is_error").asBoolean(false);
            turn.persist(Message.toolResult(text, toolUseId, isError, turn.now()));
            PendingFileTool fileTool = toolUseId == null ? null : pendingFileTools.remove(toolUseId);
            if (fileTool != null && !isError) {
                recordFileChange(fileTool.toolName(), fileTool.filePath());
            }
        }
    }

    private void onResult(JsonNode event) throws IOException {
        turn.recordResult(event);
        String sessionId = textOrNull(event, "session_id");
        if (sessionId != null && turn.capturedSessionId() == null) {
            captureSession(sessionId, false);
        }
    }

    private void onHook(JsonNode event) throws IOException {
        if (!fileChangesFromHooks || !"PostToolUse".equals(event.path("hook_event_name").asText())) {
            return;
        }
        String toolName = event.path("tool_name").asText("");
        String filePath = textOrNull(event.path("tool_input"), "file_path");
        if (filePath != null && FILE_TOOLS.contains(toolName)) {
            recordFileChange(toolName, filePath);
        }
    }

    private void recordFileChange(String toolName, String filePath) throws IOException {
        turn.touch(filePath);
        String verb = "Write".equals(toolName) ? "written" : "edited";
        turn.persist(Message.fileChange("File " + verb + ": " + filePath, toolName, filePath, turn.now()));
        turn.emit(UiEvent.fileChanged(turn.conversationId(), filePath, toolName));
    }

    private static String textOrNull(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static Integer intOrNull(JsonNode node, String field) {
        return node == null || !node.path(field).isNumber() ? null : node.path(field).asInt();
    }

    private static Long longOrNull(JsonNode node, String field) {
        return node == null || !node.path(field).isNumber() ? null : node.path(field).asLong();
    }

    private static Double doubleOrNull(JsonNode node, String field) {
        return node == null || !node.path(field).isNumber() ? null : node.path(field).asDouble();
    }

    private record PendingFileTool(String toolName, String filePath) {
    }
}
