package io.relay.core.backend.claude;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.relay.core.backend.AgentBackend;
import io.relay.core.backend.BackendConfigurationException;
import io.relay.core.backend.BackendException;
import io.relay.core.backend.BackendRouter;
import io.relay.core.backend.EventNormalizer;
import io.relay.core.backend.EventStream;
import io.relay.core.backend.TurnRequest;
import io.relay.core.config.model.ClaudeBackendConfig;
import io.relay.core.model.ConversationSettings;
import io.relay.core.permission.AgentStoppedException;
import io.relay.core.permission.PermissionDecision;
import io.relay.core.permission.PermissionGate;
import io.relay.core.turn.Turn;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a long-lived SDK bridge process over NDJSON on stdin/stdout. Tool approvals requested by
 * the bridge are routed through the {@link PermissionGate}; file changes arrive as hook events.
 */
public final class ClaudeBridgeBackend implements AgentBackend {
    private static final Logger LOG = LoggerFactory.getLogger(ClaudeBridgeBackend.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ClaudeBackendConfig config;
    private final PermissionGate permissionGate;
    private final ObjectMapper mapper;
    private final Map<String, BridgeSession> active = new ConcurrentHashMap<>();

    public ClaudeBridgeBackend(ClaudeBackendConfig config, PermissionGate permissionGate, ObjectMapper mapper) {
        this.config = config == null ? ClaudeBackendConfig.defaults() : config;
        this.permissionGate = Objects.requireNonNull(permissionGate, "permissionGate must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public String name() {
        return BackendRouter.CODING;
    }

    @Override
    public EventStream invoke(TurnRequest request) throws IOException {
        if (config.bridgeCommand().isEmpty()) {
            throw new BackendConfigurationException("Claude bridge command is not configured");
        }
        Process process;
        try {
            process = new ProcessBuilder(config.bridgeCommand())
                .directory(request.workingDirectory().toFile())
                .start();
        } catch (IOException e) {
            throw new BackendConfigurationException("Claude bridge could not be started: " + e.getMessage(), e);
        }
        String conversationId = request.conversationId();
        BridgeSession session = new BridgeSession(conversationId, request.settings(), process);
        BridgeSession previous = active.put(conversationId, session);
        if (previous != null) {
            previous.close();
        }
        session.send(query(request));
        return session;
    }

    @Override
    public EventNormalizer normalizer(Turn turn) {
        return new ClaudeEventNormalizer(turn, mapper, true);
    }

    @Override
    public void interrupt(String conversationId) {
        BridgeSession session = active.remove(conversationId);
        if (session == null) {
            return;
        }
        LOG.info("Interrupting Claude bridge for conversation {}", conversationId);
        try {
            session.send(mapper.createObjectNode().put("type", "interrupt"));
        } catch (IOException e) {
            LOG.debug("Bridge for {} already gone: {}", conversationId, e.getMessage());
        }
        session.close();
    }

    ObjectNode query(TurnRequest request) {
        ConversationSettings settings = request.settings();
        ObjectNode query = mapper.createObjectNode();
        query.put("type", "query");
        query.put("prompt", request.message());
        ObjectNode options = query.putObject("options");
        options.put("cwd", request.workingDirectory().toString());
        if (request.resumeToken() != null) {
            options.put("resume", request.resumeToken());
        } else if (request.systemPrompt() != null) {
            options.put("system_prompt", request.systemPrompt());
        }
        if (!settings.usesDefaultModel()) {
            options.put("model", settings.model());
        }
        options.put("permission_mode", settings.permissionMode().wireName());
        if (!settings.allowedTools().isEmpty()) {
            settings.allowedTools().forEach(options.putArray("allowed_tools")::add);
        }
        return query;
    }

    ObjectNode permissionResponse(String id, PermissionDecision decision, boolean interrupt) {
        ObjectNode response = mapper.createObjectNode();
        response.put("type", "permission_response");
        response.put("id", id);
        if (decision.allowed()) {
            response.put("behavior", "allow");
            response.set("updated_input", mapper.valueToTree(decision.updatedInput()));
        } else {
            response.put("behavior", "deny");
            response.put("message", decision.message());
            response.put("interrupt", interrupt);
        }
        return response;
    }

    private final class BridgeSession extends ProcessEventStream {
        private final String conversationId;
        private final ConversationSettings settings;
        private final Writer stdin;

        private BridgeSession(String conversationId, ConversationSettings settings, Process process) {
            super("claude-bridge", process, mapper, closed -> active.remove(conversationId, closed));
            this.conversationId = conversationId;
            this.settings = settings;
            this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        }

        @Override
        public Optional<JsonNode> next() throws IOException {
            while (true) {
                Optional<JsonNode> event = super.next();
                if (event.isEmpty() || !"permission_request".equals(event.get().path("type").asText())) {
                    return event;
                }
                if (!answer(event.get())) {
                    return Optional.empty();
                }
            }
        }

        @Override
        public void close() {
            super.close();
            permissionGate.cancel(conversationId);
        }

        /**
         * Returns false when the turn stopped while the request was pending.
         */
        private boolean answer(JsonNode event) throws IOException {
            String id = event.path("id").asText();
            String toolName = event.path("tool_name").asText("");
            JsonNode rawInput = event.path("input");
            Map<String, Object> input = rawInput.isObject() ? mapper.convertValue(rawInput, MAP_TYPE) : Map.of();
            if (!settings.requiresApproval(toolName)) {
                send(permissionResponse(id, PermissionDecision.allow(input), false));
                return true;
            }
            CompletableFuture<PermissionDecision> pending = permissionGate.request(conversationId, toolName, input);
            if (isClosed()) {
                permissionGate.cancel(conversationId);
            }
            try {
                send(permissionResponse(id, pending.get(), false));
                return true;
            } catch (ExecutionException e) {
                if (e.getCause() instanceof AgentStoppedException stopped) {
                    sendQuietly(permissionResponse(id, PermissionDecision.deny(stopped.getMessage()), true));
                    return false;
                }
                throw new BackendException("Permission request failed", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while awaiting permission for " + toolName);
            }
        }

        private synchronized void send(JsonNode message) throws IOException {
            stdin.write(mapper.writeValueAsString(message));
            stdin.write('\n');
            stdin.flush();
        }

        private void sendQuietly(JsonNode message) {
            try {
                send(message);
            } catch (IOException e) {
                LOG.debug("Bridge for {} closed before the stop reply: {}", conversationId, e.getMessage());
            }
        }
    }
}
