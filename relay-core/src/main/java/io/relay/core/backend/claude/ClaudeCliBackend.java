package io.relay.core.backend.claude;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.relay.core.backend.AgentBackend;
import io.relay.core.backend.BackendConfigurationException;
import io.relay.core.backend.BackendRouter;
import io.relay.core.backend.EventNormalizer;
import io.relay.core.backend.EventStream;
import io.relay.core.backend.TurnRequest;
import io.relay.core.config.model.ClaudeBackendConfig;
import io.relay.core.model.ConversationSettings;
import io.relay.core.model.PermissionMode;
import io.relay.core.turn.Turn;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs each turn as a one-shot {@code claude -p --output-format stream-json} process.
 */
public final class ClaudeCliBackend implements AgentBackend {
    private static final Logger LOG = LoggerFactory.getLogger(ClaudeCliBackend.class);

    private final ClaudeBackendConfig config;
    private final ObjectMapper mapper;
    private final Map<String, ProcessEventStream> active = new ConcurrentHashMap<>();

    public ClaudeCliBackend(ClaudeBackendConfig config, ObjectMapper mapper) {
        this.config = config == null ? ClaudeBackendConfig.defaults() : config;
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public String name() {
        return BackendRouter.CODING;
    }

    @Override
    public EventStream invoke(TurnRequest request) throws IOException {
        List<String> command = command(request);
        LOG.debug("Starting Claude CLI for conversation {} in {}", request.conversationId(), request.workingDirectory());
        Process process;
        try {
            process = new ProcessBuilder(command)
                .directory(request.workingDirectory().toFile())
                .start();
        } catch (IOException e) {
            throw new BackendConfigurationException(
                "Claude CLI could not be started (" + config.executable() + "): " + e.getMessage(),
                e
            );
        }
        process.getOutputStream().close();
        String conversationId = request.conversationId();
        ProcessEventStream stream = new ProcessEventStream(
            "claude",
            process,
            mapper,
            closed -> active.remove(conversationId, closed)
        );
        ProcessEventStream previous = active.put(conversationId, stream);
        if (previous != null) {
            previous.close();
        }
        return stream;
    }

    @Override
    public EventNormalizer normalizer(Turn turn) {
        return new ClaudeEventNormalizer(turn, mapper, false);
    }

    @Override
    public void interrupt(String conversationId) {
        ProcessEventStream stream = active.remove(conversationId);
        if (stream != null) {
            LOG.info("Interrupting Claude CLI for conversation {}", conversationId);
            stream.close();
        }
    }

    List<String> command(TurnRequest request) {
        ConversationSettings settings = request.settings();
        List<String> command = new ArrayList<>();
        command.add(config.executable() == null || config.executable().isBlank() ? "claude" : config.executable());
        command.add("-p");
        command.add("--verbose");
        command.add("--output-format");
        command.add("stream-json");
        if (request.resumeToken() != null) {
            command.add("--resume");
            command.add(request.resumeToken());
        } else if (request.systemPrompt() != null) {
            command.add("--append-system-prompt");
            command.add(request.systemPrompt());
        }
        if (!settings.usesDefaultModel()) {
            command.add("--model");
            command.add(settings.model());
        }
        if (settings.permissionMode() != PermissionMode.DEFAULT) {
            command.add("--permission-mode");
            command.add(settings.permissionMode().wireName());
        }
        if (!settings.allowedTools().isEmpty()) {
            command.add("--allowedTools");
            command.add(String.join(",", settings.allowedTools()));
        }
        command.add(request.message());
        return command;
    }
}
