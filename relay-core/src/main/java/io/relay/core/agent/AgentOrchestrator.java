package io.relay.core.agent;

import io.relay.core.backend.BackendRouter;
import io.relay.core.model.Conversation;
import io.relay.core.model.ConversationSettings;
import io.relay.core.model.ConversationUpdate;
import io.relay.core.model.LoadedConversation;
import io.relay.core.permission.PermissionResponse;
import io.relay.core.session.TurnHandle;
import io.relay.core.store.MessageStore;
import io.relay.core.turn.TurnController;
import io.relay.core.turn.TurnOutcome;
import io.relay.core.workspace.WorkspaceBinder;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for callers: starts, stops and unblocks turns and manages per-agent resume tokens.
 */
public final class AgentOrchestrator {
    private static final Logger LOG = LoggerFactory.getLogger(AgentOrchestrator.class);

    private final OrchestratorContext context;
    private final MessageStore store;
    private final BackendRouter router;
    private final TurnController controller;
    private final ConversationSettings defaultSettings;

    public AgentOrchestrator(
        OrchestratorContext context,
        MessageStore store,
        BackendRouter router,
        WorkspaceBinder binder
    ) {
        this(context, store, router, binder, ConversationSettings.defaults(), TurnController.DEFAULT_SESSION_MAX_AGE);
    }

    public AgentOrchestrator(
        OrchestratorContext context,
        MessageStore store,
        BackendRouter router,
        WorkspaceBinder binder,
        ConversationSettings defaultSettings,
        Duration sessionMaxAge
    ) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.router = Objects.requireNonNull(router, "router must not be null");
        this.defaultSettings = defaultSettings == null ? ConversationSettings.defaults() : defaultSettings;
        this.controller = new TurnController(
            context.sessions(),
            context.permissionGate(),
            router,
            store,
            context.eventBus(),
            binder,
            context.clock(),
            sessionMaxAge
        );
    }

    public Conversation createConversation(
        String workspaceId,
        String agentId,
        String repoPath,
        String agentType,
        ConversationSettings settings
    ) throws IOException {
        Conversation conversation = store.create(
            workspaceId,
            agentId,
            repoPath,
            agentType,
            settings == null ? defaultSettings : settings
        );
        LOG.info("Created conversation {} for agent {} ({})", conversation.id(), agentId, agentType);
        return conversation;
    }

    public List<Conversation> listConversations() throws IOException {
        return store.list();
    }

    public Optional<LoadedConversation> loadConversation(String conversationId) throws IOException {
        return store.load(conversationId);
    }

    public Conversation updateSettings(String conversationId, ConversationSettings settings) throws IOException {
        store.require(conversationId);
        return store.update(conversationId, ConversationUpdate.settings(settings));
    }

    /**
     * Starts a turn, cancelling any turn already running on the conversation. The future completes
     * once the conversation is back to ready.
     */
    public CompletableFuture<TurnOutcome> startTurn(String conversationId, String text) {
        Objects.requireNonNull(conversationId, "conversationId must not be null");
        TurnHandle handle = context.sessions().beginTurn(conversationId);
        return CompletableFuture.supplyAsync(() -> controller.run(handle, text == null ? "" : text), context.turnExecutor());
    }

    /**
     * Stops the running turn, if any. Stopping an idle or already stopped conversation does nothing.
     */
    public boolean stop(String conversationId) {
        boolean cancelled = context.sessions().cancel(conversationId);
        router.stop(conversationId);
        context.permissionGate().cancel(conversationId);
        if (cancelled) {
            LOG.info("Stop requested for conversation {}", conversationId);
        }
        return cancelled;
    }

    public boolean resolvePermission(String requestId, PermissionResponse response) {
        return context.permissionGate().resolve(requestId, response);
    }

    public Optional<String> getResumeToken(String agentId) {
        return context.sessions().resumeToken(agentId);
    }

    public void clearSession(String agentId) {
        context.sessions().clearResumeToken(agentId);
        router.clearSession(agentId);
    }

    public boolean isRunning(String conversationId) {
        return context.sessions().lookup(conversationId).isPresent();
    }

    public int activeTurns() {
        return context.sessions().activeTurns();
    }
}
