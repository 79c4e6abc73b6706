package io.relay.core.session;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Running turn per conversation plus the resume token last reported for each agent.
 */
public final class SessionRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, TurnHandle> turns = new ConcurrentHashMap<>();
    private final Map<String, String> resumeTokens = new ConcurrentHashMap<>();
    private final WorkspaceLeases workspaces = new WorkspaceLeases();

    public TurnHandle beginTurn(String conversationId) {
        Objects.requireNonNull(conversationId, "conversationId must not be null");
        AtomicReference<TurnHandle> previous = new AtomicReference<>();
        TurnHandle installed = turns.compute(conversationId, (id, existing) -> {
            previous.set(existing);
            return new TurnHandle(id, existing);
        });
        TurnHandle replaced = previous.get();
        if (replaced != null && replaced.cancel()) {
            LOG.debug("Cancelled running turn {} on {}", replaced.turnId(), conversationId);
        }
        return installed;
    }

    public boolean endTurn(String conversationId, TurnHandle handle) {
        return turns.remove(conversationId, handle);
    }

    public Optional<TurnHandle> lookup(String conversationId) {
        return Optional.ofNullable(turns.get(conversationId));
    }

    public boolean cancel(String conversationId) {
        return lookup(conversationId).map(TurnHandle::cancel).orElse(false);
    }

    public WorkspaceLeases workspaces() {
        return workspaces;
    }

    public int activeTurns() {
        return turns.size();
    }

    public void cacheResumeToken(String agentId, String token) {
        if (agentId == null || token == null || token.isBlank()) {
            return;
        }
        resumeTokens.put(agentId, token);
    }

    public Optional<String> resumeToken(String agentId) {
        return agentId == null ? Optional.empty() : Optional.ofNullable(resumeTokens.get(agentId));
    }

    public void clearResumeToken(String agentId) {
        if (agentId != null) {
            resumeTokens.remove(agentId);
        }
    }

    public void cancelAll() {
        turns.values().forEach(TurnHandle::cancel);
    }
}
