package io.relay.core.backend;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the backend for a conversation's agent type and fans stop/clear requests out to every backend.
 */
public final class BackendRouter {
    private static final Logger LOG = LoggerFactory.getLogger(BackendRouter.class);
    public static final String RESEARCH = "research";
    public static final String CODING = "claude";

    private final BackendRegistry registry;

    public BackendRouter(BackendRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    public AgentBackend route(String agentType) {
        String type = BackendRegistry.normalize(agentType);
        if (RESEARCH.equals(type)) {
            return registry.find(RESEARCH)
                .orElseThrow(() -> new IllegalArgumentException("Backend research is not registered"));
        }
        if (!type.isBlank() && !CODING.equals(type)) {
            var dedicated = registry.find(type);
            if (dedicated.isPresent()) {
                return dedicated.get();
            }
        }
        return registry.find(CODING)
            .orElseThrow(() -> new IllegalArgumentException("Unknown backend: " + (type.isBlank() ? CODING : type)));
    }

    public void stop(String conversationId) {
        for (AgentBackend backend : registry.all()) {
            try {
                backend.interrupt(conversationId);
            } catch (RuntimeException e) {
                LOG.warn("Backend {} failed to interrupt {}: {}", backend.name(), conversationId, e.getMessage());
            }
        }
    }

    public void clearSession(String agentId) {
        registry.all().forEach(backend -> backend.clearSession(agentId));
    }
}
