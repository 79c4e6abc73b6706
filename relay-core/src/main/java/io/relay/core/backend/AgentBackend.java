package io.relay.core.backend;

import io.relay.core.turn.Turn;
import java.io.IOException;

/**
 * A provider that can run one turn of a conversation and stream its native events back.
 */
public interface AgentBackend {
    String name();

    /**
     * Starts the turn. The returned stream is lazy and single-pass; a new turn needs a new stream.
     */
    EventStream invoke(TurnRequest request) throws IOException;

    /**
     * Creates the per-turn mapper from this backend's events to conversation messages.
     */
    EventNormalizer normalizer(Turn turn);

    /**
     * Abandons the conversation's running stream, if this backend owns one. Safe to call repeatedly.
     */
    void interrupt(String conversationId);

    default void clearSession(String agentId) {
    }
}
