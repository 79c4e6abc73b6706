package io.relay.core.permission;

/**
 * Raised to a waiting permission request when its turn is stopped, as opposed to the operator denying it.
 */
public final class AgentStoppedException extends RuntimeException {

    public AgentStoppedException() {
        super("Agent stopped");
    }
}
