package io.relay.core.turn;

public enum TurnState {
    IDLE,
    RESOLVING,
    STREAMING,
    FINALIZING,
    CANCELLED,
    FAILED
}
