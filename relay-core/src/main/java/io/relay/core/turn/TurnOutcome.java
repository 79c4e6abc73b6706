package io.relay.core.turn;

public enum TurnOutcome {
    COMPLETED,
    CANCELLED,
    FAILED
}
