package io.relay.core.permission;

import java.util.Map;

public record PermissionDecision(Behavior behavior, String message, Map<String, Object> updatedInput) {
    public static final String DEFAULT_DENIAL = "User denied permission";
    public static final String TIMED_OUT = "Permission request timed out";

    public enum Behavior {
        ALLOW,
        DENY
    }

    public PermissionDecision {
        updatedInput = updatedInput == null ? Map.of() : updatedInput;
    }

    public static PermissionDecision allow(Map<String, Object> input) {
        return new PermissionDecision(Behavior.ALLOW, null, input);
    }

    public static PermissionDecision deny(String message) {
        String text = message == null || message.isBlank() ? DEFAULT_DENIAL : message;
        return new PermissionDecision(Behavior.DENY, text, null);
    }

    public static PermissionDecision timedOut() {
        return new PermissionDecision(Behavior.DENY, TIMED_OUT, null);
    }

    public boolean allowed() {
        return behavior == Behavior.ALLOW;
    }
}
