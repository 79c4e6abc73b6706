package io.relay.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum PermissionMode {
    @JsonProperty("default") DEFAULT("default"),
    @JsonProperty("acceptEdits") ACCEPT_EDITS("acceptEdits"),
    @JsonProperty("plan") PLAN("plan"),
    @JsonProperty("bypassPermissions") BYPASS_PERMISSIONS("bypassPermissions");

    private final String wireName;

    PermissionMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
