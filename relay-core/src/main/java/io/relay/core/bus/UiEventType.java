package io.relay.core.bus;

import com.fasterxml.jackson.annotation.JsonValue;

public enum UiEventType {
    STATUS("status"),
    MESSAGE("message"),
    STREAM_DELTA("stream-delta"),
    PERMISSION_REQUEST("permission-request"),
    SESSION_UPDATE("session-update"),
    FILE_CHANGED("file-changed"),
    TODO_UPDATE("todo-update"),
    RESEARCH_COMPLETE("research-complete");

    private final String wireName;

    UiEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
