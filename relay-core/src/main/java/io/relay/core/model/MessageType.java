package io.relay.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum MessageType {
    @JsonProperty("user") USER,
    @JsonProperty("assistant") ASSISTANT,
    @JsonProperty("system") SYSTEM,
    @JsonProperty("tool_use") TOOL_USE,
    @JsonProperty("tool_result") TOOL_RESULT,
    @JsonProperty("error") ERROR,
    @JsonProperty("research_progress") RESEARCH_PROGRESS,
    @JsonProperty("research_result") RESEARCH_RESULT
}
