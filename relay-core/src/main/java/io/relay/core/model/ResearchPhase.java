package io.relay.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ResearchPhase {
    @JsonProperty("analyzing") ANALYZING,
    @JsonProperty("searching") SEARCHING,
    @JsonProperty("reasoning") REASONING,
    @JsonProperty("synthesizing") SYNTHESIZING,
    @JsonProperty("complete") COMPLETE
}
