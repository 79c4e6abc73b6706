package io.relay.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BackendsConfig(ClaudeBackendConfig claude, ResearchBackendConfig research) {

    public static BackendsConfig defaults() {
        return new BackendsConfig(ClaudeBackendConfig.defaults(), ResearchBackendConfig.defaults());
    }
}
