package io.relay.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ResearchBackendConfig(
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"api_base"}) String apiBase,
    String model,
    @JsonAlias({"output_directory"}) String outputDirectory,
    @JsonAlias({"timeout_seconds"}) int timeoutSeconds
) {

    public static ResearchBackendConfig defaults() {
        return new ResearchBackendConfig(
            "",
            "https://api.openai.com/v1",
            "o4-mini-deep-research-2025-06-26",
            "research",
            600
        );
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
