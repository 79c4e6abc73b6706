package io.relay.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ClaudeBackendConfig(
    String mode,
    String executable,
    @JsonAlias({"bridge_command"}) List<String> bridgeCommand
) {

    public ClaudeBackendConfig {
        bridgeCommand = bridgeCommand == null ? List.of() : List.copyOf(bridgeCommand);
    }

    public static ClaudeBackendConfig defaults() {
        return new ClaudeBackendConfig("cli", "claude", List.of());
    }

    public boolean bridgeMode() {
        return "bridge".equalsIgnoreCase(mode == null ? "" : mode.trim());
    }
}
