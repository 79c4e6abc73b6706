package io.relay.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayConfig(String host, int port, String token) {

    public static GatewayConfig defaults() {
        return new GatewayConfig("127.0.0.1", 8787, "");
    }
}
