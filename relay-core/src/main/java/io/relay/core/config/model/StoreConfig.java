package io.relay.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StoreConfig(String type, String directory, String sqlitePath) {

    public static StoreConfig defaults() {
        return new StoreConfig("file", "~/.relay/sessions", "~/.relay/relay.db");
    }

    public boolean sqlite() {
        return "sqlite".equalsIgnoreCase(type == null ? "" : type.trim());
    }
}
