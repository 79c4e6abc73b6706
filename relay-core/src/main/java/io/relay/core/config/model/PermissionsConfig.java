package io.relay.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PermissionsConfig(@JsonAlias({"timeout_seconds"}) int timeoutSeconds) {

    public static PermissionsConfig defaults() {
        return new PermissionsConfig(300);
    }
}
