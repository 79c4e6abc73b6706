package io.relay.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionsConfig(@JsonAlias({"max_age_days"}) int maxAgeDays) {

    public static SessionsConfig defaults() {
        return new SessionsConfig(25);
    }
}
