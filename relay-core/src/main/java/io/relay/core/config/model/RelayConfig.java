package io.relay.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.relay.core.model.ConversationSettings;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RelayConfig(
    StoreConfig store,
    BackendsConfig backends,
    GitSettings git,
    PermissionsConfig permissions,
    SessionsConfig sessions,
    ConversationSettings conversationDefaults,
    GatewayConfig gateway
) {

    public static RelayConfig defaults() {
        return new RelayConfig(
            StoreConfig.defaults(),
            BackendsConfig.defaults(),
            GitSettings.defaults(),
            PermissionsConfig.defaults(),
            SessionsConfig.defaults(),
            ConversationSettings.defaults(),
            GatewayConfig.defaults()
        );
    }
}
