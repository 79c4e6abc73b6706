package io.relay.core.backend;

/**
 * The backend cannot run at all, for example a missing API key or executable. Never retried.
 */
public final class BackendConfigurationException extends BackendException {

    public BackendConfigurationException(String message) {
        super(message);
    }

    public BackendConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
