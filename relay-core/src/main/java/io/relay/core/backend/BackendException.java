package io.relay.core.backend;

import java.io.IOException;

/**
 * The backend stream failed: the process exited non-zero, the connection broke, or the provider reported an error.
 */
public class BackendException extends IOException {

    public BackendException(String message) {
        super(message);
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
