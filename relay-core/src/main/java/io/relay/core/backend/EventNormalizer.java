package io.relay.core.backend;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;

public interface EventNormalizer {

    default void onStart() throws IOException {
    }

    void onEvent(JsonNode event) throws IOException;

    /**
     * Runs after the stream ended normally: persists the final messages and commits produced changes.
     */
    void onComplete() throws IOException;

    String stoppedMessage();
}
