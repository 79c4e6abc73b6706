package io.relay.core.backend;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.util.Optional;

public interface EventStream extends AutoCloseable {

    /**
     * Blocks until the next event is available. Empty once the stream is exhausted, and on every call after that.
     */
    Optional<JsonNode> next() throws IOException;

    @Override
    void close();
}
