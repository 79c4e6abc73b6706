package io.relay.core.backend.research;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.relay.core.backend.BackendException;
import io.relay.core.backend.EventStream;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import okhttp3.Call;
import okhttp3.Response;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Server-sent events from a streaming Responses API call, one JSON payload per {@code data:} line.
 */
final class SseEventStream implements EventStream {
    private static final Logger LOG = LoggerFactory.getLogger(SseEventStream.class);

    private final Call call;
    private final Response response;
    private final BufferedSource source;
    private final ObjectMapper mapper;
    private final Consumer<SseEventStream> onClose;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private boolean done;

    SseEventStream(Call call, Response response, ObjectMapper mapper, Consumer<SseEventStream> onClose) {
        this.call = Objects.requireNonNull(call, "call must not be null");
        this.response = Objects.requireNonNull(response, "response must not be null");
        this.source = Objects.requireNonNull(response.body(), "response body must not be null").source();
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.onClose = onClose == null ? stream -> { } : onClose;
    }

    @Override
    public Optional<JsonNode> next() throws IOException {
        while (!done) {
            String line = readLine();
            if (line == null) {
                done = true;
                break;
            }
            if (line.isBlank() || !line.startsWith("data:")) {
                continue;
            }
            String payload = line.substring(5).trim();
            if (payload.isBlank()) {
                continue;
            }
            if ("[DONE]".equals(payload)) {
                done = true;
                break;
            }
            try {
                return Optional.of(mapper.readTree(payload));
            } catch (JsonProcessingException e) {
                LOG.warn("Skipping malformed research event: {}", e.getOriginalMessage());
            }
        }
        return Optional.empty();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        call.cancel();
        response.close();
        onClose.accept(this);
    }

    private String readLine() throws IOException {
        try {
            return source.exhausted() ? null : source.readUtf8Line();
        } catch (IOException e) {
            if (closed.get() || call.isCanceled()) {
                return null;
            }
            throw new BackendException("Research stream failed: " + e.getMessage(), e);
        }
    }
}
