package io.relay.core.backend.claude;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a newline-delimited JSON byte stream into events. A trailing partial line is held until
 * the rest arrives; lines that are not JSON objects become {@code {"type":"raw","text":...}} events.
 */
final class NdjsonDecoder {
    private static final Logger LOG = LoggerFactory.getLogger(NdjsonDecoder.class);
    static final String RAW = "raw";

    private final ObjectMapper mapper;
    private final StringBuilder buffer = new StringBuilder();

    NdjsonDecoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    List<JsonNode> feed(CharSequence chunk) {
        buffer.append(chunk);
        List<JsonNode> events = new ArrayList<>();
        int newline;
        while ((newline = buffer.indexOf("\n")) >= 0) {
            String line = buffer.substring(0, newline);
            buffer.delete(0, newline + 1);
            decode(line, events);
        }
        return events;
    }

    List<JsonNode> flush() {
        List<JsonNode> events = new ArrayList<>();
        if (buffer.length() > 0) {
            String line = buffer.toString();
            buffer.setLength(0);
            decode(line, events);
        }
        return events;
    }

    private void decode(String line, List<JsonNode> events) {
        String trimmed = line.strip();
        if (trimmed.isEmpty()) {
            return;
        }
        JsonNode node = parse(trimmed);
        if (node != null && node.isObject()) {
            events.add(node);
            return;
        }
        ObjectNode raw = mapper.createObjectNode();
        raw.put("type", RAW);
        raw.put("text", line + "\n");
        events.add(raw);
    }

    private JsonNode parse(String line) {
        if (!line.startsWith("{")) {
            return null;
        }
        try {
            return mapper.readTree(line);
        } catch (JsonProcessingException e) {
            LOG.debug("Treating malformed stream line as text: {}", e.getOriginalMessage());
            return null;
        }
    }
}
