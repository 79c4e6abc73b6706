package io.relay.core.backend.claude;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class NdjsonDecoderTest {

    private final NdjsonDecoder decoder = new NdjsonDecoder(new ObjectMapper());

    @Test
    void shouldHoldPartialLineUntilNewlineArrives() {
        assertThat(decoder.feed("{\"type\":\"sys")).isEmpty();

        List<JsonNode> events = decoder.feed("tem\",\"subtype\":\"init\"}\n{\"type\":\"result\"}\n");

        assertThat(events).extracting(node -> node.path("type").asText()).containsExactly("system", "result");
    }

    @Test
    void shouldTurnNonJsonLinesIntoRawText() {
        List<JsonNode> events = decoder.feed("plain output\n{broken\n\n");

        assertThat(events).hasSize(2);
        assertThat(events.get(0).path("type").asText()).isEqualTo(NdjsonDecoder.RAW);
        assertThat(events.get(0).path("text").asText()).isEqualTo("plain output\n");
        assertThat(events.get(1).path("text").asText()).isEqualTo("{broken\n");
    }

    @Test
    void shouldDecodeTrailingLineOnFlush() {
        decoder.feed("{\"type\":\"result\",\"total_cost_usd\":0.5}");

        List<JsonNode> events = decoder.flush();

        assertThat(events).singleElement().satisfies(node -> assertThat(node.path("total_cost_usd").asDouble()).isEqualTo(0.5));
        assertThat(decoder.flush()).isEmpty();
    }
}
