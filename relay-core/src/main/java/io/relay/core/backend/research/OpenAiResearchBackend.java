package io.relay.core.backend.research;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.relay.core.backend.AgentBackend;
import io.relay.core.backend.BackendConfigurationException;
import io.relay.core.backend.BackendException;
import io.relay.core.backend.BackendRouter;
import io.relay.core.backend.EventNormalizer;
import io.relay.core.backend.EventStream;
import io.relay.core.backend.TurnRequest;
import io.relay.core.config.model.ResearchBackendConfig;
import io.relay.core.model.Message;
import io.relay.core.model.MessageType;
import io.relay.core.turn.Turn;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deep research through the OpenAI Responses API with the web search tool, streamed as SSE.
 */
public final class OpenAiResearchBackend implements AgentBackend {
    private static final Logger LOG = LoggerFactory.getLogger(OpenAiResearchBackend.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    static final String MISSING_KEY = "OpenAI API key not configured. Go to Settings to add your key.";
    static final Set<String> RESEARCH_MODELS = Set.of(
        "o4-mini-deep-research-2025-06-26",
        "o3-deep-research-2025-06-26"
    );
    private static final int CONTEXT_MESSAGES = 2;
    private static final String INSTRUCTIONS = """
        You perform deep empirical research based on the user's question.

        Guidelines:
        - Search multiple authoritative sources
        - Cross-reference information for accuracy
        - Provide citations with URLs for all claims
        - Synthesize findings into actionable insights
        - Structure output with clear headings
        - Acknowledge limitations and gaps in information
        - Use markdown formatting for better readability""";

    private final ResearchBackendConfig config;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final ResearchOutputWriter outputWriter;
    private final Map<String, SseEventStream> active = new ConcurrentHashMap<>();

    public OpenAiResearchBackend(ResearchBackendConfig config, ObjectMapper mapper) {
        this(config, mapper, new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(timeoutSeconds(config)))
            .writeTimeout(Duration.ofSeconds(20))
            .build());
    }

    public OpenAiResearchBackend(ResearchBackendConfig config, ObjectMapper mapper, OkHttpClient client) {
        this.config = config == null ? ResearchBackendConfig.defaults() : config;
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.outputWriter = new ResearchOutputWriter(this.config.outputDirectory());
    }

    @Override
    public String name() {
        return BackendRouter.RESEARCH;
    }

    @Override
    public EventStream invoke(TurnRequest request) throws IOException {
        if (!config.configured()) {
            throw new BackendConfigurationException(MISSING_KEY);
        }
        Request httpRequest = new Request.Builder()
            .url(endpoint())
            .post(RequestBody.create(mapper.writeValueAsString(payload(request)), JSON))
            .header("Authorization", "Bearer " + config.apiKey())
            .header("accept", "text/event-stream")
            .header("content-type", "application/json")
            .build();
        Call call = client.newCall(httpRequest);
        String conversationId = request.conversationId();
        Response response = call.execute();
        if (!response.isSuccessful() || response.body() == null) {
            try (response) {
                String body = response.body() == null ? "" : response.body().string();
                throw new BackendException("OpenAI request failed: HTTP " + response.code() + " " + body);
            }
        }
        SseEventStream stream = new SseEventStream(call, response, mapper, closed -> active.remove(conversationId, closed));
        SseEventStream previous = active.put(conversationId, stream);
        if (previous != null) {
            previous.close();
        }
        LOG.debug("Research stream opened for conversation {} with model {}", conversationId, model(request));
        return stream;
    }

    @Override
    public EventNormalizer normalizer(Turn turn) {
        return new ResearchEventNormalizer(turn, outputWriter);
    }

    @Override
    public void interrupt(String conversationId) {
        SseEventStream stream = active.remove(conversationId);
        if (stream != null) {
            LOG.info("Cancelling research request for conversation {}", conversationId);
            stream.close();
        }
    }

    Map<String, Object> payload(TurnRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model(request));
        payload.put("input", prompt(request));
        payload.put("instructions", INSTRUCTIONS);
        payload.put("stream", true);
        payload.put("tools", List.of(Map.of("type", "web_search_preview")));
        return payload;
    }

    String model(TurnRequest request) {
        String requested = request.settings().model();
        return RESEARCH_MODELS.contains(requested) ? requested : config.model();
    }

    static String prompt(TurnRequest request) {
        List<String> outputs = request.history().stream()
            .filter(message -> message.type() == MessageType.ASSISTANT || message.type() == MessageType.RESEARCH_RESULT)
            .map(Message::content)
            .filter(content -> !content.isBlank())
            .toList();
        if (outputs.isEmpty()) {
            return request.message();
        }
        String context = String.join("\n\n---\n\n", outputs.subList(Math.max(0, outputs.size() - CONTEXT_MESSAGES), outputs.size()));
        return "Previous research:\n\n" + context + "\n\n---\n\nFollow-up question: " + request.message();
    }

    private HttpUrl endpoint() throws BackendConfigurationException {
        String base = config.apiBase() == null || config.apiBase().isBlank()
            ? ResearchBackendConfig.defaults().apiBase()
            : config.apiBase();
        HttpUrl url = HttpUrl.parse(base.endsWith("/") ? base + "responses" : base + "/responses");
        if (url == null) {
            throw new BackendConfigurationException("Invalid research API base: " + base);
        }
        return url;
    }

    private static long timeoutSeconds(ResearchBackendConfig config) {
        return config == null || config.timeoutSeconds() <= 0 ? 600 : config.timeoutSeconds();
    }
}
