package io.relay.core.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.relay.core.agent.AgentOrchestrator;
import io.relay.core.bus.UiEvent;
import io.relay.core.bus.UiEventBus;
import io.relay.core.model.Conversation;
import io.relay.core.model.ConversationSettings;
import io.relay.core.model.LoadedConversation;
import io.relay.core.permission.PermissionResponse;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP and WebSocket front end. UI events are broadcast to every connected client; clients drive
 * turns with inbound frames.
 */
public final class GatewayServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayServer.class);
    private static final Duration POLL_INTERVAL = Duration.ofMillis(50);
    private static final String CONVERSATIONS = "/conversations";

    private final ObjectMapper mapper;
    private final String host;
    private final int requestedPort;
    private final String wsToken;
    private final AgentOrchestrator orchestrator;
    private final UiEventBus eventBus;
    private final UiEventFrameMapper frameMapper;

    private final ExecutorService executor;
    private final AtomicBoolean running;
    private final Map<String, WebSocketChannel> clients;
    private Undertow server;
    private int actualPort;

    public GatewayServer(int port, String host, AgentOrchestrator orchestrator, UiEventBus eventBus, String wsToken) {
        this.requestedPort = port;
        this.host = host == null || host.isBlank() ? "127.0.0.1" : host;
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.eventBus = eventBus;
        this.frameMapper = new UiEventFrameMapper();
        this.wsToken = wsToken == null ? "" : wsToken.trim();

        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.executor = Executors.newCachedThreadPool();
        this.running = new AtomicBoolean(false);
        this.clients = new ConcurrentHashMap<>();
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        HttpHandler wsHandler = Handlers.websocket(this::onWebSocketConnect);
        PathHandler routes = Handlers.path()
            .addExactPath("/healthz", this::handleHealth)
            .addPrefixPath(CONVERSATIONS, this::handleConversations)
            .addExactPath("/ws", wsHandler);

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(routes)
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);

        if (eventBus != null) {
            executor.submit(this::pumpEventsToClients);
        }
        LOG.info("Gateway listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    public int connectedClients() {
        return clients.size();
    }

    @Override
    public void close() {
        running.set(false);
        if (server != null) {
            server.stop();
        }
        clients.values().forEach(channel -> closeQuietly(channel));
        clients.clear();
        executor.shutdownNow();
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok", "active_turns", orchestrator.activeTurns()));
    }

    private void handleConversations(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleConversations(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }
        String method = exchange.getRequestMethod().toString();
        String id = conversationId(exchange.getRequestPath());
        if (id.isEmpty()) {
            if ("GET".equalsIgnoreCase(method)) {
                sendJson(exchange, 200, Map.of("conversations", orchestrator.listConversations()));
                return;
            }
            if ("POST".equalsIgnoreCase(method)) {
                createConversation(exchange);
                return;
            }
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        if (!"GET".equalsIgnoreCase(method)) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        Optional<LoadedConversation> loaded = orchestrator.loadConversation(id);
        if (loaded.isEmpty()) {
            sendJson(exchange, 404, Map.of("error", "not_found"));
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("conversation", loaded.get().conversation());
        payload.put("messages", loaded.get().messages());
        payload.put("running", orchestrator.isRunning(id));
        sendJson(exchange, 200, payload);
    }

    private void createConversation(HttpServerExchange exchange) throws IOException {
        CreateConversationRequest request;
        try {
            request = mapper.treeToValue(readJsonBody(exchange), CreateConversationRequest.class);
        } catch (IOException e) {
            sendJson(exchange, 400, Map.of("error", "invalid_body"));
            return;
        }
        if (request.repoPath() == null || request.repoPath().isBlank()) {
            sendJson(exchange, 400, Map.of("error", "repo_path_required"));
            return;
        }
        Conversation conversation = orchestrator.createConversation(
            request.workspaceId(),
            request.agentId(),
            request.repoPath(),
            request.agentType(),
            request.settings()
        );
        sendJson(exchange, 201, Map.of("conversation", conversation));
    }

    private void onWebSocketConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
        String token = queryParam(exchange, "token");
        if (!wsToken.isBlank() && !wsToken.equals(token)) {
            LOG.warn("Rejected WebSocket client with invalid token");
            closeQuietly(channel);
            return;
        }

        String clientId = queryParam(exchange, "client_id");
        if (clientId.isBlank()) {
            closeQuietly(channel);
            return;
        }

        clients.put(clientId, channel);

        channel.getCloseSetter().set(closeChannel -> clients.remove(clientId, closeChannel));
        channel.getReceiveSetter().set(new AbstractReceiveListener() {
            @Override
            protected void onFullTextMessage(WebSocketChannel wsChannel, BufferedTextMessage message) {
                handleInboundWs(clientId, wsChannel, message.getData());
            }
        });
        channel.resumeReceives();
        LOG.debug("WebSocket client {} connected", clientId);
    }

    private void handleInboundWs(String clientId, WebSocketChannel channel, String raw) {
        executor.submit(() -> {
            WsInboundMessage inbound;
            try {
                inbound = mapper.readValue(raw, WsInboundMessage.class);
            } catch (IOException e) {
                sendWs(channel, WsOutboundMessage.error(null, "invalid_frame"));
                return;
            }
            try {
                dispatch(channel, inbound);
            } catch (Exception e) {
                LOG.warn("Failed to process inbound WebSocket frame {} for client {}", inbound.type(), clientId, e);
                sendWs(channel, WsOutboundMessage.error(inbound.msgId(), e.getMessage()));
            }
        });
    }

    private void dispatch(WebSocketChannel channel, WsInboundMessage inbound) throws IOException {
        String type = inbound.type() == null ? "" : inbound.type();
        switch (type) {
            case "ping" -> sendWs(channel, WsOutboundMessage.of("pong", null));
            case "start_turn" -> {
                if (isBlank(inbound.conversationId()) || isBlank(inbound.text())) {
                    sendWs(channel, WsOutboundMessage.error(inbound.msgId(), "conversation_id and text are required"));
                    return;
                }
                if (orchestrator.loadConversation(inbound.conversationId()).isEmpty()) {
                    sendWs(channel, WsOutboundMessage.error(inbound.msgId(), "Unknown conversation: " + inbound.conversationId()));
                    return;
                }
                orchestrator.startTurn(inbound.conversationId(), inbound.text().trim());
                sendWs(channel, WsOutboundMessage.of("ack", inbound.msgId()));
            }
            case "stop" -> {
                orchestrator.stop(inbound.conversationId());
                sendWs(channel, WsOutboundMessage.of("ack", inbound.msgId()));
            }
            case "resolve_permission" -> {
                boolean approved = Boolean.TRUE.equals(inbound.approved());
                PermissionResponse response = new PermissionResponse(approved, inbound.reason(), inbound.updatedInput());
                boolean resolved = orchestrator.resolvePermission(inbound.requestId(), response);
                sendWs(channel, resolved
                    ? WsOutboundMessage.of("ack", inbound.msgId())
                    : WsOutboundMessage.error(inbound.msgId(), "No pending permission for requestId: " + inbound.requestId()));
            }
            case "clear_session" -> {
                orchestrator.clearSession(inbound.agentId());
                sendWs(channel, WsOutboundMessage.of("ack", inbound.msgId()));
            }
            default -> sendWs(channel, WsOutboundMessage.error(inbound.msgId(), "unsupported_type"));
        }
    }

    private void pumpEventsToClients() {
        while (running.get()) {
            try {
                Optional<UiEvent> next = eventBus.poll();
                if (next.isPresent()) {
                    broadcast(frameMapper.map(next.get()));
                    continue;
                }
                Thread.sleep(POLL_INTERVAL.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                LOG.warn("Failed to broadcast UI event: {}", e.getMessage());
            }
        }
    }

    private void broadcast(WsOutboundMessage message) {
        for (WebSocketChannel channel : clients.values()) {
            sendWs(channel, message);
        }
    }

    private void sendWs(WebSocketChannel channel, WsOutboundMessage message) {
        try {
            WebSockets.sendText(mapper.writeValueAsString(message), channel, null);
        } catch (IOException | RuntimeException e) {
            LOG.debug("Dropping {} frame: {}", message.type(), e.getMessage());
        }
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private JsonNode readJsonBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return mapper.createObjectNode();
        }
        return mapper.readTree(bytes);
    }

    private void sendInternalError(HttpServerExchange exchange, Exception error) {
        int status = error instanceof IllegalArgumentException ? 400 : 500;
        if (status == 500) {
            LOG.error("Gateway request {} failed", exchange.getRequestPath(), error);
        }
        try {
            sendJson(exchange, status, Map.of("error", error.getMessage() == null ? "internal_error" : error.getMessage()));
        } catch (IOException e) {
            LOG.debug("Could not send error response: {}", e.getMessage());
        }
    }

    static String conversationId(String requestPath) {
        String path = requestPath == null ? "" : requestPath;
        if (path.startsWith(CONVERSATIONS)) {
            path = path.substring(CONVERSATIONS.length());
        }
        while (path.startsWith("/")) {
            path = path.substring(1);
        }
        int slash = path.indexOf('/');
        return slash >= 0 ? path.substring(0, slash) : path;
    }

    private String queryParam(WebSocketHttpExchange exchange, String key) {
        List<String> values = exchange.getRequestParameters().get(key);
        if (values == null || values.isEmpty()) {
            return "";
        }
        String value = values.get(0);
        return value == null ? "" : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static void closeQuietly(WebSocketChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            LOG.debug("WebSocket close failed: {}", e.getMessage());
        }
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        List<Undertow.ListenerInfo> listeners = undertow.getListenerInfo();
        if (!listeners.isEmpty() && listeners.get(0).getAddress() instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WsInboundMessage(
        String type,
        @JsonProperty("conversation_id") String conversationId,
        @JsonProperty("agent_id") String agentId,
        String text,
        @JsonProperty("request_id") String requestId,
        Boolean approved,
        String reason,
        @JsonProperty("updated_input") Map<String, Object> updatedInput,
        @JsonProperty("msg_id") String msgId
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record WsOutboundMessage(
        String type,
        @JsonProperty("conversation_id") String conversationId,
        @JsonProperty("agent_id") String agentId,
        Map<String, Object> payload,
        @JsonProperty("msg_id") String msgId,
        String error,
        String timestamp
    ) {
        static WsOutboundMessage of(String type, String msgId) {
            return new WsOutboundMessage(type, null, null, null, msgId, null, null);
        }

        static WsOutboundMessage error(String msgId, String error) {
            return new WsOutboundMessage("error", null, null, null, msgId, error == null ? "internal_error" : error, null);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CreateConversationRequest(
        @JsonProperty("workspace_id") String workspaceId,
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("repo_path") String repoPath,
        @JsonProperty("agent_type") String agentType,
        ConversationSettings settings
    ) {
    }
}
