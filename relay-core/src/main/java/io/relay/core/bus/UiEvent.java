package io.relay.core.bus;

import io.relay.core.model.Message;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record UiEvent(
    UiEventType type,
    String conversationId,
    String agentId,
    Map<String, Object> payload,
    Instant timestamp
) {
    public static final String BUSY = "busy";
    public static final String READY = "ready";
    public static final String ERROR = "error";

    public UiEvent {
        Objects.requireNonNull(type, "type must not be null");
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static UiEvent status(String conversationId, String agentId, String status, String error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", status);
        if (error != null) {
            payload.put("error", error);
        }
        return new UiEvent(UiEventType.STATUS, conversationId, agentId, payload, null);
    }

    public static UiEvent message(String conversationId, String agentId, Message message) {
        return new UiEvent(UiEventType.MESSAGE, conversationId, agentId, Map.of("message", message), null);
    }

    public static UiEvent streamDelta(String conversationId, String agentId, String delta) {
        return new UiEvent(UiEventType.STREAM_DELTA, conversationId, agentId, Map.of("delta", delta), null);
    }

    public static UiEvent permissionRequest(
        String conversationId,
        String requestId,
        String toolName,
        Map<String, Object> toolInput
    ) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("requestId", requestId);
        payload.put("toolName", toolName);
        payload.put("toolInput", toolInput == null ? Map.of() : toolInput);
        return new UiEvent(UiEventType.PERMISSION_REQUEST, conversationId, null, payload, null);
    }

    public static UiEvent sessionUpdate(String conversationId, String sessionId, Instant sessionCreatedAt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sessionId", sessionId);
        payload.put("sessionCreatedAt", sessionCreatedAt == null ? null : sessionCreatedAt.toString());
        return new UiEvent(UiEventType.SESSION_UPDATE, conversationId, null, payload, null);
    }

    public static UiEvent fileChanged(String conversationId, String filePath, String toolName) {
        return new UiEvent(
            UiEventType.FILE_CHANGED,
            conversationId,
            null,
            Map.of("filePath", filePath, "toolName", toolName),
            null
        );
    }

    public static UiEvent todoUpdate(String conversationId, Object todos) {
        return new UiEvent(UiEventType.TODO_UPDATE, conversationId, null, Map.of("todos", todos), null);
    }

    public static UiEvent researchComplete(String conversationId, String outputPath, String text) {
        return new UiEvent(
            UiEventType.RESEARCH_COMPLETE,
            conversationId,
            null,
            Map.of("outputPath", outputPath, "text", text),
            null
        );
    }

    public String stringPayload(String key) {
        Object value = payload.get(key);
        return value == null ? null : String.valueOf(value);
    }
}
