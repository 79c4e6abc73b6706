package io.relay.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Message(
    String uuid,
    MessageType type,
    String content,
    Instant timestamp,
    String sessionId,
    String toolName,
    Map<String, Object> toolInput,
    String toolUseId,
    @JsonProperty("isToolError") Boolean isToolError,
    Integer inputTokens,
    Integer outputTokens,
    Double costUsd,
    Long durationMs,
    Integer numTurns,
    ResearchPhase researchPhase,
    Integer searchCount,
    List<ResearchSource> researchSources,
    String outputPath,
    Integer wordCount,
    Integer sourceCount
) {

    public Message {
        Objects.requireNonNull(type, "type must not be null");
        uuid = uuid == null || uuid.isBlank() ? UUID.randomUUID().toString() : uuid;
        content = content == null ? "" : content;
        timestamp = timestamp == null ? Instant.now() : timestamp;
        toolInput = toolInput == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(toolInput));
        researchSources = researchSources == null ? null : List.copyOf(researchSources);
    }

    public static Message user(String content, Instant timestamp) {
        return simple(MessageType.USER, content, timestamp);
    }

    public static Message system(String content, Instant timestamp) {
        return simple(MessageType.SYSTEM, content, timestamp);
    }

    public static Message error(String content, Instant timestamp) {
        return simple(MessageType.ERROR, content, timestamp);
    }

    public static Message assistant(
        String content,
        String sessionId,
        Integer inputTokens,
        Integer outputTokens,
        Double costUsd,
        Long durationMs,
        Instant timestamp
    ) {
        return new Message(
            null, MessageType.ASSISTANT, content, timestamp, sessionId,
            null, null, null, null,
            inputTokens, outputTokens, costUsd, durationMs, null,
            null, null, null, null, null, null
        );
    }

    public static Message toolUse(
        String content,
        String toolName,
        Map<String, Object> toolInput,
        String toolUseId,
        Instant timestamp
    ) {
        return new Message(
            null, MessageType.TOOL_USE, content, timestamp, null,
            toolName, toolInput, toolUseId, null,
            null, null, null, null, null,
            null, null, null, null, null, null
        );
    }

    public static Message toolResult(String content, String toolUseId, boolean isToolError, Instant timestamp) {
        return new Message(
            null, MessageType.TOOL_RESULT, content, timestamp, null,
            null, null, toolUseId, isToolError,
            null, null, null, null, null,
            null, null, null, null, null, null
        );
    }

    public static Message fileChange(String content, String toolName, String filePath, Instant timestamp) {
        return new Message(
            null, MessageType.SYSTEM, content, timestamp, null,
            toolName, Map.of("file_path", filePath), null, null,
            null, null, null, null, null,
            null, null, null, null, null, null
        );
    }

    public static Message turnSummary(
        String content,
        String sessionId,
        Double costUsd,
        Long durationMs,
        Integer numTurns,
        Instant timestamp
    ) {
        return new Message(
            null, MessageType.SYSTEM, content, timestamp, sessionId,
            null, null, null, null,
            null, null, costUsd, durationMs, numTurns,
            null, null, null, null, null, null
        );
    }

    public static Message researchProgress(
        String content,
        ResearchPhase phase,
        int searchCount,
        List<ResearchSource> sources,
        Instant timestamp
    ) {
        return new Message(
            null, MessageType.RESEARCH_PROGRESS, content, timestamp, null,
            null, null, null, null,
            null, null, null, null, null,
            phase, searchCount, sources, null, null, null
        );
    }

    public static Message researchResult(
        String content,
        int searchCount,
        List<ResearchSource> sources,
        String outputPath,
        int wordCount,
        int sourceCount,
        long durationMs,
        Instant timestamp
    ) {
        return new Message(
            null, MessageType.RESEARCH_RESULT, content, timestamp, null,
            null, null, null, null,
            null, null, null, durationMs, null,
            ResearchPhase.COMPLETE, searchCount, sources, outputPath, wordCount, sourceCount
        );
    }

    public Message withSessionId(String value) {
        return new Message(
            uuid, type, content, timestamp, value,
            toolName, toolInput, toolUseId, isToolError,
            inputTokens, outputTokens, costUsd, durationMs, numTurns,
            researchPhase, searchCount, researchSources, outputPath, wordCount, sourceCount
        );
    }

    private static Message simple(MessageType type, String content, Instant timestamp) {
        return new Message(
            null, type, content, timestamp, null,
            null, null, null, null,
            null, null, null, null, null,
            null, null, null, null, null, null
        );
    }
}
