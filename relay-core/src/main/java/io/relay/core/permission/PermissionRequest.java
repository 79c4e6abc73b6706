package io.relay.core.permission;

import java.time.Instant;
import java.util.Map;

public record PermissionRequest(
    String requestId,
    String conversationId,
    String toolName,
    Map<String, Object> toolInput,
    Instant createdAt
) {
}
