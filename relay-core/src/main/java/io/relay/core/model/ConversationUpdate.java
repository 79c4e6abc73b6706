package io.relay.core.model;

import java.time.Instant;

/**
 * Partial conversation patch. Null components leave the stored value untouched.
 */
public record ConversationUpdate(
    String title,
    String sessionId,
    Instant sessionCreatedAt,
    String branchName,
    String worktreePath,
    ConversationSettings settings
) {

    public static ConversationUpdate title(String title) {
        return new ConversationUpdate(title, null, null, null, null, null);
    }

    public static ConversationUpdate session(String sessionId, Instant sessionCreatedAt) {
        return new ConversationUpdate(null, sessionId, sessionCreatedAt, null, null, null);
    }

    public static ConversationUpdate branch(String branchName, String worktreePath) {
        return new ConversationUpdate(null, null, null, branchName, worktreePath, null);
    }

    public static ConversationUpdate settings(ConversationSettings settings) {
        return new ConversationUpdate(null, null, null, null, null, settings);
    }
}
