package io.relay.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Conversation(
    String id,
    String agentId,
    String workspaceId,
    String repoPath,
    String agentType,
    String title,
    String sessionId,
    Instant sessionCreatedAt,
    String branchName,
    String worktreePath,
    Instant createdAt,
    Instant updatedAt,
    int messageCount,
    ConversationSettings settings
) {
    public static final String DEFAULT_TITLE = "New Conversation";

    public Conversation {
        Objects.requireNonNull(id, "id must not be null");
        agentId = agentId == null ? "" : agentId;
        workspaceId = workspaceId == null ? "" : workspaceId;
        repoPath = repoPath == null ? "" : repoPath;
        agentType = agentType == null ? "" : agentType;
        title = title == null || title.isBlank() ? DEFAULT_TITLE : title;
        settings = settings == null ? ConversationSettings.defaults() : settings;
    }

    public boolean hasResumeToken() {
        return sessionId != null && !sessionId.isBlank();
    }

    public Conversation apply(ConversationUpdate update, Instant now) {
        return new Conversation(
            id,
            agentId,
            workspaceId,
            repoPath,
            agentType,
            update.title() != null ? update.title() : title,
            update.sessionId() != null ? update.sessionId() : sessionId,
            update.sessionCreatedAt() != null ? update.sessionCreatedAt() : sessionCreatedAt,
            update.branchName() != null ? update.branchName() : branchName,
            update.worktreePath() != null ? update.worktreePath() : worktreePath,
            createdAt,
            now,
            messageCount,
            update.settings() != null ? update.settings() : settings
        );
    }

    public Conversation withMessageAppended(Instant now) {
        return new Conversation(
            id,
            agentId,
            workspaceId,
            repoPath,
            agentType,
            title,
            sessionId,
            sessionCreatedAt,
            branchName,
            worktreePath,
            createdAt,
            now,
            messageCount + 1,
            settings
        );
    }
}
