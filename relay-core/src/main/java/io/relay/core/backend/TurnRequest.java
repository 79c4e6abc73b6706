package io.relay.core.backend;

import io.relay.core.model.Conversation;
import io.relay.core.model.ConversationSettings;
import io.relay.core.model.Message;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

public record TurnRequest(
    Conversation conversation,
    String message,
    String resumeToken,
    Path workingDirectory,
    List<Message> history,
    String systemPrompt
) {

    public TurnRequest {
        Objects.requireNonNull(conversation, "conversation must not be null");
        Objects.requireNonNull(workingDirectory, "workingDirectory must not be null");
        message = message == null ? "" : message;
        history = history == null ? List.of() : List.copyOf(history);
        systemPrompt = systemPrompt == null || systemPrompt.isBlank() ? null : systemPrompt;
    }

    public TurnRequest(
        Conversation conversation,
        String message,
        String resumeToken,
        Path workingDirectory,
        List<Message> history
    ) {
        this(conversation, message, resumeToken, workingDirectory, history, null);
    }

    public String conversationId() {
        return conversation.id();
    }

    public ConversationSettings settings() {
        return conversation.settings();
    }
}
