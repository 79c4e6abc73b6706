package io.relay.core.model;

import java.util.List;
import java.util.Objects;

public record LoadedConversation(Conversation conversation, List<Message> messages) {

    public LoadedConversation {
        Objects.requireNonNull(conversation, "conversation must not be null");
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
