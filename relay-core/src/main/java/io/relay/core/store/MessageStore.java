package io.relay.core.store;

import io.relay.core.model.Conversation;
import io.relay.core.model.ConversationSettings;
import io.relay.core.model.ConversationUpdate;
import io.relay.core.model.LoadedConversation;
import io.relay.core.model.Message;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface MessageStore {
    Conversation create(
        String workspaceId,
        String agentId,
        String repoPath,
        String agentType,
        ConversationSettings settings
    ) throws IOException;

    List<Conversation> list() throws IOException;

    Optional<LoadedConversation> load(String conversationId) throws IOException;

    void append(String conversationId, Message message) throws IOException;

    Conversation update(String conversationId, ConversationUpdate update) throws IOException;

    default Conversation require(String conversationId) throws IOException {
        return load(conversationId)
            .map(LoadedConversation::conversation)
            .orElseThrow(() -> new IllegalArgumentException("Unknown conversation: " + conversationId));
    }
}
