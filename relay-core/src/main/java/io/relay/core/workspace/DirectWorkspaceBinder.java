package io.relay.core.workspace;

import io.relay.core.model.Conversation;
import java.nio.file.Path;
import java.util.List;

public final class DirectWorkspaceBinder implements WorkspaceBinder {

    @Override
    public WorkingDirectory ensureWorkingDirectory(Conversation conversation) {
        return WorkingDirectory.of(Path.of(conversation.repoPath()).toAbsolutePath().normalize());
    }

    @Override
    public boolean commitChanges(String conversationId, Path workingDirectory, String message, List<String> touchedFiles) {
        return false;
    }
}
