package io.relay.core.workspace;

import io.relay.core.model.Conversation;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public interface WorkspaceBinder {
    WorkingDirectory ensureWorkingDirectory(Conversation conversation) throws IOException;

    /**
     * Commits what the turn produced. Returns false when there was nothing to commit or committing is disabled.
     */
    boolean commitChanges(String conversationId, Path workingDirectory, String message, List<String> touchedFiles)
        throws IOException;
}
