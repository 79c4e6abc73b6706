package io.relay.core.workspace;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Directory a turn runs in, with the branch and worktree it was bound to (both null when unbound).
 */
public record WorkingDirectory(Path path, String branchName, Path worktreePath) {

    public WorkingDirectory {
        Objects.requireNonNull(path, "path must not be null");
    }

    public static WorkingDirectory of(Path path) {
        return new WorkingDirectory(path, null, null);
    }
}
