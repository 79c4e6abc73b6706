package io.relay.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GitSettings(
    @JsonAlias({"auto_branch"}) boolean autoBranch,
    @JsonAlias({"use_worktrees"}) boolean useWorktrees,
    @JsonAlias({"auto_commit"}) boolean autoCommit,
    @JsonAlias({"branch_prefix"}) String branchPrefix,
    @JsonAlias({"worktree_directory"}) String worktreeDirectory
) {

    public GitSettings {
        branchPrefix = branchPrefix == null || branchPrefix.isBlank() ? "agent" : branchPrefix.trim();
        worktreeDirectory = worktreeDirectory == null || worktreeDirectory.isBlank()
            ? ".relay-worktrees"
            : worktreeDirectory.trim();
    }

    public static GitSettings defaults() {
        return new GitSettings(true, false, true, "agent", ".relay-worktrees");
    }
}
