package io.relay.core.workspace;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import io.relay.core.config.model.GitSettings;
import io.relay.core.model.Conversation;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GitWorkspaceBinderTest {

    @TempDir
    Path tempDir;

    private final GitCommandRunner git = new GitCommandRunner();
    private Path repo;

    @BeforeEach
    void setUp() throws IOException {
        assumeTrue(gitAvailable(), "requires git on PATH");
        repo = tempDir.resolve("repo");
        Files.createDirectories(repo);
        git.require(repo, "init");
        git.require(repo, "config", "user.email", "relay@example.com");
        git.require(repo, "config", "user.name", "Relay Test");
        git.require(repo, "config", "commit.gpgsign", "false");
        Files.writeString(repo.resolve("README.md"), "hello\n");
        git.require(repo, "add", "README.md");
        git.require(repo, "commit", "-m", "initial");
    }

    @Test
    void shouldUsePlainDirectoryWhenNotARepository() throws Exception {
        Path plain = tempDir.resolve("plain");
        Files.createDirectories(plain);
        GitWorkspaceBinder binder = new GitWorkspaceBinder(git, GitSettings.defaults());

        WorkingDirectory directory = binder.ensureWorkingDirectory(conversation(plain, null, null));

        assertThat(directory.path()).isEqualTo(plain.toAbsolutePath().normalize());
        assertThat(directory.branchName()).isNull();
        assertThat(binder.commitChanges("c1", plain, "msg", List.of())).isFalse();
    }

    @Test
    void shouldCheckOutConversationBranch() throws Exception {
        GitWorkspaceBinder binder = new GitWorkspaceBinder(git, GitSettings.defaults());
        Conversation conversation = conversation(repo, null, null);

        WorkingDirectory directory = binder.ensureWorkingDirectory(conversation);

        assertThat(directory.branchName()).isEqualTo("agent/agent-1-abcdef1");
        assertThat(directory.worktreePath()).isNull();
        assertThat(git.require(repo, "branch", "--show-current")).isEqualTo("agent/agent-1-abcdef1");

        WorkingDirectory again = binder.ensureWorkingDirectory(conversation(repo, "agent/agent-1-abcdef1", null));
        assertThat(again.branchName()).isEqualTo("agent/agent-1-abcdef1");
    }

    @Test
    void shouldCreateWorktreeOutsideTheRepository() throws Exception {
        GitSettings settings = new GitSettings(true, true, true, "agent", ".relay-worktrees");
        GitWorkspaceBinder binder = new GitWorkspaceBinder(git, settings);

        WorkingDirectory directory = binder.ensureWorkingDirectory(conversation(repo, null, null));

        Path expected = tempDir.resolve(".relay-worktrees").resolve("repo-abcdef12-3456").toAbsolutePath().normalize();
        assertThat(directory.path()).isEqualTo(expected);
        assertThat(directory.worktreePath()).isEqualTo(expected);
        assertThat(Files.exists(expected.resolve("README.md"))).isTrue();
        assertThat(git.require(expected, "branch", "--show-current")).isEqualTo("agent/agent-1-abcdef1");
    }

    @Test
    void shouldCommitTouchedFilesOnly() throws Exception {
        GitWorkspaceBinder binder = new GitWorkspaceBinder(git, GitSettings.defaults());
        Files.writeString(repo.resolve("notes.md"), "touched\n");
        Files.writeString(repo.resolve("scratch.txt"), "untouched\n");

        boolean committed = binder.commitChanges("c1", repo, "[Agent] write notes", List.of("notes.md", "../outside.txt"));

        assertThat(committed).isTrue();
        assertThat(git.require(repo, "log", "-1", "--pretty=%s")).isEqualTo("[Agent] write notes");
        assertThat(git.require(repo, "show", "--name-only", "--pretty=format:", "HEAD")).isEqualTo("notes.md");
        assertThat(git.require(repo, "status", "--porcelain")).contains("scratch.txt");
    }

    @Test
    void shouldCommitDeletionOfTouchedFileWithoutStagingOthers() throws Exception {
        Files.writeString(repo.resolve("old.md"), "stale\n");
        git.require(repo, "add", "old.md");
        git.require(repo, "commit", "-m", "add old");
        GitWorkspaceBinder binder = new GitWorkspaceBinder(git, GitSettings.defaults());
        Files.delete(repo.resolve("old.md"));
        Files.writeString(repo.resolve("scratch.txt"), "untouched\n");

        boolean committed = binder.commitChanges("c1", repo, "[Agent] remove old", List.of("old.md"));

        assertThat(committed).isTrue();
        assertThat(git.require(repo, "show", "--name-status", "--pretty=format:", "HEAD")).isEqualTo("D\told.md");
        assertThat(git.require(repo, "status", "--porcelain")).isEqualTo("?? scratch.txt");
    }

    @Test
    void shouldNotFallBackToStagingEverythingWhenTouchedFilesAreGone() throws Exception {
        GitWorkspaceBinder binder = new GitWorkspaceBinder(git, GitSettings.defaults());
        Files.writeString(repo.resolve("scratch.txt"), "untouched\n");

        boolean committed = binder.commitChanges("c1", repo, "[Agent] ghost", List.of("ghost.md"));

        assertThat(committed).isFalse();
        assertThat(git.require(repo, "log", "-1", "--pretty=%s")).isEqualTo("initial");
        assertThat(git.require(repo, "status", "--porcelain")).isEqualTo("?? scratch.txt");
    }

    @Test
    void shouldSkipCommitWhenNothingChangedOrDisabled() throws Exception {
        GitWorkspaceBinder binder = new GitWorkspaceBinder(git, GitSettings.defaults());
        assertThat(binder.commitChanges("c1", repo, "nothing", List.of())).isFalse();

        Files.writeString(repo.resolve("notes.md"), "touched\n");
        GitWorkspaceBinder disabled = new GitWorkspaceBinder(git, new GitSettings(true, false, false, "agent", null));
        assertThat(disabled.commitChanges("c1", repo, "disabled", List.of("notes.md"))).isFalse();
    }

    @Test
    void shouldRejectMissingRepositoryPath() {
        GitWorkspaceBinder binder = new GitWorkspaceBinder(git, GitSettings.defaults());

        assertThatThrownBy(() -> binder.ensureWorkingDirectory(conversation(tempDir.resolve("missing"), null, null)))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("does not exist");
    }

    private Conversation conversation(Path repoPath, String branch, String worktree) {
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        return new Conversation(
            "abcdef12-3456", "agent-1", "ws", repoPath.toString(), "claude", null, null, null, branch, worktree, now, now, 0, null
        );
    }

    private boolean gitAvailable() {
        try {
            return git.run(tempDir, "--version").ok();
        } catch (IOException e) {
            return false;
        }
    }
}
