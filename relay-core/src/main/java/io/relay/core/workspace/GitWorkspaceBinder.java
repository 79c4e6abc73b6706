package io.relay.core.workspace;

import io.relay.core.config.model.GitSettings;
import io.relay.core.model.Conversation;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds each conversation to its own git branch, optionally in a dedicated worktree, and commits what
 * a turn changed. Directories that are not git repositories are used as they are.
 */
public final class GitWorkspaceBinder implements WorkspaceBinder {
    private static final Logger LOG = LoggerFactory.getLogger(GitWorkspaceBinder.class);

    private final GitCommandRunner git;
    private final GitSettings settings;

    public GitWorkspaceBinder(GitSettings settings) {
        this(new GitCommandRunner(), settings);
    }

    public GitWorkspaceBinder(GitCommandRunner git, GitSettings settings) {
        this.git = Objects.requireNonNull(git, "git must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    @Override
    public WorkingDirectory ensureWorkingDirectory(Conversation conversation) throws IOException {
        Path repo = Path.of(conversation.repoPath()).toAbsolutePath().normalize();
        if (!Files.isDirectory(repo)) {
            throw new IOException("Repository path does not exist: " + repo);
        }
        if (!settings.autoBranch() || !isRepository(repo)) {
            return WorkingDirectory.of(repo);
        }

        if (conversation.worktreePath() != null && Files.isDirectory(Path.of(conversation.worktreePath()))) {
            Path worktree = Path.of(conversation.worktreePath());
            return new WorkingDirectory(worktree, conversation.branchName(), worktree);
        }

        String branch = conversation.branchName() != null && !conversation.branchName().isBlank()
            ? conversation.branchName()
            : branchName(conversation);

        if (settings.useWorktrees()) {
            Path worktree = worktreePath(repo, conversation.id());
            if (Files.isDirectory(worktree)) {
                return new WorkingDirectory(worktree, branch, worktree);
            }
            Files.createDirectories(worktree.getParent());
            if (branchExists(repo, branch)) {
                git.require(repo, "worktree", "add", worktree.toString(), branch);
            } else {
                git.require(repo, "worktree", "add", "-b", branch, worktree.toString());
            }
            LOG.info("Created worktree {} on branch {}", worktree, branch);
            return new WorkingDirectory(worktree, branch, worktree);
        }

        String current = git.run(repo, "branch", "--show-current").output();
        if (!branch.equals(current)) {
            if (branchExists(repo, branch)) {
                git.require(repo, "checkout", branch);
            } else {
                git.require(repo, "checkout", "-b", branch);
                LOG.info("Created branch {} in {}", branch, repo);
            }
        }
        return new WorkingDirectory(repo, branch, null);
    }

    @Override
    public boolean commitChanges(String conversationId, Path workingDirectory, String message, List<String> touchedFiles)
        throws IOException {
        if (!settings.autoCommit() || !isRepository(workingDirectory)) {
            return false;
        }
        String status = git.require(workingDirectory, "status", "--porcelain");
        if (status.isBlank()) {
            return false;
        }

        if (touchedFiles == null || touchedFiles.isEmpty()) {
            git.require(workingDirectory, "add", "-A");
        } else {
            List<String> paths = stageablePaths(workingDirectory, touchedFiles);
            if (paths.isEmpty()) {
                LOG.debug("None of the changed files can be staged in {}", workingDirectory);
                return false;
            }
            List<String> args = new ArrayList<>(List.of("add", "-A", "--"));
            args.addAll(paths);
            git.require(workingDirectory, args.toArray(String[]::new));
        }

        if (git.run(workingDirectory, "diff", "--cached", "--quiet").ok()) {
            return false;
        }
        git.require(workingDirectory, "commit", "-m", message);
        LOG.info("Committed changes for conversation {} in {}", conversationId, workingDirectory);
        return true;
    }

    String branchName(Conversation conversation) {
        String owner = conversation.agentId().isBlank() ? conversation.agentType() : conversation.agentId();
        String shortId = conversation.id().length() > 7 ? conversation.id().substring(0, 7) : conversation.id();
        return settings.branchPrefix() + "/" + slug(owner) + "-" + shortId;
    }

    Path worktreePath(Path repo, String conversationId) {
        Path base = Path.of(settings.worktreeDirectory());
        Path root = base.isAbsolute() ? base : repo.getParent().resolve(base);
        return root.resolve(repo.getFileName() + "-" + conversationId).normalize();
    }

    private boolean isRepository(Path path) throws IOException {
        if (!Files.isDirectory(path)) {
            return false;
        }
        return git.run(path, "rev-parse", "--is-inside-work-tree").ok();
    }

    private boolean branchExists(Path repo, String branch) throws IOException {
        return git.run(repo, "rev-parse", "--verify", "--quiet", "refs/heads/" + branch).ok();
    }

    /** Paths inside the working directory that exist or that git still tracks (deletions). */
    private List<String> stageablePaths(Path workingDirectory, List<String> touchedFiles) throws IOException {
        List<String> paths = new ArrayList<>();
        Path root = workingDirectory.toAbsolutePath().normalize();
        for (String file : touchedFiles) {
            if (file == null || file.isBlank()) {
                continue;
            }
            Path resolved = root.resolve(file).normalize();
            if (!resolved.startsWith(root)) {
                LOG.warn("Ignoring changed file outside working directory: {}", file);
                continue;
            }
            String relative = root.relativize(resolved).toString();
            if (Files.exists(resolved) || git.run(root, "ls-files", "--error-unmatch", "--", relative).ok()) {
                paths.add(relative);
            }
        }
        return paths;
    }

    private static String slug(String value) {
        String slug = value == null ? "" : value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        slug = slug.replaceAll("^-+|-+$", "");
        return slug.isBlank() ? "agent" : slug;
    }
}
