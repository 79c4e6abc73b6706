package io.relay.core.turn;

import io.relay.core.backend.AgentBackend;
import io.relay.core.backend.BackendConfigurationException;
import io.relay.core.backend.BackendRouter;
import io.relay.core.backend.EventNormalizer;
import io.relay.core.backend.EventStream;
import io.relay.core.backend.TurnRequest;
import io.relay.core.bus.UiEvent;
import io.relay.core.bus.UiEventBus;
import io.relay.core.model.Conversation;
import io.relay.core.model.ConversationUpdate;
import io.relay.core.model.LoadedConversation;
import io.relay.core.model.Message;
import io.relay.core.permission.PermissionGate;
import io.relay.core.session.SessionRegistry;
import io.relay.core.session.TurnHandle;
import io.relay.core.session.WorkspaceLeases;
import io.relay.core.store.MessageStore;
import io.relay.core.workspace.WorkingDirectory;
import io.relay.core.workspace.WorkspaceBinder;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a single turn from the user's message to the conversation's return to ready.
 */
public final class TurnController {
    private static final Logger LOG = LoggerFactory.getLogger(TurnController.class);
    public static final Duration DEFAULT_SESSION_MAX_AGE = Duration.ofDays(25);
    static final String DEFAULT_STOPPED_MESSAGE = "Agent stopped by user";
    private static final Duration SUPERSEDE_WAIT = Duration.ofSeconds(30);

    private final SessionRegistry sessions;
    private final PermissionGate permissionGate;
    private final BackendRouter router;
    private final MessageStore store;
    private final UiEventBus eventBus;
    private final WorkspaceBinder binder;
    private final Clock clock;
    private final Duration sessionMaxAge;

    public TurnController(
        SessionRegistry sessions,
        PermissionGate permissionGate,
        BackendRouter router,
        MessageStore store,
        UiEventBus eventBus,
        WorkspaceBinder binder,
        Clock clock,
        Duration sessionMaxAge
    ) {
        this.sessions = Objects.requireNonNull(sessions, "sessions must not be null");
        this.permissionGate = Objects.requireNonNull(permissionGate, "permissionGate must not be null");
        this.router = Objects.requireNonNull(router, "router must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus must not be null");
        this.binder = Objects.requireNonNull(binder, "binder must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sessionMaxAge = sessionMaxAge == null ? DEFAULT_SESSION_MAX_AGE : sessionMaxAge;
    }

    public TurnOutcome run(TurnHandle handle, String text) {
        String conversationId = handle.conversationId();
        String agentId = "";
        EventNormalizer normalizer = null;
        WorkspaceLeases.Lease lease = null;
        TurnState state = TurnState.IDLE;
        handle.cancellation().onCancel(() -> permissionGate.cancel(conversationId));
        try {
            awaitSuperseded(handle);

            state = TurnState.RESOLVING;
            LoadedConversation loaded = store.load(conversationId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown conversation: " + conversationId));
            Conversation conversation = loaded.conversation();
            agentId = conversation.agentId();
            eventBus.publish(UiEvent.status(conversationId, agentId, UiEvent.BUSY, null));

            String resumeToken = effectiveResumeToken(conversation);
            Message userMessage = Message.user(text, clock.instant());
            store.append(conversationId, userMessage);
            eventBus.publish(UiEvent.message(conversationId, agentId, userMessage));
            throwIfCancelled(handle);

            lease = leaseDirectory(handle, Path.of(conversation.repoPath()));
            WorkingDirectory workingDirectory = binder.ensureWorkingDirectory(conversation);
            if (!lease.covers(workingDirectory.path())) {
                lease.close();
                lease = leaseDirectory(handle, workingDirectory.path());
            }
            conversation = recordBinding(conversation, workingDirectory);
            AgentBackend backend = router.route(conversation.agentType());
            Turn turn = new Turn(
                handle,
                conversation,
                text,
                resumeToken,
                workingDirectory,
                loaded.messages(),
                store,
                eventBus,
                sessions,
                binder,
                clock
            );
            normalizer = backend.normalizer(turn);
            throwIfCancelled(handle);

            state = TurnState.STREAMING;
            TurnRequest request = new TurnRequest(
                conversation,
                text,
                resumeToken,
                workingDirectory.path(),
                loaded.messages(),
                resumeToken == null ? systemPrompt(conversation) : null
            );
            try (EventStream stream = backend.invoke(request)) {
                handle.cancellation().onCancel(() -> backend.interrupt(conversationId));
                normalizer.onStart();
                while (!handle.isCancelled()) {
                    Optional<JsonNode> event = stream.next();
                    if (event.isEmpty()) {
                        break;
                    }
                    normalizer.onEvent(event.get());
                }
            }
            if (!handle.beginFinalizing()) {
                throw new TurnCancelledException();
            }

            state = TurnState.FINALIZING;
            normalizer.onComplete();
            return TurnOutcome.COMPLETED;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            if (handle.isCancelled()) {
                state = TurnState.CANCELLED;
                String stopped = normalizer == null ? DEFAULT_STOPPED_MESSAGE : normalizer.stoppedMessage();
                persistQuietly(conversationId, agentId, Message.system(stopped, clock.instant()));
                return TurnOutcome.CANCELLED;
            }
            TurnState failedDuring = state;
            state = TurnState.FAILED;
            String error = describe(e);
            if (e instanceof BackendConfigurationException) {
                LOG.warn("Backend not configured for conversation {}: {}", conversationId, error);
            } else {
                LOG.error("Turn failed for conversation {} while {}", conversationId, failedDuring, e);
            }
            persistQuietly(conversationId, agentId, Message.error(error, clock.instant()));
            eventBus.publish(UiEvent.status(conversationId, agentId, UiEvent.ERROR, error));
            return TurnOutcome.FAILED;
        } finally {
            if (lease != null) {
                lease.close();
            }
            if (sessions.endTurn(conversationId, handle)) {
                permissionGate.cancel(conversationId);
                eventBus.publish(UiEvent.status(conversationId, agentId, UiEvent.READY, null));
            } else {
                LOG.debug("Turn {} on {} was superseded, leaving cleanup to its successor", handle.turnId(), conversationId);
            }
            handle.markFinished();
            LOG.debug("Turn {} on {} ended in state {}", handle.turnId(), conversationId, state);
        }
    }

    String effectiveResumeToken(Conversation conversation) {
        if (!conversation.hasResumeToken()) {
            return null;
        }
        Instant createdAt = conversation.sessionCreatedAt();
        if (createdAt != null) {
            Duration age = Duration.between(createdAt, clock.instant());
            if (age.compareTo(sessionMaxAge) > 0) {
                LOG.info(
                    "Session {} expired ({} days old), starting fresh",
                    conversation.sessionId(),
                    age.toDays()
                );
                return null;
            }
        }
        return conversation.sessionId();
    }

    /**
     * Contents of the conversation's agent file, used as extra system prompt for fresh sessions.
     * Relative paths resolve against the repository. Null when unset or unreadable.
     */
    String systemPrompt(Conversation conversation) {
        String agentFile = conversation.settings().agentFile();
        if (agentFile == null) {
            return null;
        }
        Path path = Path.of(conversation.repoPath()).toAbsolutePath().resolve(agentFile).normalize();
        if (!Files.isRegularFile(path)) {
            LOG.warn("Agent file {} for conversation {} does not exist", path, conversation.id());
            return null;
        }
        try {
            return Files.readString(path);
        } catch (IOException e) {
            LOG.warn("Failed to read agent file {}: {}", path, e.getMessage());
            return null;
        }
    }

    private WorkspaceLeases.Lease leaseDirectory(TurnHandle handle, Path directory)
        throws InterruptedException, TurnCancelledException {
        return sessions.workspaces()
            .acquire(directory, handle.cancellation())
            .orElseThrow(TurnCancelledException::new);
    }

    private void awaitSuperseded(TurnHandle handle) throws InterruptedException {
        Optional<TurnHandle> previous = handle.superseded();
        if (previous.isPresent() && !previous.get().awaitFinished(SUPERSEDE_WAIT)) {
            LOG.warn("Previous turn on {} did not stop within {}s", handle.conversationId(), SUPERSEDE_WAIT.toSeconds());
        }
        handle.releaseSuperseded();
    }

    private Conversation recordBinding(Conversation conversation, WorkingDirectory workingDirectory) throws IOException {
        String branch = workingDirectory.branchName();
        String worktree = workingDirectory.worktreePath() == null ? null : workingDirectory.worktreePath().toString();
        boolean branchChanged = branch != null && !branch.equals(conversation.branchName());
        boolean worktreeChanged = worktree != null && !worktree.equals(conversation.worktreePath());
        if (!branchChanged && !worktreeChanged) {
            return conversation;
        }
        return store.update(conversation.id(), ConversationUpdate.branch(branch, worktree));
    }

    private void persistQuietly(String conversationId, String agentId, Message message) {
        try {
            store.append(conversationId, message);
            eventBus.publish(UiEvent.message(conversationId, agentId, message));
        } catch (IOException | RuntimeException e) {
            LOG.error("Failed to persist {} message for conversation {}", message.type(), conversationId, e);
        }
    }

    private static void throwIfCancelled(TurnHandle handle) throws TurnCancelledException {
        if (handle.isCancelled()) {
            throw new TurnCancelledException();
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static final class TurnCancelledException extends Exception {
        private TurnCancelledException() {
            super("Turn cancelled", null, false, false);
        }
    }
}
