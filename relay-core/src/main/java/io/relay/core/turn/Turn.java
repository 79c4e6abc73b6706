package io.relay.core.turn;

import com.fasterxml.jackson.databind.JsonNode;
import io.relay.core.bus.UiEvent;
import io.relay.core.bus.UiEventBus;
import io.relay.core.model.Conversation;
import io.relay.core.model.ConversationUpdate;
import io.relay.core.model.Message;
import io.relay.core.session.SessionRegistry;
import io.relay.core.session.TurnHandle;
import io.relay.core.store.MessageStore;
import io.relay.core.workspace.WorkingDirectory;
import io.relay.core.workspace.WorkspaceBinder;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of one in-flight turn plus the sinks its normalizer writes to. Confined to the turn's thread.
 */
public final class Turn {
    private static final Logger LOG = LoggerFactory.getLogger(Turn.class);

    private final TurnHandle handle;
    private final String userMessage;
    private final String expectedSessionId;
    private final boolean firstTurn;
    private final WorkingDirectory workingDirectory;
    private final List<Message> history;
    private final MessageStore store;
    private final UiEventBus eventBus;
    private final SessionRegistry sessions;
    private final WorkspaceBinder binder;
    private final Clock clock;
    private final Instant startedAt;

    private Conversation conversation;
    private final StringBuilder streamed = new StringBuilder();
    private final Set<String> touchedFiles = new LinkedHashSet<>();
    private JsonNode lastAssistant;
    private JsonNode lastResult;
    private String capturedSessionId;

    public Turn(
        TurnHandle handle,
        Conversation conversation,
        String userMessage,
        String expectedSessionId,
        WorkingDirectory workingDirectory,
        List<Message> history,
        MessageStore store,
        UiEventBus eventBus,
        SessionRegistry sessions,
        WorkspaceBinder binder,
        Clock clock
    ) {
        this.handle = Objects.requireNonNull(handle, "handle must not be null");
        this.conversation = Objects.requireNonNull(conversation, "conversation must not be null");
        this.userMessage = userMessage == null ? "" : userMessage;
        this.expectedSessionId = expectedSessionId;
        this.firstTurn = !conversation.hasResumeToken();
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory must not be null");
        this.history = history == null ? List.of() : List.copyOf(history);
        this.store = store;
        this.eventBus = eventBus;
        this.sessions = sessions;
        this.binder = binder;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public String conversationId() {
        return conversation.id();
    }

    public String agentId() {
        return conversation.agentId();
    }

    public Conversation conversation() {
        return conversation;
    }

    public String userMessage() {
        return userMessage;
    }

    /** Resume token the backend was asked to continue, or null for a fresh session. */
    public String expectedSessionId() {
        return expectedSessionId;
    }

    public boolean firstTurn() {
        return firstTurn;
    }

    public WorkingDirectory workingDirectory() {
        return workingDirectory;
    }

    /** Messages persisted before this turn's user message. */
    public List<Message> history() {
        return history;
    }

    public boolean isCancelled() {
        return handle.isCancelled();
    }

    public Instant now() {
        return clock.instant();
    }

    public Instant startedAt() {
        return startedAt;
    }

    public void persist(Message message) throws IOException {
        store.append(conversation.id(), message);
        eventBus.publish(UiEvent.message(conversation.id(), conversation.agentId(), message));
    }

    public void emit(UiEvent event) {
        eventBus.publish(event);
    }

    /** Streams text to the UI and accumulates it into the final assistant message. */
    public void appendText(String delta) {
        if (delta == null || delta.isEmpty()) {
            return;
        }
        streamed.append(delta);
        eventBus.publish(UiEvent.streamDelta(conversation.id(), conversation.agentId(), delta));
    }

    /** Streams text to the UI without keeping it. */
    public void streamOnly(String delta) {
        if (delta == null || delta.isEmpty()) {
            return;
        }
        eventBus.publish(UiEvent.streamDelta(conversation.id(), conversation.agentId(), delta));
    }

    public String streamedText() {
        return streamed.toString();
    }

    public void updateConversation(ConversationUpdate update) throws IOException {
        conversation = store.update(conversation.id(), update);
    }

    public void captureSession(String sessionId) {
        capturedSessionId = sessionId;
        sessions.cacheResumeToken(conversation.agentId(), sessionId);
    }

    public String capturedSessionId() {
        return capturedSessionId;
    }

    public void recordAssistant(JsonNode envelope) {
        lastAssistant = envelope;
    }

    public JsonNode lastAssistant() {
        return lastAssistant;
    }

    public void recordResult(JsonNode envelope) {
        lastResult = envelope;
    }

    public JsonNode lastResult() {
        return lastResult;
    }

    public void touch(String filePath) {
        if (filePath != null && !filePath.isBlank()) {
            touchedFiles.add(filePath);
        }
    }

    public List<String> touchedFiles() {
        return new ArrayList<>(touchedFiles);
    }

    public void applyTitle() throws IOException {
        updateConversation(ConversationUpdate.title(Titles.fromMessage(userMessage)));
    }

    /**
     * Commits the turn's output. A failed commit is logged and does not fail the turn.
     */
    public boolean commit(String message, List<String> files) {
        try {
            return binder.commitChanges(conversation.id(), workingDirectory.path(), message, files);
        } catch (IOException e) {
            LOG.warn("Auto-commit failed for conversation {}: {}", conversation.id(), e.getMessage());
            return false;
        }
    }
}
