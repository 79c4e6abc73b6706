package io.relay.core.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.relay.core.model.Conversation;
import io.relay.core.model.ConversationSettings;
import io.relay.core.model.ConversationUpdate;
import io.relay.core.model.LoadedConversation;
import io.relay.core.model.Message;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversation index in {@code conversations.json} plus one append-only
 * {@code <id>-messages.jsonl} log per conversation.
 */
public final class FileMessageStore implements MessageStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileMessageStore.class);
    private static final String INDEX_FILE = "conversations.json";

    private final Path root;
    private final Clock clock;
    private final ObjectMapper mapper;

    public FileMessageStore(Path root) {
        this(root, Clock.systemUTC());
    }

    public FileMessageStore(Path root, Clock clock) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized Conversation create(
        String workspaceId,
        String agentId,
        String repoPath,
        String agentType,
        ConversationSettings settings
    ) throws IOException {
        Instant now = clock.instant();
        Conversation conversation = new Conversation(
            UUID.randomUUID().toString(),
            agentId,
            workspaceId,
            repoPath,
            agentType,
            Conversation.DEFAULT_TITLE,
            null,
            null,
            null,
            null,
            now,
            now,
            0,
            settings
        );
        List<Conversation> conversations = new ArrayList<>(readIndex());
        conversations.add(conversation);
        writeIndex(conversations);
        return conversation;
    }

    @Override
    public synchronized List<Conversation> list() throws IOException {
        return readIndex().stream()
            .sorted(Comparator.comparing(Conversation::updatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
            .toList();
    }

    @Override
    public synchronized Optional<LoadedConversation> load(String conversationId) throws IOException {
        Optional<Conversation> conversation = find(readIndex(), conversationId);
        if (conversation.isEmpty()) {
            return Optional.empty();
        }
        Path messagesPath = messagesPath(conversationId);
        List<Message> messages = new ArrayList<>();
        if (Files.exists(messagesPath)) {
            for (String line : Files.readAllLines(messagesPath, StandardCharsets.UTF_8)) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    messages.add(mapper.readValue(line, Message.class));
                } catch (IOException e) {
                    LOG.warn("Skipping malformed message line in {}: {}", messagesPath, e.getMessage());
                }
            }
        }
        return Optional.of(new LoadedConversation(conversation.get(), messages));
    }

    @Override
    public synchronized void append(String conversationId, Message message) throws IOException {
        Objects.requireNonNull(message, "message must not be null");
        List<Conversation> conversations = new ArrayList<>(readIndex());
        int index = indexOf(conversations, conversationId);

        Files.createDirectories(root);
        String line = mapper.writeValueAsString(message) + "\n";
        Files.writeString(
            messagesPath(conversationId),
            line,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND
        );

        conversations.set(index, conversations.get(index).withMessageAppended(clock.instant()));
        writeIndex(conversations);
    }

    @Override
    public synchronized Conversation update(String conversationId, ConversationUpdate update) throws IOException {
        Objects.requireNonNull(update, "update must not be null");
        List<Conversation> conversations = new ArrayList<>(readIndex());
        int index = indexOf(conversations, conversationId);
        Conversation updated = conversations.get(index).apply(update, clock.instant());
        conversations.set(index, updated);
        writeIndex(conversations);
        return updated;
    }

    private List<Conversation> readIndex() throws IOException {
        Path indexPath = root.resolve(INDEX_FILE);
        if (!Files.exists(indexPath)) {
            return List.of();
        }
        ConversationIndex index = mapper.readValue(Files.readString(indexPath), ConversationIndex.class);
        return index.conversations() == null ? List.of() : index.conversations();
    }

    private void writeIndex(List<Conversation> conversations) throws IOException {
        Files.createDirectories(root);
        Path indexPath = root.resolve(INDEX_FILE);
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(new ConversationIndex(conversations));
        Path tmp = indexPath.resolveSibling(INDEX_FILE + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, indexPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private Path messagesPath(String conversationId) {
        return root.resolve(conversationId + "-messages.jsonl");
    }

    private static Optional<Conversation> find(List<Conversation> conversations, String conversationId) {
        return conversations.stream().filter(c -> c.id().equals(conversationId)).findFirst();
    }

    private static int indexOf(List<Conversation> conversations, String conversationId) {
        for (int i = 0; i < conversations.size(); i++) {
            if (conversations.get(i).id().equals(conversationId)) {
                return i;
            }
        }
        throw new IllegalArgumentException("Unknown conversation: " + conversationId);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ConversationIndex(List<Conversation> conversations) {
    }
}
