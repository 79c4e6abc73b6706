package io.relay.core.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.relay.core.model.Conversation;
import io.relay.core.model.ConversationSettings;
import io.relay.core.model.ConversationUpdate;
import io.relay.core.model.LoadedConversation;
import io.relay.core.model.Message;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

public final class SqliteMessageStore implements MessageStore {
    private final String jdbcUrl;
    private final Clock clock;
    private final ObjectMapper mapper;

    public SqliteMessageStore(Path dbPath) throws IOException {
        this(dbPath, Clock.systemUTC());
    }

    public SqliteMessageStore(Path dbPath, Clock clock) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        init();
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
        String sql = "INSERT INTO conversations (id, updated_at, conversation_json) VALUES (?, ?, ?)";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, conversation.id());
            statement.setString(2, now.toString());
            statement.setString(3, mapper.writeValueAsString(conversation));
            statement.executeUpdate();
            return conversation;
        } catch (SQLException e) {
            throw new IOException("Failed to create conversation", e);
        }
    }

    @Override
    public synchronized List<Conversation> list() throws IOException {
        String sql = "SELECT conversation_json FROM conversations ORDER BY updated_at DESC";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            List<Conversation> conversations = new ArrayList<>();
            while (resultSet.next()) {
                conversations.add(mapper.readValue(resultSet.getString(1), Conversation.class));
            }
            return conversations;
        } catch (SQLException e) {
            throw new IOException("Failed to list conversations", e);
        }
    }

    @Override
    public synchronized Optional<LoadedConversation> load(String conversationId) throws IOException {
        try (Connection connection = openConnection()) {
            Optional<Conversation> conversation = findConversation(connection, conversationId);
            if (conversation.isEmpty()) {
                return Optional.empty();
            }
            String sql = "SELECT message_json FROM messages WHERE conversation_id = ? ORDER BY seq ASC";
            List<Message> messages = new ArrayList<>();
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, conversationId);
                try (ResultSet resultSet = statement.executeQuery()) {
                    while (resultSet.next()) {
                        messages.add(mapper.readValue(resultSet.getString(1), Message.class));
                    }
                }
            }
            return Optional.of(new LoadedConversation(conversation.get(), messages));
        } catch (SQLException e) {
            throw new IOException("Failed to load conversation " + conversationId, e);
        }
    }

    @Override
    public synchronized void append(String conversationId, Message message) throws IOException {
        Objects.requireNonNull(message, "message must not be null");
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            Conversation conversation = findConversation(connection, conversationId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown conversation: " + conversationId));
            String sql = "INSERT INTO messages (conversation_id, uuid, message_json) VALUES (?, ?, ?)";
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, conversationId);
                statement.setString(2, message.uuid());
                statement.setString(3, mapper.writeValueAsString(message));
                statement.executeUpdate();
            }
            writeConversation(connection, conversation.withMessageAppended(clock.instant()));
            connection.commit();
        } catch (SQLException e) {
            throw new IOException("Failed to append message to " + conversationId, e);
        }
    }

    @Override
    public synchronized Conversation update(String conversationId, ConversationUpdate update) throws IOException {
        Objects.requireNonNull(update, "update must not be null");
        try (Connection connection = openConnection()) {
            Conversation conversation = findConversation(connection, conversationId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown conversation: " + conversationId));
            Conversation updated = conversation.apply(update, clock.instant());
            writeConversation(connection, updated);
            return updated;
        } catch (SQLException e) {
            throw new IOException("Failed to update conversation " + conversationId, e);
        }
    }

    private Optional<Conversation> findConversation(Connection connection, String conversationId)
        throws SQLException, IOException {
        String sql = "SELECT conversation_json FROM conversations WHERE id = ?";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, conversationId);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapper.readValue(resultSet.getString(1), Conversation.class));
            }
        }
    }

    private void writeConversation(Connection connection, Conversation conversation) throws SQLException, IOException {
        String sql = "UPDATE conversations SET updated_at = ?, conversation_json = ? WHERE id = ?";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, conversation.updatedAt().toString());
            statement.setString(2, mapper.writeValueAsString(conversation));
            statement.setString(3, conversation.id());
            statement.executeUpdate();
        }
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
        }
        return connection;
    }

    private void init() throws IOException {
        String conversations = """
            CREATE TABLE IF NOT EXISTS conversations (
                id TEXT PRIMARY KEY,
                updated_at TEXT NOT NULL,
                conversation_json TEXT NOT NULL
            )
            """;
        String messages = """
            CREATE TABLE IF NOT EXISTS messages (
                seq INTEGER PRIMARY KEY AUTOINCREMENT,
                conversation_id TEXT NOT NULL,
                uuid TEXT NOT NULL,
                message_json TEXT NOT NULL
            )
            """;
        String idx = """
            CREATE INDEX IF NOT EXISTS idx_messages_conversation
            ON messages(conversation_id, seq)
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(conversations);
            statement.execute(messages);
            statement.execute(idx);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite message store", e);
        }
    }
}
