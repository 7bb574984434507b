package com.colloquy.core.persistence;

import com.colloquy.core.model.Message;
import com.colloquy.core.model.MessageRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JDBC-backed {@link ConversationStore}. One row per message in
 * {@code conversation_messages}, ordered by an identity column.
 */
public class JdbcConversationStore implements ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcConversationStore.class);

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS conversation_messages (
                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                conversation_id VARCHAR(255) NOT NULL,
                role            VARCHAR(16) NOT NULL,
                content         TEXT NOT NULL,
                speaker         VARCHAR(255),
                agent_id        VARCHAR(255),
                sent_at         BIGINT NOT NULL
            )
            """;

    private static final String INSERT_SQL = """
            INSERT INTO conversation_messages (conversation_id, role, content, speaker, agent_id, sent_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_SQL = """
            SELECT role, content, speaker, agent_id, sent_at
            FROM conversation_messages
            WHERE conversation_id = ?
            ORDER BY id ASC
            """;

    private static final String EXISTS_SQL = """
            SELECT 1 FROM conversation_messages WHERE conversation_id = ? LIMIT 1
            """;

    private final DataSource dataSource;

    public JdbcConversationStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Conversation table ensured");
        }
    }

    @Override
    public void append(String conversationId, Message message) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, conversationId);
            stmt.setString(2, message.role().name());
            stmt.setString(3, message.content());
            stmt.setString(4, message.speaker());
            stmt.setString(5, message.agentId());
            stmt.setLong(6, message.timestamp());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to append message to " + conversationId, e);
        }
    }

    @Override
    public List<Message> load(String conversationId) {
        List<Message> messages = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SQL)) {
            stmt.setString(1, conversationId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    messages.add(new Message(
                            MessageRole.valueOf(rs.getString("role")),
                            rs.getString("content"),
                            rs.getString("speaker"),
                            rs.getString("agent_id"),
                            rs.getLong("sent_at")));
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to load transcript " + conversationId, e);
        }
        return messages;
    }

    @Override
    public boolean exists(String conversationId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(EXISTS_SQL)) {
            stmt.setString(1, conversationId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to look up conversation " + conversationId, e);
        }
    }
}
