package com.colloquy.core.credit;

import com.colloquy.core.persistence.StorageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link CreditLedger}.
 * <p>
 * Each change runs in its own transaction that locks the account row with
 * {@code SELECT ... FOR UPDATE}, so concurrent debits for one user serialize in the database.
 * Tables are created by {@link #createTables()}.
 */
public class JdbcCreditLedger implements CreditLedger {

    private static final Logger log = LoggerFactory.getLogger(JdbcCreditLedger.class);

    private static final String CREATE_ACCOUNTS_SQL = """
            CREATE TABLE IF NOT EXISTS credit_accounts (
                user_id      VARCHAR(255) PRIMARY KEY,
                balance      BIGINT NOT NULL DEFAULT 0,
                credits_used BIGINT NOT NULL DEFAULT 0,
                updated_at   TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """;

    private static final String CREATE_TRANSACTIONS_SQL = """
            CREATE TABLE IF NOT EXISTS credit_transactions (
                id            BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                user_id       VARCHAR(255) NOT NULL,
                amount        BIGINT NOT NULL,
                type          VARCHAR(32) NOT NULL,
                reason        VARCHAR(1024),
                metadata      VARCHAR(4000),
                balance_after BIGINT NOT NULL,
                created_at    TIMESTAMP NOT NULL
            )
            """;

    private static final String INSERT_ACCOUNT_SQL = """
            INSERT INTO credit_accounts (user_id, balance, credits_used) VALUES (?, 0, 0)
            """;

    private static final String SELECT_BALANCE_SQL = """
            SELECT balance FROM credit_accounts WHERE user_id = ?
            """;

    private static final String LOCK_BALANCE_SQL = """
            SELECT balance FROM credit_accounts WHERE user_id = ? FOR UPDATE
            """;

    private static final String UPDATE_BALANCE_SQL = """
            UPDATE credit_accounts
            SET balance = ?, credits_used = credits_used + ?, updated_at = CURRENT_TIMESTAMP
            WHERE user_id = ?
            """;

    private static final String INSERT_TRANSACTION_SQL = """
            INSERT INTO credit_transactions (user_id, amount, type, reason, metadata, balance_after, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_HISTORY_SQL = """
            SELECT user_id, amount, type, reason, metadata, balance_after, created_at
            FROM credit_transactions
            WHERE user_id = ?
            ORDER BY id DESC
            LIMIT ?
            """;

    private static final String SELECT_STATISTICS_SQL = """
            SELECT
                COALESCE(SUM(CASE WHEN amount < 0 THEN -amount ELSE 0 END), 0) AS total_used,
                COALESCE(SUM(CASE WHEN amount > 0 THEN amount ELSE 0 END), 0) AS total_added,
                COUNT(*) AS tx_count
            FROM credit_transactions
            WHERE user_id = ?
            """;

    private final DataSource dataSource;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public JdbcCreditLedger(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement accounts = conn.prepareStatement(CREATE_ACCOUNTS_SQL);
             PreparedStatement transactions = conn.prepareStatement(CREATE_TRANSACTIONS_SQL)) {
            accounts.execute();
            transactions.execute();
            log.info("Credit tables ensured");
        }
    }

    @Override
    public Optional<Long> balance(String userId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BALANCE_SQL)) {
            stmt.setString(1, userId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(rs.getLong("balance")) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read balance for " + userId, e);
        }
    }

    @Override
    public boolean openAccount(String userId) {
        if (balance(userId).isPresent()) {
            return false;
        }
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_ACCOUNT_SQL)) {
            stmt.setString(1, userId);
            stmt.executeUpdate();
            log.info("Opened credit account for {}", userId);
            return true;
        } catch (SQLException e) {
            // Lost a race with a concurrent open
            if (balance(userId).isPresent()) {
                return false;
            }
            throw new StorageException("Failed to open credit account for " + userId, e);
        }
    }

    @Override
    public TransactionResult apply(String userId, long delta, TransactionType type, String reason,
                                   Map<String, String> metadata) {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                TransactionResult result = applyLocked(conn, userId, delta, type, reason, metadata);
                if (result.succeeded()) {
                    conn.commit();
                } else {
                    conn.rollback();
                }
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to apply " + delta + " credits for " + userId, e);
        }
    }

    private TransactionResult applyLocked(Connection conn, String userId, long delta, TransactionType type,
                                          String reason, Map<String, String> metadata) throws SQLException {
        long current;
        try (PreparedStatement lock = conn.prepareStatement(LOCK_BALANCE_SQL)) {
            lock.setString(1, userId);
            try (ResultSet rs = lock.executeQuery()) {
                if (!rs.next()) {
                    return TransactionResult.accountNotFound(userId);
                }
                current = rs.getLong("balance");
            }
        }

        long next = current + delta;
        if (next < 0) {
            log.info("Refusing debit of {} for {}: balance {}", -delta, userId, current);
            return TransactionResult.insufficient(-delta, current);
        }

        try (PreparedStatement update = conn.prepareStatement(UPDATE_BALANCE_SQL)) {
            update.setLong(1, next);
            update.setLong(2, delta < 0 ? -delta : 0);
            update.setString(3, userId);
            update.executeUpdate();
        }

        Map<String, String> meta = metadata != null ? Map.copyOf(metadata) : Map.of();
        Instant now = Instant.now();
        try (PreparedStatement insert = conn.prepareStatement(INSERT_TRANSACTION_SQL)) {
            insert.setString(1, userId);
            insert.setLong(2, delta);
            insert.setString(3, type.name());
            insert.setString(4, reason);
            insert.setString(5, serialize(meta));
            insert.setLong(6, next);
            insert.setTimestamp(7, Timestamp.from(now));
            insert.executeUpdate();
        }
        return TransactionResult.success(new CreditTransaction(userId, delta, type, reason, meta, next, now));
    }

    @Override
    public List<CreditTransaction> history(String userId, int limit) {
        List<CreditTransaction> rows = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_HISTORY_SQL)) {
            stmt.setString(1, userId);
            stmt.setInt(2, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rows.add(new CreditTransaction(
                            rs.getString("user_id"),
                            rs.getLong("amount"),
                            TransactionType.valueOf(rs.getString("type")),
                            rs.getString("reason"),
                            deserialize(rs.getString("metadata")),
                            rs.getLong("balance_after"),
                            rs.getTimestamp("created_at").toInstant()));
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read credit history for " + userId, e);
        }
        return rows;
    }

    @Override
    public Optional<CreditStatistics> statistics(String userId) {
        Optional<Long> balance = balance(userId);
        if (balance.isEmpty()) {
            return Optional.empty();
        }
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_STATISTICS_SQL)) {
            stmt.setString(1, userId);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return Optional.of(new CreditStatistics(userId, balance.get(),
                        rs.getLong("total_used"), rs.getLong("total_added"), rs.getInt("tx_count")));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read credit statistics for " + userId, e);
        }
    }

    private String serialize(Map<String, String> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize transaction metadata", e);
        }
    }

    private Map<String, String> deserialize(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize transaction metadata", e);
        }
    }
}
