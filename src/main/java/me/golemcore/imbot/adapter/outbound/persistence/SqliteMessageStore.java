package me.golemcore.imbot.adapter.outbound.persistence;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.imbot.domain.model.ChatType;
import me.golemcore.imbot.domain.model.ClientInfo;
import me.golemcore.imbot.domain.model.Message;
import me.golemcore.imbot.domain.model.Platform;
import me.golemcore.imbot.domain.model.Recipient;
import me.golemcore.imbot.domain.model.Sender;
import me.golemcore.imbot.domain.model.StoredSession;
import me.golemcore.imbot.domain.model.content.ContentType;
import me.golemcore.imbot.port.outbound.MessageStorePort;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.transaction.support.TransactionTemplate;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * SQLite-backed {@link MessageStorePort}.
 *
 * <p>
 * The store keeps a single connection and serializes every call through its own
 * lock. Messages reference their session and are removed with it.
 */
@Slf4j
public class SqliteMessageStore implements MessageStorePort {

    private static final String MESSAGE_COLUMNS = "id, session_id, timestamp, sender_id, sender_name, "
            + "recipient_id, chat_type, content_type, content_data, metadata";

    private static final String SCHEMA = """
            CREATE TABLE IF NOT EXISTS sessions (
                id TEXT PRIMARY KEY,
                sender_id TEXT NOT NULL,
                sender_name TEXT NOT NULL,
                created_at INTEGER NOT NULL,
                last_active INTEGER NOT NULL,
                client_info TEXT,
                expires_at INTEGER
            );
            CREATE INDEX IF NOT EXISTS idx_sessions_last_active ON sessions(last_active);
            CREATE INDEX IF NOT EXISTS idx_sessions_sender ON sessions(sender_id);
            CREATE TABLE IF NOT EXISTS messages (
                id TEXT PRIMARY KEY,
                session_id TEXT NOT NULL,
                timestamp INTEGER NOT NULL,
                sender_id TEXT NOT NULL,
                sender_name TEXT,
                recipient_id TEXT NOT NULL,
                chat_type TEXT NOT NULL,
                content_type TEXT NOT NULL,
                content_data TEXT NOT NULL,
                metadata TEXT,
                FOREIGN KEY (session_id) REFERENCES sessions(id) ON DELETE CASCADE
            );
            CREATE INDEX IF NOT EXISTS idx_messages_session_timestamp ON messages(session_id, timestamp DESC);
            CREATE INDEX IF NOT EXISTS idx_messages_timestamp ON messages(timestamp DESC)
            """;

    private final SingleConnectionDataSource dataSource;
    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactions;
    private final ContentCodec codec;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    public SqliteMessageStore(Path dbPath, ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.codec = new ContentCodec(objectMapper);
        this.clock = clock;
        createParentDirectories(dbPath);

        SQLiteConfig sqliteConfig = new SQLiteConfig();
        sqliteConfig.enforceForeignKeys(true);
        sqliteConfig.setJournalMode(SQLiteConfig.JournalMode.WAL);
        sqliteConfig.setBusyTimeout(5000);

        this.dataSource = new SingleConnectionDataSource();
        dataSource.setDriverClassName("org.sqlite.JDBC");
        dataSource.setUrl("jdbc:sqlite:" + dbPath.toAbsolutePath());
        dataSource.setConnectionProperties(sqliteConfig.toProperties());
        dataSource.setSuppressClose(true);

        this.jdbc = new JdbcTemplate(dataSource);
        this.transactions = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        initSchema();
        log.info("[Store] Opened SQLite store at {}", dbPath.toAbsolutePath());
    }

    private void initSchema() {
        for (String statement : SCHEMA.split(";")) {
            if (!statement.isBlank()) {
                jdbc.execute(statement.trim());
            }
        }
    }

    @Override
    public void saveMessage(Message message) {
        String sessionId = message.getRecipient().getId();
        String contentData = codec.encode(message.getContent());
        String metadata = codec.encodeMetadata(message.getMetadata());
        Sender sender = message.getSender();
        withLock(() -> transactions.executeWithoutResult(status -> {
            jdbc.update("INSERT INTO messages (" + MESSAGE_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    message.getId(),
                    sessionId,
                    message.getTimestamp(),
                    sender.getId(),
                    sender.getDisplayName(),
                    message.getRecipient().getId(),
                    message.getChatType().getValue(),
                    message.getContent().contentType().getValue(),
                    contentData,
                    metadata);
            jdbc.update("UPDATE sessions SET last_active = ? WHERE id = ?", nowSeconds(), sessionId);
        }));
    }

    @Override
    public List<Message> getMessages(String sessionId, int limit, int offset) {
        return withLock(() -> readMessages(
                "SELECT " + MESSAGE_COLUMNS + " FROM messages WHERE session_id = ? "
                        + "ORDER BY timestamp DESC LIMIT ? OFFSET ?",
                sessionId, limit, offset));
    }

    @Override
    public List<Message> getMessagesSince(String sessionId, long sinceEpochSeconds) {
        return withLock(() -> readMessages(
                "SELECT " + MESSAGE_COLUMNS + " FROM messages WHERE session_id = ? AND timestamp > ? "
                        + "ORDER BY timestamp ASC",
                sessionId, sinceEpochSeconds));
    }

    @Override
    public Optional<StoredSession> getSession(String sessionId) {
        List<StoredSession> rows = withLock(() -> jdbc.query(
                "SELECT id, sender_id, sender_name, created_at, last_active, client_info, expires_at "
                        + "FROM sessions WHERE id = ?",
                (rs, rowNum) -> StoredSession.builder()
                        .id(rs.getString("id"))
                        .senderId(rs.getString("sender_id"))
                        .senderName(rs.getString("sender_name"))
                        .createdAt(rs.getLong("created_at"))
                        .lastActive(rs.getLong("last_active"))
                        .clientInfo(readClientInfo(rs.getString("client_info")))
                        .expiresAt(rs.getLong("expires_at"))
                        .build(),
                sessionId));
        return rows.stream().findFirst();
    }

    @Override
    public void createOrUpdateSession(StoredSession session) {
        long now = nowSeconds();
        String clientInfo = writeClientInfo(session.getClientInfo());
        withLock(() -> jdbc.update("""
                INSERT INTO sessions (id, sender_id, sender_name, created_at, last_active, client_info, expires_at)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT(id) DO UPDATE SET
                    sender_name = excluded.sender_name,
                    last_active = excluded.last_active,
                    client_info = excluded.client_info,
                    expires_at = excluded.expires_at
                """,
                session.getId(),
                session.getSenderId(),
                nullToEmpty(session.getSenderName()),
                session.getCreatedAt() > 0 ? session.getCreatedAt() : now,
                now,
                clientInfo,
                session.getExpiresAt()));
    }

    @Override
    public int cleanupExpiredSessions() {
        int deleted = withLock(() -> jdbc.update(
                "DELETE FROM sessions WHERE expires_at > 0 AND expires_at < ?", nowSeconds()));
        if (deleted > 0) {
            log.info("[Store] Removed {} expired session(s)", deleted);
        }
        return deleted;
    }

    @Override
    public int getMessageCount(String sessionId) {
        Integer count = withLock(() -> jdbc.queryForObject(
                "SELECT COUNT(*) FROM messages WHERE session_id = ?", Integer.class, sessionId));
        return count != null ? count : 0;
    }

    @Override
    public void close() {
        withLock(() -> {
            dataSource.destroy();
            return null;
        });
        log.info("[Store] Closed SQLite store");
    }

    private List<Message> readMessages(String sql, Object... args) {
        List<Message> messages = new ArrayList<>();
        jdbc.query(sql, rs -> {
            mapMessage(rs).ifPresent(messages::add);
        }, args);
        return messages;
    }

    private Optional<Message> mapMessage(ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        try {
            ContentType contentType = ContentType.fromValue(rs.getString("content_type"));
            return Optional.of(Message.builder()
                    .id(id)
                    .platform(Platform.WEBCHAT)
                    .timestamp(rs.getLong("timestamp"))
                    .sender(Sender.builder()
                            .id(rs.getString("sender_id"))
                            .displayName(rs.getString("sender_name"))
                            .build())
                    .recipient(Recipient.builder()
                            .id(rs.getString("recipient_id"))
                            .type("user")
                            .build())
                    .chatType(ChatType.fromValue(rs.getString("chat_type")))
                    .content(codec.decode(contentType, rs.getString("content_data")))
                    .metadata(codec.decodeMetadata(rs.getString("metadata")))
                    .build());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("[Store] Skipping unreadable message {}: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    private ClientInfo readClientInfo(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, ClientInfo.class);
        } catch (JsonProcessingException e) {
            log.warn("[Store] Ignoring unreadable client info: {}", e.getMessage());
            return null;
        }
    }

    private String writeClientInfo(ClientInfo clientInfo) {
        if (clientInfo == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(clientInfo);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize client info", e);
        }
    }

    private <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private void withLock(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    private long nowSeconds() {
        return clock.instant().getEpochSecond();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private static void createParentDirectories(Path dbPath) {
        Path parent = dbPath.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create directory " + parent, e);
        }
    }
}
