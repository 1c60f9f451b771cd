package me.golemcore.imbot.adapter.outbound.persistence;

import me.golemcore.imbot.domain.model.ClientInfo;
import me.golemcore.imbot.domain.model.Entity;
import me.golemcore.imbot.domain.model.EntityType;
import me.golemcore.imbot.domain.model.MediaType;
import me.golemcore.imbot.domain.model.Message;
import me.golemcore.imbot.domain.model.Sender;
import me.golemcore.imbot.domain.model.StoredSession;
import me.golemcore.imbot.domain.model.content.Content;
import me.golemcore.imbot.domain.model.content.Contents;
import me.golemcore.imbot.domain.model.content.MediaAttachment;
import me.golemcore.imbot.domain.model.content.MediaContent;
import me.golemcore.imbot.domain.model.content.TextContent;
import me.golemcore.imbot.domain.service.MessageCache;
import me.golemcore.imbot.domain.service.MessageHistoryService;
import me.golemcore.imbot.infrastructure.config.AutoConfiguration;
import me.golemcore.imbot.testsupport.TestMessages;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataAccessException;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqliteMessageStoreTest {

    private static final long NOW = 1_700_000_000L;

    @TempDir
    Path tempDir;

    private SqliteMessageStore store;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);
        store = new SqliteMessageStore(tempDir.resolve("data/messages.db"), AutoConfiguration.objectMapper(), clock);
        store.createOrUpdateSession(session("s1", 0));
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void shouldPreserveEveryContentKind() {
        List<Content> contents = List.of(
                TextContent.builder()
                        .text("see https://example.com")
                        .entity(Entity.builder().type(EntityType.URL).offset(4).length(19)
                                .url("https://example.com").build())
                        .build(),
                MediaContent.builder()
                        .attachment(MediaAttachment.builder().type(MediaType.IMAGE).url("https://cdn/a.png")
                                .mimeType("image/png").width(640).height(480).size(2048).build())
                        .attachment(MediaAttachment.builder().type(MediaType.VOICE).url("https://cdn/v.ogg")
                                .duration(7).build())
                        .caption("holiday")
                        .build(),
                Contents.poll("Lunch?", List.of("pizza", "sushi")),
                Contents.reaction("m0", "👍", "user_1"),
                Contents.system("session_started", Map.of("reason", "connect")));

        for (int i = 0; i < contents.size(); i++) {
            store.saveMessage(TestMessages.of("m" + i, "s1", NOW - 100 + i, contents.get(i)));
        }

        List<Message> loaded = store.getMessagesSince("s1", 0);
        assertEquals(contents.size(), loaded.size());
        for (int i = 0; i < contents.size(); i++) {
            assertEquals(contents.get(i), loaded.get(i).getContent());
        }
    }

    @Test
    void shouldRestoreEnvelopeFields() {
        Message message = TestMessages.text("m1", "s1", "hello").withMetadata("replyTo", "m0");
        store.saveMessage(message);

        Message loaded = store.getMessages("s1", 10, 0).get(0);

        assertEquals(message, loaded);
        assertEquals("user", loaded.getRecipient().getType());
        assertEquals("m0", loaded.getMetadata().get("replyTo"));
    }

    @Test
    void shouldPageNewestFirst() {
        for (int i = 1; i <= 5; i++) {
            store.saveMessage(TestMessages.of("m" + i, "s1", NOW + i, Contents.text("text " + i)));
        }

        assertEquals(List.of("m5", "m4"), ids(store.getMessages("s1", 2, 0)));
        assertEquals(List.of("m3", "m2"), ids(store.getMessages("s1", 2, 2)));
        assertEquals(List.of("m4", "m5"), ids(store.getMessagesSince("s1", NOW + 3)));
    }

    @Test
    void shouldCountMessagesPerSession() {
        store.createOrUpdateSession(session("s2", 0));
        store.saveMessage(TestMessages.text("a", "s1", "one"));
        store.saveMessage(TestMessages.text("b", "s1", "two"));
        store.saveMessage(TestMessages.text("c", "s2", "three"));

        assertEquals(2, store.getMessageCount("s1"));
        assertEquals(1, store.getMessageCount("s2"));
        assertEquals(0, store.getMessageCount("missing"));
    }

    @Test
    void shouldRejectMessageForUnknownSession() {
        Message orphan = TestMessages.text("m1", "nobody", "hello");

        assertThrows(DataAccessException.class, () -> store.saveMessage(orphan));
        assertEquals(0, store.getMessageCount("nobody"));
    }

    @Test
    void shouldUpsertSessionKeepingCreationTime() {
        StoredSession original = store.getSession("s1").orElseThrow();

        store.createOrUpdateSession(StoredSession.builder()
                .id("s1")
                .senderId("user_1")
                .senderName("Alice Cooper")
                .createdAt(42)
                .clientInfo(ClientInfo.builder().userAgent("curl/8").ipAddress("10.0.0.1").connectTime(NOW).build())
                .expiresAt(NOW + 3600)
                .build());

        StoredSession updated = store.getSession("s1").orElseThrow();
        assertEquals(original.getCreatedAt(), updated.getCreatedAt());
        assertEquals("Alice Cooper", updated.getSenderName());
        assertEquals(NOW + 3600, updated.getExpiresAt());
        assertNotNull(updated.getClientInfo());
        assertEquals("curl/8", updated.getClientInfo().getUserAgent());
    }

    @Test
    void shouldReturnEmptyForUnknownSession() {
        Optional<StoredSession> session = store.getSession("missing");

        assertTrue(session.isEmpty());
    }

    @Test
    void shouldDeleteExpiredSessionsWithTheirMessages() {
        store.createOrUpdateSession(session("expired", NOW - 10));
        store.createOrUpdateSession(session("fresh", NOW + 3600));
        store.saveMessage(TestMessages.text("m1", "expired", "old"));
        store.saveMessage(TestMessages.text("m2", "fresh", "new"));

        int deleted = store.cleanupExpiredSessions();

        assertEquals(1, deleted);
        assertTrue(store.getSession("expired").isEmpty());
        assertEquals(0, store.getMessageCount("expired"));
        assertEquals(1, store.getMessageCount("fresh"));
        assertTrue(store.getSession("s1").isPresent());
    }

    @Test
    void shouldBumpLastActiveOnSave() {
        store.saveMessage(TestMessages.text("m1", "s1", "hello"));

        assertEquals(NOW, store.getSession("s1").orElseThrow().getLastActive());
    }

    @Test
    void shouldReadBackMissingSenderNameAsNull() {
        Message anonymous = TestMessages.text("m1", "s1", "hi").toBuilder()
                .sender(Sender.builder().id("user_9").build())
                .build();

        store.saveMessage(anonymous);

        Message stored = store.getMessages("s1", 10, 0).get(0);
        assertEquals("user_9", stored.getSender().getId());
        assertNull(stored.getSender().getDisplayName());
        assertEquals(anonymous.getSender(), stored.getSender());
    }

    @Test
    void shouldFlushQueuedHistoryWritesBeforeClosing() {
        Path dbPath = tempDir.resolve("history/webchat.db");
        Clock clock = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);
        SqliteMessageStore historyStore = new SqliteMessageStore(dbPath, AutoConfiguration.objectMapper(), clock);
        historyStore.createOrUpdateSession(session("s2", 0));
        MessageHistoryService history = new MessageHistoryService(historyStore, new MessageCache(10),
                Executors.newSingleThreadExecutor());
        for (int i = 0; i < 300; i++) {
            history.record(TestMessages.text("m" + i, "s2", "message " + i));
        }

        history.close();

        SqliteMessageStore reopened = new SqliteMessageStore(dbPath, AutoConfiguration.objectMapper(), clock);
        try {
            assertEquals(300, reopened.getMessageCount("s2"));
        } finally {
            reopened.close();
        }
    }

    private static StoredSession session(String id, long expiresAt) {
        return StoredSession.builder()
                .id(id)
                .senderId("user_1")
                .senderName("Alice")
                .expiresAt(expiresAt)
                .build();
    }

    private static List<String> ids(List<Message> messages) {
        return messages.stream().map(Message::getId).toList();
    }
}
