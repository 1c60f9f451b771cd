package me.golemcore.imbot.adapter.inbound.webchat;

import me.golemcore.imbot.adapter.inbound.webchat.dto.ChatFrame;
import me.golemcore.imbot.domain.model.BotException;
import me.golemcore.imbot.domain.model.ClientInfo;
import me.golemcore.imbot.domain.model.ErrorCode;
import me.golemcore.imbot.domain.model.MediaType;
import me.golemcore.imbot.domain.model.Message;
import me.golemcore.imbot.domain.model.Platform;
import me.golemcore.imbot.domain.model.SendMessageOptions;
import me.golemcore.imbot.domain.model.SendResult;
import me.golemcore.imbot.domain.model.StoredSession;
import me.golemcore.imbot.domain.model.config.AuthConfig;
import me.golemcore.imbot.domain.model.config.AuthType;
import me.golemcore.imbot.domain.model.config.BotConfig;
import me.golemcore.imbot.domain.model.content.MediaAttachment;
import me.golemcore.imbot.domain.model.content.MediaContent;
import me.golemcore.imbot.domain.service.MessageCache;
import me.golemcore.imbot.domain.service.MessageHistoryService;
import me.golemcore.imbot.port.outbound.MessageStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class WebChatBotTest {

    private static final long NOW = 1_700_000_000L;

    private MessageStorePort store;
    private WebChatBot bot;

    @BeforeEach
    void setUp() {
        store = mock(MessageStorePort.class);
        Clock clock = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);
        MessageHistoryService history = new MessageHistoryService(store, new MessageCache(100), Runnable::run);
        WebChatSettings settings = new WebChatSettings(":8080", "data/webchat.db", 100, 8, 50,
                Duration.ofSeconds(30), Duration.ofSeconds(60), 3600, 60, "Anonymous");
        BotConfig config = BotConfig.builder()
                .platform(Platform.WEBCHAT)
                .auth(AuthConfig.builder().type(AuthType.NONE).build())
                .build();
        bot = new WebChatBot(config, settings, history, new WebChatMessageAdapter(clock), Runnable::run, clock);
    }

    @Test
    void shouldBecomeReadyOnConnect() {
        List<String> events = new ArrayList<>();
        bot.onConnected(() -> events.add("connected"));
        bot.onReady(() -> events.add("ready"));

        bot.connect();

        assertTrue(bot.isReady());
        assertEquals("ws://:8080/ws", bot.getStatus().getConnectionDetails().getUrl());
        assertEquals(List.of("connected", "ready"), events);
        bot.disconnect();
    }

    @Test
    void shouldRefuseSessionsBeforeConnect() {
        BotException error = assertThrows(BotException.class, () -> bot.openSession(null, null));

        assertEquals(ErrorCode.CONNECTION_FAILED, error.getCode());
    }

    @Test
    void shouldOpenAndPersistNewSession() {
        bot.connect();
        ClientInfo client = ClientInfo.builder().userAgent("test").ipAddress("127.0.0.1").connectTime(NOW).build();

        WebChatSession session = bot.openSession(null, client);

        assertTrue(session.getId().startsWith("sess_"));
        assertTrue(session.getSenderId().startsWith("user_"));
        assertEquals("Anonymous", session.getSenderName());
        ArgumentCaptor<StoredSession> stored = ArgumentCaptor.forClass(StoredSession.class);
        verify(store).createOrUpdateSession(stored.capture());
        assertEquals(session.getId(), stored.getValue().getId());
        assertEquals(NOW, stored.getValue().getCreatedAt());
        assertEquals(NOW + 3600, stored.getValue().getExpiresAt());
        assertEquals(client, stored.getValue().getClientInfo());
        bot.disconnect();
    }

    @Test
    void shouldResumeStoredSession() {
        bot.connect();
        when(store.getSession("sess_old")).thenReturn(Optional.of(StoredSession.builder()
                .id("sess_old")
                .senderId("user_1")
                .senderName("Alice")
                .createdAt(100)
                .build()));

        WebChatSession session = bot.openSession("sess_old", null);

        assertEquals("sess_old", session.getId());
        assertEquals("user_1", session.getSenderId());
        assertEquals("Alice", session.getSenderName());
        ArgumentCaptor<StoredSession> stored = ArgumentCaptor.forClass(StoredSession.class);
        verify(store).createOrUpdateSession(stored.capture());
        assertEquals(100, stored.getValue().getCreatedAt());
        bot.disconnect();
    }

    @Test
    void shouldOpenFreshSessionWhenRequestedIdIsUnknown() {
        bot.connect();
        when(store.getSession("sess_gone")).thenReturn(Optional.empty());

        WebChatSession session = bot.openSession("sess_gone", null);

        assertTrue(session.getId().startsWith("sess_"));
        assertFalse("sess_gone".equals(session.getId()));
        bot.disconnect();
    }

    @Test
    void shouldKeepSessionWhenStoreFails() {
        bot.connect();
        doThrow(new IllegalStateException("db locked")).when(store).createOrUpdateSession(any());

        WebChatSession session = bot.openSession(null, null);

        assertEquals(Optional.of(session), bot.getSession(session.getId()));
        bot.disconnect();
    }

    @Test
    void shouldEmitAndPersistIncomingFrame() {
        bot.connect();
        WebChatSession session = bot.openSession(null, null);
        List<Message> received = new ArrayList<>();
        bot.onMessage(received::add);

        bot.handleIncomingMessage(session.getId(), ChatFrame.builder()
                .id("client-1")
                .senderName("Bob")
                .text("hello bot")
                .build());

        assertEquals(1, received.size());
        Message message = received.get(0);
        assertEquals("hello bot", message.getText());
        assertEquals(session.getId(), message.getRecipient().getId());
        assertEquals("Bob", message.getSender().getDisplayName());
        assertEquals(session.getSenderId(), message.getSender().getId());
        assertEquals(NOW, message.getTimestamp());
        assertEquals("client-1", message.getMetadata().get("clientMessageId"));
        verify(store).saveMessage(message);
        assertEquals(List.of(message), bot.getHistory(session.getId(), 10));
        bot.disconnect();
    }

    @Test
    void shouldDropFrameForUnknownSession() {
        bot.connect();
        List<Message> received = new ArrayList<>();
        bot.onMessage(received::add);

        bot.handleIncomingMessage("sess_missing", ChatFrame.builder().text("hello").build());

        assertTrue(received.isEmpty());
        verify(store, never()).saveMessage(any());
        bot.disconnect();
    }

    @Test
    void shouldRejectSendToUnknownSessionWithoutTouchingStore() {
        bot.connect();

        BotException error = assertThrows(BotException.class,
                () -> bot.sendMessage("sess_missing", SendMessageOptions.builder().text("hi").build()));

        assertEquals(ErrorCode.INVALID_TARGET, error.getCode());
        assertEquals("sess_missing", error.getContext().get("target"));
        verifyNoInteractions(store);
        bot.disconnect();
    }

    @Test
    void shouldDeliverAndPersistOutgoingText() {
        bot.connect();
        WebChatSession session = bot.openSession(null, null);

        SendResult result = bot.sendMessage(session.getId(), SendMessageOptions.builder()
                .text("hi there")
                .metadataEntry("source", "test")
                .build());

        assertTrue(result.getMessageId().startsWith("msg_"));
        assertEquals(NOW, result.getTimestamp());
        ArgumentCaptor<Message> saved = ArgumentCaptor.forClass(Message.class);
        verify(store).saveMessage(saved.capture());
        Message sent = saved.getValue();
        assertEquals(result.getMessageId(), sent.getId());
        assertEquals("hi there", sent.getText());
        assertTrue(sent.getSender().isBot());
        assertEquals("test", sent.getMetadata().get("source"));
        StepVerifier.create(session.outbound())
                .expectNext(sent)
                .then(() -> bot.removeSession(session.getId()))
                .verifyComplete();
        bot.disconnect();
    }

    @Test
    void shouldSendMediaWithCaption() {
        bot.connect();
        WebChatSession session = bot.openSession(null, null);
        MediaAttachment image = MediaAttachment.builder().type(MediaType.IMAGE).url("https://cdn/a.png").build();

        bot.sendMessage(session.getId(), SendMessageOptions.builder().text("look").attachment(image).build());

        ArgumentCaptor<Message> saved = ArgumentCaptor.forClass(Message.class);
        verify(store).saveMessage(saved.capture());
        MediaContent content = assertInstanceOf(MediaContent.class, saved.getValue().getContent());
        assertEquals(List.of(image), content.getMedia());
        assertEquals("look", content.getCaption());
        bot.disconnect();
    }

    @Test
    void shouldRejectEmptySend() {
        bot.connect();
        WebChatSession session = bot.openSession(null, null);

        BotException error = assertThrows(BotException.class,
                () -> bot.sendMessage(session.getId(), SendMessageOptions.builder().build()));

        assertEquals(ErrorCode.UNKNOWN, error.getCode());
        bot.disconnect();
    }

    @Test
    void shouldRejectTextOverLimit() {
        bot.connect();
        WebChatSession session = bot.openSession(null, null);

        BotException error = assertThrows(BotException.class,
                () -> bot.sendMessage(session.getId(), SendMessageOptions.builder().text("x".repeat(4097)).build()));

        assertEquals(ErrorCode.MESSAGE_TOO_LONG, error.getCode());
        bot.disconnect();
    }

    @Test
    void shouldCloseSessionsOnDisconnect() {
        bot.connect();
        WebChatSession first = bot.openSession(null, null);
        WebChatSession second = bot.openSession(null, null);

        bot.disconnect();

        assertTrue(first.isClosed());
        assertTrue(second.isClosed());
        assertEquals(0, bot.getSessionCount());
        assertFalse(bot.isConnected());
    }

    @Test
    void shouldCloseStoreOnClose() {
        bot.connect();

        bot.close();

        verify(store).close();
        assertFalse(bot.isConnected());
    }
}
