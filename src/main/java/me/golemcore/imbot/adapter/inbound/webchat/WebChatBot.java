package me.golemcore.imbot.adapter.inbound.webchat;

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

import me.golemcore.imbot.adapter.inbound.webchat.dto.ChatFrame;
import me.golemcore.imbot.domain.bot.AbstractBot;
import me.golemcore.imbot.domain.model.BotException;
import me.golemcore.imbot.domain.model.ChatType;
import me.golemcore.imbot.domain.model.ClientInfo;
import me.golemcore.imbot.domain.model.ConnectionMode;
import me.golemcore.imbot.domain.model.ErrorCode;
import me.golemcore.imbot.domain.model.Message;
import me.golemcore.imbot.domain.model.Platform;
import me.golemcore.imbot.domain.model.Recipient;
import me.golemcore.imbot.domain.model.SendMessageOptions;
import me.golemcore.imbot.domain.model.SendResult;
import me.golemcore.imbot.domain.model.Sender;
import me.golemcore.imbot.domain.model.StoredSession;
import me.golemcore.imbot.domain.model.ThreadContext;
import me.golemcore.imbot.domain.model.config.BotConfig;
import me.golemcore.imbot.domain.model.content.Content;
import me.golemcore.imbot.domain.model.content.MediaContent;
import me.golemcore.imbot.domain.model.content.TextContent;
import me.golemcore.imbot.domain.service.MessageHistoryService;
import me.golemcore.imbot.port.outbound.MessageStorePort;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Self-hosted web chat platform. Each browser connection is a
 * {@link WebChatSession}; the session id is the send target.
 *
 * <p>
 * The socket endpoint is served by the application's WebFlux server, so
 * connecting only opens the bot for new sessions and starts the expired
 * session cleanup when a session TTL is configured.
 */
public class WebChatBot extends AbstractBot {

    private static final String BOT_SENDER_ID = "bot";

    private final WebChatSettings settings;
    private final MessageHistoryService history;
    private final WebChatMessageAdapter messageAdapter;
    private final Map<String, WebChatSession> sessions = new ConcurrentHashMap<>();
    private final Object lifecycleLock = new Object();
    private ScheduledExecutorService cleanupScheduler;

    public WebChatBot(BotConfig config, WebChatSettings settings, MessageHistoryService history,
            WebChatMessageAdapter messageAdapter) {
        super(config, ConnectionMode.WEBSOCKET);
        this.settings = settings;
        this.history = history;
        this.messageAdapter = messageAdapter;
    }

    WebChatBot(BotConfig config, WebChatSettings settings, MessageHistoryService history,
            WebChatMessageAdapter messageAdapter, Executor eventExecutor, Clock clock) {
        super(config, ConnectionMode.WEBSOCKET, eventExecutor, clock);
        this.settings = settings;
        this.history = history;
        this.messageAdapter = messageAdapter;
    }

    @Override
    public void connect() {
        synchronized (lifecycleLock) {
            if (isConnected()) {
                return;
            }
            updateConnected(true);
            updateConnectionUrl("ws://" + settings.addr() + "/ws");
            updateAuthenticated(true);
            updateReady(true);
            clearError();
            startCleanup();
        }
        botLog.info("[WebChat] Web chat bot ready (addr {}, persistence {})", settings.addr(),
                settings.persistenceEnabled() ? settings.dbPath() : "disabled");
        emitConnected();
        emitReady();
    }

    @Override
    public void disconnect() {
        synchronized (lifecycleLock) {
            if (!isConnected()) {
                return;
            }
            stopCleanup();
            closeAllSessions();
            updateConnected(false);
        }
        botLog.info("[WebChat] Web chat bot disconnected");
        emitDisconnected();
    }

    @Override
    public void close() {
        super.close();
        history.close();
    }

    // ==================== Sessions ====================

    /**
     * Opens a session for a new socket. When {@code requestedId} names a stored
     * session that is not live, the session and its sender identity are
     * resumed.
     */
    public WebChatSession openSession(String requestedId, ClientInfo clientInfo) {
        ensureReady();
        Optional<StoredSession> stored = Optional.empty();
        if (requestedId != null && !requestedId.isBlank() && !sessions.containsKey(requestedId)) {
            stored = history.getStore().flatMap(store -> store.getSession(requestedId));
        }
        WebChatSession session = stored
                .map(row -> newSession(row.getId(), row.getSenderId(), row.getSenderName(), clientInfo))
                .orElseGet(() -> newSession(WebChatIds.sessionId(), WebChatIds.userId(),
                        settings.defaultSenderName(), clientInfo));
        sessions.put(session.getId(), session);
        persistSession(session, stored.map(StoredSession::getCreatedAt).orElse(0L));
        botLog.info("[WebChat] Session {} {} (sender {})", session.getId(), stored.isPresent() ? "resumed" : "opened",
                session.getSenderId());
        return session;
    }

    public Optional<WebChatSession> getSession(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public List<WebChatSession> getSessions() {
        return new ArrayList<>(sessions.values());
    }

    public int getSessionCount() {
        return sessions.size();
    }

    public void removeSession(String sessionId) {
        WebChatSession session = sessions.remove(sessionId);
        if (session != null) {
            session.close();
            botLog.info("[WebChat] Session {} removed", sessionId);
        }
    }

    public void closeAllSessions() {
        for (String sessionId : new ArrayList<>(sessions.keySet())) {
            removeSession(sessionId);
        }
    }

    /**
     * Adapts an inbound frame, records it in history and emits it to message
     * handlers. Frames for unknown sessions are dropped.
     */
    public void handleIncomingMessage(String sessionId, ChatFrame frame) {
        WebChatSession session = sessions.get(sessionId);
        if (session == null) {
            botLog.warn("[WebChat] Dropping frame for unknown session {}", sessionId);
            return;
        }
        session.updateSender(frame.getSenderId(), frame.getSenderName());
        session.touch();
        Message message;
        try {
            message = messageAdapter.toMessage(session, frame);
        } catch (BotException e) {
            botLog.warn("[WebChat] Failed to adapt frame from session {}: {}", sessionId, e.getMessage());
            emitError(e);
            return;
        }
        history.record(message);
        emitMessage(message);
    }

    public List<Message> getHistory(String sessionId, int limit) {
        return history.getHistory(sessionId, limit);
    }

    public WebChatSettings getSettings() {
        return settings;
    }

    public WebChatMessageAdapter getMessageAdapter() {
        return messageAdapter;
    }

    // ==================== Sending ====================

    @Override
    public SendResult sendMessage(String target, SendMessageOptions options) {
        ensureReady();
        WebChatSession session = sessions.get(target);
        if (session == null) {
            throw new BotException(ErrorCode.INVALID_TARGET, "session not found: " + target, false)
                    .withPlatform(platform)
                    .withContext("target", target);
        }
        Content content;
        if (options.hasMedia()) {
            content = MediaContent.builder().media(options.getMedia()).caption(options.getText()).build();
        } else if (options.hasText()) {
            validateTextLength(options.getText());
            content = TextContent.builder().text(options.getText()).build();
        } else {
            throw new BotException(ErrorCode.UNKNOWN, "no content to send", false).withPlatform(platform);
        }

        long timestamp = now().getEpochSecond();
        Message message = Message.builder()
                .id(WebChatIds.messageId())
                .platform(platform)
                .timestamp(timestamp)
                .sender(Sender.builder().id(BOT_SENDER_ID).displayName("Bot").bot(true).build())
                .recipient(Recipient.builder().id(target).type("user").build())
                .chatType(ChatType.DIRECT)
                .thread(options.getThreadId() != null
                        ? ThreadContext.builder().id(options.getThreadId()).parentMessageId(options.getReplyTo()).build()
                        : null)
                .content(content)
                .metadata(options.getMetadata())
                .build();
        session.send(message);
        updateLastActivity();
        return SendResult.builder()
                .messageId(message.getId())
                .timestamp(timestamp)
                .platform(platform)
                .build();
    }

    @Override
    public void react(String messageId, String emoji) {
        botLog.debug("[WebChat] Reaction {} on {} is not delivered to clients", emoji, messageId);
    }

    @Override
    public void editMessage(String messageId, String text) {
        botLog.debug("[WebChat] Edit of {} is not delivered to clients", messageId);
    }

    @Override
    public void deleteMessage(String messageId) {
        botLog.debug("[WebChat] Delete of {} is not delivered to clients", messageId);
    }

    // ==================== Internals ====================

    private WebChatSession newSession(String sessionId, String senderId, String senderName, ClientInfo clientInfo) {
        return new WebChatSession(sessionId, senderId, senderName, settings.sendBufferSize(), clientInfo, history,
                clock);
    }

    private void persistSession(WebChatSession session, long createdAt) {
        Optional<MessageStorePort> store = history.getStore();
        if (store.isEmpty()) {
            return;
        }
        long now = now().getEpochSecond();
        try {
            store.get().createOrUpdateSession(StoredSession.builder()
                    .id(session.getId())
                    .senderId(session.getSenderId())
                    .senderName(session.getSenderName())
                    .createdAt(createdAt > 0 ? createdAt : now)
                    .clientInfo(session.getClientInfo())
                    .expiresAt(settings.sessionTtlSeconds() > 0 ? now + settings.sessionTtlSeconds() : 0)
                    .build());
        } catch (RuntimeException e) { // NOSONAR - a store outage must not refuse the live connection
            botLog.error("[WebChat] Failed to persist session {}: {}", session.getId(), e.getMessage());
        }
    }

    private void startCleanup() {
        if (settings.sessionTtlSeconds() <= 0 || history.getStore().isEmpty()) {
            return;
        }
        MessageStorePort store = history.getStore().get();
        long interval = Math.max(1, settings.cleanupIntervalSeconds());
        cleanupScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "imbot-webchat-cleanup");
            thread.setDaemon(true);
            return thread;
        });
        cleanupScheduler.scheduleAtFixedRate(() -> {
            try {
                store.cleanupExpiredSessions();
            } catch (RuntimeException e) {
                botLog.warn("[WebChat] Expired session cleanup failed: {}", e.getMessage());
            }
        }, interval, interval, TimeUnit.SECONDS);
    }

    private void stopCleanup() {
        if (cleanupScheduler != null) {
            cleanupScheduler.shutdownNow();
            cleanupScheduler = null;
        }
    }
}
