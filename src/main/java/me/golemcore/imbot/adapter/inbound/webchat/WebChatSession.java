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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.imbot.domain.model.BotException;
import me.golemcore.imbot.domain.model.ClientInfo;
import me.golemcore.imbot.domain.model.ErrorCode;
import me.golemcore.imbot.domain.model.Message;
import me.golemcore.imbot.domain.model.Platform;
import me.golemcore.imbot.domain.service.MessageHistoryService;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One live web chat connection.
 *
 * <p>
 * Outbound messages go through a bounded FIFO buffer drained by the socket's
 * write loop. Enqueueing never blocks: when the buffer is full the send fails
 * at once with {@code PLATFORM_ERROR}. Closing completes the buffer exactly
 * once.
 */
@Slf4j
public class WebChatSession {

    private final String id;
    private final Instant createdAt;
    private final ClientInfo clientInfo;
    private final MessageHistoryService history;
    private final Clock clock;
    private final Sinks.Many<Message> outbound;
    private final Sinks.Empty<Void> closeSignal = Sinks.empty();
    private final ReentrantLock lock = new ReentrantLock();

    private volatile String senderId;
    private volatile String senderName;
    private volatile Instant lastActive;
    private boolean closed;

    public WebChatSession(String id, String senderId, String senderName, int bufferSize, ClientInfo clientInfo,
            MessageHistoryService history, Clock clock) {
        this.id = id;
        this.senderId = senderId;
        this.senderName = senderName;
        this.clientInfo = clientInfo;
        this.history = history;
        this.clock = clock;
        this.createdAt = clock.instant();
        this.lastActive = createdAt;
        this.outbound = Sinks.many().unicast().onBackpressureBuffer(new ArrayBlockingQueue<>(bufferSize));
    }

    /**
     * Enqueues the message, then caches it and persists it asynchronously.
     *
     * @throws BotException
     *             {@code CONNECTION_FAILED} when the session is closed,
     *             {@code PLATFORM_ERROR} when the send buffer is full
     */
    public void send(Message message) {
        enqueue(message);
        history.record(message);
    }

    /**
     * Replays recent history, oldest first, without persisting it again.
     *
     * @return number of replayed messages
     */
    public int sendHistory(int limit) {
        List<Message> messages = history.getReplayHistory(id, limit);
        int sent = 0;
        for (Message message : messages) {
            try {
                enqueue(message);
                sent++;
            } catch (BotException e) {
                log.warn("[WebChat] History replay for session {} stopped after {} message(s): {}", id, sent,
                        e.getMessage());
                break;
            }
        }
        return sent;
    }

    void enqueue(Message message) {
        lock.lock();
        try {
            if (closed) {
                throw new BotException(ErrorCode.CONNECTION_FAILED, "session is closed: " + id, false)
                        .withPlatform(Platform.WEBCHAT);
            }
            Sinks.EmitResult result = outbound.tryEmitNext(message);
            if (result == Sinks.EmitResult.FAIL_OVERFLOW) {
                throw BotException.platformError("send buffer full", null)
                        .withPlatform(Platform.WEBCHAT)
                        .withContext("sessionId", id);
            }
            if (result.isFailure()) {
                throw BotException.platformError("send failed: " + result, null)
                        .withPlatform(Platform.WEBCHAT)
                        .withContext("sessionId", id);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Outbound messages in enqueue order. Completes when the session closes.
     * Only one subscriber is allowed.
     */
    public Flux<Message> outbound() {
        return outbound.asFlux();
    }

    /**
     * Completes when the session closes.
     */
    public Mono<Void> onClose() {
        return closeSignal.asMono();
    }

    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            outbound.tryEmitComplete();
            closeSignal.tryEmitEmpty();
        } finally {
            lock.unlock();
        }
        log.debug("[WebChat] Session {} closed", id);
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public void updateSender(String newSenderId, String newSenderName) {
        if (newSenderId != null && !newSenderId.isBlank()) {
            this.senderId = newSenderId;
        }
        if (newSenderName != null && !newSenderName.isBlank()) {
            this.senderName = newSenderName;
        }
    }

    public void touch() {
        this.lastActive = clock.instant();
    }

    public String getId() {
        return id;
    }

    public String getSenderId() {
        return senderId;
    }

    public String getSenderName() {
        return senderName;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastActive() {
        return lastActive;
    }

    public ClientInfo getClientInfo() {
        return clientInfo;
    }
}
