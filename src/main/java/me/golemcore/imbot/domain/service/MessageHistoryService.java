package me.golemcore.imbot.domain.service;

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
import me.golemcore.imbot.domain.model.Message;
import me.golemcore.imbot.port.outbound.MessageStorePort;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Read-through history over {@link MessageCache} and the durable store.
 *
 * <p>
 * Recording updates the cache synchronously and writes to the store on the
 * persistence executor, so the cache is consistent immediately after a send and
 * the store shortly after. The store is optional; without it the cache is the
 * only history.
 *
 * <p>
 * When built with an {@link ExecutorService} the service owns it: {@link #close()}
 * lets queued writes finish before the store is closed.
 */
@Slf4j
public class MessageHistoryService implements AutoCloseable {

    private static final long CLOSE_TIMEOUT_SECONDS = 10;

    private final MessageStorePort store;
    private final MessageCache cache;
    private final Executor persistenceExecutor;
    private final ExecutorService ownedExecutor;

    public MessageHistoryService(MessageStorePort store, MessageCache cache, ExecutorService persistenceExecutor) {
        this.store = store;
        this.cache = cache;
        this.persistenceExecutor = persistenceExecutor;
        this.ownedExecutor = persistenceExecutor;
    }

    /**
     * Uses an executor owned by the caller; {@link #close()} does not wait for
     * it.
     */
    public MessageHistoryService(MessageStorePort store, MessageCache cache, Executor persistenceExecutor) {
        this.store = store;
        this.cache = cache;
        this.persistenceExecutor = persistenceExecutor;
        this.ownedExecutor = null;
    }

    public Optional<MessageStorePort> getStore() {
        return Optional.ofNullable(store);
    }

    /**
     * Caches the message under its recipient id and persists it asynchronously.
     */
    public CompletableFuture<Void> record(Message message) {
        String sessionId = message.getRecipient().getId();
        cache.add(sessionId, message);
        if (store == null) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> write;
        try {
            write = CompletableFuture.runAsync(() -> store.saveMessage(message), persistenceExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("[History] Store closed, message {} for session {} kept in cache only", message.getId(),
                    sessionId);
            return CompletableFuture.completedFuture(null);
        }
        return write
                .exceptionally(e -> {
                    log.error("[History] Failed to persist message {} for session {}: {}", message.getId(),
                            sessionId, e.getMessage());
                    return null;
                });
    }

    /**
     * Cache first: when the cache holds messages for the session a copy of up to
     * {@code limit} of them is returned in insertion order. Otherwise the store
     * is queried, newest first.
     */
    public List<Message> getHistory(String sessionId, int limit) {
        List<Message> cached = cache.get(sessionId, limit);
        if (!cached.isEmpty()) {
            return cached;
        }
        if (store == null) {
            return List.of();
        }
        return store.getMessages(sessionId, limit, 0);
    }

    /**
     * History for client replay, always oldest first.
     */
    public List<Message> getReplayHistory(String sessionId, int limit) {
        List<Message> cached = cache.get(sessionId, limit);
        if (!cached.isEmpty()) {
            return cached;
        }
        if (store == null) {
            return List.of();
        }
        List<Message> stored = new ArrayList<>(store.getMessages(sessionId, limit, 0));
        Collections.reverse(stored);
        return stored;
    }

    public void forget(String sessionId) {
        cache.remove(sessionId);
    }

    @Override
    public void close() {
        cache.clear();
        awaitPendingWrites();
        if (store != null) {
            store.close();
        }
    }

    private void awaitPendingWrites() {
        if (ownedExecutor == null) {
            return;
        }
        ownedExecutor.shutdown();
        try {
            if (!ownedExecutor.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("[History] Pending writes not finished after {}s, closing store anyway",
                        CLOSE_TIMEOUT_SECONDS);
                ownedExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ownedExecutor.shutdownNow();
        }
    }
}
