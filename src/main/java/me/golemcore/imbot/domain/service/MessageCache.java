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

import me.golemcore.imbot.domain.model.Message;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory buffer of recent messages per session, capped at
 * {@code maxPerSession}. Oldest entries are evicted first. The cache is derived
 * data; the durable store stays authoritative.
 */
public class MessageCache {

    private final int maxPerSession;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, List<Message>> sessions = new HashMap<>();

    public MessageCache(int maxPerSession) {
        if (maxPerSession <= 0) {
            throw new IllegalArgumentException("cache size must be positive: " + maxPerSession);
        }
        this.maxPerSession = maxPerSession;
    }

    public void add(String sessionId, Message message) {
        lock.writeLock().lock();
        try {
            List<Message> buffer = sessions.computeIfAbsent(sessionId, key -> new ArrayList<>());
            buffer.add(message);
            int overflow = buffer.size() - maxPerSession;
            if (overflow > 0) {
                buffer.subList(0, overflow).clear();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns a copy of the {@code limit} most recent messages in insertion
     * order, or all of them when {@code limit <= 0} or exceeds the buffer.
     */
    public List<Message> get(String sessionId, int limit) {
        lock.readLock().lock();
        try {
            List<Message> buffer = sessions.get(sessionId);
            if (buffer == null) {
                return List.of();
            }
            if (limit <= 0 || limit >= buffer.size()) {
                return new ArrayList<>(buffer);
            }
            return new ArrayList<>(buffer.subList(buffer.size() - limit, buffer.size()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Message> getAll(String sessionId) {
        return get(sessionId, 0);
    }

    public void remove(String sessionId) {
        lock.writeLock().lock();
        try {
            sessions.remove(sessionId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            sessions.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int getMaxPerSession() {
        return maxPerSession;
    }
}
