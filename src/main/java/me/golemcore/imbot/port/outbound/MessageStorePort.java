package me.golemcore.imbot.port.outbound;

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
import me.golemcore.imbot.domain.model.StoredSession;

import java.util.List;
import java.util.Optional;

/**
 * Durable system of record for web chat sessions and their messages.
 *
 * <p>
 * A message belongs to the session named by its recipient id. Implementations
 * serialize access internally and may be called from any thread.
 */
public interface MessageStorePort extends AutoCloseable {

    /**
     * Stores the message and bumps the owning session's last-active time in one
     * unit of work.
     *
     * <p>
     * Only the sender id and display name are kept (a {@code null} name reads
     * back as {@code null}); username, avatar and the bot flag are dropped. The
     * recipient reads back as a {@code user} recipient carrying only its id,
     * and the thread context is not stored.
     */
    void saveMessage(Message message);

    /**
     * Newest first.
     */
    List<Message> getMessages(String sessionId, int limit, int offset);

    /**
     * Messages strictly newer than {@code sinceEpochSeconds}, oldest first.
     */
    List<Message> getMessagesSince(String sessionId, long sinceEpochSeconds);

    Optional<StoredSession> getSession(String sessionId);

    /**
     * Inserts the session or refreshes its sender name, activity, client info
     * and expiry.
     */
    void createOrUpdateSession(StoredSession session);

    /**
     * Deletes sessions whose expiry has passed, together with their messages.
     *
     * @return number of deleted sessions
     */
    int cleanupExpiredSessions();

    int getMessageCount(String sessionId);

    @Override
    void close();
}
