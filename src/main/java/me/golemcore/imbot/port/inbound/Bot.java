package me.golemcore.imbot.port.inbound;

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

import me.golemcore.imbot.domain.model.BotException;
import me.golemcore.imbot.domain.model.BotStatus;
import me.golemcore.imbot.domain.model.Message;
import me.golemcore.imbot.domain.model.Platform;
import me.golemcore.imbot.domain.model.PlatformInfo;
import me.golemcore.imbot.domain.model.SendMessageOptions;
import me.golemcore.imbot.domain.model.SendResult;
import me.golemcore.imbot.domain.model.config.BotConfig;
import me.golemcore.imbot.domain.model.content.MediaAttachment;

import java.util.List;
import java.util.function.Consumer;

/**
 * Capability contract every messaging platform implementation satisfies.
 *
 * <p>
 * Lifecycle: {@code disconnected -> connected -> authenticated -> ready}.
 * Every outbound operation requires the ready state and fails with
 * {@link BotException} otherwise. Failures are reported by throwing
 * {@link BotException}.
 *
 * <p>
 * Event handlers are invoked asynchronously, one task per handler. A handler
 * that throws never affects other handlers or the bot itself.
 */
public interface Bot extends AutoCloseable {

    Platform getPlatform();

    BotConfig getConfig();

    /**
     * Opens the platform connection. Calling it on a connected bot is a no-op.
     */
    void connect();

    /**
     * Closes the platform connection. Calling it on a disconnected bot is a
     * no-op.
     */
    void disconnect();

    boolean isConnected();

    boolean isReady();

    /**
     * Sends a message to a platform-specific target (chat id, channel id, web
     * chat session id).
     */
    SendResult sendMessage(String target, SendMessageOptions options);

    default SendResult sendText(String target, String text) {
        return sendMessage(target, SendMessageOptions.builder().text(text).build());
    }

    default SendResult sendMedia(String target, List<MediaAttachment> media) {
        return sendMessage(target, SendMessageOptions.builder().media(media).build());
    }

    void react(String messageId, String emoji);

    void editMessage(String messageId, String text);

    void deleteMessage(String messageId);

    /**
     * Returns a snapshot; later status changes are not reflected in it.
     */
    BotStatus getStatus();

    PlatformInfo getPlatformInfo();

    void onMessage(Consumer<Message> handler);

    void onError(Consumer<BotException> handler);

    void onConnected(Runnable handler);

    void onDisconnected(Runnable handler);

    void onReady(Runnable handler);

    /**
     * Drops all handlers and disconnects.
     */
    @Override
    void close();
}
