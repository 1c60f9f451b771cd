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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.imbot.adapter.outbound.persistence.SqliteMessageStore;
import me.golemcore.imbot.domain.model.Platform;
import me.golemcore.imbot.domain.model.config.BotConfig;
import me.golemcore.imbot.domain.service.MessageCache;
import me.golemcore.imbot.domain.service.MessageHistoryService;
import me.golemcore.imbot.infrastructure.config.ImbotProperties;
import me.golemcore.imbot.port.inbound.Bot;
import me.golemcore.imbot.port.inbound.BotFactory;
import me.golemcore.imbot.port.outbound.MessageStorePort;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Builds web chat bots together with their store, cache and history service.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebChatBotFactory implements BotFactory {

    private final ImbotProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public Platform getPlatform() {
        return Platform.WEBCHAT;
    }

    @Override
    public Bot create(BotConfig config) {
        WebChatSettings settings = WebChatSettings.from(config, properties.getWebchat());
        MessageStorePort store = settings.persistenceEnabled()
                ? new SqliteMessageStore(Path.of(settings.dbPath()), objectMapper, clock)
                : null;
        if (store == null) {
            log.info("[WebChat] Persistence disabled, history is kept in memory only");
        }
        ExecutorService persistenceExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "imbot-webchat-store");
            thread.setDaemon(true);
            return thread;
        });
        MessageHistoryService history = new MessageHistoryService(store, new MessageCache(settings.cacheSize()),
                persistenceExecutor);
        return new WebChatBot(config, settings, history, new WebChatMessageAdapter(clock));
    }
}
