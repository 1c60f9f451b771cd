package me.golemcore.imbot.infrastructure.config;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.imbot.domain.model.BotException;
import me.golemcore.imbot.domain.model.Message;
import me.golemcore.imbot.domain.model.Platform;
import me.golemcore.imbot.domain.model.config.BotConfig;
import me.golemcore.imbot.domain.service.BotManager;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Registers the configured bots on context start and shuts the manager down on
 * context stop.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BotManagerLifecycle implements SmartLifecycle {

    private final ImbotProperties properties;
    private final BotManager botManager;

    private volatile boolean running;

    @Override
    public void start() {
        List<BotConfig> enabled = BotConfig.enabled(properties.getBots());
        log.info("[Manager] {} of {} configured bots enabled", enabled.size(), properties.getBots().size());

        botManager.onMessage(this::logMessage);
        botManager.onError((error, platform) -> log.warn("[{}] {}", platform.getId(), error.getMessage()));
        botManager.onReady(platform -> log.info("[{}] Bot ready", platform.getId()));

        for (BotConfig botConfig : enabled) {
            try {
                botManager.addBot(botConfig);
            } catch (IllegalArgumentException | BotException e) { // NOSONAR
                log.error("[Manager] Skipping bot for platform {}: {}", botConfig.getPlatform(), e.getMessage());
            }
        }
        botManager.start();
        running = true;
    }

    @Override
    public void stop() {
        running = false;
        botManager.close();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void logMessage(Message message, Platform platform) {
        if (log.isDebugEnabled()) {
            log.debug("[{}] {}", platform.getId(), message.formatForDisplay());
        }
    }
}
