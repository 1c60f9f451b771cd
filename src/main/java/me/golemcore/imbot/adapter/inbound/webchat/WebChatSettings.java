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

import me.golemcore.imbot.domain.model.config.BotConfig;
import me.golemcore.imbot.infrastructure.config.ImbotProperties;

import java.time.Duration;

/**
 * Effective web chat settings: bot options override the application defaults
 * from {@code imbot.webchat}.
 */
public record WebChatSettings(
        String addr,
        String dbPath,
        int cacheSize,
        int sendBufferSize,
        int historyLimit,
        Duration pingInterval,
        Duration readTimeout,
        long sessionTtlSeconds,
        long cleanupIntervalSeconds,
        String defaultSenderName) {

    public static final String NO_PERSISTENCE = "none";

    public static WebChatSettings from(BotConfig config, ImbotProperties.WebChatProperties defaults) {
        return new WebChatSettings(
                config.getOptionString("addr", ":8080"),
                config.getOptionString("dbPath", defaults.getDbPath()),
                config.getOptionInt("cacheSize", defaults.getCacheSize()),
                config.getOptionInt("sendBufferSize", defaults.getSendBufferSize()),
                config.getOptionInt("historyLimit", defaults.getHistoryLimit()),
                defaults.getPingInterval(),
                defaults.getReadTimeout(),
                config.getOptionInt("sessionTtlSeconds", 0),
                config.getOptionInt("cleanupIntervalSeconds", (int) defaults.getCleanupInterval().toSeconds()),
                defaults.getDefaultSenderName());
    }

    public boolean persistenceEnabled() {
        return dbPath != null && !dbPath.isBlank() && !NO_PERSISTENCE.equalsIgnoreCase(dbPath);
    }
}
