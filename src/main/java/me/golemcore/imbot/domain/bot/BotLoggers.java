package me.golemcore.imbot.domain.bot;

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

import ch.qos.logback.classic.Level;
import me.golemcore.imbot.domain.model.Platform;
import me.golemcore.imbot.domain.model.config.LoggingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Resolves the per-platform bot logger and applies the configured level to it.
 */
public final class BotLoggers {

    static final String PREFIX = "me.golemcore.imbot.bot.";

    private BotLoggers() {
    }

    public static Logger forPlatform(Platform platform, LoggingConfig logging) {
        Logger logger = LoggerFactory.getLogger(PREFIX + platform.getId());
        if (logging != null && logger instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(toLevel(logging.getLevel()));
        }
        return logger;
    }

    static Level toLevel(String level) {
        if (level == null) {
            return Level.INFO;
        }
        return switch (level.toLowerCase(Locale.ROOT)) {
        case "debug" -> Level.DEBUG;
        case "warn", "warning" -> Level.WARN;
        case "error" -> Level.ERROR;
        case "silent", "off" -> Level.OFF;
        default -> Level.INFO;
        };
    }
}
