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

import lombok.Data;
import me.golemcore.imbot.domain.model.config.BotConfig;
import me.golemcore.imbot.domain.model.config.ManagerConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties bound from {@code imbot.*}.
 *
 * <p>
 * Sections:
 * <ul>
 * <li>{@code imbot.manager} - auto-reconnect policy</li>
 * <li>{@code imbot.bots[n]} - one entry per bot instance</li>
 * <li>{@code imbot.webchat} - defaults for web chat bots</li>
 * <li>{@code imbot.http} - client timeouts for platform HTTP APIs</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "imbot")
@Data
public class ImbotProperties {

    private ManagerConfig manager = new ManagerConfig();
    private List<BotConfig> bots = new ArrayList<>();
    private WebChatProperties webchat = new WebChatProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class WebChatProperties {
        private String dbPath = "data/webchat.db";
        private int cacheSize = 100;
        private int sendBufferSize = 256;
        private int historyLimit = 50;
        private Duration pingInterval = Duration.ofSeconds(30);
        private Duration readTimeout = Duration.ofSeconds(60);
        private Duration cleanupInterval = Duration.ofMinutes(5);
        private String defaultSenderName = "User";
    }

    @Data
    public static class HttpProperties {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
    }
}
