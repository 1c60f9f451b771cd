package me.golemcore.imbot;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point of the messaging bot gateway.
 *
 * <p>
 * Bots for every configured platform are created from {@code imbot.bots[n]}
 * and driven by a single {@link me.golemcore.imbot.domain.service.BotManager}.
 * The web chat platform is served by the embedded WebFlux server on
 * {@code /ws}, with REST introspection under {@code /api}.
 *
 * <pre>
 * Inbound adapters   → WebChatBot, TelegramBot
 * Domain             → BotManager, ContentRegistry, MessageHistoryService
 * Outbound adapters  → SqliteMessageStore
 * </pre>
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@ConfigurationPropertiesScan
public class ImbotApplication {

    public static void main(String[] args) {
        SpringApplication.run(ImbotApplication.class, args);
    }

}
