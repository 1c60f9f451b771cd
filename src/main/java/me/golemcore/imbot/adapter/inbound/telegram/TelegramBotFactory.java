package me.golemcore.imbot.adapter.inbound.telegram;

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
import me.golemcore.imbot.domain.model.BotException;
import me.golemcore.imbot.domain.model.Platform;
import me.golemcore.imbot.domain.model.config.AuthType;
import me.golemcore.imbot.domain.model.config.BotConfig;
import me.golemcore.imbot.infrastructure.config.ImbotProperties;
import me.golemcore.imbot.port.inbound.Bot;
import me.golemcore.imbot.port.inbound.BotFactory;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;

import java.time.Clock;

/**
 * Builds Telegram bots sharing one long polling application.
 */
@Component
@RequiredArgsConstructor
public class TelegramBotFactory implements BotFactory {

    private final ImbotProperties properties;
    private final TelegramBotsLongPollingApplication botsApplication;
    private final Clock clock;

    @Override
    public Platform getPlatform() {
        return Platform.TELEGRAM;
    }

    /**
     * @throws BotException
     *             {@code AUTH_FAILED} unless the config uses token auth
     */
    @Override
    public Bot create(BotConfig config) {
        if (config.getAuth() == null || config.getAuth().getType() != AuthType.TOKEN) {
            throw BotException.authFailed("telegram requires token auth").withPlatform(Platform.TELEGRAM);
        }
        ImbotProperties.HttpProperties http = properties.getHttp();
        OkHttpClient httpClient = new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout())
                .readTimeout(http.getReadTimeout())
                .build();
        OkHttpTelegramClient telegramClient = new OkHttpTelegramClient(httpClient, config.getAuth().getToken());
        return new TelegramBot(config, botsApplication, telegramClient, new TelegramMessageAdapter(clock));
    }
}
