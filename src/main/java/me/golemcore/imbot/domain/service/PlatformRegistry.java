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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.imbot.domain.model.Platform;
import me.golemcore.imbot.domain.model.config.BotConfig;
import me.golemcore.imbot.port.inbound.Bot;
import me.golemcore.imbot.port.inbound.BotFactory;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps platforms to the factories able to build their bots.
 */
@Component
@Slf4j
public class PlatformRegistry {

    private final Map<Platform, BotFactory> factories = new ConcurrentHashMap<>();

    public PlatformRegistry(List<BotFactory> botFactories) {
        botFactories.forEach(this::register);
    }

    public void register(BotFactory factory) {
        BotFactory previous = factories.put(factory.getPlatform(), factory);
        if (previous != null) {
            log.warn("[PlatformRegistry] Replaced factory for {}: {} -> {}", factory.getPlatform().getId(),
                    previous.getClass().getSimpleName(), factory.getClass().getSimpleName());
        }
    }

    public boolean isSupported(Platform platform) {
        return factories.containsKey(platform);
    }

    public Set<Platform> getSupportedPlatforms() {
        return factories.isEmpty() ? EnumSet.noneOf(Platform.class) : EnumSet.copyOf(factories.keySet());
    }

    public Bot create(BotConfig config) {
        BotFactory factory = factories.get(config.getPlatform());
        if (factory == null) {
            throw new IllegalArgumentException("unsupported platform: " + config.getPlatform().getId());
        }
        return factory.create(config);
    }
}
