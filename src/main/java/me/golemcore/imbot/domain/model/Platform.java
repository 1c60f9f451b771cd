package me.golemcore.imbot.domain.model;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

import static me.golemcore.imbot.domain.model.ChatType.CHANNEL;
import static me.golemcore.imbot.domain.model.ChatType.DIRECT;
import static me.golemcore.imbot.domain.model.ChatType.GROUP;
import static me.golemcore.imbot.domain.model.ChatType.THREAD;
import static me.golemcore.imbot.domain.model.MediaType.AUDIO;
import static me.golemcore.imbot.domain.model.MediaType.DOCUMENT;
import static me.golemcore.imbot.domain.model.MediaType.GIF;
import static me.golemcore.imbot.domain.model.MediaType.IMAGE;
import static me.golemcore.imbot.domain.model.MediaType.STICKER;
import static me.golemcore.imbot.domain.model.MediaType.VIDEO;

/**
 * Messaging services known to the runtime, each with its capability table.
 */
public enum Platform {

    WHATSAPP("whatsapp", "WhatsApp"),
    TELEGRAM("telegram", "Telegram"),
    DISCORD("discord", "Discord"),
    SLACK("slack", "Slack"),
    GOOGLECHAT("googlechat", "Google Chat"),
    SIGNAL("signal", "Signal"),
    BLUEBUBBLES("bluebubbles", "BlueBubbles"),
    FEISHU("feishu", "Feishu"),
    WEBCHAT("webchat", "Web Chat"),
    DINGTALK("dingtalk", "DingTalk");

    private final String id;
    private final String displayName;

    Platform(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    @JsonCreator
    public static Platform fromId(String id) {
        for (Platform platform : values()) {
            if (platform.id.equalsIgnoreCase(id)) {
                return platform;
            }
        }
        throw new IllegalArgumentException("invalid platform: " + id);
    }

    public PlatformCapabilities getCapabilities() {
        return switch (this) {
        case WHATSAPP -> caps(List.of(DIRECT, GROUP), List.of(IMAGE, VIDEO, AUDIO, DOCUMENT, STICKER),
                List.of("reactions", "edit", "delete", "readReceipts", "typingIndicator"), 4096, 60);
        case TELEGRAM -> caps(List.of(DIRECT, GROUP, CHANNEL, THREAD), List.of(IMAGE, VIDEO, AUDIO, DOCUMENT, STICKER, GIF),
                List.of("reactions", "edit", "delete", "threads", "polls", "nativeCommands"), 4096, 30);
        case DISCORD -> caps(List.of(DIRECT, GROUP, CHANNEL, THREAD), List.of(IMAGE, VIDEO, AUDIO, DOCUMENT, GIF),
                List.of("reactions", "edit", "delete", "threads", "nativeCommands", "mentions"), 2000, 50);
        case SLACK -> caps(List.of(DIRECT, GROUP, CHANNEL, THREAD), List.of(IMAGE, VIDEO, AUDIO, DOCUMENT),
                List.of("reactions", "edit", "delete", "threads", "mentions"), 40000, 60);
        case GOOGLECHAT -> caps(List.of(DIRECT, GROUP, THREAD), List.of(IMAGE, VIDEO),
                List.of("reactions", "delete", "threads"), 4000, 30);
        case SIGNAL -> caps(List.of(DIRECT, GROUP), List.of(IMAGE, VIDEO, AUDIO, DOCUMENT),
                List.of("reactions", "delete", "readReceipts", "typingIndicator"), 4096, 60);
        case BLUEBUBBLES -> caps(List.of(DIRECT, GROUP), List.of(IMAGE, VIDEO, AUDIO, DOCUMENT),
                List.of("reactions", "edit", "delete", "readReceipts", "typingIndicator"), 4000, 60);
        case FEISHU -> caps(List.of(DIRECT, GROUP, CHANNEL, THREAD), List.of(IMAGE, VIDEO, AUDIO, DOCUMENT),
                List.of("reactions", "delete", "threads", "nativeCommands", "mentions"), 4000, 50);
        case WEBCHAT -> caps(List.of(DIRECT, GROUP), List.of(IMAGE, VIDEO, AUDIO, DOCUMENT, STICKER),
                List.of("reactions", "edit", "delete", "threads", "polls"), 4096, 60);
        case DINGTALK -> caps(List.of(DIRECT, GROUP), List.of(IMAGE, VIDEO, AUDIO, DOCUMENT),
                List.of("reactions", "delete", "threads"), 4000, 50);
        };
    }

    private static PlatformCapabilities caps(List<ChatType> chatTypes, List<MediaType> mediaTypes,
            List<String> features, int textLimit, int rateLimit) {
        return PlatformCapabilities.builder()
                .chatTypes(chatTypes)
                .mediaTypes(mediaTypes)
                .features(features)
                .textLimit(textLimit)
                .rateLimit(rateLimit)
                .build();
    }
}
