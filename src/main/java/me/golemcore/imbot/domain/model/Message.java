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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import me.golemcore.imbot.domain.model.content.Content;
import me.golemcore.imbot.domain.model.content.MediaContent;
import me.golemcore.imbot.domain.model.content.PollContent;
import me.golemcore.imbot.domain.model.content.ReactionContent;
import me.golemcore.imbot.domain.model.content.SystemContent;
import me.golemcore.imbot.domain.model.content.TextContent;

import java.util.Map;

/**
 * Platform-agnostic message. Instances are immutable; use {@link #copy()} or
 * {@link #withMetadata(String, Object)} to derive a changed message.
 */
@Value
@Builder(toBuilder = true)
public class Message {

    String id;
    Platform platform;
    /** Unix seconds. */
    long timestamp;
    Sender sender;
    Recipient recipient;
    ChatType chatType;
    ThreadContext thread;
    Content content;
    @Singular("metadataEntry")
    Map<String, Object> metadata;

    /**
     * Returns the text body, the media caption, or an empty string for other
     * content kinds.
     */
    public String getText() {
        if (content == null) {
            return "";
        }
        return switch (content.contentType()) {
        case TEXT -> nullToEmpty(((TextContent) content).getText());
        case MEDIA -> nullToEmpty(((MediaContent) content).getCaption());
        case POLL, REACTION, SYSTEM -> "";
        };
    }

    public boolean isGroupMessage() {
        return chatType == ChatType.GROUP || chatType == ChatType.CHANNEL;
    }

    public boolean isDirectMessage() {
        return chatType == ChatType.DIRECT;
    }

    public boolean isThreadMessage() {
        return chatType == ChatType.THREAD || thread != null;
    }

    public String getSenderDisplayName() {
        if (sender == null) {
            return "";
        }
        if (sender.getDisplayName() != null && !sender.getDisplayName().isEmpty()) {
            return sender.getDisplayName();
        }
        if (sender.getUsername() != null && !sender.getUsername().isEmpty()) {
            return sender.getUsername();
        }
        return sender.getId();
    }

    /**
     * Single-line human readable rendering used in logs and plain-text
     * transports.
     */
    public String formatForDisplay() {
        String prefix = "[" + (platform != null ? platform.getId() : "?") + "] " + getSenderDisplayName() + ": ";
        if (content == null) {
            return prefix;
        }
        return prefix + switch (content.contentType()) {
        case TEXT -> getText();
        case MEDIA -> {
            MediaContent media = (MediaContent) content;
            String caption = media.getCaption() != null ? " " + media.getCaption() : "";
            yield "[" + media.getMedia().size() + " attachment(s)]" + caption;
        }
        case POLL -> "[poll] " + ((PollContent) content).getQuestion();
        case REACTION -> {
            ReactionContent reaction = (ReactionContent) content;
            yield "[reaction " + reaction.getEmoji() + " on " + reaction.getMessageId() + "]";
        }
        case SYSTEM -> "[system:" + ((SystemContent) content).getEventType() + "]";
        };
    }

    public Message copy() {
        return toBuilder().build();
    }

    public Message withMetadata(String key, Object value) {
        return toBuilder().metadataEntry(key, value).build();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
