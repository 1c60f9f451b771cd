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

import me.golemcore.imbot.adapter.inbound.webchat.dto.ChatFrame;
import me.golemcore.imbot.adapter.inbound.webchat.dto.ChatFrameMedia;
import me.golemcore.imbot.domain.content.ContentHandler;
import me.golemcore.imbot.domain.content.ContentHandlers;
import me.golemcore.imbot.domain.content.ContentRegistry;
import me.golemcore.imbot.domain.model.ChatType;
import me.golemcore.imbot.domain.model.MediaType;
import me.golemcore.imbot.domain.model.Message;
import me.golemcore.imbot.domain.model.Platform;
import me.golemcore.imbot.domain.model.Recipient;
import me.golemcore.imbot.domain.model.Sender;
import me.golemcore.imbot.domain.model.content.Content;
import me.golemcore.imbot.domain.model.content.MediaAttachment;
import me.golemcore.imbot.domain.model.content.MediaContent;
import me.golemcore.imbot.domain.model.content.PollContent;
import me.golemcore.imbot.domain.model.content.PollOption;
import me.golemcore.imbot.domain.model.content.ReactionContent;
import me.golemcore.imbot.domain.model.content.SystemContent;
import me.golemcore.imbot.domain.model.content.TextContent;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Converts socket frames into unified messages and back.
 */
public class WebChatMessageAdapter {

    static final String CLIENT_MESSAGE_ID = "clientMessageId";
    static final String CONTENT_TYPE = "contentType";
    static final String EVENT = "event";

    private final ContentRegistry<ChatFrame> registry;
    private final Clock clock;

    public WebChatMessageAdapter(Clock clock) {
        this.clock = clock;
        this.registry = new ContentRegistry<ChatFrame>(Platform.WEBCHAT)
                .register(mediaHandler())
                .register(ContentHandlers.text(frame -> isBlank(frame.getText())
                        ? Optional.empty()
                        : Optional.of(TextContent.builder().text(frame.getText()).build())))
                .register(ContentHandlers.system("client_event", frame -> frame.getMetadata() != null
                        && frame.getMetadata().get(EVENT) != null
                                ? Optional.of(frame.getMetadata())
                                : Optional.empty()));
    }

    /**
     * Builds the inbound message for a frame received on the session. The
     * recipient is the session itself.
     */
    public Message toMessage(WebChatSession session, ChatFrame frame) {
        Content content = registry.handle(frame);
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (frame.getMetadata() != null) {
            metadata.putAll(frame.getMetadata());
        }
        if (!isBlank(frame.getId())) {
            metadata.put(CLIENT_MESSAGE_ID, frame.getId());
        }
        long timestamp = frame.getTimestamp() != null && frame.getTimestamp() > 0
                ? frame.getTimestamp()
                : clock.instant().getEpochSecond();
        return Message.builder()
                .id(WebChatIds.messageId())
                .platform(Platform.WEBCHAT)
                .timestamp(timestamp)
                .sender(Sender.builder()
                        .id(session.getSenderId())
                        .displayName(session.getSenderName())
                        .build())
                .recipient(Recipient.builder()
                        .id(session.getId())
                        .type("user")
                        .build())
                .chatType(ChatType.DIRECT)
                .content(content)
                .metadata(metadata)
                .build();
    }

    /**
     * Renders any message as a frame. Content kinds without a native frame
     * field are described in {@code text} and tagged in metadata.
     */
    public ChatFrame toFrame(Message message) {
        Map<String, Object> metadata = new LinkedHashMap<>(message.getMetadata());
        Content content = message.getContent();
        metadata.put(CONTENT_TYPE, content.contentType().getValue());
        ChatFrame.ChatFrameBuilder frame = ChatFrame.builder()
                .id(message.getId())
                .timestamp(message.getTimestamp())
                .senderId(message.getSender() != null ? message.getSender().getId() : null)
                .senderName(message.getSenderDisplayName())
                .metadata(metadata);
        switch (content.contentType()) {
        case TEXT -> frame.text(((TextContent) content).getText());
        case MEDIA -> {
            MediaContent media = (MediaContent) content;
            frame.text(media.getCaption()).media(media.getMedia().stream().map(this::toFrameMedia).toList());
        }
        case POLL -> {
            PollContent poll = (PollContent) content;
            frame.text(poll.getQuestion());
            metadata.put("options", poll.getOptions().stream().map(PollOption::getText).toList());
        }
        case REACTION -> {
            ReactionContent reaction = (ReactionContent) content;
            frame.text(reaction.getEmoji());
            metadata.put("targetMessageId", reaction.getMessageId());
        }
        case SYSTEM -> {
            SystemContent system = (SystemContent) content;
            metadata.put(EVENT, system.getEventType());
            metadata.putAll(system.getData());
        }
        }
        return frame.build();
    }

    private ContentHandler<ChatFrame> mediaHandler() {
        List<ContentHandler<ChatFrame>> byType = new ArrayList<>();
        for (MediaType type : MediaType.values()) {
            byType.add(ContentHandlers.media(type, frame -> firstMediaType(frame)
                    .filter(type::equals)
                    .map(ignored -> MediaContent.builder()
                            .media(frame.getMedia().stream().map(this::toAttachment).toList())
                            .caption(frame.getText())
                            .build())));
        }
        @SuppressWarnings("unchecked")
        ContentHandler<ChatFrame>[] handlers = byType.toArray(new ContentHandler[0]);
        return ContentHandlers.compound("media", handlers);
    }

    private Optional<MediaType> firstMediaType(ChatFrame frame) {
        if (frame.getMedia() == null || frame.getMedia().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(MediaType.fromValue(frame.getMedia().get(0).getType()));
    }

    private MediaAttachment toAttachment(ChatFrameMedia media) {
        return MediaAttachment.builder()
                .type(MediaType.fromValue(media.getType()))
                .url(media.getUrl())
                .mimeType(media.getMimeType())
                .filename(media.getFilename())
                .size(media.getSize() != null ? media.getSize() : 0)
                .thumbnail(media.getThumbnail())
                .width(media.getWidth() != null ? media.getWidth() : 0)
                .height(media.getHeight() != null ? media.getHeight() : 0)
                .duration(media.getDuration() != null ? media.getDuration() : 0)
                .raw(media.getRaw())
                .build();
    }

    private ChatFrameMedia toFrameMedia(MediaAttachment attachment) {
        return ChatFrameMedia.builder()
                .type(attachment.getType() != null ? attachment.getType().getValue() : null)
                .url(attachment.getUrl())
                .mimeType(attachment.getMimeType())
                .filename(attachment.getFilename())
                .size(attachment.getSize() > 0 ? attachment.getSize() : null)
                .thumbnail(attachment.getThumbnail())
                .width(attachment.getWidth() > 0 ? attachment.getWidth() : null)
                .height(attachment.getHeight() > 0 ? attachment.getHeight() : null)
                .duration(attachment.getDuration() > 0 ? attachment.getDuration() : null)
                .raw(attachment.getRaw())
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
