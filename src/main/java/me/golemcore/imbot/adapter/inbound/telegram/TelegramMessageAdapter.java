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

import me.golemcore.imbot.domain.content.ContentHandlers;
import me.golemcore.imbot.domain.content.ContentRegistry;
import me.golemcore.imbot.domain.model.ChatType;
import me.golemcore.imbot.domain.model.Entity;
import me.golemcore.imbot.domain.model.EntityType;
import me.golemcore.imbot.domain.model.MediaType;
import me.golemcore.imbot.domain.model.Message;
import me.golemcore.imbot.domain.model.Platform;
import me.golemcore.imbot.domain.model.Recipient;
import me.golemcore.imbot.domain.model.Sender;
import me.golemcore.imbot.domain.model.ThreadContext;
import me.golemcore.imbot.domain.model.content.MediaAttachment;
import me.golemcore.imbot.domain.model.content.MediaContent;
import me.golemcore.imbot.domain.model.content.PollContent;
import me.golemcore.imbot.domain.model.content.PollOption;
import me.golemcore.imbot.domain.model.content.TextContent;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.MessageEntity;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.chat.Chat;
import org.telegram.telegrambots.meta.api.objects.PhotoSize;
import org.telegram.telegrambots.meta.api.objects.polls.Poll;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Converts Telegram updates into unified messages.
 *
 * <p>
 * Message ids have the form {@code chatId:messageId} so that they can be used
 * directly for edits, deletes and reactions.
 */
public class TelegramMessageAdapter {

    static final String REPLY_TO = "replyTo";
    static final String CALLBACK_QUERY_ID = "callbackQueryId";
    static final String CALLBACK_DATA = "callbackData";
    static final String CALLBACK_PREFIX = "callback:";

    private final ContentRegistry<org.telegram.telegrambots.meta.api.objects.message.Message> registry;
    private final Clock clock;

    public TelegramMessageAdapter(Clock clock) {
        this.clock = clock;
        this.registry = new ContentRegistry<org.telegram.telegrambots.meta.api.objects.message.Message>(
                Platform.TELEGRAM)
                .register(ContentHandlers.text(TelegramMessageAdapter::extractText))
                .register(ContentHandlers.compound("media",
                        ContentHandlers.media(MediaType.IMAGE, TelegramMessageAdapter::extractPhoto),
                        ContentHandlers.media(MediaType.VIDEO, TelegramMessageAdapter::extractVideo),
                        ContentHandlers.media(MediaType.AUDIO, TelegramMessageAdapter::extractAudio),
                        ContentHandlers.media(MediaType.VOICE, TelegramMessageAdapter::extractVoice),
                        ContentHandlers.media(MediaType.GIF, TelegramMessageAdapter::extractAnimation),
                        ContentHandlers.media(MediaType.DOCUMENT, TelegramMessageAdapter::extractDocument),
                        ContentHandlers.media(MediaType.STICKER, TelegramMessageAdapter::extractSticker)))
                .register(ContentHandlers.poll(TelegramMessageAdapter::extractPoll))
                .setDefault(ContentHandlers.system("unknown",
                        message -> Optional.of(Map.of("messageType", "unsupported"))));
    }

    public Message toMessage(org.telegram.telegrambots.meta.api.objects.message.Message message) {
        Chat chat = message.getChat();
        String chatId = String.valueOf(chat.getId());
        Message.MessageBuilder builder = Message.builder()
                .id(messageId(chatId, message.getMessageId()))
                .platform(Platform.TELEGRAM)
                .timestamp(message.getDate() != null ? message.getDate() : clock.instant().getEpochSecond())
                .sender(toSender(message.getFrom()))
                .recipient(Recipient.builder()
                        .id(chatId)
                        .type(chat.getType())
                        .displayName(chat.getTitle())
                        .build())
                .chatType(chatType(chat.getType()))
                .content(registry.handle(message));

        if (message.getMessageThreadId() != null) {
            builder.thread(ThreadContext.builder()
                    .id(String.valueOf(message.getMessageThreadId()))
                    .build());
        }
        if (message.getReplyToMessage() != null) {
            builder.metadataEntry(REPLY_TO, messageId(chatId, message.getReplyToMessage().getMessageId()));
        }
        return builder.build();
    }

    /**
     * Inline keyboard presses arrive as text messages {@code callback:<data>}.
     */
    public Message fromCallback(CallbackQuery query) {
        String chatId = String.valueOf(query.getMessage().getChatId());
        return Message.builder()
                .id(messageId(chatId, query.getMessage().getMessageId()))
                .platform(Platform.TELEGRAM)
                .timestamp(clock.instant().getEpochSecond())
                .sender(toSender(query.getFrom()))
                .recipient(Recipient.builder().id(chatId).type("private").build())
                .chatType(ChatType.DIRECT)
                .content(TextContent.builder().text(CALLBACK_PREFIX + query.getData()).build())
                .metadataEntry(CALLBACK_QUERY_ID, query.getId())
                .metadataEntry(CALLBACK_DATA, query.getData() != null ? query.getData() : "")
                .build();
    }

    static String messageId(String chatId, Integer messageId) {
        return chatId + ":" + messageId;
    }

    static ChatType chatType(String telegramType) {
        if (telegramType == null) {
            return ChatType.DIRECT;
        }
        return switch (telegramType) {
        case "group", "supergroup" -> ChatType.GROUP;
        case "channel" -> ChatType.CHANNEL;
        default -> ChatType.DIRECT;
        };
    }

    static Sender toSender(User user) {
        if (user == null) {
            return Sender.builder().id("unknown").build();
        }
        String fullName = ((user.getFirstName() != null ? user.getFirstName() : "") + " "
                + (user.getLastName() != null ? user.getLastName() : "")).trim();
        return Sender.builder()
                .id(String.valueOf(user.getId()))
                .username(user.getUserName())
                .displayName(fullName.isEmpty() ? user.getUserName() : fullName)
                .bot(Boolean.TRUE.equals(user.getIsBot()))
                .raw(user)
                .build();
    }

    // ==================== Content extractors ====================

    private static Optional<TextContent> extractText(org.telegram.telegrambots.meta.api.objects.message.Message m) {
        if (m.getText() == null || m.getText().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(TextContent.builder()
                .text(m.getText())
                .entities(toEntities(m.getEntities()))
                .build());
    }

    private static Optional<MediaContent> extractPhoto(org.telegram.telegrambots.meta.api.objects.message.Message m) {
        List<PhotoSize> sizes = m.getPhoto();
        if (sizes == null || sizes.isEmpty()) {
            return Optional.empty();
        }
        // Telegram lists sizes smallest first
        PhotoSize largest = sizes.get(sizes.size() - 1);
        return media(m, MediaAttachment.builder()
                .type(MediaType.IMAGE)
                .url(largest.getFileId())
                .size(longOf(largest.getFileSize()))
                .width(intOf(largest.getWidth()))
                .height(intOf(largest.getHeight()))
                .raw(Map.of("fileUniqueId", largest.getFileUniqueId()))
                .build());
    }

    private static Optional<MediaContent> extractVideo(org.telegram.telegrambots.meta.api.objects.message.Message m) {
        var video = m.getVideo();
        if (video == null) {
            return Optional.empty();
        }
        return media(m, MediaAttachment.builder()
                .type(MediaType.VIDEO)
                .url(video.getFileId())
                .mimeType(video.getMimeType())
                .size(longOf(video.getFileSize()))
                .width(intOf(video.getWidth()))
                .height(intOf(video.getHeight()))
                .duration(intOf(video.getDuration()))
                .build());
    }

    private static Optional<MediaContent> extractAudio(org.telegram.telegrambots.meta.api.objects.message.Message m) {
        var audio = m.getAudio();
        if (audio == null) {
            return Optional.empty();
        }
        return media(m, MediaAttachment.builder()
                .type(MediaType.AUDIO)
                .url(audio.getFileId())
                .mimeType(audio.getMimeType())
                .filename(audio.getFileName())
                .size(longOf(audio.getFileSize()))
                .duration(intOf(audio.getDuration()))
                .build());
    }

    private static Optional<MediaContent> extractVoice(org.telegram.telegrambots.meta.api.objects.message.Message m) {
        var voice = m.getVoice();
        if (voice == null) {
            return Optional.empty();
        }
        return media(m, MediaAttachment.builder()
                .type(MediaType.VOICE)
                .url(voice.getFileId())
                .mimeType(voice.getMimeType())
                .size(longOf(voice.getFileSize()))
                .duration(intOf(voice.getDuration()))
                .build());
    }

    private static Optional<MediaContent> extractAnimation(
            org.telegram.telegrambots.meta.api.objects.message.Message m) {
        var animation = m.getAnimation();
        if (animation == null) {
            return Optional.empty();
        }
        return media(m, MediaAttachment.builder()
                .type(MediaType.GIF)
                .url(animation.getFileId())
                .filename(animation.getFileName())
                .size(longOf(animation.getFileSize()))
                .width(intOf(animation.getWidth()))
                .height(intOf(animation.getHeight()))
                .duration(intOf(animation.getDuration()))
                .build());
    }

    private static Optional<MediaContent> extractDocument(
            org.telegram.telegrambots.meta.api.objects.message.Message m) {
        // animations are also delivered with a document part
        var document = m.getDocument();
        if (document == null || m.getAnimation() != null) {
            return Optional.empty();
        }
        return media(m, MediaAttachment.builder()
                .type(MediaType.DOCUMENT)
                .url(document.getFileId())
                .mimeType(document.getMimeType())
                .filename(document.getFileName())
                .size(longOf(document.getFileSize()))
                .build());
    }

    private static Optional<MediaContent> extractSticker(
            org.telegram.telegrambots.meta.api.objects.message.Message m) {
        var sticker = m.getSticker();
        if (sticker == null) {
            return Optional.empty();
        }
        return media(m, MediaAttachment.builder()
                .type(MediaType.STICKER)
                .url(sticker.getFileId())
                .size(longOf(sticker.getFileSize()))
                .width(intOf(sticker.getWidth()))
                .height(intOf(sticker.getHeight()))
                .raw(sticker.getEmoji() != null ? Map.of("emoji", sticker.getEmoji()) : null)
                .build());
    }

    private static Optional<PollContent> extractPoll(org.telegram.telegrambots.meta.api.objects.message.Message m) {
        Poll poll = m.getPoll();
        if (poll == null) {
            return Optional.empty();
        }
        List<PollOption> options = new ArrayList<>();
        if (poll.getOptions() != null) {
            for (var option : poll.getOptions()) {
                options.add(PollOption.builder()
                        .id(String.valueOf(options.size()))
                        .text(option.getText())
                        .voterCount(intOf(option.getVoterCount()))
                        .build());
            }
        }
        return Optional.of(PollContent.builder()
                .question(poll.getQuestion())
                .options(options)
                .multipleChoice(Boolean.TRUE.equals(poll.getAllowMultipleAnswers()))
                .anonymous(Boolean.TRUE.equals(poll.getIsAnonymous()))
                .expiresAt(poll.getCloseDate() != null ? poll.getCloseDate().longValue() : null)
                .build());
    }

    private static Optional<MediaContent> media(org.telegram.telegrambots.meta.api.objects.message.Message m,
            MediaAttachment attachment) {
        return Optional.of(MediaContent.builder()
                .attachment(attachment)
                .caption(m.getCaption())
                .build());
    }

    static List<Entity> toEntities(List<MessageEntity> entities) {
        if (entities == null) {
            return List.of();
        }
        List<Entity> result = new ArrayList<>(entities.size());
        for (MessageEntity entity : entities) {
            result.add(Entity.builder()
                    .type(EntityType.fromValue(entity.getType()))
                    .offset(intOf(entity.getOffset()))
                    .length(intOf(entity.getLength()))
                    .url(entity.getUrl())
                    .userId(entity.getUser() != null ? String.valueOf(entity.getUser().getId()) : null)
                    .build());
        }
        return result;
    }

    private static int intOf(Number value) {
        return value != null ? value.intValue() : 0;
    }

    private static long longOf(Number value) {
        return value != null ? value.longValue() : 0L;
    }
}
