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

import me.golemcore.imbot.domain.bot.AbstractBot;
import me.golemcore.imbot.domain.model.BotException;
import me.golemcore.imbot.domain.model.Button;
import me.golemcore.imbot.domain.model.ConnectionMode;
import me.golemcore.imbot.domain.model.ErrorCode;
import me.golemcore.imbot.domain.model.Message;
import me.golemcore.imbot.domain.model.SendMessageOptions;
import me.golemcore.imbot.domain.model.SendResult;
import me.golemcore.imbot.domain.model.config.BotConfig;
import me.golemcore.imbot.domain.model.content.MediaAttachment;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.GetMe;
import org.telegram.telegrambots.meta.api.methods.reactions.SetMessageReaction;
import org.telegram.telegrambots.meta.api.methods.send.SendAudio;
import org.telegram.telegrambots.meta.api.methods.send.SendDocument;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.send.SendPhoto;
import org.telegram.telegrambots.meta.api.methods.send.SendVideo;
import org.telegram.telegrambots.meta.api.methods.send.SendVoice;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.DeleteMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.InputFile;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.reactions.ReactionType;
import org.telegram.telegrambots.meta.api.objects.reactions.ReactionTypeEmoji;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardRow;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Telegram bot driven by long polling.
 *
 * <p>
 * Send targets are chat ids (numeric or {@code @channelname}); message ids
 * returned by sends and used for edits, deletes and reactions have the form
 * {@code chatId:messageId}.
 */
public class TelegramBot extends AbstractBot implements LongPollingSingleThreadUpdateConsumer {

    private static final int HTTP_UNAUTHORIZED = 401;
    private static final int HTTP_BAD_REQUEST = 400;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final String EMOJI_REACTION = "emoji";

    private final String token;
    private final TelegramBotsLongPollingApplication botsApplication;
    private final TelegramMessageAdapter messageAdapter;
    private final Set<String> allowFrom;
    private final String defaultParseMode;
    private final Object lifecycleLock = new Object();
    private TelegramClient telegramClient;

    public TelegramBot(BotConfig config, TelegramBotsLongPollingApplication botsApplication,
            TelegramClient telegramClient, TelegramMessageAdapter messageAdapter) {
        super(config, ConnectionMode.POLLING);
        this.token = config.getAuth().getToken();
        this.botsApplication = botsApplication;
        this.telegramClient = telegramClient;
        this.messageAdapter = messageAdapter;
        this.allowFrom = Set.copyOf(config.getOptionList("allowFrom"));
        this.defaultParseMode = config.getOptionString("parseMode", "");
    }

    TelegramBot(BotConfig config, TelegramBotsLongPollingApplication botsApplication,
            TelegramClient telegramClient, TelegramMessageAdapter messageAdapter, Executor eventExecutor,
            Clock clock) {
        super(config, ConnectionMode.POLLING, eventExecutor, clock);
        this.token = config.getAuth().getToken();
        this.botsApplication = botsApplication;
        this.telegramClient = telegramClient;
        this.messageAdapter = messageAdapter;
        this.allowFrom = Set.copyOf(config.getOptionList("allowFrom"));
        this.defaultParseMode = config.getOptionString("parseMode", "");
    }

    /**
     * Package-private setter for testing.
     */
    void setTelegramClient(TelegramClient client) {
        this.telegramClient = client;
    }

    // ==================== Lifecycle ====================

    /**
     * Verifies the token with {@code getMe} and registers the long polling
     * session.
     *
     * @throws BotException
     *             {@code AUTH_FAILED} when the token is rejected,
     *             {@code CONNECTION_FAILED} when polling cannot start
     */
    @Override
    public void connect() {
        User self;
        synchronized (lifecycleLock) {
            if (isConnected()) {
                return;
            }
            try {
                self = telegramClient.execute(new GetMe());
            } catch (TelegramApiException e) {
                BotException error = translate(e, "getMe");
                if (error.getCode() != ErrorCode.AUTH_FAILED) {
                    error = BotException.connectionFailed("telegram API unreachable: " + e.getMessage())
                            .withCause(e)
                            .withPlatform(platform);
                }
                connectionAttemptFailed(error);
                throw error;
            }
            try {
                botsApplication.registerBot(token, this);
            } catch (TelegramApiException e) {
                BotException error = BotException.connectionFailed("failed to start polling: " + e.getMessage())
                        .withCause(e)
                        .withPlatform(platform);
                connectionAttemptFailed(error);
                throw error;
            }
            updateConnected(true);
            updateAuthenticated(true);
            updateConnectionUrl("https://api.telegram.org");
            updateReady(true);
            clearError();
        }
        botLog.info("[Telegram] Telegram bot connected: @{}", self != null ? self.getUserName() : "unknown");
        emitConnected();
        emitReady();
    }

    @Override
    public void disconnect() {
        synchronized (lifecycleLock) {
            if (!isConnected()) {
                return;
            }
            try {
                botsApplication.unregisterBot(token);
            } catch (TelegramApiException e) {
                botLog.warn("[Telegram] Failed to stop polling: {}", e.getMessage());
            }
            updateConnected(false);
        }
        botLog.info("[Telegram] Telegram bot disconnected");
        emitDisconnected();
    }

    // ==================== Inbound ====================

    @Override
    public void consume(Update update) {
        if (update.hasMessage()) {
            handleMessage(update.getMessage());
        } else if (update.hasCallbackQuery()) {
            handleCallback(update.getCallbackQuery());
        }
    }

    private void handleMessage(org.telegram.telegrambots.meta.api.objects.message.Message telegramMessage) {
        if (!isAllowed(telegramMessage.getFrom())) {
            botLog.warn("[Telegram] Ignoring message from unauthorized user {}",
                    telegramMessage.getFrom() != null ? telegramMessage.getFrom().getId() : "unknown");
            return;
        }
        Message message;
        try {
            message = messageAdapter.toMessage(telegramMessage);
        } catch (BotException e) {
            botLog.error("[Telegram] Failed to adapt message: {}", e.getMessage());
            emitError(e);
            return;
        }
        emitMessage(message);
    }

    private void handleCallback(CallbackQuery query) {
        if (query.getMessage() == null) {
            botLog.warn("[Telegram] Callback query without associated message, ignoring");
            return;
        }
        if (!isAllowed(query.getFrom())) {
            botLog.warn("[Telegram] Ignoring callback from unauthorized user {}", query.getFrom().getId());
            return;
        }
        botLog.debug("[Telegram] Callback from {}: {}", query.getFrom().getId(), query.getData());
        emitMessage(messageAdapter.fromCallback(query));
        try {
            telegramClient.execute(AnswerCallbackQuery.builder().callbackQueryId(query.getId()).build());
        } catch (TelegramApiException e) {
            botLog.error("[Telegram] Failed to answer callback query: {}", e.getMessage());
        }
    }

    private boolean isAllowed(User user) {
        if (allowFrom.isEmpty()) {
            return true;
        }
        if (user == null) {
            return false;
        }
        return allowFrom.contains(String.valueOf(user.getId()))
                || (user.getUserName() != null && allowFrom.contains(user.getUserName()));
    }

    // ==================== Outbound ====================

    @Override
    public SendResult sendMessage(String target, SendMessageOptions options) {
        ensureReady();
        String chatId = parseChatId(target);
        SendResult result;
        if (options.hasMedia()) {
            result = sendMedia(chatId, options);
        } else if (options.hasText()) {
            result = sendText(chatId, options);
        } else {
            throw new BotException(ErrorCode.UNKNOWN, "no content to send", false).withPlatform(platform);
        }
        updateLastActivity();
        return result;
    }

    /**
     * Text over the platform limit is rejected rather than split; callers that
     * want several messages chunk the text themselves with {@link #chunkText}.
     */
    private SendResult sendText(String chatId, SendMessageOptions options) {
        validateTextLength(options.getText());
        SendMessage request = SendMessage.builder()
                .chatId(chatId)
                .text(options.getText())
                .parseMode(parseMode(options.getParseMode()))
                .replyToMessageId(messageIdOrNull(options.getReplyTo()))
                .messageThreadId(threadIdOrNull(options.getThreadId()))
                .disableNotification(options.isSilent())
                .replyMarkup(keyboard(options.getButtons()))
                .build();
        try {
            return toResult(telegramClient.execute(request), chatId);
        } catch (TelegramApiException e) {
            throw translate(e, "sendMessage");
        }
    }

    private SendResult sendMedia(String chatId, SendMessageOptions options) {
        SendResult result = null;
        List<MediaAttachment> media = options.getMedia();
        for (int i = 0; i < media.size(); i++) {
            MediaAttachment attachment = media.get(i);
            String caption = i == 0 ? options.getText() : null;
            String operation = "send" + attachment.getType().getValue();
            try {
                result = toResult(sendAttachment(chatId, attachment, caption, options), chatId);
            } catch (TelegramApiException e) {
                throw translate(e, operation);
            }
        }
        return result;
    }

    private org.telegram.telegrambots.meta.api.objects.message.Message sendAttachment(String chatId,
            MediaAttachment attachment, String caption, SendMessageOptions options) throws TelegramApiException {
        InputFile file = new InputFile(attachment.getUrl());
        Integer replyTo = messageIdOrNull(options.getReplyTo());
        Integer threadId = threadIdOrNull(options.getThreadId());
        String parseMode = caption != null ? parseMode(options.getParseMode()) : null;
        return switch (attachment.getType()) {
        case IMAGE, STICKER -> telegramClient.execute(SendPhoto.builder().chatId(chatId).photo(file)
                .caption(caption).parseMode(parseMode).replyToMessageId(replyTo).messageThreadId(threadId)
                .disableNotification(options.isSilent()).build());
        case VIDEO, GIF -> telegramClient.execute(SendVideo.builder().chatId(chatId).video(file)
                .caption(caption).parseMode(parseMode).replyToMessageId(replyTo).messageThreadId(threadId)
                .disableNotification(options.isSilent()).build());
        case AUDIO -> telegramClient.execute(SendAudio.builder().chatId(chatId).audio(file)
                .caption(caption).parseMode(parseMode).replyToMessageId(replyTo).messageThreadId(threadId)
                .disableNotification(options.isSilent()).build());
        case VOICE -> telegramClient.execute(SendVoice.builder().chatId(chatId).voice(file)
                .caption(caption).parseMode(parseMode).replyToMessageId(replyTo).messageThreadId(threadId)
                .disableNotification(options.isSilent()).build());
        case DOCUMENT -> telegramClient.execute(SendDocument.builder().chatId(chatId).document(file)
                .caption(caption).parseMode(parseMode).replyToMessageId(replyTo).messageThreadId(threadId)
                .disableNotification(options.isSilent()).build());
        default -> throw BotException.mediaNotSupported(attachment.getType().getValue()).withPlatform(platform);
        };
    }

    @Override
    public void react(String messageId, String emoji) {
        ensureReady();
        MessageRef ref = parseMessageRef(messageId);
        SetMessageReaction request = SetMessageReaction.builder()
                .chatId(ref.chatId())
                .messageId(ref.messageId())
                .reactionTypes(List.<ReactionType>of(
                        ReactionTypeEmoji.builder().type(EMOJI_REACTION).emoji(emoji).build()))
                .build();
        executeVoid(() -> telegramClient.execute(request), "setMessageReaction");
    }

    @Override
    public void editMessage(String messageId, String text) {
        ensureReady();
        validateTextLength(text);
        MessageRef ref = parseMessageRef(messageId);
        EditMessageText request = EditMessageText.builder()
                .chatId(ref.chatId())
                .messageId(ref.messageId())
                .text(text)
                .parseMode(parseMode(null))
                .build();
        executeVoid(() -> telegramClient.execute(request), "editMessageText");
    }

    @Override
    public void deleteMessage(String messageId) {
        ensureReady();
        MessageRef ref = parseMessageRef(messageId);
        DeleteMessage request = DeleteMessage.builder()
                .chatId(ref.chatId())
                .messageId(ref.messageId())
                .build();
        executeVoid(() -> telegramClient.execute(request), "deleteMessage");
    }

    // ==================== Helpers ====================

    private SendResult toResult(org.telegram.telegrambots.meta.api.objects.message.Message sent, String chatId) {
        return SendResult.builder()
                .messageId(TelegramMessageAdapter.messageId(chatId, sent.getMessageId()))
                .timestamp(sent.getDate() != null ? sent.getDate() : now().getEpochSecond())
                .platform(platform)
                .raw(sent)
                .build();
    }

    @FunctionalInterface
    private interface TelegramCall {
        void run() throws TelegramApiException;
    }

    private void executeVoid(TelegramCall call, String operation) {
        try {
            call.run();
        } catch (TelegramApiException e) {
            throw translate(e, operation);
        }
        updateLastActivity();
    }

    /**
     * Maps Telegram API failures onto bot error codes.
     */
    BotException translate(TelegramApiException e, String operation) {
        BotException error;
        if (e instanceof TelegramApiRequestException requestError && requestError.getErrorCode() != null) {
            int status = requestError.getErrorCode();
            if (status == HTTP_TOO_MANY_REQUESTS) {
                long retryAfter = requestError.getParameters() != null
                        && requestError.getParameters().getRetryAfter() != null
                                ? requestError.getParameters().getRetryAfter()
                                : 1;
                error = BotException.rateLimited(retryAfter);
            } else if (status == HTTP_UNAUTHORIZED) {
                error = BotException.authFailed("telegram rejected the bot token");
            } else if (status == HTTP_BAD_REQUEST && requestError.getApiResponse() != null
                    && requestError.getApiResponse().contains("not found")) {
                error = new BotException(ErrorCode.INVALID_TARGET, requestError.getApiResponse(), false);
            } else {
                error = BotException.platformError(operation + " failed: " + e.getMessage(), e);
            }
        } else {
            error = BotException.platformError(operation + " failed: " + e.getMessage(), e);
        }
        return error.withCause(e).withPlatform(platform).withContext("operation", operation);
    }

    private String parseMode(String requested) {
        String mode = requested != null && !requested.isEmpty() ? requested : defaultParseMode;
        return switch (mode.toLowerCase(Locale.ROOT)) {
        case "markdown" -> "Markdown";
        case "markdownv2" -> "MarkdownV2";
        case "html" -> "HTML";
        default -> null;
        };
    }

    private InlineKeyboardMarkup keyboard(List<List<Button>> buttons) {
        if (buttons == null || buttons.isEmpty()) {
            return null;
        }
        List<InlineKeyboardRow> rows = new ArrayList<>();
        for (List<Button> row : buttons) {
            InlineKeyboardRow keyboardRow = new InlineKeyboardRow();
            for (Button button : row) {
                keyboardRow.add(InlineKeyboardButton.builder()
                        .text(button.text())
                        .callbackData(button.url() == null ? button.data() : null)
                        .url(button.url())
                        .build());
            }
            rows.add(keyboardRow);
        }
        return InlineKeyboardMarkup.builder().keyboard(rows).build();
    }

    private String parseChatId(String target) {
        if (target == null || target.isBlank()) {
            throw BotException.invalidTarget(String.valueOf(target)).withPlatform(platform);
        }
        if (target.startsWith("@")) {
            return target;
        }
        try {
            return String.valueOf(Long.parseLong(target));
        } catch (NumberFormatException e) {
            throw new BotException(ErrorCode.INVALID_TARGET, "invalid chat ID: " + target, false)
                    .withPlatform(platform)
                    .withContext("target", target);
        }
    }

    private MessageRef parseMessageRef(String messageId) {
        int separator = messageId != null ? messageId.lastIndexOf(':') : -1;
        if (separator <= 0) {
            throw invalidMessageId(messageId);
        }
        try {
            return new MessageRef(messageId.substring(0, separator),
                    Integer.parseInt(messageId.substring(separator + 1)));
        } catch (NumberFormatException e) {
            throw invalidMessageId(messageId);
        }
    }

    private BotException invalidMessageId(String messageId) {
        return new BotException(ErrorCode.INVALID_TARGET, "invalid message ID: " + messageId, false)
                .withPlatform(platform)
                .withContext("messageId", String.valueOf(messageId));
    }

    private static Integer messageIdOrNull(String messageId) {
        if (messageId == null || messageId.isEmpty()) {
            return null;
        }
        String local = messageId.substring(messageId.lastIndexOf(':') + 1);
        try {
            return Integer.parseInt(local);
        } catch (NumberFormatException e) { // NOSONAR - replies to unknown ids are sent as plain messages
            return null;
        }
    }

    private static Integer threadIdOrNull(String threadId) {
        if (threadId == null || threadId.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(threadId);
        } catch (NumberFormatException e) { // NOSONAR - non-numeric thread ids do not exist on Telegram
            return null;
        }
    }

    private record MessageRef(String chatId, Integer messageId) {
    }
}
