package me.golemcore.imbot.adapter.inbound.telegram;

import me.golemcore.imbot.domain.model.ChatType;
import me.golemcore.imbot.domain.model.EntityType;
import me.golemcore.imbot.domain.model.MediaType;
import me.golemcore.imbot.domain.model.Message;
import me.golemcore.imbot.domain.model.Platform;
import me.golemcore.imbot.domain.model.Sender;
import me.golemcore.imbot.domain.model.content.MediaAttachment;
import me.golemcore.imbot.domain.model.content.MediaContent;
import me.golemcore.imbot.domain.model.content.PollContent;
import me.golemcore.imbot.domain.model.content.SystemContent;
import me.golemcore.imbot.domain.model.content.TextContent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Document;
import org.telegram.telegrambots.meta.api.objects.MessageEntity;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.chat.Chat;
import org.telegram.telegrambots.meta.api.objects.PhotoSize;
import org.telegram.telegrambots.meta.api.objects.polls.Poll;
import org.telegram.telegrambots.meta.api.objects.polls.PollOption;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TelegramMessageAdapterTest {

    private static final long NOW = 1_700_000_000L;
    private static final long CHAT_ID = 100L;

    private TelegramMessageAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new TelegramMessageAdapter(Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC));
    }

    @Test
    void shouldAdaptPrivateTextMessage() {
        org.telegram.telegrambots.meta.api.objects.message.Message telegramMessage = baseMessage("private");
        MessageEntity bold = mock(MessageEntity.class);
        when(bold.getType()).thenReturn("bold");
        when(bold.getOffset()).thenReturn(0);
        when(bold.getLength()).thenReturn(5);
        when(telegramMessage.getText()).thenReturn("hello world");
        when(telegramMessage.getEntities()).thenReturn(List.of(bold));

        Message message = adapter.toMessage(telegramMessage);

        assertEquals("100:7", message.getId());
        assertEquals(Platform.TELEGRAM, message.getPlatform());
        assertEquals(1_699_999_000L, message.getTimestamp());
        assertEquals(ChatType.DIRECT, message.getChatType());
        assertEquals("100", message.getRecipient().getId());
        assertEquals("private", message.getRecipient().getType());
        TextContent content = assertInstanceOf(TextContent.class, message.getContent());
        assertEquals("hello world", content.getText());
        assertEquals(EntityType.BOLD, content.getEntities().get(0).getType());
        assertEquals(5, content.getEntities().get(0).getLength());
        assertNull(message.getThread());
        assertTrue(message.getMetadata().isEmpty());
    }

    @Test
    void shouldMapGroupThreadAndReply() {
        org.telegram.telegrambots.meta.api.objects.message.Message telegramMessage = baseMessage("supergroup");
        org.telegram.telegrambots.meta.api.objects.message.Message replied = mock(
                org.telegram.telegrambots.meta.api.objects.message.Message.class);
        when(replied.getMessageId()).thenReturn(3);
        when(telegramMessage.getText()).thenReturn("in a topic");
        when(telegramMessage.getMessageThreadId()).thenReturn(12);
        when(telegramMessage.getReplyToMessage()).thenReturn(replied);

        Message message = adapter.toMessage(telegramMessage);

        assertEquals(ChatType.GROUP, message.getChatType());
        assertTrue(message.isGroupMessage());
        assertEquals("12", message.getThread().getId());
        assertEquals("100:3", message.getMetadata().get("replyTo"));
    }

    @Test
    void shouldPickLargestPhotoSize() {
        org.telegram.telegrambots.meta.api.objects.message.Message telegramMessage = baseMessage("private");
        PhotoSize small = photo("small", 90, 90);
        PhotoSize large = photo("large", 1280, 960);
        when(telegramMessage.getPhoto()).thenReturn(List.of(small, large));
        when(telegramMessage.getCaption()).thenReturn("sunset");

        Message message = adapter.toMessage(telegramMessage);

        MediaContent content = assertInstanceOf(MediaContent.class, message.getContent());
        assertEquals("sunset", content.getCaption());
        MediaAttachment attachment = content.getMedia().get(0);
        assertEquals(MediaType.IMAGE, attachment.getType());
        assertEquals("large", attachment.getUrl());
        assertEquals(1280, attachment.getWidth());
        assertEquals("sunset", message.getText());
    }

    @Test
    void shouldAdaptDocument() {
        org.telegram.telegrambots.meta.api.objects.message.Message telegramMessage = baseMessage("private");
        Document document = mock(Document.class);
        when(document.getFileId()).thenReturn("doc-1");
        when(document.getFileName()).thenReturn("report.pdf");
        when(document.getMimeType()).thenReturn("application/pdf");
        when(telegramMessage.getDocument()).thenReturn(document);

        Message message = adapter.toMessage(telegramMessage);

        MediaContent content = assertInstanceOf(MediaContent.class, message.getContent());
        MediaAttachment attachment = content.getMedia().get(0);
        assertEquals(MediaType.DOCUMENT, attachment.getType());
        assertEquals("doc-1", attachment.getUrl());
        assertEquals("report.pdf", attachment.getFilename());
    }

    @Test
    void shouldAdaptPoll() {
        org.telegram.telegrambots.meta.api.objects.message.Message telegramMessage = baseMessage("group");
        Poll poll = mock(Poll.class);
        PollOption pizza = mock(PollOption.class);
        PollOption sushi = mock(PollOption.class);
        when(pizza.getText()).thenReturn("pizza");
        when(pizza.getVoterCount()).thenReturn(3);
        when(sushi.getText()).thenReturn("sushi");
        when(poll.getQuestion()).thenReturn("Lunch?");
        when(poll.getOptions()).thenReturn(List.of(pizza, sushi));
        when(poll.getAllowMultipleAnswers()).thenReturn(true);
        when(poll.getCloseDate()).thenReturn(null);
        when(telegramMessage.getPoll()).thenReturn(poll);

        Message message = adapter.toMessage(telegramMessage);

        PollContent content = assertInstanceOf(PollContent.class, message.getContent());
        assertEquals("Lunch?", content.getQuestion());
        assertEquals(2, content.getOptions().size());
        assertEquals("1", content.getOptions().get(1).getId());
        assertEquals(3, content.getOptions().get(0).getVoterCount());
        assertTrue(content.isMultipleChoice());
        assertNull(content.getExpiresAt());
    }

    @Test
    void shouldFallBackToUnsupportedSystemContent() {
        org.telegram.telegrambots.meta.api.objects.message.Message telegramMessage = baseMessage("private");

        Message message = adapter.toMessage(telegramMessage);

        SystemContent content = assertInstanceOf(SystemContent.class, message.getContent());
        assertEquals("unknown", content.getEventType());
        assertEquals("unsupported", content.getData().get("messageType"));
    }

    @Test
    void shouldAdaptCallbackAsText() {
        org.telegram.telegrambots.meta.api.objects.message.Message origin = mock(
                org.telegram.telegrambots.meta.api.objects.message.Message.class);
        when(origin.getChatId()).thenReturn(CHAT_ID);
        when(origin.getMessageId()).thenReturn(9);
        CallbackQuery query = mock(CallbackQuery.class);
        when(query.getId()).thenReturn("cb-1");
        when(query.getData()).thenReturn("approve");
        when(query.getMessage()).thenReturn(origin);
        User from = user(55L, "Ann", "Lee", "ann");
        when(query.getFrom()).thenReturn(from);

        Message message = adapter.fromCallback(query);

        assertEquals("100:9", message.getId());
        assertEquals("callback:approve", message.getText());
        assertEquals(NOW, message.getTimestamp());
        assertEquals("cb-1", message.getMetadata().get("callbackQueryId"));
        assertEquals("approve", message.getMetadata().get("callbackData"));
        assertEquals("Ann Lee", message.getSender().getDisplayName());
    }

    @Test
    void shouldMapChatTypes() {
        assertEquals(ChatType.GROUP, TelegramMessageAdapter.chatType("group"));
        assertEquals(ChatType.GROUP, TelegramMessageAdapter.chatType("supergroup"));
        assertEquals(ChatType.CHANNEL, TelegramMessageAdapter.chatType("channel"));
        assertEquals(ChatType.DIRECT, TelegramMessageAdapter.chatType("private"));
        assertEquals(ChatType.DIRECT, TelegramMessageAdapter.chatType(null));
    }

    @Test
    void shouldBuildSenderFromUser() {
        Sender named = TelegramMessageAdapter.toSender(user(1L, "Ann", null, "ann"));
        Sender usernameOnly = TelegramMessageAdapter.toSender(user(2L, null, null, "bob"));
        Sender missing = TelegramMessageAdapter.toSender(null);

        assertEquals("Ann", named.getDisplayName());
        assertEquals("ann", named.getUsername());
        assertEquals("1", named.getId());
        assertFalse(named.isBot());
        assertEquals("bob", usernameOnly.getDisplayName());
        assertEquals("unknown", missing.getId());
    }

    private org.telegram.telegrambots.meta.api.objects.message.Message baseMessage(String chatType) {
        Chat chat = mock(Chat.class);
        when(chat.getId()).thenReturn(CHAT_ID);
        when(chat.getType()).thenReturn(chatType);
        User from = user(55L, "Ann", null, "ann");
        org.telegram.telegrambots.meta.api.objects.message.Message telegramMessage = mock(
                org.telegram.telegrambots.meta.api.objects.message.Message.class);
        when(telegramMessage.getChat()).thenReturn(chat);
        when(telegramMessage.getChatId()).thenReturn(CHAT_ID);
        when(telegramMessage.getMessageId()).thenReturn(7);
        when(telegramMessage.getDate()).thenReturn(1_699_999_000);
        when(telegramMessage.getMessageThreadId()).thenReturn(null);
        when(telegramMessage.getFrom()).thenReturn(from);
        return telegramMessage;
    }

    private PhotoSize photo(String fileId, int width, int height) {
        PhotoSize size = mock(PhotoSize.class);
        when(size.getFileId()).thenReturn(fileId);
        when(size.getFileUniqueId()).thenReturn(fileId + "-unique");
        when(size.getWidth()).thenReturn(width);
        when(size.getHeight()).thenReturn(height);
        return size;
    }

    private User user(long id, String firstName, String lastName, String username) {
        User user = mock(User.class);
        when(user.getId()).thenReturn(id);
        when(user.getFirstName()).thenReturn(firstName);
        when(user.getLastName()).thenReturn(lastName);
        when(user.getUserName()).thenReturn(username);
        when(user.getIsBot()).thenReturn(false);
        return user;
    }
}
