package me.golemcore.imbot.testsupport;

import me.golemcore.imbot.domain.model.ChatType;
import me.golemcore.imbot.domain.model.Message;
import me.golemcore.imbot.domain.model.Platform;
import me.golemcore.imbot.domain.model.Recipient;
import me.golemcore.imbot.domain.model.Sender;
import me.golemcore.imbot.domain.model.content.Content;
import me.golemcore.imbot.domain.model.content.Contents;

public final class TestMessages {

    private TestMessages() {
    }

    public static Message text(String id, String sessionId, String text) {
        return of(id, sessionId, 1_700_000_000L, Contents.text(text));
    }

    public static Message of(String id, String sessionId, long timestamp, Content content) {
        return Message.builder()
                .id(id)
                .platform(Platform.WEBCHAT)
                .timestamp(timestamp)
                .sender(Sender.builder().id("user_1").displayName("Alice").build())
                .recipient(Recipient.builder().id(sessionId).type("user").build())
                .chatType(ChatType.DIRECT)
                .content(content)
                .build();
    }
}
