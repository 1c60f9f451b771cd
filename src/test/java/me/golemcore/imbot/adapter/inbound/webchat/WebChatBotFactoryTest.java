package me.golemcore.imbot.adapter.inbound.webchat;

import me.golemcore.imbot.domain.model.Platform;
import me.golemcore.imbot.domain.model.config.AuthConfig;
import me.golemcore.imbot.domain.model.config.AuthType;
import me.golemcore.imbot.domain.model.config.BotConfig;
import me.golemcore.imbot.infrastructure.config.AutoConfiguration;
import me.golemcore.imbot.infrastructure.config.ImbotProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebChatBotFactoryTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldBuildBotFromOptionsOverDefaults() {
        ImbotProperties properties = new ImbotProperties();
        Path dbPath = tempDir.resolve("chat/webchat.db");
        BotConfig config = webchatConfig();
        config.getOptions().put("addr", ":9090");
        config.getOptions().put("dbPath", dbPath.toString());
        config.getOptions().put("historyLimit", 20);
        WebChatBotFactory factory = new WebChatBotFactory(properties, AutoConfiguration.objectMapper(),
                Clock.systemUTC());

        WebChatBot bot = assertInstanceOf(WebChatBot.class, factory.create(config));

        try {
            assertEquals(Platform.WEBCHAT, factory.getPlatform());
            assertEquals(":9090", bot.getSettings().addr());
            assertEquals(20, bot.getSettings().historyLimit());
            assertEquals(properties.getWebchat().getSendBufferSize(), bot.getSettings().sendBufferSize());
            assertTrue(bot.getSettings().persistenceEnabled());
            assertTrue(Files.exists(dbPath));
        } finally {
            bot.close();
        }
    }

    @Test
    void shouldRunWithoutPersistence() {
        BotConfig config = webchatConfig();
        config.getOptions().put("dbPath", "none");
        WebChatBotFactory factory = new WebChatBotFactory(new ImbotProperties(), AutoConfiguration.objectMapper(),
                Clock.systemUTC());

        WebChatBot bot = (WebChatBot) factory.create(config);
        bot.connect();
        WebChatSession session = bot.openSession(null, null);

        assertFalse(bot.getSettings().persistenceEnabled());
        assertEquals("User", session.getSenderName());
        bot.close();
    }

    private static BotConfig webchatConfig() {
        return BotConfig.builder()
                .platform(Platform.WEBCHAT)
                .auth(AuthConfig.builder().type(AuthType.NONE).build())
                .build();
    }
}
