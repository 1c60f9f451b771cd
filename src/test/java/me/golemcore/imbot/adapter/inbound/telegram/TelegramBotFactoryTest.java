package me.golemcore.imbot.adapter.inbound.telegram;

import me.golemcore.imbot.domain.model.BotException;
import me.golemcore.imbot.domain.model.ErrorCode;
import me.golemcore.imbot.domain.model.Platform;
import me.golemcore.imbot.domain.model.config.AuthConfig;
import me.golemcore.imbot.domain.model.config.AuthType;
import me.golemcore.imbot.domain.model.config.BotConfig;
import me.golemcore.imbot.infrastructure.config.ImbotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;

class TelegramBotFactoryTest {

    private TelegramBotFactory factory;

    @BeforeEach
    void setUp() {
        factory = new TelegramBotFactory(new ImbotProperties(), mock(TelegramBotsLongPollingApplication.class),
                Clock.systemUTC());
    }

    @Test
    void shouldCreateBotForTokenAuth() {
        BotConfig config = BotConfig.builder()
                .platform(Platform.TELEGRAM)
                .auth(AuthConfig.builder().type(AuthType.TOKEN).token("123:abc").build())
                .build();

        TelegramBot bot = assertInstanceOf(TelegramBot.class, factory.create(config));

        assertEquals(Platform.TELEGRAM, factory.getPlatform());
        assertFalse(bot.isConnected());
    }

    @Test
    void shouldRejectNonTokenAuth() {
        BotConfig config = BotConfig.builder()
                .platform(Platform.TELEGRAM)
                .auth(AuthConfig.builder().type(AuthType.BASIC).username("u").password("p").build())
                .build();

        BotException error = assertThrows(BotException.class, () -> factory.create(config));

        assertEquals(ErrorCode.AUTH_FAILED, error.getCode());
        assertEquals("telegram requires token auth", error.getDetail());
        assertEquals(Platform.TELEGRAM, error.getPlatform());
    }
}
