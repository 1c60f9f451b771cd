package me.golemcore.imbot.adapter.inbound.web.controller;

import me.golemcore.imbot.domain.model.BotStatus;
import me.golemcore.imbot.domain.service.BotManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BotsControllerTest {

    private BotManager botManager;
    private BotsController controller;

    @BeforeEach
    void setUp() {
        botManager = mock(BotManager.class);
        controller = new BotsController(botManager);
    }

    @Test
    void shouldReturnStatusOfEveryBot() {
        BotStatus webchat = BotStatus.builder().connected(true).ready(true).build();
        BotStatus telegram = BotStatus.builder().error("unauthorized").build();
        when(botManager.getStatus()).thenReturn(Map.of("webchat:0", webchat, "telegram:0", telegram));

        StepVerifier.create(controller.status())
                .assertNext(response -> {
                    assertEquals(2, response.getBody().size());
                    assertTrue(response.getBody().get("webchat:0").isReady());
                    assertEquals("unauthorized", response.getBody().get("telegram:0").getError());
                })
                .verifyComplete();
    }
}
