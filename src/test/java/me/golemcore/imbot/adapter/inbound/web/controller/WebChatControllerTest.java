package me.golemcore.imbot.adapter.inbound.web.controller;

import me.golemcore.imbot.adapter.inbound.web.dto.ChatSessionDto;
import me.golemcore.imbot.adapter.inbound.webchat.WebChatBot;
import me.golemcore.imbot.adapter.inbound.webchat.WebChatSession;
import me.golemcore.imbot.domain.model.Platform;
import me.golemcore.imbot.domain.service.BotManager;
import me.golemcore.imbot.domain.service.MessageCache;
import me.golemcore.imbot.domain.service.MessageHistoryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WebChatControllerTest {

    private static final long NOW = 1_700_000_000L;

    private BotManager botManager;
    private WebChatBot bot;
    private WebChatController controller;
    private MessageHistoryService history;

    @BeforeEach
    void setUp() {
        botManager = mock(BotManager.class);
        bot = mock(WebChatBot.class);
        history = new MessageHistoryService(null, new MessageCache(10), Runnable::run);
        controller = new WebChatController(botManager, Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC));
    }

    @Test
    void shouldReportHealth() {
        StepVerifier.create(controller.health())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("ok", response.getBody().getStatus());
                    assertEquals("webchat", response.getBody().getPlatform());
                    assertEquals(NOW, response.getBody().getTimestamp());
                })
                .verifyComplete();
    }

    @Test
    void shouldListSessionsOldestFirst() {
        WebChatSession newer = session("sess_b", NOW + 10);
        WebChatSession older = session("sess_a", NOW);
        when(botManager.getBots(Platform.WEBCHAT)).thenReturn(List.of(bot));
        when(bot.getSessions()).thenReturn(List.of(newer, older));

        StepVerifier.create(controller.listSessions())
                .assertNext(response -> {
                    assertEquals(2, response.getBody().getCount());
                    assertEquals(List.of("sess_a", "sess_b"), response.getBody().getSessions().stream()
                            .map(ChatSessionDto::getId)
                            .toList());
                    assertEquals(NOW, response.getBody().getSessions().get(0).getCreatedAt());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnSingleSession() {
        WebChatSession session = session("sess_a", NOW);
        when(botManager.getBots(Platform.WEBCHAT)).thenReturn(List.of(bot));
        when(bot.getSession("sess_a")).thenReturn(Optional.of(session));

        StepVerifier.create(controller.getSession("sess_a"))
                .assertNext(response -> {
                    assertEquals("sess_a", response.getBody().getId());
                    assertEquals("user_1", response.getBody().getSenderId());
                    assertEquals("Alice", response.getBody().getSenderName());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectUnknownSession() {
        when(botManager.getBots(Platform.WEBCHAT)).thenReturn(List.of(bot));
        when(bot.getSession("missing")).thenReturn(Optional.empty());

        ResponseStatusException error = assertThrows(ResponseStatusException.class,
                () -> controller.getSession("missing"));

        assertEquals(HttpStatus.NOT_FOUND, error.getStatusCode());
        assertEquals("Session not found", error.getReason());
    }

    @Test
    void shouldReportUnavailableWithoutWebChatBot() {
        when(botManager.getBots(Platform.WEBCHAT)).thenReturn(List.of());

        ResponseStatusException error = assertThrows(ResponseStatusException.class,
                () -> controller.listSessions());

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, error.getStatusCode());
    }

    private WebChatSession session(String id, long createdAt) {
        Clock clock = Clock.fixed(Instant.ofEpochSecond(createdAt), ZoneOffset.UTC);
        return new WebChatSession(id, "user_1", "Alice", 4, null, history, clock);
    }
}
