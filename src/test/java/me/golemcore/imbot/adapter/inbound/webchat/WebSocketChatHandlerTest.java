package me.golemcore.imbot.adapter.inbound.webchat;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.imbot.domain.model.Platform;
import me.golemcore.imbot.domain.service.BotManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.URI;
import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSocketChatHandlerTest {

    private BotManager botManager;
    private WebSocketChatHandler handler;

    @BeforeEach
    void setUp() {
        botManager = mock(BotManager.class);
        handler = new WebSocketChatHandler(botManager, new ObjectMapper(), Clock.systemUTC());
    }

    @Test
    void shouldCloseSocketWhenNoWebChatBotIsReady() {
        WebSocketSession socket = mock(WebSocketSession.class);
        when(botManager.getBots(Platform.WEBCHAT)).thenReturn(List.of());
        when(socket.close(CloseStatus.SERVICE_RESTARTED)).thenReturn(Mono.empty());

        StepVerifier.create(handler.handle(socket)).verifyComplete();

        verify(socket).close(CloseStatus.SERVICE_RESTARTED);
    }

    @Test
    void shouldReadSessionIdFromQuery() {
        assertEquals("sess_42", WebSocketChatHandler.queryParam(URI.create("ws://localhost/ws?session_id=sess_42"),
                "session_id"));
        assertEquals("sess_1", WebSocketChatHandler.queryParam(URI.create("ws://localhost/ws?a=b&session_id=sess_1"),
                "session_id"));
    }

    @Test
    void shouldReturnNullWithoutQuery() {
        assertNull(WebSocketChatHandler.queryParam(URI.create("ws://localhost/ws"), "session_id"));
        assertNull(WebSocketChatHandler.queryParam(URI.create("ws://localhost/ws?other=1"), "session_id"));
    }
}
