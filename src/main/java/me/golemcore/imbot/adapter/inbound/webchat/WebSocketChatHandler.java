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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.imbot.adapter.inbound.webchat.dto.ChatFrame;
import me.golemcore.imbot.domain.model.ClientInfo;
import me.golemcore.imbot.domain.model.Message;
import me.golemcore.imbot.domain.model.Platform;
import me.golemcore.imbot.domain.service.BotManager;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.InetSocketAddress;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Reactive socket endpoint of the web chat platform.
 *
 * <p>
 * Each connection opens a {@link WebChatSession} and runs two loops: the read
 * loop adapts incoming frames through the bot, the write loop drains the
 * session buffer and sends keepalive pings. Whichever loop ends first closes
 * the session. A read idle longer than the configured timeout ends the read
 * loop; pongs count as activity.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSocketChatHandler implements WebSocketHandler {

    private static final String SESSION_PARAM = "session_id";

    private final BotManager botManager;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public Mono<Void> handle(WebSocketSession socket) {
        Optional<WebChatBot> webChatBot = findReadyBot();
        if (webChatBot.isEmpty()) {
            log.warn("[WebSocket] Connection rejected: web chat bot is not ready");
            return socket.close(CloseStatus.SERVICE_RESTARTED);
        }
        WebChatBot bot = webChatBot.get();
        WebChatSettings settings = bot.getSettings();
        WebChatSession chat = bot.openSession(queryParam(socket.getHandshakeInfo().getUri(), SESSION_PARAM),
                clientInfo(socket));
        int replayed = chat.sendHistory(settings.historyLimit());
        log.info("[WebSocket] Connection established: session={}, replayed={}", chat.getId(), replayed);

        Duration pingInterval = settings.pingInterval();
        Flux<WebSocketMessage> frames = chat.outbound()
                .map(message -> socket.textMessage(encode(bot, message)));
        Flux<WebSocketMessage> pings = Flux.interval(pingInterval, pingInterval)
                .map(tick -> socket.pingMessage(factory -> factory.wrap(new byte[0])))
                .takeUntilOther(chat.onClose());
        Mono<Void> output = socket.send(Flux.merge(frames, pings));

        Mono<Void> input = socket.receive()
                .timeout(settings.readTimeout())
                .doOnNext(frame -> handleFrame(bot, chat, frame))
                .then();

        return Mono.firstWithSignal(input, output)
                .onErrorResume(e -> {
                    log.debug("[WebSocket] Session {} loop ended with error: {}", chat.getId(), e.getMessage());
                    return Mono.empty();
                })
                .doFinally(signal -> {
                    log.info("[WebSocket] Connection closed: session={}, signal={}", chat.getId(), signal);
                    bot.removeSession(chat.getId());
                });
    }

    private void handleFrame(WebChatBot bot, WebChatSession chat, WebSocketMessage frame) {
        switch (frame.getType()) {
        case TEXT -> {
            try {
                ChatFrame chatFrame = objectMapper.readValue(frame.getPayloadAsText(), ChatFrame.class);
                bot.handleIncomingMessage(chat.getId(), chatFrame);
            } catch (JsonProcessingException | RuntimeException e) { // NOSONAR
                log.warn("[WebSocket] Failed to process frame from session {}: {}", chat.getId(), e.getMessage());
            }
        }
        case PONG, PING -> chat.touch();
        case BINARY -> log.debug("[WebSocket] Ignoring binary frame from session {}", chat.getId());
        }
    }

    private String encode(WebChatBot bot, Message message) {
        try {
            return objectMapper.writeValueAsString(bot.getMessageAdapter().toFrame(message));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize message " + message.getId(), e);
        }
    }

    private Optional<WebChatBot> findReadyBot() {
        return botManager.getBots(Platform.WEBCHAT).stream()
                .filter(WebChatBot.class::isInstance)
                .map(WebChatBot.class::cast)
                .filter(WebChatBot::isReady)
                .findFirst();
    }

    private ClientInfo clientInfo(WebSocketSession socket) {
        HttpHeaders headers = socket.getHandshakeInfo().getHeaders();
        InetSocketAddress remote = socket.getHandshakeInfo().getRemoteAddress();
        return ClientInfo.builder()
                .userAgent(headers.getFirst(HttpHeaders.USER_AGENT))
                .ipAddress(remote != null && remote.getAddress() != null ? remote.getAddress().getHostAddress() : null)
                .connectTime(clock.instant().getEpochSecond())
                .build();
    }

    static String queryParam(URI uri, String name) {
        String query = uri.getQuery();
        if (query == null) {
            return null;
        }
        return UriComponentsBuilder.newInstance()
                .query(query)
                .build()
                .getQueryParams()
                .getFirst(name);
    }
}
