package me.golemcore.imbot.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.imbot.adapter.inbound.web.dto.ChatSessionDto;
import me.golemcore.imbot.adapter.inbound.web.dto.ChatSessionsResponse;
import me.golemcore.imbot.adapter.inbound.web.dto.HealthResponse;
import me.golemcore.imbot.adapter.inbound.webchat.WebChatBot;
import me.golemcore.imbot.adapter.inbound.webchat.WebChatSession;
import me.golemcore.imbot.domain.model.Platform;
import me.golemcore.imbot.domain.service.BotManager;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Health and session introspection for the web chat platform.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class WebChatController {

    private final BotManager botManager;
    private final Clock clock;

    @GetMapping("/health")
    public Mono<ResponseEntity<HealthResponse>> health() {
        HealthResponse response = HealthResponse.builder()
                .status("ok")
                .platform(Platform.WEBCHAT.getId())
                .timestamp(clock.instant().getEpochSecond())
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    @GetMapping("/sessions")
    public Mono<ResponseEntity<ChatSessionsResponse>> listSessions() {
        List<ChatSessionDto> sessions = requireBot().getSessions().stream()
                .sorted(Comparator.comparing(WebChatSession::getCreatedAt))
                .map(this::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(ChatSessionsResponse.builder()
                .sessions(sessions)
                .count(sessions.size())
                .build()));
    }

    @GetMapping("/sessions/{id}")
    public Mono<ResponseEntity<ChatSessionDto>> getSession(@PathVariable String id) {
        WebChatSession session = requireBot().getSession(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found"));
        return Mono.just(ResponseEntity.ok(toDto(session)));
    }

    private Optional<WebChatBot> findBot() {
        return botManager.getBots(Platform.WEBCHAT).stream()
                .filter(WebChatBot.class::isInstance)
                .map(WebChatBot.class::cast)
                .findFirst();
    }

    private WebChatBot requireBot() {
        return findBot().orElseThrow(
                () -> new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Web chat is not configured"));
    }

    private ChatSessionDto toDto(WebChatSession session) {
        return ChatSessionDto.builder()
                .id(session.getId())
                .senderId(session.getSenderId())
                .senderName(session.getSenderName())
                .createdAt(session.getCreatedAt().getEpochSecond())
                .lastActive(session.getLastActive().getEpochSecond())
                .build();
    }
}
