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
import me.golemcore.imbot.domain.model.BotStatus;
import me.golemcore.imbot.domain.service.BotManager;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Status of every registered bot, keyed by {@code platform:index}.
 */
@RestController
@RequestMapping("/api/bots")
@RequiredArgsConstructor
public class BotsController {

    private final BotManager botManager;

    @GetMapping
    public Mono<ResponseEntity<Map<String, BotStatus>>> status() {
        return Mono.just(ResponseEntity.ok(botManager.getStatus()));
    }
}
