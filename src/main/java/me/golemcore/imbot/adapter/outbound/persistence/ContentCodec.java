package me.golemcore.imbot.adapter.outbound.persistence;

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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.imbot.domain.model.content.Content;
import me.golemcore.imbot.domain.model.content.ContentType;
import me.golemcore.imbot.domain.model.content.MediaContent;
import me.golemcore.imbot.domain.model.content.PollContent;
import me.golemcore.imbot.domain.model.content.ReactionContent;
import me.golemcore.imbot.domain.model.content.SystemContent;
import me.golemcore.imbot.domain.model.content.TextContent;

import java.util.Map;

/**
 * JSON form of content payloads and metadata as stored in the
 * {@code content_data} and {@code metadata} columns.
 */
public class ContentCodec {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ContentCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(Content content) {
        return write(content);
    }

    public Content decode(ContentType type, String json) throws JsonProcessingException {
        return switch (type) {
        case TEXT -> objectMapper.readValue(json, TextContent.class);
        case MEDIA -> objectMapper.readValue(json, MediaContent.class);
        case POLL -> objectMapper.readValue(json, PollContent.class);
        case REACTION -> objectMapper.readValue(json, ReactionContent.class);
        case SYSTEM -> objectMapper.readValue(json, SystemContent.class);
        };
    }

    public String encodeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        return write(metadata);
    }

    public Map<String, Object> decodeMetadata(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        return objectMapper.readValue(json, METADATA_TYPE);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
