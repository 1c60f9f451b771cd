package me.golemcore.imbot.domain.model.content;

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

/**
 * Discriminant of the closed {@link Content} variant set. Persistence stores
 * {@link #getValue()} next to the serialized payload.
 */
public enum ContentType {

    TEXT("text", TextContent.class),
    MEDIA("media", MediaContent.class),
    POLL("poll", PollContent.class),
    REACTION("reaction", ReactionContent.class),
    SYSTEM("system", SystemContent.class);

    private final String value;
    private final Class<? extends Content> contentClass;

    ContentType(String value, Class<? extends Content> contentClass) {
        this.value = value;
        this.contentClass = contentClass;
    }

    public String getValue() {
        return value;
    }

    public Class<? extends Content> getContentClass() {
        return contentClass;
    }

    public static ContentType fromValue(String value) {
        for (ContentType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown content type: " + value);
    }
}
