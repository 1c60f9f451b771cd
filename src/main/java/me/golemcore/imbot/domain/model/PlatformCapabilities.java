package me.golemcore.imbot.domain.model;

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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Describes what a platform can carry. The base bot runtime reads
 * {@link #textLimit} for length validation and chunking.
 */
@Value
@Builder
public class PlatformCapabilities {

    public static final String FEATURE_REACTIONS = "reactions";
    public static final String FEATURE_EDIT = "edit";
    public static final String FEATURE_DELETE = "delete";
    public static final String FEATURE_THREADS = "threads";
    public static final String FEATURE_POLLS = "polls";

    @Singular
    Set<ChatType> chatTypes;
    @Singular
    Set<MediaType> mediaTypes;
    @Singular
    Set<String> features;

    /** Maximum text length in UTF-16 code units, 0 when unlimited. */
    int textLimit;

    /** Messages per minute, 0 when unknown. */
    int rateLimit;

    public boolean supportsFeature(String feature) {
        return features.contains(feature);
    }

    public boolean supportsMediaType(MediaType mediaType) {
        return mediaTypes.contains(mediaType);
    }

    public boolean supportsChatType(ChatType chatType) {
        return chatTypes.contains(chatType);
    }
}
