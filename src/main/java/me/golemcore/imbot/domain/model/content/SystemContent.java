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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Platform-native or unrecognized event. Adapters use event type
 * {@link #UNKNOWN} with the raw payload type kept under {@code rawType}.
 */
@Value
@Builder
@Jacksonized
public class SystemContent implements Content {

    public static final String UNKNOWN = "unknown";

    String eventType;
    @Singular("dataEntry")
    Map<String, Object> data;

    @Override
    public ContentType contentType() {
        return ContentType.SYSTEM;
    }
}
