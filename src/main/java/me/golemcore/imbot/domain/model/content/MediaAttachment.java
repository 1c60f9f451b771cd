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
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import me.golemcore.imbot.domain.model.MediaType;

/**
 * One attachment. {@code url} holds either a public URL or a platform content
 * key (Telegram file id, Feishu image key).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MediaAttachment {
    MediaType type;
    String url;
    String mimeType;
    String filename;
    long size;
    String thumbnail;
    int width;
    int height;
    /** Seconds. */
    int duration;
    Object raw;
}
