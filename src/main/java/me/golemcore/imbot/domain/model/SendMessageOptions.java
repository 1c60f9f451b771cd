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
import me.golemcore.imbot.domain.model.content.MediaAttachment;

import java.util.List;
import java.util.Map;

/**
 * Outbound send request. Either {@code text} or {@code media} must be present.
 */
@Value
@Builder
public class SendMessageOptions {
    String text;
    @Singular("attachment")
    List<MediaAttachment> media;
    /** Platform formatting hint, e.g. {@code HTML} or {@code Markdown}. */
    String parseMode;
    String replyTo;
    String threadId;
    boolean silent;
    boolean disablePreview;
    @Singular
    List<List<Button>> buttons;
    @Singular("metadataEntry")
    Map<String, Object> metadata;

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }

    public boolean hasMedia() {
        return !media.isEmpty();
    }
}
