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

import me.golemcore.imbot.domain.model.MediaType;

import java.util.List;
import java.util.Map;

/**
 * Shorthand constructors for the content variants.
 */
public final class Contents {

    private Contents() {
    }

    public static TextContent text(String text) {
        return TextContent.builder().text(text).build();
    }

    public static MediaContent media(List<MediaAttachment> media, String caption) {
        return MediaContent.builder().media(media).caption(caption).build();
    }

    public static MediaContent image(String url, String caption) {
        return media(List.of(MediaAttachment.builder().type(MediaType.IMAGE).url(url).build()), caption);
    }

    public static PollContent poll(String question, List<String> options) {
        PollContent.PollContentBuilder builder = PollContent.builder().question(question);
        for (int i = 0; i < options.size(); i++) {
            builder.option(PollOption.builder().id(String.valueOf(i)).text(options.get(i)).build());
        }
        return builder.build();
    }

    public static ReactionContent reaction(String messageId, String emoji, String userId) {
        return ReactionContent.builder()
                .messageId(messageId)
                .emoji(emoji)
                .action(ReactionContent.Action.ADD)
                .userId(userId)
                .build();
    }

    public static SystemContent system(String eventType, Map<String, Object> data) {
        return SystemContent.builder().eventType(eventType).data(data).build();
    }
}
