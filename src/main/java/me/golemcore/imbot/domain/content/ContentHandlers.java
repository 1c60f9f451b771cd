package me.golemcore.imbot.domain.content;

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
import me.golemcore.imbot.domain.model.content.Content;
import me.golemcore.imbot.domain.model.content.MediaContent;
import me.golemcore.imbot.domain.model.content.PollContent;
import me.golemcore.imbot.domain.model.content.SystemContent;
import me.golemcore.imbot.domain.model.content.TextContent;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Built-in handler kinds. Each one wraps an extractor closure that returns
 * {@link Optional#empty()} when the payload is not of its kind.
 */
public final class ContentHandlers {

    private ContentHandlers() {
    }

    public static <R> ContentHandler<R> text(Function<R, Optional<TextContent>> extractor) {
        return new ExtractingHandler<>("text", extractor);
    }

    public static <R> ContentHandler<R> media(MediaType mediaType, Function<R, Optional<MediaContent>> extractor) {
        return new ExtractingHandler<R, MediaContent>("media:" + mediaType.getValue(), extractor) {
            @Override
            protected Content validate(MediaContent content) {
                if (content.getMedia().isEmpty()) {
                    throw new IllegalStateException("no media found");
                }
                return content;
            }
        };
    }

    public static <R> ContentHandler<R> poll(Function<R, Optional<PollContent>> extractor) {
        return new ExtractingHandler<>("poll", extractor);
    }

    public static <R> ContentHandler<R> system(String eventType, Function<R, Optional<Map<String, Object>>> extractor) {
        return new ExtractingHandler<R, SystemContent>("system:" + eventType,
                raw -> extractor.apply(raw).map(data -> SystemContent.builder().eventType(eventType).data(data).build()));
    }

    /**
     * Groups handlers under one name; the first capable member handles the
     * payload.
     */
    @SafeVarargs
    public static <R> ContentHandler<R> compound(String name, ContentHandler<R>... handlers) {
        List<ContentHandler<R>> members = List.of(handlers);
        return new ContentHandler<>() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public boolean canHandle(R raw) {
                return members.stream().anyMatch(handler -> handler.canHandle(raw));
            }

            @Override
            public Content handle(R raw) {
                for (ContentHandler<R> handler : members) {
                    if (handler.canHandle(raw)) {
                        return handler.handle(raw);
                    }
                }
                throw new IllegalStateException("no sub-handler could process content");
            }
        };
    }

    /**
     * Fallback producing a {@code System} content of type
     * {@value SystemContent#UNKNOWN} that records the raw payload type.
     */
    public static <R> ContentHandler<R> unknown() {
        return new ContentHandler<>() {
            @Override
            public String getName() {
                return SystemContent.UNKNOWN;
            }

            @Override
            public boolean canHandle(R raw) {
                return true;
            }

            @Override
            public Content handle(R raw) {
                return SystemContent.builder()
                        .eventType(SystemContent.UNKNOWN)
                        .dataEntry("rawType", raw != null ? raw.getClass().getName() : "null")
                        .build();
            }
        };
    }

    private static class ExtractingHandler<R, C extends Content> implements ContentHandler<R> {

        private final String name;
        private final Function<R, Optional<C>> extractor;

        ExtractingHandler(String name, Function<R, Optional<C>> extractor) {
            this.name = name;
            this.extractor = extractor;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public boolean canHandle(R raw) {
            return extractor.apply(raw).isPresent();
        }

        @Override
        public Content handle(R raw) {
            return validate(extractor.apply(raw)
                    .orElseThrow(() -> new IllegalStateException("payload no longer matches " + name)));
        }

        protected Content validate(C content) {
            return content;
        }
    }
}
