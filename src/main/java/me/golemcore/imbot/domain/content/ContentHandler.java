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

import me.golemcore.imbot.domain.model.content.Content;

/**
 * Converts one kind of platform payload into a {@link Content} variant.
 *
 * @param <R>
 *            platform-specific raw payload type
 */
public interface ContentHandler<R> {

    /**
     * Name used in diagnostics, e.g. {@code text} or {@code media:image}.
     */
    String getName();

    boolean canHandle(R raw);

    /**
     * Produces the content. Called only after {@link #canHandle(Object)}
     * returned {@code true}; may throw when conversion fails.
     */
    Content handle(R raw);
}
