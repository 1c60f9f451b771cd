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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.imbot.domain.model.BotException;
import me.golemcore.imbot.domain.model.Platform;
import me.golemcore.imbot.domain.model.content.Content;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered pipeline that classifies a raw platform payload into exactly one
 * {@link Content} variant.
 *
 * <p>
 * Handlers are tried in registration order; the first one that can handle the
 * payload wins. When none matches, the default handler runs, so unrecognized
 * input degrades to a diagnosable system event instead of failing.
 *
 * @param <R>
 *            platform-specific raw payload type
 */
@Slf4j
public class ContentRegistry<R> {

    private final Platform platform;
    private final List<ContentHandler<R>> handlers = new CopyOnWriteArrayList<>();
    private volatile ContentHandler<R> defaultHandler = ContentHandlers.unknown();

    public ContentRegistry(Platform platform) {
        this.platform = platform;
    }

    public ContentRegistry<R> register(ContentHandler<R> handler) {
        handlers.add(handler);
        return this;
    }

    public ContentRegistry<R> setDefault(ContentHandler<R> handler) {
        this.defaultHandler = handler;
        return this;
    }

    /**
     * @throws BotException
     *             {@code PLATFORM_ERROR} naming the failing handler when a
     *             handler cannot inspect or convert the payload
     */
    public Content handle(R raw) {
        for (ContentHandler<R> handler : handlers) {
            if (matches(handler, raw)) {
                return convert(handler, raw);
            }
        }
        log.debug("[ContentRegistry] No handler matched {} payload on {}, using {}",
                raw != null ? raw.getClass().getSimpleName() : "null", platform.getId(), defaultHandler.getName());
        return convert(defaultHandler, raw);
    }

    public List<String> getHandlerNames() {
        return handlers.stream().map(ContentHandler::getName).toList();
    }

    private boolean matches(ContentHandler<R> handler, R raw) {
        try {
            return handler.canHandle(raw);
        } catch (BotException e) {
            throw e;
        } catch (RuntimeException e) {
            throw handlerFailure(handler, e);
        }
    }

    private Content convert(ContentHandler<R> handler, R raw) {
        Content content;
        try {
            content = handler.handle(raw);
        } catch (BotException e) {
            throw e;
        } catch (RuntimeException e) {
            throw handlerFailure(handler, e);
        }
        if (content == null) {
            throw BotException.platformError("handler " + handler.getName() + " produced no content", null)
                    .withPlatform(platform)
                    .withContext("handler", handler.getName());
        }
        return content;
    }

    private BotException handlerFailure(ContentHandler<R> handler, RuntimeException cause) {
        return BotException.platformError("handler " + handler.getName() + " failed: " + cause.getMessage(), cause)
                .withPlatform(platform)
                .withContext("handler", handler.getName());
    }
}
