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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed failure raised by bots, the manager and content adapters.
 *
 * <p>
 * Every instance carries an {@link ErrorCode} from the closed taxonomy, the
 * originating platform when known, and a recoverable flag telling callers
 * whether a retry is reasonable. Structured details such as the retry-after
 * delay live in {@link #getContext()}.
 */
public class BotException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode code;
    private final String detail;
    private final boolean recoverable;
    private final Map<String, Object> context = new LinkedHashMap<>();
    private Platform platform;
    private Throwable wrapped;

    public BotException(ErrorCode code, String detail, boolean recoverable) {
        super(detail);
        this.code = code;
        this.detail = detail;
        this.recoverable = recoverable;
    }

    public static BotException authFailed(String detail) {
        return new BotException(ErrorCode.AUTH_FAILED, detail, false);
    }

    public static BotException connectionFailed(String detail) {
        return new BotException(ErrorCode.CONNECTION_FAILED, detail, true);
    }

    public static BotException rateLimited(long retryAfterSeconds) {
        return new BotException(ErrorCode.RATE_LIMITED, "rate limited, retry after " + retryAfterSeconds + "s", true)
                .withContext("retryAfter", retryAfterSeconds);
    }

    public static BotException messageTooLong(int length, int limit) {
        return new BotException(ErrorCode.MESSAGE_TOO_LONG,
                "message too long: " + length + " characters (max " + limit + ")", true)
                .withContext("length", length)
                .withContext("limit", limit);
    }

    public static BotException invalidTarget(String target) {
        return new BotException(ErrorCode.INVALID_TARGET, "invalid target: " + target, false)
                .withContext("target", target);
    }

    public static BotException mediaNotSupported(String mediaType) {
        return new BotException(ErrorCode.MEDIA_NOT_SUPPORTED, "media type not supported: " + mediaType, false)
                .withContext("mediaType", mediaType);
    }

    public static BotException platformError(String detail, Throwable cause) {
        return new BotException(ErrorCode.PLATFORM_ERROR, detail, false).withCause(cause);
    }

    public static BotException timeout(String operation, long durationMs) {
        return new BotException(ErrorCode.TIMEOUT,
                "operation " + operation + " timed out after " + durationMs + "ms", true)
                .withContext("operation", operation)
                .withContext("durationMs", durationMs);
    }

    public static BotException unknown(String detail, Throwable cause) {
        return new BotException(ErrorCode.UNKNOWN, detail, false).withCause(cause);
    }

    /**
     * Converts any failure into a {@code BotException}. Returns {@code null} for
     * {@code null} and the same instance for an existing {@code BotException}.
     */
    public static BotException wrap(Throwable error, Platform platform) {
        if (error == null) {
            return null;
        }
        if (error instanceof BotException botException) {
            return botException;
        }
        return unknown(error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName(), error)
                .withPlatform(platform);
    }

    public static boolean isRecoverable(Throwable error) {
        return error instanceof BotException botException && botException.isRecoverable();
    }

    public static ErrorCode codeOf(Throwable error) {
        if (error instanceof BotException botException) {
            return botException.getCode();
        }
        return ErrorCode.UNKNOWN;
    }

    public BotException withContext(String key, Object value) {
        context.put(key, value);
        return this;
    }

    public BotException withCause(Throwable cause) {
        this.wrapped = cause;
        return this;
    }

    public BotException withPlatform(Platform platform) {
        this.platform = platform;
        return this;
    }

    @Override
    public synchronized Throwable getCause() {
        return wrapped;
    }

    @Override
    public String getMessage() {
        if (platform != null) {
            return "[" + platform.getId() + "] " + code + ": " + detail;
        }
        return code + ": " + detail;
    }

    public ErrorCode getCode() {
        return code;
    }

    public String getDetail() {
        return detail;
    }

    public boolean isRecoverable() {
        return recoverable;
    }

    public Platform getPlatform() {
        return platform;
    }

    public Map<String, Object> getContext() {
        return Collections.unmodifiableMap(context);
    }
}
