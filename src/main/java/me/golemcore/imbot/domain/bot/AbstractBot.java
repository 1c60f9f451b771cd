package me.golemcore.imbot.domain.bot;

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

import me.golemcore.imbot.domain.model.BotException;
import me.golemcore.imbot.domain.model.BotStatus;
import me.golemcore.imbot.domain.model.ConnectionDetails;
import me.golemcore.imbot.domain.model.ConnectionMode;
import me.golemcore.imbot.domain.model.ErrorCode;
import me.golemcore.imbot.domain.model.Message;
import me.golemcore.imbot.domain.model.Platform;
import me.golemcore.imbot.domain.model.PlatformInfo;
import me.golemcore.imbot.domain.model.config.BotConfig;
import me.golemcore.imbot.port.inbound.Bot;
import org.slf4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * Shared runtime for {@link Bot} implementations.
 *
 * <p>
 * Provides:
 * <ul>
 * <li>status storage guarded by a read/write lock, handed out as copies</li>
 * <li>ordered handler lists per event kind</li>
 * <li>event emission that runs every handler as its own task on the event
 * executor and logs handler failures instead of propagating them</li>
 * <li>text length validation and chunking against the platform limit</li>
 * </ul>
 *
 * <p>
 * Subclasses implement the transport and drive the status through
 * {@link #updateConnected(boolean)}, {@link #updateAuthenticated(boolean)} and
 * {@link #updateReady(boolean)}.
 */
public abstract class AbstractBot implements Bot {

    private static final ExecutorService DEFAULT_EVENT_EXECUTOR = Executors.newCachedThreadPool(daemonThreads());

    protected final BotConfig config;
    protected final Platform platform;
    protected final Logger botLog;
    protected final Clock clock;

    private final Executor eventExecutor;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final BotStatus status;
    private final List<Consumer<Message>> messageHandlers = new ArrayList<>();
    private final List<Consumer<BotException>> errorHandlers = new ArrayList<>();
    private final List<Runnable> connectedHandlers = new ArrayList<>();
    private final List<Runnable> disconnectedHandlers = new ArrayList<>();
    private final List<Runnable> readyHandlers = new ArrayList<>();

    protected AbstractBot(BotConfig config, ConnectionMode mode) {
        this(config, mode, DEFAULT_EVENT_EXECUTOR, Clock.systemUTC());
    }

    protected AbstractBot(BotConfig config, ConnectionMode mode, Executor eventExecutor, Clock clock) {
        this.config = config;
        this.platform = config.getPlatform();
        this.botLog = BotLoggers.forPlatform(platform, config.getLogging());
        this.eventExecutor = eventExecutor;
        this.clock = clock;
        this.status = BotStatus.builder()
                .connectionDetails(ConnectionDetails.builder().mode(mode).build())
                .build();
    }

    @Override
    public Platform getPlatform() {
        return platform;
    }

    @Override
    public BotConfig getConfig() {
        return config;
    }

    @Override
    public boolean isConnected() {
        lock.readLock().lock();
        try {
            return status.isConnected();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean isReady() {
        lock.readLock().lock();
        try {
            return status.isReady();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public BotStatus getStatus() {
        lock.readLock().lock();
        try {
            return status.copy();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public PlatformInfo getPlatformInfo() {
        return PlatformInfo.builder()
                .platform(platform)
                .name(platform.getDisplayName())
                .version("1.0")
                .capabilities(platform.getCapabilities())
                .build();
    }

    // ==================== Status ====================

    protected void updateConnected(boolean connected) {
        lock.writeLock().lock();
        try {
            status.setConnected(connected);
            if (connected) {
                status.getConnectionDetails().setConnectedAt(clock.instant());
                status.getConnectionDetails().setReconnectAttempts(0);
            } else {
                status.setAuthenticated(false);
                status.setReady(false);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    protected void updateAuthenticated(boolean authenticated) {
        lock.writeLock().lock();
        try {
            status.setAuthenticated(authenticated);
        } finally {
            lock.writeLock().unlock();
        }
    }

    protected void updateReady(boolean ready) {
        lock.writeLock().lock();
        try {
            status.setReady(ready);
        } finally {
            lock.writeLock().unlock();
        }
    }

    protected void updateLastActivity() {
        lock.writeLock().lock();
        try {
            status.setLastActivity(clock.instant());
        } finally {
            lock.writeLock().unlock();
        }
    }

    protected void updateConnectionUrl(String url) {
        lock.writeLock().lock();
        try {
            status.getConnectionDetails().setUrl(url);
        } finally {
            lock.writeLock().unlock();
        }
    }

    protected void setError(String error) {
        lock.writeLock().lock();
        try {
            status.setError(error);
        } finally {
            lock.writeLock().unlock();
        }
    }

    protected void clearError() {
        setError(null);
    }

    /**
     * Records a failed connection attempt: stores the error, bumps the attempt
     * counter and notifies error handlers.
     */
    protected void connectionAttemptFailed(BotException error) {
        lock.writeLock().lock();
        try {
            status.setError(error.getMessage());
            ConnectionDetails details = status.getConnectionDetails();
            details.setReconnectAttempts(details.getReconnectAttempts() + 1);
        } finally {
            lock.writeLock().unlock();
        }
        emitError(error);
    }

    /**
     * Guard for every outbound operation.
     *
     * @throws BotException
     *             {@code CONNECTION_FAILED} when the bot is not ready
     */
    protected void ensureReady() {
        if (!isReady()) {
            throw new BotException(ErrorCode.CONNECTION_FAILED, "bot is not ready", false).withPlatform(platform);
        }
    }

    protected Instant now() {
        return clock.instant();
    }

    // ==================== Text limits ====================

    protected int textLimit() {
        return getPlatformInfo().getCapabilities().getTextLimit();
    }

    /**
     * @throws BotException
     *             {@code MESSAGE_TOO_LONG} with {@code length} and {@code limit}
     *             context when the text exceeds the platform limit
     */
    public void validateTextLength(String text) {
        int limit = textLimit();
        if (text != null && limit > 0 && text.length() > limit) {
            throw BotException.messageTooLong(text.length(), limit).withPlatform(platform);
        }
    }

    public List<String> chunkText(String text) {
        return TextChunker.chunk(text, textLimit());
    }

    // ==================== Handlers ====================

    @Override
    public void onMessage(Consumer<Message> handler) {
        register(messageHandlers, handler);
    }

    @Override
    public void onError(Consumer<BotException> handler) {
        register(errorHandlers, handler);
    }

    @Override
    public void onConnected(Runnable handler) {
        register(connectedHandlers, handler);
    }

    @Override
    public void onDisconnected(Runnable handler) {
        register(disconnectedHandlers, handler);
    }

    @Override
    public void onReady(Runnable handler) {
        register(readyHandlers, handler);
    }

    protected void clearHandlers() {
        lock.writeLock().lock();
        try {
            messageHandlers.clear();
            errorHandlers.clear();
            connectedHandlers.clear();
            disconnectedHandlers.clear();
            readyHandlers.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    protected void emitMessage(Message message) {
        updateLastActivity();
        for (Consumer<Message> handler : snapshot(messageHandlers)) {
            dispatch("message", () -> handler.accept(message));
        }
    }

    protected void emitError(BotException error) {
        for (Consumer<BotException> handler : snapshot(errorHandlers)) {
            dispatch("error", () -> handler.accept(error));
        }
    }

    protected void emitConnected() {
        snapshot(connectedHandlers).forEach(handler -> dispatch("connected", handler));
    }

    protected void emitDisconnected() {
        snapshot(disconnectedHandlers).forEach(handler -> dispatch("disconnected", handler));
    }

    protected void emitReady() {
        snapshot(readyHandlers).forEach(handler -> dispatch("ready", handler));
    }

    @Override
    public void close() {
        clearHandlers();
        if (isConnected()) {
            disconnect();
        }
    }

    private <T> void register(List<T> handlers, T handler) {
        lock.writeLock().lock();
        try {
            handlers.add(handler);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> List<T> snapshot(List<T> handlers) {
        lock.readLock().lock();
        try {
            return new ArrayList<>(handlers);
        } finally {
            lock.readLock().unlock();
        }
    }

    private void dispatch(String event, Runnable handler) {
        try {
            eventExecutor.execute(() -> {
                try {
                    handler.run();
                } catch (RuntimeException e) { // NOSONAR - handler faults stay at the emission boundary
                    botLog.error("[{}] {} handler failed: {}", platform.getId(), event, e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            botLog.warn("[{}] {} event dropped, executor rejected task: {}", platform.getId(), event, e.getMessage());
        }
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "imbot-event-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
