package me.golemcore.imbot.domain.service;

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
import me.golemcore.imbot.domain.model.BotStatus;
import me.golemcore.imbot.domain.model.ErrorCode;
import me.golemcore.imbot.domain.model.Message;
import me.golemcore.imbot.domain.model.Platform;
import me.golemcore.imbot.domain.model.SendMessageOptions;
import me.golemcore.imbot.domain.model.SendResult;
import me.golemcore.imbot.domain.model.config.BotConfig;
import me.golemcore.imbot.domain.model.config.ManagerConfig;
import me.golemcore.imbot.port.inbound.Bot;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Orchestrates bots across platforms.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>registration of bots built through {@link PlatformRegistry}</li>
 * <li>fan-out of every bot event to the global handlers, tagged with the
 * originating platform</li>
 * <li>bounded auto-reconnect with a fixed delay between attempts</li>
 * <li>routed sends and broadcasts</li>
 * </ul>
 *
 * <p>
 * The manager owns one lifecycle signal. {@link #stop()} releases it, which
 * wakes every reconnect loop waiting on its delay, then waits for all
 * disconnects and reconnect loops to finish. Bot registries are guarded by the
 * manager's own lock and never by a bot's lock.
 */
@Slf4j
public class BotManager implements AutoCloseable {

    private final ManagerConfig config;
    private final PlatformRegistry platformRegistry;
    private final UnaryOperator<String> envResolver;
    private final ExecutorService workers;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<Platform, List<Bot>> bots = new EnumMap<>(Platform.class);

    private final List<BiConsumer<Message, Platform>> messageHandlers = new CopyOnWriteArrayList<>();
    private final List<BiConsumer<BotException, Platform>> errorHandlers = new CopyOnWriteArrayList<>();
    private final List<Consumer<Platform>> connectedHandlers = new CopyOnWriteArrayList<>();
    private final List<Consumer<Platform>> disconnectedHandlers = new CopyOnWriteArrayList<>();
    private final List<Consumer<Platform>> readyHandlers = new CopyOnWriteArrayList<>();

    private final Set<Bot> reconnecting = ConcurrentHashMap.newKeySet();
    private final Set<CompletableFuture<Void>> reconnectLoops = ConcurrentHashMap.newKeySet();
    private volatile CountDownLatch lifecycle = new CountDownLatch(1);

    public BotManager(ManagerConfig config, PlatformRegistry platformRegistry) {
        this(config, platformRegistry, System::getenv);
    }

    public BotManager(ManagerConfig config, PlatformRegistry platformRegistry, UnaryOperator<String> envResolver) {
        this.config = config;
        this.platformRegistry = platformRegistry;
        this.envResolver = envResolver;
        this.workers = Executors.newCachedThreadPool(managerThreads());
    }

    // ==================== Registration ====================

    /**
     * Validates and expands the config, creates the bot, wires its events and
     * connects it when enabled. A failed connect is logged; the bot stays
     * registered and can be connected later.
     *
     * @throws IllegalArgumentException
     *             when the config is invalid or the platform is unsupported
     */
    public Bot addBot(BotConfig botConfig) {
        try {
            botConfig.validate();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid config: " + e.getMessage(), e);
        }
        BotConfig expanded = botConfig.expandEnvVars(envResolver);
        Bot bot = platformRegistry.create(expanded);
        Platform platform = bot.getPlatform();
        wireHandlers(bot, platform);

        lock.writeLock().lock();
        try {
            bots.computeIfAbsent(platform, key -> new ArrayList<>()).add(bot);
        } finally {
            lock.writeLock().unlock();
        }

        if (expanded.isEnabled()) {
            connectQuietly(bot);
        }
        log.info("[Manager] Added {} bot", platform.getId());
        return bot;
    }

    public void addBots(List<BotConfig> configs) {
        for (BotConfig botConfig : configs) {
            addBot(botConfig);
        }
    }

    /**
     * Removes and closes the bot registered at {@code index} for the platform.
     */
    public void removeBot(Platform platform, int index) {
        Bot bot;
        lock.writeLock().lock();
        try {
            List<Bot> platformBots = bots.get(platform);
            if (platformBots == null || index < 0 || index >= platformBots.size()) {
                throw new IllegalArgumentException("bot not found: " + platform.getId() + "[" + index + "]");
            }
            bot = platformBots.remove(index);
            if (platformBots.isEmpty()) {
                bots.remove(platform);
            }
        } finally {
            lock.writeLock().unlock();
        }
        try {
            bot.close();
        } catch (RuntimeException e) {
            log.error("[Manager] Error closing {} bot: {}", platform.getId(), e.getMessage(), e);
        }
        log.info("[Manager] Removed {} bot at index {}", platform.getId(), index);
    }

    public Optional<Bot> getBot(Platform platform) {
        lock.readLock().lock();
        try {
            List<Bot> platformBots = bots.get(platform);
            return platformBots == null || platformBots.isEmpty() ? Optional.empty() : Optional.of(platformBots.get(0));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Bot> getBots(Platform platform) {
        lock.readLock().lock();
        try {
            return List.copyOf(bots.getOrDefault(platform, List.of()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<Platform, List<Bot>> getAllBots() {
        lock.readLock().lock();
        try {
            Map<Platform, List<Bot>> copy = new EnumMap<>(Platform.class);
            bots.forEach((platform, platformBots) -> copy.put(platform, List.copyOf(platformBots)));
            return copy;
        } finally {
            lock.readLock().unlock();
        }
    }

    // ==================== Lifecycle ====================

    /**
     * Connects every registered bot that is not connected yet.
     */
    public void start() {
        if (lifecycle.getCount() == 0) {
            lifecycle = new CountDownLatch(1);
        }
        log.info("[Manager] Starting bot manager...");
        for (Bot bot : allBots()) {
            if (!bot.isConnected()) {
                connectQuietly(bot);
            }
        }
        log.info("[Manager] Bot manager started");
    }

    /**
     * Cancels reconnect loops, disconnects all bots concurrently and waits for
     * both to finish.
     */
    public void stop() {
        log.info("[Manager] Stopping bot manager...");
        lifecycle.countDown();

        List<CompletableFuture<Void>> disconnects = new ArrayList<>();
        for (Bot bot : allBots()) {
            disconnects.add(runOnWorkers(() -> {
                try {
                    bot.disconnect();
                } catch (RuntimeException e) {
                    log.error("[Manager] Error disconnecting {} bot: {}", bot.getPlatform().getId(), e.getMessage());
                }
            }));
        }
        CompletableFuture.allOf(disconnects.toArray(new CompletableFuture[0])).join();
        CompletableFuture.allOf(reconnectLoops.toArray(new CompletableFuture[0])).join();
        log.info("[Manager] Bot manager stopped");
    }

    public boolean isStopped() {
        return lifecycle.getCount() == 0;
    }

    @Override
    public void close() {
        stop();
        for (Bot bot : allBots()) {
            try {
                bot.close();
            } catch (RuntimeException e) {
                log.error("[Manager] Error closing {} bot: {}", bot.getPlatform().getId(), e.getMessage());
            }
        }
        workers.shutdown();
    }

    // ==================== Global handlers ====================

    public void onMessage(BiConsumer<Message, Platform> handler) {
        messageHandlers.add(handler);
    }

    public void onError(BiConsumer<BotException, Platform> handler) {
        errorHandlers.add(handler);
    }

    public void onConnected(Consumer<Platform> handler) {
        connectedHandlers.add(handler);
    }

    public void onDisconnected(Consumer<Platform> handler) {
        disconnectedHandlers.add(handler);
    }

    public void onReady(Consumer<Platform> handler) {
        readyHandlers.add(handler);
    }

    // ==================== Sending ====================

    /**
     * Sends through the first bot registered for the platform.
     *
     * @throws BotException
     *             {@code INVALID_TARGET} when no bot serves the platform, or
     *             whatever the bot's send reports
     */
    public SendResult sendTo(Platform platform, String target, SendMessageOptions options) {
        Bot bot = getBot(platform).orElseThrow(() -> new BotException(ErrorCode.INVALID_TARGET,
                "no bot available for platform: " + platform.getId(), false).withPlatform(platform));
        return bot.sendMessage(target, options);
    }

    /**
     * Sends to every target independently. Failures are logged and skipped; the
     * result holds the successful sends keyed by platform.
     */
    public Map<Platform, SendResult> broadcast(List<BotTarget> targets, SendMessageOptions options) {
        Map<Platform, SendResult> results = new EnumMap<>(Platform.class);
        for (BotTarget target : targets) {
            try {
                results.put(target.platform(), sendTo(target.platform(), target.target(), options));
            } catch (RuntimeException e) {
                log.error("[Manager] Failed to send to {}:{}: {}", target.platform().getId(), target.target(),
                        e.getMessage());
            }
        }
        return results;
    }

    /**
     * Status snapshot of every bot keyed by {@code platform:index}.
     */
    public Map<String, BotStatus> getStatus() {
        Map<String, BotStatus> statuses = new LinkedHashMap<>();
        getAllBots().forEach((platform, platformBots) -> {
            for (int i = 0; i < platformBots.size(); i++) {
                statuses.put(platform.getId() + ":" + i, platformBots.get(i).getStatus());
            }
        });
        return statuses;
    }

    // ==================== Internals ====================

    private void wireHandlers(Bot bot, Platform platform) {
        bot.onMessage(message -> fanOut("message", messageHandlers, handler -> handler.accept(message, platform)));
        bot.onError(error -> fanOut("error", errorHandlers, handler -> handler.accept(error, platform)));
        bot.onConnected(() -> fanOut("connected", connectedHandlers, handler -> handler.accept(platform)));
        bot.onReady(() -> fanOut("ready", readyHandlers, handler -> handler.accept(platform)));
        bot.onDisconnected(() -> {
            fanOut("disconnected", disconnectedHandlers, handler -> handler.accept(platform));
            if (config.isAutoReconnect()) {
                scheduleReconnect(bot);
            }
        });
    }

    private <H> void fanOut(String event, List<H> handlers, Consumer<H> invocation) {
        for (H handler : handlers) {
            runOnWorkers(() -> {
                try {
                    invocation.accept(handler);
                } catch (RuntimeException e) { // NOSONAR - global handler faults stay isolated
                    log.error("[Manager] Global {} handler failed: {}", event, e.getMessage(), e);
                }
            });
        }
    }

    private void scheduleReconnect(Bot bot) {
        if (isStopped()) {
            return;
        }
        if (!reconnecting.add(bot)) {
            log.debug("[Manager] Reconnect already running for {} bot", bot.getPlatform().getId());
            return;
        }
        CompletableFuture<Void> loop = runOnWorkers(() -> reconnectLoop(bot));
        reconnectLoops.add(loop);
        loop.whenComplete((ignored, error) -> {
            reconnectLoops.remove(loop);
            reconnecting.remove(bot);
        });
    }

    private void reconnectLoop(Bot bot) {
        String platform = bot.getPlatform().getId();
        CountDownLatch signal = lifecycle;
        int maxAttempts = config.getMaxReconnectAttempts();
        int attempts = 0;
        while (attempts < maxAttempts) {
            if (signal.getCount() == 0 || bot.isConnected()) {
                return;
            }
            attempts++;
            log.info("[Manager] Reconnecting {} bot (attempt {}/{})", platform, attempts, maxAttempts);
            try {
                if (signal.await(config.getReconnectDelayMs(), TimeUnit.MILLISECONDS)) {
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            try {
                bot.connect();
                log.info("[Manager] Reconnected {} bot", platform);
                return;
            } catch (RuntimeException e) {
                log.warn("[Manager] Reconnect attempt {} for {} bot failed: {}", attempts, platform, e.getMessage());
            }
        }
        log.error("[Manager] Giving up on {} bot after {} reconnect attempts", platform, maxAttempts);
    }

    private void connectQuietly(Bot bot) {
        try {
            bot.connect();
        } catch (RuntimeException e) {
            log.error("[Manager] Failed to connect {} bot: {}", bot.getPlatform().getId(), e.getMessage());
        }
    }

    private CompletableFuture<Void> runOnWorkers(Runnable task) {
        try {
            return CompletableFuture.runAsync(task, workers);
        } catch (RejectedExecutionException e) {
            log.warn("[Manager] Worker pool closed, task skipped: {}", e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
    }

    private List<Bot> allBots() {
        lock.readLock().lock();
        try {
            List<Bot> all = new ArrayList<>();
            bots.values().forEach(all::addAll);
            return all;
        } finally {
            lock.readLock().unlock();
        }
    }

    private static ThreadFactory managerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "imbot-manager-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
