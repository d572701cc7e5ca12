package me.golemcore.djbot.ratelimit;

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

import me.golemcore.djbot.domain.model.FloodStats;
import me.golemcore.djbot.infrastructure.config.BotProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Per-(chat, user) sliding-window message limiter.
 *
 * <p>
 * Each key keeps the timestamps of its admitted messages inside a trailing
 * 60-second window. A message is admitted only while fewer than
 * {@code bot.flood.limit-per-minute} timestamps remain after pruning; rejected
 * messages are not recorded, so a flooding user is released exactly one window
 * after their last admitted message. A limit of zero blocks everything.
 *
 * <p>
 * A background task drops keys idle for longer than
 * {@code bot.flood.idle-timeout} so abandoned chats do not accumulate. It can
 * be stopped with {@link #stop()} without affecting {@link #checkMessage}.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class FloodGate {

    static final Duration WINDOW = Duration.ofSeconds(60);

    private final int limitPerMinute;
    private final Duration cleanupInterval;
    private final Duration idleTimeout;
    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, UserWindow> windows = new HashMap<>();
    private ScheduledExecutorService cleanupScheduler;

    @Autowired
    public FloodGate(BotProperties properties, Clock clock) {
        this(properties.getFlood().getLimitPerMinute(), properties.getFlood().getCleanupInterval(),
                properties.getFlood().getIdleTimeout(), clock);
    }

    public FloodGate(int limitPerMinute, Duration cleanupInterval, Duration idleTimeout, Clock clock) {
        this.limitPerMinute = limitPerMinute;
        this.cleanupInterval = cleanupInterval;
        this.idleTimeout = idleTimeout;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        cleanupScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "flood-cleanup");
            t.setDaemon(true);
            t.setPriority(Thread.MIN_PRIORITY);
            return t;
        });
        long intervalMs = cleanupInterval.toMillis();
        cleanupScheduler.scheduleAtFixedRate(this::cleanup, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[Flood] Limit {}/min, cleanup every {}", limitPerMinute, cleanupInterval);
    }

    /**
     * Decide whether a message from {@code userId} in {@code chatId} may be
     * processed, recording it when admitted.
     */
    public boolean checkMessage(String chatId, String userId) {
        String key = chatId + ":" + userId;
        Instant now = clock.instant();
        Instant windowStart = now.minus(WINDOW);

        lock.writeLock().lock();
        try {
            UserWindow window = windows.computeIfAbsent(key, k -> new UserWindow());
            window.lastSeen = now;

            Deque<Instant> timestamps = window.timestamps;
            while (!timestamps.isEmpty() && !timestamps.peekFirst().isAfter(windowStart)) {
                timestamps.pollFirst();
            }

            if (timestamps.size() >= limitPerMinute) {
                log.debug("[Flood] Blocked {} ({} messages in window)", key, timestamps.size());
                return false;
            }
            timestamps.addLast(now);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    void cleanup() {
        Instant cutoff = clock.instant().minus(idleTimeout);
        int removed = 0;
        lock.writeLock().lock();
        try {
            Iterator<UserWindow> it = windows.values().iterator();
            while (it.hasNext()) {
                if (it.next().lastSeen.isBefore(cutoff)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (removed > 0) {
            log.debug("[Flood] Cleaned up {} idle entries", removed);
        }
    }

    public FloodStats getStats() {
        lock.readLock().lock();
        try {
            return new FloodStats(windows.size(), limitPerMinute, WINDOW.getSeconds());
        } finally {
            lock.readLock().unlock();
        }
    }

    @PreDestroy
    public void stop() {
        if (cleanupScheduler != null) {
            cleanupScheduler.shutdownNow();
            cleanupScheduler = null;
            log.debug("[Flood] Cleanup stopped");
        }
    }

    private static final class UserWindow {
        private final Deque<Instant> timestamps = new ArrayDeque<>();
        private Instant lastSeen;
    }
}
