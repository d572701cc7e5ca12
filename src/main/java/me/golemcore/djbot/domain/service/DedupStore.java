package me.golemcore.djbot.domain.service;

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

import com.google.common.hash.BloomFilter;
import com.google.common.hash.Funnels;
import me.golemcore.djbot.infrastructure.config.BotProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Tracks which playlist items are already queued.
 *
 * <p>
 * A Guava {@link BloomFilter} answers the common "definitely not present" case
 * without touching the exact set. Positive answers are confirmed against an
 * insertion-ordered exact set, which doubles as the eviction order: once the
 * set exceeds its capacity the oldest entry is dropped.
 *
 * <p>
 * The bloom filter cannot forget. {@link #remove(String)} only updates the
 * exact set, so a removed id keeps a stale filter bit until the next
 * {@link #load(Collection)} rebuilds the filter. Eviction has the same effect.
 *
 * <p>
 * All operations share one read-write lock: {@link #has(String)} and
 * {@link #size()} read, everything else writes.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class DedupStore {

    private final int capacity;
    private final double falsePositiveRate;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final LinkedHashSet<String> tracks = new LinkedHashSet<>();
    private BloomFilter<String> filter;

    @Autowired
    public DedupStore(BotProperties properties) {
        this(properties.getDedup().getMaxTracks(), properties.getDedup().getFalsePositiveRate());
    }

    public DedupStore(int capacity, double falsePositiveRate) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Dedup capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.falsePositiveRate = falsePositiveRate;
        this.filter = newFilter();
    }

    public boolean has(String trackId) {
        lock.readLock().lock();
        try {
            if (!filter.mightContain(trackId)) {
                return false;
            }
            return tracks.contains(trackId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void add(String trackId) {
        lock.writeLock().lock();
        try {
            if (!tracks.add(trackId)) {
                return;
            }
            filter.put(trackId);
            evictOverflow();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void remove(String trackId) {
        lock.writeLock().lock();
        try {
            tracks.remove(trackId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replace the whole snapshot, typically with the live playlist on startup.
     * Blank ids are skipped. The bloom filter is rebuilt from scratch.
     */
    public void load(Collection<String> trackIds) {
        lock.writeLock().lock();
        try {
            tracks.clear();
            filter = newFilter();
            for (String trackId : trackIds) {
                if (trackId == null || trackId.isBlank()) {
                    continue;
                }
                if (tracks.add(trackId)) {
                    filter.put(trackId);
                }
            }
            evictOverflow();
            log.info("[Dedup] Loaded {} tracks", tracks.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return tracks.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            tracks.clear();
            filter = newFilter();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // Caller holds the write lock.
    private void evictOverflow() {
        Iterator<String> oldest = tracks.iterator();
        while (tracks.size() > capacity && oldest.hasNext()) {
            String evicted = oldest.next();
            oldest.remove();
            log.debug("[Dedup] Evicted {}", evicted);
        }
    }

    private BloomFilter<String> newFilter() {
        return BloomFilter.create(Funnels.stringFunnel(StandardCharsets.UTF_8), capacity, falsePositiveRate);
    }
}
