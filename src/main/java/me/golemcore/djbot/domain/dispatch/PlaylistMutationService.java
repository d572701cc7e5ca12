package me.golemcore.djbot.domain.dispatch;

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

import me.golemcore.djbot.domain.service.DedupStore;
import me.golemcore.djbot.infrastructure.config.BotProperties;
import me.golemcore.djbot.port.outbound.CatalogPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Catalog mutations with a fixed retry policy, kept in step with the
 * {@link DedupStore}.
 *
 * <p>
 * Every mutation is attempted up to {@code bot.app.max-retries} times with
 * {@code bot.app.retry-delay} between attempts. A track is recorded in the
 * dedup store only after the catalog accepted it, so a failed add can be
 * requested again without being mistaken for a duplicate.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlaylistMutationService {

    private final CatalogPort catalogPort;
    private final DedupStore dedupStore;
    private final BotProperties properties;

    /**
     * Append a track to the playlist.
     *
     * @throws PlaylistMutationException
     *             when every attempt failed
     */
    public void addTrack(String trackId) {
        withRetry("add " + trackId, () -> catalogPort.addToPlaylist(trackId));
        dedupStore.add(trackId);
    }

    /**
     * Put a track in front of everything: the play queue and the first playlist
     * slot.
     *
     * <p>
     * Once queued the track is recorded even if the playlist insert fails, since
     * it is going to play either way.
     *
     * @return where the track ended up
     * @throws PlaylistMutationException
     *             when the track could not be queued; nothing was changed
     */
    public PriorityPlacement addPriorityTrack(String trackId) {
        withRetry("queue " + trackId, () -> catalogPort.addToQueue(trackId));
        dedupStore.add(trackId);
        try {
            withRetry("insert " + trackId, () -> catalogPort.addToPlaylistAtPosition(trackId, 0));
        } catch (PlaylistMutationException e) {
            log.warn("[Playlist] {} queued but not inserted into the playlist: {}", trackId, e.getMessage());
            return PriorityPlacement.QUEUE_ONLY;
        }
        return PriorityPlacement.QUEUE_AND_PLAYLIST;
    }

    public void removeTrack(String trackId) {
        withRetry("remove " + trackId, () -> catalogPort.removeFromPlaylist(trackId));
        dedupStore.remove(trackId);
    }

    void withRetry(String operation, Runnable action) {
        int maxRetries = Math.max(1, properties.getApp().getMaxRetries());
        long delayMs = properties.getApp().getRetryDelay().toMillis();
        RuntimeException lastError = null;

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            try {
                action.run();
                if (attempt > 1) {
                    log.info("[Playlist] {} succeeded on attempt {}", operation, attempt);
                }
                return;
            } catch (RuntimeException e) {
                lastError = e;
                log.warn("[Playlist] {} failed (attempt {}/{}): {}", operation, attempt, maxRetries,
                        e.getMessage());
            }
            if (attempt < maxRetries && delayMs > 0) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new PlaylistMutationException(operation + " interrupted", ie);
                }
            }
        }
        throw new PlaylistMutationException(operation + " failed after " + maxRetries + " attempts", lastError);
    }

    public enum PriorityPlacement {
        QUEUE_AND_PLAYLIST, QUEUE_ONLY
    }
}
