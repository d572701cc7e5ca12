package me.golemcore.djbot.port.outbound;

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

import me.golemcore.djbot.domain.model.PlaybackCompliance;
import me.golemcore.djbot.domain.model.Track;

import java.util.List;
import java.util.Optional;

/**
 * Port for the music catalog and the managed playlist.
 *
 * <p>
 * All methods may throw {@link CatalogException} on transport or API errors.
 * Implementations must be safe for concurrent use.
 */
public interface CatalogPort {

    /**
     * Extract a canonical track id from a link.
     *
     * @return the id, or empty when the link is not a track link
     */
    Optional<String> extractTrackId(String url);

    List<Track> searchTracks(String query);

    Track getTrack(String trackId);

    void addToPlaylist(String trackId);

    void addToPlaylistAtPosition(String trackId, int position);

    /**
     * Add to the player's immediate play queue.
     */
    void addToQueue(String trackId);

    List<String> getPlaylistTrackIds();

    /**
     * Whether a player is currently active on the account. Queue and player
     * calls fail without one.
     */
    boolean hasActiveDevice();

    /**
     * Whether the player is about to run out of playlist tracks.
     */
    boolean isNearPlaylistEnd();

    /**
     * Tracks that fit the playlist, used as auto-play fillers.
     */
    List<Track> getRecommendedTracks(int limit);

    void removeFromPlaylist(String trackId);

    /**
     * @return compliance snapshot, or empty when nothing is playing
     */
    Optional<PlaybackCompliance> checkPlaybackCompliance();

    /**
     * @return zero-based position in the playlist, or {@code -1}
     */
    int getTrackPosition(String trackId);

    void setShuffle(boolean enabled);

    void setRepeatMode(String mode);

    String getPlaylistUrl();
}
