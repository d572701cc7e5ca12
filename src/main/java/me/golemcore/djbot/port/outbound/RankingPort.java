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

import me.golemcore.djbot.domain.model.RankedCandidate;
import me.golemcore.djbot.domain.model.Track;

import java.util.List;

/**
 * Port for the AI ranking provider.
 *
 * <p>
 * Methods throw {@link RankingException} when the provider fails or returns
 * output that cannot be parsed; callers fall back to non-AI behavior.
 */
public interface RankingPort {

    boolean isAvailable();

    /**
     * Rank what the user most likely means.
     *
     * @param userText
     *            the raw request
     * @param catalogTracks
     *            search results to rank; when empty the provider extracts
     *            candidates from the text alone (without ids or urls)
     */
    List<RankedCandidate> rankCandidates(String userText, List<Track> catalogTracks);

    boolean isPriorityRequest(String text);

    boolean isNotMusicRequest(String text);

    /**
     * Short mood/style phrase describing the tracks together.
     */
    String generateTrackMood(List<Track> tracks);

    /**
     * Order tracks by relevance to a query, best first.
     */
    List<Track> rankTracks(String query, List<Track> tracks);
}
