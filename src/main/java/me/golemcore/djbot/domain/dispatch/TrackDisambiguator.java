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

import me.golemcore.djbot.domain.model.RankedCandidate;
import me.golemcore.djbot.domain.model.Track;
import me.golemcore.djbot.port.outbound.CatalogException;
import me.golemcore.djbot.port.outbound.CatalogPort;
import me.golemcore.djbot.port.outbound.RankingException;
import me.golemcore.djbot.port.outbound.RankingPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiPredicate;

/**
 * Resolves a free-text request to ranked catalog tracks.
 *
 * <p>
 * Three stages:
 * <ol>
 * <li>catalog search with the raw text</li>
 * <li>AI ranking of those results, or AI-only extraction when the search found
 * nothing</li>
 * <li>a targeted search for each of the top candidates ("artist title"),
 * followed by a final AI ranking of the combined hits</li>
 * </ol>
 * When ranking fails or returns nothing but catalog results exist, the search
 * order is used with descending confidence and the result is flagged as a
 * fallback so the caller always asks for confirmation.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TrackDisambiguator {

    static final int REFINE_CANDIDATES = 3;
    static final int HITS_PER_CANDIDATE = 3;
    static final double FALLBACK_BASE_CONFIDENCE = 0.7;
    static final double FALLBACK_CONFIDENCE_STEP = 0.1;
    static final double FALLBACK_MIN_CONFIDENCE = 0.3;

    private final CatalogPort catalogPort;
    private final RankingPort rankingPort;

    /**
     * @throws DisambiguationException
     *             when nothing usable was found
     */
    public Result disambiguate(String text) {
        List<Track> initial;
        try {
            initial = catalogPort.searchTracks(text);
        } catch (CatalogException e) {
            throw new DisambiguationException("error.spotify.search_failed", "Initial search failed", e);
        }
        log.debug("[Disambiguate] Stage 1: {} catalog results for '{}'", initial.size(), text);

        if (!rankingPort.isAvailable()) {
            if (initial.isEmpty()) {
                throw new DisambiguationException("error.llm.no_provider", "No ranking provider and no results");
            }
            return fallback(initial);
        }

        List<RankedCandidate> ranked;
        try {
            ranked = rankingPort.rankCandidates(text, initial);
        } catch (RankingException e) {
            log.warn("[Disambiguate] Ranking failed: {}", e.getMessage());
            if (initial.isEmpty()) {
                throw new DisambiguationException("error.llm.understand", "Ranking failed", e);
            }
            return fallback(initial);
        }
        if (ranked.isEmpty()) {
            if (initial.isEmpty()) {
                throw new DisambiguationException("error.llm.no_songs", "Ranking returned no candidates");
            }
            return fallback(initial);
        }
        log.debug("[Disambiguate] Stage 2: top candidate {}", ranked.get(0).getTrack().displayName());

        List<Track> refined = refineSearch(ranked);
        if (refined.isEmpty()) {
            throw new DisambiguationException("error.spotify.no_matches", "No catalog tracks for ranked candidates");
        }

        List<RankedCandidate> finalRanking;
        try {
            finalRanking = rankingPort.rankCandidates(text, refined);
        } catch (RankingException e) {
            log.warn("[Disambiguate] Final ranking failed: {}", e.getMessage());
            return fallback(refined);
        }
        if (finalRanking.isEmpty()) {
            return fallback(refined);
        }

        List<RankedCandidate> matched = new ArrayList<>(finalRanking.size());
        for (RankedCandidate candidate : finalRanking) {
            matched.add(restoreCatalogData(candidate, refined));
        }
        log.info("[Disambiguate] '{}' -> {} ({})", text, matched.get(0).getTrack().displayName(),
                matched.get(0).getConfidence());
        return new Result(matched, false);
    }

    private List<Track> refineSearch(List<RankedCandidate> ranked) {
        Map<String, Track> hits = new LinkedHashMap<>();
        for (RankedCandidate candidate : ranked.subList(0, Math.min(REFINE_CANDIDATES, ranked.size()))) {
            Track track = candidate.getTrack();
            String query = track.getArtist() + " " + track.getTitle();
            try {
                List<Track> found = catalogPort.searchTracks(query);
                for (Track hit : found.subList(0, Math.min(HITS_PER_CANDIDATE, found.size()))) {
                    hits.putIfAbsent(hit.getId() != null ? hit.getId() : hit.displayName(), hit);
                }
            } catch (CatalogException e) {
                log.warn("[Disambiguate] Targeted search failed for '{}': {}", query, e.getMessage());
            }
        }
        return new ArrayList<>(hits.values());
    }

    static Result fallback(List<Track> tracks) {
        List<RankedCandidate> candidates = new ArrayList<>(tracks.size());
        for (int i = 0; i < tracks.size(); i++) {
            double confidence = Math.max(FALLBACK_MIN_CONFIDENCE,
                    FALLBACK_BASE_CONFIDENCE - i * FALLBACK_CONFIDENCE_STEP);
            candidates.add(RankedCandidate.builder()
                    .track(tracks.get(i))
                    .confidence(confidence)
                    .reasoning("catalog search result")
                    .build());
        }
        return new Result(candidates, true);
    }

    /**
     * Copy id, url and duration from the catalog track the candidate refers to,
     * matching by artist and title: exact, then case-insensitive, then
     * containment.
     */
    static RankedCandidate restoreCatalogData(RankedCandidate candidate, List<Track> catalogTracks) {
        Track track = candidate.getTrack();
        Optional<Track> match = findMatch(track, catalogTracks, TrackDisambiguator::exactMatch)
                .or(() -> findMatch(track, catalogTracks, TrackDisambiguator::caseInsensitiveMatch))
                .or(() -> findMatch(track, catalogTracks, TrackDisambiguator::partialMatch));
        if (match.isEmpty()) {
            log.warn("[Disambiguate] No catalog match for {}", track.displayName());
            return candidate;
        }
        Track source = match.get();
        return candidate.toBuilder()
                .track(track.toBuilder()
                        .id(source.getId())
                        .url(source.getUrl())
                        .duration(source.getDuration())
                        .build())
                .build();
    }

    private static Optional<Track> findMatch(Track track, List<Track> catalogTracks,
            BiPredicate<Track, Track> predicate) {
        return catalogTracks.stream().filter(candidate -> predicate.test(track, candidate)).findFirst();
    }

    private static boolean exactMatch(Track a, Track b) {
        return safe(a.getArtist()).equals(safe(b.getArtist())) && safe(a.getTitle()).equals(safe(b.getTitle()));
    }

    private static boolean caseInsensitiveMatch(Track a, Track b) {
        return safe(a.getArtist()).equalsIgnoreCase(safe(b.getArtist()))
                && safe(a.getTitle()).equalsIgnoreCase(safe(b.getTitle()));
    }

    private static boolean partialMatch(Track a, Track b) {
        String artistA = lower(a.getArtist());
        String artistB = lower(b.getArtist());
        String titleA = lower(a.getTitle());
        String titleB = lower(b.getTitle());
        return (artistA.contains(artistB) || artistB.contains(artistA))
                && (titleA.contains(titleB) || titleB.contains(titleA));
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }

    private static String lower(String value) {
        return safe(value).toLowerCase(Locale.ROOT);
    }

    /**
     * Ranked candidates, best first. {@code fallback} is set when the ranking
     * came from plain search order instead of the AI.
     */
    public record Result(List<RankedCandidate> candidates, boolean fallback) {

        public RankedCandidate best() {
            return candidates.get(0);
        }
    }
}
