package me.golemcore.djbot.adapter.outbound.llm;

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
import me.golemcore.djbot.infrastructure.config.BotProperties;
import me.golemcore.djbot.port.outbound.RankingException;
import me.golemcore.djbot.port.outbound.RankingPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ranking provider backed by an OpenAI-compatible chat model through
 * langchain4j.
 *
 * <p>
 * The model is created lazily on first use. Every prompt asks for a compact
 * answer (JSON or a number list) that is parsed here; unparseable output is
 * reported as {@link RankingException} so callers can fall back.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code bot.llm.api-key} - provider key; the adapter is unavailable
 * without it
 * <li>{@code bot.llm.base-url} - optional OpenAI-compatible endpoint
 * <li>{@code bot.llm.model} - model name
 * <li>{@code bot.llm.temperature} - sampling temperature
 * <li>{@code bot.llm.timeout-ms} - request timeout
 * </ul>
 */
@Component
@Slf4j
public class Langchain4jRankingAdapter implements RankingPort {

    private static final int MAX_CANDIDATES = 3;

    private static final String CANDIDATES_PROMPT = """
            You are a music resolver for a group chat DJ bot. Given a chat message and, optionally,
            numbered catalog search results, propose up to 3 tracks the sender most likely means.

            Respond with valid JSON only, in this exact format:
            {
              "candidates": [
                {"index": 1, "title": "Song Title", "artist": "Artist Name", "album": "Album Name",
                 "year": 2020, "confidence": 0.85, "reasoning": "Brief explanation"}
              ]
            }

            Rules:
            - confidence is between 0.0 and 1.0, higher means more certain
            - when search results are given, "index" is the 1-based result number and only listed results may be used
            - without search results, omit "index" and only name real songs
            - order candidates best first, at most 3
            - return an empty list when the message names no song or artist""";

    private static final String CHATTER_PROMPT = """
            You filter general chat from music requests for a music bot.

            Respond with valid JSON only:
            {"is_not_music_request": true, "confidence": 0.85, "reasoning": "Brief explanation"}

            Set is_not_music_request to true only for obvious social chatter: greetings, thanks,
            small talk, jokes, emoji-only messages. Anything that mentions songs, artists, albums or
            music, and anything ambiguous, is a possible request: set it to false.
            When uncertain, return false.""";

    private static final String PRIORITY_PROMPT = """
            You detect priority music requests from group administrators. A priority request should
            be played next instead of being appended to the playlist.

            Respond with valid JSON only:
            {"is_priority_request": true, "confidence": 0.85, "reasoning": "Brief explanation"}

            Priority indicators: "prio:", "priority:", "urgent:", "next:", "asap", "now",
            "play this next", "skip the queue", and time-sensitive context such as "for the speech"
            or "entrance song". Regular requests and casual mentions are not priority.
            Be conservative and return false when uncertain.""";

    private static final String MOOD_PROMPT = """
            You describe musical moods and styles. Generate a short mood/style phrase of 3 to 6 words
            for the provided songs as a whole, giving equal weight to each song.
            Respond with just the phrase, for example "energetic rock anthems" or "mellow indie folk".""";

    private static final String RANK_PROMPT = "You are a music expert helping to rank tracks by relevance to a search query.";

    private final BotProperties properties;
    private final ObjectMapper objectMapper;

    private volatile ChatModel chatModel;

    @Autowired
    public Langchain4jRankingAdapter(BotProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    Langchain4jRankingAdapter(BotProperties properties, ObjectMapper objectMapper, ChatModel chatModel) {
        this(properties, objectMapper);
        this.chatModel = chatModel;
    }

    @Override
    public boolean isAvailable() {
        if (chatModel != null) {
            return true;
        }
        String apiKey = properties.getLlm().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public List<RankedCandidate> rankCandidates(String userText, List<Track> catalogTracks) {
        StringBuilder prompt = new StringBuilder("Message: \"").append(userText).append("\"\n");
        if (catalogTracks.isEmpty()) {
            prompt.append("\nNo search results. Extract candidates from the message alone.");
        } else {
            prompt.append("\nSearch results:\n").append(numbered(catalogTracks));
        }

        JsonNode json = parseJson(chat(CANDIDATES_PROMPT, prompt.toString()));
        JsonNode items = json.path("candidates");
        if (!items.isArray()) {
            throw new RankingException("Ranking response has no candidates array");
        }

        List<RankedCandidate> candidates = new ArrayList<>();
        for (JsonNode item : items) {
            Track track = candidateTrack(item, catalogTracks);
            if (track == null) {
                continue;
            }
            candidates.add(RankedCandidate.builder()
                    .track(track)
                    .confidence(clamp(item.path("confidence").asDouble(0)))
                    .reasoning(item.path("reasoning").asText(""))
                    .build());
            if (candidates.size() == MAX_CANDIDATES) {
                break;
            }
        }
        log.debug("[LLM] Ranked {} candidates for '{}'", candidates.size(), userText);
        return candidates;
    }

    @Override
    public boolean isPriorityRequest(String text) {
        JsonNode json = parseJson(chat(PRIORITY_PROMPT, text));
        boolean priority = json.path("is_priority_request").asBoolean(false);
        log.debug("[LLM] Priority check: {} (confidence {})", priority, json.path("confidence").asDouble(0));
        return priority;
    }

    @Override
    public boolean isNotMusicRequest(String text) {
        JsonNode json = parseJson(chat(CHATTER_PROMPT, text));
        boolean chatter = json.path("is_not_music_request").asBoolean(false);
        log.debug("[LLM] Chatter check: {} (confidence {})", chatter, json.path("confidence").asDouble(0));
        return chatter;
    }

    @Override
    public String generateTrackMood(List<Track> tracks) {
        if (tracks.isEmpty()) {
            return "";
        }
        StringBuilder prompt = new StringBuilder("Based on all these songs:\n");
        for (Track track : tracks) {
            prompt.append("- ").append(describe(track)).append('\n');
        }
        return stripQuotes(chat(MOOD_PROMPT, prompt.toString()).trim());
    }

    @Override
    public List<Track> rankTracks(String query, List<Track> tracks) {
        if (tracks.size() <= 1) {
            return tracks;
        }
        String prompt = "Given the search query \"" + query + "\", rank these tracks by how well they match "
                + "the search intent.\n\nTracks to rank:\n" + numbered(tracks)
                + "\nRespond with only the track numbers in order of best match first (e.g. \"3,1,5,2,4\").";
        List<Track> ranked = parseRanking(chat(RANK_PROMPT, prompt), tracks);
        log.debug("[LLM] Ranked {} tracks for '{}'", ranked.size(), query);
        return ranked;
    }

    /**
     * Order tracks by a comma-separated list of 1-based numbers. Unknown and
     * repeated numbers are ignored; tracks the list omits keep their relative
     * order at the end.
     */
    static List<Track> parseRanking(String rankingText, List<Track> tracks) {
        Set<Integer> used = new LinkedHashSet<>();
        for (String part : rankingText.split(",")) {
            String digits = part.replaceAll("[^0-9]", "");
            if (digits.isEmpty() || digits.length() > 4) {
                continue;
            }
            int index = Integer.parseInt(digits) - 1;
            if (index >= 0 && index < tracks.size()) {
                used.add(index);
            }
        }
        List<Track> ranked = new ArrayList<>(tracks.size());
        for (int index : used) {
            ranked.add(tracks.get(index));
        }
        for (int i = 0; i < tracks.size(); i++) {
            if (!used.contains(i)) {
                ranked.add(tracks.get(i));
            }
        }
        return ranked;
    }

    private Track candidateTrack(JsonNode item, List<Track> catalogTracks) {
        int index = item.path("index").asInt(0) - 1;
        if (index >= 0 && index < catalogTracks.size()) {
            return catalogTracks.get(index);
        }
        String title = item.path("title").asText("");
        String artist = item.path("artist").asText("");
        if (title.isBlank() && artist.isBlank()) {
            return null;
        }
        return Track.builder()
                .title(title)
                .artist(artist)
                .album(item.path("album").asText(""))
                .year(item.path("year").asInt(0))
                .duration(Duration.ZERO)
                .build();
    }

    private String chat(String system, String user) {
        List<ChatMessage> messages = List.of(SystemMessage.from(system), UserMessage.from(user));
        try {
            ChatResponse response = model().chat(messages);
            String text = response.aiMessage() != null ? response.aiMessage().text() : null;
            if (text == null || text.isBlank()) {
                throw new RankingException("Empty response from model");
            }
            return text;
        } catch (RankingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RankingException("Model call failed: " + e.getMessage(), e);
        }
    }

    private JsonNode parseJson(String text) {
        String trimmed = text.trim();
        int start = trimmed.indexOf('{');
        int end = trimmed.lastIndexOf('}');
        if (start < 0 || end < start) {
            throw new RankingException("Model response is not JSON");
        }
        try {
            return objectMapper.readTree(trimmed.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new RankingException("Model response is not valid JSON", e);
        }
    }

    private ChatModel model() {
        ChatModel model = chatModel;
        if (model != null) {
            return model;
        }
        synchronized (this) {
            if (chatModel == null) {
                if (!isAvailable()) {
                    throw new RankingException("Ranking provider is not configured");
                }
                chatModel = createModel();
                log.info("[LLM] Ranking model initialized: {}", properties.getLlm().getModel());
            }
            return chatModel;
        }
    }

    private ChatModel createModel() {
        BotProperties.LlmProperties llm = properties.getLlm();
        var builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .temperature(llm.getTemperature())
                .maxRetries(1)
                .timeout(Duration.ofMillis(llm.getTimeoutMs()));
        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        return builder.build();
    }

    private static String numbered(List<Track> tracks) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < tracks.size(); i++) {
            sb.append(i + 1).append(". ").append(describe(tracks.get(i))).append('\n');
        }
        return sb.toString();
    }

    private static String describe(Track track) {
        StringBuilder sb = new StringBuilder().append(track.getTitle()).append(" by ").append(track.getArtist());
        if (track.getAlbum() != null && !track.getAlbum().isBlank()) {
            sb.append(" (from ").append(track.getAlbum()).append(')');
        }
        if (track.getYear() > 0) {
            sb.append(", ").append(track.getYear());
        }
        return sb.toString();
    }

    private static String stripQuotes(String text) {
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
