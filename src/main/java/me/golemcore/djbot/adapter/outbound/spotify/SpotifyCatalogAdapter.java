package me.golemcore.djbot.adapter.outbound.spotify;

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
import me.golemcore.djbot.infrastructure.config.BotProperties;
import me.golemcore.djbot.port.outbound.CatalogException;
import me.golemcore.djbot.port.outbound.CatalogPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Spotify Web API adapter for the catalog and the managed playlist.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>GET /search, GET /tracks/{id} - catalog lookups
 * <li>GET|POST|DELETE /playlists/{id}/tracks - playlist contents
 * <li>GET /me/player, POST /me/player/queue - player state and queue
 * <li>GET /me/player/devices - device availability
 * <li>PUT /me/player/shuffle, PUT /me/player/repeat - compliance corrections
 * </ul>
 *
 * <p>
 * Requests carry a bearer token from {@link SpotifyTokenProvider}; a 401 drops
 * the cached token and the call is retried once with a fresh one.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code bot.spotify.api-url} - Web API base URL
 * <li>{@code bot.spotify.playlist-id} - managed playlist
 * <li>{@code bot.spotify.search-limit} - results per search
 * <li>{@code bot.spotify.near-end-tracks} - remaining tracks that count as
 * near the end
 * <li>{@code bot.spotify.timeout-seconds} - HTTP timeout
 * </ul>
 *
 * @see me.golemcore.djbot.port.outbound.CatalogPort
 */
@Component
@Slf4j
public class SpotifyCatalogAdapter implements CatalogPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String PLAYLIST_URL = "https://open.spotify.com/playlist/";
    private static final String REPEAT_OFF = "off";
    private static final String REPEAT_CONTEXT = "context";
    private static final int PAGE_SIZE = 100;
    private static final int RECENT_SEEDS = 5;

    private final BotProperties properties;
    private final SpotifyTokenProvider tokenProvider;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public SpotifyCatalogAdapter(BotProperties properties, SpotifyTokenProvider tokenProvider,
            OkHttpClient baseHttpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.tokenProvider = tokenProvider;
        this.objectMapper = objectMapper;

        int timeoutSeconds = properties.getSpotify().getTimeoutSeconds();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    // ==================== Catalog ====================

    @Override
    public Optional<String> extractTrackId(String url) {
        Optional<String> direct = SpotifyLinks.trackId(url);
        if (direct.isPresent() || !SpotifyLinks.isShortLink(url)) {
            return direct;
        }
        return resolveShortLink(url.trim()).flatMap(SpotifyLinks::trackId);
    }

    @Override
    public List<Track> searchTracks(String query) {
        HttpUrl url = api("search").newBuilder()
                .addQueryParameter("q", query)
                .addQueryParameter("type", "track")
                .addQueryParameter("limit", String.valueOf(properties.getSpotify().getSearchLimit()))
                .build();
        JsonNode response = get(url);
        List<Track> tracks = new ArrayList<>();
        for (JsonNode item : response.path("tracks").path("items")) {
            Track track = toTrack(item);
            if (track != null) {
                tracks.add(track);
            }
        }
        log.debug("[Spotify] Search '{}' returned {} tracks", query, tracks.size());
        return tracks;
    }

    @Override
    public Track getTrack(String trackId) {
        Track track = toTrack(get(api("tracks", trackId)));
        if (track == null) {
            throw new CatalogException("Track not found: " + trackId);
        }
        return track;
    }

    @Override
    public List<Track> getRecommendedTracks(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<String> playlistIds = getPlaylistTrackIds();
        Set<String> inPlaylist = new LinkedHashSet<>(playlistIds);
        List<String> seeds = playlistIds.subList(Math.max(0, playlistIds.size() - RECENT_SEEDS), playlistIds.size());

        Set<String> artists = new LinkedHashSet<>();
        for (int i = seeds.size() - 1; i >= 0; i--) {
            artists.add(primaryArtist(getTrack(seeds.get(i))));
        }

        Map<String, Track> picks = new LinkedHashMap<>();
        for (String artist : artists) {
            for (Track track : searchTracks("artist:\"" + artist + "\"")) {
                if (!inPlaylist.contains(track.getId())) {
                    picks.putIfAbsent(track.getId(), track);
                }
            }
            if (picks.size() >= limit) {
                break;
            }
        }
        log.debug("[Spotify] {} recommendation candidates from {} seed artists", picks.size(), artists.size());
        return new ArrayList<>(picks.values()).subList(0, Math.min(limit, picks.size()));
    }

    // ==================== Playlist ====================

    @Override
    public void addToPlaylist(String trackId) {
        ObjectNode body = objectMapper.createObjectNode();
        body.putArray("uris").add(SpotifyLinks.trackUri(trackId));
        send(new Request.Builder().url(playlistTracks()).post(jsonBody(body)));
        log.info("[Spotify] Added {} to playlist", trackId);
    }

    @Override
    public void addToPlaylistAtPosition(String trackId, int position) {
        ObjectNode body = objectMapper.createObjectNode();
        body.putArray("uris").add(SpotifyLinks.trackUri(trackId));
        body.put("position", position);
        send(new Request.Builder().url(playlistTracks()).post(jsonBody(body)));
        log.info("[Spotify] Added {} to playlist at position {}", trackId, position);
    }

    @Override
    public void removeFromPlaylist(String trackId) {
        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode tracks = body.putArray("tracks");
        tracks.addObject().put("uri", SpotifyLinks.trackUri(trackId));
        send(new Request.Builder().url(playlistTracks()).delete(jsonBody(body)));
        log.info("[Spotify] Removed {} from playlist", trackId);
    }

    @Override
    public List<String> getPlaylistTrackIds() {
        List<String> ids = new ArrayList<>();
        HttpUrl next = playlistTracks().newBuilder()
                .addQueryParameter("fields", "items(track(id)),next")
                .addQueryParameter("limit", String.valueOf(PAGE_SIZE))
                .build();
        while (next != null) {
            JsonNode page = get(next);
            for (JsonNode item : page.path("items")) {
                String id = item.path("track").path("id").asText(null);
                if (id != null && !id.isBlank()) {
                    ids.add(id);
                }
            }
            String nextUrl = page.path("next").asText(null);
            next = nextUrl != null ? HttpUrl.parse(nextUrl) : null;
        }
        return ids;
    }

    @Override
    public int getTrackPosition(String trackId) {
        List<String> ids = getPlaylistTrackIds();
        int target = ids.lastIndexOf(trackId);
        if (target < 0) {
            return -1;
        }
        Optional<JsonNode> player = playerState();
        if (player.isEmpty() || !isPlayingPlaylist(player.get())) {
            return -1;
        }
        int current = ids.indexOf(player.get().path("item").path("id").asText(""));
        if (current < 0 || target <= current) {
            return -1;
        }
        return target - current - 1;
    }

    @Override
    public String getPlaylistUrl() {
        return PLAYLIST_URL + properties.getSpotify().getPlaylistId();
    }

    // ==================== Player ====================

    @Override
    public void addToQueue(String trackId) {
        HttpUrl url = api("me", "player", "queue").newBuilder()
                .addQueryParameter("uri", SpotifyLinks.trackUri(trackId))
                .build();
        send(new Request.Builder().url(url).post(RequestBody.create(new byte[0], null)));
        log.info("[Spotify] Queued {}", trackId);
    }

    @Override
    public boolean hasActiveDevice() {
        JsonNode response = get(api("me", "player", "devices"));
        for (JsonNode device : response.path("devices")) {
            if (device.path("is_active").asBoolean(false)) {
                log.debug("[Spotify] Active device: {} ({})", device.path("name").asText(""),
                        device.path("type").asText(""));
                return true;
            }
        }
        log.debug("[Spotify] No active device among {}", response.path("devices").size());
        return false;
    }

    @Override
    public boolean isNearPlaylistEnd() {
        Optional<JsonNode> player = playerState();
        if (player.isEmpty() || !player.get().path("is_playing").asBoolean(false)
                || !isPlayingPlaylist(player.get())) {
            return false;
        }
        String currentId = player.get().path("item").path("id").asText("");
        List<String> ids = getPlaylistTrackIds();
        int current = ids.lastIndexOf(currentId);
        if (current < 0) {
            return false;
        }
        int remaining = ids.size() - current - 1;
        log.debug("[Spotify] {} tracks left after the current one", remaining);
        return remaining <= properties.getSpotify().getNearEndTracks();
    }

    @Override
    public Optional<PlaybackCompliance> checkPlaybackCompliance() {
        Optional<JsonNode> player = playerState();
        if (player.isEmpty()) {
            return Optional.empty();
        }
        JsonNode state = player.get();
        PlaybackCompliance.PlaybackComplianceBuilder builder = PlaybackCompliance.builder();

        boolean shuffleOff = !state.path("shuffle_state").asBoolean(false);
        builder.shuffleOff(shuffleOff);
        if (!shuffleOff) {
            builder.issue("Shuffle is enabled (should be off for auto-DJing)");
        }

        String repeat = state.path("repeat_state").asText(REPEAT_OFF);
        boolean repeatOk = REPEAT_OFF.equals(repeat) || REPEAT_CONTEXT.equals(repeat);
        builder.repeatOk(repeatOk);
        if (!repeatOk) {
            builder.issue("Repeat is set to '" + repeat + "' (should be off or playlist)");
        }

        boolean correctPlaylist = isPlayingPlaylist(state);
        builder.correctPlaylist(correctPlaylist);
        if (!correctPlaylist) {
            builder.issue("Not playing from the managed playlist");
        }
        return Optional.of(builder.build());
    }

    @Override
    public void setShuffle(boolean enabled) {
        HttpUrl url = api("me", "player", "shuffle").newBuilder()
                .addQueryParameter("state", String.valueOf(enabled))
                .build();
        send(new Request.Builder().url(url).put(RequestBody.create(new byte[0], null)));
        log.info("[Spotify] Shuffle set to {}", enabled);
    }

    @Override
    public void setRepeatMode(String mode) {
        HttpUrl url = api("me", "player", "repeat").newBuilder()
                .addQueryParameter("state", mode)
                .build();
        send(new Request.Builder().url(url).put(RequestBody.create(new byte[0], null)));
        log.info("[Spotify] Repeat set to {}", mode);
    }

    // ==================== Internals ====================

    private Optional<JsonNode> playerState() {
        JsonNode state = call(new Request.Builder().url(api("me", "player")).get());
        if (state == null || state.path("item").isMissingNode() || state.path("item").isNull()) {
            return Optional.empty();
        }
        return Optional.of(state);
    }

    private boolean isPlayingPlaylist(JsonNode state) {
        String contextUri = state.path("context").path("uri").asText("");
        return contextUri.equals("spotify:playlist:" + properties.getSpotify().getPlaylistId());
    }

    private Optional<String> resolveShortLink(String url) {
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            String resolved = response.request().url().toString();
            log.debug("[Spotify] Short link {} resolved to {}", url, resolved);
            return Optional.of(resolved);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("[Spotify] Failed to resolve short link {}: {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    private Track toTrack(JsonNode item) {
        if (item == null || item.isNull() || item.isMissingNode()) {
            return null;
        }
        String id = item.path("id").asText(null);
        String title = item.path("name").asText("");
        if (id == null || title.isBlank()) {
            return null;
        }
        List<String> artists = new ArrayList<>();
        for (JsonNode artist : item.path("artists")) {
            artists.add(artist.path("name").asText(""));
        }
        String releaseDate = item.path("album").path("release_date").asText("");
        int year = 0;
        if (releaseDate.length() >= 4) {
            try {
                year = Integer.parseInt(releaseDate.substring(0, 4));
            } catch (NumberFormatException e) {
                log.debug("[Spotify] Unparseable release date '{}' for {}", releaseDate, id);
            }
        }
        return Track.builder()
                .id(id)
                .title(title)
                .artist(String.join(", ", artists))
                .album(item.path("album").path("name").asText(""))
                .year(year)
                .duration(Duration.ofMillis(item.path("duration_ms").asLong(0)))
                .url(item.path("external_urls").path("spotify").asText(""))
                .build();
    }

    private static String primaryArtist(Track track) {
        String artist = track.getArtist();
        int comma = artist.indexOf(", ");
        return comma > 0 ? artist.substring(0, comma) : artist;
    }

    private HttpUrl api(String... segments) {
        HttpUrl base = HttpUrl.parse(properties.getSpotify().getApiUrl());
        if (base == null) {
            throw new CatalogException("Invalid Spotify API url: " + properties.getSpotify().getApiUrl());
        }
        HttpUrl.Builder builder = base.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    private HttpUrl playlistTracks() {
        return api("playlists", properties.getSpotify().getPlaylistId(), "tracks");
    }

    private RequestBody jsonBody(JsonNode body) {
        try {
            return RequestBody.create(objectMapper.writeValueAsString(body), JSON);
        } catch (JsonProcessingException e) {
            throw new CatalogException("Failed to serialize request", e);
        }
    }

    private JsonNode get(HttpUrl url) {
        JsonNode response = call(new Request.Builder().url(url).get());
        if (response == null) {
            throw new CatalogException("Empty response from " + url.encodedPath());
        }
        return response;
    }

    private void send(Request.Builder request) {
        call(request);
    }

    /**
     * @return parsed body, or {@code null} for 204 and empty bodies
     */
    private JsonNode call(Request.Builder request) {
        try {
            return execute(request, true);
        } catch (IOException e) {
            throw new CatalogException("Spotify request failed: " + e.getMessage(), e);
        }
    }

    private JsonNode execute(Request.Builder request, boolean retryOnUnauthorized) throws IOException {
        Request authorized = request
                .header("Authorization", "Bearer " + tokenProvider.getAccessToken())
                .build();
        try (Response response = httpClient.newCall(authorized).execute()) {
            if (response.code() == 401 && retryOnUnauthorized) {
                log.debug("[Spotify] Token rejected, refreshing");
                tokenProvider.invalidate();
                return execute(request, false);
            }
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw new CatalogException("Spotify " + authorized.method() + " "
                        + authorized.url().encodedPath() + " failed: HTTP " + response.code());
            }
            if (response.code() == 204 || text.isBlank()) {
                return null;
            }
            return objectMapper.readTree(text);
        }
    }
}
