package me.golemcore.djbot.adapter.outbound.spotify;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.djbot.domain.model.PlaybackCompliance;
import me.golemcore.djbot.domain.model.Track;
import me.golemcore.djbot.infrastructure.config.BotProperties;
import me.golemcore.djbot.port.outbound.CatalogException;
import me.golemcore.djbot.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SpotifyCatalogAdapterTest {

    private static final String PLAYLIST_ID = "pl1";
    private static final String TRACK_ID = "4uLU6hMCjMI75M1A2tKUQC";

    private OkHttpMockEngine engine;
    private SpotifyTokenProvider tokenProvider;
    private BotProperties properties;
    private SpotifyCatalogAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        tokenProvider = mock(SpotifyTokenProvider.class);
        when(tokenProvider.getAccessToken()).thenReturn("tok");

        properties = new BotProperties();
        properties.getSpotify().setApiUrl("https://api.test/v1");
        properties.getSpotify().setPlaylistId(PLAYLIST_ID);
        properties.getSpotify().setSearchLimit(10);
        properties.getSpotify().setNearEndTracks(2);

        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(engine).build();
        adapter = new SpotifyCatalogAdapter(properties, tokenProvider, client, new ObjectMapper());
    }

    // ===== Links =====

    @Test
    void shouldExtractTrackIdWithoutNetwork() {
        Optional<String> id = adapter.extractTrackId("https://open.spotify.com/track/" + TRACK_ID + "?si=abc");

        assertEquals(Optional.of(TRACK_ID), id);
        assertEquals(0, engine.requestCount());
    }

    @Test
    void shouldNotResolveForeignLinks() {
        assertTrue(adapter.extractTrackId("https://youtube.com/watch?v=xyz").isEmpty());
        assertEquals(0, engine.requestCount());
    }

    @Test
    void shouldReturnEmptyWhenShortLinkCannotBeResolved() {
        engine.enqueueFailure(new IOException("connection reset"));

        assertTrue(adapter.extractTrackId("https://spotify.link/AbCdEf").isEmpty());
        assertEquals(1, engine.requestCount());
        assertNull(engine.request(0).header("Authorization"));
    }

    // ===== Catalog =====

    @Test
    void shouldSearchTracks() {
        engine.enqueueJson(200, "{\"tracks\":{\"items\":["
                + trackJson("t1", "Hells Bells", "AC/DC", "1980-07-25") + ","
                + "{\"id\":\"t2\",\"name\":\"\"}]}}");

        List<Track> tracks = adapter.searchTracks("hells bells");

        assertEquals(1, tracks.size());
        Track track = tracks.get(0);
        assertEquals("t1", track.getId());
        assertEquals("Hells Bells", track.getTitle());
        assertEquals("AC/DC", track.getArtist());
        assertEquals("Album t1", track.getAlbum());
        assertEquals(1980, track.getYear());
        assertEquals(Duration.ofMillis(312000), track.getDuration());
        assertEquals("https://open.spotify.com/track/t1", track.getUrl());

        OkHttpMockEngine.Recorded request = engine.request(0);
        assertEquals("GET", request.method());
        assertEquals("/v1/search?q=hells bells&type=track&limit=10", request.target());
        assertEquals("Bearer tok", request.header("Authorization"));
    }

    @Test
    void shouldJoinMultipleArtists() {
        engine.enqueueJson(200, "{\"id\":\"t1\",\"name\":\"Under Pressure\",\"artists\":"
                + "[{\"name\":\"Queen\"},{\"name\":\"David Bowie\"}],\"album\":{\"name\":\"Hot Space\","
                + "\"release_date\":\"1982\"},\"duration_ms\":248000}");

        Track track = adapter.getTrack("t1");

        assertEquals("Queen, David Bowie", track.getArtist());
        assertEquals(1982, track.getYear());
        assertEquals("/v1/tracks/t1", engine.request(0).target());
    }

    @Test
    void shouldFailWhenTrackNotFound() {
        engine.enqueueJson(200, "{}");

        assertThrows(CatalogException.class, () -> adapter.getTrack("missing"));
    }

    @Test
    void shouldFailOnHttpError() {
        engine.enqueueJson(500, "{\"error\":{\"status\":500}}");

        CatalogException e = assertThrows(CatalogException.class, () -> adapter.getTrack("t1"));
        assertTrue(e.getMessage().contains("HTTP 500"));
    }

    @Test
    void shouldWrapIoFailure() {
        engine.enqueueFailure(new IOException("timeout"));

        assertThrows(CatalogException.class, () -> adapter.searchTracks("x"));
    }

    @Test
    void shouldRetryOnceWithFreshTokenAfterUnauthorized() {
        engine.enqueueJson(401, "{}");
        engine.enqueueJson(200, trackJson("t1", "Hells Bells", "AC/DC", "1980"));

        Track track = adapter.getTrack("t1");

        assertEquals("t1", track.getId());
        assertEquals(2, engine.requestCount());
        verify(tokenProvider).invalidate();
    }

    @Test
    void shouldFailWhenStillUnauthorizedAfterRetry() {
        engine.enqueueJson(401, "{}");
        engine.enqueueJson(401, "{}");

        assertThrows(CatalogException.class, () -> adapter.getTrack("t1"));
        verify(tokenProvider, times(1)).invalidate();
    }

    @Test
    void shouldRecommendTracksByRecentArtists() {
        engine.enqueueJson(200, "{\"items\":[" + itemJson("a") + "," + itemJson("b") + "],\"next\":null}");
        engine.enqueueJson(200, trackJson("b", "Song B", "Artist B", "2001"));
        engine.enqueueJson(200, trackJson("a", "Song A", "Artist A", "1999"));
        engine.enqueueJson(200, "{\"tracks\":{\"items\":[" + trackJson("b", "Song B", "Artist B", "2001") + ","
                + trackJson("x", "Song X", "Artist B", "2003") + "]}}");
        engine.enqueueJson(200, "{\"tracks\":{\"items\":[" + trackJson("y", "Song Y", "Artist A", "2005") + "]}}");

        List<Track> recommended = adapter.getRecommendedTracks(2);

        assertEquals(List.of("x", "y"), recommended.stream().map(Track::getId).toList());
        assertEquals("/v1/search?q=artist:\"Artist B\"&type=track&limit=10", engine.request(3).target());
        assertEquals("/v1/search?q=artist:\"Artist A\"&type=track&limit=10", engine.request(4).target());
    }

    @Test
    void shouldReturnNoRecommendationsForZeroLimit() {
        assertTrue(adapter.getRecommendedTracks(0).isEmpty());
        assertEquals(0, engine.requestCount());
    }

    // ===== Playlist =====

    @Test
    void shouldAppendTrackToPlaylist() {
        engine.enqueueJson(201, "{\"snapshot_id\":\"s1\"}");

        adapter.addToPlaylist("t1");

        OkHttpMockEngine.Recorded request = engine.request(0);
        assertEquals("POST", request.method());
        assertEquals("/v1/playlists/pl1/tracks", request.target());
        assertEquals("{\"uris\":[\"spotify:track:t1\"]}", request.body());
    }

    @Test
    void shouldInsertTrackAtPosition() {
        engine.enqueueJson(201, "{\"snapshot_id\":\"s1\"}");

        adapter.addToPlaylistAtPosition("t1", 0);

        assertEquals("{\"uris\":[\"spotify:track:t1\"],\"position\":0}", engine.request(0).body());
    }

    @Test
    void shouldRemoveTrackFromPlaylist() {
        engine.enqueueJson(200, "{\"snapshot_id\":\"s2\"}");

        adapter.removeFromPlaylist("t1");

        OkHttpMockEngine.Recorded request = engine.request(0);
        assertEquals("DELETE", request.method());
        assertEquals("{\"tracks\":[{\"uri\":\"spotify:track:t1\"}]}", request.body());
    }

    @Test
    void shouldFollowPlaylistPages() {
        engine.enqueueJson(200, "{\"items\":[" + itemJson("a") + ",{\"track\":null}],"
                + "\"next\":\"https://api.test/v1/playlists/pl1/tracks?offset=100&limit=100\"}");
        engine.enqueueJson(200, "{\"items\":[" + itemJson("b") + "],\"next\":null}");

        List<String> ids = adapter.getPlaylistTrackIds();

        assertEquals(List.of("a", "b"), ids);
        assertEquals("/v1/playlists/pl1/tracks?fields=items(track(id)),next&limit=100", engine.request(0).target());
        assertEquals("/v1/playlists/pl1/tracks?offset=100&limit=100", engine.request(1).target());
    }

    @Test
    void shouldComputeQueuePositionFromCurrentTrack() {
        engine.enqueueJson(200, playlistJson("a", "b", "c", "d"));
        engine.enqueueJson(200, playerJson("b", true, false, "off", PLAYLIST_ID));

        assertEquals(1, adapter.getTrackPosition("d"));
    }

    @Test
    void shouldReturnUnknownPositionWhenTrackAlreadyPlayed() {
        engine.enqueueJson(200, playlistJson("a", "b", "c"));
        engine.enqueueJson(200, playerJson("c", true, false, "off", PLAYLIST_ID));

        assertEquals(-1, adapter.getTrackPosition("a"));
    }

    @Test
    void shouldReturnUnknownPositionWhenPlayingElsewhere() {
        engine.enqueueJson(200, playlistJson("a", "b", "c"));
        engine.enqueueJson(200, playerJson("a", true, false, "off", "other"));

        assertEquals(-1, adapter.getTrackPosition("c"));
    }

    @Test
    void shouldReturnUnknownPositionWhenTrackNotInPlaylist() {
        engine.enqueueJson(200, playlistJson("a", "b"));

        assertEquals(-1, adapter.getTrackPosition("z"));
        assertEquals(1, engine.requestCount());
    }

    @Test
    void shouldBuildPlaylistUrl() {
        assertEquals("https://open.spotify.com/playlist/pl1", adapter.getPlaylistUrl());
    }

    // ===== Player =====

    @Test
    void shouldAddTrackToQueue() {
        engine.enqueueEmpty(204);

        adapter.addToQueue("t1");

        OkHttpMockEngine.Recorded request = engine.request(0);
        assertEquals("POST", request.method());
        assertEquals("/v1/me/player/queue?uri=spotify:track:t1", request.target());
    }

    @Test
    void shouldFindActiveDevice() {
        engine.enqueueJson(200, "{\"devices\":[{\"id\":\"d1\",\"name\":\"Laptop\",\"type\":\"Computer\","
                + "\"is_active\":false},{\"id\":\"d2\",\"name\":\"Speaker\",\"type\":\"Speaker\","
                + "\"is_active\":true}]}");

        assertTrue(adapter.hasActiveDevice());
        assertEquals("GET", engine.request(0).method());
        assertEquals("/v1/me/player/devices", engine.request(0).target());
    }

    @Test
    void shouldReportNoActiveDevice() {
        engine.enqueueJson(200, "{\"devices\":[{\"id\":\"d1\",\"name\":\"Laptop\",\"is_active\":false}]}");

        assertFalse(adapter.hasActiveDevice());
    }

    @Test
    void shouldReportNoActiveDeviceWhenNoneRegistered() {
        engine.enqueueJson(200, "{\"devices\":[]}");

        assertFalse(adapter.hasActiveDevice());
    }

    @Test
    void shouldDetectPlaylistNearEnd() {
        engine.enqueueJson(200, playerJson("c", true, false, "off", PLAYLIST_ID));
        engine.enqueueJson(200, playlistJson("a", "b", "c", "d"));

        assertTrue(adapter.isNearPlaylistEnd());
    }

    @Test
    void shouldNotBeNearEndWithEnoughTracksLeft() {
        engine.enqueueJson(200, playerJson("a", true, false, "off", PLAYLIST_ID));
        engine.enqueueJson(200, playlistJson("a", "b", "c", "d"));

        assertFalse(adapter.isNearPlaylistEnd());
    }

    @Test
    void shouldNotBeNearEndWhenPaused() {
        engine.enqueueJson(200, playerJson("d", false, false, "off", PLAYLIST_ID));

        assertFalse(adapter.isNearPlaylistEnd());
        assertEquals(1, engine.requestCount());
    }

    @Test
    void shouldReportNothingWhenPlayerIsIdle() {
        engine.enqueueEmpty(204);

        assertTrue(adapter.checkPlaybackCompliance().isEmpty());
    }

    @Test
    void shouldReportCompliantPlayback() {
        engine.enqueueJson(200, playerJson("a", true, false, "context", PLAYLIST_ID));

        PlaybackCompliance compliance = adapter.checkPlaybackCompliance().orElseThrow();

        assertTrue(compliance.isCompliant());
        assertTrue(compliance.getIssues().isEmpty());
    }

    @Test
    void shouldReportEveryComplianceIssue() {
        engine.enqueueJson(200, playerJson("a", true, true, "track", "other"));

        PlaybackCompliance compliance = adapter.checkPlaybackCompliance().orElseThrow();

        assertFalse(compliance.isCompliant());
        assertFalse(compliance.isShuffleOff());
        assertFalse(compliance.isRepeatOk());
        assertFalse(compliance.isCorrectPlaylist());
        assertEquals(List.of(
                "Shuffle is enabled (should be off for auto-DJing)",
                "Repeat is set to 'track' (should be off or playlist)",
                "Not playing from the managed playlist"), compliance.getIssues());
    }

    @Test
    void shouldDisableShuffle() {
        engine.enqueueEmpty(204);

        adapter.setShuffle(false);

        assertEquals("PUT", engine.request(0).method());
        assertEquals("/v1/me/player/shuffle?state=false", engine.request(0).target());
    }

    @Test
    void shouldSetRepeatMode() {
        engine.enqueueEmpty(204);

        adapter.setRepeatMode("off");

        assertEquals("/v1/me/player/repeat?state=off", engine.request(0).target());
    }

    private static String trackJson(String id, String name, String artist, String releaseDate) {
        return "{\"id\":\"" + id + "\",\"name\":\"" + name + "\",\"artists\":[{\"name\":\"" + artist + "\"}],"
                + "\"album\":{\"name\":\"Album " + id + "\",\"release_date\":\"" + releaseDate + "\"},"
                + "\"duration_ms\":312000,\"external_urls\":{\"spotify\":\"https://open.spotify.com/track/" + id
                + "\"}}";
    }

    private static String itemJson(String id) {
        return "{\"track\":{\"id\":\"" + id + "\"}}";
    }

    private static String playlistJson(String... ids) {
        StringBuilder items = new StringBuilder();
        for (String id : ids) {
            if (items.length() > 0) {
                items.append(',');
            }
            items.append(itemJson(id));
        }
        return "{\"items\":[" + items + "],\"next\":null}";
    }

    private static String playerJson(String currentId, boolean playing, boolean shuffle, String repeat,
            String playlistId) {
        return "{\"is_playing\":" + playing + ",\"shuffle_state\":" + shuffle + ",\"repeat_state\":\"" + repeat
                + "\",\"context\":{\"uri\":\"spotify:playlist:" + playlistId + "\"},"
                + "\"item\":{\"id\":\"" + currentId + "\",\"name\":\"Song\"}}";
    }
}
