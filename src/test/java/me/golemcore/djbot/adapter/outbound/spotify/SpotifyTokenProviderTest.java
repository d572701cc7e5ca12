package me.golemcore.djbot.adapter.outbound.spotify;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.djbot.infrastructure.config.BotProperties;
import me.golemcore.djbot.port.outbound.CatalogException;
import me.golemcore.djbot.testsupport.MutableClock;
import me.golemcore.djbot.testsupport.http.OkHttpMockEngine;
import okhttp3.Credentials;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SpotifyTokenProviderTest {

    private OkHttpMockEngine engine;
    private MutableClock clock;
    private BotProperties properties;
    private SpotifyTokenProvider provider;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        clock = MutableClock.startingAt("2026-02-01T20:00:00Z");
        properties = new BotProperties();
        properties.getSpotify().setAccountsUrl("https://accounts.test");
        properties.getSpotify().setClientId("client");
        properties.getSpotify().setClientSecret("secret");
        properties.getSpotify().setRefreshToken("refresh");

        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(engine).build();
        provider = new SpotifyTokenProvider(properties, client, new ObjectMapper(), clock);
    }

    @Test
    void shouldRefreshTokenWithClientCredentials() {
        engine.enqueueJson(200, "{\"access_token\":\"tok-1\",\"expires_in\":3600}");

        assertEquals("tok-1", provider.getAccessToken());

        OkHttpMockEngine.Recorded request = engine.request(0);
        assertEquals("POST", request.method());
        assertEquals("/api/token", request.target());
        assertEquals(Credentials.basic("client", "secret"), request.header("Authorization"));
        assertEquals("grant_type=refresh_token&refresh_token=refresh", request.body());
    }

    @Test
    void shouldCacheTokenUntilShortlyBeforeExpiry() {
        engine.enqueueJson(200, "{\"access_token\":\"tok-1\",\"expires_in\":3600}");
        engine.enqueueJson(200, "{\"access_token\":\"tok-2\",\"expires_in\":3600}");

        assertEquals("tok-1", provider.getAccessToken());
        clock.advance(Duration.ofMinutes(58));
        assertEquals("tok-1", provider.getAccessToken());
        clock.advance(Duration.ofMinutes(1));
        assertEquals("tok-2", provider.getAccessToken());
        assertEquals(2, engine.requestCount());
    }

    @Test
    void shouldRefreshAfterInvalidate() {
        engine.enqueueJson(200, "{\"access_token\":\"tok-1\",\"expires_in\":3600}");
        engine.enqueueJson(200, "{\"access_token\":\"tok-2\",\"expires_in\":3600}");
        provider.getAccessToken();

        provider.invalidate();

        assertEquals("tok-2", provider.getAccessToken());
    }

    @Test
    void shouldFailWhenNotConfigured() {
        properties.getSpotify().setRefreshToken(" ");

        assertFalse(provider.isConfigured());
        assertThrows(CatalogException.class, provider::getAccessToken);
        assertEquals(0, engine.requestCount());
    }

    @Test
    void shouldFailOnRejectedRefresh() {
        engine.enqueueJson(400, "{\"error\":\"invalid_grant\"}");

        assertThrows(CatalogException.class, provider::getAccessToken);
    }

    @Test
    void shouldFailWhenResponseHasNoToken() {
        engine.enqueueJson(200, "{\"token_type\":\"Bearer\"}");

        assertThrows(CatalogException.class, provider::getAccessToken);
    }

    @Test
    void shouldWrapNetworkFailure() {
        engine.enqueueFailure(new IOException("unreachable"));

        CatalogException e = assertThrows(CatalogException.class, provider::getAccessToken);
        assertInstanceOf(IOException.class, e.getCause());
    }
}
