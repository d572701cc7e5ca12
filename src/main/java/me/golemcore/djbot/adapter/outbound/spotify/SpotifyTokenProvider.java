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

import me.golemcore.djbot.infrastructure.config.BotProperties;
import me.golemcore.djbot.port.outbound.CatalogException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Credentials;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;

/**
 * Access tokens for the Web API, obtained from the configured refresh token
 * and cached until shortly before they expire.
 */
@Component
@Slf4j
public class SpotifyTokenProvider {

    private static final long EXPIRY_MARGIN_SECONDS = 60;

    private final BotProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private String accessToken;
    private Instant expiresAt = Instant.EPOCH;

    public SpotifyTokenProvider(BotProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper,
            Clock clock) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public boolean isConfigured() {
        BotProperties.SpotifyProperties spotify = properties.getSpotify();
        return notBlank(spotify.getClientId()) && notBlank(spotify.getClientSecret())
                && notBlank(spotify.getRefreshToken());
    }

    public synchronized String getAccessToken() {
        if (accessToken != null && clock.instant().isBefore(expiresAt)) {
            return accessToken;
        }
        refresh();
        return accessToken;
    }

    public synchronized void invalidate() {
        accessToken = null;
        expiresAt = Instant.EPOCH;
    }

    private void refresh() {
        if (!isConfigured()) {
            throw new CatalogException("Spotify credentials are not configured");
        }
        BotProperties.SpotifyProperties spotify = properties.getSpotify();
        Request request = new Request.Builder()
                .url(spotify.getAccountsUrl() + "/api/token")
                .header("Authorization", Credentials.basic(spotify.getClientId(), spotify.getClientSecret()))
                .post(new FormBody.Builder()
                        .add("grant_type", "refresh_token")
                        .add("refresh_token", spotify.getRefreshToken())
                        .build())
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new CatalogException("Token refresh failed: HTTP " + response.code());
            }
            JsonNode json = objectMapper.readTree(body.string());
            String token = json.path("access_token").asText(null);
            if (token == null || token.isBlank()) {
                throw new CatalogException("Token refresh returned no access token");
            }
            long expiresIn = json.path("expires_in").asLong(3600);
            accessToken = token;
            expiresAt = clock.instant().plusSeconds(Math.max(0, expiresIn - EXPIRY_MARGIN_SECONDS));
            log.debug("[Spotify] Access token refreshed, valid for {}s", expiresIn);
        } catch (IOException e) {
            throw new CatalogException("Token refresh failed", e);
        }
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
