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

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Track id extraction from Spotify URIs and open.spotify.com links.
 */
final class SpotifyLinks {

    private static final Pattern TRACK_URI = Pattern.compile("^spotify:track:([A-Za-z0-9]{22})$");
    private static final Pattern TRACK_URL = Pattern.compile(
            "^https?://(?:open|play)\\.spotify\\.com/(?:intl-[a-z-]+/)?(?:embed/)?track/([A-Za-z0-9]{22})(?:[/?#].*)?$");
    private static final Pattern SHORT_URL = Pattern.compile("^https?://(?:spotify\\.link|spotify\\.app\\.link)/\\S+$");

    private SpotifyLinks() {
    }

    static Optional<String> trackId(String url) {
        if (url == null) {
            return Optional.empty();
        }
        String trimmed = url.trim();
        Matcher uri = TRACK_URI.matcher(trimmed);
        if (uri.matches()) {
            return Optional.of(uri.group(1));
        }
        Matcher link = TRACK_URL.matcher(trimmed);
        if (link.matches()) {
            return Optional.of(link.group(1));
        }
        return Optional.empty();
    }

    static boolean isShortLink(String url) {
        return url != null && SHORT_URL.matcher(url.trim()).matches();
    }

    static String trackUri(String trackId) {
        return "spotify:track:" + trackId;
    }
}
