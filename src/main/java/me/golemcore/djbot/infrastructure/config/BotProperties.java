package me.golemcore.djbot.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties for the DJ bot, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link AppProperties} - request timeouts, retry policy, language</li>
 * <li>{@link DedupProperties} - duplicate tracking capacity</li>
 * <li>{@link FloodProperties} - per-user message rate limit</li>
 * <li>{@link TelegramProperties} - chat frontend and approval gates</li>
 * <li>{@link SpotifyProperties} - catalog credentials and target playlist</li>
 * <li>{@link LlmProperties} - ranking model</li>
 * <li>{@link MonitorProperties} - background playback monitors</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private AppProperties app = new AppProperties();
    private DedupProperties dedup = new DedupProperties();
    private FloodProperties flood = new FloodProperties();
    private TelegramProperties telegram = new TelegramProperties();
    private SpotifyProperties spotify = new SpotifyProperties();
    private LlmProperties llm = new LlmProperties();
    private MonitorProperties monitor = new MonitorProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class AppProperties {
        private int confirmTimeoutSeconds = 120;
        private int confirmAdminTimeoutSeconds = 3600;
        private int maxRetries = 3;
        private Duration retryDelay = Duration.ofSeconds(5);
        private Duration shutdownDrain = Duration.ofSeconds(10);
        private String language = "en";
    }

    @Data
    public static class DedupProperties {
        private int maxTracks = 10000;
        private double falsePositiveRate = 0.001;
    }

    @Data
    public static class FloodProperties {
        private int limitPerMinute = 6;
        private Duration cleanupInterval = Duration.ofMinutes(10);
        private Duration idleTimeout = Duration.ofMinutes(10);
    }

    @Data
    public static class TelegramProperties {
        private boolean enabled = false;
        private String token;
        private String groupId;
        private boolean adminApproval = false;
        private boolean adminNeedsApproval = false;
        /** Number of 👍 reactions that approve a request; 0 disables community approval. */
        private int communityApproval = 0;
    }

    @Data
    public static class SpotifyProperties {
        private String clientId;
        private String clientSecret;
        private String refreshToken;
        private String playlistId;
        private String apiUrl = "https://api.spotify.com/v1";
        private String accountsUrl = "https://accounts.spotify.com";
        private int searchLimit = 10;
        private int nearEndTracks = 2;
        private int timeoutSeconds = 15;
    }

    @Data
    public static class LlmProperties {
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private double temperature = 0.2;
        private double confidenceThreshold = 0.65;
        private long timeoutMs = 30000;
    }

    @Data
    public static class MonitorProperties {
        private AutoPlayProperties autoPlay = new AutoPlayProperties();
        private ComplianceProperties compliance = new ComplianceProperties();
        private PermissionsProperties permissions = new PermissionsProperties();
    }

    @Data
    public static class AutoPlayProperties {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(60);
        private int approvalTimeoutSeconds = 30;
        private int maxReplacements = 3;
        private int recommendationCount = 5;
    }

    @Data
    public static class ComplianceProperties {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(20);
        private Duration warningCooldown = Duration.ofMinutes(30);
        private boolean autoCorrect = true;
    }

    @Data
    public static class PermissionsProperties {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(5);
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
