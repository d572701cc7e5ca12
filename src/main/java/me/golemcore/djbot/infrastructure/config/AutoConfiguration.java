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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans and the startup summary.
 *
 * <p>
 * Provides the {@link Clock} used by time-based components (flood gate,
 * warning debounce) and the Jackson {@link ObjectMapper} used by the REST and
 * ranking adapters. Logs the effective approval policy on startup so a
 * misconfigured group is visible in the first lines of the log.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final BotProperties properties;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        BotProperties.TelegramProperties telegram = properties.getTelegram();
        log.info("GolemCore DJ Bot v{} starting...", version);
        log.info("Target playlist: {}", properties.getSpotify().getPlaylistId());
        log.info("Ranking model: {} (threshold {})", properties.getLlm().getModel(),
                properties.getLlm().getConfidenceThreshold());
        log.info("Approval: admin={}, adminNeedsApproval={}, community={}",
                telegram.isAdminApproval(), telegram.isAdminNeedsApproval(), telegram.getCommunityApproval());
        log.info("Flood limit: {}/min, dedup capacity: {}",
                properties.getFlood().getLimitPerMinute(), properties.getDedup().getMaxTracks());
    }
}
