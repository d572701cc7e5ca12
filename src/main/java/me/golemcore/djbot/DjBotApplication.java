package me.golemcore.djbot;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Main application class for the group chat DJ bot.
 *
 * <p>
 * The bot listens to a Telegram group and turns song requests into additions
 * to a shared Spotify playlist, optionally routed through AI disambiguation and
 * human approval gates.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Link handling</b> - Spotify links are added directly, other links
 * trigger a clarification question</li>
 * <li><b>Disambiguation</b> - free text is searched, ranked by an LLM via
 * langchain4j and confirmed by the requester</li>
 * <li><b>Approval gates</b> - admin approval by DM, community approval by
 * reactions, or a race between both</li>
 * <li><b>Protection</b> - per-user flood gate and bloom-filter backed duplicate
 * detection</li>
 * <li><b>Monitors</b> - auto-play prevention and playback compliance
 * warnings</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → TelegramAdapter
 * Domain Layer       → Dispatcher, approval services, DedupStore, FloodGate
 * Infrastructure     → Spotify / LLM adapters, monitors
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code bot.*}
 * prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
public class DjBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(DjBotApplication.class, args);
    }

}
