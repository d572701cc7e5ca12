package me.golemcore.djbot.domain.service;

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
import me.golemcore.djbot.port.outbound.ChatFrontendPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Direct-message warnings to chat admins with debounce and cleanup.
 *
 * <p>
 * A warning of a given type is sent at most once per cooldown window, however
 * often the condition is detected. Clearing a warning deletes the messages
 * that were sent but keeps the cooldown running, so a flapping condition does
 * not flood admins. Each warning type has its own cooldown and messages.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class AdminWarningManager {

    public enum WarningType {
        PLAYBACK_SETTINGS, NO_ACTIVE_DEVICE, BOT_PERMISSIONS
    }

    private final ChatFrontendPort frontend;
    private final Duration cooldown;
    private final Clock clock;

    private final Map<WarningType, Instant> lastSent = new EnumMap<>(WarningType.class);
    private final Map<WarningType, Map<String, String>> sentMessages = new EnumMap<>(WarningType.class);

    @Autowired
    public AdminWarningManager(ChatFrontendPort frontend, BotProperties properties, Clock clock) {
        this(frontend, properties.getMonitor().getCompliance().getWarningCooldown(), clock);
    }

    public AdminWarningManager(ChatFrontendPort frontend, Duration cooldown, Clock clock) {
        this.frontend = frontend;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    public synchronized boolean shouldSendWarning(WarningType type) {
        Instant last = lastSent.get(type);
        return last == null || !clock.instant().isBefore(last.plus(cooldown));
    }

    /**
     * Send {@code text} to every admin, replacing any earlier warning of the
     * same type.
     *
     * @return number of admins reached
     */
    public int sendWarning(WarningType type, List<String> adminIds, String text) {
        Map<String, String> previous;
        Map<String, String> delivered = new HashMap<>();
        synchronized (this) {
            previous = sentMessages.put(type, delivered);
            lastSent.put(type, clock.instant());
        }
        deleteAll(type, previous);

        for (String adminId : adminIds) {
            try {
                String messageId = frontend.sendDirectMessage(adminId, text);
                synchronized (this) {
                    delivered.put(adminId, messageId);
                }
            } catch (RuntimeException e) {
                log.warn("[Warnings] Failed to send {} warning to {}: {}", type, adminId, e.getMessage());
            }
        }
        log.info("[Warnings] {} warning sent to {}/{} admins", type, delivered.size(), adminIds.size());
        return delivered.size();
    }

    /**
     * Delete the warning messages of this type. The cooldown is not reset.
     */
    public void clearWarning(WarningType type) {
        Map<String, String> toDelete;
        synchronized (this) {
            toDelete = sentMessages.remove(type);
        }
        if (toDelete != null && !toDelete.isEmpty()) {
            log.info("[Warnings] Clearing {} warning ({} messages)", type, toDelete.size());
            deleteAll(type, toDelete);
        }
    }

    public synchronized boolean isWarningActive(WarningType type) {
        Map<String, String> messages = sentMessages.get(type);
        return messages != null && !messages.isEmpty();
    }

    private void deleteAll(WarningType type, Map<String, String> messages) {
        if (messages == null) {
            return;
        }
        Map<String, String> snapshot;
        synchronized (this) {
            snapshot = new HashMap<>(messages);
        }
        snapshot.forEach((userId, messageId) -> {
            try {
                frontend.deleteMessage(userId, messageId);
            } catch (RuntimeException e) {
                log.debug("[Warnings] Failed to delete {} warning {} for {}: {}", type, messageId, userId,
                        e.getMessage());
            }
        });
    }
}
