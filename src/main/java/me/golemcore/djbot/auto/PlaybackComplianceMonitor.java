package me.golemcore.djbot.auto;

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
import me.golemcore.djbot.domain.service.AdminWarningManager;
import me.golemcore.djbot.domain.service.AdminWarningManager.WarningType;
import me.golemcore.djbot.infrastructure.config.BotProperties;
import me.golemcore.djbot.infrastructure.i18n.MessageService;
import me.golemcore.djbot.port.outbound.CatalogPort;
import me.golemcore.djbot.port.outbound.ChatFrontendPort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Watches the player settings: shuffle must be off, repeat must not loop a
 * single track, and playback must come from the target playlist.
 *
 * <p>
 * Shuffle and repeat are corrected automatically when allowed. Whatever cannot
 * be corrected is reported to the chat admins by direct message, debounced by
 * {@link AdminWarningManager}. Once playback is compliant again the warning
 * messages are deleted.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlaybackComplianceMonitor {

    static final String REPEAT_OFF = "off";

    private final CatalogPort catalogPort;
    private final ChatFrontendPort frontend;
    private final AdminWarningManager warningManager;
    private final BotProperties properties;
    private final MessageService messageService;

    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    @PostConstruct
    public void init() {
        BotProperties.ComplianceProperties config = properties.getMonitor().getCompliance();
        if (!config.isEnabled()) {
            log.info("[Compliance] Monitor disabled");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "compliance-monitor");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = config.getInterval().toMillis();
        tickTask = scheduler.scheduleAtFixedRate(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[Compliance] Started with interval: {}", config.getInterval());
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Compliance] Shut down");
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[Compliance] Tick skipped: previous check still in progress");
            return;
        }
        try {
            check();
        } catch (RuntimeException e) {
            log.error("[Compliance] Tick failed: {}", e.getMessage(), e);
        } finally {
            executing.set(false);
        }
    }

    private void check() {
        Optional<PlaybackCompliance> snapshot = catalogPort.checkPlaybackCompliance();
        if (snapshot.isEmpty()) {
            return;
        }
        PlaybackCompliance compliance = snapshot.get();
        if (compliance.isCompliant()) {
            warningManager.clearWarning(WarningType.PLAYBACK_SETTINGS);
            return;
        }
        log.info("[Compliance] Issues detected: {}", compliance.getIssues());

        if (properties.getMonitor().getCompliance().isAutoCorrect() && attemptCorrection(compliance)) {
            Optional<PlaybackCompliance> recheck = catalogPort.checkPlaybackCompliance();
            if (recheck.isEmpty() || recheck.get().isCompliant()) {
                log.info("[Compliance] Playback settings corrected");
                warningManager.clearWarning(WarningType.PLAYBACK_SETTINGS);
                return;
            }
            compliance = recheck.get();
        }

        if (!warningManager.shouldSendWarning(WarningType.PLAYBACK_SETTINGS)) {
            log.debug("[Compliance] Warning suppressed by cooldown");
            return;
        }
        String groupId = properties.getTelegram().getGroupId();
        if (groupId == null || groupId.isBlank()) {
            log.warn("[Compliance] No group configured, cannot warn admins");
            return;
        }
        List<String> admins = frontend.getAdminUserIds(groupId);
        if (admins.isEmpty()) {
            log.warn("[Compliance] No admins to warn");
            return;
        }
        String text = messageService.getMessage("bot.playback_compliance_warning", catalogPort.getPlaylistUrl(),
                String.join("\n", compliance.getIssues()));
        warningManager.sendWarning(WarningType.PLAYBACK_SETTINGS, admins, text);
    }

    /**
     * @return whether any correction was applied
     */
    boolean attemptCorrection(PlaybackCompliance compliance) {
        boolean applied = false;
        if (!compliance.isShuffleOff()) {
            try {
                catalogPort.setShuffle(false);
                applied = true;
                log.info("[Compliance] Shuffle disabled");
            } catch (RuntimeException e) {
                log.warn("[Compliance] Failed to disable shuffle: {}", e.getMessage());
            }
        }
        if (!compliance.isRepeatOk()) {
            try {
                catalogPort.setRepeatMode(REPEAT_OFF);
                applied = true;
                log.info("[Compliance] Repeat set to off");
            } catch (RuntimeException e) {
                log.warn("[Compliance] Failed to set repeat mode: {}", e.getMessage());
            }
        }
        return applied;
    }
}
