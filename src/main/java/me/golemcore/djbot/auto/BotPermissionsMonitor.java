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

import me.golemcore.djbot.domain.service.AdminWarningManager;
import me.golemcore.djbot.domain.service.AdminWarningManager.WarningType;
import me.golemcore.djbot.infrastructure.config.BotProperties;
import me.golemcore.djbot.infrastructure.i18n.MessageService;
import me.golemcore.djbot.port.outbound.ChatFrontendException;
import me.golemcore.djbot.port.outbound.ChatFrontendPort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Checks that the bot is an administrator of the group. Without admin rights
 * it cannot react to requests or delete approval messages, so the chat admins
 * are warned by direct message until the rights are granted.
 *
 * <p>
 * The first check runs right after startup.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BotPermissionsMonitor {

    private final ChatFrontendPort frontend;
    private final AdminWarningManager warningManager;
    private final BotProperties properties;
    private final MessageService messageService;

    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    @PostConstruct
    public void init() {
        BotProperties.PermissionsProperties config = properties.getMonitor().getPermissions();
        if (!config.isEnabled()) {
            log.info("[Permissions] Monitor disabled");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "permissions-monitor");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = config.getInterval().toMillis();
        tickTask = scheduler.scheduleAtFixedRate(this::tick, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[Permissions] Started with interval: {}", config.getInterval());
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
        log.info("[Permissions] Shut down");
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[Permissions] Tick skipped: previous check still in progress");
            return;
        }
        try {
            check();
        } catch (RuntimeException e) {
            log.error("[Permissions] Tick failed: {}", e.getMessage(), e);
        } finally {
            executing.set(false);
        }
    }

    private void check() {
        String groupId = properties.getTelegram().getGroupId();
        if (groupId == null || groupId.isBlank()) {
            log.debug("[Permissions] No group configured");
            return;
        }

        boolean botIsAdmin;
        try {
            botIsAdmin = frontend.isBotAdmin(groupId);
        } catch (ChatFrontendException e) {
            log.debug("[Permissions] Could not check bot permissions: {}", e.getMessage());
            return;
        }
        if (botIsAdmin) {
            warningManager.clearWarning(WarningType.BOT_PERMISSIONS);
            return;
        }
        log.warn("[Permissions] Bot is not an admin of {}, reactions and cleanup will fail", groupId);

        if (!warningManager.shouldSendWarning(WarningType.BOT_PERMISSIONS)) {
            log.debug("[Permissions] Warning suppressed by cooldown");
            return;
        }
        List<String> admins = frontend.getAdminUserIds(groupId);
        if (admins.isEmpty()) {
            log.warn("[Permissions] No admins to warn");
            return;
        }
        warningManager.sendWarning(WarningType.BOT_PERMISSIONS, admins,
                messageService.getMessage("bot.permissions_warning"));
    }
}
