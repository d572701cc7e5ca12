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

import me.golemcore.djbot.domain.approval.TrackFormatter;
import me.golemcore.djbot.domain.dispatch.PlaylistMutationException;
import me.golemcore.djbot.domain.dispatch.PlaylistMutationService;
import me.golemcore.djbot.domain.model.ApprovalCallbackEvent;
import me.golemcore.djbot.domain.model.ApprovalKind;
import me.golemcore.djbot.domain.model.PromptButton;
import me.golemcore.djbot.domain.model.Reaction;
import me.golemcore.djbot.domain.model.Track;
import me.golemcore.djbot.domain.service.AdminWarningManager;
import me.golemcore.djbot.domain.service.AdminWarningManager.WarningType;
import me.golemcore.djbot.domain.service.DedupStore;
import me.golemcore.djbot.infrastructure.config.BotProperties;
import me.golemcore.djbot.infrastructure.i18n.MessageService;
import me.golemcore.djbot.port.outbound.CatalogPort;
import me.golemcore.djbot.port.outbound.ChatFrontendPort;
import me.golemcore.djbot.port.outbound.RankingPort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps the player from running out of playlist tracks and falling back to
 * the catalog's own auto-play.
 *
 * <p>
 * Each tick first makes sure a playback device is active, warning the admins
 * by direct message when none is. It then checks whether playback is near the
 * end of the playlist. If so, a recommended filler that is not yet in the
 * playlist is added and posted to the group with approve/deny buttons:
 * <ul>
 * <li>no admin answer before the timeout: the filler stays</li>
 * <li>approved: the filler stays</li>
 * <li>denied: the filler is removed and a replacement is suggested</li>
 * </ul>
 * After the configured number of denials the next filler is accepted without
 * asking.
 *
 * <p>
 * Ticks never overlap: a tick that finds the previous one still waiting for a
 * decision is skipped.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class AutoPlayPreventionMonitor {

    static final int RECENT_TRACKS_FOR_MOOD = 5;

    private final CatalogPort catalogPort;
    private final RankingPort rankingPort;
    private final ChatFrontendPort frontend;
    private final DedupStore dedupStore;
    private final PlaylistMutationService mutationService;
    private final AdminWarningManager warningManager;
    private final BotProperties properties;
    private final MessageService messageService;
    private final Clock clock;

    private final AtomicBoolean executing = new AtomicBoolean(false);
    private final Map<String, CompletableFuture<Boolean>> pending = new ConcurrentHashMap<>();

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public AutoPlayPreventionMonitor(CatalogPort catalogPort, RankingPort rankingPort, ChatFrontendPort frontend,
            DedupStore dedupStore, PlaylistMutationService mutationService, AdminWarningManager warningManager,
            BotProperties properties, MessageService messageService, Clock clock) {
        this.catalogPort = catalogPort;
        this.rankingPort = rankingPort;
        this.frontend = frontend;
        this.dedupStore = dedupStore;
        this.mutationService = mutationService;
        this.warningManager = warningManager;
        this.properties = properties;
        this.messageService = messageService;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        BotProperties.AutoPlayProperties config = properties.getMonitor().getAutoPlay();
        if (!config.isEnabled()) {
            log.info("[AutoPlay] Monitor disabled");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "auto-play-monitor");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = config.getInterval().toMillis();
        tickTask = scheduler.scheduleAtFixedRate(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[AutoPlay] Started with interval: {}", config.getInterval());
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        pending.values().forEach(decision -> decision.complete(true));
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
        log.info("[AutoPlay] Shut down");
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[AutoPlay] Tick skipped: previous fill still in progress");
            return;
        }
        try {
            String groupId = properties.getTelegram().getGroupId();
            if (groupId == null || groupId.isBlank()) {
                return;
            }
            if (!hasActiveDevice(groupId) || !catalogPort.isNearPlaylistEnd()) {
                return;
            }
            log.info("[AutoPlay] Playlist is running low, adding a filler");
            fillQueue(groupId);
        } catch (RuntimeException e) {
            log.error("[AutoPlay] Tick failed: {}", e.getMessage(), e);
        } finally {
            executing.set(false);
        }
    }

    /**
     * Nothing plays without an active device, so there is no queue to keep
     * going. Admins are told, debounced by the warning manager.
     */
    private boolean hasActiveDevice(String groupId) {
        boolean active;
        try {
            active = catalogPort.hasActiveDevice();
        } catch (RuntimeException e) {
            log.warn("[AutoPlay] Device check failed, skipping tick: {}", e.getMessage());
            return false;
        }
        if (active) {
            warningManager.clearWarning(WarningType.NO_ACTIVE_DEVICE);
            return true;
        }
        log.debug("[AutoPlay] No active device, skipping queue check");
        if (!warningManager.shouldSendWarning(WarningType.NO_ACTIVE_DEVICE)) {
            return false;
        }
        List<String> admins = frontend.getAdminUserIds(groupId);
        if (admins.isEmpty()) {
            log.warn("[AutoPlay] No admins to warn about the missing device");
            return false;
        }
        warningManager.sendWarning(WarningType.NO_ACTIVE_DEVICE, admins,
                messageService.getMessage("bot.no_active_device_warning", catalogPort.getPlaylistUrl()));
        return false;
    }

    private void fillQueue(String groupId) {
        int maxReplacements = properties.getMonitor().getAutoPlay().getMaxReplacements();
        Set<String> rejected = new HashSet<>();
        int rejections = 0;

        while (true) {
            Optional<Track> filler = pickFiller(rejected);
            if (filler.isEmpty()) {
                log.warn("[AutoPlay] No filler track available");
                sendToGroup(groupId, messageService.getMessage("bot.queue_replacement_failed"));
                return;
            }
            Track track = filler.get();
            try {
                mutationService.addTrack(track.getId());
            } catch (PlaylistMutationException e) {
                log.error("[AutoPlay] Failed to add filler {}: {}", track.displayName(), e.getMessage());
                sendToGroup(groupId, messageService.getMessage("bot.queue_replacement_failed"));
                return;
            }

            String details = TrackFormatter.details(messageService, track);
            if (rejections >= maxReplacements) {
                log.info("[AutoPlay] Auto-accepting {} after {} denials", track.displayName(), rejections);
                sendToGroup(groupId, messageService.getMessage("bot.queue_auto_accepted", track.getArtist(),
                        track.getTitle(), details));
                return;
            }

            String messageKey = rejections == 0 ? "bot.queue_management" : "bot.queue_replacement";
            String text = messageService.getMessage(messageKey, track.getArtist(), track.getTitle(), details);
            if (awaitDecision(groupId, track, text)) {
                log.info("[AutoPlay] Filler {} kept", track.displayName());
                return;
            }

            rejections++;
            rejected.add(track.getId());
            log.info("[AutoPlay] Filler {} denied ({}/{})", track.displayName(), rejections, maxReplacements);
            try {
                mutationService.removeTrack(track.getId());
            } catch (PlaylistMutationException e) {
                log.error("[AutoPlay] Failed to remove denied filler {}: {}", track.displayName(), e.getMessage());
            }
        }
    }

    Optional<Track> pickFiller(Set<String> rejected) {
        int count = properties.getMonitor().getAutoPlay().getRecommendationCount();
        List<Track> candidates = new ArrayList<>();
        for (Track track : catalogPort.getRecommendedTracks(count)) {
            if (track.getId() != null && !rejected.contains(track.getId()) && !dedupStore.has(track.getId())) {
                candidates.add(track);
            }
        }
        if (candidates.size() <= 1 || !rankingPort.isAvailable()) {
            return candidates.stream().findFirst();
        }
        try {
            String mood = rankingPort.generateTrackMood(recentTracks());
            List<Track> ranked = rankingPort.rankTracks(mood, candidates);
            if (!ranked.isEmpty()) {
                return Optional.of(ranked.get(0));
            }
        } catch (RuntimeException e) {
            log.debug("[AutoPlay] Ranking fillers failed, using catalog order: {}", e.getMessage());
        }
        return Optional.of(candidates.get(0));
    }

    private List<Track> recentTracks() {
        List<String> ids = catalogPort.getPlaylistTrackIds();
        List<Track> recent = new ArrayList<>();
        for (String id : ids.subList(Math.max(0, ids.size() - RECENT_TRACKS_FOR_MOOD), ids.size())) {
            try {
                recent.add(catalogPort.getTrack(id));
            } catch (RuntimeException e) {
                log.debug("[AutoPlay] Skipping recent track {}: {}", id, e.getMessage());
            }
        }
        return recent;
    }

    /**
     * Post the filler with approve/deny buttons and block until an admin
     * decides or the timeout keeps the track.
     */
    private boolean awaitDecision(String groupId, Track track, String text) {
        String key = "queue_" + clock.millis();
        CompletableFuture<Boolean> decision = new CompletableFuture<>();
        pending.put(key, decision);

        String messageId;
        try {
            messageId = frontend.sendPrompt(groupId, null, text, List.of(
                    PromptButton.approve(messageService.getMessage("button.queue_approve"), ApprovalKind.QUEUE, key),
                    PromptButton.reject(messageService.getMessage("button.queue_deny"), ApprovalKind.QUEUE, key)));
        } catch (RuntimeException e) {
            pending.remove(key);
            log.warn("[AutoPlay] Failed to post filler prompt, keeping {}: {}", track.displayName(), e.getMessage());
            return true;
        }

        int timeoutSeconds = properties.getMonitor().getAutoPlay().getApprovalTimeoutSeconds();
        AtomicBoolean timedOut = new AtomicBoolean(false);
        CompletableFuture<Boolean> outcome = decision.orTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .exceptionally(ex -> {
                    if (ex instanceof TimeoutException) {
                        log.info("[AutoPlay] No decision on {} within {}s, keeping it", track.displayName(),
                                timeoutSeconds);
                        timedOut.set(true);
                    } else {
                        log.warn("[AutoPlay] Decision on {} failed: {}", track.displayName(), ex.getMessage());
                    }
                    return true;
                })
                .whenComplete((approved, ex) -> pending.remove(key));

        boolean approved;
        try {
            approved = Boolean.TRUE.equals(outcome.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        } catch (ExecutionException e) {
            return true;
        }

        if (timedOut.get()) {
            markAccepted(groupId, messageId, text);
        } else if (approved) {
            editQuietly(groupId, messageId, text);
        } else {
            deleteQuietly(groupId, messageId);
        }
        return approved;
    }

    @EventListener
    public void onApprovalCallback(ApprovalCallbackEvent event) {
        if (event.kind() != ApprovalKind.QUEUE) {
            return;
        }
        CompletableFuture<Boolean> decision = pending.get(event.key());
        if (decision == null) {
            frontend.answerCallback(event.callbackId(), messageService.getMessage("callback.expired"));
            return;
        }
        if (!isAdmin(event.chatId(), event.responderId())) {
            log.debug("[AutoPlay] Non-admin {} tried to decide {}", event.responderId(), event.key());
            frontend.answerCallback(event.callbackId(), messageService.getMessage("callback.unauthorized"));
            return;
        }
        frontend.answerCallback(event.callbackId(), messageService.getMessage(
                event.approved() ? "callback.queue_approved" : "callback.queue_denied"));
        decision.complete(event.approved());
    }

    int pendingCount() {
        return pending.size();
    }

    private boolean isAdmin(String chatId, String userId) {
        try {
            return frontend.isUserAdmin(chatId, userId);
        } catch (RuntimeException e) {
            log.warn("[AutoPlay] Admin check failed for {}: {}", userId, e.getMessage());
            return false;
        }
    }

    private void markAccepted(String groupId, String messageId, String text) {
        editQuietly(groupId, messageId, text);
        try {
            frontend.react(groupId, messageId, Reaction.THUMBS_UP);
        } catch (RuntimeException e) {
            log.debug("[AutoPlay] Failed to react on {}: {}", messageId, e.getMessage());
        }
    }

    private void editQuietly(String groupId, String messageId, String text) {
        try {
            frontend.editMessage(groupId, messageId, text);
        } catch (RuntimeException e) {
            log.debug("[AutoPlay] Failed to edit {}: {}", messageId, e.getMessage());
        }
    }

    private void deleteQuietly(String groupId, String messageId) {
        try {
            frontend.deleteMessage(groupId, messageId);
        } catch (RuntimeException e) {
            log.debug("[AutoPlay] Failed to delete {}: {}", messageId, e.getMessage());
        }
    }

    private void sendToGroup(String groupId, String text) {
        try {
            frontend.sendText(groupId, null, text);
        } catch (RuntimeException e) {
            log.warn("[AutoPlay] Failed to post to group: {}", e.getMessage());
        }
    }
}
