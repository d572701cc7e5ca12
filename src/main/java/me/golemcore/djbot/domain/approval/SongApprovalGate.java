package me.golemcore.djbot.domain.approval;

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

import me.golemcore.djbot.domain.model.AdminApprovalRequest;
import me.golemcore.djbot.domain.model.ApprovalOutcome;
import me.golemcore.djbot.domain.model.ChatMessage;
import me.golemcore.djbot.domain.model.Reaction;
import me.golemcore.djbot.domain.model.Track;
import me.golemcore.djbot.infrastructure.config.BotProperties;
import me.golemcore.djbot.infrastructure.i18n.MessageService;
import me.golemcore.djbot.port.outbound.ChatFrontendPort;
import me.golemcore.djbot.port.outbound.RankingPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Runs the approval gate for a song request before it touches the playlist.
 *
 * <p>
 * Posts a notification in the group (seeded with a 👍 so members can simply
 * tap it), then waits for admin approval alone or for admin and community
 * approval racing each other. The notification is deleted once a decision is
 * in.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SongApprovalGate {

    static final String FALLBACK_MOOD = "unknown style";

    private final ChatFrontendPort frontend;
    private final RankingPort rankingPort;
    private final AdminApprovalService adminApprovalService;
    private final CommunityApprovalService communityApprovalService;
    private final ApprovalRace approvalRace;
    private final BotProperties properties;
    private final MessageService messageService;

    public boolean isAvailable() {
        return adminApprovalService.isAvailable();
    }

    /**
     * Block until the request is approved or denied.
     *
     * @throws ApprovalException
     *             when either gate fails or the wait is interrupted
     */
    public ApprovalOutcome awaitApproval(ChatMessage origin, Track track) {
        String chatId = origin.getChatId();
        int timeoutSeconds = properties.getApp().getConfirmAdminTimeoutSeconds();
        int communityThreshold = properties.getTelegram().getCommunityApproval();
        boolean communityEnabled = communityApprovalService.isAvailable() && communityThreshold > 0;

        String mood = trackMood(track);
        String notificationId = sendNotification(origin, track, mood, communityEnabled, communityThreshold);

        try {
            CompletableFuture<Boolean> admin = adminApprovalService.requestApproval(
                    new AdminApprovalRequest(origin, track.displayName(), track.getUrl(), mood), timeoutSeconds);

            if (communityEnabled && notificationId != null && !notificationId.isBlank()) {
                CompletableFuture<Boolean> community = communityApprovalService.requestApproval(
                        chatId, notificationId, communityThreshold, timeoutSeconds, origin.getSenderId());
                return approvalRace.race(admin, community,
                        () -> adminApprovalService.cancel(chatId, origin.getId()),
                        () -> communityApprovalService.cancel(chatId, notificationId)).get();
            }
            return ApprovalOutcome.admin(Boolean.TRUE.equals(admin.get()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            adminApprovalService.cancel(chatId, origin.getId());
            throw new ApprovalException("Approval wait interrupted", e);
        } catch (ExecutionException e) {
            throw new ApprovalException("Approval process failed", e.getCause());
        } finally {
            if (notificationId != null) {
                try {
                    frontend.deleteMessage(chatId, notificationId);
                } catch (RuntimeException e) {
                    log.debug("[Approval] Failed to delete notification {}: {}", notificationId, e.getMessage());
                }
            }
        }
    }

    String trackMood(Track track) {
        if (!rankingPort.isAvailable()) {
            return FALLBACK_MOOD;
        }
        try {
            String mood = rankingPort.generateTrackMood(List.of(track));
            return mood == null || mood.isBlank() ? FALLBACK_MOOD : mood;
        } catch (RuntimeException e) {
            log.debug("[Approval] Mood generation failed: {}", e.getMessage());
            return FALLBACK_MOOD;
        }
    }

    private String sendNotification(ChatMessage origin, Track track, String mood, boolean communityEnabled,
            int communityThreshold) {
        String details = TrackFormatter.details(messageService, track);
        String text = communityEnabled
                ? messageService.getMessage("admin.approval_required_community", track.getArtist(), track.getTitle(),
                        details, mood, communityThreshold)
                : messageService.getMessage("admin.approval_required", track.getArtist(), track.getTitle(),
                        details, mood);
        try {
            String messageId = frontend.sendText(origin.getChatId(), origin.getId(), text);
            try {
                frontend.react(origin.getChatId(), messageId, Reaction.THUMBS_UP);
            } catch (RuntimeException e) {
                log.debug("[Approval] Failed to seed reaction: {}", e.getMessage());
            }
            return messageId;
        } catch (RuntimeException e) {
            log.warn("[Approval] Failed to post approval notification: {}", e.getMessage());
            return null;
        }
    }
}
