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

import me.golemcore.djbot.domain.model.Reaction;
import me.golemcore.djbot.domain.model.ReactionCountEvent;
import me.golemcore.djbot.domain.model.ReactionUpdateEvent;
import me.golemcore.djbot.port.outbound.ChatFrontendPort;
import me.golemcore.djbot.port.outbound.CommunityApprovalCapablePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Community approval: a request passes once enough group members react with
 * 👍 on the bot's notification message.
 *
 * <p>
 * Individual reaction updates are counted per user, so nobody counts twice
 * and withdrawing a 👍 lowers the count again. The requester's own reaction
 * never counts. Chats that only report anonymous totals are handled by
 * subtracting one for the bot's own seed reaction, which assumes the seed
 * reaction was actually placed.
 *
 * <p>
 * Only available when the frontend implements
 * {@link CommunityApprovalCapablePort}. A timeout rejects.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class CommunityApprovalService {

    private final CommunityApprovalCapablePort reactionCapability;
    private final ApprovalCleanupExecutor cleanupExecutor;
    private final Map<String, PendingCommunityApproval> pending = new ConcurrentHashMap<>();

    public CommunityApprovalService(ChatFrontendPort frontend, ApprovalCleanupExecutor cleanupExecutor) {
        this.reactionCapability = frontend instanceof CommunityApprovalCapablePort capable ? capable : null;
        this.cleanupExecutor = cleanupExecutor;
    }

    public boolean isAvailable() {
        return reactionCapability != null;
    }

    public CompletableFuture<Boolean> requestApproval(String chatId, String messageId, int required,
            int timeoutSeconds, String requesterUserId) {
        if (required <= 0) {
            return CompletableFuture.completedFuture(false);
        }
        if (reactionCapability == null) {
            return CompletableFuture.failedFuture(new ApprovalException("Frontend does not track reactions"));
        }

        String key = key(chatId, messageId);
        PendingCommunityApproval approval = new PendingCommunityApproval(required, requesterUserId);
        pending.put(key, approval);
        reactionCapability.watchReactions(chatId, messageId);
        log.debug("[Approval] Community approval {} needs {} reactions", key, required);

        return approval.decision.orTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .exceptionally(ex -> {
                    log.debug("[Approval] Community approval {} ended without enough reactions", key);
                    return false;
                })
                .whenComplete((approved, ex) -> {
                    pending.remove(key);
                    cleanupExecutor.submit(key, () -> reactionCapability.unwatchReactions(chatId, messageId));
                });
    }

    /**
     * Stop waiting for reactions on a message; the pending request resolves as
     * not approved.
     */
    public void cancel(String chatId, String messageId) {
        PendingCommunityApproval approval = pending.get(key(chatId, messageId));
        if (approval != null && approval.decision.complete(false)) {
            log.debug("[Approval] Community approval {} cancelled", key(chatId, messageId));
        }
    }

    @EventListener
    public void onReactionUpdate(ReactionUpdateEvent event) {
        PendingCommunityApproval approval = pending.get(key(event.chatId(), event.messageId()));
        if (approval == null) {
            return;
        }
        if (event.userId().equals(approval.requesterUserId)) {
            log.debug("[Approval] Ignoring requester's own reaction on {}", event.messageId());
            return;
        }
        synchronized (approval) {
            if (event.added(Reaction.THUMBS_UP) && approval.reactedUsers.add(event.userId())) {
                approval.current++;
            } else if (event.removed(Reaction.THUMBS_UP) && approval.reactedUsers.remove(event.userId())) {
                approval.current--;
            }
            log.debug("[Approval] Community approval {}: {}/{}", event.messageId(), approval.current,
                    approval.required);
            if (approval.current >= approval.required) {
                approval.decision.complete(true);
            }
        }
    }

    @EventListener
    public void onReactionCount(ReactionCountEvent event) {
        PendingCommunityApproval approval = pending.get(key(event.chatId(), event.messageId()));
        if (approval == null) {
            return;
        }
        int total = event.count(Reaction.THUMBS_UP);
        // exclude the bot's own seed reaction
        int userReactions = total > 0 ? total - 1 : 0;
        synchronized (approval) {
            approval.current = userReactions;
            if (userReactions >= approval.required) {
                approval.decision.complete(true);
            }
        }
    }

    int currentCount(String chatId, String messageId) {
        PendingCommunityApproval approval = pending.get(key(chatId, messageId));
        if (approval == null) {
            return -1;
        }
        synchronized (approval) {
            return approval.current;
        }
    }

    private static String key(String chatId, String messageId) {
        return chatId + ":" + messageId;
    }

    private static final class PendingCommunityApproval {
        private final int required;
        private final String requesterUserId;
        private final Set<String> reactedUsers = new HashSet<>();
        private final CompletableFuture<Boolean> decision = new CompletableFuture<>();
        private int current;

        private PendingCommunityApproval(int required, String requesterUserId) {
            this.required = required;
            this.requesterUserId = requesterUserId;
        }
    }
}
