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

import me.golemcore.djbot.domain.model.ApprovalCallbackEvent;
import me.golemcore.djbot.domain.model.ApprovalKind;
import me.golemcore.djbot.domain.model.ChatMessage;
import me.golemcore.djbot.domain.model.PromptButton;
import me.golemcore.djbot.infrastructure.i18n.MessageService;
import me.golemcore.djbot.port.outbound.ChatFrontendPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Asks the original sender to confirm a guess with inline buttons.
 *
 * <p>
 * The prompt is posted as a reply to the request. Only the sender may answer;
 * anyone else gets a short notice and the wait goes on. The returned future
 * completes with {@code false} on rejection or timeout, and the prompt is
 * deleted either way.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserApprovalService {

    private final ChatFrontendPort frontend;
    private final MessageService messageService;
    private final Clock clock;
    private final ApprovalCleanupExecutor cleanupExecutor;

    private final Map<String, PendingUserApproval> pending = new ConcurrentHashMap<>();

    public CompletableFuture<Boolean> requestApproval(ChatMessage origin, String prompt, int timeoutSeconds) {
        String key = origin.getChatId() + "_" + origin.getId() + "_" + clock.millis();
        CompletableFuture<Boolean> decision = new CompletableFuture<>();
        pending.put(key, new PendingUserApproval(origin.getSenderId(), decision));

        String promptMessageId;
        try {
            promptMessageId = frontend.sendPrompt(origin.getChatId(), origin.getId(), prompt, List.of(
                    PromptButton.approve(messageService.getMessage("button.confirm"), ApprovalKind.USER, key),
                    PromptButton.reject(messageService.getMessage("button.not_this"), ApprovalKind.USER, key)));
        } catch (RuntimeException e) {
            pending.remove(key);
            return CompletableFuture.failedFuture(new ApprovalException("Failed to send confirmation prompt", e));
        }
        log.debug("[Approval] User confirmation {} pending (timeout {}s)", key, timeoutSeconds);

        return decision.orTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .exceptionally(ex -> {
                    if (ex instanceof TimeoutException) {
                        log.info("[Approval] User confirmation {} timed out", key);
                    } else {
                        log.warn("[Approval] User confirmation {} failed: {}", key, ex.getMessage());
                    }
                    return false;
                })
                .whenComplete((approved, ex) -> {
                    pending.remove(key);
                    cleanupExecutor.submit(key, () -> deleteQuietly(origin.getChatId(), promptMessageId));
                });
    }

    @EventListener
    public void onApprovalCallback(ApprovalCallbackEvent event) {
        if (event.kind() != ApprovalKind.USER) {
            return;
        }
        PendingUserApproval approval = pending.get(event.key());
        if (approval == null) {
            frontend.answerCallback(event.callbackId(), messageService.getMessage("callback.prompt_expired"));
            return;
        }
        if (!approval.originUserId().equals(event.responderId())) {
            log.debug("[Approval] Ignoring answer from {} on {}", event.responderId(), event.key());
            frontend.answerCallback(event.callbackId(), messageService.getMessage("callback.sender_only"));
            return;
        }
        frontend.answerCallback(event.callbackId(), null);
        approval.decision().complete(event.approved());
    }

    int pendingCount() {
        return pending.size();
    }

    private void deleteQuietly(String chatId, String messageId) {
        try {
            frontend.deleteMessage(chatId, messageId);
        } catch (RuntimeException e) {
            log.debug("[Approval] Failed to delete prompt {}: {}", messageId, e.getMessage());
        }
    }

    private record PendingUserApproval(String originUserId, CompletableFuture<Boolean> decision) {
    }
}
