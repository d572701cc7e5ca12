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
import me.golemcore.djbot.domain.model.ApprovalCallbackEvent;
import me.golemcore.djbot.domain.model.ApprovalKind;
import me.golemcore.djbot.domain.model.ChatMessage;
import me.golemcore.djbot.domain.model.PromptButton;
import me.golemcore.djbot.infrastructure.config.BotProperties;
import me.golemcore.djbot.infrastructure.i18n.MessageService;
import me.golemcore.djbot.port.outbound.AdminApprovalCapablePort;
import me.golemcore.djbot.port.outbound.ChatFrontendPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Admin approval of song requests via private prompts.
 *
 * <p>
 * Each request fetches the group's admin list afresh and DMs every admin in
 * parallel. The first admin to answer decides. Policy:
 * <ul>
 * <li>no admins found - approved (permissive fallback)</li>
 * <li>no prompt delivered - the future fails with {@link ApprovalException}</li>
 * <li>timeout - denied</li>
 * <li>answer from someone who did not get the prompt - ignored with a
 * notice</li>
 * </ul>
 * All delivered prompts are deleted once the request resolves, whatever the
 * outcome.
 *
 * <p>
 * Only available when the frontend implements
 * {@link AdminApprovalCapablePort} and {@code bot.telegram.admin-approval} is
 * on.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class AdminApprovalService {

    private static final String KEY_PREFIX = "admin_";

    private final ChatFrontendPort frontend;
    private final AdminApprovalCapablePort adminCapability;
    private final BotProperties properties;
    private final MessageService messageService;
    private final Clock clock;
    private final ApprovalCleanupExecutor cleanupExecutor;

    private final Map<String, PendingAdminApproval> pending = new ConcurrentHashMap<>();

    public AdminApprovalService(ChatFrontendPort frontend, BotProperties properties, MessageService messageService,
            Clock clock, ApprovalCleanupExecutor cleanupExecutor) {
        this.frontend = frontend;
        this.adminCapability = frontend instanceof AdminApprovalCapablePort capable ? capable : null;
        this.properties = properties;
        this.messageService = messageService;
        this.clock = clock;
        this.cleanupExecutor = cleanupExecutor;
    }

    public boolean isAvailable() {
        return adminCapability != null
                && properties.getTelegram().isAdminApproval()
                && adminCapability.isAdminApprovalEnabled();
    }

    public CompletableFuture<Boolean> requestApproval(AdminApprovalRequest request, int timeoutSeconds) {
        if (adminCapability == null) {
            return CompletableFuture.failedFuture(new ApprovalException("Frontend does not support admin approval"));
        }
        ChatMessage origin = request.origin();

        List<String> admins;
        try {
            admins = frontend.getAdminUserIds(origin.getChatId());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(new ApprovalException("Failed to fetch admin list", e));
        }
        if (admins.isEmpty()) {
            log.warn("[Approval] No admins found in chat {}, auto-approving", origin.getChatId());
            return CompletableFuture.completedFuture(true);
        }

        String key = keyPrefix(origin.getChatId(), origin.getId()) + clock.millis();
        PendingAdminApproval approval = new PendingAdminApproval(Set.copyOf(admins), new ConcurrentHashMap<>(),
                new CompletableFuture<>());
        pending.put(key, approval);

        String prompt = messageService.getMessage("admin.approval_prompt",
                origin.getSenderName(), request.songInfo(), request.songUrl(), request.trackMood());
        List<PromptButton> buttons = List.of(
                PromptButton.approve(messageService.getMessage("admin.button_approve"), ApprovalKind.ADMIN, key),
                PromptButton.reject(messageService.getMessage("admin.button_deny"), ApprovalKind.ADMIN, key));

        CompletableFuture<?>[] deliveries = admins.stream()
                .map(adminId -> CompletableFuture.runAsync(() -> {
                    String messageId = adminCapability.sendDirectPrompt(adminId, prompt, buttons);
                    approval.sentMessages().put(adminId, messageId);
                }).exceptionally(ex -> {
                    log.warn("[Approval] Failed to send admin prompt to {}: {}", adminId, ex.getMessage());
                    return null;
                }))
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(deliveries).join();

        if (approval.sentMessages().isEmpty()) {
            pending.remove(key);
            return CompletableFuture.failedFuture(
                    new ApprovalException("Admin approval prompt could not be delivered to any admin"));
        }
        log.info("[Approval] Admin approval {} sent to {}/{} admins", key, approval.sentMessages().size(),
                admins.size());

        return approval.decision().orTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .exceptionally(ex -> {
                    if (ex instanceof TimeoutException) {
                        log.info("[Approval] Admin approval {} timed out, denying", key);
                    } else {
                        log.warn("[Approval] Admin approval {} aborted: {}", key, ex.getMessage());
                    }
                    return false;
                })
                .whenComplete((approved, ex) -> {
                    pending.remove(key);
                    cleanupExecutor.submit(key, () -> approval.sentMessages().forEach(this::deleteQuietly));
                });
    }

    /**
     * Resolve any pending admin approval for the given request message as not
     * approved. Used when another gate decided first.
     */
    public void cancel(String chatId, String messageId) {
        String prefix = keyPrefix(chatId, messageId);
        pending.forEach((key, approval) -> {
            if (key.startsWith(prefix) && approval.decision().complete(false)) {
                log.info("[Approval] Admin approval {} cancelled", key);
            }
        });
    }

    @EventListener
    public void onApprovalCallback(ApprovalCallbackEvent event) {
        if (event.kind() != ApprovalKind.ADMIN) {
            return;
        }
        PendingAdminApproval approval = pending.get(event.key());
        if (approval == null) {
            frontend.answerCallback(event.callbackId(), messageService.getMessage("callback.expired"));
            return;
        }
        if (!approval.recipients().contains(event.responderId())) {
            log.warn("[Approval] Unauthorized admin answer from {} on {}", event.responderId(), event.key());
            frontend.answerCallback(event.callbackId(), messageService.getMessage("callback.unauthorized"));
            return;
        }
        frontend.answerCallback(event.callbackId(), messageService.getMessage(
                event.approved() ? "callback.approved" : "callback.denied"));
        if (approval.decision().complete(event.approved())) {
            log.info("[Approval] Admin {} {} request {}", event.responderId(),
                    event.approved() ? "approved" : "denied", event.key());
        }
    }

    int pendingCount() {
        return pending.size();
    }

    private static String keyPrefix(String chatId, String messageId) {
        return KEY_PREFIX + chatId + "_" + messageId + "_";
    }

    private void deleteQuietly(String adminId, String messageId) {
        try {
            frontend.deleteMessage(adminId, messageId);
        } catch (RuntimeException e) {
            log.debug("[Approval] Failed to delete admin prompt {} for {}: {}", messageId, adminId, e.getMessage());
        }
    }

    private record PendingAdminApproval(Set<String> recipients, Map<String, String> sentMessages,
            CompletableFuture<Boolean> decision) {
    }
}
