package me.golemcore.djbot.adapter.inbound.telegram;

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
import me.golemcore.djbot.domain.model.InboundChatMessageEvent;
import me.golemcore.djbot.domain.model.PromptButton;
import me.golemcore.djbot.domain.model.ReactionCountEvent;
import me.golemcore.djbot.domain.model.ReactionUpdateEvent;
import me.golemcore.djbot.infrastructure.config.BotProperties;
import me.golemcore.djbot.infrastructure.i18n.MessageService;
import me.golemcore.djbot.port.outbound.AdminApprovalCapablePort;
import me.golemcore.djbot.port.outbound.ChatFrontendException;
import me.golemcore.djbot.port.outbound.ChatFrontendPort;
import me.golemcore.djbot.port.outbound.CommunityApprovalCapablePort;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.TelegramUrl;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.GetMe;
import org.telegram.telegrambots.meta.api.methods.groupadministration.GetChatAdministrators;
import org.telegram.telegrambots.meta.api.methods.groupadministration.GetChatMember;
import org.telegram.telegrambots.meta.api.methods.reactions.SetMessageReaction;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updates.GetUpdates;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.DeleteMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.MessageEntity;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.chatmember.ChatMember;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.api.objects.reactions.MessageReactionCountUpdated;
import org.telegram.telegrambots.meta.api.objects.reactions.MessageReactionUpdated;
import org.telegram.telegrambots.meta.api.objects.reactions.ReactionCount;
import org.telegram.telegrambots.meta.api.objects.reactions.ReactionType;
import org.telegram.telegrambots.meta.api.objects.reactions.ReactionTypeEmoji;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardRow;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Telegram group frontend using long polling.
 *
 * <p>
 * Inbound updates are turned into Spring events:
 * <ul>
 * <li>group messages: {@link InboundChatMessageEvent}</li>
 * <li>inline button presses: {@link ApprovalCallbackEvent}, callback data is
 * {@code <kind>:<key>:yes|no}</li>
 * <li>reactions on watched messages: {@link ReactionUpdateEvent} and
 * {@link ReactionCountEvent}</li>
 * </ul>
 *
 * <p>
 * The adapter is always a Spring bean but only polls when
 * {@code bot.telegram.enabled=true} and a token is configured.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramAdapter implements ChatFrontendPort, AdminApprovalCapablePort, CommunityApprovalCapablePort,
        LongPollingSingleThreadUpdateConsumer {

    private static final int CALLBACK_DATA_PARTS_COUNT = 3;
    private static final int TELEGRAM_MAX_MESSAGE_LENGTH = 4096;
    private static final int POLL_TIMEOUT_SECONDS = 50;
    private static final List<String> ALLOWED_UPDATES = List.of(
            "message", "callback_query", "message_reaction", "message_reaction_count");
    private static final Set<String> BOT_ADMIN_STATUSES = Set.of("creator", "administrator");
    private static final Pattern URL_PATTERN = Pattern.compile("(https?://\\S+|spotify:[a-z]+:[A-Za-z0-9]+)");

    private final BotProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final TelegramBotsLongPollingApplication botsApplication;
    private final MessageService messageService;

    private final Set<String> watchedMessages = ConcurrentHashMap.newKeySet();
    private final Object lifecycleLock = new Object();

    private TelegramClient telegramClient;
    private volatile boolean running = false;
    private volatile boolean initialized = false;

    /**
     * Package-private setter for testing.
     */
    void setTelegramClient(TelegramClient client) {
        this.telegramClient = client;
        this.initialized = true;
    }

    private boolean isEnabled() {
        return properties.getTelegram().isEnabled();
    }

    private synchronized void ensureInitialized() {
        if (initialized || !isEnabled()) {
            return;
        }
        String token = properties.getTelegram().getToken();
        if (token == null || token.isBlank()) {
            log.warn("[Telegram] Token not configured, adapter will not start");
            return;
        }
        this.telegramClient = new OkHttpTelegramClient(token);
        initialized = true;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("[Telegram] Already running");
                return;
            }
            if (!isEnabled()) {
                log.info("[Telegram] Frontend disabled");
                return;
            }
            ensureInitialized();
            if (telegramClient == null) {
                log.warn("[Telegram] Client not initialized, cannot start");
                return;
            }
            try {
                botsApplication.registerBot(properties.getTelegram().getToken(), () -> TelegramUrl.DEFAULT_URL,
                        lastUpdateId -> GetUpdates.builder()
                                .offset(lastUpdateId + 1)
                                .timeout(POLL_TIMEOUT_SECONDS)
                                .allowedUpdates(ALLOWED_UPDATES)
                                .build(),
                        this);
                running = true;
                log.info("[Telegram] Adapter started for group {}", properties.getTelegram().getGroupId());
            } catch (TelegramApiException e) {
                log.error("[Telegram] Failed to start adapter", e);
            }
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            try {
                botsApplication.close();
                log.info("[Telegram] Adapter stopped");
            } catch (Exception e) {
                log.error("[Telegram] Error stopping adapter", e);
            }
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAdminApprovalEnabled() {
        return isEnabled() && properties.getTelegram().isAdminApproval();
    }

    // ==================== Inbound ====================

    @Override
    public void consume(Update update) {
        try {
            if (update.hasCallbackQuery()) {
                handleCallback(update.getCallbackQuery());
            } else if (update.getMessageReaction() != null) {
                handleReaction(update.getMessageReaction());
            } else if (update.getMessageReactionCount() != null) {
                handleReactionCount(update.getMessageReactionCount());
            } else if (update.hasMessage()) {
                handleMessage(update.getMessage());
            }
        } catch (RuntimeException e) {
            log.error("[Telegram] Failed to handle update {}", update.getUpdateId(), e);
        }
    }

    private void handleCallback(CallbackQuery callback) {
        String data = callback.getData();
        String[] parts = data != null ? data.split(":") : new String[0];
        ApprovalKind kind = parts.length == CALLBACK_DATA_PARTS_COUNT ? ApprovalKind.fromPrefix(parts[0]) : null;
        if (kind == null) {
            log.warn("[Telegram] Invalid callback data: {}", data);
            answerCallback(callback.getId(), null);
            return;
        }

        String chatId = null;
        String messageId = null;
        if (callback.getMessage() != null) {
            chatId = callback.getMessage().getChatId().toString();
            messageId = callback.getMessage().getMessageId().toString();
        }
        log.debug("[Telegram] Callback {} from {}", data, callback.getFrom().getId());
        eventPublisher.publishEvent(new ApprovalCallbackEvent(kind, parts[1], "yes".equals(parts[2]),
                callback.getFrom().getId().toString(), callback.getId(), chatId, messageId));
    }

    private void handleMessage(Message telegramMessage) {
        String chatId = telegramMessage.getChatId().toString();
        if (!isConfiguredGroup(chatId)) {
            log.debug("[Telegram] Ignoring message from chat {}", chatId);
            return;
        }
        User from = telegramMessage.getFrom();
        if (from == null || Boolean.TRUE.equals(from.getIsBot()) || !telegramMessage.hasText()) {
            return;
        }

        String text = telegramMessage.getText();
        if (text.startsWith("/")) {
            String command = text.substring(1).split("[\\s@]", 2)[0];
            if ("help".equals(command) || "start".equals(command)) {
                sendText(chatId, telegramMessage.getMessageId().toString(),
                        messageService.getMessage("bot.help_message"));
            }
            return;
        }

        ChatMessage message = ChatMessage.builder()
                .id(telegramMessage.getMessageId().toString())
                .chatId(chatId)
                .senderId(from.getId().toString())
                .senderName(displayName(from))
                .text(text)
                .urls(extractUrls(text, telegramMessage.getEntities()))
                .group(telegramMessage.isGroupMessage() || telegramMessage.isSuperGroupMessage())
                .build();
        eventPublisher.publishEvent(new InboundChatMessageEvent(message));
    }

    private void handleReaction(MessageReactionUpdated reaction) {
        String chatId = reaction.getChat().getId().toString();
        String messageId = reaction.getMessageId().toString();
        if (!watchedMessages.contains(watchKey(chatId, messageId)) || reaction.getUser() == null) {
            return;
        }
        eventPublisher.publishEvent(new ReactionUpdateEvent(chatId, messageId,
                reaction.getUser().getId().toString(),
                emojis(reaction.getOldReaction()), emojis(reaction.getNewReaction())));
    }

    private void handleReactionCount(MessageReactionCountUpdated reactionCount) {
        String chatId = reactionCount.getChat().getId().toString();
        String messageId = reactionCount.getMessageId().toString();
        if (!watchedMessages.contains(watchKey(chatId, messageId))) {
            return;
        }
        Map<String, Integer> counts = new HashMap<>();
        if (reactionCount.getReactions() != null) {
            for (ReactionCount count : reactionCount.getReactions()) {
                if (count.getType() instanceof ReactionTypeEmoji emoji) {
                    counts.merge(emoji.getEmoji(), count.getTotalCount(), Integer::sum);
                }
            }
        }
        eventPublisher.publishEvent(new ReactionCountEvent(chatId, messageId, counts));
    }

    static List<String> extractUrls(String text, List<MessageEntity> entities) {
        List<String> urls = new ArrayList<>();
        if (entities != null) {
            for (MessageEntity entity : entities) {
                if ("url".equals(entity.getType())) {
                    int end = Math.min(text.length(), entity.getOffset() + entity.getLength());
                    urls.add(text.substring(entity.getOffset(), end));
                } else if ("text_link".equals(entity.getType()) && entity.getUrl() != null) {
                    urls.add(entity.getUrl());
                }
            }
        }
        if (urls.isEmpty()) {
            Matcher matcher = URL_PATTERN.matcher(text);
            while (matcher.find()) {
                urls.add(matcher.group(1));
            }
        }
        return urls;
    }

    static String displayName(User user) {
        if (user.getUserName() != null && !user.getUserName().isBlank()) {
            return "@" + user.getUserName();
        }
        String name = user.getFirstName() != null ? user.getFirstName() : "";
        if (user.getLastName() != null && !user.getLastName().isBlank()) {
            name += " " + user.getLastName();
        }
        return name;
    }

    private static List<String> emojis(List<ReactionType> reactions) {
        List<String> result = new ArrayList<>();
        if (reactions != null) {
            for (ReactionType reaction : reactions) {
                if (reaction instanceof ReactionTypeEmoji emoji) {
                    result.add(emoji.getEmoji());
                }
            }
        }
        return result;
    }

    private boolean isConfiguredGroup(String chatId) {
        String groupId = properties.getTelegram().getGroupId();
        return groupId == null || groupId.isBlank() || groupId.equals(chatId);
    }

    // ==================== Outbound ====================

    @Override
    public String sendText(String chatId, String replyToId, String text) {
        return send(chatId, replyToId, text, null);
    }

    @Override
    public String sendPrompt(String chatId, String replyToId, String text, List<PromptButton> buttons) {
        return send(chatId, replyToId, text, keyboard(buttons));
    }

    @Override
    public String sendDirectMessage(String userId, String text) {
        return send(userId, null, text, null);
    }

    @Override
    public String sendDirectPrompt(String userId, String text, List<PromptButton> buttons) {
        return send(userId, null, text, keyboard(buttons));
    }

    private String send(String chatId, String replyToId, String text, InlineKeyboardMarkup keyboard) {
        String body = text.length() > TELEGRAM_MAX_MESSAGE_LENGTH
                ? text.substring(0, TELEGRAM_MAX_MESSAGE_LENGTH - 3) + "..."
                : text;
        SendMessage message = SendMessage.builder()
                .chatId(chatId)
                .text(body)
                .build();
        if (replyToId != null) {
            message.setReplyToMessageId(Integer.parseInt(replyToId));
        }
        if (keyboard != null) {
            message.setReplyMarkup(keyboard);
        }
        try {
            Message sent = client().execute(message);
            return sent.getMessageId().toString();
        } catch (TelegramApiException e) {
            throw new ChatFrontendException("Failed to send message to chat " + chatId, e);
        }
    }

    private static InlineKeyboardMarkup keyboard(List<PromptButton> buttons) {
        InlineKeyboardRow row = new InlineKeyboardRow();
        for (PromptButton button : buttons) {
            row.add(InlineKeyboardButton.builder()
                    .text(button.label())
                    .callbackData(button.callbackData())
                    .build());
        }
        return InlineKeyboardMarkup.builder().keyboardRow(row).build();
    }

    @Override
    public void react(String chatId, String messageId, String emoji) {
        SetMessageReaction reaction = SetMessageReaction.builder()
                .chatId(chatId)
                .messageId(Integer.parseInt(messageId))
                .reactionTypes(List.of(ReactionTypeEmoji.builder().emoji(emoji).build()))
                .build();
        try {
            client().execute(reaction);
        } catch (TelegramApiException e) {
            throw new ChatFrontendException("Failed to react on message " + messageId, e);
        }
    }

    @Override
    public void deleteMessage(String chatId, String messageId) {
        if (messageId == null) {
            return;
        }
        try {
            client().execute(DeleteMessage.builder()
                    .chatId(chatId)
                    .messageId(Integer.parseInt(messageId))
                    .build());
        } catch (TelegramApiException e) {
            throw new ChatFrontendException("Failed to delete message " + messageId, e);
        }
    }

    @Override
    public void editMessage(String chatId, String messageId, String text) {
        try {
            client().execute(EditMessageText.builder()
                    .chatId(chatId)
                    .messageId(Integer.parseInt(messageId))
                    .text(text)
                    .build());
        } catch (TelegramApiException e) {
            throw new ChatFrontendException("Failed to edit message " + messageId, e);
        }
    }

    @Override
    public void answerCallback(String callbackId, String text) {
        AnswerCallbackQuery answer = AnswerCallbackQuery.builder()
                .callbackQueryId(callbackId)
                .text(text)
                .build();
        try {
            client().execute(answer);
        } catch (TelegramApiException e) {
            log.debug("[Telegram] Failed to answer callback {}: {}", callbackId, e.getMessage());
        }
    }

    @Override
    public List<String> getAdminUserIds(String chatId) {
        try {
            List<ChatMember> admins = client().execute(GetChatAdministrators.builder().chatId(chatId).build());
            List<String> ids = new ArrayList<>();
            for (ChatMember admin : admins) {
                User user = admin.getUser();
                if (user != null && !Boolean.TRUE.equals(user.getIsBot())) {
                    ids.add(user.getId().toString());
                }
            }
            log.debug("[Telegram] {} admins in chat {}", ids.size(), chatId);
            return ids;
        } catch (TelegramApiException e) {
            throw new ChatFrontendException("Failed to fetch administrators of chat " + chatId, e);
        }
    }

    @Override
    public boolean isUserAdmin(String chatId, String userId) {
        return getAdminUserIds(chatId).contains(userId);
    }

    @Override
    public boolean isBotAdmin(String chatId) {
        try {
            User me = client().execute(GetMe.builder().build());
            ChatMember member = client().execute(GetChatMember.builder()
                    .chatId(chatId)
                    .userId(me.getId())
                    .build());
            log.debug("[Telegram] Bot {} has status {} in chat {}", me.getId(), member.getStatus(), chatId);
            return BOT_ADMIN_STATUSES.contains(member.getStatus());
        } catch (TelegramApiException e) {
            throw new ChatFrontendException("Failed to check bot membership in chat " + chatId, e);
        }
    }

    @Override
    public void watchReactions(String chatId, String messageId) {
        watchedMessages.add(watchKey(chatId, messageId));
    }

    @Override
    public void unwatchReactions(String chatId, String messageId) {
        watchedMessages.remove(watchKey(chatId, messageId));
    }

    private static String watchKey(String chatId, String messageId) {
        return chatId + ":" + messageId;
    }

    private TelegramClient client() {
        ensureInitialized();
        if (telegramClient == null) {
            throw new ChatFrontendException("Telegram client not initialized");
        }
        return telegramClient;
    }
}
