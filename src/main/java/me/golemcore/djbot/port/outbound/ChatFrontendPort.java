package me.golemcore.djbot.port.outbound;

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

import me.golemcore.djbot.domain.model.PromptButton;

import java.util.List;

/**
 * Port for the group chat the bot lives in.
 *
 * <p>
 * Inbound messages, button callbacks and reactions are delivered as Spring
 * application events ({@code InboundChatMessageEvent},
 * {@code ApprovalCallbackEvent}, {@code ReactionUpdateEvent}); this port covers
 * the outbound side. Admin and community approval are optional capabilities,
 * see {@link AdminApprovalCapablePort} and {@link CommunityApprovalCapablePort}.
 *
 * <p>
 * Implementations must be safe for concurrent use. Methods that return a
 * message id throw {@link ChatFrontendException} when delivery fails.
 */
public interface ChatFrontendPort {

    void start();

    void stop();

    boolean isRunning();

    /**
     * Send plain text, optionally as a reply.
     *
     * @param replyToId
     *            message to reply to, or {@code null}
     * @return id of the sent message
     */
    String sendText(String chatId, String replyToId, String text);

    /**
     * Send text with inline buttons.
     *
     * @return id of the sent message
     */
    String sendPrompt(String chatId, String replyToId, String text, List<PromptButton> buttons);

    void react(String chatId, String messageId, String emoji);

    void deleteMessage(String chatId, String messageId);

    /**
     * Replace the text of a message. Inline buttons are removed.
     */
    void editMessage(String chatId, String messageId, String text);

    /**
     * Acknowledge a button press, optionally showing a short notice to the
     * presser.
     */
    void answerCallback(String callbackId, String text);

    List<String> getAdminUserIds(String chatId);

    boolean isUserAdmin(String chatId, String userId);

    /**
     * Whether the bot itself holds admin rights in the chat. Reactions and
     * message deletion depend on it.
     */
    boolean isBotAdmin(String chatId);

    /**
     * @return id of the sent message
     */
    String sendDirectMessage(String userId, String text);
}
