package me.golemcore.djbot.domain.model;

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

/**
 * Event published when a user presses an approval button.
 *
 * <p>
 * Published by inbound chat adapters. Consumed by the approval services and
 * the auto-play monitor, each filtering on {@link #kind()}.
 *
 * @since 1.0
 */
public record ApprovalCallbackEvent(ApprovalKind kind, String key, boolean approved, String responderId,
        String callbackId, String chatId, String messageId) {
}
