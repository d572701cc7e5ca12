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

import java.util.List;

/**
 * A single user changed their reactions on a message.
 */
public record ReactionUpdateEvent(String chatId, String messageId, String userId, List<String> oldReactions,
        List<String> newReactions) {

    public boolean added(String emoji) {
        return !oldReactions.contains(emoji) && newReactions.contains(emoji);
    }

    public boolean removed(String emoji) {
        return oldReactions.contains(emoji) && !newReactions.contains(emoji);
    }
}
