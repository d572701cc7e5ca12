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
 * Emoji reactions the bot puts on chat messages.
 */
public final class Reaction {

    public static final String THUMBS_UP = "👍";
    public static final String THUMBS_DOWN = "👎";
    public static final String PROCESSING = "👀";
    public static final String FLOODED = "🥱";
    public static final List<String> IGNORED = List.of("🙈", "🙉", "🙊");

    private Reaction() {
    }
}
