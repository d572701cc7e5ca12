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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable processing state of one inbound message.
 *
 * <p>
 * Owned by the task processing that message; the dispatcher registers it in
 * the live-context map on acceptance and removes it when processing ends.
 */
@Data
@Builder
public class MessageContext {

    private final InputMessage input;
    private final ChatMessage origin;
    private final Instant startTime;
    private final Instant timeoutAt;

    @Builder.Default
    private volatile MessageState state = MessageState.DISPATCH;

    @Builder.Default
    private List<RankedCandidate> candidates = new ArrayList<>();

    private String selectedTrackId;

    public String key() {
        return input.getChatId() + ":" + input.getMessageId();
    }
}
