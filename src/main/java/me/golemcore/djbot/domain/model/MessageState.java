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
 * States of the per-message dispatch state machine.
 */
public enum MessageState {
    DISPATCH,
    HANDLE_LINK,
    ASK_WHICH_SONG,
    DISAMBIGUATE,
    CONFIRMATION_PROMPT,
    CLARIFY_ASK,
    AWAITING_APPROVAL,
    ADD_TO_PLAYLIST,
    REACT_ADDED,
    REACT_DUPLICATE,
    REACT_ERROR,
    REACT_IGNORED;

    public boolean isTerminal() {
        return this == REACT_ADDED || this == REACT_DUPLICATE || this == REACT_ERROR || this == REACT_IGNORED;
    }
}
