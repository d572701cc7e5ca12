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
 * Inline button attached to a prompt. Callback data has the form
 * {@code <kind>:<key>:yes|no}.
 */
public record PromptButton(String label, String callbackData) {

    public static PromptButton approve(String label, ApprovalKind kind, String key) {
        return new PromptButton(label, kind.prefix() + ":" + key + ":yes");
    }

    public static PromptButton reject(String label, ApprovalKind kind, String key) {
        return new PromptButton(label, kind.prefix() + ":" + key + ":no");
    }
}
