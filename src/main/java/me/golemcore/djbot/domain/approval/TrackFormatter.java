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

import me.golemcore.djbot.domain.model.Track;
import me.golemcore.djbot.infrastructure.i18n.MessageService;

/**
 * Formats the optional album/year/link suffix shown next to a track.
 */
public final class TrackFormatter {

    private TrackFormatter() {
    }

    public static String details(MessageService messageService, Track track) {
        StringBuilder sb = new StringBuilder();
        if (track.getAlbum() != null && !track.getAlbum().isBlank()) {
            sb.append(messageService.getMessage("format.album", track.getAlbum()));
        }
        if (track.getYear() > 0) {
            sb.append(messageService.getMessage("format.year", String.valueOf(track.getYear())));
        }
        if (track.getUrl() != null && !track.getUrl().isBlank()) {
            sb.append(messageService.getMessage("format.url", track.getUrl()));
        }
        return sb.toString();
    }
}
