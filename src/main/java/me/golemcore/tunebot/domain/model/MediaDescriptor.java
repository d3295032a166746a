package me.golemcore.tunebot.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A search result or a resolved entity returned by the metadata service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MediaDescriptor {

    private MediaKind kind;
    private String id;
    private String title;

    @Builder.Default
    private List<String> artists = new ArrayList<>();

    private String album;
    private String year;
    private Integer durationSeconds;
    private String thumbnailUrl;

    /** Secondary line shown in listings: track count, subscribers, views. */
    private String subtitle;

    /** Tracks of an album or playlist, top songs of an artist. */
    @Builder.Default
    private List<MediaDescriptor> tracks = new ArrayList<>();

    public String getUrl() {
        return kind != null && id != null ? kind.urlFor(id) : null;
    }

    public String artistLine() {
        return artists == null || artists.isEmpty() ? "" : String.join(", ", artists);
    }
}
