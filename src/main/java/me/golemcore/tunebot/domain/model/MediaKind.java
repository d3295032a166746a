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

/**
 * Kinds of entities exposed by the metadata service.
 */
public enum MediaKind {

    TRACK("https://music.youtube.com/watch?v="),
    VIDEO("https://www.youtube.com/watch?v="),
    ALBUM("https://music.youtube.com/browse/"),
    PLAYLIST("https://music.youtube.com/playlist?list="),
    ARTIST("https://music.youtube.com/channel/");

    private final String urlPrefix;

    MediaKind(String urlPrefix) {
        this.urlPrefix = urlPrefix;
    }

    public String urlFor(String id) {
        return urlPrefix + id;
    }

    public boolean isCollection() {
        return this == ALBUM || this == PLAYLIST;
    }

    public boolean isPlayable() {
        return this == TRACK || this == VIDEO;
    }
}
