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

import java.util.List;

/**
 * Tracks suggested for the signed-in user and where they came from.
 */
public record Recommendations(Source source, List<MediaDescriptor> tracks) {

    /**
     * Origin of a recommendation list.
     */
    public enum Source {
        /** Radio queue seeded with the most recently played track. */
        LISTENING_HISTORY,
        /** Tracks from the home feed sections. */
        HOME_FEED
    }

    public Recommendations {
        tracks = List.copyOf(tracks);
    }
}
