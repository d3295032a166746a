package me.golemcore.tunebot.port.outbound;

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

import me.golemcore.tunebot.domain.model.MediaDescriptor;
import me.golemcore.tunebot.domain.model.MediaKind;
import me.golemcore.tunebot.domain.model.MetadataSession;

import java.nio.file.Path;
import java.util.List;

/**
 * Music metadata and search service. Every call takes the session explicitly
 * so that callers always use the session current at the time of the attempt.
 */
public interface MetadataPort {

    List<MediaDescriptor> search(MetadataSession session, String query, MediaKind kind, int limit)
            throws MetadataException;

    MediaDescriptor getEntity(MetadataSession session, MediaKind kind, String id) throws MetadataException;

    /**
     * Recently played tracks, newest first. Needs an authenticated session.
     */
    List<MediaDescriptor> listeningHistory(MetadataSession session, int limit) throws MetadataException;

    /**
     * Tracks of the "liked music" playlist. Needs an authenticated session.
     */
    List<MediaDescriptor> likedTracks(MetadataSession session, int limit) throws MetadataException;

    /**
     * Radio queue started from a track; the seed itself may or may not be part
     * of the result.
     */
    List<MediaDescriptor> radio(MetadataSession session, String seedVideoId, int limit) throws MetadataException;

    /**
     * Playable tracks with known artists from the home feed sections.
     */
    List<MediaDescriptor> homeFeed(MetadataSession session, int limit) throws MetadataException;

    /**
     * Establishes a session.
     *
     * @param credentialsFile
     *            browser headers file, or {@code null} for an anonymous session
     */
    MetadataSession authenticate(Path credentialsFile) throws MetadataException;
}
