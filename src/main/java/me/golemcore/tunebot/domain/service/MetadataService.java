package me.golemcore.tunebot.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tunebot.domain.model.MediaDescriptor;
import me.golemcore.tunebot.domain.model.MediaKind;
import me.golemcore.tunebot.domain.model.MetadataSession;
import me.golemcore.tunebot.domain.model.Recommendations;
import me.golemcore.tunebot.domain.resilience.FailureKind;
import me.golemcore.tunebot.domain.resilience.OperationFailedException;
import me.golemcore.tunebot.domain.resilience.ResilientCallExecutor;
import me.golemcore.tunebot.domain.resilience.RetryPolicy;
import me.golemcore.tunebot.domain.resilience.RetryPolicyFactory;
import me.golemcore.tunebot.port.outbound.ArtworkPort;
import me.golemcore.tunebot.port.outbound.MetadataException;
import me.golemcore.tunebot.port.outbound.MetadataPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Metadata lookups and artwork fetches wrapped in the metadata retry policy.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MetadataService {

    private static final int RADIO_EXTRA = 5;

    private final MetadataPort metadataPort;
    private final ArtworkPort artworkPort;
    private final MetadataSessionHolder sessionHolder;
    private final ResilientCallExecutor callExecutor;
    private final RetryPolicyFactory retryPolicies;

    public List<MediaDescriptor> search(String query, MediaKind kind, int limit) {
        return call("metadata.search", session -> metadataPort.search(session, query, kind, limit));
    }

    public MediaDescriptor getEntity(MediaKind kind, String id) {
        return call("metadata.get-" + kind.name().toLowerCase(Locale.ROOT),
                session -> metadataPort.getEntity(session, kind, id));
    }

    public List<MediaDescriptor> listeningHistory(int limit) {
        requireSignedIn();
        return call("metadata.history", session -> metadataPort.listeningHistory(session, limit));
    }

    public List<MediaDescriptor> likedTracks(int limit) {
        requireSignedIn();
        return call("metadata.liked", session -> metadataPort.likedTracks(session, limit));
    }

    /**
     * Radio of the most recently played track when a signed-in history is
     * available, home feed tracks otherwise. Tracks are distinct and at most
     * {@code limit}.
     */
    public Recommendations recommendations(int limit) {
        if (sessionHolder.current().isAuthenticated()) {
            try {
                List<MediaDescriptor> radio = radioOfLastPlayed(limit);
                if (!radio.isEmpty()) {
                    return new Recommendations(Recommendations.Source.LISTENING_HISTORY, radio);
                }
            } catch (OperationFailedException e) {
                if (e.getKind() == FailureKind.CANCELLED) {
                    throw e;
                }
                log.warn("[Metadata] History radio unavailable, using home feed: {}", e.getMessage());
            }
        }
        List<MediaDescriptor> home = call("metadata.home",
                session -> metadataPort.homeFeed(session, limit + RADIO_EXTRA));
        return new Recommendations(Recommendations.Source.HOME_FEED, distinct(home, limit));
    }

    private List<MediaDescriptor> radioOfLastPlayed(int limit) {
        List<MediaDescriptor> history = call("metadata.history", session -> metadataPort.listeningHistory(session, 1));
        if (history.isEmpty()) {
            return List.of();
        }
        MediaDescriptor seed = history.get(0);
        List<MediaDescriptor> queue = call("metadata.radio",
                session -> metadataPort.radio(session, seed.getId(), limit + RADIO_EXTRA));
        if (queue.isEmpty()) {
            return List.of();
        }
        List<MediaDescriptor> withSeed = new ArrayList<>();
        withSeed.add(seed);
        withSeed.addAll(queue);
        return distinct(withSeed, limit);
    }

    private static List<MediaDescriptor> distinct(List<MediaDescriptor> tracks, int limit) {
        Map<String, MediaDescriptor> byId = new LinkedHashMap<>();
        for (MediaDescriptor track : tracks) {
            if (byId.size() >= limit) {
                break;
            }
            if (track.getId() != null) {
                byId.putIfAbsent(track.getId(), track);
            }
        }
        return new ArrayList<>(byId.values());
    }

    private void requireSignedIn() {
        if (!sessionHolder.current().isAuthenticated()) {
            throw new OperationFailedException(FailureKind.AUTHENTICATION_FAILED,
                    "this command needs a signed-in session (browser headers file)");
        }
    }

    public byte[] artwork(String url) {
        return callExecutor.execute("artwork.fetch", retryPolicies.metadata(null), () -> artworkPort.fetch(url));
    }

    private <T> T call(String callName, SessionCall<T> call) {
        AtomicReference<MetadataSession> used = new AtomicReference<>();
        RetryPolicy policy = retryPolicies.metadata(() -> sessionHolder.reauthenticate(used.get()));
        return callExecutor.execute(callName, policy, () -> {
            MetadataSession session = sessionHolder.current();
            used.set(session);
            return call.apply(session);
        });
    }

    @FunctionalInterface
    private interface SessionCall<T> {
        T apply(MetadataSession session) throws MetadataException;
    }
}
