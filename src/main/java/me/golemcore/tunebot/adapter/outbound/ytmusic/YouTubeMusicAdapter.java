package me.golemcore.tunebot.adapter.outbound.ytmusic;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tunebot.domain.model.MediaDescriptor;
import me.golemcore.tunebot.domain.model.MediaKind;
import me.golemcore.tunebot.domain.model.MetadataSession;
import me.golemcore.tunebot.infrastructure.config.BotProperties;
import me.golemcore.tunebot.port.outbound.MetadataException;
import me.golemcore.tunebot.port.outbound.MetadataPort;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * YouTube Music metadata through the InnerTube web client API.
 *
 * <p>
 * Endpoints used:
 * <ul>
 * <li>{@code search} - typed search with a result filter</li>
 * <li>{@code player} - track and video details</li>
 * <li>{@code next} - album and year of a track from its watch queue, radio
 * queues</li>
 * <li>{@code browse} - album, playlist and artist pages, listening history,
 * liked music and the home feed</li>
 * </ul>
 *
 * <p>
 * Authenticated sessions carry the browser headers of a signed-in user; the
 * {@code SAPISIDHASH} authorization is recomputed for every request.
 */
@Component
@Slf4j
public class YouTubeMusicAdapter implements MetadataPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String HISTORY_BROWSE_ID = "FEmusic_history";
    private static final String HOME_BROWSE_ID = "FEmusic_home";
    private static final String LIKED_BROWSE_ID = "VLLM";
    private static final String PLAYLIST_BROWSE_PREFIX = "VL";
    private static final String RADIO_PLAYLIST_PREFIX = "RDAMVM";
    private static final String RADIO_PARAMS = "wAEB";

    private static final Map<MediaKind, String> SEARCH_FILTERS = Map.of(
            MediaKind.TRACK, "EgWKAQIIAWoMEA4QChADEAQQCRAF",
            MediaKind.VIDEO, "EgWKAQIQAWoMEA4QChADEAQQCRAF",
            MediaKind.ALBUM, "EgWKAQIYAWoMEA4QChADEAQQCRAF",
            MediaKind.ARTIST, "EgWKAQIgAWoMEA4QChADEAQQCRAF",
            MediaKind.PLAYLIST, "EgeKAQQoAEABagwQDhAKEAMQBBAJEAU=");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final BotProperties.MetadataProperties config;
    private final Clock clock;

    public YouTubeMusicAdapter(OkHttpClient baseHttpClient, ObjectMapper objectMapper, BotProperties properties,
            Clock clock) {
        this.httpClient = baseHttpClient;
        this.objectMapper = objectMapper;
        this.config = properties.getMetadata();
        this.clock = clock;
    }

    @Override
    public List<MediaDescriptor> search(MetadataSession session, String query, MediaKind kind, int limit)
            throws MetadataException {
        ObjectNode body = requestBody();
        body.put("query", query);
        body.put("params", SEARCH_FILTERS.get(kind));
        JsonNode response = post(session, "search", body);
        List<MediaDescriptor> results = InnerTubeParser.searchResults(response, kind, limit);
        log.debug("[Metadata] Search '{}' ({}): {} result(s)", query, kind, results.size());
        return results;
    }

    @Override
    public MediaDescriptor getEntity(MetadataSession session, MediaKind kind, String id) throws MetadataException {
        return switch (kind) {
        case TRACK, VIDEO -> track(session, kind, id);
        case ALBUM -> browse(session, kind, id, id.startsWith("OLAK5uy_") ? PLAYLIST_BROWSE_PREFIX + id : id);
        case PLAYLIST -> browse(session, kind, id,
                id.startsWith(PLAYLIST_BROWSE_PREFIX) ? id : PLAYLIST_BROWSE_PREFIX + id);
        case ARTIST -> browse(session, kind, id, id);
        };
    }

    @Override
    public List<MediaDescriptor> listeningHistory(MetadataSession session, int limit) throws MetadataException {
        return InnerTubeParser.searchResults(browse(session, HISTORY_BROWSE_ID), MediaKind.TRACK, limit);
    }

    @Override
    public List<MediaDescriptor> likedTracks(MetadataSession session, int limit) throws MetadataException {
        return InnerTubeParser.searchResults(browse(session, LIKED_BROWSE_ID), MediaKind.TRACK, limit);
    }

    @Override
    public List<MediaDescriptor> radio(MetadataSession session, String seedVideoId, int limit)
            throws MetadataException {
        ObjectNode body = requestBody();
        body.put("videoId", seedVideoId);
        body.put("playlistId", RADIO_PLAYLIST_PREFIX + seedVideoId);
        body.put("params", RADIO_PARAMS);
        body.put("isAudioOnly", true);
        body.put("enablePersistentPlaylistPanel", true);
        List<MediaDescriptor> queue = InnerTubeParser.watchQueue(post(session, "next", body), limit);
        log.debug("[Metadata] Radio of {}: {} track(s)", seedVideoId, queue.size());
        return queue;
    }

    @Override
    public List<MediaDescriptor> homeFeed(MetadataSession session, int limit) throws MetadataException {
        return InnerTubeParser.homeFeed(browse(session, HOME_BROWSE_ID), limit);
    }

    @Override
    public MetadataSession authenticate(Path credentialsFile) throws MetadataException {
        if (credentialsFile == null) {
            return MetadataSession.anonymous(clock.instant());
        }

        Map<String, String> headers;
        try {
            headers = BrowserHeaders.load(credentialsFile, objectMapper);
        } catch (IOException e) {
            throw new MetadataException(MetadataException.Reason.INVALID,
                    "cannot read headers file " + credentialsFile + ": " + e.getMessage(), e);
        }
        if (BrowserHeaders.sapisid(headers.get(BrowserHeaders.COOKIE)) == null) {
            throw new MetadataException(MetadataException.Reason.INVALID,
                    "headers file " + credentialsFile + " has no SAPISID cookie");
        }

        MetadataSession session = new MetadataSession(headers, true, clock.instant());
        browse(session, HISTORY_BROWSE_ID);
        return session;
    }

    private MediaDescriptor track(MetadataSession session, MediaKind kind, String videoId)
            throws MetadataException {
        ObjectNode body = requestBody();
        body.put("videoId", videoId);
        JsonNode player = post(session, "player", body);

        String status = player.path("playabilityStatus").path("status").asText("");
        if ("ERROR".equals(status) || "LOGIN_REQUIRED".equals(status) && !session.isAuthenticated()) {
            throw new MetadataException(MetadataException.Reason.NOT_FOUND,
                    videoId + ": " + player.path("playabilityStatus").path("reason").asText(status));
        }
        MediaDescriptor descriptor = InnerTubeParser.player(player, kind);
        if (descriptor == null) {
            throw new MetadataException(MetadataException.Reason.NOT_FOUND, videoId + ": no video details");
        }

        ObjectNode nextBody = requestBody();
        nextBody.put("videoId", videoId);
        nextBody.put("isAudioOnly", true);
        try {
            InnerTubeParser.enrichFromWatchQueue(descriptor, post(session, "next", nextBody));
        } catch (MetadataException e) {
            if (e.getReason() == MetadataException.Reason.AUTHENTICATION) {
                throw e;
            }
            log.debug("[Metadata] Watch queue of {} unavailable: {}", videoId, e.getMessage());
        }
        return descriptor;
    }

    private MediaDescriptor browse(MetadataSession session, MediaKind kind, String id, String browseId)
            throws MetadataException {
        MediaDescriptor descriptor = InnerTubeParser.collection(browse(session, browseId), kind, id);
        if (descriptor == null) {
            throw new MetadataException(MetadataException.Reason.NOT_FOUND, kind + " " + id + " not found");
        }
        return descriptor;
    }

    private JsonNode browse(MetadataSession session, String browseId) throws MetadataException {
        ObjectNode body = requestBody();
        body.put("browseId", browseId);
        return post(session, "browse", body);
    }

    private ObjectNode requestBody() {
        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode context = body.putObject("context");
        ObjectNode client = context.putObject("client");
        client.put("clientName", config.getClientName());
        client.put("clientVersion", config.getClientVersion());
        client.put("hl", config.getLanguage());
        context.putObject("user");
        return body;
    }

    private JsonNode post(MetadataSession session, String endpoint, ObjectNode body) throws MetadataException {
        Request.Builder builder = new Request.Builder()
                .url(config.getBaseUrl() + endpoint + "?alt=json")
                .post(RequestBody.create(body.toString(), JSON))
                .header("origin", config.getOrigin())
                .header("x-goog-authuser", "0");
        session.getHeaders().forEach(builder::header);
        String sapisid = BrowserHeaders.sapisid(session.getHeaders().get(BrowserHeaders.COOKIE));
        if (sapisid != null) {
            builder.header(BrowserHeaders.AUTHORIZATION,
                    BrowserHeaders.sapisidHash(sapisid, config.getOrigin(), clock.instant().getEpochSecond()));
        }

        try (Response response = httpClient.newCall(builder.build()).execute()) {
            ResponseBody responseBody = response.body();
            if (!response.isSuccessful()) {
                throw failure(endpoint, response.code());
            }
            if (responseBody == null) {
                throw new MetadataException(MetadataException.Reason.TRANSIENT, endpoint + ": empty response");
            }
            return objectMapper.readTree(responseBody.string());
        } catch (MetadataException e) {
            throw e;
        } catch (IOException e) {
            throw new MetadataException(MetadataException.Reason.TRANSIENT, endpoint + ": " + e.getMessage(), e);
        }
    }

    private static MetadataException failure(String endpoint, int status) {
        MetadataException.Reason reason;
        if (status == 401 || status == 403) {
            reason = MetadataException.Reason.AUTHENTICATION;
        } else if (status == 429) {
            reason = MetadataException.Reason.RATE_LIMITED;
        } else if (status >= 500) {
            reason = MetadataException.Reason.TRANSIENT;
        } else if (status == 404) {
            reason = MetadataException.Reason.NOT_FOUND;
        } else {
            reason = MetadataException.Reason.INVALID;
        }
        return new MetadataException(reason, endpoint + ": HTTP " + status, status, null);
    }
}
