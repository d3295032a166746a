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

import me.golemcore.tunebot.domain.model.MediaKind;
import me.golemcore.tunebot.domain.model.MediaLink;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses YouTube and YouTube Music links, or bare ids, into a
 * {@link MediaLink}.
 *
 * <p>
 * The kind named by a link always wins over the caller's hint; the hint only
 * decides for bare ids that could mean more than one thing.
 */
public final class MediaLinkParser {

    private static final Pattern VIDEO_ID = Pattern.compile("[A-Za-z0-9_-]{11}");
    private static final String ALBUM_BROWSE_PREFIX = "MPREb_";
    private static final String ALBUM_PLAYLIST_PREFIX = "OLAK5uy_";
    private static final String BROWSE_PLAYLIST_PREFIX = "VL";
    private static final String CHANNEL_PREFIX = "UC";

    private MediaLinkParser() {
    }

    public static Optional<MediaLink> parse(String input, MediaKind hint) {
        if (input == null || input.isBlank()) {
            return Optional.empty();
        }
        String trimmed = input.trim();
        if (trimmed.contains("/") || trimmed.contains("?")) {
            return parseUrl(trimmed);
        }
        return parseBareId(trimmed, hint);
    }

    /**
     * Best-effort id extraction used when only a URL is known.
     */
    public static String sourceIdOf(String url) {
        return parse(url, null).map(MediaLink::id).orElse("");
    }

    private static Optional<MediaLink> parseUrl(String raw) {
        URI uri;
        try {
            uri = new URI(raw.contains("://") ? raw : "https://" + raw);
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
        String host = uri.getHost() != null ? uri.getHost().toLowerCase(Locale.ROOT) : "";
        String path = uri.getPath() != null ? uri.getPath() : "";

        String video = queryParam(uri, "v");
        if (video != null) {
            return Optional.of(new MediaLink(kindForVideo(host), video));
        }
        if (host.endsWith("youtu.be") && path.length() > 1) {
            return Optional.of(new MediaLink(MediaKind.VIDEO, path.substring(1)));
        }
        if (path.startsWith("/shorts/")) {
            return Optional.of(new MediaLink(MediaKind.VIDEO, lastSegment(path)));
        }
        String list = queryParam(uri, "list");
        if (list != null) {
            return Optional.of(new MediaLink(list.startsWith(ALBUM_PLAYLIST_PREFIX)
                    ? MediaKind.ALBUM
                    : MediaKind.PLAYLIST, list));
        }
        if (path.startsWith("/browse/")) {
            String id = lastSegment(path);
            if (id.startsWith(BROWSE_PLAYLIST_PREFIX)) {
                return Optional.of(new MediaLink(MediaKind.PLAYLIST, id.substring(BROWSE_PLAYLIST_PREFIX.length())));
            }
            if (id.startsWith(CHANNEL_PREFIX)) {
                return Optional.of(new MediaLink(MediaKind.ARTIST, id));
            }
            return Optional.of(new MediaLink(MediaKind.ALBUM, id));
        }
        if (path.startsWith("/channel/")) {
            return Optional.of(new MediaLink(MediaKind.ARTIST, lastSegment(path)));
        }
        return Optional.empty();
    }

    private static Optional<MediaLink> parseBareId(String id, MediaKind hint) {
        if (hint != null) {
            return Optional.of(new MediaLink(hint, id));
        }
        if (id.startsWith(ALBUM_BROWSE_PREFIX) || id.startsWith(ALBUM_PLAYLIST_PREFIX)) {
            return Optional.of(new MediaLink(MediaKind.ALBUM, id));
        }
        if (id.startsWith(CHANNEL_PREFIX) && id.length() == 24) {
            return Optional.of(new MediaLink(MediaKind.ARTIST, id));
        }
        if (VIDEO_ID.matcher(id).matches()) {
            return Optional.of(new MediaLink(MediaKind.TRACK, id));
        }
        if (id.startsWith("PL") || id.startsWith("RD") || id.startsWith(BROWSE_PLAYLIST_PREFIX)) {
            String playlistId = id.startsWith(BROWSE_PLAYLIST_PREFIX) ? id.substring(2) : id;
            return Optional.of(new MediaLink(MediaKind.PLAYLIST, playlistId));
        }
        return Optional.empty();
    }

    private static MediaKind kindForVideo(String host) {
        return host.startsWith("music.") ? MediaKind.TRACK : MediaKind.VIDEO;
    }

    private static String queryParam(URI uri, String name) {
        String query = uri.getRawQuery();
        if (query == null) {
            return null;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0 && pair.substring(0, eq).equals(name)) {
                String value = URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
                return value.isBlank() ? null : value;
            }
        }
        return null;
    }

    private static String lastSegment(String path) {
        String stripped = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        return stripped.substring(stripped.lastIndexOf('/') + 1);
    }
}
