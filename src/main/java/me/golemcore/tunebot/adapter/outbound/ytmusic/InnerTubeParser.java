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
import me.golemcore.tunebot.domain.model.MediaDescriptor;
import me.golemcore.tunebot.domain.model.MediaKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Extracts {@link MediaDescriptor}s from YouTube Music web client responses.
 *
 * <p>
 * Renderer nesting changes between client versions, so renderers are located
 * by name anywhere in the tree rather than by fixed paths.
 */
final class InnerTubeParser {

    private static final String LIST_ITEM = "musicResponsiveListItemRenderer";
    private static final String RUNS = "runs";
    private static final String TEXT = "text";
    private static final String SEPARATOR = " • ";
    private static final String ARTIST_PREFIX = "UC";
    private static final String ALBUM_PREFIX = "MPREb";
    private static final String PLAYLIST_BROWSE_PREFIX = "VL";
    private static final String TOPIC_SUFFIX = " - Topic";

    private static final Pattern DURATION = Pattern.compile("^\\d{1,2}(:\\d{2}){1,2}$");
    private static final Pattern YEAR = Pattern.compile("^\\d{4}$");
    private static final Set<String> TYPE_LABELS = Set.of(
            "song", "video", "album", "single", "ep", "playlist", "artist", "episode", "podcast");
    private static final List<String> HEADER_RENDERERS = List.of(
            "musicResponsiveHeaderRenderer", "musicDetailHeaderRenderer", "musicImmersiveHeaderRenderer",
            "musicVisualHeaderRenderer", "musicEditablePlaylistDetailHeaderRenderer");
    private static final List<String> SHELF_RENDERERS = List.of("musicShelfRenderer", "musicPlaylistShelfRenderer");

    private InnerTubeParser() {
    }

    static List<MediaDescriptor> searchResults(JsonNode response, MediaKind kind, int limit) {
        List<MediaDescriptor> results = new ArrayList<>();
        for (JsonNode item : response.findValues(LIST_ITEM)) {
            if (results.size() >= limit) {
                break;
            }
            MediaDescriptor descriptor = listItem(item, kind);
            if (descriptor != null) {
                results.add(descriptor);
            }
        }
        return results;
    }

    /**
     * Parses one list row. Returns {@code null} when the row carries no id
     * usable for the expected kind.
     */
    static MediaDescriptor listItem(JsonNode item, MediaKind kind) {
        JsonNode columns = item.path("flexColumns");
        String title = firstRunText(columns.path(0).path("musicResponsiveListItemFlexColumnRenderer").path(TEXT));
        if (title == null) {
            return null;
        }
        String id = kind.isPlayable() ? videoId(item) : browseId(item);
        if (id == null) {
            return null;
        }
        if (kind == MediaKind.PLAYLIST && id.startsWith(PLAYLIST_BROWSE_PREFIX)) {
            id = id.substring(PLAYLIST_BROWSE_PREFIX.length());
        }

        MediaDescriptor descriptor = MediaDescriptor.builder()
                .kind(kind)
                .id(id)
                .title(title)
                .thumbnailUrl(largestThumbnail(item.path("thumbnail")))
                .build();

        List<String> plainTexts = new ArrayList<>();
        for (int i = 1; i < columns.size(); i++) {
            JsonNode runs = columns.path(i).path("musicResponsiveListItemFlexColumnRenderer").path(TEXT).path(RUNS);
            applyRuns(descriptor, runs, plainTexts);
        }
        for (JsonNode fixed : item.path("fixedColumns")) {
            applyRuns(descriptor, fixed.path("musicResponsiveListItemFixedColumnRenderer").path(TEXT).path(RUNS),
                    plainTexts);
        }

        if (kind == MediaKind.PLAYLIST || kind == MediaKind.ARTIST) {
            descriptor.setSubtitle(String.join(SEPARATOR, plainTexts));
        } else if (descriptor.getArtists().isEmpty() && !plainTexts.isEmpty()) {
            descriptor.getArtists().add(stripTopic(plainTexts.get(0)));
        }
        return descriptor;
    }

    /**
     * Sorts the runs of a secondary column into artists, album, year and
     * duration; anything else is collected into {@code plainTexts}.
     */
    private static void applyRuns(MediaDescriptor descriptor, JsonNode runs, List<String> plainTexts) {
        for (JsonNode run : runs) {
            String text = run.path(TEXT).asText("").trim();
            if (text.isEmpty() || SEPARATOR.trim().equals(text) || ",".equals(text) || "&".equals(text)) {
                continue;
            }
            String browseId = run.path("navigationEndpoint").path("browseEndpoint").path("browseId").asText(null);
            if (browseId != null && browseId.startsWith(ARTIST_PREFIX)) {
                descriptor.getArtists().add(stripTopic(text));
            } else if (browseId != null && browseId.startsWith(ALBUM_PREFIX)) {
                descriptor.setAlbum(text);
            } else if (DURATION.matcher(text).matches()) {
                descriptor.setDurationSeconds(parseDuration(text));
            } else if (YEAR.matcher(text).matches()) {
                descriptor.setYear(text);
            } else if (!TYPE_LABELS.contains(text.toLowerCase(Locale.ROOT))) {
                plainTexts.add(text);
            }
        }
    }

    /**
     * Album, playlist or artist page: header fields plus the rows of the first
     * shelf.
     */
    static MediaDescriptor collection(JsonNode response, MediaKind kind, String id) {
        JsonNode header = firstRenderer(response, HEADER_RENDERERS);
        JsonNode shelf = firstRenderer(response, SHELF_RENDERERS);
        if (header == null && shelf == null) {
            return null;
        }

        MediaDescriptor descriptor = MediaDescriptor.builder().kind(kind).id(id).build();
        if (header != null) {
            descriptor.setTitle(firstRunText(header.path("title")));
            descriptor.setThumbnailUrl(largestThumbnail(header));
            List<String> plainTexts = new ArrayList<>();
            applyRuns(descriptor, header.path("straplineTextOne").path(RUNS), plainTexts);
            applyRuns(descriptor, header.path("subtitle").path(RUNS), plainTexts);
            applyRuns(descriptor, header.path("secondSubtitle").path(RUNS), plainTexts);
            if (kind == MediaKind.ARTIST) {
                String subscribers = firstRunText(header.path("subscriptionButton").path("subscribeButtonRenderer")
                        .path("subscriberCountText"));
                descriptor.setSubtitle(subscribers);
                descriptor.getArtists().clear();
            } else {
                if (descriptor.getArtists().isEmpty() && !plainTexts.isEmpty() && kind == MediaKind.ALBUM) {
                    descriptor.getArtists().add(stripTopic(plainTexts.remove(0)));
                }
                descriptor.setSubtitle(plainTexts.isEmpty() ? null : String.join(SEPARATOR, plainTexts));
            }
        }

        JsonNode rows = shelf != null ? shelf : response;
        for (JsonNode item : rows.findValues(LIST_ITEM)) {
            MediaDescriptor track = listItem(item, MediaKind.TRACK);
            if (track != null) {
                descriptor.getTracks().add(track);
            }
        }
        if (descriptor.getTitle() == null && descriptor.getTracks().isEmpty()) {
            return null;
        }
        return descriptor;
    }

    /**
     * Track from the {@code player} response.
     */
    static MediaDescriptor player(JsonNode response, MediaKind kind) {
        JsonNode details = response.path("videoDetails");
        String videoId = details.path("videoId").asText(null);
        if (videoId == null) {
            return null;
        }
        MediaDescriptor descriptor = MediaDescriptor.builder()
                .kind(kind)
                .id(videoId)
                .title(details.path("title").asText(videoId))
                .thumbnailUrl(largestThumbnail(details.path("thumbnail")))
                .build();
        String author = details.path("author").asText(null);
        if (author != null && !author.isBlank()) {
            descriptor.getArtists().add(stripTopic(author));
        }
        if (details.hasNonNull("lengthSeconds")) {
            descriptor.setDurationSeconds(details.path("lengthSeconds").asInt());
        }
        return descriptor;
    }

    /**
     * Adds album, year and credited artists from the {@code next} response
     * (the watch queue entry of the same video).
     */
    static void enrichFromWatchQueue(MediaDescriptor track, JsonNode response) {
        for (JsonNode entry : response.findValues("playlistPanelVideoRenderer")) {
            if (!track.getId().equals(entry.path("videoId").asText())) {
                continue;
            }
            MediaDescriptor credits = MediaDescriptor.builder().kind(track.getKind()).id(track.getId()).build();
            applyRuns(credits, entry.path("longBylineText").path(RUNS), new ArrayList<>());
            if (!credits.getArtists().isEmpty()) {
                track.setArtists(credits.getArtists());
            }
            if (credits.getAlbum() != null) {
                track.setAlbum(credits.getAlbum());
            }
            if (credits.getYear() != null) {
                track.setYear(credits.getYear());
            }
            return;
        }
    }

    /**
     * Entries of a watch queue ({@code next} response) in queue order.
     */
    static List<MediaDescriptor> watchQueue(JsonNode response, int limit) {
        List<MediaDescriptor> results = new ArrayList<>();
        for (JsonNode entry : response.findValues("playlistPanelVideoRenderer")) {
            if (results.size() >= limit) {
                break;
            }
            String videoId = entry.path("videoId").asText(null);
            String title = firstRunText(entry.path("title"));
            if (videoId == null || title == null) {
                continue;
            }
            MediaDescriptor track = MediaDescriptor.builder()
                    .kind(MediaKind.TRACK)
                    .id(videoId)
                    .title(title)
                    .thumbnailUrl(largestThumbnail(entry.path("thumbnail")))
                    .build();
            List<String> plainTexts = new ArrayList<>();
            applyRuns(track, entry.path("longBylineText").path(RUNS), plainTexts);
            if (track.getArtists().isEmpty() && !plainTexts.isEmpty()) {
                track.getArtists().add(stripTopic(plainTexts.get(0)));
            }
            String length = firstRunText(entry.path("lengthText"));
            if (length != null && DURATION.matcher(length).matches()) {
                track.setDurationSeconds(parseDuration(length));
            }
            results.add(track);
        }
        return results;
    }

    /**
     * Playable items of the home feed carousels. Items without a credited
     * artist (mixes, moods) are skipped.
     */
    static List<MediaDescriptor> homeFeed(JsonNode response, int limit) {
        List<MediaDescriptor> results = new ArrayList<>();
        for (JsonNode shelf : response.findValues("musicCarouselShelfRenderer")) {
            for (JsonNode content : shelf.path("contents")) {
                if (results.size() >= limit) {
                    return results;
                }
                MediaDescriptor track = content.has(LIST_ITEM)
                        ? listItem(content.path(LIST_ITEM), MediaKind.TRACK)
                        : twoRowItem(content.path("musicTwoRowItemRenderer"));
                if (track != null && !track.getArtists().isEmpty()) {
                    results.add(track);
                }
            }
        }
        return results;
    }

    private static MediaDescriptor twoRowItem(JsonNode item) {
        String videoId = item.path("navigationEndpoint").path("watchEndpoint").path("videoId").asText(null);
        String title = firstRunText(item.path("title"));
        if (videoId == null || title == null) {
            return null;
        }
        MediaDescriptor track = MediaDescriptor.builder()
                .kind(MediaKind.TRACK)
                .id(videoId)
                .title(title)
                .thumbnailUrl(largestThumbnail(item.path("thumbnailRenderer")))
                .build();
        applyRuns(track, item.path("subtitle").path(RUNS), new ArrayList<>());
        return track;
    }

    static String largestThumbnail(JsonNode node) {
        String best = null;
        int bestWidth = -1;
        for (JsonNode thumbnails : node.findValues("thumbnails")) {
            for (JsonNode thumbnail : thumbnails) {
                int width = thumbnail.path("width").asInt(0);
                String url = thumbnail.path("url").asText(null);
                if (url != null && width >= bestWidth) {
                    best = url;
                    bestWidth = width;
                }
            }
        }
        if (best != null && best.startsWith("//")) {
            best = "https:" + best;
        }
        return best;
    }

    static int parseDuration(String text) {
        int seconds = 0;
        for (String part : text.split(":")) {
            seconds = seconds * 60 + Integer.parseInt(part);
        }
        return seconds;
    }

    private static String videoId(JsonNode item) {
        String id = item.path("playlistItemData").path("videoId").asText(null);
        if (id != null) {
            return id;
        }
        JsonNode watch = item.findValue("watchEndpoint");
        return watch != null ? watch.path("videoId").asText(null) : null;
    }

    private static String browseId(JsonNode item) {
        return item.path("navigationEndpoint").path("browseEndpoint").path("browseId").asText(null);
    }

    private static JsonNode firstRenderer(JsonNode response, List<String> names) {
        for (String name : names) {
            JsonNode found = response.findValue(name);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private static String firstRunText(JsonNode textNode) {
        JsonNode runs = textNode.path(RUNS);
        if (runs.isArray() && !runs.isEmpty()) {
            String text = runs.path(0).path(TEXT).asText(null);
            return text != null && !text.isBlank() ? text : null;
        }
        String simple = textNode.path("simpleText").asText(null);
        return simple != null && !simple.isBlank() ? simple : null;
    }

    private static String stripTopic(String name) {
        return name.endsWith(TOPIC_SUFFIX) ? name.substring(0, name.length() - TOPIC_SUFFIX.length()) : name;
    }
}
