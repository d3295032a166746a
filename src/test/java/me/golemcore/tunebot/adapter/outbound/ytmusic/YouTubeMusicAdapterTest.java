package me.golemcore.tunebot.adapter.outbound.ytmusic;

import me.golemcore.tunebot.domain.model.MediaDescriptor;
import me.golemcore.tunebot.domain.model.MediaKind;
import me.golemcore.tunebot.domain.model.MetadataSession;
import me.golemcore.tunebot.infrastructure.config.AutoConfiguration;
import me.golemcore.tunebot.infrastructure.config.BotProperties;
import me.golemcore.tunebot.port.outbound.MetadataException;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class YouTubeMusicAdapterTest {

    private static final String CONTENT_TYPE = "Content-Type";
    private static final String APPLICATION_JSON = "application/json";
    private static final Instant NOW = Instant.ofEpochSecond(1_700_000_000L);
    private static final String VIDEO_ID = "FGBhQbmPwH8";

    private static final String SEARCH_RESPONSE = """
            {"contents":{"tabbedSearchResultsRenderer":{"tabs":[{"tabRenderer":{"content":
            {"sectionListRenderer":{"contents":[{"musicShelfRenderer":{"contents":[
              {"musicResponsiveListItemRenderer":{
                "thumbnail":{"musicThumbnailRenderer":{"thumbnail":{"thumbnails":[
                  {"url":"https://lh3.example/small","width":60},
                  {"url":"https://lh3.example/large","width":120}]}}},
                "flexColumns":[
                  {"musicResponsiveListItemFlexColumnRenderer":{"text":{"runs":[{"text":"One More Time"}]}}},
                  {"musicResponsiveListItemFlexColumnRenderer":{"text":{"runs":[
                    {"text":"Song"},{"text":" • "},
                    {"text":"Daft Punk","navigationEndpoint":{"browseEndpoint":{"browseId":"UCdaft"}}},
                    {"text":" • "},
                    {"text":"Discovery","navigationEndpoint":{"browseEndpoint":{"browseId":"MPREb_disc"}}},
                    {"text":" • "},{"text":"5:20"}]}}}],
                "playlistItemData":{"videoId":"FGBhQbmPwH8"}}},
              {"musicResponsiveListItemRenderer":{
                "flexColumns":[
                  {"musicResponsiveListItemFlexColumnRenderer":{"text":{"runs":[{"text":"No id here"}]}}}]}},
              {"musicResponsiveListItemRenderer":{
                "flexColumns":[
                  {"musicResponsiveListItemFlexColumnRenderer":{"text":{"runs":[{"text":"Aerodynamic"}]}}},
                  {"musicResponsiveListItemFlexColumnRenderer":{"text":{"runs":[
                    {"text":"Daft Punk - Topic"},{"text":" • "},{"text":"3:27"}]}}}],
                "overlay":{"musicItemThumbnailOverlayRenderer":{"content":{"musicPlayButtonRenderer":
                  {"playNavigationEndpoint":{"watchEndpoint":{"videoId":"L93-7vRfxNs"}}}}}}}}
            ]}}]}}}}]}}}
            """;

    private static final String PLAYLIST_SEARCH_RESPONSE = """
            {"contents":{"musicShelfRenderer":{"contents":[
              {"musicResponsiveListItemRenderer":{
                "flexColumns":[
                  {"musicResponsiveListItemFlexColumnRenderer":{"text":{"runs":[{"text":"Focus Mix"}]}}},
                  {"musicResponsiveListItemFlexColumnRenderer":{"text":{"runs":[
                    {"text":"Playlist"},{"text":" • "},{"text":"YouTube Music"},{"text":" • "},
                    {"text":"1.2M views"}]}}}],
                "navigationEndpoint":{"browseEndpoint":{"browseId":"VLPLfocus"}}}}]}}}
            """;

    private static final String ALBUM_RESPONSE = """
            {"contents":{"twoColumnBrowseResultsRenderer":{
              "tabs":[{"tabRenderer":{"content":{"sectionListRenderer":{"contents":[
                {"musicResponsiveHeaderRenderer":{
                  "title":{"runs":[{"text":"Discovery"}]},
                  "straplineTextOne":{"runs":[
                    {"text":"Daft Punk","navigationEndpoint":{"browseEndpoint":{"browseId":"UCdaft"}}}]},
                  "subtitle":{"runs":[{"text":"Album"},{"text":" • "},{"text":"2001"}]},
                  "secondSubtitle":{"runs":[{"text":"2 songs"},{"text":" • "},{"text":"9 minutes"}]},
                  "thumbnail":{"musicThumbnailRenderer":{"thumbnail":{"thumbnails":[
                    {"url":"https://lh3.example/cover","width":544}]}}}}}]}}}}],
              "secondaryContents":{"sectionListRenderer":{"contents":[{"musicShelfRenderer":{"contents":[
                {"musicResponsiveListItemRenderer":{
                  "flexColumns":[
                    {"musicResponsiveListItemFlexColumnRenderer":{"text":{"runs":[{"text":"One More Time"}]}}}],
                  "fixedColumns":[
                    {"musicResponsiveListItemFixedColumnRenderer":{"text":{"runs":[{"text":"5:20"}]}}}],
                  "playlistItemData":{"videoId":"FGBhQbmPwH8"}}},
                {"musicResponsiveListItemRenderer":{
                  "flexColumns":[
                    {"musicResponsiveListItemFlexColumnRenderer":{"text":{"runs":[{"text":"Aerodynamic"}]}}}],
                  "fixedColumns":[
                    {"musicResponsiveListItemFixedColumnRenderer":{"text":{"runs":[{"text":"3:27"}]}}}],
                  "playlistItemData":{"videoId":"L93-7vRfxNs"}}}]}}]}}}}}
            """;

    private static final String PLAYER_RESPONSE = """
            {"playabilityStatus":{"status":"OK"},
             "videoDetails":{"videoId":"FGBhQbmPwH8","title":"One More Time","author":"Daft Punk - Topic",
               "lengthSeconds":"320",
               "thumbnail":{"thumbnails":[{"url":"//i.ytimg.example/small.jpg","width":120},
                                          {"url":"//i.ytimg.example/large.jpg","width":544}]}}}
            """;

    private static final String NEXT_RESPONSE = """
            {"contents":{"singleColumnMusicWatchNextResultsRenderer":{"tabbedRenderer":{"tabs":[
              {"tabRenderer":{"content":{"musicQueueRenderer":{"content":{"playlistPanelRenderer":{"contents":[
                {"playlistPanelVideoRenderer":{"videoId":"L93-7vRfxNs","longBylineText":{"runs":[{"text":"Other"}]}}},
                {"playlistPanelVideoRenderer":{"videoId":"FGBhQbmPwH8","longBylineText":{"runs":[
                  {"text":"Daft Punk","navigationEndpoint":{"browseEndpoint":{"browseId":"UCdaft"}}},
                  {"text":" • "},
                  {"text":"Discovery","navigationEndpoint":{"browseEndpoint":{"browseId":"MPREb_disc"}}},
                  {"text":" • "},{"text":"2001"}]}}}]}}}}}}]}}}}
            """;

    private static final String RADIO_RESPONSE = """
            {"contents":{"singleColumnMusicWatchNextResultsRenderer":{"tabbedRenderer":{"tabs":[
              {"tabRenderer":{"content":{"musicQueueRenderer":{"content":{"playlistPanelRenderer":{"contents":[
                {"playlistPanelVideoRenderer":{"videoId":"FGBhQbmPwH8","title":{"runs":[{"text":"One More Time"}]},
                  "lengthText":{"runs":[{"text":"5:20"}]},
                  "longBylineText":{"runs":[
                    {"text":"Daft Punk","navigationEndpoint":{"browseEndpoint":{"browseId":"UCdaft"}}},
                    {"text":" • "},
                    {"text":"Discovery","navigationEndpoint":{"browseEndpoint":{"browseId":"MPREb_disc"}}}]}}},
                {"playlistPanelVideoRenderer":{"videoId":"L93-7vRfxNs","title":{"runs":[{"text":"Aerodynamic"}]},
                  "longBylineText":{"runs":[{"text":"Daft Punk - Topic"},{"text":" • "},{"text":"2001"}]}}},
                {"playlistPanelVideoRenderer":{"videoId":"noTitle0001"}}]}}}}}}]}}}}
            """;

    private static final String HOME_RESPONSE = """
            {"contents":{"singleColumnBrowseResultsRenderer":{"tabs":[{"tabRenderer":{"content":
            {"sectionListRenderer":{"contents":[
              {"musicCarouselShelfRenderer":{"contents":[
                {"musicTwoRowItemRenderer":{"title":{"runs":[{"text":"One More Time"}]},
                  "subtitle":{"runs":[{"text":"Song"},{"text":" • "},
                    {"text":"Daft Punk","navigationEndpoint":{"browseEndpoint":{"browseId":"UCdaft"}}}]},
                  "navigationEndpoint":{"watchEndpoint":{"videoId":"FGBhQbmPwH8"}}}},
                {"musicTwoRowItemRenderer":{"title":{"runs":[{"text":"My Supermix"}]},
                  "subtitle":{"runs":[{"text":"Daft Punk, Justice and more"}]},
                  "navigationEndpoint":{"watchEndpoint":{"videoId":"mixVideo001"}}}},
                {"musicTwoRowItemRenderer":{"title":{"runs":[{"text":"Focus"}]},
                  "subtitle":{"runs":[{"text":"Playlist"}]},
                  "navigationEndpoint":{"browseEndpoint":{"browseId":"VLPLfocus"}}}}]}},
              {"musicCarouselShelfRenderer":{"contents":[
                {"musicResponsiveListItemRenderer":{
                  "flexColumns":[
                    {"musicResponsiveListItemFlexColumnRenderer":{"text":{"runs":[{"text":"Aerodynamic"}]}}},
                    {"musicResponsiveListItemFlexColumnRenderer":{"text":{"runs":[
                      {"text":"Daft Punk","navigationEndpoint":{"browseEndpoint":{"browseId":"UCdaft"}}}]}}}],
                  "playlistItemData":{"videoId":"L93-7vRfxNs"}}}]}}
            ]}}}}]}}}
            """;

    @TempDir
    Path tempDir;

    private MockWebServer mockServer;
    private YouTubeMusicAdapter adapter;
    private MetadataSession anonymous;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();

        BotProperties properties = new BotProperties();
        properties.getMetadata().setBaseUrl(mockServer.url("/youtubei/v1/").toString());

        adapter = new YouTubeMusicAdapter(new OkHttpClient(), AutoConfiguration.objectMapper(), properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
        anonymous = MetadataSession.anonymous(NOW);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    private void enqueueJson(String body) {
        mockServer.enqueue(new MockResponse().setBody(body).setHeader(CONTENT_TYPE, APPLICATION_JSON));
    }

    private RecordedRequest takeRequest() throws InterruptedException {
        RecordedRequest request = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        return request;
    }

    @Test
    void shouldParseTrackSearchResults() throws Exception {
        enqueueJson(SEARCH_RESPONSE);

        List<MediaDescriptor> results = adapter.search(anonymous, "one more time", MediaKind.TRACK, 5);

        assertEquals(2, results.size());
        MediaDescriptor first = results.get(0);
        assertEquals(MediaKind.TRACK, first.getKind());
        assertEquals(VIDEO_ID, first.getId());
        assertEquals("One More Time", first.getTitle());
        assertEquals(List.of("Daft Punk"), first.getArtists());
        assertEquals("Discovery", first.getAlbum());
        assertEquals(320, first.getDurationSeconds());
        assertEquals("https://lh3.example/large", first.getThumbnailUrl());

        MediaDescriptor second = results.get(1);
        assertEquals("L93-7vRfxNs", second.getId());
        assertEquals(List.of("Daft Punk"), second.getArtists());
        assertEquals(207, second.getDurationSeconds());

        RecordedRequest request = takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/youtubei/v1/search?alt=json", request.getPath());
        assertEquals("https://music.youtube.com", request.getHeader("origin"));
        assertNull(request.getHeader("authorization"));
        String body = request.getBody().readUtf8();
        assertTrue(body.contains("\"query\":\"one more time\""));
        assertTrue(body.contains("\"params\":\"EgWKAQIIAWoMEA4QChADEAQQCRAF\""));
        assertTrue(body.contains("\"clientName\":\"WEB_REMIX\""));
    }

    @Test
    void shouldHonorSearchLimit() throws Exception {
        enqueueJson(SEARCH_RESPONSE);

        List<MediaDescriptor> results = adapter.search(anonymous, "one more time", MediaKind.TRACK, 1);

        assertEquals(1, results.size());
    }

    @Test
    void shouldStripBrowsePrefixFromPlaylistResults() throws Exception {
        enqueueJson(PLAYLIST_SEARCH_RESPONSE);

        List<MediaDescriptor> results = adapter.search(anonymous, "focus", MediaKind.PLAYLIST, 5);

        assertEquals(1, results.size());
        assertEquals("PLfocus", results.get(0).getId());
        assertEquals("YouTube Music • 1.2M views", results.get(0).getSubtitle());
        assertEquals("https://music.youtube.com/playlist?list=PLfocus", results.get(0).getUrl());
    }

    @Test
    void shouldLoadAlbumWithTracks() throws Exception {
        enqueueJson(ALBUM_RESPONSE);

        MediaDescriptor album = adapter.getEntity(anonymous, MediaKind.ALBUM, "MPREb_disc");

        assertEquals("Discovery", album.getTitle());
        assertEquals(List.of("Daft Punk"), album.getArtists());
        assertEquals("2001", album.getYear());
        assertEquals("2 songs • 9 minutes", album.getSubtitle());
        assertEquals("https://lh3.example/cover", album.getThumbnailUrl());
        assertEquals(2, album.getTracks().size());
        assertEquals(VIDEO_ID, album.getTracks().get(0).getId());
        assertEquals(207, album.getTracks().get(1).getDurationSeconds());

        assertTrue(takeRequest().getBody().readUtf8().contains("\"browseId\":\"MPREb_disc\""));
    }

    @Test
    void shouldBrowsePlaylistWithPrefix() throws Exception {
        enqueueJson(ALBUM_RESPONSE);

        adapter.getEntity(anonymous, MediaKind.PLAYLIST, "PLfocus");

        assertTrue(takeRequest().getBody().readUtf8().contains("\"browseId\":\"VLPLfocus\""));
    }

    @Test
    void shouldReportMissingCollectionAsNotFound() {
        enqueueJson("{\"contents\":{}}");

        MetadataException error = assertThrows(MetadataException.class,
                () -> adapter.getEntity(anonymous, MediaKind.ALBUM, "MPREb_gone"));

        assertEquals(MetadataException.Reason.NOT_FOUND, error.getReason());
    }

    @Test
    void shouldMergePlayerDetailsWithWatchQueueCredits() throws Exception {
        enqueueJson(PLAYER_RESPONSE);
        enqueueJson(NEXT_RESPONSE);

        MediaDescriptor track = adapter.getEntity(anonymous, MediaKind.TRACK, VIDEO_ID);

        assertEquals("One More Time", track.getTitle());
        assertEquals(List.of("Daft Punk"), track.getArtists());
        assertEquals("Discovery", track.getAlbum());
        assertEquals("2001", track.getYear());
        assertEquals(320, track.getDurationSeconds());
        assertEquals("https://i.ytimg.example/large.jpg", track.getThumbnailUrl());

        assertEquals("/youtubei/v1/player?alt=json", takeRequest().getPath());
        RecordedRequest next = takeRequest();
        assertEquals("/youtubei/v1/next?alt=json", next.getPath());
        assertTrue(next.getBody().readUtf8().contains("\"isAudioOnly\":true"));
    }

    @Test
    void shouldKeepPlayerDetailsWhenWatchQueueFails() throws Exception {
        enqueueJson(PLAYER_RESPONSE);
        mockServer.enqueue(new MockResponse().setResponseCode(500));

        MediaDescriptor track = adapter.getEntity(anonymous, MediaKind.TRACK, VIDEO_ID);

        assertEquals(List.of("Daft Punk"), track.getArtists());
        assertNull(track.getAlbum());
    }

    @Test
    void shouldReportUnplayableVideoAsNotFound() {
        enqueueJson("{\"playabilityStatus\":{\"status\":\"ERROR\",\"reason\":\"Video unavailable\"}}");

        MetadataException error = assertThrows(MetadataException.class,
                () -> adapter.getEntity(anonymous, MediaKind.VIDEO, VIDEO_ID));

        assertEquals(MetadataException.Reason.NOT_FOUND, error.getReason());
        assertTrue(error.getMessage().contains("Video unavailable"));
    }

    @Test
    void shouldMapHttpStatusToReason() {
        mockServer.enqueue(new MockResponse().setResponseCode(401));
        mockServer.enqueue(new MockResponse().setResponseCode(429));
        mockServer.enqueue(new MockResponse().setResponseCode(503));
        mockServer.enqueue(new MockResponse().setResponseCode(400));

        assertEquals(MetadataException.Reason.AUTHENTICATION, searchFailure().getReason());
        assertEquals(MetadataException.Reason.RATE_LIMITED, searchFailure().getReason());
        MetadataException unavailable = searchFailure();
        assertEquals(MetadataException.Reason.TRANSIENT, unavailable.getReason());
        assertEquals(503, unavailable.getHttpStatus());
        assertEquals(MetadataException.Reason.INVALID, searchFailure().getReason());
    }

    private MetadataException searchFailure() {
        return assertThrows(MetadataException.class,
                () -> adapter.search(anonymous, "query", MediaKind.TRACK, 5));
    }

    @Test
    void shouldBrowseListeningHistory() throws Exception {
        enqueueJson(SEARCH_RESPONSE);

        List<MediaDescriptor> history = adapter.listeningHistory(anonymous, 1);

        assertEquals(1, history.size());
        assertEquals(VIDEO_ID, history.get(0).getId());
        RecordedRequest request = takeRequest();
        assertEquals("/youtubei/v1/browse?alt=json", request.getPath());
        assertTrue(request.getBody().readUtf8().contains("\"browseId\":\"FEmusic_history\""));
    }

    @Test
    void shouldBrowseLikedMusicPlaylist() throws Exception {
        enqueueJson(SEARCH_RESPONSE);

        List<MediaDescriptor> liked = adapter.likedTracks(anonymous, 15);

        assertEquals(List.of(VIDEO_ID, "L93-7vRfxNs"), liked.stream().map(MediaDescriptor::getId).toList());
        assertTrue(takeRequest().getBody().readUtf8().contains("\"browseId\":\"VLLM\""));
    }

    @Test
    void shouldParseRadioQueue() throws Exception {
        enqueueJson(RADIO_RESPONSE);

        List<MediaDescriptor> queue = adapter.radio(anonymous, VIDEO_ID, 10);

        assertEquals(2, queue.size());
        MediaDescriptor first = queue.get(0);
        assertEquals(VIDEO_ID, first.getId());
        assertEquals("One More Time", first.getTitle());
        assertEquals(List.of("Daft Punk"), first.getArtists());
        assertEquals("Discovery", first.getAlbum());
        assertEquals(320, first.getDurationSeconds());
        MediaDescriptor second = queue.get(1);
        assertEquals(List.of("Daft Punk"), second.getArtists());
        assertEquals("2001", second.getYear());
        assertNull(second.getDurationSeconds());

        RecordedRequest request = takeRequest();
        assertEquals("/youtubei/v1/next?alt=json", request.getPath());
        String body = request.getBody().readUtf8();
        assertTrue(body.contains("\"playlistId\":\"RDAMVM" + VIDEO_ID + "\""));
        assertTrue(body.contains("\"params\":\"wAEB\""));
    }

    @Test
    void shouldKeepOnlyCreditedTracksFromHomeFeed() throws Exception {
        enqueueJson(HOME_RESPONSE);

        List<MediaDescriptor> home = adapter.homeFeed(anonymous, 10);

        assertEquals(List.of(VIDEO_ID, "L93-7vRfxNs"), home.stream().map(MediaDescriptor::getId).toList());
        assertEquals(List.of("Daft Punk"), home.get(0).getArtists());
        assertEquals("Aerodynamic", home.get(1).getTitle());
        assertTrue(takeRequest().getBody().readUtf8().contains("\"browseId\":\"FEmusic_home\""));
    }

    @Test
    void shouldHonorHomeFeedLimit() throws Exception {
        enqueueJson(HOME_RESPONSE);

        assertEquals(1, adapter.homeFeed(anonymous, 1).size());
    }

    @Test
    void shouldReturnAnonymousSessionWithoutCredentials() throws Exception {
        MetadataSession session = adapter.authenticate(null);

        assertFalse(session.isAuthenticated());
        assertTrue(session.getHeaders().isEmpty());
        assertEquals(0, mockServer.getRequestCount());
    }

    @Test
    void shouldAuthenticateWithBrowserHeaders() throws Exception {
        Path headers = Files.writeString(tempDir.resolve("headers_auth.json"),
                "{\"Cookie\":\"SID=1; SAPISID=abc123\",\"User-Agent\":\"Mozilla/5.0\"}");
        enqueueJson("{}");
        enqueueJson(SEARCH_RESPONSE);

        MetadataSession session = adapter.authenticate(headers);
        adapter.search(session, "query", MediaKind.TRACK, 5);

        assertTrue(session.isAuthenticated());
        RecordedRequest verification = takeRequest();
        assertEquals("/youtubei/v1/browse?alt=json", verification.getPath());
        assertTrue(verification.getBody().readUtf8().contains("FEmusic_history"));
        RecordedRequest search = takeRequest();
        assertEquals("SAPISIDHASH 1700000000_597a8411c1c01f9c14cea84b6ec377b76d93be6e",
                search.getHeader("authorization"));
        assertEquals("SID=1; SAPISID=abc123", search.getHeader("cookie"));
        assertEquals("Mozilla/5.0", search.getHeader("user-agent"));
    }

    @Test
    void shouldRejectHeadersWithoutSapisid() throws Exception {
        Path headers = Files.writeString(tempDir.resolve("headers_auth.json"), "{\"Cookie\":\"SID=1\"}");

        MetadataException error = assertThrows(MetadataException.class, () -> adapter.authenticate(headers));

        assertEquals(MetadataException.Reason.INVALID, error.getReason());
        assertEquals(0, mockServer.getRequestCount());
    }

    @Test
    void shouldRejectExpiredCredentials() throws Exception {
        Path headers = Files.writeString(tempDir.resolve("headers_auth.json"),
                "{\"Cookie\":\"SAPISID=abc123\"}");
        mockServer.enqueue(new MockResponse().setResponseCode(401));

        MetadataException error = assertThrows(MetadataException.class, () -> adapter.authenticate(headers));

        assertEquals(MetadataException.Reason.AUTHENTICATION, error.getReason());
    }
}
