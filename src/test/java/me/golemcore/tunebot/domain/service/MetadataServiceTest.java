package me.golemcore.tunebot.domain.service;

import me.golemcore.tunebot.domain.model.MediaDescriptor;
import me.golemcore.tunebot.domain.model.MediaKind;
import me.golemcore.tunebot.domain.model.MetadataSession;
import me.golemcore.tunebot.domain.model.Recommendations;
import me.golemcore.tunebot.domain.resilience.FailureKind;
import me.golemcore.tunebot.domain.resilience.OperationFailedException;
import me.golemcore.tunebot.domain.resilience.ResilientCallExecutor;
import me.golemcore.tunebot.domain.resilience.RetryPolicyFactory;
import me.golemcore.tunebot.infrastructure.config.BotProperties;
import me.golemcore.tunebot.port.outbound.ArtworkPort;
import me.golemcore.tunebot.port.outbound.MetadataException;
import me.golemcore.tunebot.port.outbound.MetadataPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class MetadataServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private MetadataPort metadataPort;
    private ArtworkPort artworkPort;
    private BotProperties properties;
    private MetadataSessionHolder sessionHolder;
    private MetadataService service;

    @BeforeEach
    void setUp() throws MetadataException {
        metadataPort = mock(MetadataPort.class);
        artworkPort = mock(ArtworkPort.class);
        when(metadataPort.authenticate(null)).thenAnswer(invocation -> MetadataSession.anonymous(NOW));

        properties = new BotProperties();
        properties.getMetadata().setAuthFile(tempDir.resolve("headers_auth.json").toString());
        properties.getRetry().getMetadata().setInitialBackoff(Duration.ZERO);
        properties.getRetry().getMetadata().setMaxBackoff(Duration.ZERO);

        sessionHolder = new MetadataSessionHolder(metadataPort, properties, Clock.fixed(NOW, ZoneOffset.UTC));
        sessionHolder.init();
        service = new MetadataService(metadataPort, artworkPort, sessionHolder, new ResilientCallExecutor(),
                new RetryPolicyFactory(properties));
    }

    @Test
    void shouldStartAnonymousWithoutAuthFile() throws MetadataException {
        assertFalse(sessionHolder.current().isAuthenticated());
        verify(metadataPort).authenticate(null);
    }

    @Test
    void shouldUseAuthFileWhenPresent() throws Exception {
        Path authFile = Files.writeString(tempDir.resolve("headers_auth.json"), "{}");
        MetadataSession authenticated = new MetadataSession(Map.of("cookie", "SAPISID=x"), true, NOW);
        when(metadataPort.authenticate(authFile.toAbsolutePath().normalize())).thenReturn(authenticated);

        sessionHolder.init();

        assertSame(authenticated, sessionHolder.current());
    }

    @Test
    void shouldFallBackToAnonymousWhenCredentialsRejected() throws Exception {
        Path authFile = Files.writeString(tempDir.resolve("headers_auth.json"), "{}");
        when(metadataPort.authenticate(authFile.toAbsolutePath().normalize()))
                .thenThrow(new MetadataException(MetadataException.Reason.AUTHENTICATION, "HTTP 401"));

        sessionHolder.init();

        assertFalse(sessionHolder.current().isAuthenticated());
    }

    @Test
    void shouldReauthenticateOnceAndRetry() throws Exception {
        MetadataSession first = sessionHolder.current();
        MediaDescriptor track = MediaDescriptor.builder().kind(MediaKind.TRACK).id("FGBhQbmPwH8").build();
        when(metadataPort.search(any(), eq("query"), eq(MediaKind.TRACK), eq(5)))
                .thenThrow(new MetadataException(MetadataException.Reason.AUTHENTICATION, "HTTP 401"))
                .thenReturn(List.of(track));

        List<MediaDescriptor> results = service.search("query", MediaKind.TRACK, 5);

        assertEquals(List.of(track), results);
        assertNotSame(first, sessionHolder.current());
        verify(metadataPort, times(2)).authenticate(null);
    }

    @Test
    void shouldFailWhenAuthenticationRejectedTwice() throws Exception {
        when(metadataPort.getEntity(any(), eq(MediaKind.ALBUM), eq("MPREb_x")))
                .thenThrow(new MetadataException(MetadataException.Reason.AUTHENTICATION, "HTTP 401"));

        OperationFailedException error = assertThrows(OperationFailedException.class,
                () -> service.getEntity(MediaKind.ALBUM, "MPREb_x"));

        assertEquals(FailureKind.AUTHENTICATION_FAILED, error.getKind());
        verify(metadataPort, times(2)).getEntity(any(), eq(MediaKind.ALBUM), eq("MPREb_x"));
    }

    @Test
    void shouldSkipReauthenticationOfReplacedSession() throws Exception {
        MetadataSession stale = sessionHolder.current();
        sessionHolder.reauthenticate(stale);
        MetadataSession fresh = sessionHolder.current();

        sessionHolder.reauthenticate(stale);

        assertSame(fresh, sessionHolder.current());
        verify(metadataPort, times(2)).authenticate(null);
    }

    @Test
    void shouldRetryTransientArtworkFailure() throws Exception {
        when(artworkPort.fetch("https://lh3.example/cover"))
                .thenThrow(new IOException("connection reset"))
                .thenReturn(new byte[] { 1, 2, 3 });

        assertArrayEquals(new byte[] { 1, 2, 3 }, service.artwork("https://lh3.example/cover"));
    }

    @Test
    void shouldNotRetryMissingEntity() throws Exception {
        when(metadataPort.getEntity(any(), eq(MediaKind.TRACK), eq("gone")))
                .thenThrow(new MetadataException(MetadataException.Reason.NOT_FOUND, "gone"));

        OperationFailedException error = assertThrows(OperationFailedException.class,
                () -> service.getEntity(MediaKind.TRACK, "gone"));

        assertEquals(FailureKind.FATAL, error.getKind());
        verify(metadataPort, times(1)).getEntity(any(), eq(MediaKind.TRACK), eq("gone"));
    }

    @Test
    void shouldRefuseAccountCommandsWithoutSignedInSession() throws Exception {
        OperationFailedException history = assertThrows(OperationFailedException.class,
                () -> service.listeningHistory(10));
        OperationFailedException liked = assertThrows(OperationFailedException.class,
                () -> service.likedTracks(15));

        assertEquals(FailureKind.AUTHENTICATION_FAILED, history.getKind());
        assertEquals(FailureKind.AUTHENTICATION_FAILED, liked.getKind());
        verify(metadataPort, never()).listeningHistory(any(), anyInt());
        verify(metadataPort, never()).likedTracks(any(), anyInt());
    }

    @Test
    void shouldListLikedTracksOfSignedInSession() throws Exception {
        signIn();
        List<MediaDescriptor> liked = List.of(track("FGBhQbmPwH8"));
        when(metadataPort.likedTracks(any(), eq(15))).thenReturn(liked);

        assertEquals(liked, service.likedTracks(15));
    }

    @Test
    void shouldRecommendRadioOfLastPlayedTrackWithSeedFirst() throws Exception {
        signIn();
        MediaDescriptor seed = track("dQw4w9WgXcQ");
        when(metadataPort.listeningHistory(any(), eq(1))).thenReturn(List.of(seed));
        when(metadataPort.radio(any(), eq("dQw4w9WgXcQ"), eq(8))).thenReturn(List.of(
                track("FGBhQbmPwH8"), track("dQw4w9WgXcQ"), track("FGBhQbmPwH8"), track("a1b2c3d4e5f"),
                track("zzzzzzzzzzz")));

        Recommendations recommendations = service.recommendations(3);

        assertEquals(Recommendations.Source.LISTENING_HISTORY, recommendations.source());
        assertEquals(List.of("dQw4w9WgXcQ", "FGBhQbmPwH8", "a1b2c3d4e5f"), ids(recommendations.tracks()));
        verify(metadataPort, never()).homeFeed(any(), anyInt());
    }

    @Test
    void shouldFallBackToHomeFeedWhenRadioFails() throws Exception {
        signIn();
        when(metadataPort.listeningHistory(any(), eq(1))).thenReturn(List.of(track("dQw4w9WgXcQ")));
        when(metadataPort.radio(any(), anyString(), anyInt()))
                .thenThrow(new MetadataException(MetadataException.Reason.INVALID, "next: HTTP 400"));
        when(metadataPort.homeFeed(any(), eq(13))).thenReturn(List.of(track("FGBhQbmPwH8")));

        Recommendations recommendations = service.recommendations(8);

        assertEquals(Recommendations.Source.HOME_FEED, recommendations.source());
        assertEquals(List.of("FGBhQbmPwH8"), ids(recommendations.tracks()));
    }

    @Test
    void shouldRecommendFromHomeFeedForAnonymousSession() throws Exception {
        when(metadataPort.homeFeed(any(), eq(7))).thenReturn(List.of(
                track("FGBhQbmPwH8"), track("FGBhQbmPwH8"), track("dQw4w9WgXcQ"), track("a1b2c3d4e5f")));

        Recommendations recommendations = service.recommendations(2);

        assertEquals(Recommendations.Source.HOME_FEED, recommendations.source());
        assertEquals(List.of("FGBhQbmPwH8", "dQw4w9WgXcQ"), ids(recommendations.tracks()));
        verify(metadataPort, never()).listeningHistory(any(), anyInt());
        verify(metadataPort, never()).radio(any(), anyString(), anyInt());
    }

    private void signIn() throws Exception {
        Path authFile = Files.writeString(tempDir.resolve("headers_auth.json"), "{}");
        when(metadataPort.authenticate(authFile.toAbsolutePath().normalize()))
                .thenReturn(new MetadataSession(Map.of("cookie", "SAPISID=x"), true, NOW));
        sessionHolder.init();
        assertTrue(sessionHolder.current().isAuthenticated());
    }

    private static MediaDescriptor track(String id) {
        return MediaDescriptor.builder().kind(MediaKind.TRACK).id(id).title("title " + id).build();
    }

    private static List<String> ids(List<MediaDescriptor> tracks) {
        return tracks.stream().map(MediaDescriptor::getId).toList();
    }
}
