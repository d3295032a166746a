package me.golemcore.tunebot.domain.download;

import me.golemcore.tunebot.domain.resilience.FailureKind;
import me.golemcore.tunebot.domain.resilience.OperationFailedException;
import me.golemcore.tunebot.infrastructure.config.BotProperties;
import me.golemcore.tunebot.port.outbound.DownloaderReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutputResolverTest {

    private static final String SOURCE_ID = "abcdefghijk";
    private static final String TOKEN = "tok12345";

    @TempDir
    Path workDir;

    private OutputResolver resolver;
    private TempArtifacts artifacts;
    private Instant startedAt;

    @BeforeEach
    void setUp() {
        resolver = new OutputResolver(new BotProperties());
        artifacts = new TempArtifacts(workDir, TOKEN);
        startedAt = Instant.now();
    }

    private Path write(String name, int size) throws IOException {
        return Files.write(workDir.resolve(name), new byte[size]);
    }

    @Test
    void shouldPreferReportedFinalPath() throws IOException {
        Path file = write("Song [" + SOURCE_ID + "] " + TOKEN + ".m4a", 10);
        write("Other [" + SOURCE_ID + "] " + TOKEN + ".mp3", 10);

        Path resolved = resolver.resolve(DownloaderReport.builder().finalPath(file).build(),
                workDir, SOURCE_ID, startedAt, artifacts);

        assertEquals(file, resolved);
    }

    @Test
    void shouldSkipEmptyReportedFile() throws IOException {
        Path empty = write("Song [" + SOURCE_ID + "] " + TOKEN + ".m4a", 0);
        Path derived = write("Song [" + SOURCE_ID + "] " + TOKEN + ".opus", 10);

        Path resolved = resolver.resolve(DownloaderReport.builder()
                .finalPath(empty)
                .templatePath(workDir.resolve("Song [" + SOURCE_ID + "] " + TOKEN + ".webm"))
                .reportedExtension("opus")
                .build(), workDir, SOURCE_ID, startedAt, artifacts);

        assertEquals(derived, resolved);
    }

    @Test
    void shouldUseNewestPostprocessorDestination() throws IOException {
        write("first " + TOKEN + ".m4a", 10);
        Path last = write("second " + TOKEN + ".m4a", 10);

        Path resolved = resolver.resolve(DownloaderReport.builder()
                .postprocessorLine("[ExtractAudio] Destination: first " + TOKEN + ".m4a")
                .postprocessorLine("[Metadata] Adding metadata to \"second " + TOKEN + ".m4a\"")
                .build(), workDir, SOURCE_ID, startedAt, artifacts);

        assertEquals(last.toAbsolutePath().normalize(), resolved);
    }

    @Test
    void shouldFindSingleCandidateByScan() throws IOException {
        Path file = write("Song [" + SOURCE_ID + "] " + TOKEN + ".m4a", 10);
        write("Song [" + SOURCE_ID + "] " + TOKEN + ".jpg", 10);
        write("Unrelated.m4a", 10);

        Path resolved = resolver.resolve(DownloaderReport.builder().build(), workDir, SOURCE_ID, startedAt,
                artifacts);

        assertEquals(file, resolved);
    }

    @Test
    void shouldIgnoreFilesOlderThanOperation() throws IOException {
        Path stale = write("Song [" + SOURCE_ID + "].m4a", 10);
        Files.setLastModifiedTime(stale, FileTime.from(startedAt.minus(1, ChronoUnit.HOURS)));

        OperationFailedException error = assertThrows(OperationFailedException.class,
                () -> resolver.resolve(DownloaderReport.builder().build(), workDir, SOURCE_ID, startedAt,
                        artifacts));

        assertEquals(FailureKind.DOWNLOAD_INCOMPLETE, error.getKind());
    }

    @Test
    void shouldFailOnMultipleScanCandidates() throws IOException {
        write("Song [" + SOURCE_ID + "] " + TOKEN + ".m4a", 10);
        write("Song [" + SOURCE_ID + "] " + TOKEN + ".opus", 10);

        OperationFailedException error = assertThrows(OperationFailedException.class,
                () -> resolver.resolve(DownloaderReport.builder().build(), workDir, SOURCE_ID, startedAt,
                        artifacts));

        assertEquals(FailureKind.AMBIGUOUS_OUTPUT, error.getKind());
    }

    @Test
    void shouldParseDestinationsNewestFirst() {
        List<Path> destinations = OutputResolver.destinationsFromLog(List.of(
                "[ExtractAudio] Destination: a.m4a",
                "[Merger] Merging formats into \"b.mkv\"",
                "[EmbedThumbnail] Adding thumbnail to \"c.m4a\""), workDir);

        assertEquals(List.of(workDir.resolve("c.m4a"), workDir.resolve("b.mkv"), workDir.resolve("a.m4a")),
                destinations);
    }

    @Test
    void shouldReplaceExtension() {
        assertEquals(Path.of("dir/song [x].m4a"), OutputResolver.withExtension(Path.of("dir/song [x].webm"), "m4a"));
        assertEquals("m4a", OutputResolver.extensionOf(Path.of("A.Song.M4A")));
        assertEquals("", OutputResolver.extensionOf(Path.of("noext")));
    }
}
