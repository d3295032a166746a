package me.golemcore.tunebot.domain.download;

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
import me.golemcore.tunebot.domain.model.DownloadResult;
import me.golemcore.tunebot.domain.model.DownloadWarning;
import me.golemcore.tunebot.domain.model.MediaDescriptor;
import me.golemcore.tunebot.domain.model.Operation;
import me.golemcore.tunebot.domain.model.TrackTags;
import me.golemcore.tunebot.domain.resilience.FailureKind;
import me.golemcore.tunebot.domain.resilience.OperationFailedException;
import me.golemcore.tunebot.domain.resilience.ResilientCallExecutor;
import me.golemcore.tunebot.domain.resilience.RetryPolicyFactory;
import me.golemcore.tunebot.infrastructure.config.BotProperties;
import me.golemcore.tunebot.port.outbound.ArtworkPort;
import me.golemcore.tunebot.port.outbound.AudioTaggerPort;
import me.golemcore.tunebot.port.outbound.DownloaderOptions;
import me.golemcore.tunebot.port.outbound.DownloaderPort;
import me.golemcore.tunebot.port.outbound.DownloaderReport;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns one requested track into exactly one tagged audio file.
 *
 * <p>
 * Every file the pipeline creates or discovers is removed when
 * {@link #download} returns or throws; on success only the resolved audio file
 * survives, and the caller hands it back through {@link #release} once it has
 * been delivered.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DownloadPipeline {

    private static final List<String> POSTPROCESSOR_MARKERS = List.of(
            "[ExtractAudio]", "[Merger]", "[EmbedThumbnail]", "[Metadata]", "[FixupM4a]");

    private final DownloaderPort downloaderPort;
    private final ArtworkPort artworkPort;
    private final AudioTaggerPort audioTagger;
    private final OutputResolver outputResolver;
    private final ResilientCallExecutor callExecutor;
    private final RetryPolicyFactory retryPolicies;
    private final BotProperties properties;

    public DownloadResult download(Operation operation, MediaDescriptor item, DownloadStageListener listener) {
        if (item.getKind() == null || !item.getKind().isPlayable()) {
            throw new IllegalArgumentException("Not a playable item: " + item.getKind());
        }
        Path workDir = prepareWorkDir();
        DownloadStageTracker tracker = new DownloadStageTracker(item.getId(), listener);
        TempArtifacts artifacts = new TempArtifacts(workDir, operation.getToken());

        try {
            tracker.advanceTo(DownloadStage.FETCHING);
            AtomicInteger postprocessorSteps = new AtomicInteger();
            DownloaderReport report = fetch(operation, item, workDir, postprocessorSteps);
            checkCancelled(operation);

            log.debug("[Download] {}: {} postprocessor step(s)", item.getId(), postprocessorSteps.get());
            tracker.advanceTo(DownloadStage.POSTPROCESSING);
            tracker.advanceTo(DownloadStage.RESOLVING_OUTPUT);
            Path file = outputResolver.resolve(report, workDir, item.getId(), operation.getStartedAt(), artifacts);
            checkCancelled(operation);

            tracker.advanceTo(DownloadStage.TAGGING);
            List<DownloadWarning> warnings = tag(file, item, workDir, operation.getToken(), artifacts);
            checkCancelled(operation);

            artifacts.keep(file);
            DownloadResult result = DownloadResult.builder()
                    .file(file)
                    .title(item.getTitle())
                    .artist(item.artistLine())
                    .album(item.getAlbum() != null ? item.getAlbum() : "")
                    .durationSeconds(item.getDurationSeconds())
                    .sourceUrl(item.getUrl())
                    .sourceId(item.getId())
                    .fileConfirmed(true)
                    .chosenFormat(report.getChosenFormat())
                    .operationToken(operation.getToken())
                    .warnings(warnings)
                    .build();
            tracker.advanceTo(DownloadStage.COMPLETE);
            log.info("[Download] {} -> {} ({} warning(s))", item.getId(), file.getFileName(), warnings.size());
            return result;
        } catch (OperationFailedException e) {
            tracker.fail();
            log.warn("[Download] {} failed: {}", item.getId(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            tracker.fail();
            log.error("[Download] {} failed unexpectedly", item.getId(), e);
            throw new OperationFailedException(FailureKind.FATAL, "download of " + item.getId() + " failed", e);
        } finally {
            artifacts.cleanup();
        }
    }

    /**
     * Disposes of a delivered file. Files with a preserved extension are kept
     * under their name without the operation token.
     */
    public void release(DownloadResult result) {
        Path file = result.getFile();
        String extension = OutputResolver.extensionOf(file);
        try {
            if (isPreserved(extension)) {
                Path target = file.resolveSibling(
                        file.getFileName().toString().replace(" " + result.getOperationToken(), ""));
                Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
                log.info("[Download] Kept {}", target);
            } else {
                Files.deleteIfExists(file);
                log.debug("[Download] Released {}", file);
            }
        } catch (IOException e) {
            log.warn("[Download] Failed to release {}: {}", file, e.getMessage());
        }
    }

    /**
     * Runs the downloader. The output listener is called on the process reader
     * thread, so it only counts postprocessor lines; stage changes and their
     * progress edits stay on the operation thread.
     */
    private DownloaderReport fetch(Operation operation, MediaDescriptor item, Path workDir,
            AtomicInteger postprocessorSteps) {
        BotProperties.DownloaderProperties config = properties.getDownloader();
        String template = config.getOutputTemplate() + " " + operation.getToken() + ".%(ext)s";
        DownloaderOptions options = DownloaderOptions.builder()
                .workDir(workDir)
                .format(config.getFormat())
                .audioFormat(config.getAudioFormat())
                .cookiesFile(cookiesFile(config))
                .timeout(config.getTimeout())
                .outputListener(line -> {
                    if (isPostprocessorLine(line)) {
                        postprocessorSteps.incrementAndGet();
                    }
                })
                .build();
        String url = item.getUrl();
        return callExecutor.execute("download " + item.getId(), retryPolicies.downloader(),
                () -> downloaderPort.run(url, template, options));
    }

    private List<DownloadWarning> tag(Path file, MediaDescriptor item, Path workDir, String token,
            TempArtifacts artifacts) {
        List<DownloadWarning> warnings = new ArrayList<>();
        TrackTags tags = new TrackTags(item.getTitle(), item.artistLine(), item.getAlbum(), item.getYear());

        Path cover = null;
        if (properties.getDownloader().isEmbedCover()
                && item.getThumbnailUrl() != null
                && audioTagger.supportsCover(OutputResolver.extensionOf(file))) {
            cover = prepareCover(item.getThumbnailUrl(), workDir, token, artifacts, warnings);
        }

        try {
            audioTagger.embed(file, tags, cover);
        } catch (IOException e) {
            if (cover != null) {
                log.warn("[Download] Embedding cover into {} failed, retrying with tags only: {}",
                        file.getFileName(), e.getMessage());
                warnings.add(new DownloadWarning(FailureKind.METADATA_INCOMPLETE, "cover not embedded"));
                embedTagsOnly(file, tags, warnings);
            } else {
                log.warn("[Download] Tagging {} failed: {}", file.getFileName(), e.getMessage());
                warnings.add(new DownloadWarning(FailureKind.METADATA_INCOMPLETE, "tags not written"));
            }
        }

        try {
            TrackTags written = audioTagger.readTags(file);
            if (!written.hasTitleAndArtist()) {
                warnings.add(new DownloadWarning(FailureKind.METADATA_INCOMPLETE, "title or artist tag missing"));
            }
        } catch (IOException e) {
            log.warn("[Download] Could not read tags back from {}: {}", file.getFileName(), e.getMessage());
            warnings.add(new DownloadWarning(FailureKind.METADATA_INCOMPLETE, "tags could not be verified"));
        }
        return warnings;
    }

    private void embedTagsOnly(Path file, TrackTags tags, List<DownloadWarning> warnings) {
        try {
            audioTagger.embed(file, tags, null);
        } catch (IOException e) {
            log.warn("[Download] Tagging {} failed: {}", file.getFileName(), e.getMessage());
            warnings.add(new DownloadWarning(FailureKind.METADATA_INCOMPLETE, "tags not written"));
        }
    }

    private Path prepareCover(String url, Path workDir, String token, TempArtifacts artifacts,
            List<DownloadWarning> warnings) {
        Path raw = workDir.resolve("cover " + token + ".img");
        Path jpeg = workDir.resolve("cover " + token + ".jpg");
        artifacts.track(raw);
        artifacts.track(jpeg);
        byte[] image;
        try {
            image = callExecutor.execute("artwork.fetch", retryPolicies.metadata(null), () -> artworkPort.fetch(url));
        } catch (OperationFailedException e) {
            if (e.getKind() == FailureKind.CANCELLED) {
                throw e;
            }
            log.warn("[Download] Artwork from {} unavailable: {}", url, e.getMessage());
            warnings.add(new DownloadWarning(FailureKind.METADATA_INCOMPLETE, "artwork unavailable"));
            return null;
        }
        try {
            Files.write(raw, image);
            audioTagger.cropSquareCover(raw, jpeg);
            return jpeg;
        } catch (IOException e) {
            log.warn("[Download] Artwork from {} could not be prepared: {}", url, e.getMessage());
            warnings.add(new DownloadWarning(FailureKind.METADATA_INCOMPLETE, "artwork unavailable"));
            return null;
        }
    }

    private Path prepareWorkDir() {
        Path workDir = BotProperties.expandPath(properties.getDownloader().getWorkDir());
        try {
            Files.createDirectories(workDir);
        } catch (IOException e) {
            throw new OperationFailedException(FailureKind.FATAL, "cannot create work directory " + workDir, e);
        }
        return workDir;
    }

    private static Path cookiesFile(BotProperties.DownloaderProperties config) {
        if (config.getCookiesFile() == null || config.getCookiesFile().isBlank()) {
            return null;
        }
        Path cookies = BotProperties.expandPath(config.getCookiesFile());
        return Files.isRegularFile(cookies) ? cookies : null;
    }

    private boolean isPreserved(String extension) {
        return properties.getDownloader().getPreservedExtensions().stream()
                .anyMatch(preserved -> preserved.toLowerCase(Locale.ROOT).equals(extension));
    }

    private static boolean isPostprocessorLine(String line) {
        return POSTPROCESSOR_MARKERS.stream().anyMatch(line::startsWith);
    }

    private static void checkCancelled(Operation operation) {
        if (operation.isCancelled()) {
            throw new OperationFailedException(FailureKind.CANCELLED, "operation " + operation.getToken()
                    + " cancelled");
        }
    }
}
