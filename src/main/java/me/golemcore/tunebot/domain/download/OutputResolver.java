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
import me.golemcore.tunebot.domain.resilience.FailureKind;
import me.golemcore.tunebot.domain.resilience.OperationFailedException;
import me.golemcore.tunebot.infrastructure.config.BotProperties;
import me.golemcore.tunebot.port.outbound.DownloaderReport;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the one file a downloader run actually produced.
 *
 * <p>
 * Resolution order:
 * <ol>
 * <li>the final path reported by the downloader</li>
 * <li>the template path with its extension replaced by the reported one</li>
 * <li>destinations named in the postprocessor log</li>
 * <li>a scan of the work directory for recent audio files whose name carries
 * the source id</li>
 * </ol>
 * A scan that yields more than one candidate fails with
 * {@link FailureKind#AMBIGUOUS_OUTPUT}; one that yields nothing fails with
 * {@link FailureKind#DOWNLOAD_INCOMPLETE}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutputResolver {

    static final Set<String> AUDIO_EXTENSIONS = Set.of("m4a", "mp3", "opus", "ogg", "flac", "aac", "wav");

    private static final Pattern DESTINATION_PATTERN = Pattern.compile("Destination: (.+)$");
    private static final Pattern MERGER_PATTERN = Pattern.compile("Merging formats into \"([^\"]+)\"");
    private static final Pattern EMBED_PATTERN = Pattern
            .compile("(?:Adding thumbnail to|Adding metadata to) \"([^\"]+)\"");

    private final BotProperties properties;

    Path resolve(DownloaderReport report, Path workDir, String sourceId, Instant startedAt,
            TempArtifacts artifacts) {
        Path reported = absolute(workDir, report.getFinalPath());
        if (reported != null) {
            artifacts.track(reported);
            if (isUsableAudio(reported)) {
                log.debug("[Download] Using reported final path {}", reported);
                return reported;
            }
            log.debug("[Download] Reported final path {} is not usable", reported);
        }

        Path template = absolute(workDir, report.getTemplatePath());
        if (template != null) {
            artifacts.track(template);
            if (report.getReportedExtension() != null) {
                Path derived = withExtension(template, report.getReportedExtension());
                artifacts.track(derived);
                if (isUsableAudio(derived)) {
                    log.debug("[Download] Using derived path {}", derived);
                    return derived;
                }
            }
        }

        for (Path destination : destinationsFromLog(report.getPostprocessorLog(), workDir)) {
            artifacts.track(destination);
            if (isUsableAudio(destination)) {
                log.debug("[Download] Using postprocessor destination {}", destination);
                return destination;
            }
        }

        return scan(workDir, sourceId, startedAt, artifacts);
    }

    private Path scan(Path workDir, String sourceId, Instant startedAt, TempArtifacts artifacts) {
        Instant notBefore = startedAt.minus(properties.getDownloader().getScanSlack());
        List<Path> candidates;
        try (Stream<Path> files = Files.list(workDir)) {
            candidates = files
                    .filter(path -> fileName(path).contains(sourceId))
                    .filter(this::isUsableAudio)
                    .filter(path -> modifiedSince(path, notBefore))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new OperationFailedException(FailureKind.DOWNLOAD_INCOMPLETE,
                    "cannot scan " + workDir + ": " + e.getMessage(), e);
        }

        for (Path candidate : candidates) {
            if (artifacts.carriesToken(candidate)) {
                artifacts.track(candidate);
            }
        }

        if (candidates.isEmpty()) {
            throw new OperationFailedException(FailureKind.DOWNLOAD_INCOMPLETE,
                    "no output file found for " + sourceId);
        }
        if (candidates.size() > 1) {
            log.error("[Download] {} candidate files for {}: {}", candidates.size(), sourceId, candidates);
            throw new OperationFailedException(FailureKind.AMBIGUOUS_OUTPUT,
                    candidates.size() + " candidate files for " + sourceId);
        }
        log.info("[Download] Output for {} found by directory scan: {}", sourceId, candidates.get(0));
        return candidates.get(0);
    }

    static List<Path> destinationsFromLog(List<String> lines, Path workDir) {
        List<Path> destinations = new ArrayList<>();
        for (String line : lines) {
            matchPath(DESTINATION_PATTERN, line).ifPresent(p -> destinations.add(absolute(workDir, p)));
            matchPath(MERGER_PATTERN, line).ifPresent(p -> destinations.add(absolute(workDir, p)));
            matchPath(EMBED_PATTERN, line).ifPresent(p -> destinations.add(absolute(workDir, p)));
        }
        // the last postprocessor step names the newest file
        Collections.reverse(destinations);
        return destinations;
    }

    private static Optional<Path> matchPath(Pattern pattern, String line) {
        Matcher matcher = pattern.matcher(line);
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Path.of(matcher.group(1).trim()));
        } catch (RuntimeException e) {
            return Optional.empty();
        }
    }

    boolean isUsableAudio(Path path) {
        try {
            return Files.isRegularFile(path)
                    && AUDIO_EXTENSIONS.contains(extensionOf(path))
                    && Files.size(path) > 0;
        } catch (IOException e) {
            return false;
        }
    }

    private static boolean modifiedSince(Path path, Instant notBefore) {
        try {
            FileTime modified = Files.getLastModifiedTime(path);
            return !modified.toInstant().isBefore(notBefore);
        } catch (IOException e) {
            return false;
        }
    }

    static String extensionOf(Path path) {
        String name = fileName(path);
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    static Path withExtension(Path path, String extension) {
        String name = fileName(path);
        int dot = name.lastIndexOf('.');
        String base = dot < 0 ? name : name.substring(0, dot);
        return path.resolveSibling(base + "." + extension);
    }

    private static String fileName(Path path) {
        Path name = path.getFileName();
        return name != null ? name.toString() : "";
    }

    private static Path absolute(Path workDir, Path path) {
        return path == null ? null : workDir.resolve(path).toAbsolutePath().normalize();
    }
}
