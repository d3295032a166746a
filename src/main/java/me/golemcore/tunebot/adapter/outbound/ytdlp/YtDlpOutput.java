package me.golemcore.tunebot.adapter.outbound.ytdlp;

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

import me.golemcore.tunebot.port.outbound.DownloaderReport;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Accumulates yt-dlp output lines: the marker lines printed through
 * {@code --print}, postprocessor lines, and a bounded tail for error reports.
 * Fed by the reader thread, read after the process ended.
 */
final class YtDlpOutput {

    static final String MARKER = "tunebot:";
    static final String TEMPLATE_KEY = "template=";
    static final String FINAL_KEY = "final=";
    static final String EXT_KEY = "ext=";
    static final String FORMAT_KEY = "format=";

    private static final List<String> POSTPROCESSOR_PREFIXES = List.of(
            "[ExtractAudio]", "[Merger]", "[EmbedThumbnail]", "[Metadata]", "[FixupM4a]", "[MoveFiles]",
            "[ThumbnailsConvertor]");
    private static final int TAIL_LINES = 40;
    private static final String NA = "NA";

    private final Deque<String> tail = new ArrayDeque<>();
    private final DownloaderReport.DownloaderReportBuilder report = DownloaderReport.builder();
    private boolean destinationSeen;

    /**
     * Records one line.
     *
     * @return {@code true} when the line is a marker line that should not be
     *         shown to listeners
     */
    synchronized boolean accept(String line) {
        if (line.startsWith(MARKER)) {
            acceptMarker(line.substring(MARKER.length()));
            return true;
        }
        if (tail.size() == TAIL_LINES) {
            tail.removeFirst();
        }
        tail.addLast(line);
        if (line.contains("Destination: ")) {
            destinationSeen = true;
        }
        if (POSTPROCESSOR_PREFIXES.stream().anyMatch(line::startsWith)) {
            report.postprocessorLine(line);
        }
        return false;
    }

    private void acceptMarker(String marker) {
        if (marker.startsWith(TEMPLATE_KEY)) {
            report.templatePath(pathOrNull(marker.substring(TEMPLATE_KEY.length())));
        } else if (marker.startsWith(FINAL_KEY)) {
            report.finalPath(pathOrNull(marker.substring(FINAL_KEY.length())));
        } else if (marker.startsWith(EXT_KEY)) {
            report.reportedExtension(valueOrNull(marker.substring(EXT_KEY.length())));
        } else if (marker.startsWith(FORMAT_KEY)) {
            report.chosenFormat(valueOrNull(marker.substring(FORMAT_KEY.length())));
        }
    }

    synchronized DownloaderReport report() {
        return report.build();
    }

    synchronized String tail() {
        return String.join("\n", tail);
    }

    synchronized boolean isPartialFileWritten() {
        return destinationSeen;
    }

    private static Path pathOrNull(String value) {
        String trimmed = valueOrNull(value);
        return trimmed == null ? null : Paths.get(trimmed);
    }

    private static String valueOrNull(String value) {
        String trimmed = value.trim();
        return trimmed.isEmpty() || NA.equals(trimmed) ? null : trimmed;
    }
}
