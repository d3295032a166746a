package me.golemcore.tunebot.domain.resilience;

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

import me.golemcore.tunebot.port.outbound.DownloaderException;

import java.util.List;
import java.util.Locale;

/**
 * Classifies downloader failures from the tail of its log. Only network-level
 * symptoms are retried; extractor and format errors are fatal.
 */
public final class DownloaderFailureClassifier {

    private static final List<String> TRANSIENT_MARKERS = List.of(
            "http error 500", "http error 502", "http error 503", "http error 504",
            "connection reset", "timed out", "temporary failure in name resolution",
            "remote end closed connection", "incompleteread");
    private static final String RATE_LIMIT_MARKER = "http error 429";

    private DownloaderFailureClassifier() {
    }

    public static FailureClassification classify(Throwable throwable) {
        if (!(throwable instanceof DownloaderException downloaderException)) {
            return FailureClassification.of(FailureKind.FATAL);
        }
        if (downloaderException.isTimedOut()) {
            return FailureClassification.of(FailureKind.FATAL);
        }
        String tail = downloaderException.getLogTail() == null
                ? ""
                : downloaderException.getLogTail().toLowerCase(Locale.ROOT);
        if (tail.contains(RATE_LIMIT_MARKER)) {
            return FailureClassification.of(FailureKind.RATE_LIMITED);
        }
        for (String marker : TRANSIENT_MARKERS) {
            if (tail.contains(marker)) {
                return FailureClassification.of(FailureKind.TRANSIENT_NETWORK);
            }
        }
        return FailureClassification.of(FailureKind.FATAL);
    }
}
