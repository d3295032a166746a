package me.golemcore.tunebot.domain.model;

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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of the download pipeline for one media item. The file is confirmed
 * to exist, be non-empty and carry a known audio extension.
 */
@Value
@Builder
public class DownloadResult {

    Path file;
    String title;
    String artist;
    String album;
    Integer durationSeconds;
    String sourceUrl;
    String sourceId;
    boolean fileConfirmed;
    String chosenFormat;

    /** Token of the operation that produced the file; part of its name. */
    String operationToken;

    @Singular
    List<DownloadWarning> warnings;

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
