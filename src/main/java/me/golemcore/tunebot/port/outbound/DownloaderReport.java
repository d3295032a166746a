package me.golemcore.tunebot.port.outbound;

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
 * What the downloader reported about one run. Paths are whatever the tool
 * printed and are not guaranteed to exist.
 */
@Value
@Builder
public class DownloaderReport {

    /** Template expansion before postprocessing; may carry a stale extension. */
    Path templatePath;

    /** Final path after postprocessing moves, when the tool printed one. */
    Path finalPath;

    /** Extension the postprocessor actually produced. */
    String reportedExtension;

    String chosenFormat;

    @Singular("postprocessorLine")
    List<String> postprocessorLog;
}
