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

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One row of the recent-downloads history.
 *
 * <p>
 * Fields are only ever appended. Rows written by older versions miss the newer
 * fields and are upgraded on read.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryRecord {

    public static final int CURRENT_SCHEMA_VERSION = 2;
    public static final int UNKNOWN_DURATION = -1;

    private Integer schemaVersion;
    private String title;
    private String artist;
    private String album;
    @JsonAlias("url")
    private String sourceUrl;
    private String sourceId;
    private Integer durationSeconds;
    private Instant downloadedAt;

    public boolean hasKnownDuration() {
        return durationSeconds != null && durationSeconds != UNKNOWN_DURATION;
    }
}
