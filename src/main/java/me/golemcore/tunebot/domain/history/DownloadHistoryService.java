package me.golemcore.tunebot.domain.history;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tunebot.domain.model.DownloadResult;
import me.golemcore.tunebot.domain.model.HistoryRecord;
import me.golemcore.tunebot.domain.service.MediaLinkParser;
import me.golemcore.tunebot.infrastructure.config.BotProperties;
import me.golemcore.tunebot.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Append-only, size-bounded log of completed downloads, stored as JSON lines
 * (oldest first) under {@code history/recent.jsonl}.
 *
 * <p>
 * Writes rewrite the whole file atomically and are serialized by this service.
 * Reads are lazy and restartable: each iteration re-reads the file and yields
 * the most recent record first. Rows written before schema versioning are
 * upgraded as they are read.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DownloadHistoryService {

    private static final String NEWLINE = "\n";
    private static final String SCHEMA_VERSION_FIELD = "schemaVersion";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final BotProperties properties;

    private final Object writeLock = new Object();

    public boolean isEnabled() {
        return properties.getHistory().isEnabled();
    }

    public void append(HistoryRecord record) {
        if (!isEnabled()) {
            return;
        }
        record.setSchemaVersion(HistoryRecord.CURRENT_SCHEMA_VERSION);
        int maxRecords = Math.max(1, properties.getHistory().getMaxRecords());

        synchronized (writeLock) {
            List<String> lines = new ArrayList<>(readLines());
            try {
                lines.add(objectMapper.writeValueAsString(record));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Cannot serialize history record", e);
            }
            if (lines.size() > maxRecords) {
                lines = new ArrayList<>(lines.subList(lines.size() - maxRecords, lines.size()));
            }
            storagePort.putTextAtomic(directory(), file(), String.join(NEWLINE, lines) + NEWLINE, false).join();
            log.debug("[History] Recorded {} ({} row(s) kept)", record.getSourceId(), lines.size());
        }
    }

    /**
     * @return a view that reads the file on every {@code iterator()} call,
     *         most recent record first; empty when tracking is disabled
     */
    public Iterable<HistoryRecord> load() {
        return this::readRecentFirst;
    }

    public HistoryRecord toRecord(DownloadResult result, Instant downloadedAt) {
        return HistoryRecord.builder()
                .schemaVersion(HistoryRecord.CURRENT_SCHEMA_VERSION)
                .title(result.getTitle())
                .artist(result.getArtist())
                .album(result.getAlbum() != null ? result.getAlbum() : "")
                .sourceUrl(result.getSourceUrl())
                .sourceId(result.getSourceId())
                .durationSeconds(result.getDurationSeconds() != null
                        ? result.getDurationSeconds()
                        : HistoryRecord.UNKNOWN_DURATION)
                .downloadedAt(downloadedAt)
                .build();
    }

    private Iterator<HistoryRecord> readRecentFirst() {
        if (!isEnabled()) {
            return Collections.emptyIterator();
        }
        List<HistoryRecord> records = new ArrayList<>();
        for (String line : readLines()) {
            HistoryRecord record = parse(line);
            if (record != null) {
                records.add(record);
            }
        }
        Collections.reverse(records);
        return records.iterator();
    }

    private HistoryRecord parse(String line) {
        try {
            JsonNode node = objectMapper.readTree(line);
            if (node == null || !node.isObject()) {
                log.warn("[History] Skipping non-object row: {}", line);
                return null;
            }
            HistoryRecord record = objectMapper.treeToValue(node, HistoryRecord.class);
            if (!node.hasNonNull(SCHEMA_VERSION_FIELD)) {
                upgrade(record);
            }
            return record;
        } catch (JsonProcessingException e) {
            log.warn("[History] Skipping unreadable row: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static void upgrade(HistoryRecord record) {
        if (record.getAlbum() == null) {
            record.setAlbum("");
        }
        if (record.getDurationSeconds() == null) {
            record.setDurationSeconds(HistoryRecord.UNKNOWN_DURATION);
        }
        if (record.getSourceId() == null || record.getSourceId().isBlank()) {
            record.setSourceId(MediaLinkParser.sourceIdOf(record.getSourceUrl()));
        }
        if (record.getDownloadedAt() == null) {
            record.setDownloadedAt(Instant.EPOCH);
        }
        record.setSchemaVersion(HistoryRecord.CURRENT_SCHEMA_VERSION);
    }

    private List<String> readLines() {
        String content = storagePort.getText(directory(), file()).join();
        if (content == null || content.isBlank()) {
            return List.of();
        }
        List<String> lines = new ArrayList<>();
        for (String line : content.split(NEWLINE)) {
            if (!line.isBlank()) {
                lines.add(line.trim());
            }
        }
        return lines;
    }

    private String directory() {
        return properties.getHistory().getDirectory();
    }

    private String file() {
        return properties.getHistory().getFile();
    }
}
