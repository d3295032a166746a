package me.golemcore.tunebot.domain.service;

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
import me.golemcore.tunebot.domain.download.DownloadPipeline;
import me.golemcore.tunebot.domain.history.DownloadHistoryService;
import me.golemcore.tunebot.domain.model.AudioUpload;
import me.golemcore.tunebot.domain.model.DownloadResult;
import me.golemcore.tunebot.domain.model.MediaDescriptor;
import me.golemcore.tunebot.domain.model.Operation;
import me.golemcore.tunebot.domain.progress.ProgressReporter;
import me.golemcore.tunebot.domain.progress.StatusHandle;
import me.golemcore.tunebot.infrastructure.i18n.MessageService;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Downloads one track, sends it to the chat, records it in the history and
 * releases the file.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrackDeliveryService {

    private final DownloadPipeline pipeline;
    private final ReplyService replyService;
    private final ProgressReporter progressReporter;
    private final DownloadHistoryService historyService;
    private final MessageService messages;
    private final Clock clock;

    /**
     * @param progressPrefix
     *            text shown before the stage line, e.g. {@code "3/12 "}
     */
    public DownloadResult deliver(Operation operation, MediaDescriptor track, StatusHandle status,
            String progressPrefix) {
        String title = track.getTitle() != null ? track.getTitle() : track.getId();
        DownloadResult result = pipeline.download(operation, track, stage -> progressReporter.update(status,
                progressPrefix + messages.getMessage(stage.messageKey(), title)));
        try {
            progressReporter.update(status, progressPrefix + messages.getMessage("download.sending", title));
            replyService.sendAudio(operation.getChatId(), AudioUpload.builder()
                    .file(result.getFile())
                    .title(result.getTitle())
                    .performer(result.getArtist())
                    .durationSeconds(result.getDurationSeconds())
                    .caption(result.hasWarnings() ? messages.getMessage("download.caption.warnings") : null)
                    .build());
            record(result);
            return result;
        } finally {
            pipeline.release(result);
        }
    }

    private void record(DownloadResult result) {
        try {
            historyService.append(historyService.toRecord(result, clock.instant()));
        } catch (RuntimeException e) {
            log.warn("[History] Failed to record {}: {}", result.getSourceId(), e.getMessage());
        }
    }
}
