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

import lombok.extern.slf4j.Slf4j;

/**
 * Enforces the {@link DownloadStage} transitions for one download and forwards
 * every change to a listener.
 */
@Slf4j
class DownloadStageTracker {

    private final String sourceId;
    private final DownloadStageListener listener;
    private DownloadStage stage = DownloadStage.REQUESTED;

    DownloadStageTracker(String sourceId, DownloadStageListener listener) {
        this.sourceId = sourceId;
        this.listener = listener;
    }

    synchronized void advanceTo(DownloadStage next) {
        if (!stage.canAdvanceTo(next)) {
            throw new IllegalStateException("Invalid download transition " + stage + " -> " + next);
        }
        log.debug("[Download] {}: {} -> {}", sourceId, stage, next);
        stage = next;
        notifyListener(next);
    }

    synchronized void fail() {
        if (!stage.isTerminal()) {
            advanceTo(DownloadStage.FAILED);
        }
    }

    synchronized DownloadStage current() {
        return stage;
    }

    private void notifyListener(DownloadStage next) {
        try {
            listener.onStage(next);
        } catch (RuntimeException e) {
            log.warn("[Download] Stage listener failed on {}: {}", next, e.getMessage());
        }
    }
}
