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

import java.util.Locale;

/**
 * Stages of one download. Stages advance strictly in declaration order up to
 * {@link #COMPLETE}; {@link #FAILED} is reachable from any non-terminal stage.
 */
public enum DownloadStage {
    REQUESTED,
    FETCHING,
    POSTPROCESSING,
    RESOLVING_OUTPUT,
    TAGGING,
    COMPLETE,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }

    public boolean canAdvanceTo(DownloadStage next) {
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return next.ordinal() == ordinal() + 1;
    }

    public String messageKey() {
        return "download.stage." + name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
