package me.golemcore.tunebot.domain.progress;

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

import java.time.Instant;

/**
 * The single status message of one operation. State is guarded by
 * {@link #lock()}; only {@link ProgressReporter} mutates it.
 */
public final class StatusHandle {

    private final Object lock = new Object();
    private final String chatId;

    private Integer messageId;
    private String renderedText;
    private Instant lastEditAt;
    private boolean terminal;

    StatusHandle(String chatId) {
        this.chatId = chatId;
    }

    Object lock() {
        return lock;
    }

    void rendered(int messageId, String text, Instant at) {
        this.messageId = messageId;
        this.renderedText = text;
        this.lastEditAt = at;
    }

    void markTerminal() {
        this.terminal = true;
    }

    public String getChatId() {
        return chatId;
    }

    public Integer getMessageId() {
        synchronized (lock) {
            return messageId;
        }
    }

    public String getRenderedText() {
        synchronized (lock) {
            return renderedText;
        }
    }

    Instant getLastEditAt() {
        return lastEditAt;
    }

    /**
     * Whether a status message is on screen. {@code false} when progress is
     * disabled or the initial send failed.
     */
    public boolean isVisible() {
        synchronized (lock) {
            return messageId != null;
        }
    }

    public boolean isTerminal() {
        synchronized (lock) {
            return terminal;
        }
    }
}
