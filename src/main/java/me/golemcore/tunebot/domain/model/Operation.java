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

import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One user-invoked command instance. Never persisted.
 */
@Getter
public class Operation {

    private static final int TOKEN_LENGTH = 8;

    private final String chatId;
    private final Integer messageId;
    private final String command;
    private final List<String> args;
    private final Instant startedAt;

    /** Unique per operation; embedded in every temporary file name. */
    private final String token;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public Operation(String chatId, Integer messageId, String command, List<String> args, Instant startedAt) {
        this.chatId = chatId;
        this.messageId = messageId;
        this.command = command;
        this.args = List.copyOf(args);
        this.startedAt = startedAt;
        this.token = UUID.randomUUID().toString().replace("-", "").substring(0, TOKEN_LENGTH);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        cancelled.set(true);
    }
}
