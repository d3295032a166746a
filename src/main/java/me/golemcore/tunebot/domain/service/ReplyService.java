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
import me.golemcore.tunebot.domain.clear.AutoClearRegistry;
import me.golemcore.tunebot.domain.model.AudioUpload;
import me.golemcore.tunebot.domain.resilience.OperationFailedException;
import me.golemcore.tunebot.port.outbound.ChatPort;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Sends bot output and records every delivered message in the
 * {@link AutoClearRegistry}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReplyService {

    private final ChatPort chatPort;
    private final AutoClearRegistry clearRegistry;

    public int send(String chatId, String text) {
        int messageId = chatPort.sendText(chatId, text);
        clearRegistry.record(chatId, messageId);
        return messageId;
    }

    public int sendAudio(String chatId, AudioUpload upload) {
        int messageId = chatPort.sendAudio(chatId, upload);
        clearRegistry.record(chatId, messageId);
        return messageId;
    }

    public int sendPhoto(String chatId, byte[] image, String caption) {
        int messageId = chatPort.sendPhoto(chatId, image, caption);
        clearRegistry.record(chatId, messageId);
        return messageId;
    }

    public void edit(String chatId, int messageId, String text) {
        chatPort.editText(chatId, messageId, text);
        clearRegistry.record(chatId, messageId);
    }

    /**
     * Best-effort delete of a user's command message. Not tracked for
     * auto-clear.
     */
    public void tryDelete(String chatId, int messageId) {
        try {
            chatPort.delete(chatId, List.of(messageId));
        } catch (OperationFailedException e) {
            log.debug("[Telegram] Could not delete command message {}: {}", messageId, e.getMessage());
        }
    }

    /**
     * Best-effort send used for error reporting.
     *
     * @return {@code true} when the message was delivered
     */
    public boolean trySend(String chatId, String text) {
        try {
            send(chatId, text);
            return true;
        } catch (OperationFailedException e) {
            log.error("[Telegram] Failed to deliver message to chat {}: {}", chatId, e.getMessage());
            return false;
        }
    }
}
