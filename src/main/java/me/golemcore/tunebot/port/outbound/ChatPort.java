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

import me.golemcore.tunebot.domain.model.AudioUpload;
import me.golemcore.tunebot.domain.model.DeleteOutcome;

import java.util.List;
import java.util.Map;

/**
 * Chat-platform primitives used by the core. Implementations retry transient
 * and rate-limited failures themselves and surface anything else as
 * {@link me.golemcore.tunebot.domain.resilience.OperationFailedException}.
 */
public interface ChatPort {

    /**
     * Sends a text message.
     *
     * @return id of the sent message
     */
    int sendText(String chatId, String text);

    /**
     * Sends an audio file.
     *
     * @return id of the sent message
     */
    int sendAudio(String chatId, AudioUpload upload);

    /**
     * Sends an image with an optional caption.
     *
     * @return id of the sent message
     */
    int sendPhoto(String chatId, byte[] image, String caption);

    /**
     * Replaces the text of a previously sent message.
     */
    void editText(String chatId, int messageId, String text);

    /**
     * Deletes messages. Never throws for individual failures.
     *
     * @return outcome for every requested id
     */
    Map<Integer, DeleteOutcome> delete(String chatId, List<Integer> messageIds);
}
