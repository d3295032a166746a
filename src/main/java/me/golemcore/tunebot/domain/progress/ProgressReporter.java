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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tunebot.domain.model.Operation;
import me.golemcore.tunebot.domain.resilience.OperationFailedException;
import me.golemcore.tunebot.domain.service.ReplyService;
import me.golemcore.tunebot.infrastructure.config.BotProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Keeps one status message per operation alive without exceeding the chat
 * platform's edit rate.
 *
 * <p>
 * {@link #update} calls that arrive within the throttle interval of the last
 * successful edit are dropped; the next update past the window carries the
 * latest text. {@link #finish} is never throttled and makes the handle
 * terminal. Failed edits count as dropped updates. When the status message
 * could not be sent in the first place the operation proceeds silently and
 * {@link #finish} delivers the outcome as a new message.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProgressReporter {

    private final ReplyService replyService;
    private final BotProperties properties;
    private final Clock clock;

    public StatusHandle begin(Operation operation, String initialText) {
        StatusHandle handle = new StatusHandle(operation.getChatId());
        if (!properties.getProgress().isEnabled()) {
            return handle;
        }
        try {
            int messageId = replyService.send(operation.getChatId(), initialText);
            synchronized (handle.lock()) {
                handle.rendered(messageId, initialText, clock.instant());
            }
        } catch (OperationFailedException e) {
            log.warn("[Progress] Status message not sent in chat {}, continuing without progress: {}",
                    operation.getChatId(), e.getMessage());
        }
        return handle;
    }

    public void update(StatusHandle handle, String text) {
        synchronized (handle.lock()) {
            if (handle.isTerminal() || !handle.isVisible() || text.equals(handle.getRenderedText())) {
                return;
            }
            Instant now = clock.instant();
            Duration sinceLastEdit = Duration.between(handle.getLastEditAt(), now);
            if (sinceLastEdit.compareTo(properties.getProgress().getThrottleInterval()) < 0) {
                log.debug("[Progress] Update dropped ({}ms since last edit)", sinceLastEdit.toMillis());
                return;
            }
            int messageId = handle.getMessageId();
            try {
                replyService.edit(handle.getChatId(), messageId, text);
                handle.rendered(messageId, text, now);
            } catch (OperationFailedException e) {
                log.debug("[Progress] Edit failed, treated as dropped update: {}", e.getMessage());
            }
        }
    }

    public void finish(StatusHandle handle, String finalText) {
        synchronized (handle.lock()) {
            if (handle.isTerminal()) {
                return;
            }
            handle.markTerminal();

            if (handle.isVisible()) {
                int messageId = handle.getMessageId();
                if (finalText.equals(handle.getRenderedText())) {
                    return;
                }
                try {
                    replyService.edit(handle.getChatId(), messageId, finalText);
                    handle.rendered(messageId, finalText, clock.instant());
                    return;
                } catch (OperationFailedException e) {
                    log.warn("[Progress] Final edit failed, sending outcome as new message: {}", e.getMessage());
                }
            }

            try {
                int messageId = replyService.send(handle.getChatId(), finalText);
                handle.rendered(messageId, finalText, clock.instant());
            } catch (OperationFailedException e) {
                log.error("[Progress] Outcome could not be delivered to chat {}: {}",
                        handle.getChatId(), e.getMessage());
            }
        }
    }
}
