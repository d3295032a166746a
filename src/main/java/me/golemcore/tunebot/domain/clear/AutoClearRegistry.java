package me.golemcore.tunebot.domain.clear;

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
import me.golemcore.tunebot.domain.model.ClearReport;
import me.golemcore.tunebot.domain.model.DeleteOutcome;
import me.golemcore.tunebot.infrastructure.config.BotProperties;
import me.golemcore.tunebot.port.outbound.ChatPort;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks messages the bot sent in each conversation and deletes them on
 * demand.
 *
 * <p>
 * Each conversation has its own {@link ConversationClearLog}. {@link #clear}
 * takes the tracked ids and empties the log inside that log's critical
 * section, then deletes outside of it: a message recorded while deletion is in
 * progress lands in the fresh log and is neither lost nor deleted twice.
 * Conversations never block each other.
 *
 * <p>
 * Deletions that fail (already removed, too old, forbidden) are skipped. Their
 * ids are dropped anyway since they can never succeed later.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AutoClearRegistry {

    private final ChatPort chatPort;
    private final BotProperties properties;

    private final Map<String, ConversationClearLog> logs = new ConcurrentHashMap<>();

    public void record(String chatId, int messageId) {
        int dropped = logFor(chatId).append(messageId);
        if (dropped > 0) {
            log.debug("[Clear] Chat {}: log at capacity, dropped {} oldest id(s)", chatId, dropped);
        }
    }

    public ClearReport clear(String chatId) {
        ConversationClearLog conversationLog = logs.get(chatId);
        if (conversationLog == null) {
            return ClearReport.empty();
        }
        List<Integer> messageIds = conversationLog.drain();
        if (messageIds.isEmpty()) {
            return ClearReport.empty();
        }

        int batchSize = Math.max(1, properties.getClear().getBatchSize());
        int deleted = 0;
        for (int start = 0; start < messageIds.size(); start += batchSize) {
            List<Integer> batch = messageIds.subList(start, Math.min(start + batchSize, messageIds.size()));
            deleted += deleteBatch(chatId, batch);
        }

        ClearReport report = new ClearReport(messageIds.size(), deleted, messageIds.size() - deleted);
        log.info("[Clear] Chat {}: deleted {}/{} tracked message(s), skipped {}",
                chatId, report.deleted(), report.requested(), report.skipped());
        return report;
    }

    private int deleteBatch(String chatId, List<Integer> batch) {
        try {
            Map<Integer, DeleteOutcome> outcomes = chatPort.delete(chatId, batch);
            int deleted = 0;
            for (Integer messageId : batch) {
                DeleteOutcome outcome = outcomes.getOrDefault(messageId, DeleteOutcome.FAILED);
                if (outcome.isDeleted()) {
                    deleted++;
                } else {
                    log.debug("[Clear] Chat {}: message {} skipped ({})", chatId, messageId, outcome);
                }
            }
            return deleted;
        } catch (RuntimeException e) {
            log.warn("[Clear] Chat {}: batch of {} could not be deleted: {}", chatId, batch.size(), e.getMessage());
            return 0;
        }
    }

    /**
     * Whether the given command should clear previous bot output before it runs.
     */
    public boolean isAutoClearCommand(String command) {
        BotProperties.CommandProperties commands = properties.getCommands();
        return commands.isAutoClear()
                && command != null
                && commands.getAutoClearCommands().contains(command.toLowerCase(Locale.ROOT));
    }

    public List<Integer> tracked(String chatId) {
        ConversationClearLog conversationLog = logs.get(chatId);
        return conversationLog == null ? List.of() : conversationLog.snapshot();
    }

    private ConversationClearLog logFor(String chatId) {
        return logs.computeIfAbsent(chatId, key -> new ConversationClearLog(properties.getClear().getLogCapacity()));
    }
}
