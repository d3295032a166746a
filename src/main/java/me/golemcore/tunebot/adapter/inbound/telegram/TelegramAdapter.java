package me.golemcore.tunebot.adapter.inbound.telegram;

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

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tunebot.infrastructure.config.BotProperties;
import me.golemcore.tunebot.port.inbound.ChannelPort;
import me.golemcore.tunebot.port.inbound.CommandPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

/**
 * Telegram long polling entry point.
 *
 * <p>
 * Only text messages from {@code bot.telegram.owner-id} that start with
 * {@code bot.commands.prefix} are handled. The polling thread only parses the
 * command and hands it to the {@link CommandPort}; deleting the command
 * message and every reply happen on the command's own thread.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramAdapter implements ChannelPort, LongPollingSingleThreadUpdateConsumer {

    private static final String CHANNEL_TYPE = "telegram";

    private final BotProperties properties;
    private final TelegramBotsLongPollingApplication botsApplication;
    private final ObjectProvider<CommandPort> commandRouter;

    private volatile boolean running = false;
    private final Object lifecycleLock = new Object();

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("[Telegram] Adapter already running");
                return;
            }
            BotProperties.TelegramProperties telegram = properties.getTelegram();
            if (!telegram.isEnabled()) {
                log.info("[Telegram] Channel disabled");
                return;
            }
            if (telegram.getToken() == null || telegram.getToken().isBlank()) {
                log.warn("[Telegram] Token not configured, adapter will not start");
                return;
            }
            if (telegram.getOwnerId() == null) {
                log.warn("[Telegram] bot.telegram.owner-id is not set, every command will be ignored");
            }
            try {
                botsApplication.registerBot(telegram.getToken(), this);
                running = true;
                log.info("[Telegram] Adapter started");
            } catch (TelegramApiException e) {
                log.error("[Telegram] Failed to start adapter", e);
            }
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            try {
                botsApplication.close();
                log.info("[Telegram] Adapter stopped");
            } catch (Exception e) {
                log.error("[Telegram] Error stopping adapter", e);
            }
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public void consume(Update update) {
        if (update.hasMessage() && update.getMessage().hasText()) {
            handleMessage(update.getMessage());
        }
    }

    private void handleMessage(Message telegramMessage) {
        String prefix = properties.getCommands().getPrefix();
        String text = telegramMessage.getText().trim();
        if (!text.startsWith(prefix)) {
            return;
        }
        String chatId = telegramMessage.getChatId().toString();
        Long senderId = telegramMessage.getFrom() != null ? telegramMessage.getFrom().getId() : null;
        if (!isOwner(senderId)) {
            log.warn("[Telegram] Ignoring command from unauthorized user {} in chat {}", senderId, chatId);
            return;
        }

        String body = text.substring(prefix.length()).trim();
        if (body.isEmpty()) {
            return;
        }
        String[] parts = body.split("\\s+");
        String command = parts[0].toLowerCase(Locale.ROOT);
        List<String> args = parts.length > 1
                ? List.copyOf(Arrays.asList(parts).subList(1, parts.length))
                : List.of();
        Integer messageId = telegramMessage.getMessageId();
        log.info("[Telegram] Command '{}' {} in chat {}", command, args, chatId);

        CommandPort router = commandRouter.getIfAvailable();
        if (router == null) {
            log.warn("[Telegram] No command router available, dropping '{}'", command);
            return;
        }

        Map<String, Object> context = Map.of(
                CommandPort.CONTEXT_CHAT_ID, chatId,
                CommandPort.CONTEXT_MESSAGE_ID, messageId,
                CommandPort.CONTEXT_DELETE_COMMAND, properties.getTelegram().isDeleteCommandMessages());
        try {
            router.execute(command, args, context).whenComplete((result, error) -> {
                if (error != null) {
                    log.error("[Telegram] Command execution failed: {}", command, error);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("[Telegram] Command '{}' rejected: {}", command, e.getMessage());
        }
    }

    private boolean isOwner(Long senderId) {
        Long ownerId = properties.getTelegram().getOwnerId();
        return ownerId != null && ownerId.equals(senderId);
    }
}
