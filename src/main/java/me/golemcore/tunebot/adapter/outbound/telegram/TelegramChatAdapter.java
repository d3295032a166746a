package me.golemcore.tunebot.adapter.outbound.telegram;

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
import me.golemcore.tunebot.domain.model.AudioUpload;
import me.golemcore.tunebot.domain.model.DeleteOutcome;
import me.golemcore.tunebot.domain.resilience.ExternalCall;
import me.golemcore.tunebot.domain.resilience.FailureKind;
import me.golemcore.tunebot.domain.resilience.OperationFailedException;
import me.golemcore.tunebot.domain.resilience.ResilientCallExecutor;
import me.golemcore.tunebot.domain.resilience.RetryPolicy;
import me.golemcore.tunebot.domain.resilience.RetryPolicyFactory;
import me.golemcore.tunebot.infrastructure.config.BotProperties;
import me.golemcore.tunebot.port.outbound.ChatPort;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.meta.api.methods.send.SendAudio;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.send.SendPhoto;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.DeleteMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.DeleteMessages;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.InputFile;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.io.ByteArrayInputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link ChatPort} over the Telegram Bot API.
 *
 * <p>
 * Every call goes through the chat retry policy: 429 responses wait for the
 * server's retry-after, transient failures back off, the rest fail at once.
 * Request objects are rebuilt for each attempt since uploads consume their
 * input stream.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramChatAdapter implements ChatPort {

    private static final int TELEGRAM_MAX_MESSAGE_LENGTH = 4096;
    private static final int TELEGRAM_MAX_CAPTION_LENGTH = 1024;
    private static final int TELEGRAM_MAX_DELETE_BATCH = 100;
    private static final int HTTP_FORBIDDEN = 403;
    private static final String NOT_MODIFIED = "message is not modified";
    private static final String ELLIPSIS = "...";

    private final ResilientCallExecutor callExecutor;
    private final RetryPolicyFactory retryPolicies;
    private final BotProperties properties;

    private volatile TelegramClient telegramClient;

    /**
     * Package-private setter for testing.
     */
    void setTelegramClient(TelegramClient client) {
        this.telegramClient = client;
    }

    private TelegramClient client() {
        TelegramClient client = telegramClient;
        if (client == null) {
            synchronized (this) {
                if (telegramClient == null) {
                    String token = properties.getTelegram().getToken();
                    if (token == null || token.isBlank()) {
                        throw new OperationFailedException(FailureKind.FATAL, "Telegram token not configured");
                    }
                    telegramClient = new OkHttpTelegramClient(token);
                }
                client = telegramClient;
            }
        }
        return client;
    }

    @Override
    public int sendText(String chatId, String text) {
        Message sent = call("telegram.sendMessage", () -> client().execute(SendMessage.builder()
                .chatId(chatId)
                .text(truncate(text, TELEGRAM_MAX_MESSAGE_LENGTH))
                .build()));
        return sent.getMessageId();
    }

    @Override
    public int sendAudio(String chatId, AudioUpload upload) {
        Message sent = call("telegram.sendAudio", () -> {
            SendAudio.SendAudioBuilder<?, ?> builder = SendAudio.builder()
                    .chatId(chatId)
                    .audio(new InputFile(upload.getFile().toFile()))
                    .title(upload.getTitle())
                    .performer(upload.getPerformer());
            if (upload.getDurationSeconds() != null && upload.getDurationSeconds() > 0) {
                builder.duration(upload.getDurationSeconds());
            }
            if (upload.getCaption() != null && !upload.getCaption().isBlank()) {
                builder.caption(truncate(upload.getCaption(), TELEGRAM_MAX_CAPTION_LENGTH));
            }
            return client().execute(builder.build());
        });
        log.debug("[Telegram] Sent audio '{}' to chat {}", upload.getFile().getFileName(), chatId);
        return sent.getMessageId();
    }

    @Override
    public int sendPhoto(String chatId, byte[] image, String caption) {
        Message sent = call("telegram.sendPhoto", () -> {
            SendPhoto.SendPhotoBuilder<?, ?> builder = SendPhoto.builder()
                    .chatId(chatId)
                    .photo(new InputFile(new ByteArrayInputStream(image), "cover.jpg"));
            if (caption != null && !caption.isBlank()) {
                builder.caption(truncate(caption, TELEGRAM_MAX_CAPTION_LENGTH));
            }
            return client().execute(builder.build());
        });
        return sent.getMessageId();
    }

    @Override
    public void editText(String chatId, int messageId, String text) {
        call("telegram.editMessageText", () -> {
            try {
                return client().execute(EditMessageText.builder()
                        .chatId(chatId)
                        .messageId(messageId)
                        .text(truncate(text, TELEGRAM_MAX_MESSAGE_LENGTH))
                        .build());
            } catch (TelegramApiRequestException e) {
                if (mentions(e, NOT_MODIFIED)) {
                    return null;
                }
                throw e;
            }
        });
    }

    @Override
    public Map<Integer, DeleteOutcome> delete(String chatId, List<Integer> messageIds) {
        Map<Integer, DeleteOutcome> outcomes = new LinkedHashMap<>();
        for (int from = 0; from < messageIds.size(); from += TELEGRAM_MAX_DELETE_BATCH) {
            List<Integer> batch = messageIds.subList(from, Math.min(from + TELEGRAM_MAX_DELETE_BATCH,
                    messageIds.size()));
            outcomes.putAll(deleteBatch(chatId, batch));
        }
        return outcomes;
    }

    private Map<Integer, DeleteOutcome> deleteBatch(String chatId, List<Integer> batch) {
        Map<Integer, DeleteOutcome> outcomes = new LinkedHashMap<>();
        try {
            Boolean deleted = call("telegram.deleteMessages", () -> client().execute(DeleteMessages.builder()
                    .chatId(chatId)
                    .messageIds(batch)
                    .build()));
            if (Boolean.TRUE.equals(deleted)) {
                batch.forEach(id -> outcomes.put(id, DeleteOutcome.DELETED));
                return outcomes;
            }
        } catch (OperationFailedException e) {
            log.debug("[Telegram] Batch delete of {} messages failed, deleting one by one: {}", batch.size(),
                    e.getMessage());
        }
        for (Integer id : batch) {
            outcomes.put(id, deleteOne(chatId, id));
        }
        return outcomes;
    }

    private DeleteOutcome deleteOne(String chatId, Integer messageId) {
        try {
            Boolean deleted = call("telegram.deleteMessage", () -> client().execute(DeleteMessage.builder()
                    .chatId(chatId)
                    .messageId(messageId)
                    .build()));
            return Boolean.TRUE.equals(deleted) ? DeleteOutcome.DELETED : DeleteOutcome.FAILED;
        } catch (OperationFailedException e) {
            return outcomeOf(e);
        }
    }

    private static DeleteOutcome outcomeOf(OperationFailedException failure) {
        if (failure.getCause() instanceof TelegramApiRequestException requestException) {
            if (mentions(requestException, "not found")) {
                return DeleteOutcome.NOT_FOUND;
            }
            Integer errorCode = requestException.getErrorCode();
            if (mentions(requestException, "can't be deleted")
                    || (errorCode != null && errorCode == HTTP_FORBIDDEN)) {
                return DeleteOutcome.FORBIDDEN;
            }
        }
        return DeleteOutcome.FAILED;
    }

    private <T> T call(String callName, ExternalCall<T> call) {
        RetryPolicy policy = retryPolicies.chat(TelegramFailureClassifier::classify);
        return callExecutor.execute(callName, policy, call);
    }

    private static boolean mentions(TelegramApiRequestException e, String fragment) {
        String response = e.getApiResponse() != null ? e.getApiResponse() : e.getMessage();
        return response != null && response.toLowerCase(Locale.ROOT).contains(fragment);
    }

    private static String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
    }
}
