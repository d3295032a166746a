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

import me.golemcore.tunebot.domain.resilience.FailureClassification;
import me.golemcore.tunebot.domain.resilience.FailureKind;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;

import java.io.IOException;
import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies Telegram Bot API failures for the retry policy.
 *
 * <p>
 * HTTP 429 is rate-limited and carries the server's retry-after; 5xx responses
 * and I/O errors anywhere in the cause chain are transient; everything else,
 * including 4xx validation errors, is fatal.
 */
public final class TelegramFailureClassifier {

    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int HTTP_SERVER_ERROR = 500;
    private static final int RETRY_AFTER_DEFAULT_SECONDS = 5;
    private static final int RETRY_AFTER_CAP_SECONDS = 30;
    private static final Pattern RETRY_AFTER_PATTERN = Pattern.compile("retry after (\\d+)");

    private TelegramFailureClassifier() {
    }

    public static FailureClassification classify(Throwable throwable) {
        Throwable current = throwable;
        while (current != null) {
            if (current instanceof TelegramApiRequestException requestException) {
                Integer errorCode = requestException.getErrorCode();
                if (errorCode != null && errorCode == HTTP_TOO_MANY_REQUESTS) {
                    return FailureClassification.rateLimited(
                            Duration.ofSeconds(extractRetryAfterSeconds(requestException)));
                }
                if (errorCode != null && errorCode >= HTTP_SERVER_ERROR) {
                    return FailureClassification.of(FailureKind.TRANSIENT_NETWORK);
                }
                if (errorCode != null && errorCode > 0) {
                    return FailureClassification.of(FailureKind.FATAL);
                }
            }
            if (current instanceof IOException) {
                return FailureClassification.of(FailureKind.TRANSIENT_NETWORK);
            }
            current = current.getCause();
        }
        return FailureClassification.of(FailureKind.FATAL);
    }

    static int extractRetryAfterSeconds(TelegramApiRequestException e) {
        if (e.getParameters() != null && e.getParameters().getRetryAfter() != null) {
            return Math.min(e.getParameters().getRetryAfter(), RETRY_AFTER_CAP_SECONDS);
        }
        String message = e.getMessage();
        if (message != null) {
            Matcher matcher = RETRY_AFTER_PATTERN.matcher(message);
            if (matcher.find()) {
                return Math.min(Integer.parseInt(matcher.group(1)), RETRY_AFTER_CAP_SECONDS);
            }
        }
        return RETRY_AFTER_DEFAULT_SECONDS;
    }
}
