package me.golemcore.tunebot.domain.resilience;

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
import me.golemcore.tunebot.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

/**
 * Builds {@link RetryPolicy} instances from {@code bot.retry.*}.
 */
@Component
@RequiredArgsConstructor
public class RetryPolicyFactory {

    private final BotProperties properties;

    public RetryPolicy metadata(Reauthenticator reauthenticator) {
        return from(properties.getRetry().getMetadata(), MetadataFailureClassifier::classify)
                .withReauthenticator(reauthenticator);
    }

    public RetryPolicy chat(FailureClassifier classifier) {
        return from(properties.getRetry().getChat(), classifier);
    }

    public RetryPolicy downloader() {
        return from(properties.getRetry().getDownloader(), DownloaderFailureClassifier::classify);
    }

    private static RetryPolicy from(BotProperties.RetryProperties retry, FailureClassifier classifier) {
        return RetryPolicy.builder()
                .maxAttempts(retry.getMaxAttempts())
                .initialBackoff(retry.getInitialBackoff())
                .multiplier(retry.getMultiplier())
                .maxBackoff(retry.getMaxBackoff())
                .classifier(classifier)
                .build();
    }
}
