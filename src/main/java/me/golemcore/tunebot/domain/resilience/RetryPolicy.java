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

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.time.Duration;

/**
 * Retry rules passed explicitly to every external call site.
 *
 * <p>
 * {@code maxAttempts} counts total attempts, the first one included. The
 * single retry that follows a re-authentication is not charged against it.
 */
@Value
@Builder
public class RetryPolicy {

    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    Duration initialBackoff = Duration.ofSeconds(1);

    @Builder.Default
    double multiplier = 2.0;

    @Builder.Default
    Duration maxBackoff = Duration.ofSeconds(30);

    @NonNull
    FailureClassifier classifier;

    /** Optional; without it authentication-lost fails immediately. */
    @With
    Reauthenticator reauthenticator;

    /**
     * Delay before the given retry (1-based), bounded by {@link #maxBackoff}.
     */
    public Duration backoffFor(int retryNumber) {
        double factor = Math.pow(multiplier, Math.max(0, retryNumber - 1));
        long millis = (long) Math.min(initialBackoff.toMillis() * factor, (double) maxBackoff.toMillis());
        return Duration.ofMillis(millis);
    }

    /**
     * Server-provided delay, capped by {@link #maxBackoff}.
     */
    public Duration capRetryAfter(Duration retryAfter) {
        return retryAfter.compareTo(maxBackoff) > 0 ? maxBackoff : retryAfter;
    }
}
