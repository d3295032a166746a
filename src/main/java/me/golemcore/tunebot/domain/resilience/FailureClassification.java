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

import java.time.Duration;

/**
 * Result of classifying one failed attempt.
 *
 * @param kind
 *            failure kind
 * @param retryAfter
 *            server-provided delay, or {@code null} when none was given
 */
public record FailureClassification(FailureKind kind, Duration retryAfter) {

    public static FailureClassification of(FailureKind kind) {
        return new FailureClassification(kind, null);
    }

    public static FailureClassification rateLimited(Duration retryAfter) {
        return new FailureClassification(FailureKind.RATE_LIMITED, retryAfter);
    }
}
