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

import java.util.Locale;

/**
 * Classification of failures raised by external calls and by the download
 * pipeline.
 *
 * <p>
 * The first four kinds are produced by {@link FailureClassifier}s from raw
 * adapter exceptions. The remaining kinds are outcomes surfaced to callers as
 * part of an {@link OperationFailedException}.
 */
public enum FailureKind {

    /** Connection reset, timeout, 5xx. Retried with backoff. */
    TRANSIENT_NETWORK(true),

    /** Platform rate limit (HTTP 429). Retried, honouring retry-after. */
    RATE_LIMITED(true),

    /** Metadata session rejected (HTTP 401/403). One re-authentication. */
    AUTHENTICATION_LOST(false),

    /** Caller-input or unexpected error. Never retried. */
    FATAL(false),

    RETRIES_EXHAUSTED(false),

    AUTHENTICATION_FAILED(false),

    /** More than one downloaded file matches the requested item. */
    AMBIGUOUS_OUTPUT(false),

    /** No downloaded file matches the requested item. */
    DOWNLOAD_INCOMPLETE(false),

    /** Title or artist tag missing after tagging. Reported as a warning. */
    METADATA_INCOMPLETE(false),

    /** Operation timed out or its thread was interrupted. */
    CANCELLED(false);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Message bundle key used when reporting this kind to the user.
     */
    public String messageKey() {
        return "error." + name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
