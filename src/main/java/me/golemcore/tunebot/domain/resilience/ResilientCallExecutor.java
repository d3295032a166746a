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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Executes external calls under a {@link RetryPolicy}.
 *
 * <p>
 * Each failed attempt is classified by the policy's {@link FailureClassifier}:
 * <ul>
 * <li>transient-network and rate-limited failures are retried with bounded
 * exponential backoff (or the server's retry-after) until the attempt budget
 * is spent, then surface as {@link FailureKind#RETRIES_EXHAUSTED}</li>
 * <li>authentication-lost triggers exactly one re-authentication and one extra
 * attempt; a second occurrence surfaces as
 * {@link FailureKind#AUTHENTICATION_FAILED}</li>
 * <li>everything else surfaces immediately without retry</li>
 * </ul>
 *
 * <p>
 * Callers that hold a session reference must re-read it inside the call so a
 * retry after re-authentication sees the fresh session.
 */
@Component
@Slf4j
public class ResilientCallExecutor {

    public <T> T execute(String callName, RetryPolicy policy, ExternalCall<T> call) {
        int failedAttempts = 0;
        boolean reauthenticated = false;

        while (true) {
            try {
                return call.call();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OperationFailedException(FailureKind.CANCELLED, callName + " interrupted", e);
            } catch (OperationFailedException e) {
                throw e;
            } catch (Exception e) {
                FailureClassification classification = policy.getClassifier().classify(e);
                FailureKind kind = classification.kind();

                if (kind == FailureKind.AUTHENTICATION_LOST) {
                    if (reauthenticated || policy.getReauthenticator() == null) {
                        log.error("[Retry] {}: authentication rejected again, giving up", callName);
                        throw new OperationFailedException(FailureKind.AUTHENTICATION_FAILED,
                                callName + ": " + describe(e), e);
                    }
                    reauthenticated = true;
                    log.warn("[Retry] {}: authentication lost ({}), re-authenticating", callName, describe(e));
                    reauthenticate(callName, policy.getReauthenticator());
                    continue;
                }

                if (!kind.isRetryable()) {
                    log.debug("[Retry] {}: non-retryable failure {}", callName, kind);
                    throw new OperationFailedException(kind, callName + ": " + describe(e), e);
                }

                failedAttempts++;
                if (failedAttempts >= policy.getMaxAttempts()) {
                    log.error("[Retry] {}: giving up after {} attempts ({})", callName, failedAttempts, describe(e));
                    throw new OperationFailedException(FailureKind.RETRIES_EXHAUSTED,
                            callName + " failed after " + failedAttempts + " attempts: " + describe(e), e);
                }

                Duration delay = kind == FailureKind.RATE_LIMITED && classification.retryAfter() != null
                        ? policy.capRetryAfter(classification.retryAfter())
                        : policy.backoffFor(failedAttempts);
                log.warn("[Retry] {}: {} ({}), waiting {}ms before retry (attempt {}/{})",
                        callName, kind, describe(e), delay.toMillis(), failedAttempts + 1, policy.getMaxAttempts());
                sleepForRetry(delay);
            }
        }
    }

    private void reauthenticate(String callName, Reauthenticator reauthenticator) {
        try {
            reauthenticator.reauthenticate();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationFailedException(FailureKind.CANCELLED, callName + " interrupted", e);
        } catch (Exception e) {
            log.error("[Retry] {}: re-authentication failed", callName, e);
            throw new OperationFailedException(FailureKind.AUTHENTICATION_FAILED,
                    callName + ": re-authentication failed: " + describe(e), e);
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }

    /**
     * Package-private for testing: allows tests to skip real sleeps.
     */
    void sleepForRetry(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationFailedException(FailureKind.CANCELLED, "retry wait interrupted", e);
        }
    }
}
