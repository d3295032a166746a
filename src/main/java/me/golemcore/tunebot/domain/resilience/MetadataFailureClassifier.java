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

import me.golemcore.tunebot.port.outbound.MetadataException;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

/**
 * Classifies metadata-service failures by walking the cause chain.
 */
public final class MetadataFailureClassifier {

    private MetadataFailureClassifier() {
    }

    public static FailureClassification classify(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            if (current instanceof MetadataException metadataException) {
                return FailureClassification.of(fromReason(metadataException.getReason()));
            }
            if (current instanceof IOException) {
                return FailureClassification.of(FailureKind.TRANSIENT_NETWORK);
            }
            current = current.getCause();
        }
        return FailureClassification.of(FailureKind.FATAL);
    }

    private static FailureKind fromReason(MetadataException.Reason reason) {
        return switch (reason) {
        case AUTHENTICATION -> FailureKind.AUTHENTICATION_LOST;
        case TRANSIENT -> FailureKind.TRANSIENT_NETWORK;
        case RATE_LIMITED -> FailureKind.RATE_LIMITED;
        case NOT_FOUND, INVALID -> FailureKind.FATAL;
        };
    }
}
