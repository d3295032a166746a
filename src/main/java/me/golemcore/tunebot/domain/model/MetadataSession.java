package me.golemcore.tunebot.domain.model;

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

import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable metadata-service session. Replaced as a whole on
 * re-authentication; in-flight calls keep using the instance they read.
 */
@Value
public class MetadataSession {

    Map<String, String> headers;
    boolean authenticated;
    Instant createdAt;

    public MetadataSession(Map<String, String> headers, boolean authenticated, Instant createdAt) {
        this.headers = Map.copyOf(headers);
        this.authenticated = authenticated;
        this.createdAt = createdAt;
    }

    public static MetadataSession anonymous(Instant createdAt) {
        return new MetadataSession(Map.of(), false, createdAt);
    }
}
