package me.golemcore.tunebot.port.outbound;

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

/**
 * Typed failure of the metadata service.
 */
public class MetadataException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Why a metadata call failed.
     */
    public enum Reason {
        AUTHENTICATION,
        TRANSIENT,
        RATE_LIMITED,
        NOT_FOUND,
        INVALID
    }

    private final Reason reason;
    private final int httpStatus;

    public MetadataException(Reason reason, String message) {
        this(reason, message, 0, null);
    }

    public MetadataException(Reason reason, String message, Throwable cause) {
        this(reason, message, 0, cause);
    }

    public MetadataException(Reason reason, String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.httpStatus = httpStatus;
    }

    public Reason getReason() {
        return reason;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
