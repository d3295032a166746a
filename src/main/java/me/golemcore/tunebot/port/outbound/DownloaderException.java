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
 * Structured downloader failure.
 */
public class DownloaderException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int exitCode;
    private final boolean partialFileWritten;
    private final boolean timedOut;
    private final String logTail;

    public DownloaderException(String message, int exitCode, boolean partialFileWritten, boolean timedOut,
            String logTail) {
        super(message);
        this.exitCode = exitCode;
        this.partialFileWritten = partialFileWritten;
        this.timedOut = timedOut;
        this.logTail = logTail;
    }

    public DownloaderException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
        this.partialFileWritten = false;
        this.timedOut = false;
        this.logTail = "";
    }

    public int getExitCode() {
        return exitCode;
    }

    public boolean isPartialFileWritten() {
        return partialFileWritten;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public String getLogTail() {
        return logTail;
    }
}
