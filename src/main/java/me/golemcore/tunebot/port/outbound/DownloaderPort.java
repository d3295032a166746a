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
 * External media downloader, run as an isolated subprocess-like unit.
 */
public interface DownloaderPort {

    /**
     * Downloads one item.
     *
     * @param url
     *            media URL
     * @param outputTemplate
     *            output name template, relative to the options' work directory
     * @param options
     *            format selection and postprocessing options
     * @return what the downloader reported about its output
     * @throws DownloaderException
     *             when the downloader fails or times out
     * @throws InterruptedException
     *             when the calling thread is interrupted while waiting
     */
    DownloaderReport run(String url, String outputTemplate, DownloaderOptions options)
            throws DownloaderException, InterruptedException;
}
