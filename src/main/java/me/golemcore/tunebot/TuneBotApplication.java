package me.golemcore.tunebot;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for TuneBot.
 *
 * <p>
 * TuneBot is a single-owner Telegram bot that searches YouTube Music, shows
 * details of tracks, albums, playlists and artists, and downloads audio with
 * yt-dlp, tagging it before sending it back to the chat.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → TelegramAdapter, CommandRouter
 * Domain Layer       → DownloadPipeline, ProgressReporter, AutoClearRegistry, Services
 * Infrastructure     → YouTube Music, yt-dlp, FFmpeg, Telegram, Storage Adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code bot.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class TuneBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(TuneBotApplication.class, args);
    }

}
