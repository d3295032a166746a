package me.golemcore.tunebot.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the bot, bound from
 * application.properties.
 *
 * <p>
 * All bot configuration is organized under the {@code bot.*} prefix. This class
 * contains nested property classes for different subsystems:
 * <ul>
 * <li>{@link TelegramProperties} - bot token and owner</li>
 * <li>{@link CommandProperties} - prefix, auto-clear, search limits</li>
 * <li>{@link ProgressProperties} - status message throttling</li>
 * <li>{@link ClearProperties} - message registry bounds</li>
 * <li>{@link RetryGroupProperties} - retry budgets per external service</li>
 * <li>{@link MetadataProperties} - YouTube Music client</li>
 * <li>{@link DownloaderProperties} - yt-dlp invocation and output policy</li>
 * <li>{@link OperationProperties} - worker pool and operation timeout</li>
 * <li>{@link HistoryProperties} - recent downloads log</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private String language = "en";
    private TelegramProperties telegram = new TelegramProperties();
    private CommandProperties commands = new CommandProperties();
    private ProgressProperties progress = new ProgressProperties();
    private ClearProperties clear = new ClearProperties();
    private RetryGroupProperties retry = new RetryGroupProperties();
    private MetadataProperties metadata = new MetadataProperties();
    private DownloaderProperties downloader = new DownloaderProperties();
    private OperationProperties operations = new OperationProperties();
    private HistoryProperties history = new HistoryProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();

    /**
     * Expands {@code ${user.home}} and normalizes a configured path.
     */
    public static Path expandPath(String raw) {
        return Paths.get(raw.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
    }

    @Data
    public static class TelegramProperties {
        private boolean enabled = true;
        private String token;
        private Long ownerId;
        private boolean deleteCommandMessages = true;
    }

    @Data
    public static class CommandProperties {
        private String prefix = ",";
        private boolean autoClear = true;
        private List<String> autoClearCommands = new ArrayList<>(
                List.of("search", "see", "last", "download", "dl", "rec", "alast", "likes", "help", "clear"));
        private int searchLimit = 8;
        private int maxSearchLimit = 20;
        private int maxListedTracks = 15;
        private int recommendationsLimit = 8;
        private int historyLimit = 10;
        private int likedLimit = 15;
    }

    @Data
    public static class ProgressProperties {
        private boolean enabled = true;
        private Duration throttleInterval = Duration.ofSeconds(1);
    }

    @Data
    public static class ClearProperties {
        private int logCapacity = 500;
        private int batchSize = 100;
    }

    @Data
    public static class RetryGroupProperties {
        private RetryProperties metadata = new RetryProperties(3, Duration.ofSeconds(1), Duration.ofSeconds(10));
        private RetryProperties chat = new RetryProperties(4, Duration.ofSeconds(1), Duration.ofSeconds(30));
        private RetryProperties downloader = new RetryProperties(2, Duration.ofSeconds(5), Duration.ofSeconds(30));
    }

    @Data
    public static class RetryProperties {
        private int maxAttempts;
        private Duration initialBackoff;
        private double multiplier = 2.0;
        private Duration maxBackoff;

        public RetryProperties() {
            this(3, Duration.ofSeconds(1), Duration.ofSeconds(30));
        }

        public RetryProperties(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
            this.maxAttempts = maxAttempts;
            this.initialBackoff = initialBackoff;
            this.maxBackoff = maxBackoff;
        }
    }

    @Data
    public static class MetadataProperties {
        private String baseUrl = "https://music.youtube.com/youtubei/v1/";
        private String origin = "https://music.youtube.com";
        private String clientName = "WEB_REMIX";
        private String clientVersion = "1.20240918.01.00";
        private String language = "en";
        private String authFile = "headers_auth.json";
    }

    @Data
    public static class DownloaderProperties {
        private String executable = "yt-dlp";
        private String workDir = "${user.home}/.tunebot/downloads";
        private String format = "bestaudio[ext=m4a]/best[ext=m4a]";
        private String audioFormat = "m4a";
        private String outputTemplate = "%(title).80s [%(channel)s] [%(id)s]";
        private String cookiesFile = "cookies.txt";
        private Duration timeout = Duration.ofMinutes(10);
        private Duration scanSlack = Duration.ofSeconds(2);
        private List<String> preservedExtensions = new ArrayList<>(List.of("opus"));
        private boolean embedCover = true;
    }

    @Data
    public static class OperationProperties {
        private int threads = 4;
        private Duration timeout = Duration.ofMinutes(15);
    }

    @Data
    public static class HistoryProperties {
        private boolean enabled = true;
        private int maxRecords = 5;
        private String directory = "history";
        private String file = "recent.jsonl";
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.tunebot/workspace";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:128.0) Gecko/20100101 Firefox/128.0";
    }
}
