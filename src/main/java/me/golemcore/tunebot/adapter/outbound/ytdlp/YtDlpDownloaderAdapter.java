package me.golemcore.tunebot.adapter.outbound.ytdlp;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tunebot.infrastructure.config.BotProperties;
import me.golemcore.tunebot.port.outbound.DownloaderException;
import me.golemcore.tunebot.port.outbound.DownloaderOptions;
import me.golemcore.tunebot.port.outbound.DownloaderPort;
import me.golemcore.tunebot.port.outbound.DownloaderReport;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs yt-dlp as a child process, one process per download.
 *
 * <p>
 * Paths and the chosen format are printed through {@code --print} marker
 * lines, so the report does not depend on yt-dlp's human-readable output.
 * Every other line is forwarded to the options' output listener as it
 * arrives. A run that exceeds its timeout is killed.
 */
@Component
@Slf4j
public class YtDlpDownloaderAdapter implements DownloaderPort {

    private static final long READER_DRAIN_SECONDS = 5;

    private final BotProperties.DownloaderProperties config;
    private final ExecutorService readers;

    public YtDlpDownloaderAdapter(BotProperties properties) {
        this.config = properties.getDownloader();
        AtomicInteger counter = new AtomicInteger();
        this.readers = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "tunebot-ytdlp-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    public void shutdown() {
        readers.shutdownNow();
    }

    @Override
    public DownloaderReport run(String url, String outputTemplate, DownloaderOptions options)
            throws DownloaderException, InterruptedException {
        List<String> command = buildCommand(config.getExecutable(), url, outputTemplate, options);
        log.debug("[Download] Running {}", String.join(" ", command));

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(options.getWorkDir().toFile());
        pb.redirectErrorStream(true);

        Process process;
        try {
            Files.createDirectories(options.getWorkDir());
            process = pb.start();
        } catch (IOException e) {
            throw new DownloaderException("cannot start " + config.getExecutable() + ": " + e.getMessage(), e);
        }

        YtDlpOutput output = new YtDlpOutput();
        Future<?> reader = readers.submit(() -> {
            try (BufferedReader in = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line = in.readLine();
                while (line != null) {
                    if (!output.accept(line)) {
                        options.getOutputListener().accept(line);
                    }
                    line = in.readLine();
                }
            }
            return null;
        });

        boolean completed;
        try {
            completed = process.waitFor(options.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            reader.cancel(true);
            throw e;
        }
        if (!completed) {
            process.destroyForcibly();
            reader.cancel(true);
            log.warn("[Download] {} timed out after {}", url, options.getTimeout());
            throw new DownloaderException("timed out after " + options.getTimeout().toSeconds() + "s",
                    -1, output.isPartialFileWritten(), true, output.tail());
        }
        drain(reader);

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            throw new DownloaderException(config.getExecutable() + " exited with code " + exitCode,
                    exitCode, output.isPartialFileWritten(), false, output.tail());
        }
        return output.report();
    }

    static List<String> buildCommand(String executable, String url, String outputTemplate,
            DownloaderOptions options) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("--no-playlist");
        command.add("--newline");
        command.add("--no-simulate");
        command.add("--no-quiet");
        command.add("-f");
        command.add(options.getFormat());
        if (options.getAudioFormat() != null && !options.getAudioFormat().isBlank()) {
            command.add("-x");
            command.add("--audio-format");
            command.add(options.getAudioFormat());
        }
        if (options.isEmbedMetadata()) {
            command.add("--embed-metadata");
        }
        addPrint(command, "before_dl", YtDlpOutput.TEMPLATE_KEY + "%(filename)s");
        addPrint(command, "before_dl", YtDlpOutput.FORMAT_KEY + "%(format_id)s");
        addPrint(command, "after_move", YtDlpOutput.FINAL_KEY + "%(filepath)s");
        addPrint(command, "after_move", YtDlpOutput.EXT_KEY + "%(ext)s");
        if (options.getCookiesFile() != null) {
            command.add("--cookies");
            command.add(options.getCookiesFile().toString());
        }
        command.add("-P");
        command.add(options.getWorkDir().toString());
        command.add("-o");
        command.add(outputTemplate);
        command.add("--");
        command.add(url);
        return command;
    }

    private static void addPrint(List<String> command, String stage, String template) {
        command.add("--print");
        command.add(stage + ":" + YtDlpOutput.MARKER + template);
    }

    private static void drain(Future<?> reader) throws InterruptedException {
        try {
            reader.get(READER_DRAIN_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            reader.cancel(true);
            log.warn("[Download] Output reader did not finish within {}s", READER_DRAIN_SECONDS);
        } catch (ExecutionException e) {
            log.warn("[Download] Output reader failed: {}", e.getCause().getMessage());
        }
    }
}
