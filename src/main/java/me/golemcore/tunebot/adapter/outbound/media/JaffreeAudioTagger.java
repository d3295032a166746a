package me.golemcore.tunebot.adapter.outbound.media;

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

import com.github.kokorin.jaffree.JaffreeException;
import com.github.kokorin.jaffree.ffmpeg.FFmpeg;
import com.github.kokorin.jaffree.ffmpeg.UrlInput;
import com.github.kokorin.jaffree.ffmpeg.UrlOutput;
import com.github.kokorin.jaffree.ffprobe.FFprobe;
import com.github.kokorin.jaffree.ffprobe.FFprobeResult;
import com.github.kokorin.jaffree.ffprobe.Stream;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tunebot.domain.model.TrackTags;
import me.golemcore.tunebot.port.outbound.AudioTaggerPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Set;

/**
 * Audio tagging through FFmpeg (Jaffree).
 *
 * <p>
 * Tags are written by remuxing into a scratch file next to the target, with
 * streams copied, and moving it over the original. The scratch file keeps the
 * original base name so leftovers are recognizable by the same name pattern as
 * the download itself.
 *
 * <p>
 * Requires the ffmpeg and ffprobe binaries in the system PATH.
 */
@Component
@Slf4j
public class JaffreeAudioTagger implements AudioTaggerPort {

    private static final String SCRATCH_MARKER = ".tagging.";
    private static final Set<String> COVER_CONTAINERS = Set.of("m4a", "mp4", "mp3", "flac");
    private static final String SQUARE_CROP = "crop=min(iw\\,ih):min(iw\\,ih)";

    @Override
    public void embed(Path audioFile, TrackTags tags, Path cover) throws IOException {
        String extension = extensionOf(audioFile);
        Path scratch = scratchFileFor(audioFile);
        boolean withCover = cover != null && supportsCover(extension);

        UrlOutput output = UrlOutput.toPath(scratch)
                .addArguments("-map", "0:a")
                .addArguments("-map_metadata", "0")
                .addArguments("-c", "copy");
        if (withCover) {
            output.addArguments("-map", "1:v")
                    .addArguments("-disposition:v:0", "attached_pic");
            if ("mp3".equals(extension)) {
                output.addArguments("-id3v2_version", "3");
            }
        }
        addTag(output, "title", tags.title());
        addTag(output, "artist", tags.artist());
        addTag(output, "album", tags.album());
        addTag(output, "date", tags.year());

        FFmpeg ffmpeg = FFmpeg.atPath()
                .addInput(UrlInput.fromPath(audioFile))
                .setOverwriteOutput(true);
        if (withCover) {
            ffmpeg.addInput(UrlInput.fromPath(cover));
        }
        try {
            ffmpeg.addOutput(output).execute();
            Files.move(scratch, audioFile, StandardCopyOption.REPLACE_EXISTING);
            log.debug("[Tagger] Tagged {} (cover={})", audioFile.getFileName(), withCover);
        } catch (JaffreeException e) {
            Files.deleteIfExists(scratch);
            throw new IOException("ffmpeg could not tag " + audioFile.getFileName() + ": " + e.getMessage(), e);
        } catch (IOException e) {
            Files.deleteIfExists(scratch);
            throw e;
        }
    }

    @Override
    public TrackTags readTags(Path audioFile) throws IOException {
        FFprobeResult result;
        try {
            result = FFprobe.atPath()
                    .setShowFormat(true)
                    .setShowStreams(true)
                    .setInput(audioFile)
                    .execute();
        } catch (JaffreeException e) {
            throw new IOException("ffprobe could not read " + audioFile.getFileName() + ": " + e.getMessage(), e);
        }
        return new TrackTags(
                tag(result, "title"),
                tag(result, "artist"),
                tag(result, "album"),
                tag(result, "date"));
    }

    @Override
    public void cropSquareCover(Path image, Path jpegTarget) throws IOException {
        try {
            FFmpeg.atPath()
                    .addInput(UrlInput.fromPath(image))
                    .setOverwriteOutput(true)
                    .addOutput(UrlOutput.toPath(jpegTarget)
                            .addArguments("-vf", SQUARE_CROP)
                            .addArguments("-frames:v", "1")
                            .addArguments("-q:v", "2"))
                    .execute();
        } catch (JaffreeException e) {
            Files.deleteIfExists(jpegTarget);
            throw new IOException("ffmpeg could not crop " + image.getFileName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean supportsCover(String extension) {
        return extension != null && COVER_CONTAINERS.contains(extension.toLowerCase(Locale.ROOT));
    }

    static Path scratchFileFor(Path audioFile) {
        String name = audioFile.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String scratchName = dot < 0
                ? name + SCRATCH_MARKER + "tmp"
                : name.substring(0, dot) + SCRATCH_MARKER + name.substring(dot + 1);
        return audioFile.resolveSibling(scratchName);
    }

    private static void addTag(UrlOutput output, String name, String value) {
        if (value != null && !value.isBlank()) {
            output.addArguments("-metadata", name + "=" + value);
        }
    }

    private static String tag(FFprobeResult result, String name) {
        String value = result.getFormat() != null ? tagOf(result.getFormat().getTag(name),
                result.getFormat().getTag(name.toUpperCase(Locale.ROOT))) : null;
        if (value != null || result.getStreams() == null) {
            return value;
        }
        for (Stream stream : result.getStreams()) {
            value = tagOf(stream.getTag(name), stream.getTag(name.toUpperCase(Locale.ROOT)));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String tagOf(String lower, String upper) {
        String value = lower != null ? lower : upper;
        return value != null && !value.isBlank() ? value : null;
    }

    private static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
