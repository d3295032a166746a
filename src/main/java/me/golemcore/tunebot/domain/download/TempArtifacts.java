package me.golemcore.tunebot.domain.download;

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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Files created or found during one download. {@link #cleanup()} removes all
 * of them, plus any file in the work directory carrying the operation token,
 * except the ones marked with {@link #keep(Path)}.
 */
@Slf4j
class TempArtifacts {

    private final Path workDir;
    private final String token;
    private final Set<Path> tracked = new LinkedHashSet<>();
    private final Set<Path> kept = new LinkedHashSet<>();

    TempArtifacts(Path workDir, String token) {
        this.workDir = workDir;
        this.token = token;
    }

    void track(Path path) {
        if (path != null) {
            tracked.add(path.toAbsolutePath().normalize());
        }
    }

    void keep(Path path) {
        kept.add(path.toAbsolutePath().normalize());
    }

    boolean carriesToken(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().contains(token);
    }

    /**
     * @return number of files removed
     */
    int cleanup() {
        Set<Path> doomed = new LinkedHashSet<>(tracked);
        if (Files.isDirectory(workDir)) {
            try (Stream<Path> files = Files.list(workDir)) {
                files.filter(Files::isRegularFile)
                        .filter(this::carriesToken)
                        .map(path -> path.toAbsolutePath().normalize())
                        .forEach(doomed::add);
            } catch (IOException e) {
                log.warn("[Download] Could not list {} for cleanup: {}", workDir, e.getMessage());
            }
        }
        doomed.removeAll(kept);

        int removed = 0;
        for (Path path : doomed) {
            try {
                if (Files.deleteIfExists(path)) {
                    removed++;
                }
            } catch (IOException e) {
                log.warn("[Download] Failed to remove temporary file {}: {}", path, e.getMessage());
            }
        }
        if (removed > 0) {
            log.debug("[Download] Removed {} temporary file(s) for token {}", removed, token);
        }
        return removed;
    }
}
