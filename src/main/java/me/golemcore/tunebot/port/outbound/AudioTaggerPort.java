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

import me.golemcore.tunebot.domain.model.TrackTags;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes and reads audio file tags and prepares cover pictures.
 */
public interface AudioTaggerPort {

    /**
     * Rewrites the file in place with the given tags and, when {@code cover} is
     * not {@code null}, an attached cover picture.
     */
    void embed(Path audioFile, TrackTags tags, Path cover) throws IOException;

    TrackTags readTags(Path audioFile) throws IOException;

    /**
     * Center-crops an image to a square and writes it as JPEG.
     */
    void cropSquareCover(Path image, Path jpegTarget) throws IOException;

    /**
     * Whether the container of the given extension can carry an attached
     * picture.
     */
    boolean supportsCover(String extension);
}
