package me.golemcore.tunebot.adapter.outbound.artwork;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tunebot.port.outbound.ArtworkPort;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Downloads cover images over HTTP.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HttpArtworkAdapter implements ArtworkPort {

    private static final long MAX_IMAGE_BYTES = 10L * 1024 * 1024;

    private final OkHttpClient httpClient;

    @Override
    public byte[] fetch(String url) throws IOException {
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new IOException("artwork request failed: HTTP " + response.code());
            }
            if (body.contentLength() > MAX_IMAGE_BYTES) {
                throw new IOException("artwork too large: " + body.contentLength() + " bytes");
            }
            byte[] bytes = body.bytes();
            log.debug("[Artwork] Fetched {} bytes from {}", bytes.length, url);
            return bytes;
        }
    }
}
