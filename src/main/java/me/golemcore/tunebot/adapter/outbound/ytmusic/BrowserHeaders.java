package me.golemcore.tunebot.adapter.outbound.ytmusic;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Browser request headers exported for YouTube Music (the
 * {@code headers_auth.json} format) and the {@code SAPISIDHASH} authorization
 * derived from their cookie.
 */
final class BrowserHeaders {

    static final String COOKIE = "cookie";
    static final String AUTHORIZATION = "authorization";

    private static final Set<String> DROPPED_HEADERS = Set.of(
            AUTHORIZATION, "content-length", "content-type", "host", "accept-encoding", "connection");
    private static final String[] SAPISID_COOKIES = { "SAPISID", "__Secure-3PAPISID" };
    private static final TypeReference<Map<String, String>> HEADER_MAP = new TypeReference<>() {
    };

    private BrowserHeaders() {
    }

    /**
     * Reads the header file, lower-casing names and dropping headers that are
     * recomputed per request.
     */
    static Map<String, String> load(Path file, ObjectMapper objectMapper) throws IOException {
        Map<String, String> raw = objectMapper.readValue(file.toFile(), HEADER_MAP);
        Map<String, String> headers = new LinkedHashMap<>();
        raw.forEach((name, value) -> {
            String key = name.toLowerCase(Locale.ROOT).trim();
            if (value != null && !DROPPED_HEADERS.contains(key)) {
                headers.put(key, value);
            }
        });
        return headers;
    }

    static String sapisid(String cookieHeader) {
        if (cookieHeader == null) {
            return null;
        }
        for (String wanted : SAPISID_COOKIES) {
            for (String cookie : cookieHeader.split(";")) {
                int eq = cookie.indexOf('=');
                if (eq > 0 && cookie.substring(0, eq).trim().equals(wanted)) {
                    return cookie.substring(eq + 1).trim();
                }
            }
        }
        return null;
    }

    static String sapisidHash(String sapisid, String origin, long epochSeconds) {
        try {
            MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            byte[] digest = sha1.digest((epochSeconds + " " + sapisid + " " + origin)
                    .getBytes(StandardCharsets.UTF_8));
            return "SAPISIDHASH " + epochSeconds + "_" + HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
