package me.golemcore.tunebot.adapter.outbound.ytmusic;

import me.golemcore.tunebot.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BrowserHeadersTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLowerCaseNamesAndDropRecomputedHeaders() throws IOException {
        Path file = Files.writeString(tempDir.resolve("headers_auth.json"), """
                {
                  "Cookie": "SID=1; SAPISID=abc123",
                  "User-Agent": "Mozilla/5.0",
                  "Authorization": "SAPISIDHASH stale",
                  "Content-Length": "120",
                  "X-Goog-Visitor-Id": "visitor"
                }
                """);

        Map<String, String> headers = BrowserHeaders.load(file, AutoConfiguration.objectMapper());

        assertEquals(Map.of(
                "cookie", "SID=1; SAPISID=abc123",
                "user-agent", "Mozilla/5.0",
                "x-goog-visitor-id", "visitor"), headers);
    }

    @Test
    void shouldFailOnMalformedFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("broken.json"), "not json");

        assertThrows(IOException.class, () -> BrowserHeaders.load(file, AutoConfiguration.objectMapper()));
    }

    @Test
    void shouldExtractSapisidWithSecureFallback() {
        assertEquals("abc123", BrowserHeaders.sapisid("SID=1; SAPISID=abc123; HSID=2"));
        assertEquals("secure", BrowserHeaders.sapisid("SID=1; __Secure-3PAPISID=secure"));
        assertNull(BrowserHeaders.sapisid("SID=1; HSID=2"));
        assertNull(BrowserHeaders.sapisid(null));
    }

    @Test
    void shouldComputeSapisidHash() {
        assertEquals("SAPISIDHASH 1700000000_597a8411c1c01f9c14cea84b6ec377b76d93be6e",
                BrowserHeaders.sapisidHash("abc123", "https://music.youtube.com", 1_700_000_000L));
    }
}
