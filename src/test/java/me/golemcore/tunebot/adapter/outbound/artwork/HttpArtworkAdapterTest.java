package me.golemcore.tunebot.adapter.outbound.artwork;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class HttpArtworkAdapterTest {

    private MockWebServer mockServer;
    private HttpArtworkAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();
        adapter = new HttpArtworkAdapter(new OkHttpClient());
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    @Test
    void shouldReturnImageBytes() throws Exception {
        byte[] image = { (byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 0x00 };
        mockServer.enqueue(new MockResponse().setBody(new Buffer().write(image))
                .setHeader("Content-Type", "image/jpeg"));

        assertArrayEquals(image, adapter.fetch(mockServer.url("/cover.jpg").toString()));
        assertEquals("GET", mockServer.takeRequest().getMethod());
    }

    @Test
    void shouldFailOnHttpError() {
        mockServer.enqueue(new MockResponse().setResponseCode(404));

        IOException error = assertThrows(IOException.class,
                () -> adapter.fetch(mockServer.url("/missing.jpg").toString()));

        assertEquals("artwork request failed: HTTP 404", error.getMessage());
    }

    @Test
    void shouldRejectOversizedImage() {
        mockServer.enqueue(new MockResponse().setBody(new Buffer().write(new byte[11 * 1024 * 1024])));

        IOException error = assertThrows(IOException.class,
                () -> adapter.fetch(mockServer.url("/huge.jpg").toString()));

        assertTrue(error.getMessage().startsWith("artwork too large"));
    }
}
