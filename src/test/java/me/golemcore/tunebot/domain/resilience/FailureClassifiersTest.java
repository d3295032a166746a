package me.golemcore.tunebot.domain.resilience;

import me.golemcore.tunebot.port.outbound.DownloaderException;
import me.golemcore.tunebot.port.outbound.MetadataException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class FailureClassifiersTest {

    @Test
    void shouldClassifyMetadataReasons() {
        assertEquals(FailureKind.AUTHENTICATION_LOST, metadataKind(MetadataException.Reason.AUTHENTICATION));
        assertEquals(FailureKind.TRANSIENT_NETWORK, metadataKind(MetadataException.Reason.TRANSIENT));
        assertEquals(FailureKind.RATE_LIMITED, metadataKind(MetadataException.Reason.RATE_LIMITED));
        assertEquals(FailureKind.FATAL, metadataKind(MetadataException.Reason.NOT_FOUND));
        assertEquals(FailureKind.FATAL, metadataKind(MetadataException.Reason.INVALID));
    }

    @Test
    void shouldFindMetadataCauseDeepInChain() {
        RuntimeException wrapped = new RuntimeException("outer",
                new IllegalStateException("middle", new MetadataException(MetadataException.Reason.AUTHENTICATION,
                        "401")));

        assertEquals(FailureKind.AUTHENTICATION_LOST, MetadataFailureClassifier.classify(wrapped).kind());
    }

    @Test
    void shouldTreatIoErrorsAsTransient() {
        assertEquals(FailureKind.TRANSIENT_NETWORK,
                MetadataFailureClassifier.classify(new SocketTimeoutException("read timed out")).kind());
        assertEquals(FailureKind.TRANSIENT_NETWORK,
                MetadataFailureClassifier.classify(new IOException("connection reset")).kind());
        assertEquals(FailureKind.FATAL,
                MetadataFailureClassifier.classify(new IllegalArgumentException("bad")).kind());
    }

    @Test
    void shouldClassifyDownloaderLogTail() {
        assertEquals(FailureKind.RATE_LIMITED, downloaderKind("ERROR: HTTP Error 429: Too Many Requests"));
        assertEquals(FailureKind.TRANSIENT_NETWORK, downloaderKind("ERROR: HTTP Error 503: Service Unavailable"));
        assertEquals(FailureKind.TRANSIENT_NETWORK, downloaderKind("ERROR: Connection reset by peer"));
        assertEquals(FailureKind.FATAL, downloaderKind("ERROR: Video unavailable"));
    }

    @Test
    void shouldNotRetryDownloaderTimeout() {
        DownloaderException timedOut = new DownloaderException("timed out", -1, true, true, "HTTP Error 503");

        assertEquals(FailureKind.FATAL, DownloaderFailureClassifier.classify(timedOut).kind());
        assertEquals(FailureKind.FATAL, DownloaderFailureClassifier.classify(new IOException("x")).kind());
    }

    private static FailureKind metadataKind(MetadataException.Reason reason) {
        return MetadataFailureClassifier.classify(new MetadataException(reason, "test")).kind();
    }

    private static FailureKind downloaderKind(String tail) {
        return DownloaderFailureClassifier.classify(new DownloaderException("failed", 1, false, false, tail)).kind();
    }
}
