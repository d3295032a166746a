package me.golemcore.tunebot.domain.resilience;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ResilientCallExecutorTest {

    private static final String CALL = "test.call";

    private ResilientCallExecutor executor;

    @BeforeEach
    void setUp() {
        executor = spy(new ResilientCallExecutor());
        doNothing().when(executor).sleepForRetry(any());
    }

    private static RetryPolicy policy(int maxAttempts, FailureClassifier classifier) {
        return RetryPolicy.builder()
                .maxAttempts(maxAttempts)
                .initialBackoff(Duration.ofMillis(100))
                .maxBackoff(Duration.ofSeconds(2))
                .classifier(classifier)
                .build();
    }

    private static FailureClassifier always(FailureKind kind) {
        return error -> FailureClassification.of(kind);
    }

    @Test
    void shouldReturnResultWithoutRetryOnSuccess() {
        String result = executor.execute(CALL, policy(3, always(FailureKind.FATAL)), () -> "ok");

        assertEquals("ok", result);
        verify(executor, never()).sleepForRetry(any());
    }

    @Test
    void shouldRetryTransientFailureUntilSuccess() {
        AtomicInteger attempts = new AtomicInteger();

        String result = executor.execute(CALL, policy(3, always(FailureKind.TRANSIENT_NETWORK)), () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IOException("connection reset");
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, attempts.get());
        verify(executor).sleepForRetry(Duration.ofMillis(100));
        verify(executor).sleepForRetry(Duration.ofMillis(200));
    }

    @Test
    void shouldSurfaceRetriesExhaustedAfterBudget() {
        AtomicInteger attempts = new AtomicInteger();

        OperationFailedException error = assertThrows(OperationFailedException.class,
                () -> executor.execute(CALL, policy(3, always(FailureKind.TRANSIENT_NETWORK)), () -> {
                    attempts.incrementAndGet();
                    throw new IOException("timeout");
                }));

        assertEquals(FailureKind.RETRIES_EXHAUSTED, error.getKind());
        assertEquals(3, attempts.get());
        assertInstanceOf(IOException.class, error.getCause());
    }

    @Test
    void shouldNotRetryFatalFailure() {
        AtomicInteger attempts = new AtomicInteger();

        OperationFailedException error = assertThrows(OperationFailedException.class,
                () -> executor.execute(CALL, policy(5, always(FailureKind.FATAL)), () -> {
                    attempts.incrementAndGet();
                    throw new IllegalArgumentException("bad input");
                }));

        assertEquals(FailureKind.FATAL, error.getKind());
        assertEquals(1, attempts.get());
        verify(executor, never()).sleepForRetry(any());
    }

    @Test
    void shouldHonourRetryAfterCappedByMaxBackoff() {
        AtomicInteger attempts = new AtomicInteger();
        FailureClassifier rateLimited = error -> FailureClassification.rateLimited(Duration.ofSeconds(60));

        executor.execute(CALL, policy(3, rateLimited), () -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IOException("429");
            }
            return "ok";
        });

        verify(executor).sleepForRetry(Duration.ofSeconds(2));
    }

    @Test
    void shouldReauthenticateOnceAndRetry() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        Reauthenticator reauthenticator = mock(Reauthenticator.class);
        RetryPolicy policy = policy(1, always(FailureKind.AUTHENTICATION_LOST)).withReauthenticator(reauthenticator);

        String result = executor.execute(CALL, policy, () -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IOException("401");
            }
            return "ok";
        });

        assertEquals("ok", result);
        verify(reauthenticator, times(1)).reauthenticate();
    }

    @Test
    void shouldFailWhenAuthenticationLostTwice() throws Exception {
        Reauthenticator reauthenticator = mock(Reauthenticator.class);
        RetryPolicy policy = policy(3, always(FailureKind.AUTHENTICATION_LOST)).withReauthenticator(reauthenticator);

        OperationFailedException error = assertThrows(OperationFailedException.class,
                () -> executor.execute(CALL, policy, () -> {
                    throw new IOException("403");
                }));

        assertEquals(FailureKind.AUTHENTICATION_FAILED, error.getKind());
        verify(reauthenticator, times(1)).reauthenticate();
    }

    @Test
    void shouldFailImmediatelyOnAuthenticationLostWithoutReauthenticator() {
        OperationFailedException error = assertThrows(OperationFailedException.class,
                () -> executor.execute(CALL, policy(3, always(FailureKind.AUTHENTICATION_LOST)), () -> {
                    throw new IOException("401");
                }));

        assertEquals(FailureKind.AUTHENTICATION_FAILED, error.getKind());
    }

    @Test
    void shouldReportFailedReauthentication() throws Exception {
        Reauthenticator reauthenticator = mock(Reauthenticator.class);
        doThrow(new IOException("no network")).when(reauthenticator).reauthenticate();
        RetryPolicy policy = policy(3, always(FailureKind.AUTHENTICATION_LOST)).withReauthenticator(reauthenticator);

        OperationFailedException error = assertThrows(OperationFailedException.class,
                () -> executor.execute(CALL, policy, () -> {
                    throw new IOException("401");
                }));

        assertEquals(FailureKind.AUTHENTICATION_FAILED, error.getKind());
    }

    @Test
    void shouldMapInterruptionToCancelled() {
        OperationFailedException error = assertThrows(OperationFailedException.class,
                () -> executor.execute(CALL, policy(3, always(FailureKind.TRANSIENT_NETWORK)), () -> {
                    throw new InterruptedException();
                }));

        assertEquals(FailureKind.CANCELLED, error.getKind());
        assertTrue(Thread.interrupted());
    }

    @Test
    void shouldPassThroughOperationFailedException() {
        OperationFailedException original = new OperationFailedException(FailureKind.DOWNLOAD_INCOMPLETE, "gone");

        OperationFailedException error = assertThrows(OperationFailedException.class,
                () -> executor.execute(CALL, policy(3, always(FailureKind.TRANSIENT_NETWORK)), () -> {
                    throw original;
                }));

        assertSame(original, error);
    }
}
