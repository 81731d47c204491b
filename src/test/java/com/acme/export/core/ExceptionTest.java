package com.acme.export.core;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ExceptionTest {

    @Test
    void testPermanentException() {
        PermanentException ex = new PermanentException("Permanent error");
        assertEquals("Permanent error", ex.getMessage());
        assertTrue(ex instanceof RuntimeException);
        assertEquals(FailureKind.PERMANENT, Failures.classify(ex));
    }

    @Test
    void testTransientException() {
        TransientException ex = new TransientException("Transient error");
        assertEquals("Transient error", ex.getMessage());
        assertTrue(ex instanceof RuntimeException);
        assertEquals(FailureKind.TRANSIENT, Failures.classify(ex));
    }

    @Test
    void testRateLimitedException() {
        RateLimitedException ex = new RateLimitedException("429", Duration.ofSeconds(3));
        assertTrue(ex instanceof TransientException);
        assertEquals(FailureKind.RATE_LIMITED, Failures.classify(ex));
        assertEquals(Duration.ofSeconds(3), Failures.retryAfter(ex));
        assertTrue(new RateLimitedException("429").retryAfter().isEmpty());
    }

    @Test
    void testCorruptStateExceptionCarriesPath() {
        Path path = Path.of("state", "export-state.json");
        CorruptStateException ex = new CorruptStateException(path, "Not JSON", null);
        assertEquals(path, ex.getPath());
        assertTrue(ex.getMessage().contains("Not JSON"));
        assertTrue(ex.getMessage().contains("export-state.json"));
    }

    @Test
    void testTimeoutsAndIoErrorsAreTransient() {
        assertEquals(FailureKind.TRANSIENT, Failures.classify(new TimeoutException()));
        assertEquals(FailureKind.TRANSIENT, Failures.classify(new IOException("disk full")));
        assertEquals(FailureKind.TRANSIENT, Failures.classify(new UncheckedIOException(new IOException("disk full"))));
    }

    @Test
    void testUnknownErrorsArePermanent() {
        assertEquals(FailureKind.PERMANENT, Failures.classify(new IllegalStateException("bad markup")));
        assertEquals(FailureKind.PERMANENT, Failures.classify(new NumberFormatException("x")));
    }

    @Test
    void testClassifyUnwrapsExecutionException() {
        var wrapped = new ExecutionException(new RateLimitedException("slow down"));
        assertEquals(FailureKind.RATE_LIMITED, Failures.classify(wrapped));
        assertEquals("slow down", Failures.describe(wrapped));
    }

    @Test
    void testDescribeFallsBackToTypeName() {
        assertEquals("TimeoutException", Failures.describe(new TimeoutException()));
    }
}
