package com.acme.export.core;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

public final class Failures {

    private Failures() {
    }

    public static FailureKind classify(Throwable t) {
        Throwable e = unwrap(t);
        if (e instanceof RateLimitedException) {
            return FailureKind.RATE_LIMITED;
        }
        if (e instanceof TransientException
                || e instanceof TimeoutException
                || e instanceof IOException
                || e instanceof UncheckedIOException) {
            return FailureKind.TRANSIENT;
        }
        return FailureKind.PERMANENT;
    }

    public static Duration retryAfter(Throwable t) {
        return unwrap(t) instanceof RateLimitedException r ? r.retryAfter().orElse(null) : null;
    }

    public static String describe(Throwable t) {
        Throwable e = unwrap(t);
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    static Throwable unwrap(Throwable t) {
        Throwable e = t;
        while ((e instanceof ExecutionException || e instanceof CompletionException) && e.getCause() != null) {
            e = e.getCause();
        }
        return e;
    }
}
