package com.example.khaznati_backend.exception;

import java.time.Duration;

/**
 * The backend is in a cooldown window. Callers must not retry before {@link #getRetryAfter()} has elapsed.
 */
public class ThrottledException extends StorageException {
    private final Duration retryAfter;

    public ThrottledException(String backend, Duration retryAfter) {
        super("Backend " + backend + " throttled, retry after " + retryAfter.toSeconds() + "s");
        this.retryAfter = retryAfter.isNegative() ? Duration.ZERO : retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
