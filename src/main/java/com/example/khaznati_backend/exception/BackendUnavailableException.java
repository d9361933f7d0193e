package com.example.khaznati_backend.exception;

/**
 * Connection or authentication failure against the object backend. Transport level failures are
 * retryable, configuration and authentication failures are not.
 */
public class BackendUnavailableException extends StorageException {
    private final boolean retryable;

    public BackendUnavailableException(String message) {
        this(message, null, false);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public BackendUnavailableException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    @Override
    public boolean isRetryable() {
        return retryable;
    }
}
