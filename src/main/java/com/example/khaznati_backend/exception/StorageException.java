package com.example.khaznati_backend.exception;

/**
 * Base type for every failure raised by the storage pipeline.
 * <p>
 * {@link #isRetryable()} tells the transfer policy whether the same chunk operation may be attempted again.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isRetryable() {
        return false;
    }
}
