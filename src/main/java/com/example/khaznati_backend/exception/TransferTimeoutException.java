package com.example.khaznati_backend.exception;

public class TransferTimeoutException extends StorageException {

    public TransferTimeoutException(String message) {
        super(message);
    }

    public TransferTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
