package com.example.khaznati_backend.exception;

public class TransferCancelledException extends StorageException {

    public TransferCancelledException(String message) {
        super(message);
    }
}
