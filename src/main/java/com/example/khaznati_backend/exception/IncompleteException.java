package com.example.khaznati_backend.exception;

/** The stored chunk set does not match the expected count, size or checksum. */
public class IncompleteException extends StorageException {

    public IncompleteException(String message) {
        super(message);
    }
}
