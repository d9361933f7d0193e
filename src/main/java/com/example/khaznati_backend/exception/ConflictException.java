package com.example.khaznati_backend.exception;

/** Duplicate chunk index entry, duplicate sibling folder name or an illegal folder move. */
public class ConflictException extends StorageException {

    public ConflictException(String message) {
        super(message);
    }
}
