package com.example.khaznati_backend.exception;

/** A file, folder, chunk, share link or backend locator does not exist (or is not visible to the caller). */
public class NotFoundException extends StorageException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
