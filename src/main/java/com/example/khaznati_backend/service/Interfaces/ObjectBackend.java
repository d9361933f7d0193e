package com.example.khaznati_backend.service.Interfaces;

import com.example.khaznati_backend.util.ConnectionState;

/**
 * Stores opaque chunk payloads. Locators returned by {@link #put(byte[])} are only meaningful to the
 * backend that produced them.
 * <p>
 * Every call may block and fail with a {@link com.example.khaznati_backend.exception.StorageException}.
 * While the backend is cooling down {@code put} and {@code get} fail immediately with
 * {@link com.example.khaznati_backend.exception.ThrottledException}; waiting is the caller's decision.
 */
public interface ObjectBackend {

    /** Short identifier persisted with each file, e.g. {@code local} or {@code telegram}. */
    String name();

    /** Stores one chunk and returns its locator. Safe to retry: each call yields an independent locator. */
    String put(byte[] payload);

    /** Fetches one chunk; {@link com.example.khaznati_backend.exception.NotFoundException} if it is gone. */
    byte[] get(String locator);

    /** Removes one chunk. Removing an already removed locator is not an error. */
    void delete(String locator);

    default ConnectionState connectionState() {
        return ConnectionState.CONNECTED;
    }
}
