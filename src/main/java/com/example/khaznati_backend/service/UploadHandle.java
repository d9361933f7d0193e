package com.example.khaznati_backend.service;

import java.util.UUID;

/**
 * Opaque reference to an upload in progress.
 */
public record UploadHandle(UUID id) {
    public static UploadHandle of(String id) {
        try {
            return new UploadHandle(UUID.fromString(id));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Malformed upload handle: " + id, e);
        }
    }
}
