package com.example.khaznati_backend.exception;

import java.util.UUID;

public class QuotaExceededException extends StorageException {
    private final UUID ownerId;
    private final long requestedBytes;

    public QuotaExceededException(UUID ownerId, long requestedBytes, long usedBytes, long quotaBytes) {
        super("Storage quota exceeded owner=" + ownerId + " requested=" + requestedBytes
                + " used=" + usedBytes + " quota=" + quotaBytes);
        this.ownerId = ownerId;
        this.requestedBytes = requestedBytes;
    }

    public UUID getOwnerId() {
        return ownerId;
    }

    public long getRequestedBytes() {
        return requestedBytes;
    }
}
