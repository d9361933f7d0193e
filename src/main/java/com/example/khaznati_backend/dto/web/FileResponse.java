package com.example.khaznati_backend.dto.web;

import com.example.khaznati_backend.model.StoredFile;

import java.time.Instant;
import java.util.UUID;

public record FileResponse(
        UUID id,
        String name,
        long sizeBytes,
        String mimeType,
        UUID folderId,
        String checksum,
        int chunkCount,
        boolean trashed,
        Instant trashedAt,
        Instant createdAt,
        Instant updatedAt
) {
    public static FileResponse from(StoredFile f) {
        return new FileResponse(f.getId(), f.getName(), f.getSizeBytes(), f.getMimeType(), f.getFolderId(),
                f.getChecksum(), f.getChunkCount(), f.isTrashed(), f.getTrashedAt(), f.getCreatedAt(), f.getUpdatedAt());
    }
}
