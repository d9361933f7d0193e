package com.example.khaznati_backend.dto.web;

import com.example.khaznati_backend.service.UploadCoordinator;

import java.util.UUID;

public record UploadStatusResponse(UUID uploadId, String state, int chunksStored, Integer expectedChunks,
                                   Long sizeBytes, UUID fileId, String error) {
    public static UploadStatusResponse from(UploadCoordinator.UploadStatus status) {
        return new UploadStatusResponse(status.handle(), status.state().name(), status.chunksStored(),
                status.expectedChunks(), status.sizeBytes(), status.fileId(), status.error());
    }
}
