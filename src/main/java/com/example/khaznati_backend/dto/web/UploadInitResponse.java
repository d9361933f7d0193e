package com.example.khaznati_backend.dto.web;

import java.util.UUID;

public record UploadInitResponse(UUID uploadId, String state, int chunkSizeBytes) {
}
