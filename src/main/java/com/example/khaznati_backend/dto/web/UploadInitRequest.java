package com.example.khaznati_backend.dto.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.UUID;

public record UploadInitRequest(
        @NotBlank String name,
        @PositiveOrZero Long size,
        UUID folderId,
        String mimeType,
        String checksum
) {
}
