package com.example.khaznati_backend.dto.web;

import com.example.khaznati_backend.model.Folder;

import java.time.Instant;
import java.util.UUID;

public record FolderResponse(UUID id, String name, UUID parentId, Instant createdAt) {
    public static FolderResponse from(Folder f) {
        return new FolderResponse(f.getId(), f.getName(), f.getParentId(), f.getCreatedAt());
    }
}
