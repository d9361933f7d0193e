package com.example.khaznati_backend.dto.web;

import com.example.khaznati_backend.service.LifecycleManager;

import java.util.UUID;

public record FolderDeleteResponse(UUID folderId, int foldersDeleted, int filesDeleted, int orphanedChunks) {
    public static FolderDeleteResponse from(LifecycleManager.FolderDeleteReport report) {
        return new FolderDeleteResponse(report.folderId(), report.foldersDeleted(), report.files().size(),
                report.orphanedChunks());
    }
}
