package com.example.khaznati_backend.dto.web;

import java.util.UUID;

public record FolderPatchRequest(String name, UUID parentId, Boolean moveToRoot) {
}
