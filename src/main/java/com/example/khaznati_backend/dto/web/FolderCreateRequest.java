package com.example.khaznati_backend.dto.web;

import jakarta.validation.constraints.NotBlank;

import java.util.UUID;

public record FolderCreateRequest(@NotBlank String name, UUID parentId) {
}
