package com.example.khaznati_backend.dto.web;

import java.util.UUID;

/**
 * Partial update of a file. {@code moveToRoot=true} moves the file out of any folder.
 */
public record FilePatchRequest(String name, UUID folderId, Boolean moveToRoot) {
}
