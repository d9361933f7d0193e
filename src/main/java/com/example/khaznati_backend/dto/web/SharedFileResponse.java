package com.example.khaznati_backend.dto.web;

public record SharedFileResponse(String name, long sizeBytes, String mimeType) {
}
