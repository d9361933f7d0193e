package com.example.khaznati_backend.dto.web;

import jakarta.validation.constraints.Positive;

public record ShareLinkRequest(@Positive Long expiresInHours, @Positive Integer maxDownloads) {
}
