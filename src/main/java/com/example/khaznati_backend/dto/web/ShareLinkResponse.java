package com.example.khaznati_backend.dto.web;

import com.example.khaznati_backend.model.ShareLink;

import java.time.Instant;
import java.util.UUID;

public record ShareLinkResponse(UUID id, UUID fileId, String token, Instant expiresAt, Integer maxDownloads,
                                int downloadCount, boolean active, Instant createdAt) {
    public static ShareLinkResponse from(ShareLink link) {
        return new ShareLinkResponse(link.getId(), link.getFile().getId(), link.getToken(), link.getExpiresAt(),
                link.getMaxDownloads(), link.getDownloadCount(), link.isActive(), link.getCreatedAt());
    }
}
