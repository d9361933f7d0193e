package com.example.khaznati_backend.dto.web;

public record UsageResponse(long usedBytes, long quotaBytes, boolean unlimited) {
}
