package com.example.khaznati_backend.dto.web;

import com.example.khaznati_backend.service.LifecycleManager;

import java.util.List;
import java.util.UUID;

public record DeleteReportResponse(UUID fileId, int chunksTotal, int chunksDeleted, List<Integer> failedChunks) {
    public static DeleteReportResponse from(LifecycleManager.DeleteReport report) {
        return new DeleteReportResponse(report.fileId(), report.chunksTotal(), report.chunksDeleted(),
                report.failures().stream().map(LifecycleManager.ChunkFailure::sequenceIndex).toList());
    }
}
