package com.example.khaznati_backend.util;

import java.util.EnumSet;
import java.util.Set;

public enum UploadState {
    INITIATED,
    SPLITTING,
    UPLOADING,
    FINALIZING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(UploadState next) {
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return allowedNext().contains(next);
    }

    private Set<UploadState> allowedNext() {
        return switch (this) {
            case INITIATED -> EnumSet.of(SPLITTING);
            // empty files skip UPLOADING
            case SPLITTING -> EnumSet.of(UPLOADING, FINALIZING);
            case UPLOADING -> EnumSet.of(FINALIZING);
            case FINALIZING -> EnumSet.of(COMPLETED);
            default -> EnumSet.noneOf(UploadState.class);
        };
    }
}
