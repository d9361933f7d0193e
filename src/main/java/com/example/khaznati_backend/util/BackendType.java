package com.example.khaznati_backend.util;

import java.util.Locale;

public enum BackendType {
    LOCAL,
    TELEGRAM,
    S3;

    public static BackendType fromProperty(String value) {
        if (value == null || value.isBlank()) {
            return LOCAL;
        }
        return BackendType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
