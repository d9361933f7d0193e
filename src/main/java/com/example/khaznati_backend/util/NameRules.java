package com.example.khaznati_backend.util;

/**
 * Validation of user supplied file and folder names.
 */
public final class NameRules {
    public static final int MAX_LENGTH = 255;

    private NameRules() {
    }

    /** Returns the trimmed name or throws {@link IllegalArgumentException}. */
    public static String requireValidName(String name, String what) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(what + " name is required");
        }
        String trimmed = name.trim();
        if (trimmed.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(what + " name is longer than " + MAX_LENGTH + " characters");
        }
        if (trimmed.indexOf('/') >= 0 || trimmed.indexOf('\\') >= 0 || trimmed.indexOf('\0') >= 0) {
            throw new IllegalArgumentException(what + " name must not contain '/', '\\' or NUL");
        }
        if (trimmed.equals(".") || trimmed.equals("..")) {
            throw new IllegalArgumentException(what + " name must not be '.' or '..'");
        }
        return trimmed;
    }
}
