package com.example.abac.common.util;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.regex.Pattern;

public final class StringSanitizer {

    private static final Pattern SAFE_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_@.-]{1,128}$");
    private static final int DEFAULT_LOG_MAX_LENGTH = 64;
    private static final int DEFAULT_HEADER_MAX_LENGTH = 256;

    private StringSanitizer() {}

    @NonNull
    public static String forLog(@Nullable String value) {
        return forLog(value, DEFAULT_LOG_MAX_LENGTH);
    }

    @NonNull
    public static String forLog(@Nullable String value, int maxLength) {
        if (value == null) {
            return "null";
        }
        String sanitized = stripControl(value);
        return sanitized.substring(0, Math.min(sanitized.length(), maxLength));
    }

    /**
     * Strips control characters and truncates, appending an ellipsis when cut.
     */
    @Nullable
    public static String truncate(@Nullable String value, int maxLength) {
        if (value == null) {
            return null;
        }
        String sanitized = stripControl(value);
        if (sanitized.length() > maxLength) {
            return sanitized.substring(0, maxLength) + "...";
        }
        return sanitized;
    }

    @Nullable
    public static String headerValue(@Nullable String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() > DEFAULT_HEADER_MAX_LENGTH) {
            return trimmed.substring(0, DEFAULT_HEADER_MAX_LENGTH);
        }
        return trimmed;
    }

    /**
     * Subject ids arrive in a trusted header but still end up in cache keys and logs.
     */
    public static boolean isValidSubjectId(@Nullable String subjectId) {
        if (subjectId == null || subjectId.isBlank()) {
            return false;
        }
        return SAFE_ID_PATTERN.matcher(subjectId).matches();
    }

    private static String stripControl(String value) {
        return value
                .replace("\n", "")
                .replace("\r", "")
                .replace("\t", "");
    }
}
