package com.example.abac.common.util;

import org.springframework.lang.NonNull;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Cache key helpers shared by the in-memory and Redis caches.
 */
public final class CacheKeyUtils {

    private CacheKeyUtils() {}

    /**
     * @throws IllegalArgumentException if key is null or blank
     */
    @NonNull
    public static String requireKey(@NonNull String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Cache key cannot be null or blank");
        }
        return key;
    }

    /**
     * URL-encodes the key so it holds no delimiter, whitespace or control character.
     * The encoding is reversible, so distinct keys never share an entry.
     *
     * @throws IllegalArgumentException if key is null or blank
     */
    @NonNull
    public static String encode(@NonNull String key) {
        return URLEncoder.encode(requireKey(key), StandardCharsets.UTF_8);
    }

    /**
     * Full key as stored in a shared cache: {@code <cacheName>:<encoded key>}.
     */
    @NonNull
    public static String qualify(@NonNull String cacheName, @NonNull String key) {
        return cacheName + ":" + encode(key);
    }
}
