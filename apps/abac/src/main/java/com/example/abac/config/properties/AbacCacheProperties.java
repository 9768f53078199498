package com.example.abac.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Cache configuration bound from {@code abac.cache.*}.
 * {@code type} selects Caffeine ({@code memory}, the default) or Redis ({@code redis}).
 */
@ConfigurationProperties(prefix = "abac.cache")
public record AbacCacheProperties(
        String type,
        CacheConfig policies,
        CacheConfig subjects,
        int maxEntries
) {
    public static final String POLICY_CACHE = "abac:policies";
    public static final String SUBJECT_CACHE = "abac:subject";

    /**
     * Single key the whole active policy set is stored under.
     */
    public static final String POLICY_SET_KEY = "abac_policies";

    public AbacCacheProperties {
        if (type == null || type.isBlank()) {
            type = "memory";
        }
        if (policies == null) {
            policies = new CacheConfig(Duration.ofMinutes(10));
        }
        if (subjects == null) {
            subjects = new CacheConfig(Duration.ofMinutes(30));
        }
        if (maxEntries <= 0) {
            maxEntries = 1000;
        }
    }

    public record CacheConfig(Duration ttl) {
        public CacheConfig {
            if (ttl == null) {
                ttl = Duration.ofMinutes(10);
            }
        }
    }

    public static AbacCacheProperties defaults() {
        return new AbacCacheProperties(null, null, null, 0);
    }
}
