package com.example.abac.cache;

import com.example.abac.common.util.CacheKeyUtils;
import com.example.abac.common.util.StringSanitizer;
import com.example.abac.config.properties.AbacCacheProperties;
import com.example.abac.model.SubjectAttributes;
import com.example.abac.observability.CacheMetricsService;
import com.example.abac.policy.PolicySnapshot;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import static com.example.abac.config.properties.AbacCacheProperties.POLICY_CACHE;
import static com.example.abac.config.properties.AbacCacheProperties.POLICY_SET_KEY;
import static com.example.abac.config.properties.AbacCacheProperties.SUBJECT_CACHE;

/**
 * Caffeine-backed cache for single-instance deployments.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "abac.cache.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryAbacCacheService implements AbacCacheOperations {

    private static final String CACHE_TYPE = "memory";

    private final Cache<String, PolicySnapshot> policyCache;
    private final Cache<String, SubjectAttributes> subjectCache;
    private final CacheMetricsService metricsService;

    public InMemoryAbacCacheService(AbacCacheProperties cacheProperties, CacheMetricsService metricsService) {
        this.metricsService = metricsService;

        this.policyCache = Caffeine.newBuilder()
                .expireAfterWrite(cacheProperties.policies().ttl())
                .maximumSize(1)
                .build();

        this.subjectCache = Caffeine.newBuilder()
                .expireAfterWrite(cacheProperties.subjects().ttl())
                .maximumSize(cacheProperties.maxEntries())
                .build();

        log.info("In-memory ABAC cache initialized (policy-ttl={}, subject-ttl={}, max-entries={})",
                cacheProperties.policies().ttl(), cacheProperties.subjects().ttl(), cacheProperties.maxEntries());
    }

    @Override
    @NonNull
    public Mono<PolicySnapshot> getOrLoadPolicies(@NonNull Mono<PolicySnapshot> loader) {
        return getOrLoad(POLICY_CACHE, policyCache, POLICY_SET_KEY, loader);
    }

    @Override
    @NonNull
    public Mono<SubjectAttributes> getOrLoadSubject(@NonNull String subjectId, @NonNull Mono<SubjectAttributes> loader) {
        return getOrLoad(SUBJECT_CACHE, subjectCache, subjectId, loader);
    }

    private <T> Mono<T> getOrLoad(String cacheName, Cache<String, T> cache, String key, Mono<T> loader) {
        return Mono.defer(() -> {
            String cacheKey = CacheKeyUtils.requireKey(key);
            T cached = cache.getIfPresent(cacheKey);
            if (cached != null) {
                log.debug("Cache hit for key: {}:{}", cacheName, StringSanitizer.forLog(cacheKey));
                metricsService.recordHit(cacheName, CACHE_TYPE);
                return Mono.just(cached);
            }

            metricsService.recordMiss(cacheName, CACHE_TYPE);
            return loader.doOnNext(value -> {
                log.debug("Cache miss for key: {}:{}, loading and caching", cacheName, StringSanitizer.forLog(cacheKey));
                cache.put(cacheKey, value);
                metricsService.updateSize(cacheName, CACHE_TYPE, cache.estimatedSize());
            });
        });
    }

    @Override
    @NonNull
    public Mono<Boolean> evictPolicies() {
        return evict(POLICY_CACHE, policyCache, POLICY_SET_KEY);
    }

    @Override
    @NonNull
    public Mono<Boolean> evictSubject(@NonNull String subjectId) {
        return evict(SUBJECT_CACHE, subjectCache, subjectId);
    }

    private <T> Mono<Boolean> evict(String cacheName, Cache<String, T> cache, String key) {
        return Mono.fromCallable(() -> {
            String cacheKey = CacheKeyUtils.requireKey(key);
            boolean present = cache.asMap().remove(cacheKey) != null;
            if (present) {
                metricsService.recordEviction(cacheName, CACHE_TYPE);
                metricsService.updateSize(cacheName, CACHE_TYPE, cache.estimatedSize());
                log.debug("Evicted cache entry: {}:{}", cacheName, StringSanitizer.forLog(cacheKey));
            }
            return present;
        });
    }
}
