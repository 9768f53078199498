package com.example.abac.cache;

import com.example.abac.common.util.CacheKeyUtils;
import com.example.abac.config.properties.AbacCacheProperties;
import com.example.abac.model.SubjectAttributes;
import com.example.abac.observability.CacheMetricsService;
import com.example.abac.policy.PolicySnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;

import static com.example.abac.config.AbacCacheConfig.ABAC_CACHE_TEMPLATE;
import static com.example.abac.config.properties.AbacCacheProperties.POLICY_CACHE;
import static com.example.abac.config.properties.AbacCacheProperties.POLICY_SET_KEY;
import static com.example.abac.config.properties.AbacCacheProperties.SUBJECT_CACHE;

/**
 * Redis-backed cache shared by every instance. Staleness is bounded by TTL; concurrent
 * refreshes write the same authoritative data, so the last writer wins.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "abac.cache.type", havingValue = "redis")
public class RedisAbacCacheService implements AbacCacheOperations {

    private static final String CACHE_TYPE = "redis";

    private final ReactiveRedisTemplate<String, Object> redisTemplate;
    private final AbacCacheProperties cacheProperties;
    private final ObjectMapper objectMapper;
    private final CacheMetricsService metricsService;

    public RedisAbacCacheService(
            @Qualifier(ABAC_CACHE_TEMPLATE) ReactiveRedisTemplate<String, Object> redisTemplate,
            AbacCacheProperties cacheProperties,
            ObjectMapper objectMapper,
            CacheMetricsService metricsService) {
        this.redisTemplate = redisTemplate;
        this.cacheProperties = cacheProperties;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
    }

    @Override
    @NonNull
    public Mono<PolicySnapshot> getOrLoadPolicies(@NonNull Mono<PolicySnapshot> loader) {
        return getOrLoad(POLICY_CACHE, POLICY_SET_KEY, loader, PolicySnapshot.class, cacheProperties.policies().ttl());
    }

    @Override
    @NonNull
    public Mono<SubjectAttributes> getOrLoadSubject(@NonNull String subjectId, @NonNull Mono<SubjectAttributes> loader) {
        return getOrLoad(SUBJECT_CACHE, subjectId, loader, SubjectAttributes.class, cacheProperties.subjects().ttl());
    }

    private <T> Mono<T> getOrLoad(String cacheName, String key, Mono<T> loader, Class<T> type, Duration ttl) {
        String fullKey = CacheKeyUtils.qualify(cacheName, key);

        return redisTemplate.opsForValue().get(fullKey)
                .onErrorResume(cacheError -> {
                    log.warn("Cache unavailable for key {}, falling back to loader: {}", fullKey, cacheError.getMessage());
                    return Mono.empty();
                })
                .flatMap(cached -> {
                    try {
                        T value = objectMapper.convertValue(cached, type);
                        log.debug("Cache hit for key: {}", fullKey);
                        metricsService.recordHit(cacheName, CACHE_TYPE);
                        return Mono.just(value);
                    } catch (IllegalArgumentException e) {
                        log.warn("Failed to deserialize cached value for key {}, evicting corrupted entry", fullKey);
                        metricsService.recordEviction(cacheName, CACHE_TYPE);
                        return redisTemplate.delete(fullKey)
                                .onErrorResume(deleteError -> Mono.just(0L))
                                .then(Mono.<T>empty());
                    }
                })
                .switchIfEmpty(Mono.defer(() -> {
                    metricsService.recordMiss(cacheName, CACHE_TYPE);
                    return loader.flatMap(value -> {
                        log.debug("Cache miss for key: {}, loading and caching with TTL: {}", fullKey, ttl);
                        return redisTemplate.opsForValue()
                                .set(fullKey, value, ttl)
                                .thenReturn(value)
                                .onErrorResume(cacheWriteError -> {
                                    log.warn("Failed to write to cache for key {}: {}", fullKey, cacheWriteError.getMessage());
                                    return Mono.just(value);
                                });
                    });
                }));
    }

    @Override
    @NonNull
    public Mono<Boolean> evictPolicies() {
        return evict(POLICY_CACHE, POLICY_SET_KEY);
    }

    @Override
    @NonNull
    public Mono<Boolean> evictSubject(@NonNull String subjectId) {
        return evict(SUBJECT_CACHE, subjectId);
    }

    private Mono<Boolean> evict(String cacheName, String key) {
        String fullKey = CacheKeyUtils.qualify(cacheName, key);
        return redisTemplate.delete(fullKey)
                .map(count -> count > 0)
                .doOnNext(evicted -> {
                    if (evicted) {
                        metricsService.recordEviction(cacheName, CACHE_TYPE);
                        log.debug("Evicted cache entry: {}", fullKey);
                    }
                });
    }
}
