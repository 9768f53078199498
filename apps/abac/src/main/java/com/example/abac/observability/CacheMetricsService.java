package com.example.abac.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer meters for the policy and subject caches, tagged by cache name and backend.
 */
@Slf4j
@Service
public class CacheMetricsService {

    private static final String METRIC_PREFIX = "abac.cache";
    private static final String TAG_CACHE_NAME = "cache";
    private static final String TAG_CACHE_TYPE = "type";

    private final MeterRegistry meterRegistry;
    private final Map<String, CacheMeters> meters = new ConcurrentHashMap<>();

    public CacheMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        log.info("Cache metrics service initialized");
    }

    public void recordHit(String cacheName, String cacheType) {
        metersFor(cacheName, cacheType).hits().increment();
    }

    public void recordMiss(String cacheName, String cacheType) {
        metersFor(cacheName, cacheType).misses().increment();
    }

    public void recordEviction(String cacheName, String cacheType) {
        metersFor(cacheName, cacheType).evictions().increment();
    }

    public void updateSize(String cacheName, String cacheType, long size) {
        metersFor(cacheName, cacheType).size().set(size);
    }

    /**
     * hits / (hits + misses), or 0 before the first lookup.
     */
    public double getHitRate(String cacheName, String cacheType) {
        CacheMeters cacheMeters = meters.get(key(cacheName, cacheType));
        if (cacheMeters == null) {
            return 0.0;
        }
        double hits = cacheMeters.hits().count();
        double total = hits + cacheMeters.misses().count();
        return total > 0 ? hits / total : 0.0;
    }

    private CacheMeters metersFor(String cacheName, String cacheType) {
        return meters.computeIfAbsent(key(cacheName, cacheType), k -> register(cacheName, cacheType));
    }

    private CacheMeters register(String cacheName, String cacheType) {
        Tags tags = Tags.of(TAG_CACHE_NAME, cacheName, TAG_CACHE_TYPE, cacheType);
        AtomicLong size = meterRegistry.gauge(METRIC_PREFIX + ".size", tags, new AtomicLong());
        log.debug("Registered meters for cache {}:{}", cacheName, cacheType);
        return new CacheMeters(
                counter("hits", "Number of cache hits", tags),
                counter("misses", "Number of cache misses", tags),
                counter("evictions", "Number of cache evictions", tags),
                size);
    }

    private Counter counter(String name, String description, Tags tags) {
        return Counter.builder(METRIC_PREFIX + "." + name)
                .description(description)
                .tags(tags)
                .register(meterRegistry);
    }

    private static String key(String cacheName, String cacheType) {
        return cacheName + ":" + cacheType;
    }

    private record CacheMeters(Counter hits, Counter misses, Counter evictions, AtomicLong size) {
    }
}
