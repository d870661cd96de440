package com.assessrec.recommendation.service;

import com.assessrec.recommendation.model.RecommendationResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Least-recently-used cache of ranking results keyed by the exact query text. Entries expire after
 * the configured TTL; once full, the entry used longest ago is evicted.
 */
@Service
public class RecommendationCacheService {

    private final boolean enabled;
    private final long ttlMillis;
    private final int maxEntries;
    private final LongSupplier clock;
    private final LinkedHashMap<String, CachedResult> entries;

    @Autowired
    public RecommendationCacheService(
            @Value("${recommendation.cache.enabled:true}") boolean enabled,
            @Value("${recommendation.cache.ttl-seconds:300}") long ttlSeconds,
            @Value("${recommendation.cache.max-entries:5000}") int maxEntries
    ) {
        this(enabled, ttlSeconds, maxEntries, System::currentTimeMillis);
    }

    public RecommendationCacheService(boolean enabled, long ttlSeconds, int maxEntries, LongSupplier clock) {
        this.enabled = enabled;
        this.ttlMillis = Math.max(1L, ttlSeconds) * 1000L;
        this.maxEntries = Math.max(1, maxEntries);
        this.clock = clock;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CachedResult> eldest) {
                return size() > RecommendationCacheService.this.maxEntries;
            }
        };
    }

    public synchronized RecommendationResult get(String query) {
        if (!enabled || query == null) {
            return null;
        }
        CachedResult cached = entries.get(query);
        if (cached == null) {
            return null;
        }
        if (cached.expiresAtMillis() <= clock.getAsLong()) {
            entries.remove(query);
            return null;
        }
        return cached.result();
    }

    public synchronized void put(String query, RecommendationResult result) {
        if (!enabled || query == null || result == null) {
            return;
        }
        entries.put(query, new CachedResult(result, clock.getAsLong() + ttlMillis));
    }

    /** Number of entries held, expired ones included until they are next looked up or evicted. */
    public synchronized int size() {
        return entries.size();
    }

    private record CachedResult(RecommendationResult result, long expiresAtMillis) {
    }
}
