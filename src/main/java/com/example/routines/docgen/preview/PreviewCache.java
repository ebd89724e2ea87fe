package com.example.routines.docgen.preview;

import com.example.routines.docgen.config.EngineProperties;
import com.example.routines.docgen.util.BoundedCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Content-addressed LRU cache of preview payloads with per-entry TTL.
 *
 * Expiry is checked lazily: an expired entry is dropped when looked up.
 */
@Slf4j
@Component
public class PreviewCache {
    private final BoundedCache<String, PreviewCacheEntry> entries;
    private final Clock clock;
    private final long defaultTtlSeconds;
    private long hits;
    private long misses;
    private long expirations;

    public PreviewCache(EngineProperties properties, Clock clock) {
        this.entries = new BoundedCache<>(Math.max(1, properties.getPreviewCacheMaxEntries()), true);
        this.clock = clock;
        this.defaultTtlSeconds = properties.getPreviewCacheTtlSeconds();
    }

    public synchronized Optional<PreviewCacheEntry> get(String key) {
        PreviewCacheEntry entry = entries.get(key);
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key);
            expirations++;
            misses++;
            log.debug("Preview cache entry {} expired", key);
            return Optional.empty();
        }
        hits++;
        return Optional.of(entry);
    }

    /**
     * Stores a payload; a TTL below one second is raised to one second.
     */
    public synchronized void put(String key, Object data, long sizeBytes, long ttlSeconds) {
        Instant expiresAt = clock.instant().plusSeconds(Math.max(1, ttlSeconds));
        entries.put(key, PreviewCacheEntry.of(key, data, sizeBytes, expiresAt));
    }

    public synchronized void clear() {
        entries.clear();
        log.info("Preview cache cleared");
    }

    public synchronized int size() {
        return entries.size();
    }

    public long getDefaultTtlSeconds() {
        return defaultTtlSeconds;
    }

    public int getMaxEntries() {
        return entries.getMaxEntries();
    }

    public synchronized Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("size", entries.size());
        stats.put("maxEntries", entries.getMaxEntries());
        stats.put("hitCount", hits);
        stats.put("missCount", misses);
        stats.put("evictionCount", entries.getEvictionCount());
        stats.put("expiredCount", expirations);
        stats.put("defaultTtlSeconds", defaultTtlSeconds);
        return stats;
    }
}
