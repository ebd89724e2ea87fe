package com.example.routines.docgen.service;

import com.example.routines.docgen.expression.ExpressionResolver;
import com.example.routines.docgen.preview.PreviewCache;
import com.example.routines.docgen.util.BoundedCache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only statistics of the engine's caches: the Spring/Caffeine template
 * cache, the compiled expression cache and the preview cache.
 */
@Service
@RequiredArgsConstructor
public class CacheInspectionService {
    public static final String EXPRESSION_CACHE = "compiledExpressions";
    public static final String PREVIEW_CACHE = "previews";

    private final CacheManager cacheManager;
    private final ExpressionResolver expressionResolver;
    private final PreviewCache previewCache;

    public Map<String, Object> inspectCache(String cacheName) {
        if (EXPRESSION_CACHE.equals(cacheName)) {
            return inspectExpressionCache();
        }
        if (PREVIEW_CACHE.equals(cacheName)) {
            return inspectPreviewCache();
        }

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("cacheName", cacheName);

        Cache cache = cacheManager.getCache(cacheName);
        if (cache == null) {
            out.put("error", "Cache not found");
            return out;
        }

        out.put("springCacheClass", cache.getClass().getName());

        if (cache instanceof CaffeineCache) {
            com.github.benmanes.caffeine.cache.Cache<Object, Object> nativeCache =
                    ((CaffeineCache) cache).getNativeCache();

            out.put("estimatedSize", nativeCache.estimatedSize());
            out.put("keys", nativeCache.asMap().keySet());

            CacheStats stats = nativeCache.stats();
            Map<String, Object> statsMap = new LinkedHashMap<>();
            statsMap.put("hitCount", stats.hitCount());
            statsMap.put("missCount", stats.missCount());
            statsMap.put("evictionCount", stats.evictionCount());
            statsMap.put("hitRate", stats.hitRate());
            out.put("stats", statsMap);
        } else {
            out.put("message", "Cache is not a CaffeineCache; native inspection unavailable");
        }

        return out;
    }

    public Map<String, Object> inspectExpressionCache() {
        BoundedCache<String, ?> compiled = expressionResolver.getCompiledCache();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("cacheName", EXPRESSION_CACHE);
        out.put("size", compiled.size());
        out.put("maxEntries", compiled.getMaxEntries());
        out.put("evictionCount", compiled.getEvictionCount());
        return out;
    }

    public Map<String, Object> inspectPreviewCache() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("cacheName", PREVIEW_CACHE);
        out.put("stats", previewCache.stats());
        return out;
    }

    public List<Map<String, Object>> inspectAllCaches() {
        List<Map<String, Object>> list = new ArrayList<>();
        for (String name : cacheManager.getCacheNames()) {
            list.add(inspectCache(name));
        }
        list.add(inspectExpressionCache());
        list.add(inspectPreviewCache());
        return list;
    }
}
