package com.example.routines.docgen.service;

import com.example.routines.docgen.config.CacheConfig;
import com.example.routines.docgen.config.EngineProperties;
import com.example.routines.docgen.expression.ExpressionResolver;
import com.example.routines.docgen.preview.PreviewCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;

import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CacheInspectionServiceTest {
    private CacheManager cacheManager;
    private ExpressionResolver expressionResolver;
    private PreviewCache previewCache;
    private CacheInspectionService service;

    @BeforeEach
    public void setUp() {
        EngineProperties properties = new EngineProperties();
        cacheManager = new CacheConfig().cacheManager();
        expressionResolver = new ExpressionResolver(properties);
        previewCache = new PreviewCache(properties, Clock.systemUTC());
        service = new CacheInspectionService(cacheManager, expressionResolver, previewCache);
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testTemplateCacheStats() {
        Cache cache = cacheManager.getCache(CacheConfig.TEMPLATE_CONFIGS);
        cache.put("routine-weekly", "template");
        cache.get("routine-weekly");
        cache.get("other");

        Map<String, Object> info = service.inspectCache(CacheConfig.TEMPLATE_CONFIGS);

        assertEquals(1L, info.get("estimatedSize"));
        Map<String, Object> stats = (Map<String, Object>) info.get("stats");
        assertEquals(1L, stats.get("hitCount"));
        assertEquals(1L, stats.get("missCount"));
    }

    @Test
    public void testUnknownCache() {
        assertEquals("Cache not found", service.inspectCache("nope").get("error"));
    }

    @Test
    public void testExpressionAndPreviewCaches() {
        expressionResolver.resolve("{{ a }}", Collections.singletonMap("a", 1));
        previewCache.put("k", new byte[]{1, 2}, 2, 60);

        assertEquals(1, service.inspectCache(CacheInspectionService.EXPRESSION_CACHE).get("size"));
        Map<?, ?> previewStats = (Map<?, ?>) service.inspectCache(CacheInspectionService.PREVIEW_CACHE).get("stats");
        assertEquals(1, previewStats.get("size"));

        List<Map<String, Object>> all = service.inspectAllCaches();
        assertEquals(3, all.size());
    }
}
