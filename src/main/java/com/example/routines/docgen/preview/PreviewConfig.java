package com.example.routines.docgen.preview;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Preview request options. Format and quality stay plain strings so that an
 * unsupported value reaches the engine and comes back as a failed result.
 */
@Value
@Builder(toBuilder = true)
public class PreviewConfig {
    @Builder.Default
    String format = "pdf";
    @Builder.Default
    String quality = "medium";
    /** 1-based page rasterized for image previews. */
    @Builder.Default
    int pageNumber = 1;
    @Builder.Default
    int dpi = 150;
    @Builder.Default
    boolean useCache = true;
    /** Entry lifetime; null means the engine default. */
    Long cacheTtlSeconds;
    @Builder.Default
    boolean generateSampleData = true;

    public static PreviewConfig defaults() {
        return PreviewConfig.builder().build();
    }

    Map<String, Object> toKeyMap(long effectiveTtl) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("format", format);
        map.put("quality", quality);
        map.put("page_number", pageNumber);
        map.put("dpi", dpi);
        map.put("use_cache", useCache);
        map.put("cache_ttl", effectiveTtl);
        map.put("generate_sample_data", generateSampleData);
        return map;
    }
}
