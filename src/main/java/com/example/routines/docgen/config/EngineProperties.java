package com.example.routines.docgen.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables of the rendering engine, bound from {@code docgen.engine.*}.
 */
@Data
@ConfigurationProperties(prefix = "docgen.engine")
public class EngineProperties {

    /** Largest decoded inline image accepted by image sections. */
    private int maxImageBytes = 600_000;

    /** Compiled expression cache capacity. */
    private int maxCompiledTemplates = 500;

    private int previewCacheMaxEntries = 200;

    private long previewCacheTtlSeconds = 3600;
}
