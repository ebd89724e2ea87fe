package com.example.routines.docgen.preview;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Requested preview quality. Part of the cache key; the raster resolution
 * itself comes from the configured DPI.
 */
public enum PreviewQuality {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    ULTRA("ultra");

    private final String value;

    PreviewQuality(String value) {
        this.value = value;
    }

    public static Optional<PreviewQuality> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(q -> q.value.equals(normalized)).findFirst();
    }

    public String getValue() {
        return value;
    }
}
