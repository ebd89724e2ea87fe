package com.example.routines.docgen.preview;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a preview request. {@code data} is a {@code byte[]} for PDF and
 * raster formats, a {@code String} for HTML and a map for JSON.
 */
@Value
@Builder
public class PreviewResult {
    boolean success;
    Object data;
    /** Null when the requested format is not supported. */
    PreviewFormat format;
    long sizeBytes;
    long generationTimeMillis;
    boolean cacheHit;
    String errorMessage;

    public byte[] getBytes() {
        return data instanceof byte[] ? (byte[]) data : null;
    }
}
