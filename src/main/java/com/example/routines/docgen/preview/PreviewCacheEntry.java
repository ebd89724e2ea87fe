package com.example.routines.docgen.preview;

import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable cached payload. Byte arrays and JSON structures are copied on
 * the way in and out so cached values never alias caller state.
 */
@Value
public class PreviewCacheEntry {
    String key;
    Object data;
    long sizeBytes;
    Instant expiresAt;

    public static PreviewCacheEntry of(String key, Object data, long sizeBytes, Instant expiresAt) {
        return new PreviewCacheEntry(key, copy(data), sizeBytes, expiresAt);
    }

    public Object copyOfData() {
        return copy(data);
    }

    public boolean isExpired(Instant now) {
        return expiresAt.isBefore(now);
    }

    static Object copy(Object value) {
        if (value instanceof byte[]) {
            return ((byte[]) value).clone();
        }
        if (value instanceof Map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> copy.put(k, copy(v)));
            return copy;
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<?>) value) {
                copy.add(copy(item));
            }
            return copy;
        }
        return value;
    }
}
