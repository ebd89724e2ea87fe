package com.example.routines.docgen.model;

import com.example.routines.docgen.util.Values;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw page geometry directives. Values stay unconverted here; the unit
 * helper turns them into points when a document is laid out.
 */
@Value
@Builder
public class PageLayout {
    public static final Object DEFAULT_MARGIN = 20;

    String pageSize;
    String orientation;
    Map<String, Object> margins;

    public static PageLayout from(Object raw) {
        Map<String, Object> map = Values.asMap(raw);
        Object size = map.get("page_size");
        Object orientation = map.get("orientation");
        return PageLayout.builder()
                .pageSize(size == null ? "A4" : Values.asString(size))
                .orientation(orientation == null ? "portrait" : Values.asString(orientation))
                .margins(new LinkedHashMap<>(Values.asMap(map.get("margins"))))
                .build();
    }

    public boolean isLandscape() {
        return "landscape".equalsIgnoreCase(orientation.trim());
    }

    public Object margin(String side) {
        Object value = margins.get(side);
        return value == null ? DEFAULT_MARGIN : value;
    }
}
