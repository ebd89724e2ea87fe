package com.example.routines.docgen.model;

import com.example.routines.docgen.util.Values;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One typed content block of a page. {@code content} is kept as supplied
 * (a string for simple text sections, a map otherwise).
 */
@Value
@Builder
public class Section {
    SectionType type;
    String rawType;
    Object content;
    Map<String, Object> attributes;

    public static Section from(Object raw) {
        Map<String, Object> map = Values.asMap(raw);
        Object type = map.get("type");
        return Section.builder()
                .type(SectionType.fromValue(type))
                .rawType(type == null ? "" : Values.asString(type))
                .content(map.get("content"))
                .attributes(Collections.unmodifiableMap(new LinkedHashMap<>(map)))
                .build();
    }

    public Map<String, Object> contentMap() {
        return Values.asMap(content);
    }

    /**
     * Looks a setting up in {@code content} first, then on the section itself.
     */
    public Object get(String key) {
        Map<String, Object> c = contentMap();
        if (c.containsKey(key)) {
            return c.get(key);
        }
        return attributes.get(key);
    }

    public Object get(String key, Object fallback) {
        Object value = get(key);
        return value == null ? fallback : value;
    }
}
