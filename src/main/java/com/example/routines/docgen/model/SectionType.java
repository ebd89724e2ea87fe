package com.example.routines.docgen.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Closed set of section kinds a page can contain. Anything the engine does not
 * recognise maps to {@link #UNKNOWN} so the rest of the template still renders.
 */
public enum SectionType {
    HEADER("header"),
    TEXT("text"),
    SPACING("spacing", "spacer"),
    TABLE("table"),
    EXERCISE_TABLE("exercise_table"),
    IMAGE("image"),
    QR_CODE("qr_code"),
    PAGE_BREAK("page_break"),
    EXCEL_HEADER("excel_header"),
    UNKNOWN();

    private final List<String> names;

    SectionType(String... names) {
        this.names = Arrays.asList(names);
    }

    public List<String> getNames() {
        return names;
    }

    public static SectionType fromValue(Object raw) {
        if (raw == null) {
            return UNKNOWN;
        }
        String value = String.valueOf(raw).trim().toLowerCase(Locale.ROOT);
        for (SectionType type : values()) {
            if (type.names.contains(value)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    /**
     * Every accepted type name, aliases included.
     */
    public static List<String> knownNames() {
        return Arrays.stream(values())
                .flatMap(t -> t.names.stream())
                .collect(Collectors.toList());
    }
}
