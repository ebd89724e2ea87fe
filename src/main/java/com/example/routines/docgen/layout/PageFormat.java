package com.example.routines.docgen.layout;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Supported physical page sizes, portrait dimensions in points.
 */
public enum PageFormat {
    A4("A4", 595.27563f, 841.8898f),
    LETTER("Letter", 612f, 792f),
    LEGAL("Legal", 612f, 1008f);

    private final String displayName;
    private final float width;
    private final float height;

    PageFormat(String displayName, float width, float height) {
        this.displayName = displayName;
        this.width = width;
        this.height = height;
    }

    public static boolean isKnown(String name) {
        return name != null && Arrays.stream(values())
                .anyMatch(f -> f.name().equals(name.trim().toUpperCase(Locale.ROOT)));
    }

    /**
     * Case-insensitive lookup, A4 when unrecognised.
     */
    public static PageFormat resolve(String name) {
        return isKnown(name) ? valueOf(name.trim().toUpperCase(Locale.ROOT)) : A4;
    }

    public static List<String> displayNames() {
        return Arrays.stream(values()).map(PageFormat::getDisplayName).collect(Collectors.toList());
    }

    public String getDisplayName() {
        return displayName;
    }

    public float getWidth() {
        return width;
    }

    public float getHeight() {
        return height;
    }
}
