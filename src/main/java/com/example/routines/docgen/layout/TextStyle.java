package com.example.routines.docgen.layout;

import java.awt.Color;
import java.util.Locale;

/**
 * Paragraph styles available to text sections.
 */
public enum TextStyle {
    NORMAL(10f, 12f, false, false, 0f, 0f, Color.BLACK),
    HEADER(18f, 21.6f, true, true, 0f, 6f, Color.BLACK),
    SECTION_HEADER(14f, 16.8f, true, false, 12f, 6f, Color.BLACK),
    SMALL(8f, 10f, false, false, 0f, 0f, Color.GRAY),
    JUSTIFY(10f, 12f, false, false, 0f, 0f, Color.BLACK);

    private final float fontSize;
    private final float leading;
    private final boolean bold;
    private final boolean centered;
    private final float spaceBefore;
    private final float spaceAfter;
    private final Color color;

    TextStyle(float fontSize, float leading, boolean bold, boolean centered,
              float spaceBefore, float spaceAfter, Color color) {
        this.fontSize = fontSize;
        this.leading = leading;
        this.bold = bold;
        this.centered = centered;
        this.spaceBefore = spaceBefore;
        this.spaceAfter = spaceAfter;
        this.color = color;
    }

    /**
     * Style by template name; unknown names fall back to {@link #NORMAL}.
     */
    public static TextStyle fromName(Object name) {
        if (name == null) {
            return NORMAL;
        }
        switch (String.valueOf(name).trim().toLowerCase(Locale.ROOT)) {
            case "header":
            case "title":
                return HEADER;
            case "section_header":
            case "subtitle":
                return SECTION_HEADER;
            case "small":
                return SMALL;
            case "justify":
                return JUSTIFY;
            default:
                return NORMAL;
        }
    }

    public float getFontSize() {
        return fontSize;
    }

    public float getLeading() {
        return leading;
    }

    public boolean isBold() {
        return bold;
    }

    public boolean isCentered() {
        return centered;
    }

    public float getSpaceBefore() {
        return spaceBefore;
    }

    public float getSpaceAfter() {
        return spaceAfter;
    }

    public Color getColor() {
        return color;
    }
}
