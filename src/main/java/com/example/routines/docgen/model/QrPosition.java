package com.example.routines.docgen.model;

import java.util.Locale;

/**
 * Where the template-level QR code is drawn.
 */
public enum QrPosition {
    /** Top-right margin corner of every page. */
    HEADER,
    /** Bottom-right margin corner of every page. */
    FOOTER,
    /** Once, at the end of the content flow. */
    INLINE,
    /** On a dedicated trailing page. */
    SEPARATE,
    NONE;

    /**
     * Normalises the configured position. Missing means inline, the
     * {@code separate_sheet}/{@code sheet} aliases mean separate and anything
     * unrecognised disables the overlay.
     */
    public static QrPosition fromValue(Object raw) {
        String value = raw == null ? "" : String.valueOf(raw).trim().toLowerCase(Locale.ROOT);
        switch (value) {
            case "":
            case "inline":
                return INLINE;
            case "header":
                return HEADER;
            case "footer":
                return FOOTER;
            case "separate":
            case "separate_sheet":
            case "sheet":
                return SEPARATE;
            default:
                return NONE;
        }
    }

    public boolean isOverlay() {
        return this == HEADER || this == FOOTER;
    }
}
