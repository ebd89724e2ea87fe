package com.example.routines.docgen.layout;

import java.awt.Color;

public final class Colors {

    private Colors() {
    }

    /**
     * Parses {@code #rrggbb}/{@code rrggbb}; null for anything else.
     */
    public static Color parseHex(String hex) {
        if (hex == null) {
            return null;
        }
        String value = hex.trim();
        if (!value.startsWith("#")) {
            value = "#" + value;
        }
        if (value.length() != 7) {
            return null;
        }
        try {
            return Color.decode(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
