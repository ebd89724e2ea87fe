package com.example.routines.docgen.preview;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum PreviewFormat {
    PDF("pdf", "application/pdf"),
    IMAGE("image", "image/png"),
    THUMBNAIL("thumbnail", "image/png"),
    HTML("html", "text/html"),
    JSON("json", "application/json");

    private final String value;
    private final String mimeType;

    PreviewFormat(String value, String mimeType) {
        this.value = value;
        this.mimeType = mimeType;
    }

    public static Optional<PreviewFormat> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(f -> f.value.equals(normalized)).findFirst();
    }

    public String getValue() {
        return value;
    }

    public String getMimeType() {
        return mimeType;
    }

    public boolean isRaster() {
        return this == IMAGE || this == THUMBNAIL;
    }
}
