package com.example.routines.docgen.util;

import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Converts layout lengths to PDF points.
 *
 * Bare numbers and unsuffixed strings are millimetres; strings may carry a
 * {@code mm}, {@code cm}, {@code in} or {@code pt} suffix.
 */
public final class UnitConverter {
    public static final double POINTS_PER_INCH = 72d;
    public static final double POINTS_PER_MM = POINTS_PER_INCH / 25.4d;

    private UnitConverter() {
    }

    public static double mm(double millimetres) {
        return millimetres * POINTS_PER_MM;
    }

    /**
     * Length in points, {@code fallbackMm} when the value is absent and 0 when
     * it cannot be parsed.
     */
    public static double toPoints(Object value, double fallbackMm) {
        if (value == null) {
            return mm(fallbackMm);
        }
        return parse(value).orElse(0d);
    }

    /**
     * Length in points, or empty when the value is not a recognisable length.
     */
    public static OptionalDouble parse(Object value) {
        if (value instanceof Number) {
            return OptionalDouble.of(mm(((Number) value).doubleValue()));
        }
        if (!(value instanceof String)) {
            return OptionalDouble.empty();
        }
        String text = ((String) value).trim().toLowerCase(Locale.ROOT);
        double factor = POINTS_PER_MM;
        if (text.endsWith("mm")) {
            text = text.substring(0, text.length() - 2);
        } else if (text.endsWith("cm")) {
            text = text.substring(0, text.length() - 2);
            factor = POINTS_PER_MM * 10;
        } else if (text.endsWith("in")) {
            text = text.substring(0, text.length() - 2);
            factor = POINTS_PER_INCH;
        } else if (text.endsWith("pt")) {
            text = text.substring(0, text.length() - 2);
            factor = 1d;
        }
        try {
            return OptionalDouble.of(Double.parseDouble(text.trim()) * factor);
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }
}
