package com.example.routines.docgen.expression;

import com.example.routines.docgen.util.Values;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Whitelisted filters. Anything not listed here fails at compile time.
 */
final class Filters {
    static final String DEFAULT = "default";

    private static final Set<String> KNOWN = new HashSet<>(
            Arrays.asList(DEFAULT, "upper", "lower", "title", "trim", "length", "string"));

    private Filters() {
    }

    static boolean isKnown(String name) {
        return KNOWN.contains(name);
    }

    static Object apply(String name, Object value) throws ExpressionException {
        switch (name) {
            case "upper":
                return Values.asString(value).toUpperCase(Locale.ROOT);
            case "lower":
                return Values.asString(value).toLowerCase(Locale.ROOT);
            case "title":
                return titleCase(Values.asString(value));
            case "trim":
                return Values.asString(value).trim();
            case "string":
                return Values.asString(value);
            case "length":
                return (long) length(value);
            default:
                throw new ExpressionException("Unknown filter " + name);
        }
    }

    private static int length(Object value) throws ExpressionException {
        if (value instanceof String) {
            return ((String) value).length();
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).size();
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).size();
        }
        throw new ExpressionException("Object of type " + (value == null ? "none" : value.getClass().getSimpleName())
                + " has no length");
    }

    private static String titleCase(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (char c : text.toCharArray()) {
            if (Character.isLetterOrDigit(c)) {
                sb.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                sb.append(c);
                startOfWord = true;
            }
        }
        return sb.toString();
    }
}
