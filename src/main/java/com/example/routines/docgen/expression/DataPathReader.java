package com.example.routines.docgen.expression;

import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.JsonPathException;

import java.util.List;
import java.util.Map;

/**
 * Looks dotted/subscripted names up in the data context through a
 * precompiled bracket-notation JsonPath ({@code $['routine']['dias'][0]}).
 */
final class DataPathReader {
    private static final Configuration CONFIGURATION = Configuration.defaultConfiguration();

    private final String displayPath;
    private final JsonPath path;

    DataPathReader(List<Object> segments) {
        StringBuilder json = new StringBuilder("$");
        StringBuilder display = new StringBuilder();
        for (Object segment : segments) {
            if (segment instanceof Integer) {
                json.append('[').append(segment).append(']');
                display.append('[').append(segment).append(']');
            } else {
                String key = String.valueOf(segment);
                json.append("['").append(key.replace("\\", "\\\\").replace("'", "\\'")).append("']");
                display.append(display.length() == 0 ? "" : ".").append(key);
            }
        }
        this.displayPath = display.toString();
        this.path = JsonPath.compile(json.toString());
    }

    Object read(Map<String, Object> data) throws UndefinedVariableException {
        try {
            return path.read(data, CONFIGURATION);
        } catch (JsonPathException | ClassCastException e) {
            throw new UndefinedVariableException(displayPath);
        }
    }
}
