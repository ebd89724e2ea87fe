package com.example.routines.docgen.model;

import com.example.routines.docgen.util.Values;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Declared template variable. {@code hasDefault} distinguishes an explicit
 * {@code default: null} from an absent default.
 */
@Value
@Builder
public class VariableDefinition {
    String name;
    String type;
    Object defaultValue;
    boolean hasDefault;
    boolean required;

    public static VariableDefinition from(String name, Object raw) {
        Map<String, Object> map = Values.asMap(raw);
        Object type = map.get("type");
        return VariableDefinition.builder()
                .name(name)
                .type(type == null ? "string" : Values.asString(type))
                .defaultValue(map.get("default"))
                .hasDefault(map.containsKey("default"))
                .required(Values.isTruthy(map.get("required")))
                .build();
    }
}
