package com.example.routines.docgen.service;

import com.example.routines.docgen.model.TemplateConfig;
import com.example.routines.docgen.model.VariableDefinition;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the data context a render sees: the caller's data plus
 * {@code current_date} and the defaults of declared variables. Caller data
 * always wins.
 */
@Component
@RequiredArgsConstructor
public class VariableResolver {
    public static final String CURRENT_DATE = "current_date";
    static final String TODAY = "today";

    private final Clock clock;

    public Map<String, Object> resolve(TemplateConfig template, Map<String, Object> data) {
        Map<String, Object> resolved = data == null ? new LinkedHashMap<>() : new LinkedHashMap<>(data);
        String today = LocalDate.now(clock).toString();
        resolved.putIfAbsent(CURRENT_DATE, today);

        for (VariableDefinition variable : template.getVariables().values()) {
            if (resolved.containsKey(variable.getName()) || !variable.isHasDefault()) {
                continue;
            }
            Object value = variable.getDefaultValue();
            if ("date".equalsIgnoreCase(variable.getType()) && TODAY.equals(value)) {
                value = today;
            }
            resolved.put(variable.getName(), value);
        }
        return resolved;
    }
}
