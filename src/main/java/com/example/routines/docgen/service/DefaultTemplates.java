package com.example.routines.docgen.service;

import com.example.routines.docgen.model.TemplateConfig;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in routine templates equivalent to the spreadsheet routines, one per
 * supported number of training days.
 */
@Component
public class DefaultTemplates {
    public static final int MIN_DAYS = 2;
    public static final int MAX_DAYS = 5;

    /**
     * Template definition for a routine of {@code days} training days.
     *
     * @throws IllegalArgumentException when days is outside 2..5
     */
    public Map<String, Object> excelEquivalent(int days) {
        if (days < MIN_DAYS || days > MAX_DAYS) {
            throw new IllegalArgumentException("Default templates exist for " + MIN_DAYS + " to " + MAX_DAYS
                    + " days, not " + days);
        }
        String name = "Plantilla Excel " + days + " días";

        Map<String, Object> template = new LinkedHashMap<>();
        template.put("metadata", map(
                "name", name,
                "version", "1.0.0",
                "description", "Plantilla equivalente a Excel para rutinas de " + days + " días",
                "tags", Arrays.asList("excel", "system", days + "_dias"),
                "dias_semana", days));
        template.put("layout", map(
                "page_size", "A4",
                "orientation", "portrait",
                "margins", map("top", 20, "bottom", 20, "left", 20, "right", 20)));

        List<Object> sections = new ArrayList<>();
        sections.add(map("type", "header", "content", map(
                "title", "{{ gym_name }}",
                "subtitle", "{{ nombre_rutina }} - {{ usuario_nombre }}")));
        sections.add(map("type", "spacing", "content", map("height", 8)));
        sections.add(map("type", "exercise_table", "content", map()));
        sections.add(map("type", "spacing", "content", map("height", 12)));
        sections.add(map("type", "qr_code", "content", map("size", 90)));
        template.put("pages", Arrays.asList(map("name", "Rutina", "sections", sections)));

        template.put("variables", map(
                "gym_name", variable("Gimnasio"),
                "nombre_rutina", variable("Rutina"),
                "usuario_nombre", variable("Usuario")));
        template.put("qr_code", map("enabled", true, "position", "inline", "data_source", "routine_uuid"));
        template.put("styling", map("colors", map("primary", "#111827", "accent", "#3B82F6")));
        template.put("dias_semana", days);
        return template;
    }

    public TemplateConfig excelEquivalentConfig(int days) {
        return TemplateConfig.from(excelEquivalent(days));
    }

    /**
     * Every built-in template keyed by id ({@code excel-2-dias} ... {@code excel-5-dias}).
     */
    public Map<String, Map<String, Object>> all() {
        Map<String, Map<String, Object>> templates = new LinkedHashMap<>();
        for (int days = MIN_DAYS; days <= MAX_DAYS; days++) {
            templates.put("excel-" + days + "-dias", excelEquivalent(days));
        }
        return templates;
    }

    private static Map<String, Object> variable(String defaultValue) {
        return map("type", "string", "default", defaultValue, "required", false);
    }

    private static Map<String, Object> map(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
