package com.example.routines.docgen.model;

import com.example.routines.docgen.util.Values;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed view over a declarative template definition.
 *
 * The original map is retained as {@code source}; it is what gets hashed for
 * cache keys and document ids, and what the validator inspects.
 */
@Value
@Builder
public class TemplateConfig {
    Map<String, Object> source;
    TemplateMetadata metadata;
    PageLayout layout;
    List<Page> pages;
    Map<String, VariableDefinition> variables;
    QrCodeConfig qrCode;
    Map<String, Object> styling;

    public static TemplateConfig from(Map<String, Object> raw) {
        Map<String, Object> source = raw == null ? Collections.emptyMap() : raw;

        List<Page> pages = new ArrayList<>();
        for (Object page : Values.asList(source.get("pages"))) {
            if (page instanceof Map) {
                pages.add(Page.from(page));
            }
        }

        Map<String, VariableDefinition> variables = new LinkedHashMap<>();
        Values.asMap(source.get("variables"))
                .forEach((name, def) -> variables.put(name, VariableDefinition.from(name, def)));

        return TemplateConfig.builder()
                .source(source)
                .metadata(TemplateMetadata.from(source.get("metadata")))
                .layout(PageLayout.from(source.get("layout")))
                .pages(pages)
                .variables(variables)
                .qrCode(QrCodeConfig.from(source.get("qr_code")))
                .styling(new LinkedHashMap<>(Values.asMap(source.get("styling"))))
                .build();
    }

    /**
     * Day count hint, looked up at the top level first and then in metadata.
     */
    public Integer getDiasSemana() {
        Object top = source.get("dias_semana");
        if (Values.isNumericLike(top)) {
            return Values.toInt(top, 0);
        }
        return metadata.getDiasSemana();
    }

    /**
     * {@code styling.colors.primary}, or null when the template sets none.
     */
    public String getPrimaryColor() {
        Object primary = Values.asMap(styling.get("colors")).get("primary");
        return Values.isBlank(primary) ? null : Values.asString(primary).trim();
    }
}
