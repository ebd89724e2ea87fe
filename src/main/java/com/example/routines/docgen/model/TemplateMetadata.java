package com.example.routines.docgen.model;

import com.example.routines.docgen.util.Values;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Descriptive block of a template. Nothing here affects layout except the
 * {@code dias_semana} hint used for sample data.
 */
@Value
@Builder
public class TemplateMetadata {
    String name;
    String version;
    String description;
    List<String> tags;
    Integer diasSemana;

    public static TemplateMetadata from(Object raw) {
        Map<String, Object> map = Values.asMap(raw);
        List<String> tags = new ArrayList<>();
        for (Object tag : Values.asList(map.get("tags"))) {
            tags.add(Values.asString(tag));
        }
        Object dias = map.get("dias_semana");
        return TemplateMetadata.builder()
                .name(Values.asString(map.get("name")))
                .version(Values.asString(map.get("version")))
                .description(Values.asString(map.get("description")))
                .tags(tags)
                .diasSemana(Values.isNumericLike(dias) ? Values.toInt(dias, 0) : null)
                .build();
    }
}
