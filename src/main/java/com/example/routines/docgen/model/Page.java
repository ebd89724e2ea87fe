package com.example.routines.docgen.model;

import com.example.routines.docgen.util.Values;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class Page {
    String name;
    List<Section> sections;

    public static Page from(Object raw) {
        Map<String, Object> map = Values.asMap(raw);
        List<Section> sections = new ArrayList<>();
        for (Object section : Values.asList(map.get("sections"))) {
            if (section instanceof Map) {
                sections.add(Section.from(section));
            }
        }
        return Page.builder()
                .name(Values.asString(map.get("name")))
                .sections(sections)
                .build();
    }
}
