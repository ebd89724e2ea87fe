package com.example.routines.docgen.renderer;

import com.example.routines.docgen.core.RenderContext;
import com.example.routines.docgen.layout.LayoutElement;
import com.example.routines.docgen.layout.ParagraphElement;
import com.example.routines.docgen.layout.TableElement;
import com.example.routines.docgen.layout.TableStyle;
import com.example.routines.docgen.layout.TextStyle;
import com.example.routines.docgen.model.Section;
import com.example.routines.docgen.model.SectionType;
import com.example.routines.docgen.util.Values;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Boxed label/value block heading a spreadsheet-style routine.
 * {@code fields} is a list of {@code {label, value}} or a plain map.
 */
@Component
public class ExcelHeaderSectionRenderer implements SectionRenderer {
    private static final double SPACING_AFTER_MM = 6;

    @Override
    public List<LayoutElement> render(Section section, RenderContext context) {
        List<LayoutElement> elements = new ArrayList<>();
        String title = context.resolve(section.get("title")).trim();
        if (!title.isEmpty()) {
            elements.add(new ParagraphElement(title, TextStyle.SECTION_HEADER, context.getHeadingColor()));
        }

        List<List<String>> rows = new ArrayList<>();
        Object fields = section.get("fields");
        if (fields instanceof Map) {
            Values.asMap(fields).forEach((label, value) ->
                    rows.add(Arrays.asList(label, context.resolve(value))));
        } else {
            for (Object field : Values.asList(fields)) {
                Map<String, Object> entry = Values.asMap(field);
                if (!entry.isEmpty()) {
                    rows.add(Arrays.asList(context.resolve(entry.get("label")), context.resolve(entry.get("value"))));
                }
            }
        }
        if (!rows.isEmpty()) {
            elements.add(new TableElement(rows, TableStyle.builder().boldFirstColumn(true).build()));
        }
        if (!elements.isEmpty()) {
            context.spacingAfter(section, SPACING_AFTER_MM).ifPresent(elements::add);
        }
        return elements;
    }

    @Override
    public boolean supports(SectionType type) {
        return type == SectionType.EXCEL_HEADER;
    }
}
