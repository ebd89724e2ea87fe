package com.example.routines.docgen.renderer;

import com.example.routines.docgen.core.RenderContext;
import com.example.routines.docgen.layout.LayoutElement;
import com.example.routines.docgen.layout.TableElement;
import com.example.routines.docgen.layout.TableStyle;
import com.example.routines.docgen.model.Section;
import com.example.routines.docgen.model.SectionType;
import com.example.routines.docgen.util.Values;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Literal grid of cells, each resolved on its own. {@code header: true}
 * styles the first row as a header.
 */
@Component
public class TableSectionRenderer implements SectionRenderer {
    private static final double SPACING_AFTER_MM = 6;

    @Override
    public List<LayoutElement> render(Section section, RenderContext context) {
        List<List<String>> rows = new ArrayList<>();
        for (Object rawRow : Values.asList(section.get("rows"))) {
            List<String> row = new ArrayList<>();
            if (rawRow instanceof List) {
                for (Object cell : (List<?>) rawRow) {
                    row.add(context.resolve(cell));
                }
            } else {
                row.add(context.resolve(rawRow));
            }
            rows.add(row);
        }

        List<LayoutElement> elements = new ArrayList<>();
        if (rows.isEmpty()) {
            return elements;
        }
        TableStyle style = Values.isTruthy(section.get("header")) ? TableStyle.withHeader() : TableStyle.plain();
        elements.add(new TableElement(rows, style));
        context.spacingAfter(section, SPACING_AFTER_MM).ifPresent(elements::add);
        return elements;
    }

    @Override
    public boolean supports(SectionType type) {
        return type == SectionType.TABLE;
    }
}
