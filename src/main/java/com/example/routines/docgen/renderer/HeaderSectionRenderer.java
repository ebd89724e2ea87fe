package com.example.routines.docgen.renderer;

import com.example.routines.docgen.core.RenderContext;
import com.example.routines.docgen.layout.LayoutElement;
import com.example.routines.docgen.layout.ParagraphElement;
import com.example.routines.docgen.layout.SpacerElement;
import com.example.routines.docgen.layout.TextStyle;
import com.example.routines.docgen.model.Section;
import com.example.routines.docgen.model.SectionType;
import com.example.routines.docgen.util.UnitConverter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Title and optional subtitle, separated by a small gap.
 */
@Component
public class HeaderSectionRenderer implements SectionRenderer {
    private static final double SUBTITLE_GAP_MM = 2;
    private static final double SPACING_AFTER_MM = 6;

    @Override
    public List<LayoutElement> render(Section section, RenderContext context) {
        String title = context.resolve(section.get("title")).trim();
        String subtitle = context.resolve(section.get("subtitle")).trim();

        List<LayoutElement> elements = new ArrayList<>();
        if (!title.isEmpty()) {
            elements.add(new ParagraphElement(title, TextStyle.HEADER, context.getHeadingColor()));
        }
        if (!subtitle.isEmpty()) {
            if (!elements.isEmpty()) {
                elements.add(new SpacerElement((float) UnitConverter.mm(SUBTITLE_GAP_MM)));
            }
            elements.add(new ParagraphElement(subtitle, TextStyle.SMALL));
        }
        if (!elements.isEmpty()) {
            context.spacingAfter(section, SPACING_AFTER_MM).ifPresent(elements::add);
        }
        return elements;
    }

    @Override
    public boolean supports(SectionType type) {
        return type == SectionType.HEADER;
    }
}
