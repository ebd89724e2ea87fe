package com.example.routines.docgen.renderer;

import com.example.routines.docgen.core.RenderContext;
import com.example.routines.docgen.layout.LayoutElement;
import com.example.routines.docgen.layout.ParagraphElement;
import com.example.routines.docgen.layout.TextStyle;
import com.example.routines.docgen.model.Section;
import com.example.routines.docgen.model.SectionType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Free text. Content is either the text itself or {@code {text, style}}.
 */
@Component
public class TextSectionRenderer implements SectionRenderer {
    private static final double SPACING_AFTER_MM = 4;

    @Override
    public List<LayoutElement> render(Section section, RenderContext context) {
        Object content = section.getContent();
        Object rawText;
        Object styleName;
        if (content instanceof Map) {
            rawText = section.get("text");
            styleName = section.get("style");
        } else {
            rawText = content != null ? content : section.getAttributes().get("text");
            styleName = section.getAttributes().get("style");
        }

        String text = context.resolve(rawText);
        List<LayoutElement> elements = new ArrayList<>();
        if (text.trim().isEmpty()) {
            return elements;
        }
        TextStyle style = TextStyle.fromName(styleName);
        boolean heading = style == TextStyle.HEADER || style == TextStyle.SECTION_HEADER;
        elements.add(new ParagraphElement(text, style, heading ? context.getHeadingColor() : null));
        context.spacingAfter(section, SPACING_AFTER_MM).ifPresent(elements::add);
        return elements;
    }

    @Override
    public boolean supports(SectionType type) {
        return type == SectionType.TEXT;
    }
}
