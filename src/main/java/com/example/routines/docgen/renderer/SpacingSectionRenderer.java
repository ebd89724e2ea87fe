package com.example.routines.docgen.renderer;

import com.example.routines.docgen.core.RenderContext;
import com.example.routines.docgen.layout.LayoutElement;
import com.example.routines.docgen.layout.SpacerElement;
import com.example.routines.docgen.model.Section;
import com.example.routines.docgen.model.SectionType;
import com.example.routines.docgen.util.UnitConverter;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

@Component
public class SpacingSectionRenderer implements SectionRenderer {
    private static final double DEFAULT_HEIGHT_MM = 8;

    @Override
    public List<LayoutElement> render(Section section, RenderContext context) {
        float height = (float) UnitConverter.toPoints(section.get("height"), DEFAULT_HEIGHT_MM);
        if (height <= 0) {
            return Collections.emptyList();
        }
        return Collections.singletonList(new SpacerElement(height));
    }

    @Override
    public boolean supports(SectionType type) {
        return type == SectionType.SPACING;
    }
}
